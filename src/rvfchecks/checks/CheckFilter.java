package rvfchecks.checks;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rvfchecks.config.ConfigException;
import rvfchecks.config.ConfigStore;
import rvfchecks.config.Section;

/**
 * Enables or disables checks by the [filter-checks] rules {@code <+|-> <regex>}.
 * The first rule whose pattern matches at the start of the check name decides; checks are enabled by default.
 */
public class CheckFilter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private record FilterRule(boolean enable, Pattern pattern) {}

  private final List<FilterRule> rules = new ArrayList<>();

  public CheckFilter(ConfigStore config) throws ConfigException {
    for (String line : config.lines(Section.FilterChecks)) {
      if (line.isEmpty())
        continue;
      String[] words = line.split("\\s+");
      if (words.length != 2 || !(words[0].equals("+") || words[0].equals("-")))
        throw new ConfigException("Filter rule must read '<+|-> <pattern>', got '" + line + "'");
      rules.add(new FilterRule(words[0].equals("+"), DepthResolver.compile(words[1], line)));
    }
  }

  public boolean isEnabled(String checkName) {
    for (FilterRule rule : rules) {
      if (rule.pattern.matcher(checkName).lookingAt()) {
        if (!rule.enable)
          logger.debug("{} disabled by filter {}", checkName, rule.pattern);
        return rule.enable;
      }
    }
    return true;
  }
}
