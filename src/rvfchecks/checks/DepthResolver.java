package rvfchecks.checks;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rvfchecks.config.ConfigException;
import rvfchecks.config.ConfigStore;
import rvfchecks.config.Section;

/**
 * Cycle parameters from the [depth] section. Each rule reads {@code <regex> <int>...}.
 * All rules are scanned in file order and the last rule fully matching any candidate name wins.
 * A check without a matching rule is not generated.
 */
public class DepthResolver {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private record DepthRule(Pattern pattern, List<Integer> values) {}

  private final List<DepthRule> rules = new ArrayList<>();

  public DepthResolver(ConfigStore config) throws ConfigException {
    for (String line : config.lines(Section.Depth)) {
      if (line.isEmpty())
        continue;
      String[] words = line.split("\\s+");
      List<Integer> values = new ArrayList<>();
      for (int i = 1; i < words.length; ++i) {
        try {
          values.add(Integer.parseInt(words[i]));
        } catch (NumberFormatException e) {
          throw new ConfigException("Depth rule '" + line + "' has a non-numeric value", e);
        }
      }
      rules.add(new DepthRule(compile(words[0], line), List.copyOf(values)));
    }
  }

  static Pattern compile(String regex, String line) throws ConfigException {
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw new ConfigException("Invalid pattern in line '" + line + "': " + e.getDescription(), e);
    }
  }

  /**
   * @param candidates name variants of one check, from least to most specific
   * @return the depth vector, or Optional.empty() if the check does not exist
   */
  public Optional<List<Integer>> resolve(List<String> candidates) {
    Optional<List<Integer>> ret = Optional.empty();
    for (DepthRule rule : rules) {
      for (String candidate : candidates) {
        if (rule.pattern.matcher(candidate).matches())
          ret = Optional.of(rule.values);
      }
    }
    if (ret.isEmpty())
      logger.trace("No depth rule for any of {}", candidates);
    return ret;
  }
}
