package rvfchecks.sby;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import rvfchecks.config.ConfigException;
import rvfchecks.config.ConfigStore;
import rvfchecks.config.SectionEntry.TaggedLine;

/**
 * Lines of the {@code [assume <tags>]} sections, selected per check.
 *
 * A tag is a pattern matched against the start of the check name, a leading '!' negates it.
 * Tags are scanned in order and the first matching tag decides: a matching plain tag drops the line, a matching negated tag keeps it.
 * If no tag matches, the line is kept unless the last tag was negated. Untagged lines are always kept.
 */
public class AssumeStatements {
  private record Tag(boolean negated, Pattern pattern) {}
  private record Statement(List<Tag> tags, String text) {}

  private final List<Statement> statements = new ArrayList<>();
  private final boolean present;

  public AssumeStatements(ConfigStore config) throws ConfigException {
    for (TaggedLine line : config.assumptions()) {
      List<Tag> tags = new ArrayList<>();
      for (String tag : line.tags()) {
        boolean negated = tag.startsWith("!");
        String regex = negated ? tag.substring(1) : tag;
        try {
          tags.add(new Tag(negated, Pattern.compile(regex)));
        } catch (PatternSyntaxException e) {
          throw new ConfigException("Invalid assume pattern '" + tag + "': " + e.getDescription(), e);
        }
      }
      statements.add(new Statement(tags, line.text()));
    }
    this.present = !statements.isEmpty();
  }

  /** Whether any assume section exists. */
  public boolean isPresent() { return present; }

  public List<String> linesFor(String checkName) {
    List<String> ret = new ArrayList<>();
    for (Statement statement : statements) {
      boolean enabled = true;
      for (Tag tag : statement.tags) {
        enabled = !tag.negated;
        if (tag.pattern.matcher(checkName).lookingAt()) {
          enabled = !enabled;
          break;
        }
      }
      if (enabled)
        ret.add(statement.text);
    }
    return ret;
  }
}
