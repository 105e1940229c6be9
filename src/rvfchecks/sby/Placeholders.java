package rvfchecks.sby;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bindings for {@code @name@} placeholders of one check.
 */
public class Placeholders {
  private static final Pattern placeholder = Pattern.compile("@([a-zA-Z0-9_]+)@");
  /** Hook lines starting with ':' keep the text after it (and one optional space) verbatim. */
  private static final Pattern verbatimLine = Pattern.compile("^\\s*: ?(.*)");

  private final Map<String, String> bindings = new LinkedHashMap<>();
  private final String context;

  /**
   * @param context name of the check, used in error messages
   */
  public Placeholders(String context) { this.context = context; }

  public Placeholders bind(String name, Object value) {
    bindings.put(name, String.valueOf(value));
    return this;
  }

  /**
   * Replaces all placeholders of a line.
   * @throws TemplateException if a placeholder is unbound
   */
  public String substitute(String line) {
    Matcher matcher = placeholder.matcher(line);
    StringBuilder ret = new StringBuilder();
    while (matcher.find()) {
      String value = bindings.get(matcher.group(1));
      if (value == null)
        throw new TemplateException("Placeholder @" + matcher.group(1) + "@ is not defined for " + context + " (line '" + line + "')");
      matcher.appendReplacement(ret, Matcher.quoteReplacement(value));
    }
    matcher.appendTail(ret);
    return ret.toString();
  }

  /**
   * Formats lines of a user hook section. Blank lines are dropped unless written as ':'.
   */
  public List<String> hookLines(List<String> lines) {
    List<String> ret = new ArrayList<>();
    for (String line : lines) {
      Matcher verbatim = verbatimLine.matcher(line);
      if (verbatim.matches())
        line = verbatim.group(1);
      else if (line.isBlank())
        continue;
      ret.add(substitute(line));
    }
    return ret;
  }
}
