package rvfchecks.config;

import java.util.List;

/**
 * One entry of a configuration section.
 * Plain sections hold {@link TextLine}s; the assume sections hold {@link TaggedLine}s carrying the pattern tags of their header.
 */
public interface SectionEntry {
  /** The trimmed line as read from the configuration file. */
  String text();

  public record TextLine(String text) implements SectionEntry {}

  /**
   * Line from an {@code [assume <tags...>]} section.
   * @param tags check name patterns from the section header, possibly prefixed with '!'
   */
  public record TaggedLine(List<String> tags, String text) implements SectionEntry {
    public TaggedLine {
      tags = List.copyOf(tags);
    }
  }
}
