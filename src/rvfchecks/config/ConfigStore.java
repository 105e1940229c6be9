package rvfchecks.config;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rvfchecks.config.SectionEntry.TaggedLine;
import rvfchecks.config.SectionEntry.TextLine;

/**
 * Section map of a check configuration file ({@code <core>/<cfgname>.cfg}).
 *
 * Lines starting with '#' are comments. A line {@code [name]} opens a section, reopening a section appends to it.
 * Headers starting with {@code assume} file their lines under {@link Section#Assume}, tagged with the remaining header words.
 * Lines before the first header are ignored. Entry order is kept, since rule scanning depends on it.
 */
public class ConfigStore {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** key: section name as written in the header (after assume canonicalization) */
  private final LinkedHashMap<String, List<SectionEntry>> sections = new LinkedHashMap<>();

  private ConfigStore() {}

  public static ConfigStore read(Path cfgFile) throws IOException {
    logger.info("Reading {}.", cfgFile);
    try (BufferedReader in = Files.newBufferedReader(cfgFile, StandardCharsets.UTF_8)) {
      return parse(in);
    }
  }

  public static ConfigStore parse(String text) {
    try {
      return parse(new StringReader(text));
    } catch (IOException e) {
      throw new IllegalStateException("StringReader failed", e);
    }
  }

  public static ConfigStore parse(Reader reader) throws IOException {
    ConfigStore store = new ConfigStore();
    BufferedReader in = (reader instanceof BufferedReader) ? (BufferedReader)reader : new BufferedReader(reader);
    String currentSection = null;
    List<String> currentTags = null;
    String line;
    while ((line = in.readLine()) != null) {
      line = line.strip();
      if (line.startsWith("#"))
        continue;

      if (line.startsWith("[") && line.endsWith("]")) {
        currentSection = stripBrackets(line);
        currentTags = null;
        if (currentSection.startsWith("assume ") || currentSection.equals(Section.Assume.serialName)) {
          List<String> words = Arrays.asList(currentSection.split("\\s+"));
          currentTags = words.subList(1, words.size());
          currentSection = Section.Assume.serialName;
        } else if (Section.fromHeader(currentSection).isEmpty()) {
          logger.debug("Section [{}] is not used by the generator", currentSection);
        }
        continue;
      }

      if (currentSection == null) {
        logger.trace("Ignoring line outside of any section: '{}'", line);
        continue;
      }
      List<SectionEntry> entries = store.sections.computeIfAbsent(currentSection, name_ -> new ArrayList<>());
      entries.add(currentTags == null ? new TextLine(line) : new TaggedLine(currentTags, line));
    }
    return store;
  }

  private static String stripBrackets(String header) {
    int begin = 0;
    int end = header.length();
    while (begin < end && header.charAt(begin) == '[')
      ++begin;
    while (end > begin && header.charAt(end - 1) == ']')
      --end;
    return header.substring(begin, end);
  }

  public boolean has(String section) { return sections.containsKey(section); }
  public boolean has(Section section) { return has(section.serialName); }

  /** Entries of a section in file order, or an empty list. */
  public List<SectionEntry> get(String section) {
    return Collections.unmodifiableList(sections.getOrDefault(section, Collections.emptyList()));
  }
  public List<SectionEntry> get(Section section) { return get(section.serialName); }

  /** Texts of all entries of a section in file order (blank lines included). */
  public List<String> lines(String section) { return get(section).stream().map(SectionEntry::text).collect(Collectors.toList()); }
  public List<String> lines(Section section) { return lines(section.serialName); }

  /** Tagged entries of the assume section. */
  public List<TaggedLine> assumptions() {
    return get(Section.Assume)
        .stream()
        .filter(entry -> entry instanceof TaggedLine)
        .map(entry -> (TaggedLine)entry)
        .collect(Collectors.toList());
  }

  /** Section lines joined with newlines, empty if the section is missing. */
  public Optional<String> joined(Section section) {
    if (!has(section))
      return Optional.empty();
    return Optional.of(String.join("\n", lines(section)));
  }
}
