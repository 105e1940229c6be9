package rvfchecks.util;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rvfchecks.config.ConfigException;
import rvfchecks.config.ConfigStore;
import rvfchecks.config.Section;
import rvfchecks.solver.SolverConfig;

/*
 * Class for writing the generated descriptors and the makefile that runs them.
 */
public class ArtifactWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String DescriptorSuffix = ".sby";
  public static final String MakefileName = "makefile";

  private final Path outDir;
  private final SolverConfig solverCfg;
  /** One pattern per [sort] line, blank lines included so that positions match the file. */
  private final List<Pattern> sortPatterns = new ArrayList<>();

  public ArtifactWriter(Path outDir, ConfigStore config, SolverConfig solverCfg) throws ConfigException {
    this.outDir = outDir;
    this.solverCfg = solverCfg;
    for (String line : config.lines(Section.Sort)) {
      try {
        sortPatterns.add(Pattern.compile(line));
      } catch (PatternSyntaxException e) {
        throw new ConfigException("Invalid sort pattern '" + line + "': " + e.getDescription(), e);
      }
    }
  }

  /**
   * Deletes a directory with all its contents and creates it again, empty.
   */
  public static void recreateDir(Path dir) throws IOException {
    logger.info("Creating {} directory.", dir);
    if (Files.exists(dir)) {
      List<Path> contents;
      try (Stream<Path> walk = Files.walk(dir)) {
        contents = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
      }
      for (Path path : contents)
        Files.delete(path);
    }
    Files.createDirectories(dir);
  }

  public void writeDescriptor(String checkName, String text) throws IOException {
    Path file = outDir.resolve(checkName + DescriptorSuffix);
    logger.trace("Writing {}", file);
    try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      out.write(text);
    }
  }

  /**
   * Checks matching a [sort] pattern come first, in pattern order. Instruction checks come last.
   */
  public String sortKey(String checkName) {
    for (int i = 0; i < sortPatterns.size(); ++i) {
      if (sortPatterns.get(i).matcher(checkName).matches())
        return String.format("%04d-%s", i, checkName);
    }
    return (checkName.startsWith("insn_") ? "9999-" : "9998-") + checkName;
  }

  public List<String> buildOrder(Collection<String> checkNames) {
    return checkNames.stream().sorted(Comparator.comparing(this::sortKey)).collect(Collectors.toList());
  }

  public String makefileText(Collection<String> checkNames) {
    List<String> ordered = buildOrder(checkNames);
    StringBuilder ret = new StringBuilder("all:");
    for (String check : ordered)
      ret.append(' ').append(check);
    ret.append('\n');
    for (String check : ordered) {
      String descriptor = (solverCfg.abspath ? "$(shell pwd)/" : "") + check + DescriptorSuffix;
      ret.append(check).append(": ").append(check).append("/status\n");
      ret.append(check).append("/status:\n");
      ret.append('\t').append(solverCfg.sbycmd).append(' ').append(descriptor).append('\n');
      ret.append(".PHONY: ").append(check).append('\n');
    }
    return ret.toString();
  }

  public void writeMakefile(Collection<String> checkNames) throws IOException {
    Path file = outDir.resolve(MakefileName);
    logger.debug("Writing {} with {} targets", file, checkNames.size());
    try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      out.write(makefileText(checkNames));
    }
  }
}
