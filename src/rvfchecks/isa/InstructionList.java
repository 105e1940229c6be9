package rvfchecks.isa;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import rvfchecks.config.ConfigException;

/**
 * Instruction names of an isa, read from {@code <basedir>/insns/isa_<isa>.txt}.
 */
public class InstructionList {
  public static Path pathFor(Path basedir, String isa) { return basedir.resolve("insns").resolve("isa_" + isa + ".txt"); }

  public static List<String> read(Path basedir, String isa) throws ConfigException {
    Path isaFile = pathFor(basedir, isa);
    if (!Files.isRegularFile(isaFile))
      throw new ConfigException("No instruction list for isa " + isa + " at " + isaFile);
    try {
      return Files.readAllLines(isaFile, StandardCharsets.UTF_8)
          .stream()
          .map(String::strip)
          .filter(insn -> !insn.isEmpty())
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new ConfigException("Cannot read instruction list " + isaFile, e);
    }
  }
}
