package rvfchecks.config;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Section names understood by the generator.
 */
public enum Section {
  Options("options"),
  Groups("groups"),
  Depth("depth"),
  FilterChecks("filter-checks"),
  Csrs("csrs"),
  CustomCsrs("custom_csrs"),
  IllegalCsrs("illegal_csrs"),
  Cover("cover"),
  /** All {@code [assume ...]} headers are filed under this section. */
  Assume("assume"),
  Sort("sort"),
  /** May also appear per checker as {@code [script-defines <checker>]}. */
  ScriptDefines("script-defines"),
  ScriptSources("script-sources"),
  ScriptLink("script-link"),
  VerilogFiles("verilog-files"),
  VhdlFiles("vhdl-files"),
  /** May also appear per checker as {@code [defines <checker>]}. */
  Defines("defines");

  public final String serialName;

  private Section(String serialName) { this.serialName = serialName; }

  /** Name of the per-checker variant of this section, e.g. {@code "defines liveness"}. */
  public String forChecker(String checker) { return serialName + " " + checker; }

  /**
   * Resolves a section header. Per-checker variants resolve to their base section.
   */
  public static Optional<Section> fromHeader(String header) {
    String base = header.split("\\s+", 2)[0];
    return Stream.of(values()).filter(section -> section.serialName.equals(base)).findAny();
  }

  @Override
  public String toString() {
    return serialName;
  }
}
