package rvfchecks.sby;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;
import rvfchecks.isa.CustomCsr;

/**
 * Verilog macros that route the rvfi signals of custom CSRs through the testbench.
 */
public class CustomCsrMacros {
  private static final String[] signals = {"rmask", "wmask", "rdata", "wdata"};
  private static final String levels = "msu";

  private enum Macro {
    Inputs("INPUTS", "  ,input [`RISCV_FORMAL_NRET * `RISCV_FORMAL_XLEN - 1 : 0] rvfi_csr_%1$s_%2$s \\"),
    Wires("WIRES", "  (* keep *) wire [`RISCV_FORMAL_NRET * `RISCV_FORMAL_XLEN - 1 : 0] rvfi_csr_%1$s_%2$s; \\"),
    Conn("CONN", "  ,.rvfi_csr_%1$s_%2$s (rvfi_csr_%1$s_%2$s) \\"),
    Channel("CHANNEL(_idx)",
            "  wire [`RISCV_FORMAL_XLEN - 1 : 0] csr_%1$s_%2$s = rvfi_csr_%1$s_%2$s [(_idx)*(`RISCV_FORMAL_XLEN) +: `RISCV_FORMAL_XLEN]; \\"),
    Signals("SIGNALS", "`RISCV_FORMAL_CHANNEL_SIGNAL(`RISCV_FORMAL_NRET, `RISCV_FORMAL_XLEN, csr_%1$s_%2$s) \\"),
    Outputs("OUTPUTS", "  ,output [`RISCV_FORMAL_NRET * `RISCV_FORMAL_XLEN - 1 : 0] rvfi_csr_%1$s_%2$s \\"),
    Indices("INDICES", "  localparam [11:0] csr_%1$sindex_%2$s = 12'h%3$03X; \\");

    final String header;
    final String format;

    private Macro(String suffix, String format) {
      this.header = "`define RISCV_FORMAL_CUSTOM_CSR_" + suffix + " \\";
      this.format = format;
    }
  }

  /**
   * All macro blocks, each followed by an empty line. CSRs are emitted in name order.
   */
  public static List<String> lines(Collection<CustomCsr> customCsrs) {
    List<CustomCsr> sorted = customCsrs.stream().sorted(CustomCsr.byName).collect(Collectors.toList());
    List<String> ret = new ArrayList<>();
    for (Macro macro : Macro.values()) {
      ret.add(macro.header);
      for (CustomCsr csr : sorted) {
        if (macro == Macro.Indices) {
          for (char level : levels.toCharArray())
            ret.add(String.format(macro.format, level, csr.name(), csr.addressAt(level)));
        } else {
          for (String signal : signals)
            ret.add(String.format(macro.format, csr.name(), signal));
        }
      }
      ret.add("");
    }
    return ret;
  }
}
