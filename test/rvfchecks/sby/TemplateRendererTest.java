package rvfchecks.sby;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import rvfchecks.checks.Check;
import rvfchecks.checks.CheckEnumerator;
import rvfchecks.checks.CheckSet;
import rvfchecks.config.ConfigException;
import rvfchecks.config.ConfigStore;
import rvfchecks.isa.ISAConfig;
import rvfchecks.isa.ISAModel;
import rvfchecks.solver.SolverConfig;

class TemplateRendererTest {

  private TemplateRenderer renderer;
  private CheckSet checks;

  private void generate(String text, List<String> insns) throws ConfigException {
    ConfigStore config = ConfigStore.parse(text);
    ISAConfig isaCfg = new ISAConfig();
    SolverConfig solverCfg = new SolverConfig();
    ISAModel.extractOptions(config, isaCfg, solverCfg);
    ISAModel.addAllCsrs(config, isaCfg);
    CheckEnumerator enumerator = new CheckEnumerator(config, isaCfg, solverCfg);
    checks = enumerator.enumerateInstructionChecks(insns);
    checks.addAll(enumerator.enumerateConsistencyChecks());
    renderer = new TemplateRenderer(config, isaCfg, solverCfg, "/rvf", "mycore");
  }

  private String render(String checkName) {
    Check check = checks.get(checkName).orElseThrow(() -> new AssertionError("no check " + checkName));
    return renderer.render(check);
  }

  @Test
  void testInstructionDescriptor() throws ConfigException {
    generate("[options]\nisa rv32ic\nnret 1\n"
                 + "[depth]\ninsn 10\n"
                 + "[script-sources]\nread -sv @core@.sv\n"
                 + "[verilog-files]\n@basedir@/cores/@core@/wrapper.sv\n"
                 + "[defines]\n`define EXTRA @nret@\n",
             List.of("add"));
    String expected = "[options]\n"
                      + "mode bmc\n"
                      + "expect pass,fail\n"
                      + "append 0\n"
                      + "depth 11\n"
                      + "skip 10\n"
                      + "\n"
                      + "[engines]\n"
                      + "smtbmc boolector\n"
                      + "\n"
                      + "[script]\n"
                      + "read -sv insn_add_ch0.sv /rvf/cores/mycore/wrapper.sv\n"
                      + "read -sv mycore.sv\n"
                      + "prep -flatten -nordff -top rvfi_testbench\n"
                      + "chformal -early\n"
                      + "\n"
                      + "[files]\n"
                      + "/rvf/checks/rvfi_macros.vh\n"
                      + "/rvf/checks/rvfi_channel.sv\n"
                      + "/rvf/checks/rvfi_testbench.sv\n"
                      + "/rvf/checks/rvfi_insn_check.sv\n"
                      + "/rvf/insns/insn_add.v\n"
                      + "\n"
                      + "[file defines.sv]\n"
                      + "`define RISCV_FORMAL\n"
                      + "`define RISCV_FORMAL_NRET 1\n"
                      + "`define RISCV_FORMAL_XLEN 32\n"
                      + "`define RISCV_FORMAL_ILEN 32\n"
                      + "`define RISCV_FORMAL_RESET_CYCLES 1\n"
                      + "`define RISCV_FORMAL_CHECK_CYCLE 10\n"
                      + "`define RISCV_FORMAL_CHANNEL_IDX 0\n"
                      + "`define RISCV_FORMAL_CHECKER rvfi_insn_check\n"
                      + "`define RISCV_FORMAL_INSN_MODEL rvfi_insn_add\n"
                      + "`define RISCV_FORMAL_COMPRESSED\n"
                      + "`define EXTRA 1\n"
                      + "`include \"rvfi_macros.vh\"\n"
                      + "\n"
                      + "[file insn_add_ch0.sv]\n"
                      + "`include \"defines.sv\"\n"
                      + "`include \"rvfi_channel.sv\"\n"
                      + "`include \"rvfi_testbench.sv\"\n"
                      + "`include \"rvfi_insn_check.sv\"\n"
                      + "`include \"insn_add.v\"\n";
    Assertions.assertEquals(expected, render("insn_add_ch0"));
  }

  @Test
  void testConsistencyDescriptor() throws ConfigException {
    generate("[options]\nnret 2\nmode prove\nblackbox\n"
                 + "[csrs]\nmie\n"
                 + "[depth]\nreg_ch1 2 8\n"
                 + "[assume]\nassume_all\n"
                 + "[assume reg_ch0]\nnot_for_reg_ch0\n"
                 + "[defines reg]\n`define REG_ONLY @channel@\n",
             List.of());
    String expected = "[options]\n"
                      + "mode prove\n"
                      + "expect pass,fail\n"
                      + "append 0\n"
                      + "depth 9\n"
                      + "skip 8\n"
                      + "\n"
                      + "[engines]\n"
                      + "smtbmc boolector\n"
                      + "\n"
                      + "[script]\n"
                      + "read -sv reg_ch1.sv\n"
                      + "prep -flatten -nordff -top rvfi_testbench\n"
                      + "chformal -early\n"
                      + "\n"
                      + "[files]\n"
                      + "/rvf/checks/rvfi_macros.vh\n"
                      + "/rvf/checks/rvfi_channel.sv\n"
                      + "/rvf/checks/rvfi_testbench.sv\n"
                      + "/rvf/checks/rvfi_reg_check.sv\n"
                      + "\n"
                      + "[file defines.sv]\n"
                      + "`define RISCV_FORMAL\n"
                      + "`define RISCV_FORMAL_NRET 2\n"
                      + "`define RISCV_FORMAL_XLEN 32\n"
                      + "`define RISCV_FORMAL_ILEN 32\n"
                      + "`define RISCV_FORMAL_CHECKER rvfi_reg_check\n"
                      + "`define RISCV_FORMAL_RESET_CYCLES 2\n"
                      + "`define RISCV_FORMAL_CHECK_CYCLE 8\n"
                      + "`define RISCV_FORMAL_ASSUME\n"
                      + "`define RISCV_FORMAL_UNBOUNDED\n"
                      + "`define RISCV_FORMAL_CSR_MIE\n"
                      + "`define RISCV_FORMAL_BLACKBOX_ALU\n"
                      + "`define RISCV_FORMAL_CHANNEL_IDX 1\n"
                      + "`define REG_ONLY 1\n"
                      + "`include \"rvfi_macros.vh\"\n"
                      + "\n"
                      + "[file reg_ch1.sv]\n"
                      + "`include \"defines.sv\"\n"
                      + "`include \"rvfi_channel.sv\"\n"
                      + "`include \"rvfi_testbench.sv\"\n"
                      + "`include \"rvfi_reg_check.sv\"\n"
                      + "\n"
                      + "[file assume_stmts.vh]\n"
                      + "assume_all\n"
                      + "not_for_reg_ch0\n";
    Assertions.assertEquals(expected, render("reg_ch1"));
  }

  @Test
  void testLivenessAndBusDefines() throws ConfigException {
    generate("[options]\nblackbox\nnbus 2\nbuslen 64\n[depth]\nliveness 0 3 9\nbus_dmem 1 4\n", List.of());
    String liveness = render("liveness_ch0");
    Assertions.assertTrue(liveness.contains("`define RISCV_FORMAL_BLACKBOX_REGS\n`define RISCV_FORMAL_CHANNEL_IDX 0\n"
                                            + "`define RISCV_FORMAL_TRIG_CYCLE 3\n`define RISCV_FORMAL_FAIRNESS\n"));
    Assertions.assertFalse(liveness.contains("BLACKBOX_ALU"));
    String bus = render("bus_dmem_ch0");
    Assertions.assertTrue(bus.contains("`define RISCV_FORMAL_BUS\n`define RISCV_FORMAL_NBUS 2\n`define RISCV_FORMAL_BUSLEN 64\n"));
    Assertions.assertTrue(bus.contains("/rvf/checks/rvfi_bus_dmem_check.sv\n"));
  }

  @Test
  void testCoverDescriptor() throws ConfigException {
    generate("[depth]\ncover 1 20\n[cover]\ncover(a);\ncover(b);\n", List.of());
    String cover = render("cover");
    Assertions.assertTrue(cover.startsWith("[options]\nmode cover\n"));
    Assertions.assertTrue(cover.endsWith("`include \"rvfi_cover_check.sv\"\n\n[file cover_stmts.vh]\ncover(a);\ncover(b);\n"));
    Assertions.assertFalse(cover.contains("CHANNEL_IDX"));
  }

  @Test
  void testCoverWithoutStatements() throws ConfigException {
    generate("[depth]\ncover 1 20\n", List.of());
    Assertions.assertThrows(TemplateException.class, () -> render("cover"));
  }

  @Test
  void testUnboundChannelInHook() throws ConfigException {
    generate("[depth]\nhang 1 5\nreg 1 5\n[defines]\n`define IDX @channel@\n", List.of());
    Assertions.assertTrue(render("reg_ch0").contains("`define IDX 0\n"));
    Assertions.assertThrows(TemplateException.class, () -> render("hang"));
  }

  @Test
  void testCsrConsistencyDefines() throws ConfigException {
    generate("[csrs]\nmstatus const=\"32'h 0\"_mask=\"32'h ff\"\nmhpmevent3 hpm=7\n[depth]\ncsrc_const 0 3\ncsrc_hpm 0 3\n", List.of());
    String constCheck = render("csrc_const_mstatus_ch0");
    Assertions.assertTrue(constCheck.contains("`define RISCV_FORMAL_CHECKER rvfi_csrc_const_check\n"));
    Assertions.assertTrue(constCheck.contains("`define RISCV_FORMAL_CSRC_CONSTVAL 32'h 0\n`define RISCV_FORMAL_CSRC_MASK 32'h ff\n"
                                              + "`define RISCV_FORMAL_CSRC_NAME mstatus\n"));
    String hpmCheck = render("csrc_hpm_mhpmevent3_ch0");
    Assertions.assertTrue(hpmCheck.startsWith("[options]\nmode cover\n"));
    Assertions.assertTrue(hpmCheck.contains("`define RISCV_FORMAL_CSR_MHPMCOUNTER3\n`define RISCV_FORMAL_CSR_MHPMEVENT3\n"));
    Assertions.assertTrue(hpmCheck.contains("`define RISCV_FORMAL_CSRC_HPMEVENT 7\n`define RISCV_FORMAL_CSRC_HPMCOUNTER mhpmcounter3\n"
                                            + "`define RISCV_FORMAL_CSRC_NAME mhpmevent3\n"));
  }

  @Test
  void testCsrInstructionDescriptors() throws ConfigException {
    generate("[csrs]\nmcycle\n[illegal_csrs]\n7c2 su r\n[custom_csrs]\n7c0 mu mycsr\n[depth]\ncsrw 3\ncsr_ill 3\n", List.of());
    String csrw = render("csrw_mcycle_ch0");
    Assertions.assertTrue(csrw.contains("`define RISCV_FORMAL_CSRWH\n`define RISCV_FORMAL_CHECKER rvfi_csrw_check\n"
                                        + "`define RISCV_FORMAL_CSRW_NAME mcycle\n`define RISCV_FORMAL_CUSTOM_CSR_INPUTS \\\n"));
    Assertions.assertFalse(render("csrw_mycsr_ch0").contains("CSRWH"));
    String ill = render("csr_ill_7c2_ch0");
    Assertions.assertTrue(ill.contains("`define RISCV_FORMAL_ILL_CSR_ADDR 12'h7C2\n`define RISCV_FORMAL_ILL_SMODE\n"
                                       + "`define RISCV_FORMAL_ILL_UMODE\n`define RISCV_FORMAL_ILL_READ\n"));
    Assertions.assertFalse(ill.contains("ILL_WRITE"));
    Assertions.assertTrue(ill.contains("  localparam [11:0] csr_sindex_mycsr = 12'hFFF; \\\n"));
    Assertions.assertTrue(ill.contains("`include \"rvfi_csr_ill_check.sv\"\n"));
  }

  @Test
  void testScriptHookOrder() throws ConfigException {
    generate("[depth]\nreg 1 5\n"
                 + "[script-link]\nLINK\n"
                 + "[vhdl-files]\na.vhd\n"
                 + "[script-defines reg]\nSDR @check@\n"
                 + "[script-sources]\nSRC\n"
                 + "[script-defines]\nSD\n",
             List.of());
    String text = render("reg_ch0");
    String script = text.substring(text.indexOf("[script]\n"), text.indexOf("[files]\n"));
    Assertions.assertEquals("[script]\n"
                                + "SD\n"
                                + "SDR reg\n"
                                + "read -sv reg_ch0.sv\n"
                                + "read -vhdl a.vhd\n"
                                + "SRC\n"
                                + "prep -flatten -nordff -top rvfi_testbench\n"
                                + "LINK\n"
                                + "chformal -early\n"
                                + "\n",
                            script);
  }
}
