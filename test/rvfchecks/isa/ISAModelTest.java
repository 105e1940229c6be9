package rvfchecks.isa;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import rvfchecks.config.ConfigException;
import rvfchecks.config.ConfigStore;
import rvfchecks.solver.ProofMode;
import rvfchecks.solver.SolverConfig;

class ISAModelTest {

  private static ISAConfig isaCfg;
  private static SolverConfig solverCfg;

  private static void load(String text) throws ConfigException {
    ConfigStore config = ConfigStore.parse(text);
    isaCfg = new ISAConfig();
    solverCfg = new SolverConfig();
    ISAModel.extractOptions(config, isaCfg, solverCfg);
    ISAModel.addAllCsrs(config, isaCfg);
  }

  @Test
  void testOptions() throws ConfigException {
    load("[options]\nisa rv64imc\nnret 2\nbuslen 64\nnbus 2\nsolver bmc3\nmode prove\nblackbox\nabspath\n");
    Assertions.assertEquals("rv64imc", isaCfg.isa);
    Assertions.assertEquals(64, isaCfg.xlen);
    Assertions.assertTrue(isaCfg.compr);
    Assertions.assertEquals(2, isaCfg.nret);
    Assertions.assertEquals(64, isaCfg.buslen);
    Assertions.assertEquals(2, isaCfg.nbus);
    Assertions.assertEquals(ProofMode.Prove, solverCfg.mode);
    Assertions.assertTrue(solverCfg.blackbox);
    Assertions.assertTrue(solverCfg.abspath);
    Assertions.assertEquals("abc bmc3", solverCfg.engine());
    Assertions.assertEquals("core-gates.il", solverCfg.ilangFile("core"));
  }

  @Test
  void testDefaults() throws ConfigException {
    load("[options]\nisa rv32i\n");
    Assertions.assertEquals(32, isaCfg.xlen);
    Assertions.assertFalse(isaCfg.compr);
    Assertions.assertEquals(ProofMode.Bmc, solverCfg.mode);
    Assertions.assertEquals("smtbmc boolector", solverCfg.engine());
    Assertions.assertEquals("core-hier.il", solverCfg.ilangFile("core"));
    Assertions.assertEquals(List.of(Optional.empty()), solverCfg.groups);
  }

  @Test
  void testDumpSmt2Engine() throws ConfigException {
    load("[options]\nsolver yices\ndumpsmt2\n");
    Assertions.assertEquals("smtbmc --dumpsmt2 yices", solverCfg.engine());
  }

  @Test
  void testGroups() throws ConfigException {
    load("[groups]\nnodiv\n\nfast\n");
    Assertions.assertEquals(List.of(Optional.empty(), Optional.of("nodiv"), Optional.of("fast")), solverCfg.groups);
  }

  @ParameterizedTest
  @ValueSource(strings = {"foo 1", "nret", "nret 1 2", "blackbox yes", "mode sim", "nret two"})
  void testMalformedOptions(String line) {
    Assertions.assertThrows(ConfigException.class, () -> load("[options]\n" + line + "\n"));
  }

  @Test
  void testQuotedTestDescriptor() throws ConfigException {
    load("[csrs]\nmstatus const=\"32'h 0\"_mask=\"32'h dead_beef\"\nmscratch any inc\nmie\n");
    Assertions.assertEquals(List.of("const=\"32'h 0\"_mask=\"32'h dead_beef\""), isaCfg.getCsrTests("mstatus"));
    Assertions.assertEquals(List.of("any", "inc"), isaCfg.getCsrTests("mscratch"));
    Assertions.assertEquals(List.of(), isaCfg.getCsrTests("mie"));
    Assertions.assertEquals(List.of("mie", "mscratch", "mstatus"), List.copyOf(isaCfg.csrs));
  }

  @Test
  void testPrivilegeGating() throws ConfigException {
    load("[options]\nisa rv32i\ncsr_spec 1.12\n");
    Assertions.assertFalse(isaCfg.csrs.contains("medeleg"));
    Assertions.assertTrue(isaCfg.illegalCsrs.contains(new IllegalCsr("302", "m", "rw")));
    Assertions.assertTrue(isaCfg.illegalCsrs.contains(new IllegalCsr("306", "m", "rw")));
    // "32" is part of the isa string, so the high status half is legal
    Assertions.assertTrue(isaCfg.csrs.contains("mstatush"));
    Assertions.assertTrue(isaCfg.csrs.contains("mhpmcounter3"));
    Assertions.assertTrue(isaCfg.csrs.contains("mhpmevent31"));
    Assertions.assertFalse(isaCfg.csrs.contains("mhpmevent32"));
    Assertions.assertEquals(List.of("const"), isaCfg.getCsrTests("mvendorid"));

    load("[options]\nisa rv64imsu\ncsr_spec 1.12\n");
    Assertions.assertTrue(isaCfg.csrs.contains("medeleg"));
    Assertions.assertTrue(isaCfg.csrs.contains("mcounteren"));
    Assertions.assertFalse(isaCfg.csrs.contains("mstatush"));
    Assertions.assertTrue(isaCfg.illegalCsrs.contains(new IllegalCsr("310", "m", "rw")));
  }

  @Test
  void testUnknownCatalogVersion() throws ConfigException {
    load("[options]\ncsr_spec 0.1\n");
    Assertions.assertTrue(isaCfg.csrs.isEmpty());
  }

  @Test
  void testCustomCsrs() throws ConfigException {
    load("[custom_csrs]\n7c0 mu mycsr const\n0x7C1 m othercsr\n7c2 m\n");
    Assertions.assertTrue(isaCfg.customCsrs.contains(new CustomCsr("mycsr", 0x7c0, "mu")));
    Assertions.assertTrue(isaCfg.customCsrs.contains(new CustomCsr("othercsr", 0x7c1, "m")));
    Assertions.assertEquals(2, isaCfg.customCsrs.size());
    Assertions.assertEquals(List.of("const"), isaCfg.getCsrTests("mycsr"));
    Assertions.assertTrue(isaCfg.csrs.contains("othercsr"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"7c2 m", "7c2 m rw extra", "xyz m rw"})
  void testMalformedIllegalCsrs(String line) {
    Assertions.assertThrows(ConfigException.class, () -> load("[illegal_csrs]\n" + line + "\n"));
  }

  @Test
  void testIllegalCsrLiteral() {
    Assertions.assertEquals("12'h7C2", new IllegalCsr("7c2", "m", "rw").addressLiteral());
    Assertions.assertEquals("12'h005", new IllegalCsr("5", "m", "rw").addressLiteral());
  }
}
