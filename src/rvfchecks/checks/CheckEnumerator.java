package rvfchecks.checks;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rvfchecks.checks.CheckTarget.CsrWrite;
import rvfchecks.checks.CheckTarget.IllegalAccess;
import rvfchecks.checks.CheckTarget.Instruction;
import rvfchecks.config.ConfigException;
import rvfchecks.config.ConfigStore;
import rvfchecks.isa.ISAConfig;
import rvfchecks.isa.IllegalCsr;
import rvfchecks.solver.ProofMode;
import rvfchecks.solver.SolverConfig;

/**
 * Enumerates all checks of a configuration, for every group and channel.
 * A candidate becomes a check only if a depth rule matches it and the filter rules enable it.
 */
public class CheckEnumerator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final ISAConfig isaCfg;
  private final SolverConfig solverCfg;
  private final DepthResolver depthResolver;
  private final CheckFilter checkFilter;

  public CheckEnumerator(ConfigStore config, ISAConfig isaCfg, SolverConfig solverCfg) throws ConfigException {
    this.isaCfg = isaCfg;
    this.solverCfg = solverCfg;
    this.depthResolver = new DepthResolver(config);
    this.checkFilter = new CheckFilter(config);
  }

  /**
   * Instruction, CSR write and illegal CSR checks.
   * @param insns instruction names of the isa
   */
  public CheckSet enumerateInstructionChecks(List<String> insns) throws ConfigException {
    CheckSet ret = new CheckSet();
    for (Optional<String> group : solverCfg.groups) {
      for (String insn : insns) {
        for (int channel = 0; channel < isaCfg.nret; ++channel)
          addInstructionCheck(ret, group, CheckKind.Insn, insn, new Instruction(insn), channel);
      }
      for (String csr : new ArrayList<>(isaCfg.csrs)) {
        for (int channel = 0; channel < isaCfg.nret; ++channel)
          addInstructionCheck(ret, group, CheckKind.CsrWrite, csr, new CsrWrite(csr), channel);
      }
      List<IllegalCsr> illegalCsrs = isaCfg.illegalCsrs.stream().sorted(IllegalCsr.byAddress).collect(Collectors.toList());
      for (IllegalCsr illegalCsr : illegalCsrs) {
        for (int channel = 0; channel < isaCfg.nret; ++channel)
          addInstructionCheck(ret, group, CheckKind.CsrIllegal, illegalCsr.address(), new IllegalAccess(illegalCsr), channel);
      }
    }
    logger.debug("{} instruction checks", ret.size());
    return ret;
  }

  private void addInstructionCheck(CheckSet checks, Optional<String> group, CheckKind kind, String identity, CheckTarget target, int channel)
      throws ConfigException {
    String base = Check.prefix(group) + kind.serialName;
    String chSuffix = "_ch" + channel;
    String name = base + "_" + identity + chSuffix;
    Optional<List<Integer>> depthCfg = depthResolver.resolve(List.of(base, base + chSuffix, base + "_" + identity, name));
    if (depthCfg.isEmpty())
      return;
    if (depthCfg.get().size() != 1)
      throw new ConfigException("Depth rule for " + name + " must give exactly one cycle, got " + depthCfg.get());
    if (!checkFilter.isEnabled(name))
      return;

    checks.add(new Check(name, kind, kind.serialName, group, OptionalInt.of(channel), CheckKind.DefaultStartCycle, OptionalInt.empty(),
                         depthCfg.get().get(0), Optional.of(target), List.copyOf(isaCfg.csrs), solverCfg.mode));
  }

  /**
   * Fixed consistency checks per channel, the global checks and one check per CSR test and channel.
   * Referencing an hpm event CSR adds its counter to the declared CSRs.
   */
  public CheckSet enumerateConsistencyChecks() throws ConfigException {
    CheckSet ret = new CheckSet();
    for (Optional<String> group : solverCfg.groups) {
      String pf = Check.prefix(group);
      for (int channel = 0; channel < isaCfg.nret; ++channel) {
        String chSuffix = "_ch" + channel;
        for (CheckKind kind : CheckKind.channelChecks()) {
          String base = pf + kind.serialName;
          addConsistencyCheck(ret, group, kind, kind.serialName, base + chSuffix, OptionalInt.of(channel), List.of(base, base + chSuffix),
                              Optional.empty());
        }
      }
      for (CheckKind kind : CheckKind.globalChecks()) {
        String base = pf + kind.serialName;
        addConsistencyCheck(ret, group, kind, kind.serialName, base, OptionalInt.empty(), List.of(base), Optional.empty());
      }

      for (String csr : new ArrayList<>(isaCfg.csrs)) {
        List<Optional<String>> descriptors = isaCfg.getCsrTests(csr).stream().map(Optional::of).collect(Collectors.toList());
        if (descriptors.isEmpty())
          descriptors = List.of(Optional.empty());
        for (int channel = 0; channel < isaCfg.nret; ++channel) {
          for (Optional<String> descriptor : descriptors)
            addCsrCheck(ret, group, csr, descriptor, channel);
        }
      }
    }
    logger.debug("{} consistency checks", ret.size());
    return ret;
  }

  private void addCsrCheck(CheckSet checks, Optional<String> group, String csr, Optional<String> descriptor, int channel)
      throws ConfigException {
    CsrTest test = CsrTest.parse(csr, descriptor);
    if (test.hpmcounter().isPresent() && !isaCfg.csrs.contains(test.hpmcounter().get())) {
      logger.debug("Adding counter {} for hpm check of {}", test.hpmcounter().get(), csr);
      isaCfg.csrs.add(test.hpmcounter().get());
    }

    String pf = Check.prefix(group);
    String chSuffix = "_ch" + channel;
    String base = pf + test.baseName();
    List<String> candidates = List.of(pf + test.checker(), base, pf + test.checker() + chSuffix, base + chSuffix);
    addConsistencyCheck(checks, group, CheckKind.CsrConsistency, test.checker(), base + chSuffix, OptionalInt.of(channel), candidates,
                        Optional.of(test));
  }

  private void addConsistencyCheck(CheckSet checks, Optional<String> group, CheckKind kind, String checker, String name, OptionalInt channel,
                                   List<String> candidates, Optional<CsrTest> test) throws ConfigException {
    Optional<List<Integer>> depthCfg = depthResolver.resolve(candidates);
    if (depthCfg.isEmpty())
      return;
    List<Integer> cycles = depthCfg.get();

    int start = CheckKind.DefaultStartCycle;
    if (kind.startIndex().isPresent())
      start = cycleAt(cycles, kind.startIndex().getAsInt(), name);
    OptionalInt trigger = OptionalInt.empty();
    if (kind.triggerIndex().isPresent())
      trigger = OptionalInt.of(cycleAt(cycles, kind.triggerIndex().getAsInt(), name));
    int depth = cycleAt(cycles, kind.depthIndex(), name);

    if (!checkFilter.isEnabled(name))
      return;

    // grouped cover checks keep the configured mode
    boolean coverOnly = (kind == CheckKind.Cover && group.isEmpty()) || test.map(CsrTest::isHpm).orElse(false);
    ProofMode mode = coverOnly ? ProofMode.Cover : solverCfg.mode;
    checks.add(new Check(name, kind, checker, group, channel, start, trigger, depth, test.map(t -> (CheckTarget)t), List.copyOf(isaCfg.csrs),
                         mode));
  }

  private static int cycleAt(List<Integer> cycles, int index, String name) throws ConfigException {
    if (index >= cycles.size())
      throw new ConfigException("Depth rule for " + name + " needs at least " + (index + 1) + " values, got " + cycles);
    return cycles.get(index);
  }
}
