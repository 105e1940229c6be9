package rvfchecks.checks;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import rvfchecks.solver.ProofMode;

/**
 * One generated check with its resolved cycle parameters. Immutable once created by {@link CheckEnumerator}.
 */
public class Check {
  /** Unique name, also the descriptor file name without {@code .sby}. */
  public final String name;
  public final CheckKind kind;
  /** Checker name selecting {@code rvfi_<checker>_check.sv}, e.g. {@code reg} or {@code csrc_const}. */
  public final String checker;
  public final Optional<String> group;
  public final OptionalInt channel;
  public final int start;
  public final OptionalInt trigger;
  public final int depth;
  public final Optional<CheckTarget> target;
  /** Declared CSRs at the time the check was enumerated, sorted. */
  public final List<String> csrs;
  /** Proof mode this check runs in, which differs from the configured mode for cover and hpm checks. */
  public final ProofMode mode;

  public Check(String name, CheckKind kind, String checker, Optional<String> group, OptionalInt channel, int start, OptionalInt trigger,
               int depth, Optional<CheckTarget> target, List<String> csrs, ProofMode mode) {
    this.name = name;
    this.kind = kind;
    this.checker = checker;
    this.group = group;
    this.channel = channel;
    this.start = start;
    this.trigger = trigger;
    this.depth = depth;
    this.target = target;
    this.csrs = List.copyOf(csrs);
    this.mode = mode;
  }

  /** Name prefix of a configuration group, e.g. {@code "nodiv_"}, or the empty string. */
  public static String prefix(Optional<String> group) { return group.map(name -> name + "_").orElse(""); }

  /** Solver depth, one cycle beyond the check cycle. */
  public int depthPlus() { return depth + 1; }

  public int skip() { return depth; }

  public Optional<CsrTest> csrTest() { return target.filter(t -> t instanceof CsrTest).map(t -> (CsrTest)t); }

  @Override
  public String toString() {
    return name + " (" + checker + ", start " + start + ", depth " + depth + ")";
  }
}
