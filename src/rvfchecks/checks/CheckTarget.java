package rvfchecks.checks;

import java.util.Optional;
import rvfchecks.isa.IllegalCsr;

/**
 * What a check is about, beyond its kind. Plain consistency checks have no target.
 */
public interface CheckTarget {
  /** Identity bound to the {@code @insn@} placeholder, present for the instruction family only. */
  default Optional<String> insn() { return Optional.empty(); }

  /** Instruction against its model {@code insn_<name>.v}. */
  public record Instruction(String name) implements CheckTarget {
    @Override
    public Optional<String> insn() {
      return Optional.of(name);
    }
  }

  /** Write to a legal CSR. */
  public record CsrWrite(String csr) implements CheckTarget {
    @Override
    public Optional<String> insn() {
      return Optional.of(csr);
    }

    /** Counters that need the high-half write handling. */
    public boolean isWideCounter() { return csr.equals("mcycle") || csr.equals("minstret"); }
  }

  /** Access to an address that must trap. */
  public record IllegalAccess(IllegalCsr csr) implements CheckTarget {
    @Override
    public Optional<String> insn() {
      return Optional.of(csr.addressLiteral());
    }
  }
}
