package rvfchecks.solver;

import java.util.Optional;
import java.util.stream.Stream;

public enum ProofMode {
  /** Bounded search for counterexamples. */
  Bmc("bmc"),
  /** Unbounded inductive proof. */
  Prove("prove"),
  /** Search for reachability witnesses. */
  Cover("cover");

  public final String serialName;

  private ProofMode(String serialName) { this.serialName = serialName; }

  public static Optional<ProofMode> fromSerialName(String name) {
    return Stream.of(values()).filter(mode -> mode.serialName.equals(name)).findAny();
  }

  @Override
  public String toString() {
    return serialName;
  }
}
