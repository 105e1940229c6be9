package rvfchecks.checks;

import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Kinds of generated checks. The serial name selects the checker source {@code rvfi_<name>_check.sv}.
 */
public enum CheckKind {
  Insn("insn", Family.Instruction),
  CsrWrite("csrw", Family.Instruction),
  CsrIllegal("csr_ill", Family.Instruction),

  Reg("reg", Family.Channel, 0, -1, 1),
  PcFwd("pc_fwd", Family.Channel, 0, -1, 1),
  PcBwd("pc_bwd", Family.Channel, 0, -1, 1),
  Liveness("liveness", Family.Channel, 0, 1, 2),
  Unique("unique", Family.Channel, 0, 1, 2),
  Causal("causal", Family.Channel, 0, -1, 1),
  CausalMem("causal_mem", Family.Channel, 0, -1, 1),
  CausalIo("causal_io", Family.Channel, 0, -1, 1),
  Ill("ill", Family.Channel, -1, -1, 0),
  Fault("fault", Family.Channel, -1, -1, 0),

  BusImem("bus_imem", Family.Bus, 0, -1, 1),
  BusImemFault("bus_imem_fault", Family.Bus, 0, -1, 1),
  BusDmem("bus_dmem", Family.Bus, 0, -1, 1),
  BusDmemFault("bus_dmem_fault", Family.Bus, 0, -1, 1),
  BusDmemIoRead("bus_dmem_io_read", Family.Bus, 0, -1, 1),
  BusDmemIoReadFault("bus_dmem_io_read_fault", Family.Bus, 0, -1, 1),
  BusDmemIoWrite("bus_dmem_io_write", Family.Bus, 0, -1, 1),
  BusDmemIoWriteFault("bus_dmem_io_write_fault", Family.Bus, 0, -1, 1),
  BusDmemIoOrder("bus_dmem_io_order", Family.Bus, 0, -1, 1),

  Hang("hang", Family.Global, 0, -1, 1),
  Cover("cover", Family.Global, 0, -1, 1),

  /** CSR consistency; the checker name depends on the CSR test (csrc, csrc_const, csrc_hpm, ...). */
  CsrConsistency("csrc", Family.Csr, 0, -1, 1);

  public enum Family {
    /** One check per instruction, CSR or illegal CSR and channel. */
    Instruction,
    /** Consistency check per channel. */
    Channel,
    /** Bus protocol check per channel. */
    Bus,
    /** Consistency check without a channel. */
    Global,
    /** Consistency check per CSR test and channel. */
    Csr
  }

  /** Cycle that is used when a kind has no start position in its depth vector. */
  public static final int DefaultStartCycle = 1;

  public final String serialName;
  public final Family family;
  // Positions in the depth vector, NONE (-1) if the kind does not read that value.
  private final int startIndex;
  private final int triggerIndex;
  private final int depthIndex;

  private CheckKind(String serialName, Family family) { this(serialName, family, -1, -1, 0); }

  private CheckKind(String serialName, Family family, int startIndex, int triggerIndex, int depthIndex) {
    this.serialName = serialName;
    this.family = family;
    this.startIndex = startIndex;
    this.triggerIndex = triggerIndex;
    this.depthIndex = depthIndex;
  }

  private static final int NONE = -1;

  public OptionalInt startIndex() { return startIndex == NONE ? OptionalInt.empty() : OptionalInt.of(startIndex); }
  public OptionalInt triggerIndex() { return triggerIndex == NONE ? OptionalInt.empty() : OptionalInt.of(triggerIndex); }
  public int depthIndex() { return depthIndex; }

  public boolean isInstructionFamily() { return family == Family.Instruction; }
  public boolean isBus() { return family == Family.Bus; }
  /** Liveness and hang checks need fairness assumptions. */
  public boolean needsFairness() { return this == Liveness || this == Hang; }

  /** Fixed consistency checks generated for every channel, in generation order. */
  public static List<CheckKind> channelChecks() {
    return Stream.of(values()).filter(kind -> kind.family == Family.Channel || kind.family == Family.Bus).collect(Collectors.toList());
  }

  /** Consistency checks without a channel, in generation order. */
  public static List<CheckKind> globalChecks() {
    return Stream.of(values()).filter(kind -> kind.family == Family.Global).collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return serialName;
  }
}
