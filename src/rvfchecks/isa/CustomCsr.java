package rvfchecks.isa;

import java.util.Comparator;

/**
 * Core specific CSR with an explicit address.
 * @param levels privilege levels ({@code m}, {@code s}, {@code u}) that expose the address
 */
public record CustomCsr(String name, int address, String levels) {
  /** Address used for privilege levels that do not expose the CSR. */
  public static final int UnmappedAddress = 0xfff;

  public static final Comparator<CustomCsr> byName =
      Comparator.comparing(CustomCsr::name).thenComparingInt(CustomCsr::address).thenComparing(CustomCsr::levels);

  public int addressAt(char level) { return levels.indexOf(level) >= 0 ? address : UnmappedAddress; }
}
