package rvfchecks.isa;

import java.util.Comparator;

/**
 * CSR access that must raise an exception.
 * @param address hex address as written in the configuration (without prefix), e.g. {@code 302}
 * @param levels privilege levels ({@code m}, {@code s}, {@code u}) at which the access is illegal
 * @param access {@code r}, {@code w} or {@code rw}
 */
public record IllegalCsr(String address, String levels, String access) {
  public static final Comparator<IllegalCsr> byAddress =
      Comparator.comparing(IllegalCsr::address).thenComparing(IllegalCsr::levels).thenComparing(IllegalCsr::access);

  /** Address as a 12 bit Verilog literal, e.g. {@code 12'h302}. */
  public String addressLiteral() { return String.format("12'h%03X", ISAConfig.parseHex(address)); }
}
