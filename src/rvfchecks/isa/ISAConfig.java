package rvfchecks.isa;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ISA and CSR configuration of the core under verification.
 */
public class ISAConfig {
  /** Splits at whitespace, except inside quotes: {@code const="32'h 0"_mask="32'h dead_beef"} is a single token. */
  private static final Pattern csrTestToken = Pattern.compile("(?:\\S*?\"[^\"]*\")+|\\S+");

  public String isa = "rv32i";
  public boolean compr = false;
  public Optional<String> csrSpec = Optional.empty();

  public int nret = 1;
  public int ilen = 32;
  public int xlen = 32;
  public int buslen = 32;
  public int nbus = 1;

  /** Legal CSR names, kept sorted for the generated define blocks. */
  public TreeSet<String> csrs = new TreeSet<>();
  public Set<CustomCsr> customCsrs = new LinkedHashSet<>();
  public Set<IllegalCsr> illegalCsrs = new LinkedHashSet<>();
  /** key: CSR name, value: test descriptors in declaration order */
  public Map<String, List<String>> csrTests = new HashMap<>();

  /** Derives register width and compressed support from the isa string. */
  public void deriveFromIsa() {
    if (isa.contains("64"))
      xlen = 64;
    if (isa.contains("c"))
      compr = true;
  }

  /** Whether the isa string mentions a privilege level or extension, e.g. "s" or "u". */
  public boolean isaHas(String feature) { return isa.contains(feature); }

  public void addCsrTests(String csrName, String testStr) { csrTests.put(csrName, tokenizeTests(testStr)); }

  /**
   * Adds a CSR from a {@code <name> [tests...]} line.
   * @return the CSR name
   */
  public String addCsr(String csrStr) {
    String[] parts = csrStr.strip().split("\\s+", 2);
    String name = parts[0];
    if (parts.length == 2)
      addCsrTests(name, parts[1]);
    csrs.add(name);
    return name;
  }

  public List<String> getCsrTests(String csrName) { return csrTests.getOrDefault(csrName, List.of()); }

  public static List<String> tokenizeTests(String testStr) {
    List<String> tests = new ArrayList<>();
    Matcher matcher = csrTestToken.matcher(testStr);
    while (matcher.find())
      tests.add(matcher.group());
    return tests;
  }

  /** Parses a hex number, with or without {@code 0x} prefix. */
  public static int parseHex(String text) {
    String digits = text.startsWith("0x") || text.startsWith("0X") ? text.substring(2) : text;
    return Integer.parseInt(digits, 16);
  }

  @Override
  public String toString() {
    return "ISAConfig isa=" + isa + " xlen=" + xlen + " nret=" + nret + " csrs=" + csrs + " illegal=" + illegalCsrs;
  }
}
