package rvfchecks.isa;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import rvfchecks.config.ConfigException;

/**
 * Built-in CSR sets of a privileged specification version, read from {@code csr_spec_<version>.yaml}.
 */
public class CsrCatalog {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final CsrSpecDescription description;

  private CsrCatalog(CsrSpecDescription description) { this.description = description; }

  public static class BitRange implements Serializable {
    int from = 0;
    /** Exclusive; a negative value counts back from the mask width. */
    int to = 0;

    public int getFrom() { return from; }
    public void setFrom(int from) { this.from = from; }
    public int getTo() { return to; }
    public void setTo(int to) { this.to = to; }
  }

  public static class ZeroMaskDesc implements Serializable {
    String test = "zero";
    List<Integer> bits = new ArrayList<>();
    List<BitRange> ranges = new ArrayList<>();
    List<Integer> rv64Bits = new ArrayList<>();
    List<BitRange> rv64Ranges = new ArrayList<>();
    boolean invert = false;

    public String getTest() { return test; }
    public void setTest(String test) { this.test = test; }
    public List<Integer> getBits() { return bits; }
    public void setBits(List<Integer> bits) { this.bits = bits; }
    public List<BitRange> getRanges() { return ranges; }
    public void setRanges(List<BitRange> ranges) { this.ranges = ranges; }
    public List<Integer> getRv64Bits() { return rv64Bits; }
    public void setRv64Bits(List<Integer> rv64Bits) { this.rv64Bits = rv64Bits; }
    public List<BitRange> getRv64Ranges() { return rv64Ranges; }
    public void setRv64Ranges(List<BitRange> rv64Ranges) { this.rv64Ranges = rv64Ranges; }
    public boolean isInvert() { return invert; }
    public void setInvert(boolean invert) { this.invert = invert; }

    /** Collects all masked bit positions for the given register width. */
    List<Integer> bitPositions(int xlen) {
      List<Integer> positions = new ArrayList<>(bits);
      addRanges(positions, ranges, xlen);
      if (xlen == 64) {
        positions.addAll(rv64Bits);
        addRanges(positions, rv64Ranges, xlen);
      }
      return positions;
    }

    private static void addRanges(List<Integer> positions, List<BitRange> ranges, int xlen) {
      for (BitRange range : ranges) {
        int to = range.to < 0 ? xlen + range.to : range.to;
        for (int bit = range.from; bit < to; ++bit)
          positions.add(bit);
      }
    }
  }

  public static class CsrDesc implements Serializable {
    String name = "";
    List<String> tests = new ArrayList<>();
    ZeroMaskDesc zeroMask = null;

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public List<String> getTests() { return tests; }
    public void setTests(List<String> tests) { this.tests = tests; }
    public ZeroMaskDesc getZeroMask() { return zeroMask; }
    public void setZeroMask(ZeroMaskDesc zeroMask) { this.zeroMask = zeroMask; }

    /** Test descriptors of this CSR, including the zero mask test. */
    List<String> testsFor(int xlen) {
      List<String> ret = new ArrayList<>(tests);
      if (zeroMask != null)
        ret.add(maskBits(zeroMask.test, zeroMask.bitPositions(xlen), xlen, zeroMask.invert));
      return ret;
    }
  }

  public static class RestrictedCsrDesc extends CsrDesc {
    /** Substring of the isa string that makes this CSR legal. */
    String requires = "";
    String address = "";

    public String getRequires() { return requires; }
    public void setRequires(String requires) { this.requires = requires; }
    public String getAddress() { return address; }
    public void setAddress(String address) { this.address = address; }
  }

  public static class CounterRangeDesc implements Serializable {
    String counterPrefix = "mhpmcounter";
    String eventPrefix = "mhpmevent";
    int first = 3;
    /** Inclusive. */
    int last = 31;

    public String getCounterPrefix() { return counterPrefix; }
    public void setCounterPrefix(String counterPrefix) { this.counterPrefix = counterPrefix; }
    public String getEventPrefix() { return eventPrefix; }
    public void setEventPrefix(String eventPrefix) { this.eventPrefix = eventPrefix; }
    public int getFirst() { return first; }
    public void setFirst(int first) { this.first = first; }
    public int getLast() { return last; }
    public void setLast(int last) { this.last = last; }
  }

  public static class CsrSpecDescription implements Serializable {
    String version = "";
    List<CsrDesc> mandatory = new ArrayList<>();
    CounterRangeDesc counters = null;
    List<RestrictedCsrDesc> restricted = new ArrayList<>();

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }
    public List<CsrDesc> getMandatory() { return mandatory; }
    public void setMandatory(List<CsrDesc> mandatory) { this.mandatory = mandatory; }
    public CounterRangeDesc getCounters() { return counters; }
    public void setCounters(CounterRangeDesc counters) { this.counters = counters; }
    public List<RestrictedCsrDesc> getRestricted() { return restricted; }
    public void setRestricted(List<RestrictedCsrDesc> restricted) { this.restricted = restricted; }
  }

  /**
   * Loads the bundled catalog of a specification version.
   * @return Optional.empty() if no catalog exists for that version
   */
  public static Optional<CsrCatalog> load(String version) throws ConfigException {
    String resource = "csr_spec_" + version + ".yaml";
    try (InputStream readFile = CsrCatalog.class.getResourceAsStream(resource)) {
      if (readFile == null)
        return Optional.empty();
      return Optional.of(load(readFile));
    } catch (IOException e) {
      throw new ConfigException("Cannot read CSR catalog " + resource, e);
    }
  }

  public static CsrCatalog load(InputStream readFile) throws ConfigException {
    Yaml yamlCatalog = new Yaml(new Constructor(CsrSpecDescription.class, new LoaderOptions()));
    try {
      Object parseResult = yamlCatalog.load(readFile);
      if (!(parseResult instanceof CsrSpecDescription))
        throw new ConfigException("CSR catalog does not describe a CSR specification");
      return new CsrCatalog((CsrSpecDescription)parseResult);
    } catch (YAMLException e) {
      throw new ConfigException("Malformed CSR catalog: " + e.getMessage(), e);
    }
  }

  public String getVersion() { return description.version; }

  /**
   * Adds the catalog to an ISA configuration. Restricted CSRs the isa does not enable become illegal CSRs.
   */
  public void applyTo(ISAConfig isaCfg) {
    // name -> tests; insertion order only matters for logging
    Map<String, List<String>> specCsrs = new LinkedHashMap<>();
    for (CsrDesc csr : description.mandatory)
      specCsrs.put(csr.name, csr.testsFor(isaCfg.xlen));
    if (description.counters != null) {
      CounterRangeDesc counters = description.counters;
      for (int i = counters.first; i <= counters.last; ++i)
        specCsrs.put(counters.counterPrefix + i, List.of());
      for (int i = counters.first; i <= counters.last; ++i)
        specCsrs.put(counters.eventPrefix + i, List.of());
    }
    for (RestrictedCsrDesc csr : description.restricted) {
      if (isaCfg.isaHas(csr.requires)) {
        specCsrs.put(csr.name, csr.testsFor(isaCfg.xlen));
      } else {
        logger.debug("{} not enabled by isa {}, adding as illegal CSR {}", csr.name, isaCfg.isa, csr.address);
        isaCfg.illegalCsrs.add(new IllegalCsr(csr.address, "m", "rw"));
      }
    }

    specCsrs.forEach((name, tests) -> {
      isaCfg.csrs.add(name);
      if (!tests.isEmpty())
        isaCfg.csrTests.put(name, new ArrayList<>(tests));
    });
    logger.debug("CSR spec {} added {} CSRs", description.version, specCsrs.size());
  }

  /**
   * Formats a mask test descriptor, e.g. {@code zero_mask=32'b0000...10101}.
   */
  public static String maskBits(String test, List<Integer> bits, int maskLen, boolean invert) {
    long mask = 0;
    for (int bit : bits)
      mask |= 1L << bit;
    String binary = Long.toBinaryString(mask);
    if (binary.length() < maskLen)
      binary = "0".repeat(maskLen - binary.length()) + binary;
    return test + "_mask=" + (invert ? "~" : "") + maskLen + "'b" + binary;
  }
}
