package rvfchecks.isa;

import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rvfchecks.config.ConfigException;
import rvfchecks.config.ConfigStore;
import rvfchecks.config.Section;
import rvfchecks.solver.ProofMode;
import rvfchecks.solver.SolverConfig;

/**
 * Builds {@link ISAConfig} and {@link SolverConfig} from the options and CSR sections of a configuration.
 */
public class ISAModel {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /**
   * Reads the [groups] and [options] sections.
   */
  public static void extractOptions(ConfigStore config, ISAConfig isaCfg, SolverConfig solverCfg) throws ConfigException {
    for (String group : config.lines(Section.Groups)) {
      if (!group.isEmpty())
        solverCfg.groups.add(Optional.of(group));
    }

    for (String line : config.lines(Section.Options)) {
      String[] words = line.split("\\s+");
      if (line.isEmpty())
        continue;

      switch (words[0]) {
      case "nret":
        isaCfg.nret = parseInt(expectArgs(words, 1)[1], line);
        break;
      case "isa":
        isaCfg.isa = expectArgs(words, 1)[1];
        break;
      case "buslen":
        isaCfg.buslen = parseInt(expectArgs(words, 1)[1], line);
        break;
      case "nbus":
        isaCfg.nbus = parseInt(expectArgs(words, 1)[1], line);
        break;
      case "csr_spec":
        isaCfg.csrSpec = Optional.of(expectArgs(words, 1)[1]);
        break;
      case "blackbox":
        expectArgs(words, 0);
        solverCfg.blackbox = true;
        break;
      case "solver":
        solverCfg.solver = expectArgs(words, 1)[1];
        break;
      case "dumpsmt2":
        expectArgs(words, 0);
        solverCfg.dumpsmt2 = true;
        break;
      case "abspath":
        expectArgs(words, 0);
        solverCfg.abspath = true;
        break;
      case "mode":
        String modeName = expectArgs(words, 1)[1];
        solverCfg.mode = ProofMode.fromSerialName(modeName)
                             .orElseThrow(() -> new ConfigException("Unknown mode '" + modeName + "', expected bmc, prove or cover"));
        break;
      default:
        throw new ConfigException("Unknown option '" + words[0] + "' in line '" + line + "'");
      }
    }

    isaCfg.deriveFromIsa();
  }

  private static String[] expectArgs(String[] words, int nargs) throws ConfigException {
    if (words.length != nargs + 1)
      throw new ConfigException("Option '" + words[0] + "' takes " + nargs + " argument(s), got '" + String.join(" ", words) + "'");
    return words;
  }

  private static int parseInt(String value, String line) throws ConfigException {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new ConfigException("Expected a number in line '" + line + "'", e);
    }
  }

  /**
   * Collects legal, custom and illegal CSRs: the privileged CSR catalog named by csr_spec, then [csrs], [custom_csrs] and [illegal_csrs].
   * Must run after {@link #extractOptions}, since the catalog masks depend on xlen.
   */
  public static void addAllCsrs(ConfigStore config, ISAConfig isaCfg) throws ConfigException {
    if (isaCfg.csrSpec.isPresent()) {
      Optional<CsrCatalog> catalog = CsrCatalog.load(isaCfg.csrSpec.get());
      if (catalog.isPresent())
        catalog.get().applyTo(isaCfg);
      else
        logger.warn("No CSR catalog for csr_spec {}, only configured CSRs will be checked", isaCfg.csrSpec.get());
    }

    for (String line : config.lines(Section.Csrs)) {
      if (!line.isEmpty())
        isaCfg.addCsr(line);
    }

    for (String line : config.lines(Section.CustomCsrs)) {
      String[] words = line.split("\\s+", 3);
      if (words.length < 3) {
        logger.trace("Skipping custom CSR line '{}'", line);
        continue;
      }
      int address;
      try {
        address = ISAConfig.parseHex(words[0]);
      } catch (NumberFormatException e) {
        throw new ConfigException("Invalid custom CSR address in line '" + line + "'", e);
      }
      String name = isaCfg.addCsr(words[2]);
      isaCfg.customCsrs.add(new CustomCsr(name, address, words[1]));
    }

    for (String line : config.lines(Section.IllegalCsrs)) {
      if (line.isEmpty())
        continue;
      String[] words = line.split("\\s+");
      if (words.length != 3)
        throw new ConfigException("Illegal CSR line must read '<address> <levels> <rw>', got '" + line + "'");
      try {
        ISAConfig.parseHex(words[0]);
      } catch (NumberFormatException e) {
        throw new ConfigException("Invalid illegal CSR address in line '" + line + "'", e);
      }
      isaCfg.illegalCsrs.add(new IllegalCsr(words[0], words[1], words[2]));
    }
    logger.debug(isaCfg.toString());
  }
}
