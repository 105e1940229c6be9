package rvfchecks.ui;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Data-Class to hold input and output locations.
 */
public class PathConfig {
  public static final String DefaultCfgName = "checks";

  /** Subdirectory of the working directory holding the core's configuration. */
  public String corename;
  /** Name of the configuration file (without .cfg) and of the output directory. */
  public String cfgname = DefaultCfgName;
  /** Root of the check library with its checks/ and insns/ directories. */
  public String basedir = defaultBasedir();
  /** Directory containing the core directories. */
  public Path workDir = Paths.get("").toAbsolutePath();

  public PathConfig(String corename) { this.corename = corename; }

  public static String defaultBasedir() { return Paths.get("").toAbsolutePath().resolve("..").normalize().toString(); }

  public Path coreDir() { return workDir.resolve(corename); }

  public Path configFile() { return coreDir().resolve(cfgname + ".cfg"); }

  public Path outDir() { return coreDir().resolve(cfgname); }

  @Override
  public String toString() {
    return "PathConfig core=" + corename + " cfg=" + cfgname + " basedir=" + basedir;
  }
}
