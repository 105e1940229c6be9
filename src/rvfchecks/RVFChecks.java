package rvfchecks;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rvfchecks.checks.Check;
import rvfchecks.checks.CheckEnumerator;
import rvfchecks.checks.CheckSet;
import rvfchecks.config.ConfigException;
import rvfchecks.config.ConfigStore;
import rvfchecks.isa.ISAConfig;
import rvfchecks.isa.ISAModel;
import rvfchecks.isa.InstructionList;
import rvfchecks.sby.TemplateRenderer;
import rvfchecks.solver.SolverConfig;
import rvfchecks.ui.PathConfig;
import rvfchecks.util.ArtifactWriter;

/**
 * Generates the sby descriptors and the makefile for one core configuration.
 */
public class RVFChecks {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /**
   * Reads {@code <core>/<cfgname>.cfg} and writes all checks to {@code <core>/<cfgname>/}.
   * The output directory is recreated only after the configuration has been read and checked.
   * @return the generated checks
   */
  public CheckSet Generate(PathConfig pathCfg) throws ConfigException, IOException {
    logger.debug(pathCfg.toString());
    ConfigStore config = ConfigStore.read(pathCfg.configFile());

    ISAConfig isaCfg = new ISAConfig();
    SolverConfig solverCfg = new SolverConfig();
    ISAModel.extractOptions(config, isaCfg, solverCfg);
    ISAModel.addAllCsrs(config, isaCfg);
    List<String> insns = InstructionList.read(Paths.get(pathCfg.basedir), isaCfg.isa);

    CheckEnumerator enumerator = new CheckEnumerator(config, isaCfg, solverCfg);
    TemplateRenderer renderer = new TemplateRenderer(config, isaCfg, solverCfg, pathCfg.basedir, pathCfg.corename);
    ArtifactWriter writer = new ArtifactWriter(pathCfg.outDir(), config, solverCfg);

    CheckSet checks = enumerator.enumerateInstructionChecks(insns);
    checks.addAll(enumerator.enumerateConsistencyChecks());

    // Render everything before touching the output directory
    LinkedHashMap<String, String> descriptors = new LinkedHashMap<>();
    for (Check check : checks)
      descriptors.put(check.name, renderer.render(check));

    ArtifactWriter.recreateDir(pathCfg.outDir());
    for (Map.Entry<String, String> descriptor : descriptors.entrySet())
      writer.writeDescriptor(descriptor.getKey(), descriptor.getValue());
    writer.writeMakefile(descriptors.keySet());

    logger.info("Generated {} checks.", checks.size());
    return checks;
  }
}
