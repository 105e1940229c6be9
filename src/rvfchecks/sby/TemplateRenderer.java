package rvfchecks.sby;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rvfchecks.checks.Check;
import rvfchecks.config.ConfigException;
import rvfchecks.config.ConfigStore;
import rvfchecks.config.Section;
import rvfchecks.isa.ISAConfig;
import rvfchecks.sby.SbyTemplate.RenderContext;
import rvfchecks.solver.SolverConfig;

/**
 * Renders the sby descriptor of a check.
 */
public class TemplateRenderer {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final ConfigStore config;
  private final ISAConfig isaCfg;
  private final SolverConfig solverCfg;
  private final String basedir;
  private final String corename;
  private final AssumeStatements assumeStatements;

  public TemplateRenderer(ConfigStore config, ISAConfig isaCfg, SolverConfig solverCfg, String basedir, String corename)
      throws ConfigException {
    this.config = config;
    this.isaCfg = isaCfg;
    this.solverCfg = solverCfg;
    this.basedir = basedir;
    this.corename = corename;
    this.assumeStatements = new AssumeStatements(config);
  }

  /**
   * Placeholder bindings of a check. Values that do not apply to the check (channel, insn, cover) stay unbound.
   */
  public Placeholders bindingsFor(Check check) {
    Placeholders ret = new Placeholders(check.name);
    ret.bind("basedir", basedir)
        .bind("core", corename)
        .bind("nret", isaCfg.nret)
        .bind("xlen", isaCfg.xlen)
        .bind("ilen", isaCfg.ilen)
        .bind("buslen", isaCfg.buslen)
        .bind("nbus", isaCfg.nbus)
        .bind("append", 0)
        .bind("mode", solverCfg.mode)
        .bind("xmode", check.mode)
        .bind("engine", solverCfg.engine())
        .bind("ilang_file", solverCfg.ilangFile(corename))
        .bind("checkch", check.name)
        .bind("check", check.checker)
        .bind("start", check.start)
        .bind("depth", check.depth)
        .bind("depth_plus", check.depthPlus())
        .bind("skip", check.skip());
    config.joined(Section.Cover).ifPresent(cover -> ret.bind("cover", cover));
    check.channel.ifPresent(channel -> ret.bind("channel", channel));
    check.target.flatMap(target -> target.insn()).ifPresent(insn -> ret.bind("insn", insn));
    return ret;
  }

  /**
   * @return descriptor text, each line terminated by a newline
   * @throws TemplateException if the layout or a hook section uses a placeholder the check does not bind
   */
  public String render(Check check) {
    logger.trace("Rendering {}", check);
    RenderContext ctx = new RenderContext(check, config, isaCfg, solverCfg, bindingsFor(check), assumeStatements);
    StringBuilder ret = new StringBuilder();
    for (String line : SbyTemplates.forKind(check.kind).render(ctx))
      ret.append(line).append('\n');
    return ret.toString();
  }
}
