package rvfchecks.sby;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import rvfchecks.checks.Check;
import rvfchecks.config.ConfigStore;
import rvfchecks.config.Section;
import rvfchecks.isa.ISAConfig;
import rvfchecks.solver.SolverConfig;

/**
 * Descriptor skeleton as an ordered list of fragments. Each fragment appends zero or more lines.
 */
public class SbyTemplate {
  /**
   * Everything a fragment may read while rendering one check.
   */
  public record RenderContext(Check check, ConfigStore config, ISAConfig isaCfg, SolverConfig solverCfg, Placeholders placeholders,
                              AssumeStatements assumeStatements) {}

  @FunctionalInterface
  public interface Fragment {
    void appendTo(RenderContext ctx, List<String> out);
  }

  private final List<Fragment> fragments;

  public SbyTemplate(List<Fragment> fragments) { this.fragments = List.copyOf(fragments); }

  public List<String> render(RenderContext ctx) {
    List<String> ret = new ArrayList<>();
    for (Fragment fragment : fragments)
      fragment.appendTo(ctx, ret);
    return ret;
  }

  /** Fixed lines with placeholders. */
  public static Fragment text(String... lines) {
    return (ctx, out) -> {
      for (String line : lines)
        out.add(ctx.placeholders().substitute(line));
    };
  }

  /** A {@code `define} without value. */
  public static Fragment define(String name) { return (ctx, out) -> out.add("`define " + name); }

  /** Lines of a user hook section, if the configuration has it. */
  public static Fragment hook(Section section) {
    return (ctx, out) -> out.addAll(ctx.placeholders().hookLines(ctx.config().lines(section)));
  }

  /** Lines of the per-checker variant of a hook section, e.g. {@code [defines liveness]}. */
  public static Fragment checkerHook(Section section) {
    return (ctx, out) -> out.addAll(ctx.placeholders().hookLines(ctx.config().lines(section.forChecker(ctx.check().checker))));
  }

  /** Fragments that are rendered only if the condition holds. */
  public static Fragment when(Predicate<RenderContext> condition, Fragment... fragments) {
    return (ctx, out) -> {
      if (condition.test(ctx)) {
        for (Fragment fragment : fragments)
          fragment.appendTo(ctx, out);
      }
    };
  }

  /** Lines computed from the check; no placeholder substitution. */
  public static Fragment computed(Function<RenderContext, List<String>> lines) { return (ctx, out) -> out.addAll(lines.apply(ctx)); }
}
