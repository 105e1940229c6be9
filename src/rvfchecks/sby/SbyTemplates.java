package rvfchecks.sby;

import static rvfchecks.sby.SbyTemplate.checkerHook;
import static rvfchecks.sby.SbyTemplate.computed;
import static rvfchecks.sby.SbyTemplate.define;
import static rvfchecks.sby.SbyTemplate.hook;
import static rvfchecks.sby.SbyTemplate.text;
import static rvfchecks.sby.SbyTemplate.when;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import rvfchecks.checks.CheckKind;
import rvfchecks.checks.CheckTarget;
import rvfchecks.checks.CsrTest;
import rvfchecks.config.Section;
import rvfchecks.isa.IllegalCsr;
import rvfchecks.sby.SbyTemplate.Fragment;
import rvfchecks.solver.ProofMode;

/**
 * The two descriptor layouts: instruction family checks and consistency checks.
 */
public class SbyTemplates {

  public static final SbyTemplate Instruction = new SbyTemplate(List.of(
      options("@mode@"),
      scriptSection(),
      filesSection(),
      when(ctx -> ctx.check().kind == CheckKind.Insn, text("@basedir@/insns/insn_@insn@.v")),
      text("",
           "[file defines.sv]",
           "`define RISCV_FORMAL",
           "`define RISCV_FORMAL_NRET @nret@",
           "`define RISCV_FORMAL_XLEN @xlen@",
           "`define RISCV_FORMAL_ILEN @ilen@",
           "`define RISCV_FORMAL_RESET_CYCLES 1",
           "`define RISCV_FORMAL_CHECK_CYCLE @depth@",
           "`define RISCV_FORMAL_CHANNEL_IDX @channel@"),
      modeDefines(),
      csrDefines(),
      when(SbyTemplates::isWideCounterWrite, define("RISCV_FORMAL_CSRWH")),
      when(ctx -> ctx.check().kind == CheckKind.CsrIllegal,
           text("`define RISCV_FORMAL_CHECKER rvfi_csr_ill_check", "`define RISCV_FORMAL_ILL_CSR_ADDR @insn@"),
           computed(SbyTemplates::illegalAccessDefines)),
      when(ctx -> ctx.check().kind == CheckKind.CsrWrite,
           text("`define RISCV_FORMAL_CHECKER rvfi_csrw_check", "`define RISCV_FORMAL_CSRW_NAME @insn@")),
      when(ctx -> ctx.check().kind == CheckKind.Insn,
           text("`define RISCV_FORMAL_CHECKER rvfi_insn_check", "`define RISCV_FORMAL_INSN_MODEL rvfi_insn_@insn@")),
      customCsrDefines(),
      when(ctx -> ctx.solverCfg().blackbox, define("RISCV_FORMAL_BLACKBOX_REGS")),
      when(ctx -> ctx.isaCfg().compr, define("RISCV_FORMAL_COMPRESSED")),
      hook(Section.Defines),
      checkerHook(Section.Defines),
      checkerFile(),
      when(ctx -> ctx.check().kind == CheckKind.Insn, text("`include \"insn_@insn@.v\"")),
      assumeFile()));

  public static final SbyTemplate Consistency = new SbyTemplate(List.of(
      options("@xmode@"),
      scriptSection(),
      filesSection(),
      text("",
           "[file defines.sv]",
           "`define RISCV_FORMAL",
           "`define RISCV_FORMAL_NRET @nret@",
           "`define RISCV_FORMAL_XLEN @xlen@",
           "`define RISCV_FORMAL_ILEN @ilen@",
           "`define RISCV_FORMAL_CHECKER rvfi_@check@_check",
           "`define RISCV_FORMAL_RESET_CYCLES @start@",
           "`define RISCV_FORMAL_CHECK_CYCLE @depth@"),
      modeDefines(),
      csrDefines(),
      computed(SbyTemplates::csrTestDefines),
      customCsrDefines(),
      when(ctx -> ctx.solverCfg().blackbox && !ctx.check().checker.equals(CheckKind.Liveness.serialName), define("RISCV_FORMAL_BLACKBOX_ALU")),
      when(ctx -> ctx.solverCfg().blackbox && !ctx.check().checker.equals(CheckKind.Reg.serialName), define("RISCV_FORMAL_BLACKBOX_REGS")),
      when(ctx -> ctx.check().channel.isPresent(), text("`define RISCV_FORMAL_CHANNEL_IDX @channel@")),
      when(ctx -> ctx.check().trigger.isPresent(),
           computed(ctx -> List.of("`define RISCV_FORMAL_TRIG_CYCLE " + ctx.check().trigger.getAsInt()))),
      when(ctx -> ctx.check().kind.isBus(),
           text("`define RISCV_FORMAL_BUS", "`define RISCV_FORMAL_NBUS @nbus@", "`define RISCV_FORMAL_BUSLEN @buslen@")),
      when(ctx -> ctx.check().kind.needsFairness(), define("RISCV_FORMAL_FAIRNESS")),
      hook(Section.Defines),
      checkerHook(Section.Defines),
      checkerFile(),
      when(ctx -> ctx.check().kind == CheckKind.Cover, text("", "[file cover_stmts.vh]", "@cover@")),
      assumeFile()));

  public static SbyTemplate forKind(CheckKind kind) { return kind.isInstructionFamily() ? Instruction : Consistency; }

  private static Fragment options(String modePlaceholder) {
    return text("[options]",
                "mode " + modePlaceholder,
                "expect pass,fail",
                "append @append@",
                "depth @depth_plus@",
                "skip @skip@",
                "",
                "[engines]",
                "@engine@",
                "",
                "[script]");
  }

  private static Fragment scriptSection() {
    Fragment readFiles = (ctx, out) -> {
      List<String> svFiles = new ArrayList<>();
      svFiles.add(ctx.check().name + ".sv");
      svFiles.addAll(ctx.placeholders().hookLines(ctx.config().lines(Section.VerilogFiles)));
      out.add("read -sv " + String.join(" ", svFiles));
      List<String> vhdlFiles = ctx.placeholders().hookLines(ctx.config().lines(Section.VhdlFiles));
      if (!vhdlFiles.isEmpty())
        out.add("read -vhdl " + String.join(" ", vhdlFiles));
    };
    return (ctx, out) -> {
      for (Fragment fragment : List.of(hook(Section.ScriptDefines), checkerHook(Section.ScriptDefines), readFiles, hook(Section.ScriptSources),
                                       text("prep -flatten -nordff -top rvfi_testbench"), hook(Section.ScriptLink)))
        fragment.appendTo(ctx, out);
    };
  }

  private static Fragment filesSection() {
    return text("chformal -early",
                "",
                "[files]",
                "@basedir@/checks/rvfi_macros.vh",
                "@basedir@/checks/rvfi_channel.sv",
                "@basedir@/checks/rvfi_testbench.sv",
                "@basedir@/checks/rvfi_@check@_check.sv");
  }

  private static Fragment modeDefines() {
    return (ctx, out) -> {
      if (ctx.assumeStatements().isPresent())
        out.add("`define RISCV_FORMAL_ASSUME");
      if (ctx.solverCfg().mode == ProofMode.Prove)
        out.add("`define RISCV_FORMAL_UNBOUNDED");
    };
  }

  private static Fragment csrDefines() {
    return computed(ctx -> ctx.check().csrs.stream().map(csr -> "`define RISCV_FORMAL_CSR_" + csr.toUpperCase()).collect(Collectors.toList()));
  }

  private static Fragment customCsrDefines() {
    return when(ctx -> !ctx.isaCfg().customCsrs.isEmpty(), computed(ctx -> CustomCsrMacros.lines(ctx.isaCfg().customCsrs)));
  }

  private static Fragment checkerFile() {
    return text("`include \"rvfi_macros.vh\"",
                "",
                "[file @checkch@.sv]",
                "`include \"defines.sv\"",
                "`include \"rvfi_channel.sv\"",
                "`include \"rvfi_testbench.sv\"",
                "`include \"rvfi_@check@_check.sv\"");
  }

  private static Fragment assumeFile() {
    return when(ctx -> ctx.assumeStatements().isPresent(), text("", "[file assume_stmts.vh]"),
                computed(ctx -> ctx.assumeStatements().linesFor(ctx.check().name)));
  }

  private static boolean isWideCounterWrite(SbyTemplate.RenderContext ctx) {
    return ctx.check().target.filter(target -> target instanceof CheckTarget.CsrWrite)
        .map(target -> ((CheckTarget.CsrWrite)target).isWideCounter())
        .orElse(false);
  }

  private static List<String> illegalAccessDefines(SbyTemplate.RenderContext ctx) {
    IllegalCsr csr = ((CheckTarget.IllegalAccess)ctx.check().target.get()).csr();
    List<String> ret = new ArrayList<>();
    if (csr.levels().contains("m"))
      ret.add("`define RISCV_FORMAL_ILL_MMODE");
    if (csr.levels().contains("s"))
      ret.add("`define RISCV_FORMAL_ILL_SMODE");
    if (csr.levels().contains("u"))
      ret.add("`define RISCV_FORMAL_ILL_UMODE");
    if (csr.access().contains("r"))
      ret.add("`define RISCV_FORMAL_ILL_READ");
    if (csr.access().contains("w"))
      ret.add("`define RISCV_FORMAL_ILL_WRITE");
    return ret;
  }

  private static List<String> csrTestDefines(SbyTemplate.RenderContext ctx) {
    if (ctx.check().csrTest().isEmpty())
      return List.of();
    CsrTest test = ctx.check().csrTest().get();
    List<String> ret = new ArrayList<>();
    test.constval().ifPresent(value -> ret.add("`define RISCV_FORMAL_CSRC_CONSTVAL " + value));
    test.hpmevent().ifPresent(value -> ret.add("`define RISCV_FORMAL_CSRC_HPMEVENT " + value));
    test.hpmcounter().ifPresent(value -> ret.add("`define RISCV_FORMAL_CSRC_HPMCOUNTER " + value));
    test.mask().ifPresent(value -> ret.add("`define RISCV_FORMAL_CSRC_MASK " + value));
    ret.add("`define RISCV_FORMAL_CSRC_NAME " + test.csr());
    return ret;
  }
}
