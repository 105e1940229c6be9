package rvfchecks.solver;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Data-Class to hold solver and sby options.
 */
public class SolverConfig {

  public String solver = "boolector";
  public boolean dumpsmt2 = false;
  public boolean abspath = false;
  public boolean blackbox = false;
  public String sbycmd = "sby";
  public ProofMode mode = ProofMode.Bmc;

  /** Configuration groups in declaration order. The unnamed default group is always first. */
  public List<Optional<String>> groups = new ArrayList<>(List.of(Optional.empty()));

  /** Engine line for the [engines] section of each descriptor. */
  public String engine() {
    switch (solver) {
    case "bmc3":
      return "abc bmc3";
    case "btormc":
      return "btor btormc";
    default:
      return "smtbmc " + (dumpsmt2 ? "--dumpsmt2 " : "") + solver;
    }
  }

  /** Name of the ilang netlist the selected engine works on. */
  public String ilangFile(String corename) { return corename + (solver.equals("bmc3") ? "-gates.il" : "-hier.il"); }
}
