package basic.cfg.build;

import basic.ast.Program;
import basic.ast.Routine;
import basic.cfg.CfgError;
import basic.cfg.ControlFlowGraph;
import basic.cfg.ProgramCfg;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the main program and every routine, in declaration order, each from scratch. A routine
 * that fails is reported in {@link ProgramCfg#errors} and the others are still built, so that all
 * errors of a program show up in one run.
 */
public class ProgramCfgBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger("ProgramCfgBuilder");

  private ProgramCfgBuilder() {}

  public static ProgramCfg build(Program program, CfgOptions options) {
    CfgBuilder builder = new CfgBuilder(options);
    List<CfgError> errors = new ArrayList<>();
    ControlFlowGraph main = null;
    try {
      main = builder.buildMain(program);
    } catch (CfgError e) {
      LOGGER.warn(e.getMessage());
      errors.add(e);
    }
    SortedMap<String, ControlFlowGraph> routines = new TreeMap<>();
    for (Routine routine : program.routines) {
      try {
        routines.put(routine.name, builder.build(routine));
      } catch (CfgError e) {
        LOGGER.warn(e.getMessage());
        errors.add(e);
      }
    }
    return new ProgramCfg(main, routines, errors);
  }
}
