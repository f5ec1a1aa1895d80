package basic.cfg;

import basic.ast.Program;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * The graphs of a whole program: the main program and one per SUB or FUNCTION, plus the errors of
 * the routines that failed to build. A routine that failed has no graph.
 */
public class ProgramCfg {
  public final Optional<ControlFlowGraph> main;
  /** Keyed and iterated by routine name. */
  public final ImmutableSortedMap<String, ControlFlowGraph> routines;

  public final ImmutableList<CfgError> errors;

  public ProgramCfg(
      @Nullable ControlFlowGraph main,
      Map<String, ControlFlowGraph> routines,
      List<CfgError> errors) {
    this.main = Optional.ofNullable(main);
    this.routines = ImmutableSortedMap.copyOf(routines);
    this.errors = ImmutableList.copyOf(errors);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /** The main program first, then the routines by name. */
  public ImmutableList<ControlFlowGraph> all() {
    ImmutableList.Builder<ControlFlowGraph> all = ImmutableList.builder();
    main.ifPresent(all::add);
    return all.addAll(routines.values()).build();
  }

  public Optional<ControlFlowGraph> graphOf(String routine) {
    if (routine.equals(Program.MAIN)) {
      return main;
    }
    return Optional.ofNullable(routines.get(routine));
  }
}
