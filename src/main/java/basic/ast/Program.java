package basic.ast;

import basic.util.SourceRange;
import java.util.List;

/** The main statement list followed by the SUB and FUNCTION declarations, as parsed. */
public class Program extends Node {
  /** The routine name under which the main program is reported. */
  public static final String MAIN = "main";

  public final List<Statement> main;
  public final List<Routine> routines;

  public Program(List<Statement> main, List<Routine> routines, SourceRange range) {
    super(range);
    this.main = main;
    this.routines = routines;
  }
}
