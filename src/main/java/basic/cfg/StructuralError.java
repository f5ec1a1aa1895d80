package basic.cfg;

import basic.util.SourceRange;

/** Wiring that violates the edge shape rules. Valid input never produces one. */
public class StructuralError extends CfgError {

  public StructuralError(String routine, SourceRange range, String message) {
    super(routine, range, message);
  }
}
