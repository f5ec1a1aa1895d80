package basic.cfg;

import basic.ast.JumpTarget;
import basic.util.SourceRange;

/** A GOTO, GOSUB, ON ... GOTO/GOSUB or RETURN names a line or label the routine doesn't have. */
public class UnresolvedLabelError extends CfgError {
  public final JumpTarget target;

  public UnresolvedLabelError(String routine, SourceRange range, JumpTarget target) {
    super(routine, range, "Undefined line number or label " + target);
    this.target = target;
  }
}
