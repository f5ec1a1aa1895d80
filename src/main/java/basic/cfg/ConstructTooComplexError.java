package basic.cfg;

import basic.util.SourceRange;

public class ConstructTooComplexError extends CfgError {
  public final int maxDepth;

  public ConstructTooComplexError(String routine, SourceRange range, int maxDepth) {
    super(
        routine,
        range,
        String.format("Control constructs are nested deeper than %d levels", maxDepth));
    this.maxDepth = maxDepth;
  }
}
