package basic.cfg;

import basic.BasicError;
import basic.util.SourceRange;
import java.util.List;

/**
 * A fatal error while building the control flow graph of one routine. The other routines of the
 * program are still built.
 */
public abstract class CfgError extends BasicError {
  public final String routine;
  public final SourceRange range;

  CfgError(String routine, SourceRange range, String message) {
    super(String.format("CFG error in %s at %s: %s", routine, range, message));
    this.routine = routine;
    this.range = range;
  }

  @Override
  public String getSourceReferencingMessage(List<String> sourceFile) {
    return getMessage()
        + System.lineSeparator()
        + System.lineSeparator()
        + range.annotateSourceFileExcerpt(sourceFile);
  }
}
