package basic;

import java.util.List;

/** Base class of the errors reported while compiling a program. */
public class BasicError extends RuntimeException {

  public BasicError(String message) {
    super(message);
  }

  /** The message, followed by an excerpt of {@code sourceFile} if the error points into it. */
  public String getSourceReferencingMessage(List<String> sourceFile) {
    return getMessage();
  }
}
