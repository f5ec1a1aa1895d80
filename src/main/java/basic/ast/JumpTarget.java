package basic.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The destination of a non-structured transfer: either a BASIC line number or an alphanumeric
 * label. Line numbers order before labels, so sorted collections of targets iterate the same way
 * on every run.
 */
public final class JumpTarget implements Comparable<JumpTarget> {
  private final int lineNumber;
  @Nullable private final String label;

  private JumpTarget(int lineNumber, @Nullable String label) {
    this.lineNumber = lineNumber;
    this.label = label;
  }

  public static JumpTarget line(int lineNumber) {
    checkArgument(lineNumber >= 0, "Line numbers are non-negative, got %s", lineNumber);
    return new JumpTarget(lineNumber, null);
  }

  public static JumpTarget label(String label) {
    checkArgument(!checkNotNull(label).isEmpty(), "Labels may not be empty");
    return new JumpTarget(-1, label);
  }

  public boolean isLineNumber() {
    return label == null;
  }

  public int lineNumber() {
    checkArgument(isLineNumber(), "%s is not a line number", this);
    return lineNumber;
  }

  @Override
  public int compareTo(@NotNull JumpTarget other) {
    if (isLineNumber() != other.isLineNumber()) {
      return isLineNumber() ? -1 : 1;
    }
    if (isLineNumber()) {
      return Integer.compare(lineNumber, other.lineNumber);
    }
    return label.compareTo(other.label);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    JumpTarget that = (JumpTarget) o;
    return lineNumber == that.lineNumber && Objects.equals(label, that.label);
  }

  @Override
  public int hashCode() {
    return Objects.hash(lineNumber, label);
  }

  @Override
  public String toString() {
    return isLineNumber() ? Integer.toString(lineNumber) : label;
  }
}
