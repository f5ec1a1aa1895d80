package basic.util;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import java.util.List;

/**
 * A half-open interval in the BASIC source, denoting the extent of a statement or expression.
 * {@code end} is one beyond the last character.
 */
public class SourceRange {
  public static final SourceRange FIRST_CHAR = new SourceRange(SourcePosition.BEGIN_OF_PROGRAM, 1);
  public final SourcePosition begin;
  public final SourcePosition end; // exclusive!

  public SourceRange(SourcePosition begin, SourcePosition end) {
    this.begin = checkNotNull(begin);
    this.end = checkNotNull(end);
    checkArgument(begin.compareTo(end) < 0, "SourceRange ends before it begins");
  }

  public SourceRange(SourcePosition begin, int length) {
    this(begin, begin.moveHorizontal(length));
  }

  /** A range covering the whole of {@code line}, {@code length} characters wide. */
  public static SourceRange ofLine(int line, int length) {
    return new SourceRange(new SourcePosition(line, 0), Math.max(1, length));
  }

  /**
   * Renders the lines covered by this range, squiggling the range itself when it fits on one
   * line. Lines outside of {@code sourceFile} are skipped.
   */
  public String annotateSourceFileExcerpt(List<String> sourceFile) {
    StringBuilder sb = new StringBuilder();
    if (sourceFile.isEmpty()) {
      return "";
    }
    int first = Math.max(begin.line, 1);
    int last = Math.min(end.line, sourceFile.size());
    if (first > last) {
      return "";
    }
    if (begin.line < end.line) {
      int digits = String.valueOf(last).length();
      for (int i = first; i <= last; ++i) {
        sb.append(String.format("%" + digits + "d|> %s", i, sourceFile.get(i - 1)));
        sb.append(System.lineSeparator());
      }
      return sb.toString();
    }
    String prefix = String.format("%d| ", begin.line);
    sb.append(prefix).append(sourceFile.get(begin.line - 1)).append(System.lineSeparator());
    sb.append(Strings.repeat(" ", prefix.length() + begin.column));
    sb.append(Strings.repeat("^", end.column - begin.column));
    sb.append(System.lineSeparator());
    return sb.toString();
  }

  @Override
  public String toString() {
    return String.format("%s-%s", begin, end);
  }
}
