package basic.cfg.build;

import basic.ast.Statement;
import java.util.Objects;

/**
 * The body or the CATCH clauses of a TRY. Control can't leave either of them for a block outside
 * the TRY without passing its FINALLY. The FINALLY itself belongs to the enclosing part.
 */
final class TryPart {
  final Statement.Try statement;
  final boolean isHandler;

  private TryPart(Statement.Try statement, boolean isHandler) {
    this.statement = statement;
    this.isHandler = isHandler;
  }

  static TryPart body(Statement.Try statement) {
    return new TryPart(statement, false);
  }

  static TryPart handlers(Statement.Try statement) {
    return new TryPart(statement, true);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    TryPart that = (TryPart) o;
    return statement == that.statement && isHandler == that.isHandler;
  }

  @Override
  public int hashCode() {
    return Objects.hash(System.identityHashCode(statement), isHandler);
  }

  @Override
  public String toString() {
    return (isHandler ? "CATCH of " : "TRY body at ") + statement.range();
  }
}
