package basic.ast;

import static com.google.common.base.Preconditions.checkArgument;

import basic.util.SourceRange;
import java.util.List;

/** A {@code SUB} or {@code FUNCTION} declaration. Its labels and line numbers are its own. */
public class Routine extends Node {
  public final Construct kind;
  public final String name;
  public final List<String> parameters;
  public final List<Statement> body;

  public Routine(
      Construct kind,
      String name,
      List<String> parameters,
      List<Statement> body,
      SourceRange range) {
    super(range);
    checkArgument(kind.isRoutine(), "A routine is a SUB or a FUNCTION, got %s", kind);
    this.kind = kind;
    this.name = name;
    this.parameters = parameters;
    this.body = body;
  }

  public boolean isFunction() {
    return kind == Construct.FUNCTION;
  }

  @Override
  public String toString() {
    return kind + " " + name;
  }
}
