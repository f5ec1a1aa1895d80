package basic.backend.instructions;

import basic.ast.Statement;
import basic.util.PrettyPrinter;

/** Runs a straight-line statement that has no effect on control flow. */
public class Execute extends Instruction {
  public final Statement statement;

  public Execute(Statement statement) {
    this.statement = statement;
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "Execute(" + PrettyPrinter.header(statement) + ")";
  }
}
