package basic.backend.instructions;

import basic.ast.Expression;
import basic.backend.operands.Temp;
import basic.util.PrettyPrinter;

/**
 * Computes the value of a source expression into {@link #target}. How the expression itself is
 * lowered is up to the expression code generator; the linearizer only needs the value.
 */
public class Evaluate extends Instruction {
  public final Temp target;
  public final Expression expression;

  public Evaluate(Temp target, Expression expression) {
    this.target = target;
    this.expression = expression;
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "Evaluate(" + PrettyPrinter.print(expression) + ") -> " + target;
  }
}
