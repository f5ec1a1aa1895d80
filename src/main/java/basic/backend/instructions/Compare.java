package basic.backend.instructions;

import basic.backend.operands.Operand;
import basic.backend.operands.Temp;

/** Sets {@link #target} to 1 if {@code left relation right} holds, to 0 otherwise. */
public class Compare extends Instruction {
  public final Temp target;
  public final Relation relation;
  public final Operand left;
  public final Operand right;

  public Compare(Temp target, Relation relation, Operand left, Operand right) {
    this.target = target;
    this.relation = relation;
    this.left = left;
    this.right = right;
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "Compare(" + left + " " + relation + " " + right + ") -> " + target;
  }
}
