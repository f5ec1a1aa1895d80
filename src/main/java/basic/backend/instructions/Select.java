package basic.backend.instructions;

import basic.backend.operands.Operand;
import basic.backend.operands.Temp;

/** {@code target = condition != 0 ? ifTrue : ifFalse}, without branching. */
public class Select extends Instruction {
  public final Temp target;
  public final Operand condition;
  public final Operand ifTrue;
  public final Operand ifFalse;

  public Select(Temp target, Operand condition, Operand ifTrue, Operand ifFalse) {
    this.target = target;
    this.condition = condition;
    this.ifTrue = ifTrue;
    this.ifFalse = ifFalse;
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "Select(" + condition + " ? " + ifTrue + " : " + ifFalse + ") -> " + target;
  }
}
