package basic.backend.instructions;

import basic.backend.operands.Operand;

/** Jumps to {@link #ifNonZero} if the condition is non-zero, to {@link #ifZero} otherwise. */
public class Branch extends Instruction {
  public final Operand condition;
  public final String ifNonZero;
  public final String ifZero;

  public Branch(Operand condition, String ifNonZero, String ifZero) {
    this.condition = condition;
    this.ifNonZero = ifNonZero;
    this.ifZero = ifZero;
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "Branch(" + condition + ", " + ifNonZero + ", " + ifZero + ")";
  }
}
