package basic.backend.instructions;

import basic.backend.operands.Operand;
import basic.backend.operands.Temp;

public class Arith extends Instruction {
  public final Temp target;
  public final Op op;
  public final Operand left;
  public final Operand right;

  public Arith(Temp target, Op op, Operand left, Operand right) {
    this.target = target;
    this.op = op;
    this.left = left;
    this.right = right;
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "Arith(" + left + " " + op + " " + right + ") -> " + target;
  }

  public enum Op {
    ADD("add"),
    SUB("sub"),
    AND("and"),
    OR("or");

    public final String mnemonic;

    Op(String mnemonic) {
      this.mnemonic = mnemonic;
    }
  }
}
