package basic.backend.instructions;

import basic.backend.operands.Operand;

public class Store extends Instruction {
  public final Operand value;
  public final Operand address;

  public Store(Operand value, Operand address) {
    this.value = value;
    this.address = address;
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "Store(" + value + ", " + address + ")";
  }
}
