package basic.backend.instructions;

import basic.backend.operands.Operand;
import basic.backend.operands.Temp;

public class Load extends Instruction {
  public final Temp target;
  public final Operand address;

  public Load(Temp target, Operand address) {
    this.target = target;
    this.address = address;
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "Load(" + address + ") -> " + target;
  }
}
