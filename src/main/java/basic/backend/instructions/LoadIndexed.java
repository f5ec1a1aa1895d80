package basic.backend.instructions;

import basic.backend.operands.Global;
import basic.backend.operands.Operand;
import basic.backend.operands.Temp;

/** Loads the word at {@code base + 4 * index}. */
public class LoadIndexed extends Instruction {
  public final Temp target;
  public final Global base;
  public final Operand index;

  public LoadIndexed(Temp target, Global base, Operand index) {
    this.target = target;
    this.base = base;
    this.index = index;
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "LoadIndexed(" + base + "[" + index + "]) -> " + target;
  }
}
