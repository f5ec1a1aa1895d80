package basic.backend.instructions;

import basic.backend.operands.Global;
import basic.backend.operands.Operand;

/** Stores a word at {@code base + 4 * index}. */
public class StoreIndexed extends Instruction {
  public final Operand value;
  public final Global base;
  public final Operand index;

  public StoreIndexed(Operand value, Global base, Operand index) {
    this.value = value;
    this.base = base;
    this.index = index;
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "StoreIndexed(" + value + ", " + base + "[" + index + "])";
  }
}
