package basic.backend.instructions;

import basic.backend.operands.Slot;
import basic.semantic.SemanticType;

/** Reserves a stack slot. Only emitted in the entry block of a function. */
public class Allocate extends Instruction {
  public final Slot slot;
  public final SemanticType type;

  public Allocate(Slot slot, SemanticType type) {
    this.slot = slot;
    this.type = type;
  }

  /** Slots are 4 or 8 bytes wide; descriptors and arrays are pointers. */
  public int size() {
    return type.ilClass.equals("w") || type.ilClass.equals("s") ? 4 : 8;
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "Allocate(" + slot + ", " + type + ")";
  }
}
