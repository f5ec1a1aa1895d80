package basic.backend.instructions;

import basic.backend.operands.Slot;
import basic.semantic.SemanticType;

/** Stores zero, or the null descriptor, into a freshly allocated slot. */
public class ZeroInit extends Instruction {
  public final Slot slot;
  public final SemanticType type;

  public ZeroInit(Slot slot, SemanticType type) {
    this.slot = slot;
    this.type = type;
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "ZeroInit(" + slot + ")";
  }
}
