package basic.backend.instructions;

public class Jump extends Instruction {
  public final String label;

  public Jump(String label) {
    this.label = label;
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "Jump(" + label + ")";
  }
}
