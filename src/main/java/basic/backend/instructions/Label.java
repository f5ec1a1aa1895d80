package basic.backend.instructions;

public class Label extends Instruction {
  public final String label;

  public Label(String label) {
    this.label = label;
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return label;
  }
}
