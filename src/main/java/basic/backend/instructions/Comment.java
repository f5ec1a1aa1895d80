package basic.backend.instructions;

public class Comment extends Instruction {
  public final String text;

  public Comment(String text) {
    this.text = text;
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }
}
