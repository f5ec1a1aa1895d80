package basic.ast;

public enum UnOp {
  NEGATE("-"),
  NOT("NOT ");

  public final String string;

  UnOp(String string) {
    this.string = string;
  }
}
