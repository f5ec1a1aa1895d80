package basic.ast;

/** The enclosing constructs an {@code EXIT} or {@code CONTINUE} statement can name. */
public enum Construct {
  FOR,
  WHILE,
  DO,
  SELECT,
  SUB,
  FUNCTION;

  public boolean isLoop() {
    return this == FOR || this == WHILE || this == DO;
  }

  public boolean isRoutine() {
    return this == SUB || this == FUNCTION;
  }
}
