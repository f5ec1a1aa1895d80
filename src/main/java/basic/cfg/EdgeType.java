package basic.cfg;

public enum EdgeType {
  FALLTHROUGH("Fallthrough"),
  JUMP("Jump"),
  CONDITIONAL_TRUE("ConditionalTrue"),
  CONDITIONAL_FALSE("ConditionalFalse"),
  /** GOSUB into a landing zone. Always paired with the edge to the return point. */
  CALL("Call"),
  /** A bare RETURN. The target is only known at run time. */
  RETURN("Return"),
  /** Entry of a protected TRY region, taken when an error is raised inside of it. */
  EXCEPTION("Exception");

  public final String displayName;

  EdgeType(String displayName) {
    this.displayName = displayName;
  }

  public boolean isUnconditional() {
    return this == FALLTHROUGH || this == JUMP;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
