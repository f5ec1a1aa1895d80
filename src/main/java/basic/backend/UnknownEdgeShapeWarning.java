package basic.backend;

/**
 * The outgoing edges of a block matched no terminator pattern. The block was emitted with a jump
 * along its first edge instead.
 */
public class UnknownEdgeShapeWarning extends LinearizerWarning {
  public final String reason;

  public UnknownEdgeShapeWarning(String routine, int block, String reason) {
    super(routine, block);
    this.reason = reason;
  }

  @Override
  public String getMessage() {
    return String.format(
        "%s: unknown edge shape at bb%d (%s), jumping along the first edge",
        routine, block, reason);
  }
}
