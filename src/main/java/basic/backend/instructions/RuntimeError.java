package basic.backend.instructions;

/**
 * Reports a fatal run time error and stops the program. Control never continues after this
 * instruction.
 */
public class RuntimeError extends Instruction {
  public static final String FUNCTION = "basic_runtime_error";

  public final Kind kind;

  public RuntimeError(Kind kind) {
    this.kind = kind;
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "RuntimeError(" + kind + ")";
  }

  public enum Kind {
    GOSUB_STACK_OVERFLOW(1),
    RETURN_WITHOUT_GOSUB(2),
    /** A RETURN popped a value that is none of the routine's return sites. */
    DISPATCH_MISS(3),
    UNHANDLED_EXCEPTION(4);

    public final int code;

    Kind(int code) {
      this.code = code;
    }
  }
}
