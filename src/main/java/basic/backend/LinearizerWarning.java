package basic.backend;

/** A non-fatal finding of the {@link Linearizer}. Emission always continues. */
public abstract class LinearizerWarning {
  public final String routine;
  public final int block;

  LinearizerWarning(String routine, int block) {
    this.routine = routine;
    this.block = block;
  }

  public abstract String getMessage();

  @Override
  public String toString() {
    return getMessage();
  }
}
