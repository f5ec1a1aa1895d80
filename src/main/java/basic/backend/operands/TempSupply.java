package basic.backend.operands;

/** Hands out fresh {@link Temp}s. One instance per emitted function. */
public class TempSupply {
  private int next = 0;

  public Temp next() {
    return new Temp(next++);
  }
}
