package basic.backend.operands;

import java.util.function.Function;

/** Constant operand. */
public class Immediate extends Operand {
  public final long value;

  public Immediate(long value) {
    this.value = value;
  }

  @Override
  public <T> T match(
      Function<Immediate, T> matchImm,
      Function<Temp, T> matchTemp,
      Function<Slot, T> matchSlot,
      Function<Global, T> matchGlobal) {
    return matchImm.apply(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return value == ((Immediate) o).value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    return Long.toString(value);
  }
}
