package basic.backend.operands;

import java.util.function.Function;

/** A pseudo-register, assigned exactly once within its function. See {@link TempSupply}. */
public class Temp extends Operand {
  public final int id;

  Temp(int id) {
    this.id = id;
  }

  @Override
  public <T> T match(
      Function<Immediate, T> matchImm,
      Function<Temp, T> matchTemp,
      Function<Slot, T> matchSlot,
      Function<Global, T> matchGlobal) {
    return matchTemp.apply(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return id == ((Temp) o).id;
  }

  @Override
  public int hashCode() {
    return id;
  }

  @Override
  public String toString() {
    return "%t" + id;
  }
}
