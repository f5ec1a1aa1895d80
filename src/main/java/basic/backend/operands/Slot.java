package basic.backend.operands;

import java.util.Objects;
import java.util.function.Function;

/**
 * The address of a stack slot of the current function, holding a variable, a hidden loop value
 * or the result of a FUNCTION.
 */
public class Slot extends Operand {
  public final String name;

  public Slot(String name) {
    this.name = name;
  }

  public static Slot ofVariable(String variable) {
    return new Slot("v." + variable);
  }

  @Override
  public <T> T match(
      Function<Immediate, T> matchImm,
      Function<Temp, T> matchTemp,
      Function<Slot, T> matchSlot,
      Function<Global, T> matchGlobal) {
    return matchSlot.apply(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return name.equals(((Slot) o).name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name);
  }

  @Override
  public String toString() {
    return "%" + name;
  }
}
