package basic.backend.operands;

import java.util.Objects;
import java.util.function.Function;

/** The address of a module level data declaration. */
public class Global extends Operand {
  public static final Global RETURN_STACK = new Global("return_stack");
  public static final Global RETURN_SP = new Global("return_sp");

  public final String name;

  public Global(String name) {
    this.name = name;
  }

  @Override
  public <T> T match(
      Function<Immediate, T> matchImm,
      Function<Temp, T> matchTemp,
      Function<Slot, T> matchSlot,
      Function<Global, T> matchGlobal) {
    return matchGlobal.apply(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return name.equals(((Global) o).name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name);
  }

  @Override
  public String toString() {
    return "$" + name;
  }
}
