package basic.backend.operands;

import java.util.function.Function;

/** Operand of an IL instruction. */
public abstract class Operand {

  Operand() {}

  public abstract <T> T match(
      Function<Immediate, T> matchImm,
      Function<Temp, T> matchTemp,
      Function<Slot, T> matchSlot,
      Function<Global, T> matchGlobal);
}
