package basic.backend.instructions;

import basic.backend.operands.Operand;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

public class Ret extends Instruction {
  public final Optional<Operand> value;

  public Ret(@Nullable Operand value) {
    this.value = Optional.ofNullable(value);
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return value.map(v -> "Ret(" + v + ")").orElse("Ret");
  }
}
