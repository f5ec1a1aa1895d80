package basic.backend.instructions;

import basic.backend.operands.Operand;
import basic.backend.operands.Temp;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** Calls a function of the BASIC runtime library. */
public class RuntimeCall extends Instruction {
  public static final String TRY_ENTER = "basic_try_enter";
  public static final String TRY_LEAVE = "basic_try_leave";
  public static final String ERR_SET = "basic_err_set";
  public static final String ERR_CODE = "basic_err_code";
  public static final String ERR_CLEAR = "basic_err_clear";
  public static final String ERR_PENDING = "basic_err_pending";
  public static final String END = "basic_end";

  public final Optional<Temp> target;
  public final String function;
  public final ImmutableList<Operand> arguments;

  public RuntimeCall(@Nullable Temp target, String function, List<Operand> arguments) {
    this.target = Optional.ofNullable(target);
    this.function = function;
    this.arguments = ImmutableList.copyOf(arguments);
  }

  public static RuntimeCall of(String function, Operand... arguments) {
    return new RuntimeCall(null, function, ImmutableList.copyOf(arguments));
  }

  public static RuntimeCall returning(Temp target, String function) {
    return new RuntimeCall(target, function, ImmutableList.of());
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    String call = "RuntimeCall(" + function + "(" + Joiner.on(", ").join(arguments) + "))";
    return target.map(t -> call + " -> " + t).orElse(call);
  }
}
