package basic.backend.syntax;

import basic.backend.IlFunction;
import basic.backend.IlModule;
import basic.backend.instructions.Allocate;
import basic.backend.instructions.Arith;
import basic.backend.instructions.Branch;
import basic.backend.instructions.Comment;
import basic.backend.instructions.Compare;
import basic.backend.instructions.Evaluate;
import basic.backend.instructions.Execute;
import basic.backend.instructions.Instruction;
import basic.backend.instructions.Jump;
import basic.backend.instructions.Label;
import basic.backend.instructions.Load;
import basic.backend.instructions.LoadIndexed;
import basic.backend.instructions.Ret;
import basic.backend.instructions.RuntimeCall;
import basic.backend.instructions.RuntimeError;
import basic.backend.instructions.Select;
import basic.backend.instructions.Store;
import basic.backend.instructions.StoreIndexed;
import basic.backend.instructions.ZeroInit;
import basic.backend.operands.Global;
import basic.backend.operands.Operand;
import basic.util.PrettyPrinter;
import com.google.common.base.Joiner;

/**
 * Prints instructions in a textual, QBE-like syntax. Expressions and straight-line statements are
 * not lowered here; they are printed as {@code eval} and {@code exec} pseudo instructions for the
 * code generator further down the pipeline.
 */
public class IlSyntax implements Instruction.Visitor {
  private final StringBuilder builder;

  private IlSyntax(StringBuilder builder) {
    this.builder = builder;
  }

  public static String formatModule(IlModule module) {
    StringBuilder builder = new StringBuilder();
    builder.append("data ").append(Global.RETURN_STACK);
    builder.append(" = { z ").append(4 * module.returnStackCapacity).append(" }");
    builder.append(System.lineSeparator());
    builder.append("data ").append(Global.RETURN_SP).append(" = { l 0 }");
    builder.append(System.lineSeparator());
    for (IlFunction function : module.functions) {
      builder.append(System.lineSeparator());
      builder.append(formatFunction(function));
    }
    return builder.toString();
  }

  public static String formatFunction(IlFunction function) {
    StringBuilder builder = new StringBuilder();
    builder.append("export function ");
    if (function.returnsValue()) {
      builder.append("l ");
    }
    builder.append("$").append(function.symbol()).append("() {");
    builder.append(System.lineSeparator());
    IlSyntax syntax = new IlSyntax(builder);
    for (Instruction instruction : function.instructions) {
      instruction.accept(syntax);
    }
    builder.append("}").append(System.lineSeparator());
    return builder.toString();
  }

  public static String formatInstruction(Instruction instruction) {
    StringBuilder builder = new StringBuilder();
    instruction.accept(new IlSyntax(builder));
    return builder.toString().trim();
  }

  private void indent() {
    builder.append("    ");
  }

  private void appendLine() {
    builder.append(System.lineSeparator());
  }

  private void assign(Operand target, String ilClass, String mnemonic) {
    indent();
    builder.append(target).append(" =").append(ilClass).append(" ").append(mnemonic).append(" ");
  }

  @Override
  public void visit(Label label) {
    builder.append(label.label);
    appendLine();
  }

  @Override
  public void visit(Comment comment) {
    indent();
    builder.append("# ").append(comment.text);
    appendLine();
  }

  @Override
  public void visit(Allocate allocate) {
    int size = allocate.size();
    assign(allocate.slot, "l", "alloc" + size);
    builder.append(size);
    appendLine();
  }

  @Override
  public void visit(ZeroInit zeroInit) {
    indent();
    String ilClass = zeroInit.type.ilClass;
    builder.append("store").append(ilClass).append(" ");
    switch (ilClass) {
      case "s":
        builder.append("s_0");
        break;
      case "d":
        builder.append("d_0");
        break;
      default:
        builder.append("0");
    }
    builder.append(", ").append(zeroInit.slot);
    appendLine();
  }

  @Override
  public void visit(Evaluate evaluate) {
    assign(evaluate.target, "l", "eval");
    builder.append("\"").append(PrettyPrinter.print(evaluate.expression)).append("\"");
    appendLine();
  }

  @Override
  public void visit(Execute execute) {
    indent();
    builder.append("exec \"").append(PrettyPrinter.header(execute.statement)).append("\"");
    appendLine();
  }

  @Override
  public void visit(Load load) {
    assign(load.target, "l", "loadl");
    builder.append(load.address);
    appendLine();
  }

  @Override
  public void visit(Store store) {
    indent();
    builder.append("storel ").append(store.value).append(", ").append(store.address);
    appendLine();
  }

  @Override
  public void visit(LoadIndexed load) {
    assign(load.target, "w", "loadw");
    builder.append(load.base).append("[").append(load.index).append("]");
    appendLine();
  }

  @Override
  public void visit(StoreIndexed store) {
    indent();
    builder.append("storew ").append(store.value).append(", ");
    builder.append(store.base).append("[").append(store.index).append("]");
    appendLine();
  }

  @Override
  public void visit(Compare compare) {
    assign(compare.target, "w", "c" + compare.relation.mnemonic + "l");
    builder.append(compare.left).append(", ").append(compare.right);
    appendLine();
  }

  @Override
  public void visit(Arith arith) {
    assign(arith.target, "l", arith.op.mnemonic);
    builder.append(arith.left).append(", ").append(arith.right);
    appendLine();
  }

  @Override
  public void visit(Select select) {
    assign(select.target, "l", "sel");
    builder.append(select.condition).append(", ");
    builder.append(select.ifTrue).append(", ").append(select.ifFalse);
    appendLine();
  }

  @Override
  public void visit(Jump jump) {
    indent();
    builder.append("jmp ").append(jump.label);
    appendLine();
  }

  @Override
  public void visit(Branch branch) {
    indent();
    builder.append("jnz ").append(branch.condition).append(", ");
    builder.append(branch.ifNonZero).append(", ").append(branch.ifZero);
    appendLine();
  }

  @Override
  public void visit(RuntimeCall call) {
    if (call.target.isPresent()) {
      assign(call.target.get(), "l", "call");
    } else {
      indent();
      builder.append("call ");
    }
    builder.append("$").append(call.function).append("(");
    builder.append(Joiner.on(", ").join(call.arguments.stream().map(a -> "l " + a).iterator()));
    builder.append(")");
    appendLine();
  }

  @Override
  public void visit(RuntimeError error) {
    indent();
    builder.append("call $").append(RuntimeError.FUNCTION);
    builder.append("(w ").append(error.kind.code).append(")");
    appendLine();
    indent();
    builder.append("hlt");
    appendLine();
  }

  @Override
  public void visit(Ret ret) {
    indent();
    builder.append("ret");
    ret.value.ifPresent(v -> builder.append(" ").append(v));
    appendLine();
  }
}
