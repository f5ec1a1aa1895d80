package basic.backend;

import basic.backend.instructions.Instruction;
import basic.cfg.ControlFlowGraph;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** The linear code of one routine. */
public class IlFunction {
  public final String name;
  public final ControlFlowGraph.Kind kind;
  public final ImmutableList<Instruction> instructions;

  public IlFunction(String name, ControlFlowGraph.Kind kind, List<Instruction> instructions) {
    this.name = name;
    this.kind = kind;
    this.instructions = ImmutableList.copyOf(instructions);
  }

  /** The name the function is exported under. */
  public String symbol() {
    return kind == ControlFlowGraph.Kind.MAIN ? "main" : "basic_" + name;
  }

  public boolean returnsValue() {
    return kind != ControlFlowGraph.Kind.SUB;
  }

  @Override
  public String toString() {
    return "IlFunction " + name + " (" + instructions.size() + " instructions)";
  }
}
