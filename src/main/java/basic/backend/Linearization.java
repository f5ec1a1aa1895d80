package basic.backend;

import basic.backend.instructions.Instruction;
import basic.cfg.ControlFlowGraph;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;

/** The result of linearizing one {@link ControlFlowGraph}. */
public class Linearization {
  public final ControlFlowGraph graph;
  public final IlFunction function;
  /** Every block of the graph, reachable or not. */
  public final ImmutableList<Integer> emissionOrder;
  /** Blocks reachable from the entry along static edges. Informational only. */
  public final ImmutableSortedSet<Integer> reachable;
  public final ImmutableList<LinearizerWarning> warnings;

  private final ImmutableListMultimap<Integer, Instruction> byBlock;

  Linearization(
      ControlFlowGraph graph,
      IlFunction function,
      List<Integer> emissionOrder,
      ImmutableSortedSet<Integer> reachable,
      List<LinearizerWarning> warnings,
      ImmutableListMultimap<Integer, Instruction> byBlock) {
    this.graph = graph;
    this.function = function;
    this.emissionOrder = ImmutableList.copyOf(emissionOrder);
    this.reachable = reachable;
    this.warnings = ImmutableList.copyOf(warnings);
    this.byBlock = byBlock;
  }

  /** The instructions emitted for {@code block}, starting with its label. */
  public ImmutableList<Instruction> instructionsOf(int block) {
    return byBlock.get(block);
  }
}
