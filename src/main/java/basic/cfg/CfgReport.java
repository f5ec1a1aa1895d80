package basic.cfg;

import basic.ast.Statement;
import basic.util.PrettyPrinter;
import com.google.common.base.Joiner;

/**
 * Renders a human readable summary of a {@link ControlFlowGraph}, used for debugging and golden
 * output tests. Nothing in here is stored; everything is read off the graph.
 */
public class CfgReport {
  private static final String NL = System.lineSeparator();
  private static final Joiner COMMA = Joiner.on(", ");

  private CfgReport() {}

  public static String render(ControlFlowGraph graph) {
    StringBuilder sb = new StringBuilder();
    sb.append("CFG ").append(graph.name).append(" [").append(graph.kind).append("]").append(NL);
    sb.append("  blocks: ").append(graph.blocks.size()).append(NL);
    sb.append("  edges: ").append(graph.edges.size()).append(NL);
    sb.append("  entry: ").append(graph.entryBlock).append(NL);
    sb.append("  loop headers: [").append(COMMA.join(graph.loopHeaders())).append("]").append(NL);
    sb.append("  gosub return sites: [")
        .append(COMMA.join(graph.gosubReturnBlocks))
        .append("]")
        .append(NL);
    for (BasicBlock block : graph.blocks) {
      sb.append(NL).append(block);
      if (block.isLoopHeader) {
        sb.append(" loop-header");
      }
      sb.append(NL);
      sb.append("  preds: [").append(COMMA.join(block.predecessors)).append("]").append(NL);
      sb.append("  succs: [").append(COMMA.join(block.successors)).append("]").append(NL);
      for (Statement statement : block.statements) {
        sb.append("  | ").append(PrettyPrinter.header(statement)).append(NL);
      }
      for (CFGEdge edge : graph.outgoing(block.id)) {
        sb.append("  ").append(edge).append(NL);
      }
    }
    return sb.toString();
  }

  public static String render(ProgramCfg program) {
    StringBuilder sb = new StringBuilder();
    for (ControlFlowGraph graph : program.all()) {
      sb.append(render(graph)).append(NL);
    }
    for (CfgError error : program.errors) {
      sb.append("error: ").append(error.getMessage()).append(NL);
    }
    return sb.toString();
  }
}
