package basic.cfg.build;

import static org.jooq.lambda.Seq.seq;

import basic.cfg.BasicBlock;
import basic.cfg.CFGEdge;
import basic.cfg.ControlFlowGraph;
import basic.cfg.StructuralError;
import basic.util.SourceRange;
import java.util.List;

/**
 * Checks that loop headers and back edges agree: every loop header is entered by at least one of
 * the back edges the builder wired, and every back edge enters a loop header.
 */
class LoopHeaderVerifier {

  private LoopHeaderVerifier() {}

  static void verify(ControlFlowGraph graph, List<CFGEdge> backEdges, SourceRange routineRange) {
    for (CFGEdge backEdge : backEdges) {
      if (!graph.edges.contains(backEdge) || !graph.block(backEdge.target).isLoopHeader) {
        throw new StructuralError(
            graph.name,
            routineRange,
            String.format("Back edge %s doesn't enter a loop header", backEdge));
      }
    }
    for (BasicBlock header : graph.blocks) {
      if (header.isLoopHeader && seq(backEdges).noneMatch(e -> e.target == header.id)) {
        throw new StructuralError(
            graph.name,
            EdgeShapeVerifier.rangeOf(header, routineRange),
            String.format("Loop header %s has no back edge", header));
      }
    }
  }
}
