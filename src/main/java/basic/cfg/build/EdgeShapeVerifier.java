package basic.cfg.build;

import basic.ast.Statement;
import basic.cfg.BasicBlock;
import basic.cfg.ControlFlowGraph;
import basic.cfg.StructuralError;
import basic.util.SourceRange;

/** Checks that the outgoing edges of every block form one of the legal edge shapes. */
class EdgeShapeVerifier {

  private EdgeShapeVerifier() {}

  /**
   * @throws StructuralError for the first block with an illegal shape
   */
  static void verify(ControlFlowGraph graph, SourceRange routineRange) {
    for (BasicBlock block : graph.blocks) {
      if (!graph.shapeOf(block.id).isPresent()) {
        throw new StructuralError(
            graph.name,
            rangeOf(block, routineRange),
            String.format("%s has illegal outgoing edges %s", block, graph.outgoing(block.id)));
      }
    }
  }

  /** The range of the statement that ends {@code block}, for reporting. */
  static SourceRange rangeOf(BasicBlock block, SourceRange fallback) {
    return block.lastStatement().map(Statement::range).orElse(fallback);
  }
}
