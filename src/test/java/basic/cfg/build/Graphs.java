package basic.cfg.build;

import static org.jooq.lambda.Seq.seq;

import basic.ast.Program;
import basic.ast.Statement;
import basic.cfg.ControlFlowGraph;
import java.util.List;

/** Helpers to look at built graphs in assertions. */
class Graphs {

  private Graphs() {}

  static ControlFlowGraph build(Statement... main) {
    return new CfgBuilder().buildMain(basic.ast.Ast.program(main));
  }

  static ControlFlowGraph buildKeepingDeadBlocks(Statement... main) {
    Program program = basic.ast.Ast.program(main);
    return new CfgBuilder(CfgOptions.DEFAULT.withEliminateDeadBlocks(false)).buildMain(program);
  }

  static List<String> edges(ControlFlowGraph graph) {
    return seq(graph.edges).map(Object::toString).toList();
  }

  /** {@code bb<id>(<label>)} of every block, in id order. */
  static List<String> blocks(ControlFlowGraph graph) {
    return seq(graph.blocks).map(Object::toString).toList();
  }
}
