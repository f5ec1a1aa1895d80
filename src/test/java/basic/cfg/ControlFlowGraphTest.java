package basic.cfg;

import static basic.ast.Ast.print;
import static basic.ast.Ast.str;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;

import basic.ast.JumpTarget;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import org.junit.Test;

public class ControlFlowGraphTest {

  private static BasicBlock block(int id, String label) {
    return new BasicBlock(id, label, ImmutableList.of(), false);
  }

  /** A WHILE loop around a PRINT, wired by hand. */
  private static ControlFlowGraph loop() {
    List<BasicBlock> blocks =
        ImmutableList.of(
            block(0, Labels.ENTRY),
            new BasicBlock(1, Labels.WHILE_HEADER, ImmutableList.of(), true),
            new BasicBlock(2, Labels.WHILE_BODY, ImmutableList.of(print(str("x"))), false),
            block(3, Labels.WHILE_EXIT));
    List<CFGEdge> edges =
        ImmutableList.of(
            new CFGEdge(0, 1, EdgeType.FALLTHROUGH),
            new CFGEdge(1, 2, EdgeType.CONDITIONAL_TRUE),
            new CFGEdge(1, 3, EdgeType.CONDITIONAL_FALSE),
            new CFGEdge(2, 1, EdgeType.JUMP));
    return ControlFlowGraph.create(
        "main",
        ControlFlowGraph.Kind.MAIN,
        0,
        blocks,
        edges,
        ImmutableSet.of(),
        ImmutableMap.of(JumpTarget.line(10), 2));
  }

  @Test
  public void create_derivesPredecessorsAndSuccessorsFromEdges() throws Exception {
    ControlFlowGraph graph = loop();
    assertThat(graph.block(1).predecessors, contains(0, 2));
    assertThat(graph.block(1).successors, contains(2, 3));
    assertThat(graph.block(3).successors, is(empty()));
    assertThat(graph.block(0).predecessors, is(empty()));
  }

  @Test
  public void outgoing_inWiringOrder() throws Exception {
    ControlFlowGraph graph = loop();
    assertThat(
        graph.outgoing(1),
        contains(
            new CFGEdge(1, 2, EdgeType.CONDITIONAL_TRUE),
            new CFGEdge(1, 3, EdgeType.CONDITIONAL_FALSE)));
    assertThat(graph.incoming(1).size(), is(2));
  }

  @Test
  public void loopHeadersAndLandingZones() throws Exception {
    ControlFlowGraph graph = loop();
    assertThat(graph.loopHeaders(), contains(1));
    assertThat(graph.landingZones(), contains(2));
  }

  @Test
  public void returnEdges_haveNoSuccessor() throws Exception {
    ControlFlowGraph graph =
        ControlFlowGraph.create(
            "main",
            ControlFlowGraph.Kind.MAIN,
            0,
            ImmutableList.of(block(0, Labels.ENTRY)),
            ImmutableList.of(CFGEdge.returnFrom(0)),
            ImmutableSet.of(),
            ImmutableMap.of());
    assertThat(graph.block(0).successors, is(empty()));
    assertThat(graph.shapeOf(0).get(), instanceOf(EdgeShape.Return.class));
  }

  @Test(expected = IllegalArgumentException.class)
  public void create_edgeToUnknownBlock_throws() throws Exception {
    ControlFlowGraph.create(
        "main",
        ControlFlowGraph.Kind.MAIN,
        0,
        ImmutableList.of(block(0, Labels.ENTRY)),
        ImmutableList.of(new CFGEdge(0, 7, EdgeType.JUMP)),
        ImmutableSet.of(),
        ImmutableMap.of());
  }

  @Test(expected = IllegalArgumentException.class)
  public void create_duplicateBlockIds_throws() throws Exception {
    ControlFlowGraph.create(
        "main",
        ControlFlowGraph.Kind.MAIN,
        0,
        ImmutableList.of(block(0, Labels.ENTRY), block(0, Labels.UNREACHABLE)),
        ImmutableList.of(),
        ImmutableSet.of(),
        ImmutableMap.of());
  }

  @Test(expected = IllegalArgumentException.class)
  public void returnEdgeWithStaticTarget_throws() throws Exception {
    new CFGEdge(0, 1, EdgeType.RETURN);
  }

  @Test
  public void withBlocksAndEdges_keepsNameKindAndEntry() throws Exception {
    ControlFlowGraph graph = loop();
    ControlFlowGraph smaller =
        graph.withBlocksAndEdges(
            ImmutableList.of(graph.block(0)), ImmutableList.of(), ImmutableSet.of());
    assertThat(smaller.name, is("main"));
    assertThat(smaller.entryBlock, is(0));
    assertThat(smaller.blocks.size(), is(1));
    assertThat(smaller.block(0).successors, is(empty()));
  }

  @Test
  public void edgeToString() throws Exception {
    CFGEdge edge = new CFGEdge(0, 3, EdgeType.JUMP, Labels.caseEdge(0));
    assertThat(edge.toString(), is("0 -Jump[case_0]-> 3"));
    assertThat(CFGEdge.returnFrom(4).toString(), is("4 -Return-> ?"));
  }
}
