package basic.cfg;

import static com.google.common.base.Preconditions.checkArgument;
import static org.jooq.lambda.Seq.seq;

import basic.ast.JumpTarget;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The control flow graph of one routine. Instances are immutable: passes that change the graph,
 * like dead block elimination, produce a new one.
 *
 * <p>Predecessor and successor sets of the blocks are recomputed from the edge list on
 * construction, so they can't drift apart. {@link EdgeType#RETURN} edges have no static target
 * and don't contribute to either set.
 */
public class ControlFlowGraph {
  public final String name;
  public final Kind kind;
  public final int entryBlock;
  /** Sorted by ascending id. Ids of a graph after elimination need not be dense. */
  public final ImmutableList<BasicBlock> blocks;
  /** In the order the builder wired them. */
  public final ImmutableList<CFGEdge> edges;
  /** Blocks a bare RETURN may resume at. */
  public final ImmutableSortedSet<Integer> gosubReturnBlocks;
  /** The landing zone of every jump target defined in this routine that something jumps to. */
  public final ImmutableSortedMap<JumpTarget, Integer> lineToBlock;

  private final ImmutableSortedMap<Integer, BasicBlock> byId;
  private final ImmutableListMultimap<Integer, CFGEdge> outgoing;
  private final ImmutableListMultimap<Integer, CFGEdge> incoming;

  private ControlFlowGraph(
      String name,
      Kind kind,
      int entryBlock,
      Collection<BasicBlock> blocks,
      List<CFGEdge> edges,
      Set<Integer> gosubReturnBlocks,
      Map<JumpTarget, Integer> lineToBlock) {
    this.name = name;
    this.kind = kind;
    this.entryBlock = entryBlock;
    this.edges = ImmutableList.copyOf(edges);
    this.gosubReturnBlocks = ImmutableSortedSet.copyOf(gosubReturnBlocks);
    this.lineToBlock = ImmutableSortedMap.copyOf(lineToBlock);

    ImmutableListMultimap.Builder<Integer, CFGEdge> out = ImmutableListMultimap.builder();
    ImmutableListMultimap.Builder<Integer, CFGEdge> in = ImmutableListMultimap.builder();
    for (CFGEdge edge : edges) {
      out.put(edge.source, edge);
      if (edge.hasStaticTarget()) {
        in.put(edge.target, edge);
      }
    }
    this.outgoing = out.build();
    this.incoming = in.build();

    SortedMap<Integer, BasicBlock> linked = new TreeMap<>();
    for (BasicBlock block : blocks) {
      checkArgument(!linked.containsKey(block.id), "Duplicate block id %s", block.id);
      Set<Integer> preds = seq(incoming.get(block.id)).map(e -> e.source).toSet();
      Set<Integer> succs =
          seq(outgoing.get(block.id)).filter(CFGEdge::hasStaticTarget).map(e -> e.target).toSet();
      linked.put(block.id, block.linked(preds, succs));
    }
    this.byId = ImmutableSortedMap.copyOfSorted(linked);
    this.blocks = ImmutableList.copyOf(linked.values());

    checkArgument(
        byId.containsKey(entryBlock), "Entry block %s is not part of the graph", entryBlock);
    for (CFGEdge edge : edges) {
      checkArgument(byId.containsKey(edge.source), "Edge %s leaves an unknown block", edge);
      checkArgument(
          !edge.hasStaticTarget() || byId.containsKey(edge.target),
          "Edge %s enters an unknown block",
          edge);
    }
  }

  public static ControlFlowGraph create(
      String name,
      Kind kind,
      int entryBlock,
      Collection<BasicBlock> blocks,
      List<CFGEdge> edges,
      Set<Integer> gosubReturnBlocks,
      Map<JumpTarget, Integer> lineToBlock) {
    return new ControlFlowGraph(
        name, kind, entryBlock, blocks, edges, gosubReturnBlocks, lineToBlock);
  }

  /** A copy of this graph with other blocks and edges, but the same name, kind and entry. */
  public ControlFlowGraph withBlocksAndEdges(
      Collection<BasicBlock> blocks, List<CFGEdge> edges, Set<Integer> gosubReturnBlocks) {
    return new ControlFlowGraph(
        name, kind, entryBlock, blocks, edges, gosubReturnBlocks, lineToBlock);
  }

  public boolean hasBlock(int id) {
    return byId.containsKey(id);
  }

  public BasicBlock block(int id) {
    BasicBlock block = byId.get(id);
    checkArgument(block != null, "No block %s in %s", id, name);
    return block;
  }

  public Optional<BasicBlock> findBlock(int id) {
    return Optional.ofNullable(byId.get(id));
  }

  /** Outgoing edges of {@code id}, in wiring order. */
  public ImmutableList<CFGEdge> outgoing(int id) {
    return outgoing.get(id);
  }

  public ImmutableList<CFGEdge> incoming(int id) {
    return incoming.get(id);
  }

  public Optional<EdgeShape> shapeOf(int id) {
    return EdgeShape.classify(outgoing(id));
  }

  public ImmutableSortedSet<Integer> loopHeaders() {
    return seq(blocks)
        .filter(b -> b.isLoopHeader)
        .map(b -> b.id)
        .collect(ImmutableSortedSet.toImmutableSortedSet(Comparator.naturalOrder()));
  }

  public ImmutableSortedSet<Integer> landingZones() {
    return ImmutableSortedSet.copyOf(lineToBlock.values());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ControlFlowGraph that = (ControlFlowGraph) o;
    return entryBlock == that.entryBlock
        && name.equals(that.name)
        && kind == that.kind
        && blocks.equals(that.blocks)
        && edges.equals(that.edges)
        && gosubReturnBlocks.equals(that.gosubReturnBlocks)
        && lineToBlock.equals(that.lineToBlock);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, kind, entryBlock, blocks, edges, gosubReturnBlocks, lineToBlock);
  }

  @Override
  public String toString() {
    return "CFG " + name + " (" + blocks.size() + " blocks, " + edges.size() + " edges)";
  }

  public enum Kind {
    MAIN,
    SUB,
    FUNCTION
  }
}
