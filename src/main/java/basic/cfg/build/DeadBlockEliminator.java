package basic.cfg.build;

import static org.jooq.lambda.Seq.seq;

import basic.cfg.BasicBlock;
import basic.cfg.CFGEdge;
import basic.cfg.ControlFlowGraph;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes blocks nothing jumps to and splices out empty blocks that only pass control on. Runs
 * until nothing changes, so running it on its own output changes nothing.
 *
 * <p>The entry block, landing zones and GOSUB return points are kept even if nothing jumps to
 * them, since dispatch at run time may still reach them. Loop headers are never spliced out.
 */
public class DeadBlockEliminator {
  private static final Logger LOGGER = LoggerFactory.getLogger("DeadBlockEliminator");

  private final ControlFlowGraph graph;
  private final SortedMap<Integer, BasicBlock> blocks = new TreeMap<>();
  private final List<CFGEdge> edges;
  private final Set<Integer> pinned = new HashSet<>();

  private DeadBlockEliminator(ControlFlowGraph graph) {
    this.graph = graph;
    graph.blocks.forEach(b -> blocks.put(b.id, b));
    this.edges = new ArrayList<>(graph.edges);
    pinned.add(graph.entryBlock);
    pinned.addAll(graph.gosubReturnBlocks);
    pinned.addAll(graph.landingZones());
  }

  public static ControlFlowGraph eliminate(ControlFlowGraph graph) {
    return new DeadBlockEliminator(graph).run();
  }

  private ControlFlowGraph run() {
    boolean hasChanged = true;
    while (hasChanged) {
      hasChanged = pruneUnreferenced();
      hasChanged |= spliceEmpty();
      hasChanged |= clearStaleLoopHeaders();
    }
    LOGGER.debug("{}: {} of {} blocks left", graph.name, blocks.size(), graph.blocks.size());
    return graph.withBlocksAndEdges(blocks.values(), edges, graph.gosubReturnBlocks);
  }

  private boolean hasIncoming(int id) {
    return seq(edges).anyMatch(e -> e.hasStaticTarget() && e.target == id);
  }

  private boolean pruneUnreferenced() {
    boolean hasChanged = false;
    for (int id : new ArrayList<>(blocks.keySet())) {
      if (!pinned.contains(id) && !hasIncoming(id)) {
        blocks.remove(id);
        edges.removeIf(e -> e.source == id);
        hasChanged = true;
      }
    }
    return hasChanged;
  }

  private boolean spliceEmpty() {
    boolean hasChanged = false;
    for (int id : new ArrayList<>(blocks.keySet())) {
      Optional<Redirection> redirection = tryToIdentifyRedirection(blocks.get(id));
      if (redirection.isPresent()) {
        Redirection r = redirection.get();
        edges.set(edges.indexOf(r.incoming), r.incoming.withTarget(r.outgoing.target));
        edges.remove(r.outgoing);
        blocks.remove(id);
        hasChanged = true;
      }
    }
    return hasChanged;
  }

  /** The edges to bypass an empty block with, if it may be bypassed. */
  private Optional<Redirection> tryToIdentifyRedirection(BasicBlock block) {
    if (pinned.contains(block.id) || block.isLoopHeader || !block.statements.isEmpty()) {
      return Optional.empty();
    }
    List<CFGEdge> in =
        seq(edges).filter(e -> e.hasStaticTarget() && e.target == block.id).toList();
    List<CFGEdge> out = seq(edges).filter(e -> e.source == block.id).toList();
    if (in.size() != 1 || out.size() != 1 || !out.get(0).type.isUnconditional()) {
      return Optional.empty();
    }
    CFGEdge incoming = in.get(0);
    CFGEdge outgoing = out.get(0);
    if (incoming.source == block.id || outgoing.target == block.id) {
      return Optional.empty();
    }
    return Optional.of(new Redirection(incoming, outgoing));
  }

  /** A loop header whose back edges all went away isn't entered from its loop anymore. */
  private boolean clearStaleLoopHeaders() {
    boolean hasChanged = false;
    for (BasicBlock block : new ArrayList<>(blocks.values())) {
      if (block.isLoopHeader && !isOnCycle(block.id)) {
        LOGGER.debug("{}: {} lost its back edges", graph.name, block);
        blocks.put(block.id, block.withLoopHeader(false));
        hasChanged = true;
      }
    }
    return hasChanged;
  }

  private boolean isOnCycle(int header) {
    SortedSet<Integer> seen = new TreeSet<>();
    Deque<Integer> toVisit = new ArrayDeque<>();
    toVisit.push(header);
    while (!toVisit.isEmpty()) {
      int id = toVisit.pop();
      for (CFGEdge edge : edges) {
        if (edge.source != id || !edge.hasStaticTarget()) {
          continue;
        }
        if (edge.target == header) {
          return true;
        }
        if (seen.add(edge.target)) {
          toVisit.push(edge.target);
        }
      }
    }
    return false;
  }

  /** The predecessor's edge is retargeted, keeping its type and label. */
  private static class Redirection {
    final CFGEdge incoming;
    final CFGEdge outgoing;

    private Redirection(CFGEdge incoming, CFGEdge outgoing) {
      this.incoming = incoming;
      this.outgoing = outgoing;
    }
  }
}
