package basic.cfg.build;

import static com.google.common.base.Preconditions.checkArgument;
import static org.jooq.lambda.Seq.seq;

import basic.ast.JumpTarget;
import basic.ast.Statement;
import basic.cfg.BasicBlock;
import basic.cfg.CFGEdge;
import basic.cfg.ControlFlowGraph;
import basic.cfg.EdgeType;
import basic.cfg.Labels;
import basic.cfg.StructuralError;
import basic.cfg.UnresolvedLabelError;
import basic.util.SourceRange;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.jetbrains.annotations.Nullable;

/**
 * The mutable state of building one routine: the blocks and edges created so far, the landing
 * zones and the return points. A fresh instance is used per routine and dropped afterwards, so
 * nothing carries over from one routine to the next.
 */
class RoutineBuild {
  final String name;
  final ControlFlowGraph.Kind kind;
  final JumpTargets targets;
  final SourceRange range;

  private final List<Draft> blocks = new ArrayList<>();
  private final List<CFGEdge> edges = new ArrayList<>();
  private final Map<JumpTarget, Integer> landingZones = new TreeMap<>();
  private final SortedSet<Integer> gosubReturnBlocks = new TreeSet<>();
  private final List<CFGEdge> backEdges = new ArrayList<>();
  private final Map<Statement.Try, TryRoutes> tryRoutes = new IdentityHashMap<>();
  @Nullable private Integer routineExit;

  RoutineBuild(String name, ControlFlowGraph.Kind kind, JumpTargets targets, SourceRange range) {
    this.name = name;
    this.kind = kind;
    this.targets = targets;
    this.range = range;
  }

  int newBlock(String label) {
    blocks.add(new Draft(blocks.size(), label, false));
    return blocks.size() - 1;
  }

  int newLoopHeader(String label) {
    blocks.add(new Draft(blocks.size(), label, true));
    return blocks.size() - 1;
  }

  void add(int block, Statement statement) {
    blocks.get(block).statements.add(statement);
  }

  boolean isEmpty(int block) {
    return blocks.get(block).statements.isEmpty();
  }

  void edge(int source, int target, EdgeType type) {
    edges.add(new CFGEdge(source, target, type));
  }

  void edge(int source, int target, EdgeType type, String label) {
    edges.add(new CFGEdge(source, target, type, label));
  }

  /** An edge that closes a loop. Its target must be a loop header. */
  void backEdge(int source, int header, EdgeType type) {
    checkArgument(blocks.get(header).isLoopHeader, "bb%s is not a loop header", header);
    CFGEdge edge = new CFGEdge(source, header, type);
    edges.add(edge);
    backEdges.add(edge);
  }

  void returnEdge(int source) {
    edges.add(CFGEdge.returnFrom(source));
  }

  List<CFGEdge> backEdges() {
    return backEdges;
  }

  boolean isLandingZone(JumpTarget target) {
    return targets.isLandingZone(target);
  }

  /**
   * The block {@code target} starts, created on first use. {@code reference} is where the
   * transfer to it is written.
   *
   * @throws UnresolvedLabelError if the routine doesn't define {@code target}
   */
  int landing(JumpTarget target, SourceRange reference) {
    if (!targets.defined.containsKey(target)) {
      throw new UnresolvedLabelError(name, reference, target);
    }
    checkArgument(isLandingZone(target), "%s was not scanned as a landing zone", target);
    return landingZones.computeIfAbsent(
        target,
        t ->
            newBlock(
                t.isLineNumber() ? Labels.LINE_PREFIX + t : Labels.LABEL_PREFIX + t));
  }

  TryRoutes openTry(Statement.Try statement, Optional<Integer> finallyBlock) {
    TryRoutes routes = new TryRoutes(this, statement, finallyBlock);
    tryRoutes.put(statement, routes);
    return routes;
  }

  TryRoutes routesOf(Statement.Try statement) {
    return tryRoutes.get(statement);
  }

  void registerGosubReturn(int block) {
    gosubReturnBlocks.add(block);
  }

  /** The block EXIT SUB, EXIT FUNCTION and RETURN with a value go to, created on first use. */
  int routineExit() {
    if (routineExit == null) {
      routineExit = newBlock(Labels.ROUTINE_EXIT);
    }
    return routineExit;
  }

  Optional<Integer> existingRoutineExit() {
    return Optional.ofNullable(routineExit);
  }

  /**
   * Constructs hand back the block control continues in. That block must not have been wired yet.
   *
   * @throws StructuralError otherwise
   */
  void checkOpen(int block, Statement construct) {
    if (seq(edges).anyMatch(e -> e.source == block)) {
      List<CFGEdge> wired = seq(edges).filter(e -> e.source == block).toList();
      throw new StructuralError(
          name,
          construct.range(),
          String.format("Construct continues in bb%d, which already has edges %s", block, wired));
    }
  }

  ControlFlowGraph toGraph(int entry) {
    List<BasicBlock> finished =
        seq(blocks).map(d -> new BasicBlock(d.id, d.label, d.statements, d.isLoopHeader)).toList();
    return ControlFlowGraph.create(
        name, kind, entry, finished, edges, gosubReturnBlocks, landingZones);
  }

  private static class Draft {
    final int id;
    final String label;
    final boolean isLoopHeader;
    final List<Statement> statements = new ArrayList<>();

    Draft(int id, String label, boolean isLoopHeader) {
      this.id = id;
      this.label = label;
      this.isLoopHeader = isLoopHeader;
    }
  }
}
