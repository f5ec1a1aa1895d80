package basic.cfg.build;

import basic.ast.Construct;
import basic.ast.JumpTarget;
import basic.ast.Program;
import basic.ast.Routine;
import basic.ast.Statement;
import basic.cfg.CfgReport;
import basic.cfg.ConstructTooComplexError;
import basic.cfg.ControlFlowGraph;
import basic.cfg.EdgeType;
import basic.cfg.Labels;
import basic.cfg.StructuralError;
import basic.cfg.UnresolvedLabelError;
import basic.util.SourceRange;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the control flow graph of one routine in a single walk over its statements.
 *
 * <p>Every construct is wired completely when it is visited: it gets the block control enters it
 * from and hands back the one block control leaves it through, which has no edges yet. Its
 * internal blocks are never seen by the caller. Loop back edges are wired as soon as the loop
 * body is done.
 *
 * <p>A transfer to a block outside of a TRY is routed through the {@link TryRoutes} of every TRY
 * it leaves, so that it removes the handler and runs the FINALLY on the way.
 *
 * <p>After the walk the graph is checked (edge shapes, loop headers, GOSUB return points) and dead
 * and empty blocks are removed.
 */
public class CfgBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger("CfgBuilder");
  private final CfgOptions options;

  public CfgBuilder(CfgOptions options) {
    this.options = options;
  }

  public CfgBuilder() {
    this(CfgOptions.DEFAULT);
  }

  public ControlFlowGraph buildMain(Program program) {
    return build(Program.MAIN, ControlFlowGraph.Kind.MAIN, program.main, program.range());
  }

  public ControlFlowGraph build(Routine routine) {
    ControlFlowGraph.Kind kind =
        routine.isFunction() ? ControlFlowGraph.Kind.FUNCTION : ControlFlowGraph.Kind.SUB;
    return build(routine.name, kind, routine.body, routine.range());
  }

  /**
   * @throws basic.cfg.CfgError if the routine can't be built; see the subclasses for the reasons
   */
  public ControlFlowGraph build(
      String name, ControlFlowGraph.Kind kind, List<Statement> body, SourceRange range) {
    LOGGER.debug("Building CFG of {}", name);
    JumpTargets targets = JumpTargetScanner.scan(name, body, options.maxNestingDepth);
    RoutineBuild build = new RoutineBuild(name, kind, targets, range);
    int entry = build.newBlock(Labels.ENTRY);
    int last = buildList(build, body, entry, Nesting.root());
    int end = last;
    build.existingRoutineExit().ifPresent(exit -> build.edge(end, exit, EdgeType.FALLTHROUGH));

    ControlFlowGraph graph = build.toGraph(entry);
    EdgeShapeVerifier.verify(graph, range);
    LoopHeaderVerifier.verify(graph, build.backEdges(), range);
    GosubSiteVerifier.verify(graph, range);
    if (options.eliminateDeadBlocks) {
      graph = DeadBlockEliminator.eliminate(graph);
    }
    LOGGER.debug("Built {}", graph);
    if (options.dumpCfg) {
      LOGGER.info(CfgReport.render(graph));
    }
    return graph;
  }

  private int buildList(
      RoutineBuild build, List<Statement> statements, int incoming, Nesting nesting) {
    int current = incoming;
    for (int i = 0; i < statements.size(); ++i) {
      Statement statement = statements.get(i);
      Optional<Statement> next =
          i + 1 < statements.size() ? Optional.of(statements.get(i + 1)) : Optional.empty();
      current = statement.acceptVisitor(new Wiring(build, current, nesting, next));
      build.checkOpen(current, statement);
    }
    return current;
  }

  /**
   * Wires a single statement. Returns the block control continues in, which is {@code incoming}
   * for straight-line statements.
   */
  private class Wiring implements Statement.Visitor<Integer> {
    private final RoutineBuild build;
    private final int incoming;
    private final Nesting nesting;
    /** The statement after this one in the same list, for finding return landing zones. */
    private final Optional<Statement> next;

    private Wiring(RoutineBuild build, int incoming, Nesting nesting, Optional<Statement> next) {
      this.build = build;
      this.incoming = incoming;
      this.nesting = nesting;
      this.next = next;
    }

    private Nesting enter(Statement construct) {
      Nesting inner = nesting.deeper();
      if (inner.depth > options.maxNestingDepth) {
        throw new ConstructTooComplexError(build.name, construct.range(), options.maxNestingDepth);
      }
      return inner;
    }

    private int straightLine(Statement statement) {
      build.add(incoming, statement);
      return incoming;
    }

    /** Statements after an unconditional transfer go here until the next landing zone. */
    private int unreachable() {
      return build.newBlock(Labels.UNREACHABLE);
    }

    private int landing(JumpTarget target, Statement reference) {
      return build.landing(target, reference.range());
    }

    /** Where a GOTO-like transfer to {@code target} jumps to. */
    private int jumpTo(JumpTarget target, Statement reference) {
      int landing = landing(target, reference);
      return leaving(landing, part -> build.targets.isInside(target, part));
    }

    /**
     * The block to jump to for reaching {@code target}, leaving every enclosing TRY part that
     * {@code isInside} doesn't hold for.
     */
    private int leaving(int target, Predicate<TryPart> isInside) {
      List<TryPart> left = new ArrayList<>();
      for (TryPart part : nesting.tries()) {
        if (isInside.test(part)) {
          break;
        }
        left.add(part);
      }
      int next = target;
      for (TryPart part : Lists.reverse(left)) {
        next = build.routesOf(part.statement).leave(part.isHandler, next);
      }
      return next;
    }

    /**
     * Where a GOSUB returns to. That is the landing zone of the label written right after it, if
     * there is one, and a fresh block otherwise.
     */
    private int returnPoint(String label) {
      if (next.isPresent() && next.get() instanceof Statement.Label) {
        JumpTarget target = ((Statement.Label) next.get()).target;
        if (build.targets.returnLandingZones.contains(target)) {
          return landing(target, next.get());
        }
      }
      return build.newBlock(label);
    }

    private StructuralError structuralError(Statement statement, String message) {
      return new StructuralError(build.name, statement.range(), message);
    }

    private String outside(String keyword, Construct construct) {
      return keyword + " " + construct + " outside of a " + construct;
    }

    @Override
    public Integer visitLabel(Statement.Label that) {
      if (!build.isLandingZone(that.target)) {
        return straightLine(that);
      }
      int landing = landing(that.target, that);
      if (landing != incoming) {
        build.edge(incoming, landing, EdgeType.FALLTHROUGH);
      }
      build.add(landing, that);
      return landing;
    }

    @Override
    public Integer visitLet(Statement.Let that) {
      return straightLine(that);
    }

    @Override
    public Integer visitPrint(Statement.Print that) {
      return straightLine(that);
    }

    @Override
    public Integer visitDim(Statement.Dim that) {
      return straightLine(that);
    }

    @Override
    public Integer visitCallSub(Statement.CallSub that) {
      return straightLine(that);
    }

    @Override
    public Integer visitRestore(Statement.Restore that) {
      if (that.target.isPresent() && !build.targets.defined.containsKey(that.target.get())) {
        throw new UnresolvedLabelError(build.name, that.range(), that.target.get());
      }
      return straightLine(that);
    }

    @Override
    public Integer visitIf(Statement.If that) {
      if (that.thenGoto.isPresent()) {
        build.add(incoming, that);
        int target = jumpTo(that.thenGoto.get(), that);
        int merge = build.newBlock(Labels.IF_MERGE);
        build.edge(incoming, target, EdgeType.CONDITIONAL_TRUE);
        build.edge(incoming, merge, EdgeType.CONDITIONAL_FALSE);
        return merge;
      }
      Nesting inner = enter(that);
      build.add(incoming, that);

      // Edges into the merge block, which is created once all branches are built
      List<Integer> toMergeSources = new ArrayList<>();
      List<EdgeType> toMergeTypes = new ArrayList<>();

      int condition = incoming;
      if (that.then.isEmpty()) {
        toMergeSources.add(condition);
        toMergeTypes.add(EdgeType.CONDITIONAL_TRUE);
      } else {
        int then = build.newBlock(Labels.IF_THEN);
        build.edge(condition, then, EdgeType.CONDITIONAL_TRUE);
        toMergeSources.add(buildList(build, that.then, then, inner));
        toMergeTypes.add(EdgeType.JUMP);
      }

      for (Statement.ElseIf elseIf : that.elseIfs) {
        int test = build.newBlock(Labels.IF_ELSE_IF);
        build.add(test, elseIf);
        build.edge(condition, test, EdgeType.CONDITIONAL_FALSE);
        condition = test;
        if (elseIf.body.isEmpty()) {
          toMergeSources.add(condition);
          toMergeTypes.add(EdgeType.CONDITIONAL_TRUE);
        } else {
          int body = build.newBlock(Labels.IF_THEN);
          build.edge(condition, body, EdgeType.CONDITIONAL_TRUE);
          toMergeSources.add(buildList(build, elseIf.body, body, inner));
          toMergeTypes.add(EdgeType.JUMP);
        }
      }

      if (!that.else_.isPresent() || that.else_.get().isEmpty()) {
        toMergeSources.add(condition);
        toMergeTypes.add(EdgeType.CONDITIONAL_FALSE);
      } else {
        int else_ = build.newBlock(Labels.IF_ELSE);
        build.edge(condition, else_, EdgeType.CONDITIONAL_FALSE);
        toMergeSources.add(buildList(build, that.else_.get(), else_, inner));
        toMergeTypes.add(EdgeType.JUMP);
      }

      int merge = build.newBlock(Labels.IF_MERGE);
      for (int i = 0; i < toMergeSources.size(); ++i) {
        if (toMergeTypes.get(i) == EdgeType.JUMP) {
          build.checkOpen(toMergeSources.get(i), that);
        }
        build.edge(toMergeSources.get(i), merge, toMergeTypes.get(i));
      }
      return merge;
    }

    @Override
    public Integer visitElseIf(Statement.ElseIf that) {
      throw structuralError(that, "ELSEIF outside of an IF");
    }

    @Override
    public Integer visitSelectCase(Statement.SelectCase that) {
      Nesting inner = enter(that);
      build.add(incoming, that);
      int merge = build.newBlock(Labels.SELECT_MERGE);
      Nesting caseNesting = inner.withExit(Construct.SELECT, merge);
      for (int i = 0; i < that.cases.size(); ++i) {
        List<Statement> body = that.cases.get(i).body;
        wireCase(body, Labels.SELECT_CASE, Labels.caseEdge(i), merge, caseNesting, that);
      }
      List<Statement> else_ = that.else_.orElse(ImmutableList.of());
      wireCase(else_, Labels.SELECT_ELSE, Labels.DEFAULT_EDGE, merge, caseNesting, that);
      return merge;
    }

    private void wireCase(
        List<Statement> body,
        String blockLabel,
        String edgeLabel,
        int merge,
        Nesting caseNesting,
        Statement select) {
      if (body.isEmpty()) {
        build.edge(incoming, merge, EdgeType.JUMP, edgeLabel);
        return;
      }
      int block = build.newBlock(blockLabel);
      build.edge(incoming, block, EdgeType.JUMP, edgeLabel);
      int exit = buildList(build, body, block, caseNesting);
      build.checkOpen(exit, select);
      build.edge(exit, merge, EdgeType.JUMP);
    }

    @Override
    public Integer visitFor(Statement.For that) {
      Nesting inner = enter(that);
      int init = build.newBlock(Labels.FOR_INIT);
      build.add(init, that);
      int header = build.newLoopHeader(Labels.FOR_HEADER);
      build.add(header, that);
      int body = build.newBlock(Labels.FOR_BODY);
      int increment = build.newBlock(Labels.FOR_INCREMENT);
      build.add(increment, that);
      int exit = build.newBlock(Labels.FOR_EXIT);

      build.edge(incoming, init, EdgeType.FALLTHROUGH);
      build.edge(init, header, EdgeType.FALLTHROUGH);
      build.edge(header, body, EdgeType.CONDITIONAL_TRUE);
      build.edge(header, exit, EdgeType.CONDITIONAL_FALSE);
      int bodyExit =
          buildList(build, that.body, body, inner.withLoop(Construct.FOR, exit, increment));
      build.checkOpen(bodyExit, that);
      build.edge(bodyExit, increment, EdgeType.FALLTHROUGH);
      build.backEdge(increment, header, EdgeType.JUMP);
      return exit;
    }

    @Override
    public Integer visitWhile(Statement.While that) {
      Nesting inner = enter(that);
      int header = build.newLoopHeader(Labels.WHILE_HEADER);
      build.add(header, that);
      int body = build.newBlock(Labels.WHILE_BODY);
      int exit = build.newBlock(Labels.WHILE_EXIT);

      build.edge(incoming, header, EdgeType.FALLTHROUGH);
      build.edge(header, body, EdgeType.CONDITIONAL_TRUE);
      build.edge(header, exit, EdgeType.CONDITIONAL_FALSE);
      int bodyExit =
          buildList(build, that.body, body, inner.withLoop(Construct.WHILE, exit, header));
      build.checkOpen(bodyExit, that);
      build.backEdge(bodyExit, header, EdgeType.JUMP);
      return exit;
    }

    @Override
    public Integer visitDo(Statement.Do that) {
      Nesting inner = enter(that);
      if (that.postCondition.isPresent()) {
        return postTestDo(that, that.postCondition.get(), inner);
      }
      int header = build.newLoopHeader(Labels.DO_HEADER);
      build.add(header, that);
      int body = build.newBlock(Labels.DO_BODY);
      int exit = build.newBlock(Labels.DO_EXIT);

      build.edge(incoming, header, EdgeType.FALLTHROUGH);
      if (that.preCondition.isPresent()) {
        // UNTIL leaves the loop when the condition holds
        boolean isUntil = that.preCondition.get().isUntil;
        build.edge(header, isUntil ? exit : body, EdgeType.CONDITIONAL_TRUE);
        build.edge(header, isUntil ? body : exit, EdgeType.CONDITIONAL_FALSE);
      } else {
        build.edge(header, body, EdgeType.FALLTHROUGH);
      }
      int bodyExit = buildList(build, that.body, body, inner.withLoop(Construct.DO, exit, header));
      build.checkOpen(bodyExit, that);
      build.backEdge(bodyExit, header, EdgeType.JUMP);
      return exit;
    }

    private int postTestDo(Statement.Do that, Statement.Do.Condition condition, Nesting inner) {
      int body = build.newLoopHeader(Labels.DO_BODY);
      int test = build.newBlock(Labels.DO_CONDITION);
      build.add(test, that);
      int exit = build.newBlock(Labels.DO_EXIT);

      build.edge(incoming, body, EdgeType.FALLTHROUGH);
      int bodyExit = buildList(build, that.body, body, inner.withLoop(Construct.DO, exit, test));
      build.checkOpen(bodyExit, that);
      build.edge(bodyExit, test, EdgeType.FALLTHROUGH);
      if (condition.isUntil) {
        build.edge(test, exit, EdgeType.CONDITIONAL_TRUE);
        build.backEdge(test, body, EdgeType.CONDITIONAL_FALSE);
      } else {
        build.backEdge(test, body, EdgeType.CONDITIONAL_TRUE);
        build.edge(test, exit, EdgeType.CONDITIONAL_FALSE);
      }
      return exit;
    }

    /*
     * The block before TRY installs the handler and gets an Exception edge to the dispatch block
     * next to the normal path into the body. Every way out of body and CATCH clauses passes the
     * single FINALLY block, after which an error that is still pending is raised again and a
     * routed transfer continues to its target.
     */
    @Override
    public Integer visitTry(Statement.Try that) {
      Nesting inner = enter(that);
      build.add(incoming, that);
      int body = build.newBlock(Labels.TRY_BODY);
      int dispatch = build.newBlock(Labels.TRY_DISPATCH);
      build.add(dispatch, that);
      Optional<Integer> finally_ =
          that.finally_.isPresent()
              ? Optional.of(build.newBlock(Labels.TRY_FINALLY))
              : Optional.empty();
      int exit = build.newBlock(Labels.TRY_EXIT);
      int afterHandlers = finally_.orElse(exit);
      Rethrow rethrow = new Rethrow(that);
      TryRoutes routes = build.openTry(that, finally_);

      build.edge(incoming, body, EdgeType.FALLTHROUGH);
      build.edge(incoming, dispatch, EdgeType.EXCEPTION);
      int bodyExit = buildList(build, that.body, body, inner.inBody(that, dispatch));
      build.checkOpen(bodyExit, that);
      int leave = build.newBlock(Labels.TRY_LEAVE);
      build.add(leave, that);
      build.edge(bodyExit, leave, EdgeType.FALLTHROUGH);
      build.edge(leave, afterHandlers, EdgeType.JUMP);

      Nesting handlers = inner.inHandlers(that, finally_);
      for (int i = 0; i < that.catches.size(); ++i) {
        int handler = build.newBlock(Labels.TRY_CATCH);
        build.add(handler, that);
        build.edge(dispatch, handler, EdgeType.JUMP, Labels.catchEdge(i));
        int handlerExit = buildList(build, that.catches.get(i).body, handler, handlers);
        build.checkOpen(handlerExit, that);
        build.edge(handlerExit, afterHandlers, EdgeType.JUMP);
      }
      int unmatched = finally_.isPresent() ? finally_.get() : rethrow.block();
      build.edge(dispatch, unmatched, EdgeType.JUMP, Labels.DEFAULT_EDGE);

      if (finally_.isPresent()) {
        int finallyExit = buildList(build, that.finally_.get(), finally_.get(), inner);
        build.checkOpen(finallyExit, that);
        int pending = build.newBlock(Labels.TRY_FINALLY_EXIT);
        build.add(pending, that);
        build.edge(finallyExit, pending, EdgeType.FALLTHROUGH);
        build.edge(pending, rethrow.block(), EdgeType.CONDITIONAL_TRUE);
        build.edge(pending, continueAfterFinally(that, routes, exit), EdgeType.CONDITIONAL_FALSE);
      }
      return exit;
    }

    /** {@code exit}, or a block picking between it and the routes out of the TRY. */
    private int continueAfterFinally(Statement.Try that, TryRoutes routes, int exit) {
      List<Integer> continuations = routes.continuations();
      if (continuations.isEmpty()) {
        return exit;
      }
      int select = build.newBlock(Labels.TRY_FINALLY_ROUTE);
      build.add(select, that);
      for (int i = 0; i < continuations.size(); ++i) {
        build.edge(select, continuations.get(i), EdgeType.JUMP, Labels.caseEdge(i));
      }
      build.edge(select, exit, EdgeType.JUMP, Labels.DEFAULT_EDGE);
      return select;
    }

    /** The block raising an error again that this TRY didn't handle. Created when needed. */
    private class Rethrow {
      private final Statement.Try statement;
      private int block = -1;

      private Rethrow(Statement.Try statement) {
        this.statement = statement;
      }

      int block() {
        if (block < 0) {
          block = build.newBlock(Labels.TRY_RETHROW);
          build.add(block, statement);
          nesting.throwTarget().ifPresent(outer -> build.edge(block, outer, EdgeType.JUMP));
        }
        return block;
      }
    }

    @Override
    public Integer visitThrow(Statement.Throw that) {
      build.add(incoming, that);
      nesting.throwTarget().ifPresent(target -> build.edge(incoming, target, EdgeType.JUMP));
      return unreachable();
    }

    @Override
    public Integer visitGoto(Statement.Goto that) {
      build.add(incoming, that);
      build.edge(incoming, jumpTo(that.target, that), EdgeType.JUMP);
      return unreachable();
    }

    @Override
    public Integer visitGosub(Statement.Gosub that) {
      build.add(incoming, that);
      int callee = landing(that.target, that);
      int back = returnPoint(Labels.RETURN_POINT);
      build.edge(incoming, callee, EdgeType.CALL);
      build.edge(incoming, back, EdgeType.FALLTHROUGH);
      build.registerGosubReturn(back);
      return back;
    }

    @Override
    public Integer visitOnGoto(Statement.OnGoto that) {
      build.add(incoming, that);
      for (int i = 0; i < that.targets.size(); ++i) {
        int target = jumpTo(that.targets.get(i), that);
        build.edge(incoming, target, EdgeType.JUMP, Labels.caseEdge(i));
      }
      int outOfRange = build.newBlock(Labels.ON_GOTO_FALLTHROUGH);
      build.edge(incoming, outOfRange, EdgeType.JUMP, Labels.DEFAULT_EDGE);
      return outOfRange;
    }

    /*
     * A GOSUB edge pair per target would give the dispatching block an illegal shape, so every
     * target gets a small block of its own that performs the call.
     */
    @Override
    public Integer visitOnGosub(Statement.OnGosub that) {
      build.add(incoming, that);
      int back = returnPoint(Labels.ON_GOSUB_RETURN_POINT);
      build.registerGosubReturn(back);
      for (int i = 0; i < that.targets.size(); ++i) {
        int call = build.newBlock(Labels.ON_GOSUB_CALL);
        build.edge(incoming, call, EdgeType.JUMP, Labels.caseEdge(i));
        build.edge(call, landing(that.targets.get(i), that), EdgeType.CALL);
        build.edge(call, back, EdgeType.FALLTHROUGH);
      }
      build.edge(incoming, back, EdgeType.JUMP, Labels.DEFAULT_EDGE);
      return back;
    }

    @Override
    public Integer visitReturn(Statement.Return that) {
      build.add(incoming, that);
      if (that.value.isPresent()) {
        if (build.kind != ControlFlowGraph.Kind.FUNCTION) {
          throw structuralError(that, "RETURN with a value outside of a FUNCTION");
        }
        build.edge(incoming, leaving(build.routineExit(), part -> false), EdgeType.JUMP);
      } else if (that.target.isPresent()) {
        build.edge(incoming, jumpTo(that.target.get(), that), EdgeType.JUMP);
      } else {
        build.returnEdge(incoming);
      }
      return unreachable();
    }

    @Override
    public Integer visitExit(Statement.Exit that) {
      build.add(incoming, that);
      int target;
      if (that.construct.isRoutine()) {
        boolean matches =
            (that.construct == Construct.SUB && build.kind == ControlFlowGraph.Kind.SUB)
                || (that.construct == Construct.FUNCTION
                    && build.kind == ControlFlowGraph.Kind.FUNCTION);
        if (!matches) {
          throw structuralError(that, outside("EXIT", that.construct));
        }
        target = leaving(build.routineExit(), part -> false);
      } else {
        int exit =
            nesting
                .exitOf(that.construct)
                .orElseThrow(
                    () -> structuralError(that, outside("EXIT", that.construct)));
        target = leaving(exit, nesting.triesAround(that.construct)::contains);
      }
      build.edge(incoming, target, EdgeType.JUMP);
      return unreachable();
    }

    @Override
    public Integer visitContinue(Statement.Continue that) {
      build.add(incoming, that);
      int target =
          nesting
              .continueOf(that.loop)
              .orElseThrow(() -> structuralError(that, outside("CONTINUE", that.loop)));
      build.edge(
          incoming, leaving(target, nesting.triesAround(that.loop)::contains), EdgeType.JUMP);
      return unreachable();
    }

    @Override
    public Integer visitEnd(Statement.End that) {
      build.add(incoming, that);
      return unreachable();
    }
  }
}
