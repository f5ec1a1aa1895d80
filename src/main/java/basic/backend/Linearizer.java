package basic.backend;

import static org.jooq.lambda.Seq.seq;

import basic.ast.Expression;
import basic.ast.Statement;
import basic.backend.instructions.Allocate;
import basic.backend.instructions.Arith;
import basic.backend.instructions.Branch;
import basic.backend.instructions.Compare;
import basic.backend.instructions.Evaluate;
import basic.backend.instructions.Instruction;
import basic.backend.instructions.Jump;
import basic.backend.instructions.Label;
import basic.backend.instructions.Load;
import basic.backend.instructions.LoadIndexed;
import basic.backend.instructions.Relation;
import basic.backend.instructions.Ret;
import basic.backend.instructions.RuntimeCall;
import basic.backend.instructions.RuntimeError;
import basic.backend.instructions.Select;
import basic.backend.instructions.Store;
import basic.backend.instructions.StoreIndexed;
import basic.backend.instructions.ZeroInit;
import basic.backend.operands.Global;
import basic.backend.operands.Immediate;
import basic.backend.operands.Operand;
import basic.backend.operands.Slot;
import basic.backend.operands.Temp;
import basic.backend.operands.TempSupply;
import basic.cfg.BasicBlock;
import basic.cfg.CFGEdge;
import basic.cfg.ControlFlowGraph;
import basic.cfg.EdgeShape;
import basic.cfg.Labels;
import basic.cfg.ProgramCfg;
import basic.cfg.StructuralError;
import basic.cfg.build.CfgOptions;
import basic.semantic.SemanticType;
import basic.semantic.Symbol;
import basic.semantic.SymbolTable;
import basic.util.SourceRange;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers a finished {@link ControlFlowGraph} into a linear instruction stream.
 *
 * <p>Blocks are emitted in ascending id order. Blocks that can't be reached statically are still
 * emitted, since GOSUB and ON GOTO dispatch may reach them at run time; they only produce an
 * {@link UnreachableBlockWarning}. Each block ends in a terminator chosen by the {@link
 * EdgeShape} of its outgoing edges. Straight-line statements are handed to a {@link
 * StatementEmitter}; construct statements are lowered here, according to the role their block
 * plays (see {@link Labels}).
 *
 * <p>A TRY that is left through EXIT, CONTINUE or GOTO numbers those routes. The number is stored
 * before its FINALLY runs and decides where control goes after it.
 *
 * <p>GOSUB and RETURN don't use the native call stack. GOSUB pushes the id of its return block
 * onto {@link Global#RETURN_STACK}, RETURN pops it and compares it against every return site of
 * the routine in ascending order.
 */
public class Linearizer {
  private static final Logger LOGGER = LoggerFactory.getLogger("Linearizer");

  /** Where a FUNCTION keeps the value it returns. */
  public static final Slot RESULT_SLOT = new Slot("result");

  private final SymbolTable symbols;
  private final StatementEmitter statementEmitter;
  private final CfgOptions options;

  public Linearizer(SymbolTable symbols, StatementEmitter statementEmitter, CfgOptions options) {
    this.symbols = symbols;
    this.statementEmitter = statementEmitter;
    this.options = options;
  }

  public Linearizer(SymbolTable symbols, CfgOptions options) {
    this(symbols, new OpaqueStatementEmitter(), options);
  }

  public static String blockLabel(int block) {
    return "@bb" + block;
  }

  public static Slot limitSlot(int loop) {
    return new Slot("for" + loop + ".limit");
  }

  public static Slot stepSlot(int loop) {
    return new Slot("for" + loop + ".step");
  }

  /** Which route out of a TRY is taken; 0 when its FINALLY is reached on a normal path. */
  public static Slot routeSlot(int try_) {
    return new Slot("try" + try_ + ".route");
  }

  /** Ascending by id, unreachable blocks included. */
  public static ImmutableList<Integer> emissionOrder(ControlFlowGraph graph) {
    return seq(graph.blocks).map(b -> b.id).collect(ImmutableList.toImmutableList());
  }

  /** Depth first from the entry, along every edge that has a static target. */
  public static ImmutableSortedSet<Integer> reachable(ControlFlowGraph graph) {
    SortedSet<Integer> seen = new TreeSet<>();
    Deque<Integer> toVisit = new ArrayDeque<>();
    seen.add(graph.entryBlock);
    toVisit.push(graph.entryBlock);
    while (!toVisit.isEmpty()) {
      int id = toVisit.pop();
      for (CFGEdge edge : graph.outgoing(id)) {
        if (edge.hasStaticTarget() && seen.add(edge.target)) {
          toVisit.push(edge.target);
        }
      }
    }
    return ImmutableSortedSet.copyOfSorted(seen);
  }

  public Linearization linearize(ControlFlowGraph graph) {
    Linearization linearization = new FunctionEmitter(graph).emit();
    LOGGER.debug("{}: {}", graph.name, linearization.function);
    return linearization;
  }

  /** Main first, then the routines by name. Graphs that failed to build are skipped. */
  public ImmutableList<Linearization> linearizeAll(ProgramCfg program) {
    return seq(program.all()).map(this::linearize).collect(ImmutableList.toImmutableList());
  }

  public IlModule module(List<Linearization> linearizations) {
    return new IlModule(
        options.returnStackCapacity, seq(linearizations).map(l -> l.function).toList());
  }

  /** Emits a single graph. Not reusable. */
  private class FunctionEmitter implements Statement.Visitor<Void> {
    private final ControlFlowGraph graph;
    private final TempSupply temps = new TempSupply();
    private final ImmutableListMultimap.Builder<Integer, Instruction> byBlock =
        ImmutableListMultimap.builder();
    private final List<Instruction> instructions = new ArrayList<>();
    private final List<LinearizerWarning> warnings = new ArrayList<>();
    private final Map<Statement.For, Integer> forLoops = new IdentityHashMap<>();
    /** TRYs that are left through a route, numbered for their route slot. */
    private final Map<Statement.Try, Integer> routedTries = new IdentityHashMap<>();
    private int helpers = 0;

    private BasicBlock block;
    private int position;
    /** The value the terminator of the current block decides on, if any. */
    private Optional<Operand> decision;
    /** The last construct statement of the current block. */
    private Optional<Statement> construct;

    FunctionEmitter(ControlFlowGraph graph) {
      this.graph = graph;
    }

    Linearization emit() {
      for (int site : graph.gosubReturnBlocks) {
        if (!graph.hasBlock(site)) {
          throw new StructuralError(
              graph.name,
              SourceRange.FIRST_CHAR,
              "GOSUB return site bb" + site + " is not part of the graph");
        }
      }
      numberForLoops();
      numberRoutedTries();
      ImmutableList<Integer> order = emissionOrder(graph);
      ImmutableSortedSet<Integer> reachable = reachable(graph);
      for (int id : order) {
        BasicBlock current = graph.block(id);
        if (!reachable.contains(id) && !current.statements.isEmpty()) {
          warn(new UnreachableBlockWarning(graph.name, id));
        }
        emitBlock(current);
      }
      IlFunction function = new IlFunction(graph.name, graph.kind, instructions);
      return new Linearization(graph, function, order, reachable, warnings, byBlock.build());
    }

    private void numberForLoops() {
      for (BasicBlock b : graph.blocks) {
        for (Statement statement : b.statements) {
          if (statement instanceof Statement.For) {
            forLoops.computeIfAbsent((Statement.For) statement, k -> forLoops.size());
          }
        }
      }
    }

    private void numberRoutedTries() {
      for (BasicBlock b : graph.blocks) {
        boolean routes =
            b.hasLabel(Labels.TRY_FINALLY_ROUTE) || b.label.filter(Labels::isTryRoute).isPresent();
        if (routes) {
          for (Statement statement : b.statements) {
            if (statement instanceof Statement.Try) {
              routedTries.computeIfAbsent((Statement.Try) statement, k -> routedTries.size());
            }
          }
        }
      }
    }

    private void warn(LinearizerWarning warning) {
      LOGGER.warn(warning.getMessage());
      warnings.add(warning);
    }

    private void emit(Instruction instruction) {
      instructions.add(instruction);
      byBlock.put(block.id, instruction);
    }

    private String helperLabel(String purpose) {
      return blockLabel(block.id) + "." + purpose + helpers++;
    }

    private void emitBlock(BasicBlock current) {
      block = current;
      decision = Optional.empty();
      construct = Optional.empty();
      emit(new Label(blockLabel(block.id)));
      if (block.id == graph.entryBlock) {
        allocateStorage();
      }
      for (position = 0; position < block.statements.size(); ++position) {
        block.statements.get(position).acceptVisitor(this);
      }
      emitTerminator();
    }

    private void allocateStorage() {
      for (Symbol symbol : symbols.storageOf(graph.name)) {
        SemanticType type = symbol.kind == Symbol.Kind.ARRAY ? SemanticType.OBJECT : symbol.type;
        allocate(Slot.ofVariable(symbol.name), type);
      }
      for (int loop = 0; loop < forLoops.size(); ++loop) {
        allocate(limitSlot(loop), SemanticType.LONG);
        allocate(stepSlot(loop), SemanticType.LONG);
      }
      for (int try_ = 0; try_ < routedTries.size(); ++try_) {
        allocate(routeSlot(try_), SemanticType.LONG);
      }
      if (graph.kind == ControlFlowGraph.Kind.FUNCTION) {
        SemanticType type =
            symbols.lookup(graph.name, graph.name).map(s -> s.type).orElse(SemanticType.LONG);
        allocate(RESULT_SLOT, type);
      }
    }

    private void allocate(Slot slot, SemanticType type) {
      emit(new Allocate(slot, type));
      emit(new ZeroInit(slot, type));
    }

    private Temp evaluate(Expression expression) {
      Temp value = temps.next();
      emit(new Evaluate(value, expression));
      return value;
    }

    private Temp load(Operand address) {
      Temp value = temps.next();
      emit(new Load(value, address));
      return value;
    }

    private Temp compare(Relation relation, Operand left, Operand right) {
      Temp result = temps.next();
      emit(new Compare(result, relation, left, right));
      return result;
    }

    private Temp arith(Arith.Op op, Operand left, Operand right) {
      Temp result = temps.next();
      emit(new Arith(result, op, left, right));
      return result;
    }

    private Temp call(String function) {
      Temp result = temps.next();
      emit(RuntimeCall.returning(result, function));
      return result;
    }

    private Void decide(Statement statement, @Nullable Operand value) {
      construct = Optional.of(statement);
      decision = Optional.ofNullable(value);
      return null;
    }

    private Void straightLine(Statement statement) {
      statementEmitter.emit(statement, temps).forEach(this::emit);
      return null;
    }

    // Statements

    @Override
    public Void visitLabel(Statement.Label that) {
      return null;
    }

    @Override
    public Void visitLet(Statement.Let that) {
      return straightLine(that);
    }

    @Override
    public Void visitPrint(Statement.Print that) {
      return straightLine(that);
    }

    @Override
    public Void visitDim(Statement.Dim that) {
      return straightLine(that);
    }

    @Override
    public Void visitCallSub(Statement.CallSub that) {
      return straightLine(that);
    }

    @Override
    public Void visitRestore(Statement.Restore that) {
      return straightLine(that);
    }

    @Override
    public Void visitIf(Statement.If that) {
      return decide(that, evaluate(that.condition));
    }

    @Override
    public Void visitElseIf(Statement.ElseIf that) {
      return decide(that, evaluate(that.condition));
    }

    @Override
    public Void visitSelectCase(Statement.SelectCase that) {
      return decide(that, evaluate(that.selector));
    }

    @Override
    public Void visitFor(Statement.For that) {
      int loop = forLoops.get(that);
      Slot variable = Slot.ofVariable(that.variable);
      if (block.hasLabel(Labels.FOR_INIT)) {
        emit(new Store(evaluate(that.start), variable));
        emit(new Store(evaluate(that.limit), limitSlot(loop)));
        Operand step =
            that.step.isPresent() ? evaluate(that.step.get()) : new Immediate(1);
        emit(new Store(step, stepSlot(loop)));
        return decide(that, null);
      }
      if (block.hasLabel(Labels.FOR_HEADER)) {
        Temp value = load(variable);
        Temp limit = load(limitSlot(loop));
        Temp step = load(stepSlot(loop));
        Temp upwards = compare(Relation.LESS_EQUAL, value, limit);
        Temp downwards = compare(Relation.GREATER_EQUAL, value, limit);
        Temp ascending = compare(Relation.GREATER_EQUAL, step, new Immediate(0));
        Temp inRange = temps.next();
        emit(new Select(inRange, ascending, upwards, downwards));
        return decide(that, inRange);
      }
      if (block.hasLabel(Labels.FOR_INCREMENT)) {
        Temp value = load(variable);
        Temp step = load(stepSlot(loop));
        emit(new Store(arith(Arith.Op.ADD, value, step), variable));
      }
      return decide(that, null);
    }

    @Override
    public Void visitWhile(Statement.While that) {
      return decide(that, evaluate(that.condition));
    }

    @Override
    public Void visitDo(Statement.Do that) {
      if (block.hasLabel(Labels.DO_CONDITION) && that.postCondition.isPresent()) {
        return decide(that, evaluate(that.postCondition.get().expression));
      }
      if (that.preCondition.isPresent()) {
        return decide(that, evaluate(that.preCondition.get().expression));
      }
      return decide(that, null);
    }

    /*
     * Entering a handler's dispatch block always removes that handler, so the catch and finally
     * parts of a TRY run under the enclosing handler.
     */
    @Override
    public Void visitTry(Statement.Try that) {
      if (position == 0 && block.hasLabel(Labels.TRY_DISPATCH)) {
        return decide(that, call(RuntimeCall.ERR_CODE));
      }
      if (position == 0 && block.hasLabel(Labels.TRY_CATCH)) {
        emit(RuntimeCall.of(RuntimeCall.ERR_CLEAR));
        // The catch body follows in the same block.
        construct = Optional.empty();
        return null;
      }
      if (position == 0 && block.hasLabel(Labels.TRY_LEAVE)) {
        emit(RuntimeCall.of(RuntimeCall.TRY_LEAVE));
        return decide(that, null);
      }
      if (position == 0 && block.hasLabel(Labels.TRY_FINALLY_EXIT)) {
        return decide(that, call(RuntimeCall.ERR_PENDING));
      }
      if (position == 0 && block.hasLabel(Labels.TRY_FINALLY_ROUTE)) {
        return decide(that, load(routeSlot(routedTries.get(that))));
      }
      if (position == 0 && block.label.filter(Labels::isTryRoute).isPresent()) {
        int route = Labels.edgeIndex(block.label.get());
        emit(new Store(new Immediate(route + 1), routeSlot(routedTries.get(that))));
        return decide(that, null);
      }
      if (position == 0 && block.hasLabel(Labels.TRY_RETHROW)) {
        leaveHandlerBeforeRaising();
        return decide(that, null);
      }
      if (routedTries.containsKey(that)) {
        emit(new Store(new Immediate(0), routeSlot(routedTries.get(that))));
      }
      // Non-zero once an error unwound to this handler.
      return decide(that, call(RuntimeCall.TRY_ENTER));
    }

    @Override
    public Void visitThrow(Statement.Throw that) {
      emit(RuntimeCall.of(RuntimeCall.ERR_SET, evaluate(that.errorCode)));
      leaveHandlerBeforeRaising();
      return decide(that, null);
    }

    /**
     * An error raised in a TRY body goes to the dispatch of that TRY, whose handler is removed
     * first. Raised in a CATCH clause it runs the FINALLY of the TRY first, under the enclosing
     * handler.
     */
    private void leaveHandlerBeforeRaising() {
      boolean toDispatch =
          seq(graph.outgoing(block.id))
              .filter(CFGEdge::hasStaticTarget)
              .anyMatch(e -> graph.block(e.target).hasLabel(Labels.TRY_DISPATCH));
      if (toDispatch) {
        emit(RuntimeCall.of(RuntimeCall.TRY_LEAVE));
      }
    }

    @Override
    public Void visitGoto(Statement.Goto that) {
      return decide(that, null);
    }

    @Override
    public Void visitGosub(Statement.Gosub that) {
      return decide(that, null);
    }

    @Override
    public Void visitOnGoto(Statement.OnGoto that) {
      return decide(that, evaluate(that.selector));
    }

    @Override
    public Void visitOnGosub(Statement.OnGosub that) {
      return decide(that, evaluate(that.selector));
    }

    @Override
    public Void visitReturn(Statement.Return that) {
      if (that.value.isPresent()) {
        emit(new Store(evaluate(that.value.get()), RESULT_SLOT));
      } else if (that.target.isPresent()) {
        // The GOSUB frame is dropped, control goes to the line instead.
        popReturnStack();
      }
      return decide(that, null);
    }

    @Override
    public Void visitExit(Statement.Exit that) {
      return decide(that, null);
    }

    @Override
    public Void visitContinue(Statement.Continue that) {
      return decide(that, null);
    }

    @Override
    public Void visitEnd(Statement.End that) {
      emit(RuntimeCall.of(RuntimeCall.END));
      return decide(that, null);
    }

    // Terminators

    private void emitTerminator() {
      Optional<EdgeShape> shape = graph.shapeOf(block.id);
      if (!shape.isPresent()) {
        fallback("no terminator pattern for " + graph.outgoing(block.id));
        return;
      }
      shape
          .get()
          .<Void>match(
              this::terminal,
              this::unconditional,
              this::conditional,
              this::gosub,
              this::dispatchReturn,
              this::protectedRegion,
              this::multiway);
    }

    private void fallback(String reason) {
      warn(new UnknownEdgeShapeWarning(graph.name, block.id, reason));
      Optional<CFGEdge> first =
          seq(graph.outgoing(block.id)).filter(CFGEdge::hasStaticTarget).findFirst();
      if (first.isPresent()) {
        emit(new Jump(blockLabel(first.get().target)));
      } else {
        exitSequence();
      }
    }

    private Void terminal(EdgeShape.Terminal terminal) {
      boolean isThrow = construct.isPresent() && construct.get() instanceof Statement.Throw;
      if (isThrow || block.hasLabel(Labels.TRY_RETHROW)) {
        emit(new RuntimeError(RuntimeError.Kind.UNHANDLED_EXCEPTION));
      } else {
        exitSequence();
      }
      return null;
    }

    private void exitSequence() {
      switch (graph.kind) {
        case MAIN:
          emit(new Ret(new Immediate(0)));
          break;
        case FUNCTION:
          emit(new Ret(load(RESULT_SLOT)));
          break;
        default:
          emit(new Ret(null));
      }
    }

    private Void unconditional(EdgeShape.Unconditional unconditional) {
      emit(new Jump(blockLabel(unconditional.edge.target)));
      return null;
    }

    private Void conditional(EdgeShape.Conditional conditional) {
      if (!decision.isPresent()) {
        fallback("conditional edges without a condition");
        return null;
      }
      emit(
          new Branch(
              decision.get(),
              blockLabel(conditional.onTrue.target),
              blockLabel(conditional.onFalse.target)));
      return null;
    }

    private Void protectedRegion(EdgeShape.Protected region) {
      if (!decision.isPresent()) {
        fallback("exception edge without a TRY");
        return null;
      }
      emit(
          new Branch(
              decision.get(),
              blockLabel(region.exception.target),
              blockLabel(region.normal.target)));
      return null;
    }

    private Void gosub(EdgeShape.Gosub gosub) {
      Temp sp = load(Global.RETURN_SP);
      Temp full =
          compare(Relation.GREATER_EQUAL, sp, new Immediate(options.returnStackCapacity));
      String overflow = helperLabel("overflow");
      String push = helperLabel("push");
      emit(new Branch(full, overflow, push));
      emit(new Label(overflow));
      emit(new RuntimeError(RuntimeError.Kind.GOSUB_STACK_OVERFLOW));
      emit(new Label(push));
      emit(new StoreIndexed(new Immediate(gosub.continuation.target), Global.RETURN_STACK, sp));
      emit(new Store(arith(Arith.Op.ADD, sp, new Immediate(1)), Global.RETURN_SP));
      emit(new Jump(blockLabel(gosub.call.target)));
      return null;
    }

    /** Checks for an empty stack and decrements the stack pointer, which is returned. */
    private Temp popReturnStack() {
      Temp sp = load(Global.RETURN_SP);
      Temp isEmpty = compare(Relation.LESS_EQUAL, sp, new Immediate(0));
      String empty = helperLabel("empty");
      String pop = helperLabel("pop");
      emit(new Branch(isEmpty, empty, pop));
      emit(new Label(empty));
      emit(new RuntimeError(RuntimeError.Kind.RETURN_WITHOUT_GOSUB));
      emit(new Label(pop));
      Temp top = arith(Arith.Op.SUB, sp, new Immediate(1));
      emit(new Store(top, Global.RETURN_SP));
      return top;
    }

    private Void dispatchReturn(EdgeShape.Return ret) {
      Temp top = popReturnStack();
      Temp site = temps.next();
      emit(new LoadIndexed(site, Global.RETURN_STACK, top));
      for (int candidate : graph.gosubReturnBlocks) {
        Temp matches = compare(Relation.EQUAL, site, new Immediate(candidate));
        String next = helperLabel("dispatch");
        emit(new Branch(matches, blockLabel(candidate), next));
        emit(new Label(next));
      }
      emit(new RuntimeError(RuntimeError.Kind.DISPATCH_MISS));
      return null;
    }

    private Void multiway(EdgeShape.Multiway multiway) {
      if (!decision.isPresent() || !construct.isPresent() || !isMultiway(construct.get())) {
        fallback("case edges without a selector");
        return null;
      }
      Operand selector = decision.get();
      for (CFGEdge edge : multiway.cases) {
        int index = Labels.edgeIndex(edge.label.get());
        Optional<Operand> matches = caseMatches(construct.get(), index, selector);
        String next = helperLabel("case");
        if (matches.isPresent()) {
          emit(new Branch(matches.get(), blockLabel(edge.target), next));
        } else {
          emit(new Jump(blockLabel(edge.target)));
        }
        emit(new Label(next));
      }
      emit(new Jump(blockLabel(multiway.defaultEdge.target)));
      return null;
    }

    private boolean isMultiway(Statement statement) {
      return statement instanceof Statement.SelectCase
          || statement instanceof Statement.OnGoto
          || statement instanceof Statement.OnGosub
          || statement instanceof Statement.Try;
    }

    /** Whether case {@code index} applies, or empty if it always does. */
    private Optional<Operand> caseMatches(Statement statement, int index, Operand selector) {
      if (statement instanceof Statement.SelectCase) {
        Statement.SelectCase select = (Statement.SelectCase) statement;
        List<Operand> tests = new ArrayList<>();
        for (Statement.SelectCase.CaseTest test : select.cases.get(index).tests) {
          tests.add(caseTest(test, selector));
        }
        return Optional.of(anyOf(tests));
      }
      if (statement instanceof Statement.Try && block.hasLabel(Labels.TRY_FINALLY_ROUTE)) {
        return Optional.of(compare(Relation.EQUAL, selector, new Immediate(index + 1)));
      }
      if (statement instanceof Statement.Try) {
        Statement.Try.Catch handler = ((Statement.Try) statement).catches.get(index);
        if (handler.catchesAll()) {
          return Optional.empty();
        }
        List<Operand> tests = new ArrayList<>();
        for (int code : handler.errorCodes) {
          tests.add(compare(Relation.EQUAL, selector, new Immediate(code)));
        }
        return Optional.of(anyOf(tests));
      }
      // ON ... GOTO and ON ... GOSUB count their targets from 1.
      return Optional.of(compare(Relation.EQUAL, selector, new Immediate(index + 1)));
    }

    private Operand caseTest(Statement.SelectCase.CaseTest test, Operand selector) {
      return test.match(
          value -> compare(Relation.EQUAL, selector, evaluate(value.value)),
          range -> {
            Temp low = evaluate(range.low);
            Temp high = evaluate(range.high);
            Temp aboveLow = compare(Relation.GREATER_EQUAL, selector, low);
            Temp belowHigh = compare(Relation.LESS_EQUAL, selector, high);
            return arith(Arith.Op.AND, aboveLow, belowHigh);
          },
          is -> compare(Relation.fromBinOp(is.relation), selector, evaluate(is.value)));
    }

    private Operand anyOf(List<Operand> tests) {
      Operand result = tests.get(0);
      for (Operand test : tests.subList(1, tests.size())) {
        result = arith(Arith.Op.OR, result, test);
      }
      return result;
    }
  }
}
