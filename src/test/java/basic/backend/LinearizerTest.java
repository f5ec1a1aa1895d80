package basic.backend;

import static basic.ast.Ast.body;
import static basic.ast.Ast.case_;
import static basic.ast.Ast.catch_;
import static basic.ast.Ast.end;
import static basic.ast.Ast.exit;
import static basic.ast.Ast.forStep;
import static basic.ast.Ast.for_;
import static basic.ast.Ast.function;
import static basic.ast.Ast.gosub;
import static basic.ast.Ast.isRelation;
import static basic.ast.Ast.label;
import static basic.ast.Ast.line;
import static basic.ast.Ast.num;
import static basic.ast.Ast.onGoto;
import static basic.ast.Ast.print;
import static basic.ast.Ast.program;
import static basic.ast.Ast.range;
import static basic.ast.Ast.restore;
import static basic.ast.Ast.ret;
import static basic.ast.Ast.retValue;
import static basic.ast.Ast.select;
import static basic.ast.Ast.str;
import static basic.ast.Ast.throw_;
import static basic.ast.Ast.try_;
import static basic.ast.Ast.var;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.jooq.lambda.Seq.seq;

import basic.ast.Ast;
import basic.ast.BinOp;
import basic.ast.Construct;
import basic.ast.Statement;
import basic.backend.instructions.Comment;
import basic.backend.instructions.Compare;
import basic.backend.instructions.Instruction;
import basic.backend.instructions.Relation;
import basic.backend.instructions.RuntimeError;
import basic.backend.operands.Immediate;
import basic.backend.syntax.IlSyntax;
import basic.cfg.BasicBlock;
import basic.cfg.CFGEdge;
import basic.cfg.ControlFlowGraph;
import basic.cfg.EdgeType;
import basic.cfg.Labels;
import basic.cfg.StructuralError;
import basic.cfg.build.CfgBuilder;
import basic.cfg.build.CfgOptions;
import basic.semantic.SemanticType;
import basic.semantic.Symbol;
import basic.semantic.SymbolTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.junit.Test;

public class LinearizerTest {

  private static final String NL = System.lineSeparator();

  private static Linearization linearize(SymbolTable symbols, Statement... main) {
    ControlFlowGraph graph = new CfgBuilder().buildMain(program(main));
    return new Linearizer(symbols, CfgOptions.DEFAULT).linearize(graph);
  }

  private static Linearization linearize(Statement... main) {
    return linearize(SymbolTable.of(), main);
  }

  /** The IL of {@code block}, one instruction per entry. */
  private static List<String> il(Linearization linearization, int block) {
    return seq(linearization.instructionsOf(block))
        .map(IlSyntax::formatInstruction)
        .map(s -> s.replace(NL + "    ", "; "))
        .toList();
  }

  /** The first block labeled {@code label} that satisfies {@code filter}. */
  private static int block(
      Linearization linearization, String label, Predicate<BasicBlock> filter) {
    return seq(linearization.graph.blocks)
        .filter(b -> b.hasLabel(label))
        .filter(filter)
        .findFirst()
        .get()
        .id;
  }

  private static int block(Linearization linearization, String label) {
    return block(linearization, label, b -> true);
  }

  private static Instruction last(Linearization linearization, int block) {
    List<Instruction> instructions = linearization.instructionsOf(block);
    return instructions.get(instructions.size() - 1);
  }

  @Test
  public void gosub_pushesReturnSiteAndJumps() throws Exception {
    Linearization linearization =
        linearize(
            line(10), gosub(100), print(str("back")), line(100), print(str("sub")), ret());

    assertThat(
        il(linearization, 0),
        contains(
            "@bb0",
            "%t0 =l loadl $return_sp",
            "%t1 =w csgel %t0, 16",
            "jnz %t1, @bb0.overflow0, @bb0.push1",
            "@bb0.overflow0",
            "call $basic_runtime_error(w 1); hlt",
            "@bb0.push1",
            "storew 2, $return_stack[%t0]",
            "%t2 =l add %t0, 1",
            "storel %t2, $return_sp",
            "jmp @bb1"));
    assertThat(il(linearization, 2), contains("@bb2", "exec \"PRINT \"back\"\"", "jmp @bb1"));
  }

  @Test
  public void return_popsAndDispatchesOnSite() throws Exception {
    Linearization linearization =
        linearize(
            line(10), gosub(100), print(str("back")), line(100), print(str("sub")), ret());

    assertThat(
        il(linearization, 1),
        contains(
            "@bb1",
            "exec \"PRINT \"sub\"\"",
            "%t3 =l loadl $return_sp",
            "%t4 =w cslel %t3, 0",
            "jnz %t4, @bb1.empty2, @bb1.pop3",
            "@bb1.empty2",
            "call $basic_runtime_error(w 2); hlt",
            "@bb1.pop3",
            "%t5 =l sub %t3, 1",
            "storel %t5, $return_sp",
            "%t6 =w loadw $return_stack[%t5]",
            "%t7 =w ceql %t6, 2",
            "jnz %t7, @bb2, @bb1.dispatch4",
            "@bb1.dispatch4",
            "call $basic_runtime_error(w 3); hlt"));
  }

  @Test
  public void return_twoSites_comparedInAscendingOrder() throws Exception {
    Linearization linearization =
        linearize(
            gosub(100),
            print(str("a")),
            gosub(100),
            print(str("b")),
            end(),
            line(100),
            print(str("sub")),
            ret());

    List<Long> sites =
        seq(linearization.instructionsOf(1))
            .ofType(Compare.class)
            .filter(c -> c.relation == Relation.EQUAL)
            .map(c -> ((Immediate) c.right).value)
            .toList();
    assertThat(sites, contains(2L, 3L));
    Instruction last = last(linearization, 1);
    assertThat(last, instanceOf(RuntimeError.class));
    assertThat(((RuntimeError) last).kind, is(RuntimeError.Kind.DISPATCH_MISS));
  }

  @Test
  public void gosub_stackCapacityFromOptions() throws Exception {
    ControlFlowGraph graph =
        new CfgBuilder().buildMain(program(gosub(100), end(), line(100), ret()));
    Linearizer linearizer =
        new Linearizer(SymbolTable.of(), CfgOptions.DEFAULT.withReturnStackCapacity(4));

    Linearization linearization = linearizer.linearize(graph);

    assertThat(il(linearization, 0), hasItem("%t1 =w csgel %t0, 4"));
    assertThat(linearizer.module(ImmutableList.of(linearization)).returnStackCapacity, is(4));
  }

  @Test
  public void forLoop_initHeaderAndIncrement() throws Exception {
    Linearization linearization =
        linearize(
            SymbolTable.of(Symbol.global("I", SemanticType.LONG)),
            forStep("I", 1, 10, 2, print(var("I"))));

    assertThat(
        il(linearization, 0),
        contains(
            "@bb0",
            "%v.I =l alloc8 8",
            "storel 0, %v.I",
            "%for0.limit =l alloc8 8",
            "storel 0, %for0.limit",
            "%for0.step =l alloc8 8",
            "storel 0, %for0.step",
            "jmp @bb1"));
    assertThat(
        il(linearization, 1),
        contains(
            "@bb1",
            "%t0 =l eval \"1\"",
            "storel %t0, %v.I",
            "%t1 =l eval \"10\"",
            "storel %t1, %for0.limit",
            "%t2 =l eval \"2\"",
            "storel %t2, %for0.step",
            "jmp @bb2"));
    assertThat(
        il(linearization, 2),
        contains(
            "@bb2",
            "%t3 =l loadl %v.I",
            "%t4 =l loadl %for0.limit",
            "%t5 =l loadl %for0.step",
            "%t6 =w cslel %t3, %t4",
            "%t7 =w csgel %t3, %t4",
            "%t8 =w csgel %t5, 0",
            "%t9 =l sel %t8, %t6, %t7",
            "jnz %t9, @bb3, @bb5"));
    assertThat(
        il(linearization, 4),
        contains(
            "@bb4",
            "%t10 =l loadl %v.I",
            "%t11 =l loadl %for0.step",
            "%t12 =l add %t10, %t11",
            "storel %t12, %v.I",
            "jmp @bb2"));
    assertThat(il(linearization, 5), contains("@bb5", "ret 0"));
  }

  @Test
  public void forLoop_withoutStep_storesOne() throws Exception {
    Linearization linearization = linearize(for_("I", 1, 3, print(var("I"))));

    assertThat(il(linearization, 1), hasItem("storel 1, %for0.step"));
  }

  @Test
  public void twoForLoops_ownLimitAndStepSlots() throws Exception {
    Linearization linearization =
        linearize(for_("I", 1, 3, print(var("I"))), for_("J", 1, 3, print(var("J"))));

    assertThat(il(linearization, 0), hasItem("%for1.step =l alloc8 8"));
  }

  @Test
  public void selectCase_testsOrChainedPerCase() throws Exception {
    Linearization linearization =
        linearize(
            select(
                var("X"),
                ImmutableList.of(
                    case_(Ast.is(1), print(str("a"))),
                    case_(ImmutableList.of(range(2, 4), isRelation(BinOp.GT, 9)), print(str("b")))),
                body(print(str("c")))));

    assertThat(
        il(linearization, 0),
        contains(
            "@bb0",
            "%t0 =l eval \"X\"",
            "%t1 =l eval \"1\"",
            "%t2 =w ceql %t0, %t1",
            "jnz %t2, @bb2, @bb0.case0",
            "@bb0.case0",
            "%t3 =l eval \"2\"",
            "%t4 =l eval \"4\"",
            "%t5 =w csgel %t0, %t3",
            "%t6 =w cslel %t0, %t4",
            "%t7 =l and %t5, %t6",
            "%t8 =l eval \"9\"",
            "%t9 =w csgtl %t0, %t8",
            "%t10 =l or %t7, %t9",
            "jnz %t10, @bb3, @bb0.case1",
            "@bb0.case1",
            "jmp @bb4"));
  }

  @Test
  public void onGoto_comparesAgainstOneBasedIndex() throws Exception {
    Linearization linearization =
        linearize(
            onGoto(var("X"), 100, 200),
            print(str("none")),
            line(100),
            print(str("a")),
            line(200),
            print(str("b")));

    assertThat(
        il(linearization, 0),
        contains(
            "@bb0",
            "%t0 =l eval \"X\"",
            "%t1 =w ceql %t0, 1",
            "jnz %t1, @bb1, @bb0.case0",
            "@bb0.case0",
            "%t2 =w ceql %t0, 2",
            "jnz %t2, @bb2, @bb0.case1",
            "@bb0.case1",
            "jmp @bb3"));
  }

  @Test
  public void tryCatchFinally_runtimeCalls() throws Exception {
    Linearization linearization =
        linearize(
            try_(
                body(print(str("a")), throw_(5)),
                ImmutableList.of(catch_(ImmutableList.of(5), print(str("b")))),
                body(print(str("c")))),
            print(str("d")));

    assertThat(
        il(linearization, 0),
        contains("@bb0", "%t0 =l call $basic_try_enter()", "jnz %t0, @bb2, @bb1"));
    assertThat(
        il(linearization, 1),
        contains(
            "@bb1",
            "exec \"PRINT \"a\"\"",
            "%t1 =l eval \"5\"",
            "call $basic_err_set(l %t1)",
            "call $basic_try_leave()",
            "jmp @bb2"));
    assertThat(
        il(linearization, 2),
        contains(
            "@bb2",
            "%t2 =l call $basic_err_code()",
            "%t3 =w ceql %t2, 5",
            "jnz %t3, @bb7, @bb2.case0",
            "@bb2.case0",
            "jmp @bb3"));
    assertThat(
        il(linearization, 7),
        contains("@bb7", "call $basic_err_clear()", "exec \"PRINT \"b\"\"", "jmp @bb3"));
    assertThat(
        il(linearization, 8),
        contains("@bb8", "%t4 =l call $basic_err_pending()", "jnz %t4, @bb9, @bb4"));
    assertThat(il(linearization, 9), contains("@bb9", "call $basic_runtime_error(w 4); hlt"));
  }

  @Test
  public void exitFromTryWithFinally_recordsRouteAndPicksItAfterFinally() throws Exception {
    Linearization linearization =
        linearize(
            for_(
                "I",
                1,
                3,
                try_(
                    body(exit(Construct.FOR)),
                    ImmutableList.of(catch_(ImmutableList.of(), print(str("c")))),
                    body(print(str("f"))))));
    int finally_ = block(linearization, Labels.TRY_FINALLY);
    int route = block(linearization, Labels.tryRoute(0));
    int leave = block(linearization, Labels.TRY_LEAVE);
    int select = block(linearization, Labels.TRY_FINALLY_ROUTE);
    int forExit = block(linearization, Labels.FOR_EXIT);
    int increment = block(linearization, Labels.FOR_INCREMENT);

    int protectedEntry = block(linearization, Labels.FOR_BODY);

    assertThat(il(linearization, 0), hasItem("%try0.route =l alloc8 8"));
    assertThat(il(linearization, protectedEntry), hasItem("storel 0, %try0.route"));
    assertThat(
        il(linearization, protectedEntry), hasItem(containsString("call $basic_try_enter()")));
    assertThat(
        il(linearization, leave),
        contains(
            Linearizer.blockLabel(leave),
            "call $basic_try_leave()",
            "jmp " + Linearizer.blockLabel(route)));
    assertThat(
        il(linearization, route),
        contains(
            Linearizer.blockLabel(route),
            "storel 1, %try0.route",
            "jmp " + Linearizer.blockLabel(finally_)));
    List<String> picked = il(linearization, select);
    assertThat(picked, hasItem(containsString("loadl %try0.route")));
    assertThat(picked, hasItem(containsString(", 1")));
    assertThat(picked, hasItem(containsString(Linearizer.blockLabel(forExit) + ", ")));
    assertThat(picked.get(picked.size() - 1), is("jmp " + Linearizer.blockLabel(increment)));
  }

  @Test
  public void throwInCatchWithFinally_runsFinallyUnderOuterHandler() throws Exception {
    Linearization linearization =
        linearize(
            try_(
                body(
                    try_(
                        body(throw_(1)),
                        ImmutableList.of(catch_(ImmutableList.of(1), throw_(3))),
                        body(print(str("f"))))),
                ImmutableList.of(catch_(ImmutableList.of(2), print(str("o")))),
                null));
    int handler =
        block(
            linearization,
            Labels.TRY_CATCH,
            b -> seq(b.statements).anyMatch(s -> s instanceof Statement.Throw));
    int finally_ = block(linearization, Labels.TRY_FINALLY);
    int rethrow =
        block(
            linearization,
            Labels.TRY_RETHROW,
            b -> !linearization.graph.outgoing(b.id).isEmpty());

    assertThat(il(linearization, handler), hasItem(containsString("call $basic_err_set(")));
    assertThat(il(linearization, handler), not(hasItem("call $basic_try_leave()")));
    List<String> raised = il(linearization, handler);
    assertThat(raised.get(raised.size() - 1), is("jmp " + Linearizer.blockLabel(finally_)));
    assertThat(il(linearization, rethrow), hasItem("call $basic_try_leave()"));
  }

  @Test
  public void tryWithoutRoutes_noRouteSlot() throws Exception {
    Linearization linearization =
        linearize(
            try_(
                body(print(str("a"))),
                ImmutableList.of(catch_(ImmutableList.of())),
                body(print(str("f")))));

    assertThat(
        seq(linearization.function.instructions)
            .map(IlSyntax::formatInstruction)
            .anyMatch(s -> s.contains("route")),
        is(false));
  }

  @Test
  public void restore_goesThroughEmitter() throws Exception {
    Linearization linearization = linearize(label("data"), restore("data"));

    assertThat(il(linearization, 0), hasItem("exec \"RESTORE data\""));
  }

  @Test
  public void catchAll_jumpsWithoutCompare() throws Exception {
    Linearization linearization =
        linearize(
            try_(
                body(throw_(5)),
                ImmutableList.of(catch_(ImmutableList.of(), print(str("any")))),
                null));

    assertThat(
        seq(linearization.instructionsOf(2)).ofType(Compare.class).toList(), is(empty()));
    int handler =
        seq(linearization.graph.outgoing(2))
            .filter(e -> e.label.equals(Optional.of(Labels.catchEdge(0))))
            .findFirst()
            .get()
            .target;
    assertThat(il(linearization, 2), hasItem("jmp " + Linearizer.blockLabel(handler)));
  }

  @Test
  public void unhandledThrow_runtimeError() throws Exception {
    Linearization linearization = linearize(throw_(3));

    assertThat(
        il(linearization, 0),
        contains(
            "@bb0",
            "%t0 =l eval \"3\"",
            "call $basic_err_set(l %t0)",
            "call $basic_runtime_error(w 4); hlt"));
  }

  @Test
  public void entryBlock_allocatesStorageSortedByName() throws Exception {
    SymbolTable symbols =
        SymbolTable.of(
            Symbol.global("X", SemanticType.INTEGER),
            Symbol.global("S", SemanticType.STRING),
            Symbol.globalArray("A", SemanticType.INTEGER),
            Symbol.local("other", "L", SemanticType.LONG));

    Linearization linearization = linearize(symbols, print(var("X")));

    assertThat(
        il(linearization, 0),
        contains(
            "@bb0",
            "%v.A =l alloc8 8",
            "storel 0, %v.A",
            "%v.S =l alloc8 8",
            "storel 0, %v.S",
            "%v.X =l alloc4 4",
            "storew 0, %v.X",
            "exec \"PRINT X\"",
            "ret 0"));
  }

  @Test
  public void function_resultSlotAndExit() throws Exception {
    ControlFlowGraph graph = new CfgBuilder().build(function("f", retValue(num(1))));

    Linearization linearization =
        new Linearizer(SymbolTable.of(), CfgOptions.DEFAULT).linearize(graph);

    assertThat(
        il(linearization, 0),
        contains(
            "@bb0",
            "%result =l alloc8 8",
            "storel 0, %result",
            "%t0 =l eval \"1\"",
            "storel %t0, %result",
            "jmp @bb1"));
    assertThat(il(linearization, 1), contains("@bb1", "%t1 =l loadl %result", "ret %t1"));
  }

  @Test
  public void function_resultTypeFromSymbolTable() throws Exception {
    ControlFlowGraph graph = new CfgBuilder().build(function("f", retValue(num(1))));
    SymbolTable symbols =
        SymbolTable.of(
            new Symbol(
                "f", SemanticType.INTEGER, Symbol.Scope.GLOBAL, null, Symbol.Kind.FUNCTION, false));

    Linearization linearization = new Linearizer(symbols, CfgOptions.DEFAULT).linearize(graph);

    assertThat(il(linearization, 0), hasItem("%result =l alloc4 4"));
  }

  @Test
  public void end_callsRuntimeAndReturns() throws Exception {
    Linearization linearization = linearize(end());

    assertThat(il(linearization, 0), contains("@bb0", "call $basic_end()", "ret 0"));
  }

  @Test
  public void unreachableBlock_emittedWithWarning() throws Exception {
    ControlFlowGraph graph =
        new CfgBuilder(CfgOptions.DEFAULT.withEliminateDeadBlocks(false))
            .buildMain(program(end(), print(str("dead"))));

    Linearization linearization =
        new Linearizer(SymbolTable.of(), CfgOptions.DEFAULT).linearize(graph);

    assertThat(linearization.emissionOrder, contains(0, 1));
    assertThat(linearization.reachable, contains(0));
    assertThat(linearization.warnings.size(), is(1));
    assertThat(linearization.warnings.get(0), instanceOf(UnreachableBlockWarning.class));
    assertThat(linearization.warnings.get(0).block, is(1));
  }

  @Test
  public void illegalShape_fallsBackToFirstEdge() throws Exception {
    Statement print = print(str("x"));
    ControlFlowGraph graph =
        ControlFlowGraph.create(
            "main",
            ControlFlowGraph.Kind.MAIN,
            0,
            ImmutableList.of(
                new BasicBlock(0, null, ImmutableList.of(print), false),
                new BasicBlock(1, null, ImmutableList.of(print), false),
                new BasicBlock(2, null, ImmutableList.of(print), false)),
            ImmutableList.of(
                new CFGEdge(0, 1, EdgeType.FALLTHROUGH), new CFGEdge(0, 2, EdgeType.FALLTHROUGH)),
            ImmutableSet.of(),
            ImmutableMap.of());

    Linearization linearization =
        new Linearizer(SymbolTable.of(), CfgOptions.DEFAULT).linearize(graph);

    assertThat(linearization.warnings.size(), is(1));
    assertThat(linearization.warnings.get(0), instanceOf(UnknownEdgeShapeWarning.class));
    assertThat(linearization.warnings.get(0).block, is(0));
    assertThat(IlSyntax.formatInstruction(last(linearization, 0)), is("jmp @bb1"));
  }

  @Test(expected = StructuralError.class)
  public void missingReturnSite_structuralError() throws Exception {
    ControlFlowGraph graph =
        ControlFlowGraph.create(
            "main",
            ControlFlowGraph.Kind.MAIN,
            0,
            ImmutableList.of(new BasicBlock(0, null, ImmutableList.of(), false)),
            ImmutableList.of(),
            ImmutableSet.of(7),
            ImmutableMap.of());

    new Linearizer(SymbolTable.of(), CfgOptions.DEFAULT).linearize(graph);
  }

  @Test
  public void straightLineStatements_goThroughEmitter() throws Exception {
    StatementEmitter emitter = (statement, temps) -> ImmutableList.of(new Comment("custom"));
    ControlFlowGraph graph = new CfgBuilder().buildMain(program(print(str("x"))));

    Linearization linearization =
        new Linearizer(SymbolTable.of(), emitter, CfgOptions.DEFAULT).linearize(graph);

    assertThat(il(linearization, 0), contains("@bb0", "# custom", "ret 0"));
  }

  @Test
  public void function_instructionsOfAllBlocksInEmissionOrder() throws Exception {
    Linearization linearization = linearize(for_("I", 1, 3, print(var("I"))));

    int total = seq(linearization.emissionOrder).mapToInt(b -> il(linearization, b).size()).sum();
    assertThat(linearization.function.instructions.size(), is(total));
    assertThat(
        IlSyntax.formatInstruction(linearization.function.instructions.get(0)), is("@bb0"));
  }
}
