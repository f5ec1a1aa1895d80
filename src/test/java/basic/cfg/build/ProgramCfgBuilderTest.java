package basic.cfg.build;

import static basic.ast.Ast.body;
import static basic.ast.Ast.exit;
import static basic.ast.Ast.function;
import static basic.ast.Ast.goto_;
import static basic.ast.Ast.gt;
import static basic.ast.Ast.line;
import static basic.ast.Ast.num;
import static basic.ast.Ast.print;
import static basic.ast.Ast.program;
import static basic.ast.Ast.ret;
import static basic.ast.Ast.retValue;
import static basic.ast.Ast.str;
import static basic.ast.Ast.sub;
import static basic.ast.Ast.var;
import static basic.ast.Ast.while_;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresent;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.jooq.lambda.Seq.seq;

import basic.ast.Construct;
import basic.ast.JumpTarget;
import basic.ast.Statement;
import basic.cfg.ConstructTooComplexError;
import basic.cfg.ControlFlowGraph;
import basic.cfg.ProgramCfg;
import basic.cfg.StructuralError;
import basic.cfg.UnresolvedLabelError;
import org.junit.Test;

public class ProgramCfgBuilderTest {

  @Test
  public void everyRoutineGetsItsOwnGraph() throws Exception {
    ProgramCfg cfgs =
        ProgramCfgBuilder.build(
            program(
                body(print(str("main"))),
                sub("b", print(str("b"))),
                function("a", retValue(num(1)))),
            CfgOptions.DEFAULT);

    assertThat(cfgs.hasErrors(), is(false));
    assertThat(seq(cfgs.all()).map(g -> g.name).toList(), contains("main", "a", "b"));
    assertThat(cfgs.graphOf("a").get().kind, is(ControlFlowGraph.Kind.FUNCTION));
    assertThat(cfgs.graphOf("b").get().kind, is(ControlFlowGraph.Kind.SUB));
    assertThat(cfgs.graphOf("main"), isPresent());
    assertThat(cfgs.graphOf("missing"), isEmpty());
  }

  @Test
  public void brokenRoutine_reportedWhileOthersBuild() throws Exception {
    ProgramCfg cfgs =
        ProgramCfgBuilder.build(
            program(
                body(print(str("main"))),
                sub("broken", exit(Construct.FOR)),
                sub("fine", print(str("ok")))),
            CfgOptions.DEFAULT);

    assertThat(cfgs.errors.size(), is(1));
    assertThat(cfgs.errors.get(0), instanceOf(StructuralError.class));
    assertThat(cfgs.errors.get(0).routine, is("broken"));
    assertThat(cfgs.main, isPresent());
    assertThat(cfgs.routines.keySet(), contains("fine"));
  }

  @Test
  public void brokenMain_reportedAndRoutinesStillBuilt() throws Exception {
    ProgramCfg cfgs =
        ProgramCfgBuilder.build(
            program(body(goto_(10)), sub("s", print(str("x")))), CfgOptions.DEFAULT);

    assertThat(cfgs.main, isEmpty());
    assertThat(cfgs.errors.get(0), instanceOf(UnresolvedLabelError.class));
    assertThat(cfgs.routines.keySet(), contains("s"));
  }

  @Test
  public void lineNumbersAreRoutineLocal() throws Exception {
    ProgramCfg cfgs =
        ProgramCfgBuilder.build(
            program(body(line(10), print(str("main"))), sub("s", goto_(10), line(10), ret())),
            CfgOptions.DEFAULT);

    assertThat(cfgs.hasErrors(), is(false));
    assertThat(cfgs.main.get().lineToBlock.isEmpty(), is(true));
    assertThat(
        cfgs.routines.get("s").lineToBlock.containsKey(JumpTarget.line(10)), is(true));
  }

  @Test
  public void veryDeepRoutine_tooComplexWhileOthersBuild() throws Exception {
    Statement deep = print(str("x"));
    for (int i = 0; i < 20000; i++) {
      deep = while_(gt(var("X"), num(0)), deep);
    }
    ProgramCfg cfgs =
        ProgramCfgBuilder.build(
            program(body(print(str("main"))), sub("deep", deep), sub("flat", print(str("ok")))),
            CfgOptions.DEFAULT);

    assertThat(cfgs.errors.size(), is(1));
    assertThat(cfgs.errors.get(0), instanceOf(ConstructTooComplexError.class));
    assertThat(cfgs.errors.get(0).routine, is("deep"));
    assertThat(cfgs.main, isPresent());
    assertThat(cfgs.routines.keySet(), contains("flat"));
  }
}
