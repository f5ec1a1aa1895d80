package basic.cfg.build;

import static basic.ast.Ast.body;
import static basic.ast.Ast.for_;
import static basic.ast.Ast.gosub;
import static basic.ast.Ast.goto_;
import static basic.ast.Ast.gt;
import static basic.ast.Ast.ifThenGoto;
import static basic.ast.Ast.if_;
import static basic.ast.Ast.label;
import static basic.ast.Ast.line;
import static basic.ast.Ast.num;
import static basic.ast.Ast.onGoto;
import static basic.ast.Ast.print;
import static basic.ast.Ast.restore;
import static basic.ast.Ast.retTo;
import static basic.ast.Ast.str;
import static basic.ast.Ast.var;
import static basic.ast.Ast.while_;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

import basic.ast.JumpTarget;
import basic.ast.Statement;
import basic.cfg.ConstructTooComplexError;
import java.util.List;
import org.junit.Test;

public class JumpTargetScannerTest {

  private static final JumpTarget L10 = JumpTarget.line(10);
  private static final JumpTarget L20 = JumpTarget.line(20);
  private static final JumpTarget L100 = JumpTarget.line(100);
  private static final JumpTarget L200 = JumpTarget.line(200);

  private static JumpTargets scan(List<Statement> body) {
    return JumpTargetScanner.scan("main", body, 64);
  }

  @Test
  public void referencedAndDefined_isLandingZone() throws Exception {
    JumpTargets targets = scan(body(goto_(100), line(100), line(200)));

    assertThat(targets.landingZones(), contains(L100));
    assertThat(targets.defined.keySet(), contains(L100, L200));
    assertThat(targets.isLandingZone(L200), is(false));
    assertThat(targets.unresolved(), is(empty()));
  }

  @Test
  public void undefinedReference_unresolved() throws Exception {
    JumpTargets targets = scan(body(goto_(300), line(100)));

    assertThat(targets.unresolved(), contains(JumpTarget.line(300)));
    assertThat(targets.landingZones(), is(empty()));
  }

  @Test
  public void labelAfterGosub_isReturnLandingZone() throws Exception {
    JumpTargets targets =
        scan(body(gosub(100), line(20), print(str("x")), line(100)));

    assertThat(targets.returnLandingZones, contains(L20));
    assertThat(targets.landingZones(), contains(L20, L100));
    assertThat(targets.referenced.containsKey(L20), is(false));
  }

  @Test
  public void nestedBodies_scanned() throws Exception {
    JumpTargets targets =
        scan(
            body(
                if_(gt(var("X"), num(0)), body(goto_(100))),
                for_("I", 1, 3, line(100), ifThenGoto(gt(var("I"), num(1)), 10)),
                line(10)));

    assertThat(targets.landingZones(), contains(L10, L100));
  }

  @Test
  public void onGotoAndReturnToLine_referenceTargets() throws Exception {
    JumpTargets targets =
        scan(
            body(onGoto(var("X"), 100, 200), retTo(20), line(20), line(100), line(200)));

    assertThat(targets.referenced.keySet(), contains(L20, L100, L200));
  }

  @Test
  public void lineNumbersOrderBeforeLabels() throws Exception {
    JumpTargets targets =
        scan(
            body(goto_("done"), goto_(100), label("done"), line(100)));

    assertThat(targets.landingZones(), contains(L100, JumpTarget.label("done")));
  }

  @Test
  public void restore_mustBeDefinedButStartsNoBlock() throws Exception {
    JumpTargets targets = scan(body(restore("data"), label("data"), restore("nowhere")));

    assertThat(
        targets.restored.keySet(),
        contains(JumpTarget.label("data"), JumpTarget.label("nowhere")));
    assertThat(targets.unresolved(), contains(JumpTarget.label("nowhere")));
    assertThat(targets.landingZones(), is(empty()));
  }

  @Test
  public void restoreWithoutTarget_recordsNothing() throws Exception {
    JumpTargets targets = scan(body(restore(), label("data")));

    assertThat(targets.restored.keySet(), is(empty()));
    assertThat(targets.unresolved(), is(empty()));
  }

  @Test
  public void nestingAtTheBound_scanned() throws Exception {
    assertThat(JumpTargetScanner.scan("main", nestedWhiles(3), 3).unresolved(), is(empty()));
  }

  @Test(expected = ConstructTooComplexError.class)
  public void nestingPastTheBound_tooComplex() throws Exception {
    JumpTargetScanner.scan("main", nestedWhiles(4), 3);
  }

  @Test(expected = ConstructTooComplexError.class)
  public void veryDeepNesting_tooComplexRatherThanOverflowing() throws Exception {
    scan(nestedWhiles(20000));
  }

  static List<Statement> nestedWhiles(int depth) {
    Statement statement = print(str("x"));
    for (int i = 0; i < depth; i++) {
      statement = while_(gt(var("X"), num(0)), statement);
    }
    return body(statement);
  }
}
