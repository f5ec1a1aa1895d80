package basic.util;

import static basic.ast.Ast.bin;
import static basic.ast.Ast.body;
import static basic.ast.Ast.case_;
import static basic.ast.Ast.catch_;
import static basic.ast.Ast.exit;
import static basic.ast.Ast.forStep;
import static basic.ast.Ast.gt;
import static basic.ast.Ast.ifElse;
import static basic.ast.Ast.is;
import static basic.ast.Ast.isRelation;
import static basic.ast.Ast.label;
import static basic.ast.Ast.line;
import static basic.ast.Ast.loopUntil;
import static basic.ast.Ast.num;
import static basic.ast.Ast.onGosub;
import static basic.ast.Ast.plus;
import static basic.ast.Ast.print;
import static basic.ast.Ast.range;
import static basic.ast.Ast.ret;
import static basic.ast.Ast.retTo;
import static basic.ast.Ast.retValue;
import static basic.ast.Ast.select;
import static basic.ast.Ast.str;
import static basic.ast.Ast.sub;
import static basic.ast.Ast.throw_;
import static basic.ast.Ast.try_;
import static basic.ast.Ast.var;
import static java.lang.String.format;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

import basic.ast.BinOp;
import basic.ast.Construct;
import basic.ast.Statement;
import com.google.common.collect.ImmutableList;
import org.junit.Test;

public class PrettyPrinterTest {

  private static String render(Statement statement) {
    return statement.acceptVisitor(new PrettyPrinter()).toString();
  }

  @Test
  public void expression_outerParenthesesDropped() throws Exception {
    String actual =
        PrettyPrinter.print(plus(var("X"), bin(BinOp.MULTIPLY, var("Y"), num(2))));

    assertThat(actual, equalTo("X + (Y * 2)"));
  }

  @Test
  public void ifElse_indentedBodies() throws Exception {
    Statement statement =
        ifElse(gt(var("X"), num(0)), body(print(str("pos"))), body(print(str("neg"))));

    assertThat(
        render(statement),
        equalTo(format("IF X > 0 THEN%n  PRINT \"pos\"%nELSE%n  PRINT \"neg\"%nEND IF")));
  }

  @Test
  public void header_forWithoutBody() throws Exception {
    Statement statement = forStep("I", 1, 10, 2, print(var("I")));

    assertThat(PrettyPrinter.header(statement), equalTo("FOR I = 1 TO 10 STEP 2"));
  }

  @Test
  public void selectCase_allTestKinds() throws Exception {
    Statement statement =
        select(
            var("X"),
            ImmutableList.of(
                case_(ImmutableList.of(is(1), range(2, 4)), print(str("low"))),
                case_(isRelation(BinOp.GT, 9), print(str("high")))),
            body(print(str("other"))));

    assertThat(
        render(statement),
        equalTo(
            format(
                "SELECT CASE X%n"
                    + "  CASE 1, 2 TO 4%n"
                    + "    PRINT \"low\"%n"
                    + "  CASE IS > 9%n"
                    + "    PRINT \"high\"%n"
                    + "  CASE ELSE%n"
                    + "    PRINT \"other\"%n"
                    + "END SELECT")));
  }

  @Test
  public void postTestDo_conditionAfterLoop() throws Exception {
    Statement statement = loopUntil(gt(var("I"), num(10)), print(var("I")));

    assertThat(render(statement), equalTo(format("DO%n  PRINT I%nLOOP UNTIL I > 10")));
  }

  @Test
  public void try_catchClausesAndFinally() throws Exception {
    Statement statement =
        try_(
            body(throw_(5)),
            ImmutableList.of(
                catch_(ImmutableList.of(5, 6), print(str("caught"))),
                catch_(ImmutableList.of(), print(str("any")))),
            body(print(str("done"))));

    assertThat(
        render(statement),
        equalTo(
            format(
                "TRY%n"
                    + "  THROW 5%n"
                    + "CATCH 5, 6%n"
                    + "  PRINT \"caught\"%n"
                    + "CATCH%n"
                    + "  PRINT \"any\"%n"
                    + "FINALLY%n"
                    + "  PRINT \"done\"%n"
                    + "END TRY")));
  }

  @Test
  public void transfers() throws Exception {
    assertThat(render(onGosub(var("X"), 100, 200)), equalTo("ON X GOSUB 100, 200"));
    assertThat(render(ret()), equalTo("RETURN"));
    assertThat(render(retTo(20)), equalTo("RETURN 20"));
    assertThat(render(retValue(plus(var("A"), num(1)))), equalTo("RETURN A + 1"));
    assertThat(render(exit(Construct.FOR)), equalTo("EXIT FOR"));
  }

  @Test
  public void labels() throws Exception {
    assertThat(render(line(100)), equalTo("100"));
    assertThat(render(label("done")), equalTo("done:"));
  }

  @Test
  public void printRoutine() throws Exception {
    CharSequence actual = new PrettyPrinter().printRoutine(sub("s", print(str("x"))));

    assertThat(actual.toString(), equalTo(format("SUB s()%n  PRINT \"x\"%nEND SUB")));
  }
}
