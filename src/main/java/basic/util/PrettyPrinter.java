package basic.util;

import basic.ast.Expression;
import basic.ast.JumpTarget;
import basic.ast.Routine;
import basic.ast.Statement;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An implementation of an AST visitor that pretty-prints statements and expressions back to
 * BASIC source code.
 *
 * <p>Instances of this class <em>are</em> stateful (e.g., current indentation level). It is very
 * cheap to create new instances of this class and therefore it is generally not advisable to reuse
 * instances.
 */
public class PrettyPrinter
    implements Statement.Visitor<CharSequence>, Expression.Visitor<CharSequence> {

  private static final String NL = System.lineSeparator();
  private int indentLevel = 0;

  public PrettyPrinter() {}

  /** The first line of {@code statement}, e.g. {@code FOR I = 1 TO 5} without the loop body. */
  public static String header(Statement statement) {
    String full = statement.acceptVisitor(new PrettyPrinter()).toString();
    int newline = full.indexOf(NL);
    return newline < 0 ? full : full.substring(0, newline);
  }

  public static String print(Expression expression) {
    return outerParenthesesRemoved(expression.acceptVisitor(new PrettyPrinter())).toString();
  }

  private static CharSequence outerParenthesesRemoved(CharSequence seq) {
    if (seq.length() > 1 && seq.charAt(0) == '(' && seq.charAt(seq.length() - 1) == ')') {
      return seq.subSequence(1, seq.length() - 1);
    }
    return seq;
  }

  private CharSequence indent() {
    return Strings.repeat("  ", indentLevel);
  }

  public CharSequence printRoutine(Routine routine) {
    StringBuilder sb = new StringBuilder();
    sb.append(routine.kind).append(" ").append(routine.name);
    sb.append("(").append(Joiner.on(", ").join(routine.parameters)).append(")").append(NL);
    sb.append(body(routine.body));
    return sb.append("END ").append(routine.kind);
  }

  private CharSequence body(List<Statement> statements) {
    StringBuilder sb = new StringBuilder();
    indentLevel++;
    for (Statement s : statements) {
      sb.append(indent()).append(s.acceptVisitor(this)).append(NL);
    }
    indentLevel--;
    return sb;
  }

  private CharSequence expressions(List<Expression> expressions) {
    return expressions
        .stream()
        .map(e -> outerParenthesesRemoved(e.acceptVisitor(this)))
        .collect(Collectors.joining(", "));
  }

  private static String targets(List<JumpTarget> targets) {
    return Joiner.on(", ").join(targets);
  }

  private CharSequence condition(Expression expression) {
    return outerParenthesesRemoved(expression.acceptVisitor(this));
  }

  @Override
  public CharSequence visitLabel(Statement.Label that) {
    return that.target.isLineNumber() ? that.target.toString() : that.target + ":";
  }

  @Override
  public CharSequence visitLet(Statement.Let that) {
    return new StringBuilder("LET ")
        .append(that.target.acceptVisitor(this))
        .append(" = ")
        .append(condition(that.value));
  }

  @Override
  public CharSequence visitPrint(Statement.Print that) {
    if (that.items.isEmpty()) {
      return "PRINT";
    }
    return "PRINT " + expressions(that.items);
  }

  @Override
  public CharSequence visitDim(Statement.Dim that) {
    return "DIM " + that.name + "(" + expressions(that.bounds) + ")";
  }

  @Override
  public CharSequence visitCallSub(Statement.CallSub that) {
    return "CALL " + that.name + "(" + expressions(that.arguments) + ")";
  }

  @Override
  public CharSequence visitRestore(Statement.Restore that) {
    return that.target.map(t -> "RESTORE " + t).orElse("RESTORE");
  }

  @Override
  public CharSequence visitIf(Statement.If that) {
    StringBuilder sb = new StringBuilder("IF ").append(condition(that.condition)).append(" THEN");
    if (that.thenGoto.isPresent()) {
      return sb.append(" ").append(that.thenGoto.get());
    }
    sb.append(NL).append(body(that.then));
    for (Statement.ElseIf elseIf : that.elseIfs) {
      sb.append(indent()).append(elseIf.acceptVisitor(this));
    }
    if (that.else_.isPresent()) {
      sb.append(indent()).append("ELSE").append(NL).append(body(that.else_.get()));
    }
    return sb.append(indent()).append("END IF");
  }

  @Override
  public CharSequence visitElseIf(Statement.ElseIf that) {
    return new StringBuilder("ELSEIF ")
        .append(condition(that.condition))
        .append(" THEN")
        .append(NL)
        .append(body(that.body));
  }

  @Override
  public CharSequence visitSelectCase(Statement.SelectCase that) {
    StringBuilder sb = new StringBuilder("SELECT CASE ").append(condition(that.selector));
    sb.append(NL);
    indentLevel++;
    for (Statement.SelectCase.Case c : that.cases) {
      String tests =
          c.tests
              .stream()
              .map(
                  t ->
                      t.match(
                          value -> condition(value.value).toString(),
                          range -> condition(range.low) + " TO " + condition(range.high),
                          is -> "IS " + is.relation.string + " " + condition(is.value)))
              .collect(Collectors.joining(", "));
      sb.append(indent()).append("CASE ").append(tests).append(NL).append(body(c.body));
    }
    if (that.else_.isPresent()) {
      sb.append(indent()).append("CASE ELSE").append(NL).append(body(that.else_.get()));
    }
    indentLevel--;
    return sb.append(indent()).append("END SELECT");
  }

  @Override
  public CharSequence visitFor(Statement.For that) {
    StringBuilder sb = new StringBuilder("FOR ").append(that.variable).append(" = ");
    sb.append(condition(that.start)).append(" TO ").append(condition(that.limit));
    that.step.ifPresent(step -> sb.append(" STEP ").append(condition(step)));
    return sb.append(NL)
        .append(body(that.body))
        .append(indent())
        .append("NEXT ")
        .append(that.variable);
  }

  @Override
  public CharSequence visitWhile(Statement.While that) {
    return new StringBuilder("WHILE ")
        .append(condition(that.condition))
        .append(NL)
        .append(body(that.body))
        .append(indent())
        .append("WEND");
  }

  private CharSequence doCondition(Statement.Do.Condition condition) {
    return (condition.isUntil ? " UNTIL " : " WHILE ") + condition(condition.expression);
  }

  @Override
  public CharSequence visitDo(Statement.Do that) {
    StringBuilder sb = new StringBuilder("DO");
    that.preCondition.ifPresent(c -> sb.append(doCondition(c)));
    sb.append(NL).append(body(that.body)).append(indent()).append("LOOP");
    that.postCondition.ifPresent(c -> sb.append(doCondition(c)));
    return sb;
  }

  @Override
  public CharSequence visitTry(Statement.Try that) {
    StringBuilder sb = new StringBuilder("TRY").append(NL).append(body(that.body));
    for (Statement.Try.Catch c : that.catches) {
      sb.append(indent()).append("CATCH");
      if (!c.catchesAll()) {
        sb.append(" ").append(Joiner.on(", ").join(c.errorCodes));
      }
      sb.append(NL).append(body(c.body));
    }
    if (that.finally_.isPresent()) {
      sb.append(indent()).append("FINALLY").append(NL).append(body(that.finally_.get()));
    }
    return sb.append(indent()).append("END TRY");
  }

  @Override
  public CharSequence visitThrow(Statement.Throw that) {
    return "THROW " + condition(that.errorCode);
  }

  @Override
  public CharSequence visitGoto(Statement.Goto that) {
    return "GOTO " + that.target;
  }

  @Override
  public CharSequence visitGosub(Statement.Gosub that) {
    return "GOSUB " + that.target;
  }

  @Override
  public CharSequence visitOnGoto(Statement.OnGoto that) {
    return "ON " + condition(that.selector) + " GOTO " + targets(that.targets);
  }

  @Override
  public CharSequence visitOnGosub(Statement.OnGosub that) {
    return "ON " + condition(that.selector) + " GOSUB " + targets(that.targets);
  }

  @Override
  public CharSequence visitReturn(Statement.Return that) {
    if (that.value.isPresent()) {
      return "RETURN " + condition(that.value.get());
    }
    if (that.target.isPresent()) {
      return "RETURN " + that.target.get();
    }
    return "RETURN";
  }

  @Override
  public CharSequence visitExit(Statement.Exit that) {
    return "EXIT " + that.construct;
  }

  @Override
  public CharSequence visitContinue(Statement.Continue that) {
    return "CONTINUE " + that.loop;
  }

  @Override
  public CharSequence visitEnd(Statement.End that) {
    return "END";
  }

  @Override
  public CharSequence visitIntegerLiteral(Expression.IntegerLiteral that) {
    return Long.toString(that.literal);
  }

  @Override
  public CharSequence visitFloatLiteral(Expression.FloatLiteral that) {
    return Double.toString(that.literal);
  }

  @Override
  public CharSequence visitStringLiteral(Expression.StringLiteral that) {
    return "\"" + that.literal + "\"";
  }

  @Override
  public CharSequence visitVariable(Expression.Variable that) {
    return that.name;
  }

  @Override
  public CharSequence visitArrayAccess(Expression.ArrayAccess that) {
    return that.array + "(" + expressions(that.indices) + ")";
  }

  @Override
  public CharSequence visitBinaryOperator(Expression.BinaryOperator that) {
    return new StringBuilder("(")
        .append(that.left.acceptVisitor(this))
        .append(" ")
        .append(that.op.string)
        .append(" ")
        .append(that.right.acceptVisitor(this))
        .append(")");
  }

  @Override
  public CharSequence visitUnaryOperator(Expression.UnaryOperator that) {
    return new StringBuilder("(")
        .append(that.op.string)
        .append(that.expression.acceptVisitor(this))
        .append(")");
  }

  @Override
  public CharSequence visitFunctionCall(Expression.FunctionCall that) {
    return that.function + "(" + expressions(that.arguments) + ")";
  }
}
