package basic.ast;

import static com.google.common.base.Preconditions.checkArgument;

import basic.util.SourceCodeReferable;
import basic.util.SourceRange;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;

/*
 * Statement lists are already nested by the parser: a FOR carries its body, an IF its branches
 * and so on. Line numbers and labels appear as Label statements at the position they were
 * written, so the only thing that ties a GOTO to its destination is the JumpTarget.
 */
public interface Statement extends SourceCodeReferable {

  <T> T acceptVisitor(Statement.Visitor<T> visitor);

  /** A line number or label in front of the following statement. */
  class Label extends Node implements Statement {
    public final JumpTarget target;

    public Label(JumpTarget target, SourceRange range) {
      super(range);
      this.target = target;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitLabel(this);
    }
  }

  class Let extends Node implements Statement {
    public final Expression target;
    public final Expression value;

    public Let(Expression target, Expression value, SourceRange range) {
      super(range);
      this.target = target;
      this.value = value;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitLet(this);
    }
  }

  class Print extends Node implements Statement {
    public final List<Expression> items;

    public Print(List<Expression> items, SourceRange range) {
      super(range);
      this.items = items;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitPrint(this);
    }
  }

  class Dim extends Node implements Statement {
    public final String name;
    public final List<Expression> bounds;

    public Dim(String name, List<Expression> bounds, SourceRange range) {
      super(range);
      this.name = name;
      this.bounds = bounds;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitDim(this);
    }
  }

  /** {@code CALL name(args)} of a SUB. */
  class CallSub extends Node implements Statement {
    public final String name;
    public final List<Expression> arguments;

    public CallSub(String name, List<Expression> arguments, SourceRange range) {
      super(range);
      this.name = name;
      this.arguments = arguments;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitCallSub(this);
    }
  }

  class If extends Node implements Statement {
    public final Expression condition;
    public final List<Statement> then;
    public final List<ElseIf> elseIfs;
    public final Optional<List<Statement>> else_;
    /** Set for the single line form {@code IF cond THEN 100}, which has no bodies. */
    public final Optional<JumpTarget> thenGoto;

    public If(
        Expression condition,
        List<Statement> then,
        List<ElseIf> elseIfs,
        @Nullable List<Statement> else_,
        SourceRange range) {
      super(range);
      this.condition = condition;
      this.then = then;
      this.elseIfs = elseIfs;
      this.else_ = Optional.ofNullable(else_);
      this.thenGoto = Optional.empty();
    }

    private If(Expression condition, JumpTarget thenGoto, SourceRange range) {
      super(range);
      this.condition = condition;
      this.then = ImmutableList.of();
      this.elseIfs = ImmutableList.of();
      this.else_ = Optional.empty();
      this.thenGoto = Optional.of(thenGoto);
    }

    public static If thenGoto(Expression condition, JumpTarget target, SourceRange range) {
      return new If(condition, target, range);
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitIf(this);
    }
  }

  /**
   * An {@code ELSEIF} clause. It never appears in a statement list on its own, but it ends the
   * condition block that tests it.
   */
  class ElseIf extends Node implements Statement {
    public final Expression condition;
    public final List<Statement> body;

    public ElseIf(Expression condition, List<Statement> body, SourceRange range) {
      super(range);
      this.condition = condition;
      this.body = body;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitElseIf(this);
    }
  }

  class SelectCase extends Node implements Statement {
    public final Expression selector;
    public final List<Case> cases;
    public final Optional<List<Statement>> else_;

    public SelectCase(
        Expression selector, List<Case> cases, @Nullable List<Statement> else_, SourceRange range) {
      super(range);
      this.selector = selector;
      this.cases = cases;
      this.else_ = Optional.ofNullable(else_);
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitSelectCase(this);
    }

    public static class Case extends Node {
      /** Alternatives, any of which selects this case. */
      public final List<CaseTest> tests;

      public final List<Statement> body;

      public Case(List<CaseTest> tests, List<Statement> body, SourceRange range) {
        super(range);
        checkArgument(!tests.isEmpty(), "A CASE needs at least one test");
        this.tests = tests;
        this.body = body;
      }
    }

    /** Poor man's ADT for {@code CASE 1}, {@code CASE 1 TO 5} and {@code CASE IS > 3}. */
    public interface CaseTest {

      <T> T match(
          Function<Value, T> matchValue, Function<Range, T> matchRange, Function<Is, T> matchIs);

      class Value implements CaseTest {
        public final Expression value;

        public Value(Expression value) {
          this.value = value;
        }

        @Override
        public <T> T match(
            Function<Value, T> matchValue,
            Function<Range, T> matchRange,
            Function<Is, T> matchIs) {
          return matchValue.apply(this);
        }
      }

      class Range implements CaseTest {
        public final Expression low;
        public final Expression high;

        public Range(Expression low, Expression high) {
          this.low = low;
          this.high = high;
        }

        @Override
        public <T> T match(
            Function<Value, T> matchValue,
            Function<Range, T> matchRange,
            Function<Is, T> matchIs) {
          return matchRange.apply(this);
        }
      }

      class Is implements CaseTest {
        public final BinOp relation;
        public final Expression value;

        public Is(BinOp relation, Expression value) {
          checkArgument(relation.isRelational(), "CASE IS needs a relation, got %s", relation);
          this.relation = relation;
          this.value = value;
        }

        @Override
        public <T> T match(
            Function<Value, T> matchValue,
            Function<Range, T> matchRange,
            Function<Is, T> matchIs) {
          return matchIs.apply(this);
        }
      }
    }
  }

  class For extends Node implements Statement {
    public final String variable;
    public final Expression start;
    public final Expression limit;
    public final Optional<Expression> step;
    public final List<Statement> body;

    public For(
        String variable,
        Expression start,
        Expression limit,
        @Nullable Expression step,
        List<Statement> body,
        SourceRange range) {
      super(range);
      this.variable = variable;
      this.start = start;
      this.limit = limit;
      this.step = Optional.ofNullable(step);
      this.body = body;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitFor(this);
    }
  }

  class While extends Node implements Statement {
    public final Expression condition;
    public final List<Statement> body;

    public While(Expression condition, List<Statement> body, SourceRange range) {
      super(range);
      this.condition = condition;
      this.body = body;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitWhile(this);
    }
  }

  /**
   * {@code DO [WHILE|UNTIL c] ... LOOP [WHILE|UNTIL c]}. At most one of the two conditions is
   * present; with neither, the loop only ends through EXIT DO, GOTO or END. {@code REPEAT ...
   * UNTIL c} is parsed into a post-test UNTIL.
   */
  class Do extends Node implements Statement {
    public final Optional<Condition> preCondition;
    public final Optional<Condition> postCondition;
    public final List<Statement> body;

    public Do(
        @Nullable Condition preCondition,
        @Nullable Condition postCondition,
        List<Statement> body,
        SourceRange range) {
      super(range);
      checkArgument(
          preCondition == null || postCondition == null,
          "DO can test either before or after the body, not both");
      this.preCondition = Optional.ofNullable(preCondition);
      this.postCondition = Optional.ofNullable(postCondition);
      this.body = body;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitDo(this);
    }

    public static class Condition {
      public final boolean isUntil;
      public final Expression expression;

      private Condition(boolean isUntil, Expression expression) {
        this.isUntil = isUntil;
        this.expression = expression;
      }

      public static Condition while_(Expression expression) {
        return new Condition(false, expression);
      }

      public static Condition until(Expression expression) {
        return new Condition(true, expression);
      }
    }
  }

  class Try extends Node implements Statement {
    public final List<Statement> body;
    public final List<Catch> catches;
    public final Optional<List<Statement>> finally_;

    public Try(
        List<Statement> body,
        List<Catch> catches,
        @Nullable List<Statement> finally_,
        SourceRange range) {
      super(range);
      this.body = body;
      this.catches = catches;
      this.finally_ = Optional.ofNullable(finally_);
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitTry(this);
    }

    public static class Catch extends Node {
      /** Error codes handled by this clause. Empty means the clause catches everything. */
      public final List<Integer> errorCodes;

      public final List<Statement> body;

      public Catch(List<Integer> errorCodes, List<Statement> body, SourceRange range) {
        super(range);
        this.errorCodes = errorCodes;
        this.body = body;
      }

      public boolean catchesAll() {
        return errorCodes.isEmpty();
      }
    }
  }

  /** {@code RESTORE [target]}: the next READ takes the DATA at {@code target} or the first DATA. */
  class Restore extends Node implements Statement {
    public final Optional<JumpTarget> target;

    public Restore(@Nullable JumpTarget target, SourceRange range) {
      super(range);
      this.target = Optional.ofNullable(target);
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitRestore(this);
    }
  }

  class Throw extends Node implements Statement {
    public final Expression errorCode;

    public Throw(Expression errorCode, SourceRange range) {
      super(range);
      this.errorCode = errorCode;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitThrow(this);
    }
  }

  class Goto extends Node implements Statement {
    public final JumpTarget target;

    public Goto(JumpTarget target, SourceRange range) {
      super(range);
      this.target = target;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitGoto(this);
    }
  }

  class Gosub extends Node implements Statement {
    public final JumpTarget target;

    public Gosub(JumpTarget target, SourceRange range) {
      super(range);
      this.target = target;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitGosub(this);
    }
  }

  /** {@code ON selector GOTO t1, t2, ...}: selector 1 picks t1. Out of range continues. */
  class OnGoto extends Node implements Statement {
    public final Expression selector;
    public final List<JumpTarget> targets;

    public OnGoto(Expression selector, List<JumpTarget> targets, SourceRange range) {
      super(range);
      checkArgument(!targets.isEmpty(), "ON GOTO needs at least one target");
      this.selector = selector;
      this.targets = targets;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitOnGoto(this);
    }
  }

  class OnGosub extends Node implements Statement {
    public final Expression selector;
    public final List<JumpTarget> targets;

    public OnGosub(Expression selector, List<JumpTarget> targets, SourceRange range) {
      super(range);
      checkArgument(!targets.isEmpty(), "ON GOSUB needs at least one target");
      this.selector = selector;
      this.targets = targets;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitOnGosub(this);
    }
  }

  /**
   * {@code RETURN} from a GOSUB, {@code RETURN value} from a FUNCTION, or {@code RETURN 100},
   * which drops the pending GOSUB return address and continues at line 100.
   */
  class Return extends Node implements Statement {
    public final Optional<Expression> value;
    public final Optional<JumpTarget> target;

    private Return(
        @Nullable Expression value, @Nullable JumpTarget target, SourceRange range) {
      super(range);
      this.value = Optional.ofNullable(value);
      this.target = Optional.ofNullable(target);
    }

    public static Return fromGosub(SourceRange range) {
      return new Return(null, null, range);
    }

    public static Return withValue(Expression value, SourceRange range) {
      return new Return(value, null, range);
    }

    public static Return toLine(JumpTarget target, SourceRange range) {
      return new Return(null, target, range);
    }

    public boolean isGosubReturn() {
      return !value.isPresent();
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitReturn(this);
    }
  }

  class Exit extends Node implements Statement {
    public final Construct construct;

    public Exit(Construct construct, SourceRange range) {
      super(range);
      this.construct = construct;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitExit(this);
    }
  }

  class Continue extends Node implements Statement {
    public final Construct loop;

    public Continue(Construct loop, SourceRange range) {
      super(range);
      checkArgument(loop.isLoop(), "CONTINUE needs a loop, got %s", loop);
      this.loop = loop;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitContinue(this);
    }
  }

  class End extends Node implements Statement {
    public End(SourceRange range) {
      super(range);
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitEnd(this);
    }
  }

  interface Visitor<T> {

    T visitLabel(Label that);

    T visitLet(Let that);

    T visitPrint(Print that);

    T visitDim(Dim that);

    T visitCallSub(CallSub that);

    T visitRestore(Restore that);

    T visitIf(If that);

    T visitElseIf(ElseIf that);

    T visitSelectCase(SelectCase that);

    T visitFor(For that);

    T visitWhile(While that);

    T visitDo(Do that);

    T visitTry(Try that);

    T visitThrow(Throw that);

    T visitGoto(Goto that);

    T visitGosub(Gosub that);

    T visitOnGoto(OnGoto that);

    T visitOnGosub(OnGosub that);

    T visitReturn(Return that);

    T visitExit(Exit that);

    T visitContinue(Continue that);

    T visitEnd(End that);
  }
}
