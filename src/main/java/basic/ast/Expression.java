package basic.ast;

import basic.util.SourceRange;
import java.util.List;

public abstract class Expression extends Node {

  Expression(SourceRange range) {
    super(range);
  }

  public abstract <T> T acceptVisitor(Visitor<T> visitor);

  public static class IntegerLiteral extends Expression {

    public final long literal;

    public IntegerLiteral(long literal, SourceRange range) {
      super(range);
      this.literal = literal;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitIntegerLiteral(this);
    }
  }

  public static class FloatLiteral extends Expression {

    public final double literal;

    public FloatLiteral(double literal, SourceRange range) {
      super(range);
      this.literal = literal;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitFloatLiteral(this);
    }
  }

  public static class StringLiteral extends Expression {

    public final String literal;

    public StringLiteral(String literal, SourceRange range) {
      super(range);
      this.literal = literal;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitStringLiteral(this);
    }
  }

  /** A scalar variable reference, resolved against the symbol table by name. */
  public static class Variable extends Expression {

    public final String name;

    public Variable(String name, SourceRange range) {
      super(range);
      this.name = name;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitVariable(this);
    }
  }

  public static class ArrayAccess extends Expression {

    public final String array;
    public final List<Expression> indices;

    public ArrayAccess(String array, List<Expression> indices, SourceRange range) {
      super(range);
      this.array = array;
      this.indices = indices;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitArrayAccess(this);
    }
  }

  public static class BinaryOperator extends Expression {
    public final BinOp op;
    public final Expression left;
    public final Expression right;

    public BinaryOperator(BinOp op, Expression left, Expression right, SourceRange range) {
      super(range);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitBinaryOperator(this);
    }
  }

  public static class UnaryOperator extends Expression {

    public final UnOp op;
    public final Expression expression;

    public UnaryOperator(UnOp op, Expression expression, SourceRange range) {
      super(range);
      this.op = op;
      this.expression = expression;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitUnaryOperator(this);
    }
  }

  /** Calls a FUNCTION, a DEF FN or a builtin like {@code LEN}. */
  public static class FunctionCall extends Expression {

    public final String function;
    public final List<Expression> arguments;

    public FunctionCall(String function, List<Expression> arguments, SourceRange range) {
      super(range);
      this.function = function;
      this.arguments = arguments;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitFunctionCall(this);
    }
  }

  public interface Visitor<T> {

    T visitIntegerLiteral(IntegerLiteral that);

    T visitFloatLiteral(FloatLiteral that);

    T visitStringLiteral(StringLiteral that);

    T visitVariable(Variable that);

    T visitArrayAccess(ArrayAccess that);

    T visitBinaryOperator(BinaryOperator that);

    T visitUnaryOperator(UnaryOperator that);

    T visitFunctionCall(FunctionCall that);
  }
}
