package basic.ast;

public enum BinOp {
  PLUS("+"),
  MINUS("-"),
  MULTIPLY("*"),
  DIVIDE("/"),
  INT_DIVIDE("\\"),
  MODULO("MOD"),
  POWER("^"),
  EQ("="),
  NEQ("<>"),
  LT("<"),
  LEQ("<="),
  GT(">"),
  GEQ(">="),
  AND("AND"),
  OR("OR"),
  XOR("XOR");

  public final String string;

  BinOp(String string) {
    this.string = string;
  }

  public boolean isRelational() {
    switch (this) {
      case EQ:
      case NEQ:
      case LT:
      case LEQ:
      case GT:
      case GEQ:
        return true;
      default:
        return false;
    }
  }
}
