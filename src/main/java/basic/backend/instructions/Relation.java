package basic.backend.instructions;

import basic.ast.BinOp;

/** Signed integer comparisons. */
public enum Relation {
  EQUAL("eq"),
  NOT_EQUAL("ne"),
  LESS("slt"),
  LESS_EQUAL("sle"),
  GREATER("sgt"),
  GREATER_EQUAL("sge");

  /** Suffix of the compare instruction, as in {@code csltw}. */
  public final String mnemonic;

  Relation(String mnemonic) {
    this.mnemonic = mnemonic;
  }

  public static Relation fromBinOp(BinOp op) {
    switch (op) {
      case EQ:
        return EQUAL;
      case NEQ:
        return NOT_EQUAL;
      case LT:
        return LESS;
      case LEQ:
        return LESS_EQUAL;
      case GT:
        return GREATER;
      case GEQ:
        return GREATER_EQUAL;
      default:
        throw new IllegalArgumentException(op + " is not a relation");
    }
  }
}
