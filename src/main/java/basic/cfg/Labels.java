package basic.cfg;

/**
 * Block labels. They name the role a block plays in its construct, so that the linearizer knows
 * which code a construct statement stands for in that block. They are never used for addressing.
 */
public final class Labels {
  public static final String ENTRY = "Entry";
  public static final String UNREACHABLE = "Unreachable";
  public static final String ROUTINE_EXIT = "Routine_Exit";
  public static final String LINE_PREFIX = "Line_";
  public static final String LABEL_PREFIX = "Label_";

  public static final String IF_THEN = "If_Then";
  public static final String IF_ELSE_IF = "If_ElseIf";
  public static final String IF_ELSE = "If_Else";
  public static final String IF_MERGE = "If_Merge";

  public static final String SELECT_CASE = "Select_Case";
  public static final String SELECT_ELSE = "Select_Else";
  public static final String SELECT_MERGE = "Select_Merge";

  public static final String FOR_INIT = "For_Init";
  public static final String FOR_HEADER = "For_Header";
  public static final String FOR_BODY = "For_Body";
  public static final String FOR_INCREMENT = "For_Increment";
  public static final String FOR_EXIT = "For_Exit";

  public static final String WHILE_HEADER = "While_Header";
  public static final String WHILE_BODY = "While_Body";
  public static final String WHILE_EXIT = "While_Exit";

  public static final String DO_HEADER = "Do_Header";
  public static final String DO_BODY = "Do_Body";
  public static final String DO_CONDITION = "Do_Condition";
  public static final String DO_EXIT = "Do_Exit";

  public static final String RETURN_POINT = "Return_Point";
  public static final String ON_GOTO_FALLTHROUGH = "OnGoto_Fallthrough";
  public static final String ON_GOSUB_CALL = "OnGosub_Call";
  public static final String ON_GOSUB_RETURN_POINT = "OnGosub_Return_Point";

  public static final String TRY_BODY = "Try_Body";
  public static final String TRY_LEAVE = "Try_Leave";
  public static final String TRY_DISPATCH = "Try_Dispatch";
  public static final String TRY_CATCH = "Try_Catch";
  public static final String TRY_FINALLY = "Try_Finally";
  public static final String TRY_FINALLY_EXIT = "Try_Finally_Exit";
  public static final String TRY_FINALLY_ROUTE = "Try_Finally_Route";
  public static final String TRY_RETHROW = "Try_Rethrow";
  public static final String TRY_EXIT = "Try_Exit";

  /** Label of the {@code i}th case edge of a multiway block. */
  public static String caseEdge(int i) {
    return "case_" + i;
  }

  public static String catchEdge(int i) {
    return "catch_" + i;
  }

  public static final String DEFAULT_EDGE = "default";

  private static final String TRY_ROUTE_PREFIX = "Try_Route_";

  /** Block recording route {@code i} out of a TRY before its FINALLY runs. */
  public static String tryRoute(int i) {
    return TRY_ROUTE_PREFIX + i;
  }

  public static boolean isTryRoute(String blockLabel) {
    return blockLabel.startsWith(TRY_ROUTE_PREFIX);
  }

  /** The {@code i} of a {@code case_<i>} or {@code catch_<i>} edge or a route block label. */
  public static int edgeIndex(String edgeLabel) {
    return Integer.parseInt(edgeLabel.substring(edgeLabel.lastIndexOf('_') + 1));
  }

  private Labels() {}
}
