package basic.cfg.build;

import basic.ast.Statement;
import basic.cfg.EdgeType;
import basic.cfg.Labels;
import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The transfers that leave one TRY for a block outside of it, through EXIT, CONTINUE, GOTO or a
 * FUNCTION result.
 *
 * <p>Leaving the body removes the handler in a {@code Try_Leave} block first. With a FINALLY, each
 * distinct continuation gets a route number, which a {@code Try_Route_<i>} block records before it
 * jumps into the single FINALLY block. After the FINALLY, a {@code Try_Finally_Route} block picks
 * the continuation by that number.
 */
final class TryRoutes {
  private final RoutineBuild build;
  private final Statement.Try statement;
  private final Optional<Integer> finallyBlock;

  /** Route number by the block the route continues in after the FINALLY, in creation order. */
  private final Map<Integer, Integer> routes = new LinkedHashMap<>();

  private final Map<Integer, Integer> routeBlocks = new HashMap<>();
  /** {@code Try_Leave} blocks by the block they jump to. */
  private final Map<Integer, Integer> leaveBlocks = new HashMap<>();

  TryRoutes(RoutineBuild build, Statement.Try statement, Optional<Integer> finallyBlock) {
    this.build = build;
    this.statement = statement;
    this.finallyBlock = finallyBlock;
  }

  /**
   * The block a transfer out of the body or a CATCH clause jumps to so that it ends up in {@code
   * next}, which is outside of this TRY.
   */
  int leave(boolean fromHandler, int next) {
    int afterHandler = finallyBlock.isPresent() ? routeBlock(next) : next;
    if (fromHandler) {
      return afterHandler;
    }
    Integer leave = leaveBlocks.get(afterHandler);
    if (leave == null) {
      leave = build.newBlock(Labels.TRY_LEAVE);
      build.add(leave, statement);
      build.edge(leave, afterHandler, EdgeType.JUMP);
      leaveBlocks.put(afterHandler, leave);
    }
    return leave;
  }

  private int routeBlock(int next) {
    Integer route = routes.get(next);
    if (route == null) {
      route = routes.size();
      routes.put(next, route);
      int block = build.newBlock(Labels.tryRoute(route));
      build.add(block, statement);
      build.edge(block, finallyBlock.get(), EdgeType.JUMP);
      routeBlocks.put(route, block);
    }
    return routeBlocks.get(route);
  }

  /** Where route {@code i} continues after the FINALLY, by route number. */
  ImmutableList<Integer> continuations() {
    return ImmutableList.copyOf(routes.keySet());
  }
}
