package basic.cfg.build;

import basic.cfg.BasicBlock;
import basic.cfg.ControlFlowGraph;
import basic.cfg.EdgeShape;
import basic.cfg.StructuralError;
import basic.util.SourceRange;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Checks that GOSUB call sites and the registered return points match up: every call continues
 * in a registered return point, and every return point is the continuation of some call.
 */
class GosubSiteVerifier {

  private GosubSiteVerifier() {}

  static void verify(ControlFlowGraph graph, SourceRange routineRange) {
    Set<Integer> continuations = new HashSet<>();
    for (BasicBlock block : graph.blocks) {
      Optional<EdgeShape.Gosub> call =
          graph
              .shapeOf(block.id)
              .flatMap(
                  shape ->
                      shape.<Optional<EdgeShape.Gosub>>match(
                          terminal -> Optional.empty(),
                          unconditional -> Optional.empty(),
                          conditional -> Optional.empty(),
                          Optional::of,
                          ret -> Optional.empty(),
                          protected_ -> Optional.empty(),
                          multiway -> Optional.empty()));
      if (!call.isPresent()) {
        continue;
      }
      int continuation = call.get().continuation.target;
      if (!graph.gosubReturnBlocks.contains(continuation)) {
        throw new StructuralError(
            graph.name,
            EdgeShapeVerifier.rangeOf(block, routineRange),
            String.format("GOSUB in %s returns to unregistered bb%d", block, continuation));
      }
      continuations.add(continuation);
    }
    for (int returnPoint : graph.gosubReturnBlocks) {
      if (!continuations.contains(returnPoint)) {
        throw new StructuralError(
            graph.name,
            routineRange,
            String.format("Return point bb%d doesn't follow a GOSUB", returnPoint));
      }
    }
  }
}
