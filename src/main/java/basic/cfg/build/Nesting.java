package basic.cfg.build;

import basic.ast.Construct;
import basic.ast.Statement;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.pcollections.ConsPStack;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.pcollections.PStack;

/**
 * What the statements at one point of a routine know about the constructs enclosing them: where
 * EXIT and CONTINUE go, which TRY parts they are in and where a THROW goes. Passed down the
 * recursion and never mutated, so a construct can't leak its targets to its siblings.
 */
final class Nesting {
  private final PMap<Construct, Integer> exits;
  private final PMap<Construct, Integer> continues;
  /** The TRY parts around each construct in {@link #exits}. */
  private final PMap<Construct, PStack<TryPart>> triesAround;
  /** Innermost first. */
  private final PStack<TryPart> tries;
  @Nullable private final Integer throwTarget;
  /** Number of enclosing constructs. */
  final int depth;

  private Nesting(
      PMap<Construct, Integer> exits,
      PMap<Construct, Integer> continues,
      PMap<Construct, PStack<TryPart>> triesAround,
      PStack<TryPart> tries,
      @Nullable Integer throwTarget,
      int depth) {
    this.exits = exits;
    this.continues = continues;
    this.triesAround = triesAround;
    this.tries = tries;
    this.throwTarget = throwTarget;
    this.depth = depth;
  }

  static Nesting root() {
    return new Nesting(
        HashTreePMap.empty(), HashTreePMap.empty(), HashTreePMap.empty(), ConsPStack.empty(),
        null, 0);
  }

  /** One level deeper, without new targets. IF bodies and FINALLY are nested like this. */
  Nesting deeper() {
    return new Nesting(exits, continues, triesAround, tries, throwTarget, depth + 1);
  }

  /** EXIT {@code construct} from within now goes to {@code exitBlock}. */
  Nesting withExit(Construct construct, int exitBlock) {
    return new Nesting(
        exits.plus(construct, exitBlock),
        continues,
        triesAround.plus(construct, tries),
        tries,
        throwTarget,
        depth);
  }

  Nesting withLoop(Construct loop, int exitBlock, int continueBlock) {
    return new Nesting(
        exits.plus(loop, exitBlock),
        continues.plus(loop, continueBlock),
        triesAround.plus(loop, tries),
        tries,
        throwTarget,
        depth);
  }

  /** The protected body of {@code statement}. Errors go to its dispatch block. */
  Nesting inBody(Statement.Try statement, int dispatchBlock) {
    return new Nesting(
        exits, continues, triesAround, tries.plus(TryPart.body(statement)), dispatchBlock, depth);
  }

  /**
   * The CATCH clauses of {@code statement}. Errors raised there run its FINALLY, if it has one,
   * before they reach the enclosing TRY.
   */
  Nesting inHandlers(Statement.Try statement, Optional<Integer> finallyBlock) {
    return new Nesting(
        exits,
        continues,
        triesAround,
        tries.plus(TryPart.handlers(statement)),
        finallyBlock.orElse(throwTarget),
        depth);
  }

  Optional<Integer> exitOf(Construct construct) {
    return Optional.ofNullable(exits.get(construct));
  }

  Optional<Integer> continueOf(Construct loop) {
    return Optional.ofNullable(continues.get(loop));
  }

  /** The TRY parts around {@code construct}, which must have an exit. */
  PStack<TryPart> triesAround(Construct construct) {
    return triesAround.get(construct);
  }

  PStack<TryPart> tries() {
    return tries;
  }

  /** Where a THROW goes: the dispatch or FINALLY block of the innermost enclosing TRY. */
  Optional<Integer> throwTarget() {
    return Optional.ofNullable(throwTarget);
  }
}
