package basic.cfg;

import static org.jooq.lambda.Seq.seq;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * The legal combinations of outgoing edges of a block. Every block of a finished graph has exactly
 * one of these shapes; anything else is a defect of the builder.
 *
 * <p>Poor man's ADT
 */
public abstract class EdgeShape {

  private EdgeShape() {}

  /**
   * Classifies the outgoing edges of a single block, or returns {@link Optional#empty()} if they
   * don't form a legal shape.
   */
  public static Optional<EdgeShape> classify(List<CFGEdge> outgoing) {
    switch (outgoing.size()) {
      case 0:
        return Optional.of(new Terminal());
      case 1:
        CFGEdge only = outgoing.get(0);
        if (only.type.isUnconditional()) {
          return Optional.of(new Unconditional(only));
        }
        if (only.type == EdgeType.RETURN) {
          return Optional.of(new Return(only));
        }
        return Optional.empty();
      case 2:
        Optional<EdgeShape> pair = classifyPair(outgoing.get(0), outgoing.get(1));
        if (pair.isPresent()) {
          return pair;
        }
        Optional<EdgeShape> swapped = classifyPair(outgoing.get(1), outgoing.get(0));
        if (swapped.isPresent()) {
          return swapped;
        }
        return multiway(outgoing);
      default:
        return multiway(outgoing);
    }
  }

  private static Optional<EdgeShape> classifyPair(CFGEdge first, CFGEdge second) {
    if (first.type == EdgeType.CONDITIONAL_TRUE && second.type == EdgeType.CONDITIONAL_FALSE) {
      return Optional.of(new Conditional(first, second));
    }
    if (first.type == EdgeType.CALL && second.type.isUnconditional()) {
      return Optional.of(new Gosub(first, second));
    }
    if (first.type == EdgeType.EXCEPTION && second.type.isUnconditional()) {
      return Optional.of(new Protected(first, second));
    }
    return Optional.empty();
  }

  private static Optional<EdgeShape> multiway(List<CFGEdge> outgoing) {
    boolean allLabeledJumps =
        seq(outgoing).allMatch(e -> e.type == EdgeType.JUMP && e.label.isPresent());
    if (!allLabeledJumps) {
      return Optional.empty();
    }
    List<CFGEdge> defaults = seq(outgoing).filter(e -> e.isLabeled(Labels.DEFAULT_EDGE)).toList();
    List<CFGEdge> cases = seq(outgoing).filter(e -> !e.isLabeled(Labels.DEFAULT_EDGE)).toList();
    long distinctLabels = seq(cases).map(e -> e.label.get()).distinct().count();
    if (defaults.size() != 1 || distinctLabels != cases.size()) {
      return Optional.empty();
    }
    return Optional.of(new Multiway(cases, defaults.get(0)));
  }

  public abstract <T> T match(
      Function<Terminal, T> matchTerminal,
      Function<Unconditional, T> matchUnconditional,
      Function<Conditional, T> matchConditional,
      Function<Gosub, T> matchGosub,
      Function<Return, T> matchReturn,
      Function<Protected, T> matchProtected,
      Function<Multiway, T> matchMultiway);

  /** No successors: END, an unhandled THROW or the end of the routine. */
  public static class Terminal extends EdgeShape {
    @Override
    public <T> T match(
        Function<Terminal, T> matchTerminal,
        Function<Unconditional, T> matchUnconditional,
        Function<Conditional, T> matchConditional,
        Function<Gosub, T> matchGosub,
        Function<Return, T> matchReturn,
        Function<Protected, T> matchProtected,
        Function<Multiway, T> matchMultiway) {
      return matchTerminal.apply(this);
    }

    @Override
    public String toString() {
      return "terminal";
    }
  }

  public static class Unconditional extends EdgeShape {
    public final CFGEdge edge;

    Unconditional(CFGEdge edge) {
      this.edge = edge;
    }

    @Override
    public <T> T match(
        Function<Terminal, T> matchTerminal,
        Function<Unconditional, T> matchUnconditional,
        Function<Conditional, T> matchConditional,
        Function<Gosub, T> matchGosub,
        Function<Return, T> matchReturn,
        Function<Protected, T> matchProtected,
        Function<Multiway, T> matchMultiway) {
      return matchUnconditional.apply(this);
    }

    @Override
    public String toString() {
      return "unconditional";
    }
  }

  public static class Conditional extends EdgeShape {
    public final CFGEdge onTrue;
    public final CFGEdge onFalse;

    Conditional(CFGEdge onTrue, CFGEdge onFalse) {
      this.onTrue = onTrue;
      this.onFalse = onFalse;
    }

    @Override
    public <T> T match(
        Function<Terminal, T> matchTerminal,
        Function<Unconditional, T> matchUnconditional,
        Function<Conditional, T> matchConditional,
        Function<Gosub, T> matchGosub,
        Function<Return, T> matchReturn,
        Function<Protected, T> matchProtected,
        Function<Multiway, T> matchMultiway) {
      return matchConditional.apply(this);
    }

    @Override
    public String toString() {
      return "conditional";
    }
  }

  public static class Gosub extends EdgeShape {
    public final CFGEdge call;
    /** Leads to the registered return point. */
    public final CFGEdge continuation;

    Gosub(CFGEdge call, CFGEdge continuation) {
      this.call = call;
      this.continuation = continuation;
    }

    @Override
    public <T> T match(
        Function<Terminal, T> matchTerminal,
        Function<Unconditional, T> matchUnconditional,
        Function<Conditional, T> matchConditional,
        Function<Gosub, T> matchGosub,
        Function<Return, T> matchReturn,
        Function<Protected, T> matchProtected,
        Function<Multiway, T> matchMultiway) {
      return matchGosub.apply(this);
    }

    @Override
    public String toString() {
      return "gosub";
    }
  }

  public static class Return extends EdgeShape {
    public final CFGEdge edge;

    Return(CFGEdge edge) {
      this.edge = edge;
    }

    @Override
    public <T> T match(
        Function<Terminal, T> matchTerminal,
        Function<Unconditional, T> matchUnconditional,
        Function<Conditional, T> matchConditional,
        Function<Gosub, T> matchGosub,
        Function<Return, T> matchReturn,
        Function<Protected, T> matchProtected,
        Function<Multiway, T> matchMultiway) {
      return matchReturn.apply(this);
    }

    @Override
    public String toString() {
      return "return";
    }
  }

  /** Entry of a TRY region: the normal path plus the edge taken when an error is raised. */
  public static class Protected extends EdgeShape {
    public final CFGEdge exception;
    public final CFGEdge normal;

    Protected(CFGEdge exception, CFGEdge normal) {
      this.exception = exception;
      this.normal = normal;
    }

    @Override
    public <T> T match(
        Function<Terminal, T> matchTerminal,
        Function<Unconditional, T> matchUnconditional,
        Function<Conditional, T> matchConditional,
        Function<Gosub, T> matchGosub,
        Function<Return, T> matchReturn,
        Function<Protected, T> matchProtected,
        Function<Multiway, T> matchMultiway) {
      return matchProtected.apply(this);
    }

    @Override
    public String toString() {
      return "protected";
    }
  }

  public static class Multiway extends EdgeShape {
    /** In edge list order, which is source declaration order. */
    public final ImmutableList<CFGEdge> cases;

    public final CFGEdge defaultEdge;

    Multiway(List<CFGEdge> cases, CFGEdge defaultEdge) {
      this.cases = ImmutableList.copyOf(cases);
      this.defaultEdge = defaultEdge;
    }

    @Override
    public <T> T match(
        Function<Terminal, T> matchTerminal,
        Function<Unconditional, T> matchUnconditional,
        Function<Conditional, T> matchConditional,
        Function<Gosub, T> matchGosub,
        Function<Return, T> matchReturn,
        Function<Protected, T> matchProtected,
        Function<Multiway, T> matchMultiway) {
      return matchMultiway.apply(this);
    }

    @Override
    public String toString() {
      return "multiway(" + cases.size() + ")";
    }
  }
}
