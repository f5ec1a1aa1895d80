package basic.cfg.build;

import basic.ast.JumpTarget;
import basic.ast.Statement;
import basic.cfg.ConstructTooComplexError;
import basic.util.SourceRange;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Collects the landing zones of a routine before any block is created, so that no block has to be
 * split after it was populated. Targets that are never defined are not an error here; the builder
 * reports them when it wires the transfer.
 *
 * <p>Constructs nested deeper than the builder accepts are rejected here already, before the walk
 * gets deep enough to exhaust the stack.
 */
public class JumpTargetScanner implements Statement.Visitor<Void> {
  private final String routine;
  private final int maxDepth;
  private final Map<JumpTarget, SourceRange> referenced = new TreeMap<>();
  private final Map<JumpTarget, SourceRange> defined = new TreeMap<>();
  private final Map<JumpTarget, SourceRange> restored = new TreeMap<>();
  private final Set<JumpTarget> returnLandingZones = new TreeSet<>();
  private final Map<JumpTarget, ImmutableList<TryPart>> triesAround = new TreeMap<>();
  /** Innermost first. */
  private final Deque<TryPart> tries = new ArrayDeque<>();
  private int depth = 0;

  private JumpTargetScanner(String routine, int maxDepth) {
    this.routine = routine;
    this.maxDepth = maxDepth;
  }

  /** @throws ConstructTooComplexError if constructs nest deeper than {@code maxDepth} */
  public static JumpTargets scan(String routine, List<Statement> body, int maxDepth) {
    JumpTargetScanner scanner = new JumpTargetScanner(routine, maxDepth);
    scanner.scanList(body);
    return new JumpTargets(
        scanner.referenced,
        scanner.defined,
        scanner.restored,
        scanner.returnLandingZones,
        scanner.triesAround);
  }

  private void enter(Statement construct) {
    if (++depth > maxDepth) {
      throw new ConstructTooComplexError(routine, construct.range(), maxDepth);
    }
  }

  private void leave() {
    depth--;
  }

  private void scanList(List<Statement> statements) {
    for (int i = 0; i < statements.size(); ++i) {
      Statement statement = statements.get(i);
      statement.acceptVisitor(this);
      boolean isCall =
          statement instanceof Statement.Gosub || statement instanceof Statement.OnGosub;
      if (isCall && i + 1 < statements.size()) {
        Statement next = statements.get(i + 1);
        if (next instanceof Statement.Label) {
          returnLandingZones.add(((Statement.Label) next).target);
        }
      }
    }
  }

  private void reference(JumpTarget target, SourceRange range) {
    referenced.putIfAbsent(target, range);
  }

  private void referenceAll(List<JumpTarget> targets, SourceRange range) {
    targets.forEach(t -> reference(t, range));
  }

  @Override
  public Void visitLabel(Statement.Label that) {
    if (!defined.containsKey(that.target)) {
      defined.put(that.target, that.range());
      triesAround.put(that.target, ImmutableList.copyOf(tries));
    }
    return null;
  }

  @Override
  public Void visitLet(Statement.Let that) {
    return null;
  }

  @Override
  public Void visitPrint(Statement.Print that) {
    return null;
  }

  @Override
  public Void visitDim(Statement.Dim that) {
    return null;
  }

  @Override
  public Void visitCallSub(Statement.CallSub that) {
    return null;
  }

  @Override
  public Void visitRestore(Statement.Restore that) {
    that.target.ifPresent(t -> restored.putIfAbsent(t, that.range()));
    return null;
  }

  @Override
  public Void visitIf(Statement.If that) {
    if (that.thenGoto.isPresent()) {
      reference(that.thenGoto.get(), that.range());
      return null;
    }
    enter(that);
    scanList(that.then);
    that.elseIfs.forEach(e -> e.acceptVisitor(this));
    that.else_.ifPresent(this::scanList);
    leave();
    return null;
  }

  @Override
  public Void visitElseIf(Statement.ElseIf that) {
    scanList(that.body);
    return null;
  }

  @Override
  public Void visitSelectCase(Statement.SelectCase that) {
    enter(that);
    that.cases.forEach(c -> scanList(c.body));
    that.else_.ifPresent(this::scanList);
    leave();
    return null;
  }

  @Override
  public Void visitFor(Statement.For that) {
    enter(that);
    scanList(that.body);
    leave();
    return null;
  }

  @Override
  public Void visitWhile(Statement.While that) {
    enter(that);
    scanList(that.body);
    leave();
    return null;
  }

  @Override
  public Void visitDo(Statement.Do that) {
    enter(that);
    scanList(that.body);
    leave();
    return null;
  }

  @Override
  public Void visitTry(Statement.Try that) {
    enter(that);
    tries.push(TryPart.body(that));
    scanList(that.body);
    tries.pop();
    tries.push(TryPart.handlers(that));
    that.catches.forEach(c -> scanList(c.body));
    tries.pop();
    that.finally_.ifPresent(this::scanList);
    leave();
    return null;
  }

  @Override
  public Void visitThrow(Statement.Throw that) {
    return null;
  }

  @Override
  public Void visitGoto(Statement.Goto that) {
    reference(that.target, that.range());
    return null;
  }

  @Override
  public Void visitGosub(Statement.Gosub that) {
    reference(that.target, that.range());
    return null;
  }

  @Override
  public Void visitOnGoto(Statement.OnGoto that) {
    referenceAll(that.targets, that.range());
    return null;
  }

  @Override
  public Void visitOnGosub(Statement.OnGosub that) {
    referenceAll(that.targets, that.range());
    return null;
  }

  @Override
  public Void visitReturn(Statement.Return that) {
    that.target.ifPresent(t -> reference(t, that.range()));
    return null;
  }

  @Override
  public Void visitExit(Statement.Exit that) {
    return null;
  }

  @Override
  public Void visitContinue(Statement.Continue that) {
    return null;
  }

  @Override
  public Void visitEnd(Statement.End that) {
    return null;
  }
}
