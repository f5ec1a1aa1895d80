package basic.cfg;

import static com.google.common.base.Preconditions.checkArgument;

import basic.ast.Statement;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * A maximal straight-line run of statements. Blocks are addressed by {@link #id} only; their
 * predecessor and successor sets are derived from the edge list of the {@link ControlFlowGraph}
 * they end up in and are empty before that.
 */
public class BasicBlock {
  public final int id;
  /** The role of the block within its construct, e.g. {@code For_Header}. See {@link Labels}. */
  public final Optional<String> label;
  /** Borrowed from the AST, in source order. */
  public final ImmutableList<Statement> statements;

  public final boolean isLoopHeader;
  public final ImmutableSortedSet<Integer> predecessors;
  public final ImmutableSortedSet<Integer> successors;

  public BasicBlock(
      int id, @Nullable String label, List<Statement> statements, boolean isLoopHeader) {
    this(
        id,
        Optional.ofNullable(label),
        ImmutableList.copyOf(statements),
        isLoopHeader,
        ImmutableSortedSet.of(),
        ImmutableSortedSet.of());
  }

  private BasicBlock(
      int id,
      Optional<String> label,
      ImmutableList<Statement> statements,
      boolean isLoopHeader,
      ImmutableSortedSet<Integer> predecessors,
      ImmutableSortedSet<Integer> successors) {
    checkArgument(id >= 0, "Block ids are non-negative, got %s", id);
    this.id = id;
    this.label = label;
    this.statements = statements;
    this.isLoopHeader = isLoopHeader;
    this.predecessors = predecessors;
    this.successors = successors;
  }

  BasicBlock linked(Set<Integer> predecessors, Set<Integer> successors) {
    return new BasicBlock(
        id,
        label,
        statements,
        isLoopHeader,
        ImmutableSortedSet.copyOf(predecessors),
        ImmutableSortedSet.copyOf(successors));
  }

  public BasicBlock withLoopHeader(boolean isLoopHeader) {
    return new BasicBlock(id, label, statements, isLoopHeader, predecessors, successors);
  }

  public boolean hasLabel(String label) {
    return this.label.isPresent() && this.label.get().equals(label);
  }

  public Optional<Statement> lastStatement() {
    return statements.isEmpty()
        ? Optional.empty()
        : Optional.of(statements.get(statements.size() - 1));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    BasicBlock that = (BasicBlock) o;
    return id == that.id
        && isLoopHeader == that.isLoopHeader
        && label.equals(that.label)
        && statements.equals(that.statements)
        && predecessors.equals(that.predecessors)
        && successors.equals(that.successors);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, label, statements, isLoopHeader, predecessors, successors);
  }

  @Override
  public String toString() {
    return "bb" + id + label.map(l -> "(" + l + ")").orElse("");
  }
}
