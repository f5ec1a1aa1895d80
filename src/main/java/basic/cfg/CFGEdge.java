package basic.cfg;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

public final class CFGEdge {
  /** Target of {@link EdgeType#RETURN} edges, which is resolved by dispatch at run time. */
  public static final int DYNAMIC_TARGET = -1;

  public final int source;
  public final int target;
  public final EdgeType type;
  /** {@code case_<i>}, {@code catch_<i>} or {@code default} on multiway edges. */
  public final Optional<String> label;

  public CFGEdge(int source, int target, EdgeType type, @Nullable String label) {
    checkArgument(source >= 0, "Edge source must be a block, got %s", source);
    checkArgument(
        (type == EdgeType.RETURN) == (target == DYNAMIC_TARGET),
        "Exactly the Return edges have a dynamic target");
    this.source = source;
    this.target = target;
    this.type = type;
    this.label = Optional.ofNullable(label);
  }

  public CFGEdge(int source, int target, EdgeType type) {
    this(source, target, type, null);
  }

  public static CFGEdge returnFrom(int source) {
    return new CFGEdge(source, DYNAMIC_TARGET, EdgeType.RETURN);
  }

  public boolean hasStaticTarget() {
    return target != DYNAMIC_TARGET;
  }

  public boolean isLabeled(String label) {
    return this.label.isPresent() && this.label.get().equals(label);
  }

  public CFGEdge withTarget(int target) {
    return new CFGEdge(source, target, type, label.orElse(null));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    CFGEdge that = (CFGEdge) o;
    return source == that.source
        && target == that.target
        && type == that.type
        && label.equals(that.label);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, target, type, label);
  }

  @Override
  public String toString() {
    String to = hasStaticTarget() ? Integer.toString(target) : "?";
    return source + " -" + type + label.map(l -> "[" + l + "]").orElse("") + "-> " + to;
  }
}
