package basic.semantic;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

public class Symbol {
  public final String name;
  public final SemanticType type;
  public final Scope scope;
  /** The routine a LOCAL symbol belongs to. Empty for GLOBAL and SHARED symbols. */
  public final Optional<String> owner;

  public final Kind kind;
  public final boolean isParameter;

  public Symbol(
      String name,
      SemanticType type,
      Scope scope,
      @Nullable String owner,
      Kind kind,
      boolean isParameter) {
    checkArgument(
        (scope == Scope.LOCAL) == (owner != null), "Exactly the LOCAL symbols have an owner");
    checkArgument(!isParameter || scope == Scope.LOCAL, "Parameters are local to their routine");
    this.name = name;
    this.type = type;
    this.scope = scope;
    this.owner = Optional.ofNullable(owner);
    this.kind = kind;
    this.isParameter = isParameter;
  }

  public static Symbol global(String name, SemanticType type) {
    return new Symbol(name, type, Scope.GLOBAL, null, Kind.VARIABLE, false);
  }

  public static Symbol globalArray(String name, SemanticType type) {
    return new Symbol(name, type, Scope.GLOBAL, null, Kind.ARRAY, false);
  }

  public static Symbol local(String owner, String name, SemanticType type) {
    return new Symbol(name, type, Scope.LOCAL, owner, Kind.VARIABLE, false);
  }

  public static Symbol parameter(String owner, String name, SemanticType type) {
    return new Symbol(name, type, Scope.LOCAL, owner, Kind.VARIABLE, true);
  }

  /** Whether storage for this symbol is a descriptor pointer rather than a number. */
  public boolean isReference() {
    return kind == Kind.ARRAY || type.isDescriptor();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Symbol symbol = (Symbol) o;
    return isParameter == symbol.isParameter
        && name.equals(symbol.name)
        && type == symbol.type
        && scope == symbol.scope
        && owner.equals(symbol.owner)
        && kind == symbol.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, scope, owner, kind, isParameter);
  }

  @Override
  public String toString() {
    return scope + " " + kind + " " + name + " AS " + type;
  }

  public enum Scope {
    GLOBAL,
    LOCAL,
    /** Declared with {@code SHARED} inside a routine, but stored with the globals. */
    SHARED
  }

  public enum Kind {
    VARIABLE,
    ARRAY,
    FUNCTION
  }
}
