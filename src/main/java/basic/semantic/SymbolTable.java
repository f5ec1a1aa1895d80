package basic.semantic;

import static com.google.common.base.Preconditions.checkArgument;

import basic.ast.Program;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.jooq.lambda.Seq;

/**
 * The resolved symbols of a program, as handed over by semantic analysis. Read-only once built.
 */
public class SymbolTable {
  private final ImmutableList<Symbol> symbols;

  private SymbolTable(List<Symbol> symbols) {
    this.symbols = ImmutableList.copyOf(symbols);
  }

  public static SymbolTable of(Symbol... symbols) {
    return builder().addAll(ImmutableList.copyOf(symbols)).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<Symbol> symbols() {
    return symbols;
  }

  /**
   * Lookup {@code name} as seen from inside {@code routine}: a LOCAL of that routine shadows a
   * global of the same name.
   */
  public Optional<Symbol> lookup(String routine, String name) {
    Optional<Symbol> local =
        Seq.seq(symbols)
            .filter(s -> s.name.equals(name) && s.owner.equals(Optional.of(routine)))
            .findFirst();
    if (local.isPresent()) {
      return local;
    }
    return Seq.seq(symbols).filter(s -> s.name.equals(name) && s.scope != Symbol.Scope.LOCAL)
        .findFirst();
  }

  /**
   * The symbols whose storage the entry block of {@code routine} allocates, sorted by name. The
   * main program allocates every global plus its own locals; a SUB or FUNCTION only its
   * non-parameter locals. SHARED symbols live with the globals and are never allocated again, and
   * FUNCTION symbols have no storage.
   */
  public List<Symbol> storageOf(String routine) {
    boolean isMain = routine.equals(Program.MAIN);
    return Seq.seq(symbols)
        .filter(s -> s.kind != Symbol.Kind.FUNCTION)
        .filter(
            s ->
                (isMain && s.scope == Symbol.Scope.GLOBAL)
                    || (s.scope == Symbol.Scope.LOCAL
                        && s.owner.get().equals(routine)
                        && !s.isParameter))
        .sorted(Comparator.comparing((Symbol s) -> s.name))
        .toList();
  }

  public static class Builder {
    private final List<Symbol> symbols = new ArrayList<>();

    private Builder() {}

    public Builder add(Symbol symbol) {
      checkArgument(
          symbols
              .stream()
              .noneMatch(s -> s.name.equals(symbol.name) && s.owner.equals(symbol.owner)),
          "Symbol %s is already defined",
          symbol.name);
      symbols.add(symbol);
      return this;
    }

    public Builder addAll(Iterable<Symbol> symbols) {
      symbols.forEach(this::add);
      return this;
    }

    public SymbolTable build() {
      return new SymbolTable(symbols);
    }
  }
}
