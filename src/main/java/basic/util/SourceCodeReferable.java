package basic.util;

/** Objects of this type refer to a location in the original BASIC source. */
public interface SourceCodeReferable {

  /** Returns the {@link SourceRange} this object was parsed from. */
  SourceRange range();
}
