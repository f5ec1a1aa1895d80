package basic.semantic;

/**
 * Resolved type of a symbol. Only the storage class matters to control flow construction: the
 * entry block zero-initializes numbers and nulls descriptors.
 */
public enum SemanticType {
  INTEGER("w", false),
  LONG("l", false),
  SINGLE("s", false),
  DOUBLE("d", false),
  /** A reference-counted string descriptor. */
  STRING("l", true),
  /** A user defined type or object, held by reference. */
  OBJECT("l", true);

  /** Width class of the storage slot in the emitted IL. */
  public final String ilClass;

  private final boolean isDescriptor;

  SemanticType(String ilClass, boolean isDescriptor) {
    this.ilClass = ilClass;
    this.isDescriptor = isDescriptor;
  }

  /** Whether the slot holds a pointer to runtime-managed memory that starts out null. */
  public boolean isDescriptor() {
    return isDescriptor;
  }
}
