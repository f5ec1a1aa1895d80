package basic;

import java.util.Optional;

/** Environment variables that tune the middle end. Read by {@code CfgOptions.fromEnvironment}. */
public enum EnvVar {
  BASIC_CFG_MAX_DEPTH("Maximum nesting depth of control constructs per routine."),
  BASIC_RETURN_STACK_SIZE("Number of entries on the GOSUB return stack."),
  BASIC_CFG_KEEP_DEAD_BLOCKS("Set to \"1\" to turn off dead and empty block elimination."),
  BASIC_CFG_DUMP("Set to \"1\" to log the CFG report of every routine.");

  public final String description;

  EnvVar(String description) {
    this.description = description;
  }

  public Optional<String> value() {
    return Optional.ofNullable(System.getenv(name()));
  }

  public boolean isAvailable() {
    return value().isPresent();
  }

  public boolean isSetToOne() {
    return value().map(v -> v.trim().equals("1")).orElse(false);
  }

  @Override
  public String toString() {
    return name() + ": " + description;
  }
}
