package basic.cfg.build;

import static com.google.common.base.Preconditions.checkArgument;

import basic.EnvVar;
import com.google.common.primitives.Ints;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Knobs of CFG construction and linearization. Instances are immutable. */
public class CfgOptions {
  private static final Logger LOGGER = LoggerFactory.getLogger("CfgOptions");
  /** Deeper nesting could exhaust the stack of the recursive walks. */
  public static final int MAX_NESTING_DEPTH = 1024;

  public static final CfgOptions DEFAULT = new CfgOptions(64, 16, true, false);

  /** Construct nesting beyond this depth is rejected with a ConstructTooComplexError. */
  public final int maxNestingDepth;
  /** Number of entries of the GOSUB return stack of the generated program. */
  public final int returnStackCapacity;

  public final boolean eliminateDeadBlocks;
  /** Log the report of every built graph at info level. */
  public final boolean dumpCfg;

  private CfgOptions(
      int maxNestingDepth,
      int returnStackCapacity,
      boolean eliminateDeadBlocks,
      boolean dumpCfg) {
    checkArgument(
        maxNestingDepth > 0 && maxNestingDepth <= MAX_NESTING_DEPTH,
        "Nesting depth must be from 1 to %s, got %s",
        MAX_NESTING_DEPTH,
        maxNestingDepth);
    checkArgument(
        returnStackCapacity > 0, "Return stack must have room, got %s", returnStackCapacity);
    this.maxNestingDepth = maxNestingDepth;
    this.returnStackCapacity = returnStackCapacity;
    this.eliminateDeadBlocks = eliminateDeadBlocks;
    this.dumpCfg = dumpCfg;
  }

  /** The defaults, overridden by whichever of the BASIC_CFG_* variables are set. */
  public static CfgOptions fromEnvironment() {
    CfgOptions options = DEFAULT;
    if (EnvVar.BASIC_CFG_MAX_DEPTH.isAvailable()) {
      options =
          options.withMaxNestingDepth(
              parse(EnvVar.BASIC_CFG_MAX_DEPTH, DEFAULT.maxNestingDepth, MAX_NESTING_DEPTH));
    }
    if (EnvVar.BASIC_RETURN_STACK_SIZE.isAvailable()) {
      options =
          options.withReturnStackCapacity(
              parse(
                  EnvVar.BASIC_RETURN_STACK_SIZE,
                  DEFAULT.returnStackCapacity,
                  Integer.MAX_VALUE));
    }
    if (EnvVar.BASIC_CFG_KEEP_DEAD_BLOCKS.isSetToOne()) {
      options = options.withEliminateDeadBlocks(false);
    }
    if (EnvVar.BASIC_CFG_DUMP.isSetToOne()) {
      options = options.withDumpCfg(true);
    }
    return options;
  }

  private static int parse(EnvVar variable, int fallback, int max) {
    return parse(variable.name(), variable.value().orElse(""), fallback, max);
  }

  /** {@code raw} as a number from 1 to {@code max}, or {@code fallback} with a warning. */
  static int parse(String name, String raw, int fallback, int max) {
    Integer value = Ints.tryParse(raw.trim());
    if (value == null || value <= 0 || value > max) {
      LOGGER.warn("Ignoring {}={}, expected a number from 1 to {}", name, raw, max);
      return fallback;
    }
    return value;
  }

  public CfgOptions withMaxNestingDepth(int maxNestingDepth) {
    return new CfgOptions(maxNestingDepth, returnStackCapacity, eliminateDeadBlocks, dumpCfg);
  }

  public CfgOptions withReturnStackCapacity(int returnStackCapacity) {
    return new CfgOptions(maxNestingDepth, returnStackCapacity, eliminateDeadBlocks, dumpCfg);
  }

  public CfgOptions withEliminateDeadBlocks(boolean eliminateDeadBlocks) {
    return new CfgOptions(maxNestingDepth, returnStackCapacity, eliminateDeadBlocks, dumpCfg);
  }

  public CfgOptions withDumpCfg(boolean dumpCfg) {
    return new CfgOptions(maxNestingDepth, returnStackCapacity, eliminateDeadBlocks, dumpCfg);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    CfgOptions that = (CfgOptions) o;
    return maxNestingDepth == that.maxNestingDepth
        && returnStackCapacity == that.returnStackCapacity
        && eliminateDeadBlocks == that.eliminateDeadBlocks
        && dumpCfg == that.dumpCfg;
  }

  @Override
  public int hashCode() {
    return Objects.hash(maxNestingDepth, returnStackCapacity, eliminateDeadBlocks, dumpCfg);
  }

  @Override
  public String toString() {
    return String.format(
        "CfgOptions(maxNestingDepth=%d, returnStackCapacity=%d, "
            + "eliminateDeadBlocks=%s, dumpCfg=%s)",
        maxNestingDepth, returnStackCapacity, eliminateDeadBlocks, dumpCfg);
  }
}
