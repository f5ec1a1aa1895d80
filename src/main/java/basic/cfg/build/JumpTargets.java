package basic.cfg.build;

import basic.ast.JumpTarget;
import basic.util.SourceRange;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import java.util.Map;
import java.util.Set;

/** What {@link JumpTargetScanner} found out about the jump targets of one routine. */
public class JumpTargets {
  /** Every line number and label a transfer refers to, with the range of its first reference. */
  public final ImmutableSortedMap<JumpTarget, SourceRange> referenced;
  /** Every line number and label that is written in front of a statement. */
  public final ImmutableSortedMap<JumpTarget, SourceRange> defined;
  /**
   * Targets written directly after a GOSUB or ON ... GOSUB. The block they start is where those
   * calls return to, so they are landing zones even if nothing jumps to them.
   */
  public final ImmutableSortedSet<JumpTarget> returnLandingZones;
  /**
   * Targets of RESTORE. They must be defined, but they name DATA rather than code and don't start
   * a block.
   */
  public final ImmutableSortedMap<JumpTarget, SourceRange> restored;
  /** The TRY parts around each defined target, innermost first. */
  private final ImmutableSortedMap<JumpTarget, ImmutableList<TryPart>> triesAround;

  JumpTargets(
      Map<JumpTarget, SourceRange> referenced,
      Map<JumpTarget, SourceRange> defined,
      Map<JumpTarget, SourceRange> restored,
      Set<JumpTarget> returnLandingZones,
      Map<JumpTarget, ImmutableList<TryPart>> triesAround) {
    this.referenced = ImmutableSortedMap.copyOf(referenced);
    this.defined = ImmutableSortedMap.copyOf(defined);
    this.restored = ImmutableSortedMap.copyOf(restored);
    this.returnLandingZones = ImmutableSortedSet.copyOf(returnLandingZones);
    this.triesAround = ImmutableSortedMap.copyOf(triesAround);
  }

  /** The targets that must start a block of their own. */
  public ImmutableSortedSet<JumpTarget> landingZones() {
    return ImmutableSortedSet.copyOf(
        Sets.union(
            Sets.intersection(referenced.keySet(), defined.keySet()), returnLandingZones));
  }

  public boolean isLandingZone(JumpTarget target) {
    return returnLandingZones.contains(target)
        || (referenced.containsKey(target) && defined.containsKey(target));
  }

  /** Referenced or restored, but not defined in this routine. */
  public ImmutableSortedSet<JumpTarget> unresolved() {
    return ImmutableSortedSet.copyOf(
        Sets.difference(Sets.union(referenced.keySet(), restored.keySet()), defined.keySet()));
  }

  /** Whether the defined {@code target} lies within {@code part}. */
  boolean isInside(JumpTarget target, TryPart part) {
    ImmutableList<TryPart> around = triesAround.get(target);
    return around != null && around.contains(part);
  }
}
