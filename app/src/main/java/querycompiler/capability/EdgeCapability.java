package querycompiler.capability;

import java.util.OptionalInt;
import querycompiler.core.LiteralWeights;

/**
 * Capability verdict for one edge after pessimistic aggregation over its data sources.
 *
 * @param maxPathLength smallest declared limit, or zero when no source declares one
 * @param degraded true when any source was resolved through a fallback
 */
public record EdgeCapability(
    boolean nativeExclude,
    boolean nativeVisited,
    boolean ordered,
    int maxPathLength,
    boolean degraded) {

  /** Verdict for an edge without data sources. */
  public static EdgeCapability conservative() {
    return new EdgeCapability(false, false, false, 0, false);
  }

  public OptionalInt maxPathLengthLimit() {
    return maxPathLength > 0 ? OptionalInt.of(maxPathLength) : OptionalInt.empty();
  }

  /** Prices literals the edge cannot execute at infinity. */
  public LiteralWeights effectiveWeights(LiteralWeights weights) {
    LiteralWeights effective = weights == null ? LiteralWeights.defaults() : weights;
    if (!nativeExclude) {
      effective = effective.withExcludeCost(Double.POSITIVE_INFINITY);
    }
    if (!nativeVisited) {
      effective = effective.withVisitedCost(Double.POSITIVE_INFINITY);
    }
    return effective;
  }
}
