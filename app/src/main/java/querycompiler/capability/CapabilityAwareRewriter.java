package querycompiler.capability;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import querycompiler.model.DataSource;

/**
 * Aggregates provider capabilities per edge. A feature counts as native only when every data
 * source on the edge supports it; only capability flags are consulted, never provider names.
 */
public final class CapabilityAwareRewriter {
  private static final Logger LOG = LoggerFactory.getLogger(CapabilityAwareRewriter.class);

  private CapabilityAwareRewriter() {}

  public static EdgeCapability edgeCapability(EdgeDataSources sources, CapabilityTable table) {
    Objects.requireNonNull(sources, "sources");
    Objects.requireNonNull(table, "table");
    if (sources.isEmpty()) {
      return EdgeCapability.conservative();
    }
    boolean nativeExclude = true;
    boolean nativeVisited = true;
    boolean ordered = true;
    int maxPathLength = 0;
    boolean degraded = false;
    for (DataSource source : sources.sources()) {
      CapabilityLookup lookup = table.lookup(source);
      ProviderCapability capability = lookup.capability();
      nativeExclude &= capability.supportsNativeExclude();
      nativeVisited &= capability.supportsVisited();
      ordered &= capability.supportsOrdered();
      degraded |= lookup.degraded();
      if (capability.maxPathLength() > 0) {
        maxPathLength =
            maxPathLength == 0
                ? capability.maxPathLength()
                : Math.min(maxPathLength, capability.maxPathLength());
      }
    }
    EdgeCapability verdict =
        new EdgeCapability(nativeExclude, nativeVisited, ordered, maxPathLength, degraded);
    LOG.debug("Capability verdict for {}: {}", sources.sources(), verdict);
    return verdict;
  }
}
