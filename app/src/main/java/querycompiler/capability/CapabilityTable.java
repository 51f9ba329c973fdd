package querycompiler.capability;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import querycompiler.model.DataSource;

/**
 * Immutable capability registry: named connections first, then per-provider defaults, then an
 * all-false fallback.
 */
public final class CapabilityTable {
  private static final Logger LOG = LoggerFactory.getLogger(CapabilityTable.class);

  private final Map<String, ProviderCapability> connections;
  private final Map<String, ProviderCapability> providers;

  public CapabilityTable(
      Map<String, ProviderCapability> connections, Map<String, ProviderCapability> providers) {
    this.connections = Map.copyOf(Objects.requireNonNull(connections, "connections"));
    this.providers = Map.copyOf(Objects.requireNonNull(providers, "providers"));
  }

  public static CapabilityTable empty() {
    return new CapabilityTable(Map.of(), Map.of());
  }

  /**
   * Resolves the capability of {@code source}. A named connection that is not registered, and any
   * use of the all-false fallback, marks the lookup degraded.
   */
  public CapabilityLookup lookup(DataSource source) {
    Objects.requireNonNull(source, "source");
    String name = source.connectionName();
    ProviderCapability direct = connections.get(name);
    if (direct != null) {
      return new CapabilityLookup(direct, CapabilityLookup.Resolution.CONNECTION, false);
    }
    boolean named = !name.isEmpty();
    String provider = !source.provider().isEmpty() ? source.provider() : name;
    ProviderCapability byProvider = providers.get(provider);
    if (byProvider != null) {
      if (named) {
        LOG.warn(
            "Unknown connection '{}'; using defaults of provider '{}'",
            name,
            byProvider.provider());
      }
      return new CapabilityLookup(
          byProvider.rename(name, byProvider.provider()),
          CapabilityLookup.Resolution.PROVIDER_DEFAULT,
          named);
    }
    LOG.warn(
        "No capability entry for connection '{}' (provider '{}'); assuming no native support",
        name,
        source.provider());
    return new CapabilityLookup(
        ProviderCapability.unsupported(name, source.provider()),
        CapabilityLookup.Resolution.FALLBACK,
        true);
  }

  public Set<String> connectionNames() {
    return connections.keySet();
  }

  public Set<String> providerNames() {
    return providers.keySet();
  }
}
