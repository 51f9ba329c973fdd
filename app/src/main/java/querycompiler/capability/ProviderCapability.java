package querycompiler.capability;

import java.util.Objects;

/**
 * Query features one connection supports. {@code maxPathLength} of zero or less means no limit.
 */
public record ProviderCapability(
    String connectionName,
    String provider,
    boolean supportsNativeExclude,
    boolean supportsVisited,
    boolean supportsOrdered,
    int maxPathLength) {

  public ProviderCapability {
    Objects.requireNonNull(connectionName, "connectionName");
    Objects.requireNonNull(provider, "provider");
    maxPathLength = Math.max(0, maxPathLength);
  }

  /** Capability assumed when nothing is known: every feature off. */
  public static ProviderCapability unsupported(String connectionName, String provider) {
    return new ProviderCapability(connectionName, provider, false, false, false, 0);
  }

  ProviderCapability rename(String name, String providerName) {
    return new ProviderCapability(
        name, providerName, supportsNativeExclude, supportsVisited, supportsOrdered, maxPathLength);
  }
}
