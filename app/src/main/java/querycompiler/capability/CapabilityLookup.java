package querycompiler.capability;

import java.util.Objects;

/** Capability resolved for one data source and how it was found. */
public record CapabilityLookup(
    ProviderCapability capability, Resolution resolution, boolean degraded) {

  public enum Resolution {
    CONNECTION,
    PROVIDER_DEFAULT,
    FALLBACK
  }

  public CapabilityLookup {
    Objects.requireNonNull(capability, "capability");
    Objects.requireNonNull(resolution, "resolution");
  }
}
