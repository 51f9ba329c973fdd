package querycompiler.testing;

import querycompiler.core.CompilerOptions;

/**
 * Centralized test configuration knobs. The reachability budget used by tests can be raised via
 * the system property {@code querycompiler.maxChecks} or environment variable {@code
 * QUERYCOMPILER_MAX_CHECKS}.
 */
public final class TestDefaults {
  private static final String MAX_CHECKS_PROPERTY = "querycompiler.maxChecks";
  private static final String MAX_CHECKS_ENV = "QUERYCOMPILER_MAX_CHECKS";

  private TestDefaults() {}

  public static int maxChecks() {
    Integer fromProperty = parse(System.getProperty(MAX_CHECKS_PROPERTY));
    if (fromProperty != null) {
      return fromProperty;
    }
    Integer fromEnv = parse(System.getenv(MAX_CHECKS_ENV));
    return fromEnv != null ? fromEnv : CompilerOptions.DEFAULT_MAX_CHECKS;
  }

  public static CompilerOptions compilerOptions() {
    return CompilerOptions.defaults().withMaxChecks(maxChecks());
  }

  private static Integer parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      int value = Integer.parseInt(raw.trim());
      return value > 0 ? value : null;
    } catch (NumberFormatException ex) {
      return null;
    }
  }
}
