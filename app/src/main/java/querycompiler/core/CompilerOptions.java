package querycompiler.core;

/** Configuration for compiling a single edge query. */
public record CompilerOptions(int maxChecks, boolean siblingExclusion) {

  /** Reachability checks allowed per compilation before the search is capped. */
  public static final int DEFAULT_MAX_CHECKS = 200;

  public static CompilerOptions defaults() {
    return new CompilerOptions(DEFAULT_MAX_CHECKS, true);
  }

  public static CompilerOptions normalize(CompilerOptions options) {
    if (options == null) {
      return defaults();
    }
    int maxChecks = options.maxChecks() > 0 ? options.maxChecks() : DEFAULT_MAX_CHECKS;
    return new CompilerOptions(maxChecks, options.siblingExclusion());
  }

  public CompilerOptions withMaxChecks(int maxChecks) {
    return new CompilerOptions(maxChecks, siblingExclusion);
  }
}
