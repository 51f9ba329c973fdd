package querycompiler.reach;

/**
 * Counts reachability checks spent by one compilation. Not shared between compilations and not
 * thread-safe.
 */
public final class CheckBudget {
  private final int limit;
  private int used;
  private boolean capped;

  private CheckBudget(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0: " + limit);
    }
    this.limit = limit;
  }

  public static CheckBudget of(int limit) {
    return new CheckBudget(limit);
  }

  /** Spends one check; returns false and marks the budget capped once the limit is reached. */
  public boolean tryConsume() {
    if (used >= limit) {
      capped = true;
      return false;
    }
    used++;
    return true;
  }

  public int used() {
    return used;
  }

  public int limit() {
    return limit;
  }

  public boolean capped() {
    return capped;
  }
}
