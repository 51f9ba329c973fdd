package querycompiler.reach;

import java.util.List;

/**
 * Combinations found reachable, in input order. When {@code capped} is set the budget ran out and
 * later combinations were not tested.
 */
public record ReachabilityResult(
    List<ConstraintCombination> reachable, int checksUsed, boolean capped) {

  public ReachabilityResult {
    reachable = reachable == null ? List.of() : List.copyOf(reachable);
  }
}
