package querycompiler.compile;

import java.util.Objects;
import java.util.SortedSet;
import querycompiler.dsl.NodeSets;

/**
 * One sub-fetch of a compiled query: fetch {@code query} and add it with {@code coefficient}.
 *
 * @param coefficient +1 or -1
 * @param visited nodes the sub-fetch requires, on top of the base query's own constraints
 */
public record QueryTerm(int coefficient, SortedSet<String> visited, String query) {

  public QueryTerm {
    if (coefficient != 1 && coefficient != -1) {
      throw new IllegalArgumentException("coefficient must be +1 or -1: " + coefficient);
    }
    visited = NodeSets.freeze(visited);
    Objects.requireNonNull(query, "query");
  }
}
