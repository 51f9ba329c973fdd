package querycompiler.compile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import querycompiler.core.LiteralWeights;
import querycompiler.dsl.Condition;
import querycompiler.dsl.NodeSets;
import querycompiler.graph.GraphView;
import querycompiler.reach.CheckBudget;
import querycompiler.reach.ReachabilityAnalyzer;
import querycompiler.route.CompetingPathDetector;

/**
 * Swaps a literal for its cheaper dual when the immediate predecessors of {@code from} partition
 * every journey. If no path joins two predecessors, each journey passes exactly one of them, so
 * excluding some predecessors is the same as visiting any of the rest, and visiting one is the
 * same as excluding all the others.
 */
public final class DualRewriter {
  private static final Logger LOG = LoggerFactory.getLogger(DualRewriter.class);

  private DualRewriter() {}

  public static Condition rewrite(
      GraphView view, Condition condition, LiteralWeights weights, CheckBudget budget) {
    Objects.requireNonNull(condition, "condition");
    Objects.requireNonNull(weights, "weights");
    if (condition.from() == null) {
      return condition;
    }
    List<String> parents = view.predecessors(condition.from());
    if (parents.size() < 2) {
      return condition;
    }
    Condition rewritten = condition;
    if (weights.excludeCost() > weights.visitedCost()) {
      rewritten = excludeToVisitedAny(view, rewritten, parents, budget);
    } else if (weights.visitedCost() > weights.excludeCost()) {
      rewritten = visitedToExclude(view, rewritten, parents, budget);
    }
    if (!rewritten.equals(condition)) {
      LOG.debug("Dual rewrite {} -> {}", condition, rewritten);
    }
    return rewritten;
  }

  private static Condition excludeToVisitedAny(
      GraphView view, Condition condition, List<String> parents, CheckBudget budget) {
    SortedSet<String> excludedParents = new TreeSet<>(condition.exclude());
    excludedParents.retainAll(parents);
    if (excludedParents.isEmpty()) {
      return condition;
    }
    SortedSet<String> remaining = NodeSets.difference(parents, excludedParents);
    if (remaining.isEmpty() || !mutuallyExclusive(view, parents, budget)) {
      return condition;
    }
    return condition.toBuilder()
        .clearExclude()
        .exclude(NodeSets.difference(condition.exclude(), excludedParents))
        .visitedAny(remaining)
        .build();
  }

  private static Condition visitedToExclude(
      GraphView view, Condition condition, List<String> parents, CheckBudget budget) {
    SortedSet<String> visitedParents = new TreeSet<>(condition.visited());
    visitedParents.retainAll(parents);
    if (visitedParents.size() != 1) {
      return condition;
    }
    String chosen = visitedParents.first();
    if (!mutuallyExclusive(view, parents, budget)) {
      return condition;
    }
    List<String> others =
        CompetingPathDetector.upstreamAlternatives(view, condition.from(), chosen);
    return condition.toBuilder()
        .clearVisited()
        .visited(NodeSets.difference(condition.visited(), Set.of(chosen)))
        .exclude(others)
        .build();
  }

  /** No path joins any two of {@code nodes}; conservative (false) once the budget runs out. */
  static boolean mutuallyExclusive(GraphView view, List<String> nodes, CheckBudget budget) {
    List<String> ordered = new ArrayList<>(nodes);
    ordered.sort((a, b) -> Integer.compare(view.topologicalIndex(a), view.topologicalIndex(b)));
    for (int i = 0; i < ordered.size(); i++) {
      for (int j = i + 1; j < ordered.size(); j++) {
        if (ReachabilityAnalyzer.reaches(view, ordered.get(i), ordered.get(j), Set.of(), budget)) {
          return false;
        }
      }
    }
    return true;
  }
}
