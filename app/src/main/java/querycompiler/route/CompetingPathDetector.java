package querycompiler.route;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import querycompiler.graph.GraphView;
import querycompiler.reach.CheckBudget;
import querycompiler.reach.ReachabilityAnalyzer;

/** Finds alternative routes that make a naive {@code from -> to} funnel ambiguous. */
public final class CompetingPathDetector {
  private static final Logger LOG = LoggerFactory.getLogger(CompetingPathDetector.class);

  private CompetingPathDetector() {}

  /**
   * Predecessors of {@code to}, other than {@code from}, that are reachable from {@code from}. Each
   * one closes a route {@code from -> ... -> p -> to} that bypasses the direct transition. Sorted;
   * empty when the transition is the only route.
   */
  public static List<String> siblingRoutes(
      GraphView view, String from, String to, CheckBudget budget) {
    Objects.requireNonNull(view, "view");
    List<String> siblings = new ArrayList<>();
    for (String parent : view.predecessors(to)) {
      if (parent.equals(from)) {
        continue;
      }
      if (ReachabilityAnalyzer.reaches(view, from, parent, Set.of(), budget)) {
        siblings.add(parent);
      }
    }
    if (!siblings.isEmpty()) {
      LOG.debug("Competing routes for {} -> {} via {}", from, to, siblings);
    }
    return List.copyOf(siblings);
  }

  /**
   * The other immediate predecessors of {@code anchor} when {@code node} is one of them; empty
   * otherwise.
   */
  public static List<String> upstreamAlternatives(GraphView view, String anchor, String node) {
    List<String> parents = view.predecessors(anchor);
    if (!parents.contains(node)) {
      return List.of();
    }
    List<String> others = new ArrayList<>(parents);
    others.remove(node);
    return List.copyOf(others);
  }
}
