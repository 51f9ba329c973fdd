package querycompiler.reach;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import querycompiler.graph.GraphView;

/**
 * Decides which path-constraint combinations admit a journey that enters the graph at an entry
 * node, passes through {@code from} and ends at {@code to}.
 *
 * <p>In a DAG every journey meets its waypoints in topological order, so one check sorts the
 * required nodes by topological index and runs a bounded traversal per consecutive pair. Each
 * choice of representatives for the {@code anyOf} groups costs one check.
 */
public final class ReachabilityAnalyzer {
  private static final Logger LOG = LoggerFactory.getLogger(ReachabilityAnalyzer.class);

  private ReachabilityAnalyzer() {}

  public static ReachabilityResult reachableCombinations(
      GraphView view,
      String from,
      String to,
      List<ConstraintCombination> combinations,
      CheckBudget budget) {
    Objects.requireNonNull(view, "view");
    Objects.requireNonNull(combinations, "combinations");
    Objects.requireNonNull(budget, "budget");
    int before = budget.used();
    List<ConstraintCombination> reachable = new ArrayList<>();
    for (int i = 0; i < combinations.size(); i++) {
      ConstraintCombination combination = combinations.get(i);
      Verdict verdict = evaluate(view, from, to, combination, budget);
      if (verdict == Verdict.CAPPED) {
        LOG.warn(
            "Reachability budget of {} checks exhausted for {} -> {}; {} of {} combinations tested",
            budget.limit(),
            from,
            to,
            i,
            combinations.size());
        return new ReachabilityResult(reachable, budget.used() - before, true);
      }
      if (verdict == Verdict.REACHABLE) {
        reachable.add(combination);
      }
    }
    return new ReachabilityResult(reachable, budget.used() - before, false);
  }

  /** Single-combination form of {@link #reachableCombinations}; false when capped. */
  public static boolean isReachable(
      GraphView view,
      String from,
      String to,
      ConstraintCombination combination,
      CheckBudget budget) {
    return evaluate(view, from, to, combination, budget) == Verdict.REACHABLE;
  }

  /**
   * Whether {@code target} can be reached from {@code source} without touching {@code avoided}.
   * Returns true when the budget is already exhausted, leaving the budget marked as capped.
   */
  public static boolean reaches(
      GraphView view, String source, String target, Set<String> avoided, CheckBudget budget) {
    if (!budget.tryConsume()) {
      return true;
    }
    return segment(view, source, target, avoided);
  }

  private static Verdict evaluate(
      GraphView view,
      String from,
      String to,
      ConstraintCombination combination,
      CheckBudget budget) {
    SortedSet<String> avoided = combination.avoided();
    if (avoided.contains(from)
        || avoided.contains(to)
        || combination.required().stream().anyMatch(avoided::contains)) {
      return Verdict.UNREACHABLE;
    }
    List<List<String>> choices = new ArrayList<>();
    for (SortedSet<String> group : combination.anyOf()) {
      List<String> usable = new ArrayList<>();
      for (String node : group) {
        if (!avoided.contains(node)) {
          usable.add(node);
        }
      }
      if (usable.isEmpty()) {
        return Verdict.UNREACHABLE;
      }
      choices.add(usable);
    }

    int[] cursor = new int[choices.size()];
    while (true) {
      if (!budget.tryConsume()) {
        return Verdict.CAPPED;
      }
      Set<String> waypoints = new HashSet<>(combination.required());
      for (int i = 0; i < cursor.length; i++) {
        waypoints.add(choices.get(i).get(cursor[i]));
      }
      if (check(view, from, to, waypoints, avoided)) {
        return Verdict.REACHABLE;
      }
      if (!advance(cursor, choices)) {
        return Verdict.UNREACHABLE;
      }
    }
  }

  private static boolean advance(int[] cursor, List<List<String>> choices) {
    for (int i = cursor.length - 1; i >= 0; i--) {
      if (++cursor[i] < choices.get(i).size()) {
        return true;
      }
      cursor[i] = 0;
    }
    return false;
  }

  private static boolean check(
      GraphView view, String from, String to, Set<String> required, Set<String> avoided) {
    int toIndex = view.topologicalIndex(to);
    if (toIndex < 0 || view.topologicalIndex(from) < 0 || view.topologicalIndex(from) >= toIndex) {
      return false;
    }
    TreeSet<String> ordered = new TreeSet<>(Comparator.comparingInt(view::topologicalIndex));
    ordered.add(from);
    for (String node : required) {
      if (node.equals(to)) {
        continue;
      }
      int position = view.topologicalIndex(node);
      if (position < 0 || position >= toIndex) {
        return false;
      }
      ordered.add(node);
    }
    List<String> waypoints = new ArrayList<>(ordered);
    waypoints.add(to);
    if (!reachableFromEntry(view, waypoints.get(0), avoided)) {
      return false;
    }
    for (int i = 0; i + 1 < waypoints.size(); i++) {
      if (!segment(view, waypoints.get(i), waypoints.get(i + 1), avoided)) {
        return false;
      }
    }
    return true;
  }

  private static boolean reachableFromEntry(GraphView view, String node, Set<String> avoided) {
    Deque<String> frontier = new ArrayDeque<>();
    Set<String> seen = new HashSet<>();
    frontier.add(node);
    seen.add(node);
    while (!frontier.isEmpty()) {
      String current = frontier.poll();
      if (view.isEntry(current)) {
        return true;
      }
      for (String parent : view.predecessors(current)) {
        if (!avoided.contains(parent) && seen.add(parent)) {
          frontier.add(parent);
        }
      }
    }
    return false;
  }

  private static boolean segment(
      GraphView view, String source, String target, Set<String> avoided) {
    if (source.equals(target)) {
      return !avoided.contains(source);
    }
    int upper = view.topologicalIndex(target);
    if (avoided.contains(source) || avoided.contains(target)) {
      return false;
    }
    if (upper < 0 || view.topologicalIndex(source) < 0 || view.topologicalIndex(source) > upper) {
      return false;
    }
    Deque<String> frontier = new ArrayDeque<>();
    Set<String> seen = new HashSet<>();
    frontier.add(source);
    seen.add(source);
    while (!frontier.isEmpty()) {
      String current = frontier.poll();
      for (String next : view.successors(current)) {
        if (next.equals(target)) {
          return true;
        }
        if (view.topologicalIndex(next) < upper && !avoided.contains(next) && seen.add(next)) {
          frontier.add(next);
        }
      }
    }
    return false;
  }

  private enum Verdict {
    REACHABLE,
    UNREACHABLE,
    CAPPED
  }
}
