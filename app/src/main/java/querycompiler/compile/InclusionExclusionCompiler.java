package querycompiler.compile;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import querycompiler.capability.EdgeCapability;
import querycompiler.core.LiteralWeights;
import querycompiler.dsl.Condition;
import querycompiler.dsl.NodeSets;
import querycompiler.dsl.QuerySerializer;
import querycompiler.graph.GraphView;
import querycompiler.reach.CheckBudget;
import querycompiler.reach.ConstraintCombination;
import querycompiler.reach.ReachabilityAnalyzer;
import querycompiler.reach.ReachabilityResult;

/**
 * Replaces {@code exclude(X)} by signed sub-queries: {@code N(not X) = N - sum N(S) over odd S +
 * sum N(S) over even S}, for non-empty {@code S} of {@code X} that some journey can visit in
 * full.
 *
 * <p>Subsets are tested level by level. A subset is only tested when every subset one smaller was
 * reachable, since a journey through {@code S} also passes through all its subsets.
 */
public final class InclusionExclusionCompiler {
  private static final Logger LOG = LoggerFactory.getLogger(InclusionExclusionCompiler.class);

  private InclusionExclusionCompiler() {}

  public static CompiledQuery compileExclusion(
      GraphView view, Condition condition, LiteralWeights weights, CheckBudget budget) {
    Objects.requireNonNull(view, "view");
    Objects.requireNonNull(condition, "condition");
    Objects.requireNonNull(budget, "budget");
    if (!condition.hasEndpoints()) {
      throw new IllegalArgumentException("Condition must be anchored: " + condition);
    }
    int before = budget.used();
    Condition rewritten =
        DualRewriter.rewrite(
            view, condition, weights == null ? LiteralWeights.defaults() : weights, budget);
    Condition base = rewritten.toBuilder().clearExclude().clearTerms().build();
    List<String> excluded = new ArrayList<>(rewritten.exclude());

    List<SortedSet<String>> reachable = new ArrayList<>();
    boolean capped = false;
    List<SortedSet<String>> level = singletons(excluded);
    while (!level.isEmpty()) {
      List<ConstraintCombination> combinations = new ArrayList<>();
      Map<ConstraintCombination, SortedSet<String>> subsets = new IdentityHashMap<>();
      for (SortedSet<String> subset : level) {
        ConstraintCombination combination =
            new ConstraintCombination(
                NodeSets.union(base.visited(), subset), null, base.visitedAny());
        combinations.add(combination);
        subsets.put(combination, subset);
      }
      ReachabilityResult result =
          ReachabilityAnalyzer.reachableCombinations(
              view, base.from(), base.to(), combinations, budget);
      List<SortedSet<String>> survivors = new ArrayList<>();
      for (ConstraintCombination combination : result.reachable()) {
        survivors.add(subsets.get(combination));
      }
      reachable.addAll(survivors);
      if (result.capped()) {
        capped = true;
        break;
      }
      level = nextLevel(survivors);
    }

    Condition.Builder compiled = base.toBuilder();
    List<QueryTerm> terms = new ArrayList<>();
    terms.add(new QueryTerm(1, base.visited(), QuerySerializer.serialize(base)));
    List<SortedSet<String>> ordered = NodeSets.freezeGroups(reachable);
    for (SortedSet<String> subset : ordered) {
      if (subset.size() % 2 == 1) {
        compiled.minus(subset);
        terms.add(term(-1, base, subset));
      }
    }
    for (SortedSet<String> subset : ordered) {
      if (subset.size() % 2 == 0) {
        compiled.plus(subset);
        terms.add(term(1, base, subset));
      }
    }
    Condition result = compiled.build();
    LOG.debug("Expanded {} into {} terms{}", condition, terms.size(), capped ? " (capped)" : "");
    return new CompiledQuery(
        QuerySerializer.serialize(result),
        result,
        terms,
        EdgeCapability.conservative(),
        budget.used() - before,
        capped,
        true,
        List.of());
  }

  private static QueryTerm term(int coefficient, Condition base, SortedSet<String> subset) {
    Condition sub = base.toBuilder().visited(subset).build();
    return new QueryTerm(coefficient, sub.visited(), QuerySerializer.serialize(sub));
  }

  private static List<SortedSet<String>> singletons(List<String> nodes) {
    List<SortedSet<String>> level = new ArrayList<>();
    for (String node : nodes) {
      level.add(NodeSets.of(node));
    }
    return level;
  }

  /**
   * Joins pairs of k-sets that share their first k-1 elements, keeping candidates whose every
   * k-subset survived.
   */
  static List<SortedSet<String>> nextLevel(List<SortedSet<String>> survivors) {
    Set<SortedSet<String>> known = new HashSet<>(survivors);
    List<SortedSet<String>> sorted = NodeSets.freezeGroups(survivors);
    List<SortedSet<String>> candidates = new ArrayList<>();
    for (int i = 0; i < sorted.size(); i++) {
      List<String> left = new ArrayList<>(sorted.get(i));
      for (int j = i + 1; j < sorted.size(); j++) {
        List<String> right = new ArrayList<>(sorted.get(j));
        if (!left.subList(0, left.size() - 1).equals(right.subList(0, right.size() - 1))) {
          continue;
        }
        TreeSet<String> candidate = new TreeSet<>(left);
        candidate.add(right.get(right.size() - 1));
        if (allSubsetsKnown(candidate, known)) {
          candidates.add(NodeSets.freeze(candidate));
        }
      }
    }
    return candidates;
  }

  private static boolean allSubsetsKnown(
      SortedSet<String> candidate, Set<SortedSet<String>> known) {
    for (String drop : candidate) {
      if (!known.contains(NodeSets.difference(candidate, Set.of(drop)))) {
        return false;
      }
    }
    return true;
  }
}
