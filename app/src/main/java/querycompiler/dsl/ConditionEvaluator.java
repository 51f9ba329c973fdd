package querycompiler.dsl;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;

/**
 * Evaluates a condition against the set of nodes a journey visited. {@code visited} is a
 * conjunction, each {@code visitedAny} group is a disjunction and the groups are ANDed together,
 * and any excluded node rejects the journey.
 */
public final class ConditionEvaluator {

  private ConditionEvaluator() {}

  public static boolean matches(Condition condition, Set<String> visitedNodes) {
    return matches(condition, visitedNodes, Map.of(), Map.of());
  }

  public static boolean matches(
      Condition condition,
      Set<String> visitedNodes,
      Map<String, String> context,
      Map<String, String> caseAssignments) {
    Objects.requireNonNull(condition, "condition");
    Set<String> nodes = visitedNodes == null ? Collections.emptySet() : visitedNodes;
    if (condition.from() != null && !nodes.contains(condition.from())) {
      return false;
    }
    if (condition.to() != null && !nodes.contains(condition.to())) {
      return false;
    }
    if (!nodes.containsAll(condition.visited())) {
      return false;
    }
    for (SortedSet<String> group : condition.visitedAny()) {
      if (Collections.disjoint(group, nodes)) {
        return false;
      }
    }
    if (!Collections.disjoint(condition.exclude(), nodes)) {
      return false;
    }
    Map<String, String> actualContext = context == null ? Map.of() : context;
    for (Map.Entry<String, String> required : condition.context().entrySet()) {
      if (!required.getValue().equals(actualContext.get(required.getKey()))) {
        return false;
      }
    }
    CaseFilter caseFilter = condition.caseFilter();
    if (caseFilter != null) {
      Map<String, String> cases = caseAssignments == null ? Map.of() : caseAssignments;
      return caseFilter.variant().equals(cases.get(caseFilter.caseId()));
    }
    return true;
  }
}
