package querycompiler.reach;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import querycompiler.dsl.NodeSets;
import querycompiler.graph.DagView;
import querycompiler.graph.GraphView;
import querycompiler.testing.TestGraphs;

final class ReachabilityAnalyzerTest {

  @Test
  void requiredNodesMustLieOnOneJourney() {
    GraphView view = DagView.of(TestGraphs.diamond());
    List<ConstraintCombination> combinations =
        List.of(
            ConstraintCombination.requiring(Set.of("b")),
            ConstraintCombination.requiring(Set.of("d")),
            ConstraintCombination.requiring(Set.of("b", "d")));
    ReachabilityResult result =
        ReachabilityAnalyzer.reachableCombinations(
            view, "a", "c", combinations, CheckBudget.of(200));
    assertEquals(combinations.subList(0, 2), result.reachable());
    assertFalse(result.capped());
    assertEquals(3, result.checksUsed());
  }

  @Test
  void avoidedNodesBlockRoutes() {
    GraphView view = DagView.of(TestGraphs.graph("a>b", "b>c", "a>c"));
    ConstraintCombination avoidB =
        ConstraintCombination.requiring(Set.of()).withAvoided(Set.of("b"));
    assertTrue(ReachabilityAnalyzer.isReachable(view, "a", "c", avoidB, CheckBudget.of(10)));
    ConstraintCombination viaB =
        ConstraintCombination.requiring(Set.of("b")).withAvoided(Set.of("b"));
    assertFalse(ReachabilityAnalyzer.isReachable(view, "a", "c", viaB, CheckBudget.of(10)));
  }

  @Test
  void upstreamWaypointsNeedAnUnblockedEntry() {
    GraphView view = DagView.of(TestGraphs.fanIn());
    ConstraintCombination viaC = ConstraintCombination.requiring(Set.of("c"));
    assertTrue(ReachabilityAnalyzer.isReachable(view, "e", "f", viaC, CheckBudget.of(10)));
    ConstraintCombination entryAvoided =
        ConstraintCombination.requiring(Set.of()).withAvoided(Set.of("a"));
    assertFalse(
        ReachabilityAnalyzer.isReachable(view, "e", "f", entryAvoided, CheckBudget.of(10)),
        "Every journey into e starts at the avoided entry a");
  }

  @Test
  void anyOfGroupsNeedOneReachableMember() {
    GraphView view = DagView.of(TestGraphs.fanIn());
    ConstraintCombination group =
        ConstraintCombination.requiring(Set.of())
            .withAnyOf(List.of(NodeSets.of("b", "c")))
            .withAvoided(Set.of("b"));
    CheckBudget budget = CheckBudget.of(10);
    assertTrue(ReachabilityAnalyzer.isReachable(view, "e", "f", group, budget));
    assertEquals(1, budget.used(), "Avoided members are not tried");

    ConstraintCombination bothAvoided = group.withAvoided(Set.of("b", "c"));
    assertFalse(
        ReachabilityAnalyzer.isReachable(view, "e", "f", bothAvoided, CheckBudget.of(10)));
  }

  @Test
  void downstreamWaypointIsUnreachable() {
    GraphView view = DagView.of(TestGraphs.fanIn());
    ConstraintCombination afterTarget = ConstraintCombination.requiring(Set.of("f"));
    assertTrue(ReachabilityAnalyzer.isReachable(view, "b", "f", afterTarget, CheckBudget.of(10)));
    ConstraintCombination pastEnd = ConstraintCombination.requiring(Set.of("f"));
    assertFalse(ReachabilityAnalyzer.isReachable(view, "a", "e", pastEnd, CheckBudget.of(10)));
  }

  @Test
  void exhaustedBudgetReturnsPartialResult() {
    GraphView view = DagView.of(TestGraphs.complex());
    List<ConstraintCombination> combinations = new ArrayList<>();
    for (String node : List.of("b", "d", "e", "f", "g")) {
      combinations.add(ConstraintCombination.requiring(Set.of(node)));
    }
    CheckBudget budget = CheckBudget.of(3);
    ReachabilityResult result =
        ReachabilityAnalyzer.reachableCombinations(view, "a", "m", combinations, budget);
    assertTrue(result.capped());
    assertEquals(combinations.subList(0, 3), result.reachable());
    assertEquals(3, result.checksUsed());
    assertTrue(budget.capped());
  }

  @Test
  void reachesTreatsExhaustedBudgetAsReachable() {
    GraphView view = DagView.of(TestGraphs.fanIn());
    CheckBudget budget = CheckBudget.of(1);
    assertFalse(ReachabilityAnalyzer.reaches(view, "b", "c", Set.of(), budget));
    assertTrue(ReachabilityAnalyzer.reaches(view, "b", "c", Set.of(), budget));
    assertTrue(budget.capped());
  }
}
