package querycompiler.route;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;
import querycompiler.graph.DagView;
import querycompiler.graph.GraphView;
import querycompiler.reach.CheckBudget;
import querycompiler.testing.TestGraphs;

final class CompetingPathDetectorTest {

  @Test
  void findsParentsReachableFromSource() {
    GraphView view = DagView.of(TestGraphs.graph("a>b", "b>d", "a>c", "c>d", "a>d"));
    assertEquals(
        List.of("b", "c"), CompetingPathDetector.siblingRoutes(view, "a", "d", CheckBudget.of(10)));
  }

  @Test
  void ignoresParentsNotReachableFromSource() {
    GraphView view = DagView.of(TestGraphs.graph("a>b", "b>d", "a>d", "x>d"));
    assertEquals(
        List.of("b"), CompetingPathDetector.siblingRoutes(view, "a", "d", CheckBudget.of(10)));
  }

  @Test
  void singleRouteHasNoSiblings() {
    GraphView view = DagView.of(TestGraphs.fanIn());
    assertEquals(
        List.of(), CompetingPathDetector.siblingRoutes(view, "e", "f", CheckBudget.of(10)));
  }

  @Test
  void upstreamAlternativesAreTheOtherParents() {
    GraphView view = DagView.of(TestGraphs.fanIn());
    assertEquals(List.of("c", "d"), CompetingPathDetector.upstreamAlternatives(view, "e", "b"));
    assertEquals(List.of(), CompetingPathDetector.upstreamAlternatives(view, "e", "a"));
  }
}
