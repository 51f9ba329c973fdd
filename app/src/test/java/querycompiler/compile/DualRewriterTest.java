package querycompiler.compile;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import querycompiler.core.LiteralWeights;
import querycompiler.dsl.Condition;
import querycompiler.dsl.QueryParser;
import querycompiler.graph.DagView;
import querycompiler.graph.GraphView;
import querycompiler.reach.CheckBudget;
import querycompiler.testing.TestGraphs;

final class DualRewriterTest {
  private final GraphView fanIn = DagView.of(TestGraphs.fanIn());

  @Test
  void expensiveExcludeBecomesVisitedAny() {
    Condition rewritten = rewrite(fanIn, "from(e).to(f).exclude(b)", new LiteralWeights(1, 10));
    assertEquals("from(e).to(f).visitedAny(c,d)", rewritten.toString());
  }

  @Test
  void expensiveVisitedBecomesExclude() {
    Condition rewritten = rewrite(fanIn, "from(e).to(f).visited(b)", new LiteralWeights(10, 1));
    assertEquals("from(e).to(f).exclude(c,d)", rewritten.toString());
  }

  @Test
  void equalCostsKeepTheLiteralAsWritten() {
    LiteralWeights tie = LiteralWeights.defaults();
    assertEquals(
        "from(e).to(f).exclude(b)", rewrite(fanIn, "from(e).to(f).exclude(b)", tie).toString());
    assertEquals(
        "from(e).to(f).visited(b)", rewrite(fanIn, "from(e).to(f).visited(b)", tie).toString());
  }

  @Test
  void nonPredecessorLiteralsAreLeftAlone() {
    Condition rewritten =
        rewrite(fanIn, "from(e).to(f).exclude(a,b)", new LiteralWeights(1, 10));
    assertEquals(
        "from(e).to(f).visitedAny(c,d).exclude(a)",
        rewritten.toString(),
        "Only the predecessor part of the exclude has a dual");
  }

  @Test
  void joinedPredecessorsAreNotRewritten() {
    GraphView joined = DagView.of(TestGraphs.graph("a>b", "b>c", "b>e", "c>e", "e>f"));
    Condition rewritten = rewrite(joined, "from(e).to(f).exclude(b)", new LiteralWeights(1, 10));
    assertEquals("from(e).to(f).exclude(b)", rewritten.toString());
  }

  @Test
  void excludingEveryPredecessorHasNoDual() {
    Condition rewritten =
        rewrite(fanIn, "from(e).to(f).exclude(b,c,d)", new LiteralWeights(1, 10));
    assertEquals("from(e).to(f).exclude(b,c,d)", rewritten.toString());
  }

  private static Condition rewrite(GraphView view, String query, LiteralWeights weights) {
    return DualRewriter.rewrite(view, QueryParser.parseQuery(query), weights, CheckBudget.of(200));
  }
}
