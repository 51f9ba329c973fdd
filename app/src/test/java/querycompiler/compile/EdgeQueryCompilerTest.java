package querycompiler.compile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import querycompiler.capability.CapabilityTable;
import querycompiler.capability.CapabilityTableLoader;
import querycompiler.capability.EdgeDataSources;
import querycompiler.capability.ProviderCapability;
import querycompiler.core.CompilerOptions;
import querycompiler.core.LiteralWeights;
import querycompiler.dsl.CaseFilter;
import querycompiler.dsl.Condition;
import querycompiler.graph.DagView;
import querycompiler.graph.GraphView;
import querycompiler.graph.InvalidConditionException;
import querycompiler.graph.UnknownNodeException;
import querycompiler.model.DataSource;
import querycompiler.testing.TestDefaults;
import querycompiler.testing.TestGraphs;

final class EdgeQueryCompilerTest {
  private static final EdgeDataSources NATIVE = EdgeDataSources.of(TestGraphs.AMPLITUDE);
  private static final EdgeDataSources NON_NATIVE = EdgeDataSources.of(TestGraphs.SHEETS);

  private final EdgeQueryCompiler compiler =
      new EdgeQueryCompiler(CapabilityTableLoader.loadDefaults(), TestDefaults.compilerOptions());

  @Test
  void unconditionedSlotExcludesCompetingRoutes() {
    GraphView view = DagView.of(TestGraphs.graph("a>b", "b>d", "a>c", "c>d", "a>d"));
    CompiledQuery compiled = compile(view, "a->d", "", NATIVE, LiteralWeights.defaults());
    assertEquals("from(a).to(d).exclude(b,c)", compiled.query());
    assertTrue(compiled.capability().nativeExclude());
    assertFalse(compiled.expanded());
  }

  @Test
  void parentsUnreachableFromSourceAreNotExcluded() {
    GraphView view = DagView.of(TestGraphs.graph("a>b", "b>d", "a>c", "c>d", "a>d", "x>d"));
    CompiledQuery compiled = compile(view, "a->d", null, NATIVE, LiteralWeights.defaults());
    assertEquals("from(a).to(d).exclude(b,c)", compiled.query());
  }

  @Test
  void nonNativeEdgeIsExpanded() {
    GraphView view = DagView.of(TestGraphs.diamond());
    CompiledQuery compiled = compile(view, "a->c", "", NON_NATIVE, LiteralWeights.defaults());
    assertEquals("from(a).to(c).minus(b).minus(d)", compiled.query());
    assertFalse(compiled.capability().nativeExclude());
    assertTrue(compiled.expanded());
    assertTrue(compiled.satisfiable());
  }

  @Test
  void edgeWithoutSourcesIsTreatedAsNonNative() {
    GraphView view = DagView.of(TestGraphs.diamond());
    CompiledQuery compiled =
        compile(view, "a->c", "", EdgeDataSources.none(), LiteralWeights.defaults());
    assertEquals("from(a).to(c).minus(b).minus(d)", compiled.query());
  }

  @Test
  void conditionalSlotUsesCheaperDual() {
    GraphView view = DagView.of(TestGraphs.fanIn());
    assertEquals(
        "from(e).to(f).visitedAny(c,d)",
        compile(view, "e->f", "exclude(b)", NATIVE, new LiteralWeights(1, 10)).query());
    assertEquals(
        "from(e).to(f).exclude(c,d)",
        compile(view, "e->f", "visited(b)", NATIVE, new LiteralWeights(10, 1)).query());
    assertEquals(
        "from(e).to(f).exclude(b)",
        compile(view, "e->f", "exclude(b)", NATIVE, LiteralWeights.defaults()).query());
  }

  @Test
  void sourceWithoutVisitedSupportGetsNoVisitedAnyDual() {
    GraphView view = DagView.of(TestGraphs.fanIn());
    CompiledQuery compiled =
        compile(view, "e->f", "exclude(b)", NON_NATIVE, new LiteralWeights(1, 10));
    assertEquals("from(e).to(f).minus(b)", compiled.query());
    assertTrue(compiled.expanded());
  }

  @Test
  void nonNativeExcludeUsesDualWhenVisitedIsSupported() {
    EdgeQueryCompiler visitedOnly =
        new EdgeQueryCompiler(
            singleConnection(new ProviderCapability("visits", "p", false, true, false, 0)),
            TestDefaults.compilerOptions());
    CompiledQuery compiled =
        visitedOnly.compile(
            DagView.of(TestGraphs.fanIn()),
            "e->f",
            "exclude(b)",
            EdgeDataSources.of(new DataSource("visits", "p")),
            LiteralWeights.defaults());
    assertEquals("from(e).to(f).visitedAny(c,d)", compiled.query());
    assertFalse(compiled.query().contains("exclude("));
  }

  @Test
  void nativeExcludeWithoutVisitedKeepsExclude() {
    EdgeQueryCompiler excludeOnly =
        new EdgeQueryCompiler(
            singleConnection(new ProviderCapability("xonly", "p", true, false, false, 0)),
            TestDefaults.compilerOptions());
    EdgeDataSources sources = EdgeDataSources.of(new DataSource("xonly", "p"));
    GraphView view = DagView.of(TestGraphs.fanIn());

    assertEquals(
        "from(e).to(f).exclude(b)",
        excludeOnly
            .compile(view, "e->f", "exclude(b)", sources, new LiteralWeights(1, 10))
            .query());
    assertEquals(
        "from(e).to(f).exclude(c,d)",
        excludeOnly
            .compile(view, "e->f", "visited(b)", sources, LiteralWeights.defaults())
            .query(),
        "Unsupported visited is swapped for its exclude dual");
  }

  @Test
  void exhaustedBudgetIsCappedNotUnsatisfiable() {
    EdgeQueryCompiler tight =
        new EdgeQueryCompiler(CapabilityTableLoader.loadDefaults(), new CompilerOptions(1, true));
    CompiledQuery compiled =
        tight.compile(
            DagView.of(TestGraphs.diamond()), "a->c", "", NATIVE, LiteralWeights.defaults());
    assertEquals("from(a).to(c).exclude(b,d)", compiled.query());
    assertTrue(compiled.capped());
    assertTrue(compiled.satisfiable(), "An unchecked condition is not reported as impossible");
    assertEquals(List.of(), compiled.warnings());
  }

  @Test
  void caseFilterIsKept() {
    GraphView view = DagView.of(TestGraphs.diamond());
    Condition condition =
        Condition.builder().caseFilter(new CaseFilter("checkout", "treatment")).build();
    CompiledQuery compiled =
        compiler.compile(view, "a->c", condition, NATIVE, LiteralWeights.defaults());
    assertEquals("from(a).to(c).exclude(b,d).case(checkout:treatment)", compiled.query());
  }

  @Test
  void unknownNodesFail() {
    GraphView view = DagView.of(TestGraphs.diamond());
    UnknownNodeException ex =
        assertThrows(
            UnknownNodeException.class,
            () -> compile(view, "a->c", "visited(nowhere)", NATIVE, LiteralWeights.defaults()));
    assertEquals("nowhere", ex.nodeId());
  }

  @Test
  void excludingAnEndpointIsInvalid() {
    GraphView view = DagView.of(TestGraphs.diamond());
    assertThrows(
        InvalidConditionException.class,
        () -> compile(view, "a->c", "exclude(a)", NATIVE, LiteralWeights.defaults()));
    assertThrows(
        InvalidConditionException.class,
        () -> compile(view, "a->c", "from(b).visited(d)", NATIVE, LiteralWeights.defaults()));
  }

  @Test
  void unsatisfiableConditionIsFlagged() {
    GraphView view = DagView.of(TestGraphs.fanIn());
    CompiledQuery compiled =
        compile(view, "e->f", "visited(b,c)", NATIVE, LiteralWeights.defaults());
    assertFalse(compiled.satisfiable());
    assertEquals("from(e).to(f).visited(b,c)", compiled.query());
    assertTrue(compiled.warnings().get(0).startsWith("No journey satisfies"));
  }

  @Test
  void termsLongerThanProviderLimitAreReported() {
    CapabilityTable table =
        new CapabilityTable(
            Map.of("short", new ProviderCapability("short", "legacy", false, true, false, 2)),
            Map.of());
    EdgeQueryCompiler limited = new EdgeQueryCompiler(table, TestDefaults.compilerOptions());
    GraphView view = DagView.of(TestGraphs.diamond());
    CompiledQuery compiled =
        limited.compile(
            view,
            "a->c",
            "",
            EdgeDataSources.of(new DataSource("short", "legacy")),
            LiteralWeights.defaults());
    assertEquals(2, compiled.warnings().size());
    assertTrue(compiled.warnings().get(0).endsWith("from(a).to(c).visited(b)"));
  }

  @Test
  void compilationIsDeterministic() {
    GraphView view = DagView.of(TestGraphs.complex());
    CompiledQuery first = compile(view, "a->m", "", NON_NATIVE, LiteralWeights.defaults());
    CompiledQuery second = compile(view, "a->m", "", NON_NATIVE, LiteralWeights.defaults());
    assertEquals(first, second);
    assertEquals(
        "from(a).to(m).minus(b).minus(d).minus(g).plus(b,d).plus(d,g)", first.query());
  }

  private static CapabilityTable singleConnection(ProviderCapability capability) {
    return new CapabilityTable(Map.of(capability.connectionName(), capability), Map.of());
  }

  private CompiledQuery compile(
      GraphView view,
      String edgeId,
      String condition,
      EdgeDataSources sources,
      LiteralWeights weights) {
    return compiler.compile(view, edgeId, condition, sources, weights);
  }
}
