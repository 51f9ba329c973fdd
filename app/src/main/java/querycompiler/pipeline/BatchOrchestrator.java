package querycompiler.pipeline;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import querycompiler.capability.CapabilityTable;
import querycompiler.capability.EdgeDataSources;
import querycompiler.compile.CompiledQuery;
import querycompiler.compile.EdgeQueryCompiler;
import querycompiler.core.LiteralWeights;
import querycompiler.core.QueryCompilationException;
import querycompiler.dsl.CaseFilter;
import querycompiler.dsl.Condition;
import querycompiler.dsl.QuerySerializer;
import querycompiler.graph.DagView;
import querycompiler.graph.EdgeEndpoints;
import querycompiler.graph.GraphView;
import querycompiler.model.CaseDefinition;
import querycompiler.model.CaseVariant;
import querycompiler.model.ConditionalProbability;
import querycompiler.model.Edge;
import querycompiler.model.Graph;
import querycompiler.model.Node;
import querycompiler.model.Parameter;
import querycompiler.model.SlotRef;
import querycompiler.util.Timing;

/**
 * Compiles every parameter slot of a graph and writes the queries back.
 *
 * <p>Each edge is compiled independently. A failing slot is recorded as a {@link SlotFailure} and
 * keeps its previous query; it never aborts the pass. Results are assembled in graph order, so a
 * parallel pass produces the same output as a sequential one.
 */
public final class BatchOrchestrator {
  private static final Logger LOG = LoggerFactory.getLogger(BatchOrchestrator.class);

  private BatchOrchestrator() {}

  public static BatchResult compileAll(
      Graph graph, CapabilityTable capabilities, BatchOptions options) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(capabilities, "capabilities");
    BatchOptions normalized = BatchOptions.normalize(options);
    Timing timing = Timing.start();
    GraphView view = DagView.of(graph);
    EdgeQueryCompiler compiler =
        new EdgeQueryCompiler(capabilities, normalized.compilerOptions());
    timing.lap("view");

    Set<String> scope = scope(view, normalized);
    Map<String, Node> nodesById = new HashMap<>();
    graph.nodes().forEach(node -> nodesById.put(node.id(), node));
    List<Edge> selected =
        graph.edges().stream()
            .filter(edge -> normalized.edgeId() == null || normalized.edgeId().equals(edge.id()))
            .filter(edge -> scope == null || inScope(view, edge, scope))
            .collect(Collectors.toList());

    List<EdgeOutcome> outcomes = compileEdges(view, compiler, selected, nodesById, normalized);
    timing.lap("compile");

    Map<String, EdgeOutcome> byEdge = new HashMap<>();
    List<SlotQuery> queries = new ArrayList<>();
    List<SlotFailure> failures = new ArrayList<>();
    for (EdgeOutcome outcome : outcomes) {
      byEdge.put(outcome.edge().id(), outcome);
      queries.addAll(outcome.queries());
      failures.addAll(outcome.failures());
    }
    List<Edge> edges = new ArrayList<>(graph.edges().size());
    for (Edge edge : graph.edges()) {
      EdgeOutcome outcome = byEdge.get(edge.id());
      edges.add(outcome == null ? edge : outcome.edge());
    }
    Graph compiled = graph.withEdges(edges).withNodes(writeCaseQueries(graph.nodes(), outcomes));
    timing.lap("assemble");

    long elapsed = timing.elapsedMillis();
    LOG.info(
        "Compiled {} slots on {} edges ({} failed) in {} ms",
        queries.size(),
        selected.size(),
        failures.size(),
        elapsed);
    return new BatchResult(compiled, queries, failures, elapsed, timing.phases());
  }

  private static List<EdgeOutcome> compileEdges(
      GraphView view,
      EdgeQueryCompiler compiler,
      List<Edge> edges,
      Map<String, Node> nodesById,
      BatchOptions options) {
    if (options.parallelism() <= 1 || edges.size() <= 1) {
      List<EdgeOutcome> outcomes = new ArrayList<>(edges.size());
      for (Edge edge : edges) {
        outcomes.add(compileEdge(view, compiler, edge, nodesById, options.weights()));
      }
      return outcomes;
    }
    ForkJoinPool pool = new ForkJoinPool(options.parallelism());
    try {
      return pool.submit(
              () ->
                  edges.parallelStream()
                      .map(edge -> compileEdge(view, compiler, edge, nodesById, options.weights()))
                      .collect(Collectors.toList()))
          .join();
    } finally {
      pool.shutdown();
    }
  }

  private static EdgeOutcome compileEdge(
      GraphView view,
      EdgeQueryCompiler compiler,
      Edge edge,
      Map<String, Node> nodesById,
      LiteralWeights weights) {
    EdgeDataSources sources = EdgeDataSources.of(edge);
    SlotCompiler slots = new SlotCompiler(view, compiler, edge, sources, weights);

    Parameter probability =
        slots.compile(SlotRef.baseProbability(), edge.probability(), Condition.empty(), "");

    List<ConditionalProbability> conditionals = new ArrayList<>();
    List<ConditionalProbability> existing = edge.conditionalProbabilities();
    for (int i = 0; i < existing.size(); i++) {
      ConditionalProbability conditional = existing.get(i);
      conditionals.add(
          conditional.withProbability(
              slots.compileText(
                  SlotRef.conditional(i), conditional.probability(), conditional.condition())));
    }

    TreeMap<String, Parameter> costs = new TreeMap<>();
    for (Map.Entry<String, Parameter> cost : edge.costs().entrySet()) {
      costs.put(
          cost.getKey(),
          slots.compile(SlotRef.cost(cost.getKey()), cost.getValue(), Condition.empty(), ""));
    }

    Map<String, String> variantQueries = new TreeMap<>();
    String caseNodeId = null;
    EdgeEndpoints endpoints = view.edge(edge.id()).orElse(null);
    Node source = endpoints == null ? null : nodesById.get(endpoints.from());
    if (source != null && source.isCase()) {
      caseNodeId = source.id();
      CaseDefinition definition = source.caseDefinition();
      for (CaseVariant variant : definition.variants()) {
        Condition condition =
            Condition.builder()
                .caseFilter(new CaseFilter(definition.id(), variant.name()))
                .build();
        String prior = variant.queries().get(edge.id());
        String compiled =
            slots.compileQuery(SlotRef.caseVariant(variant.name()), condition, prior);
        if (compiled != null) {
          variantQueries.put(variant.name(), compiled);
        }
      }
    }

    Edge updated =
        edge.withProbability(probability)
            .withConditionalProbabilities(conditionals)
            .withCosts(costs);
    return new EdgeOutcome(updated, slots.queries, slots.failures, caseNodeId, variantQueries);
  }

  private static List<Node> writeCaseQueries(List<Node> nodes, List<EdgeOutcome> outcomes) {
    Map<String, Map<String, Map<String, String>>> byNode = new HashMap<>();
    for (EdgeOutcome outcome : outcomes) {
      if (outcome.caseNodeId() == null) {
        continue;
      }
      Map<String, Map<String, String>> byVariant =
          byNode.computeIfAbsent(outcome.caseNodeId(), k -> new HashMap<>());
      for (Map.Entry<String, String> entry : outcome.variantQueries().entrySet()) {
        byVariant
            .computeIfAbsent(entry.getKey(), k -> new TreeMap<>())
            .put(outcome.edge().id(), entry.getValue());
      }
    }
    if (byNode.isEmpty()) {
      return nodes;
    }
    List<Node> updated = new ArrayList<>(nodes.size());
    for (Node node : nodes) {
      Map<String, Map<String, String>> byVariant = byNode.get(node.id());
      if (byVariant == null || !node.isCase()) {
        updated.add(node);
        continue;
      }
      List<CaseVariant> variants = new ArrayList<>();
      for (CaseVariant variant : node.caseDefinition().variants()) {
        Map<String, String> merged = new TreeMap<>(variant.queries());
        merged.putAll(byVariant.getOrDefault(variant.name(), Map.of()));
        variants.add(variant.withQueries(merged));
      }
      updated.add(node.withCaseDefinition(node.caseDefinition().withVariants(variants)));
    }
    return updated;
  }

  /** Node ids whose outgoing edges are in scope, or null when every edge is. */
  private static Set<String> scope(GraphView view, BatchOptions options) {
    if (options.downstreamOf() == null) {
      return null;
    }
    String start = view.requireCanonical(options.downstreamOf());
    Set<String> reached = new LinkedHashSet<>();
    Deque<String> frontier = new ArrayDeque<>();
    frontier.add(start);
    reached.add(start);
    while (!frontier.isEmpty()) {
      for (String next : view.successors(frontier.poll())) {
        if (reached.add(next)) {
          frontier.add(next);
        }
      }
    }
    return reached;
  }

  private static boolean inScope(GraphView view, Edge edge, Set<String> scope) {
    return view.edge(edge.id()).map(endpoints -> scope.contains(endpoints.from())).orElse(false);
  }

  /** Compiles the slots of one edge, collecting successes and failures. */
  private static final class SlotCompiler {
    private final GraphView view;
    private final EdgeQueryCompiler compiler;
    private final Edge edge;
    private final EdgeDataSources sources;
    private final LiteralWeights weights;
    private final List<SlotQuery> queries = new ArrayList<>();
    private final List<SlotFailure> failures = new ArrayList<>();

    SlotCompiler(
        GraphView view,
        EdgeQueryCompiler compiler,
        Edge edge,
        EdgeDataSources sources,
        LiteralWeights weights) {
      this.view = view;
      this.compiler = compiler;
      this.edge = edge;
      this.sources = sources;
      this.weights = weights;
    }

    Parameter compileText(SlotRef slot, Parameter parameter, String conditionText) {
      try {
        CompiledQuery compiled =
            compiler.compile(view, edge.id(), conditionText, sources, weights);
        record(slot, parameter, conditionText, compiled);
        return parameter.withQuery(compiled.query());
      } catch (QueryCompilationException ex) {
        fail(slot, ex);
        return parameter;
      }
    }

    Parameter compile(
        SlotRef slot, Parameter parameter, Condition condition, String conditionText) {
      String compiled = compileQuery(slot, parameter, condition, conditionText);
      return compiled == null ? parameter : parameter.withQuery(compiled);
    }

    String compileQuery(SlotRef slot, Condition condition, String prior) {
      String compiled = compileQuery(slot, Parameter.empty(), condition, "");
      return compiled == null ? prior : compiled;
    }

    private String compileQuery(
        SlotRef slot, Parameter parameter, Condition condition, String conditionText) {
      try {
        CompiledQuery compiled = compiler.compile(view, edge.id(), condition, sources, weights);
        String text =
            conditionText.isEmpty() ? QuerySerializer.serialize(condition) : conditionText;
        record(slot, parameter, text, compiled);
        return compiled.query();
      } catch (QueryCompilationException ex) {
        fail(slot, ex);
        return null;
      }
    }

    private void record(
        SlotRef slot, Parameter parameter, String conditionText, CompiledQuery compiled) {
      String parameterId =
          parameter.id() != null && !parameter.id().isBlank()
              ? parameter.id()
              : "synthetic:" + edge.id() + ":" + slot.label();
      queries.add(
          new SlotQuery(edge.id(), edge.key(), slot, parameterId, conditionText, compiled));
    }

    private void fail(SlotRef slot, QueryCompilationException ex) {
      LOG.warn("Edge {} slot {} failed: {}", edge.id(), slot.label(), ex.getMessage());
      failures.add(
          new SlotFailure(edge.id(), slot, ex.getClass().getSimpleName(), ex.getMessage()));
    }
  }

  private record EdgeOutcome(
      Edge edge,
      List<SlotQuery> queries,
      List<SlotFailure> failures,
      String caseNodeId,
      Map<String, String> variantQueries) {}
}
