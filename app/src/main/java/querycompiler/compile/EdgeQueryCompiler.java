package querycompiler.compile;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.SortedSet;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import querycompiler.capability.CapabilityAwareRewriter;
import querycompiler.capability.CapabilityTable;
import querycompiler.capability.EdgeCapability;
import querycompiler.capability.EdgeDataSources;
import querycompiler.core.CompilerOptions;
import querycompiler.core.LiteralWeights;
import querycompiler.dsl.Condition;
import querycompiler.dsl.QueryParser;
import querycompiler.dsl.QuerySerializer;
import querycompiler.graph.EdgeEndpoints;
import querycompiler.graph.GraphView;
import querycompiler.graph.InvalidConditionException;
import querycompiler.reach.CheckBudget;
import querycompiler.reach.ConstraintCombination;
import querycompiler.reach.ReachabilityAnalyzer;
import querycompiler.route.CompetingPathDetector;

/**
 * Compiles the condition of one edge slot into a provider-correct query string.
 *
 * <p>The condition is anchored on the edge endpoints and validated against the graph. Slots
 * without path literals exclude the competing routes into {@code to}. Edges whose sources all
 * support native exclude keep {@code exclude(...)} (after the cheaper dual rewrite, if any);
 * other edges are expanded into {@code minus(...)}/{@code plus(...)} terms.
 */
public final class EdgeQueryCompiler {
  private static final Logger LOG = LoggerFactory.getLogger(EdgeQueryCompiler.class);

  private final CapabilityTable capabilities;
  private final CompilerOptions options;

  public EdgeQueryCompiler(CapabilityTable capabilities, CompilerOptions options) {
    this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
    this.options = CompilerOptions.normalize(options);
  }

  public CompiledQuery compile(
      GraphView view,
      String edgeId,
      String condition,
      EdgeDataSources sources,
      LiteralWeights weights) {
    Condition parsed =
        condition == null || condition.isBlank() ? Condition.empty() : QueryParser.parse(condition);
    return compile(view, edgeId, parsed, sources, weights);
  }

  public CompiledQuery compile(
      GraphView view,
      String edgeId,
      Condition condition,
      EdgeDataSources sources,
      LiteralWeights weights) {
    Objects.requireNonNull(view, "view");
    Objects.requireNonNull(condition, "condition");
    EdgeEndpoints endpoints =
        view.edge(edgeId)
            .orElseThrow(() -> new InvalidConditionException("Unknown edge: " + edgeId));
    Condition anchored = anchor(view, endpoints, condition);

    CheckBudget budget = CheckBudget.of(options.maxChecks());
    if (options.siblingExclusion() && !anchored.hasPathLiterals()) {
      List<String> siblings =
          CompetingPathDetector.siblingRoutes(view, anchored.from(), anchored.to(), budget);
      anchored = anchored.toBuilder().exclude(siblings).build();
    }

    EdgeCapability verdict =
        CapabilityAwareRewriter.edgeCapability(
            sources == null ? EdgeDataSources.none() : sources, capabilities);
    LiteralWeights effective = verdict.effectiveWeights(weights);

    boolean reachable =
        ReachabilityAnalyzer.isReachable(
            view,
            anchored.from(),
            anchored.to(),
            new ConstraintCombination(
                anchored.visited(), anchored.exclude(), anchored.visitedAny()),
            budget);
    // An exhausted budget leaves satisfiability unknown; only the capped flag reports it.
    boolean satisfiable = reachable || budget.capped();

    CompiledQuery compiled;
    if (verdict.nativeExclude()) {
      Condition rewritten = DualRewriter.rewrite(view, anchored, effective, budget);
      String query = QuerySerializer.serialize(rewritten);
      compiled =
          new CompiledQuery(
              query,
              rewritten,
              List.of(new QueryTerm(1, rewritten.visited(), query)),
              verdict,
              budget.used(),
              budget.capped(),
              satisfiable,
              List.of());
    } else {
      compiled =
          InclusionExclusionCompiler.compileExclusion(view, anchored, effective, budget)
              .withCapability(verdict)
              .withChecks(budget.used(), budget.capped())
              .withSatisfiable(satisfiable);
    }

    if (!satisfiable) {
      compiled =
          compiled.withWarning("No journey satisfies " + QuerySerializer.serialize(anchored));
    }
    compiled = checkPathLength(compiled, verdict);
    if (compiled.capped()) {
      LOG.warn(
          "Edge {} compiled with a capped search after {} checks: {}",
          edgeId,
          compiled.checks(),
          compiled.query());
    }
    LOG.debug("Edge {}: {} -> {}", edgeId, condition, compiled.query());
    return compiled;
  }

  private static Condition anchor(GraphView view, EdgeEndpoints endpoints, Condition condition) {
    String from = endpoints.from();
    String to = endpoints.to();
    if (condition.from() != null && !view.requireCanonical(condition.from()).equals(from)) {
      throw new InvalidConditionException(
          "Condition from(" + condition.from() + ") does not match edge source " + from);
    }
    if (condition.to() != null && !view.requireCanonical(condition.to()).equals(to)) {
      throw new InvalidConditionException(
          "Condition to(" + condition.to() + ") does not match edge target " + to);
    }
    Condition.Builder builder =
        Condition.builder()
            .from(from)
            .to(to)
            .visited(canonical(view, condition.visited()))
            .exclude(canonical(view, condition.exclude()))
            .context(condition.context())
            .dateRange(condition.dateRange())
            .caseFilter(condition.caseFilter());
    for (SortedSet<String> group : condition.visitedAny()) {
      builder.visitedAny(canonical(view, group));
    }
    Condition anchored = builder.build();
    if (anchored.exclude().contains(from) || anchored.exclude().contains(to)) {
      throw new InvalidConditionException(
          "Condition excludes an endpoint of " + from + "->" + to + ": " + anchored);
    }
    return anchored;
  }

  private static List<String> canonical(GraphView view, SortedSet<String> ids) {
    List<String> resolved = new ArrayList<>(ids.size());
    for (String id : ids) {
      resolved.add(view.requireCanonical(id));
    }
    return resolved;
  }

  private static CompiledQuery checkPathLength(CompiledQuery compiled, EdgeCapability verdict) {
    OptionalInt limit = verdict.maxPathLengthLimit();
    if (limit.isEmpty()) {
      return compiled;
    }
    Map<String, Integer> tooLong = new TreeMap<>();
    int anyGroups = compiled.condition().visitedAny().size();
    for (QueryTerm term : compiled.terms()) {
      int length = 2 + term.visited().size() + anyGroups;
      if (length > limit.getAsInt()) {
        tooLong.put(term.query(), length);
      }
    }
    CompiledQuery result = compiled;
    for (Map.Entry<String, Integer> entry : tooLong.entrySet()) {
      result =
          result.withWarning(
              "Funnel length "
                  + entry.getValue()
                  + " exceeds provider limit "
                  + limit.getAsInt()
                  + ": "
                  + entry.getKey());
    }
    return result;
  }
}
