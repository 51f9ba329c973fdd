package querycompiler.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import querycompiler.capability.CapabilityTable;
import querycompiler.capability.EdgeDataSources;
import querycompiler.cli.CliParsers.OptionSpec;
import querycompiler.compile.CompiledQuery;
import querycompiler.compile.EdgeQueryCompiler;
import querycompiler.compile.QueryTerm;
import querycompiler.core.CompilerOptions;
import querycompiler.dsl.QueryParser;
import querycompiler.dsl.QuerySerializer;
import querycompiler.graph.DagView;
import querycompiler.io.GraphJson;
import querycompiler.model.Edge;
import querycompiler.model.Graph;

/**
 * Handles the {@code query} command. Without {@code --graph} it prints the canonical form of
 * {@code --condition}; with a graph it compiles the condition for {@code --edge}.
 */
final class QueryCommand {

  int execute(String[] args) throws IOException {
    CliOptions options = CliParsers.parse(args, "query", optionSpecs());
    if (!options.hasGraph()) {
      if (options.condition() == null) {
        throw new IllegalArgumentException("query requires --condition or --graph/--edge");
      }
      System.out.println(QuerySerializer.serialize(QueryParser.parse(options.condition())));
      return 0;
    }
    if (options.edgeId() == null) {
      throw new IllegalArgumentException("query with --graph requires --edge <id>");
    }
    Graph graph = GraphJson.read(options.graphPath());
    Edge edge =
        graph
            .edge(options.edgeId())
            .orElseThrow(
                () -> new IllegalArgumentException("Unknown edge: " + options.edgeId()));
    EdgeDataSources sources =
        options.dataSource() != null
            ? EdgeDataSources.of(options.dataSource())
            : EdgeDataSources.of(edge);
    CapabilityTable capabilities = CliParsers.loadCapabilities(options.capabilitiesPath());

    EdgeQueryCompiler compiler = new EdgeQueryCompiler(capabilities, options.compilerOptions());
    CompiledQuery compiled =
        compiler.compile(
            DagView.of(graph), edge.id(), options.condition(), sources, options.weights());

    System.out.println(compiled.query());
    if (compiled.expanded()) {
      for (QueryTerm term : compiled.terms()) {
        System.out.printf("  %s %s%n", term.coefficient() > 0 ? "+" : "-", term.query());
      }
    }
    System.out.printf(
        "native_exclude=%s degraded=%s checks=%d capped=%s%n",
        compiled.capability().nativeExclude(),
        compiled.capability().degraded(),
        compiled.checks(),
        compiled.capped());
    compiled.warnings().forEach(warning -> System.out.println("warning: " + warning));
    return 0;
  }

  private Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--graph", OptionSpec.withValue((b, raw) -> b.graphPath(Path.of(raw))));
    specs.put("--edge", OptionSpec.withValue(CliOptions.Builder::edgeId));
    specs.put("--condition", OptionSpec.withValue(CliOptions.Builder::condition));
    specs.put("--connection", OptionSpec.withValue(CliOptions.Builder::connectionName));
    specs.put("--provider", OptionSpec.withValue(CliOptions.Builder::provider));
    specs.put(
        "--capabilities", OptionSpec.withValue((b, raw) -> b.capabilitiesPath(Path.of(raw))));
    specs.put(
        "--weights", OptionSpec.withValue((b, raw) -> b.weights(CliParsers.parseWeights(raw))));
    specs.put(
        "--max-checks",
        OptionSpec.withValue(
            (b, raw) ->
                b.maxChecks(
                    CliParsers.parseInt(
                        raw, CompilerOptions.DEFAULT_MAX_CHECKS, "--max-checks"))));
    specs.put("--no-sibling-exclusion", OptionSpec.flag(b -> b.siblingExclusion(false)));
    return specs;
  }
}
