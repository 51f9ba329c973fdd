package querycompiler.cli;

import com.google.gson.JsonObject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import querycompiler.capability.CapabilityTable;
import querycompiler.cli.CliParsers.OptionSpec;
import querycompiler.core.CompilerOptions;
import querycompiler.io.GraphJson;
import querycompiler.model.Graph;
import querycompiler.pipeline.BatchOrchestrator;
import querycompiler.pipeline.BatchResult;
import querycompiler.pipeline.SlotFailure;

/** Handles the {@code compile} command: compiles every slot of a graph file. */
final class CompileCommand {
  private static final Logger LOG = LoggerFactory.getLogger(CompileCommand.class);

  int execute(String[] args) throws IOException {
    CliOptions options = CliParsers.parse(args, "compile", optionSpecs());
    if (!options.hasGraph()) {
      throw new IllegalArgumentException("compile requires --graph <file>");
    }
    JsonObject original = GraphJson.readTree(options.graphPath());
    Graph graph = GraphJson.fromJson(original);
    CapabilityTable capabilities = CliParsers.loadCapabilities(options.capabilitiesPath());

    BatchResult result = BatchOrchestrator.compileAll(graph, capabilities, options.batchOptions());
    JsonObject compiled = GraphJson.apply(original, result.graph());

    if (options.outputPath() != null) {
      GraphJson.write(options.outputPath(), compiled);
      LOG.info("Wrote compiled graph to {}", options.outputPath());
    } else {
      System.out.println(GraphJson.toPrettyString(compiled));
    }
    if (options.reportPath() != null) {
      writeReport(options.reportPath(), new JsonReportBuilder().build(result));
    }
    for (SlotFailure failure : result.failures()) {
      LOG.warn(
          "{} [{}] {}: {}",
          failure.edgeId(),
          failure.slot().label(),
          failure.errorType(),
          failure.message());
    }
    return result.failures().isEmpty() ? 0 : 2;
  }

  private void writeReport(Path path, String json) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(path, json, StandardCharsets.UTF_8);
    LOG.info("Wrote report to {}", path);
  }

  private Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--graph", OptionSpec.withValue((b, raw) -> b.graphPath(Path.of(raw))));
    specs.put(
        "--capabilities", OptionSpec.withValue((b, raw) -> b.capabilitiesPath(Path.of(raw))));
    specs.put("--out", OptionSpec.withValue((b, raw) -> b.outputPath(Path.of(raw))));
    specs.put("--report", OptionSpec.withValue((b, raw) -> b.reportPath(Path.of(raw))));
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
    specs.put("--downstream-of", OptionSpec.withValue(CliOptions.Builder::downstreamOf));
    specs.put("--edge", OptionSpec.withValue(CliOptions.Builder::edgeId));
    specs.put(
        "--parallelism",
        OptionSpec.withValue(
            (b, raw) -> b.parallelism(CliParsers.parseInt(raw, 1, "--parallelism"))));
    return specs;
  }
}
