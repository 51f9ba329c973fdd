package querycompiler.cli;

import java.nio.file.Path;
import querycompiler.core.CompilerOptions;
import querycompiler.core.LiteralWeights;
import querycompiler.model.DataSource;
import querycompiler.pipeline.BatchOptions;

record CliOptions(
    Path graphPath,
    Path capabilitiesPath,
    Path outputPath,
    Path reportPath,
    LiteralWeights weights,
    int maxChecks,
    boolean siblingExclusion,
    String downstreamOf,
    String edgeId,
    int parallelism,
    String condition,
    DataSource dataSource) {

  CliOptions {
    weights = weights == null ? LiteralWeights.defaults() : weights;
    if (maxChecks < 1) {
      throw new IllegalArgumentException("--max-checks must be at least 1");
    }
    if (parallelism < 1) {
      throw new IllegalArgumentException("--parallelism must be at least 1");
    }
  }

  boolean hasGraph() {
    return graphPath != null;
  }

  CompilerOptions compilerOptions() {
    return new CompilerOptions(maxChecks, siblingExclusion);
  }

  BatchOptions batchOptions() {
    return new BatchOptions(compilerOptions(), weights, downstreamOf, edgeId, parallelism);
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private Path graphPath;
    private Path capabilitiesPath;
    private Path outputPath;
    private Path reportPath;
    private LiteralWeights weights = LiteralWeights.defaults();
    private int maxChecks = CompilerOptions.DEFAULT_MAX_CHECKS;
    private boolean siblingExclusion = true;
    private String downstreamOf;
    private String edgeId;
    private int parallelism = 1;
    private String condition;
    private String connectionName;
    private String provider;

    Builder graphPath(Path value) {
      this.graphPath = value;
      return this;
    }

    Builder capabilitiesPath(Path value) {
      this.capabilitiesPath = value;
      return this;
    }

    Builder outputPath(Path value) {
      this.outputPath = value;
      return this;
    }

    Builder reportPath(Path value) {
      this.reportPath = value;
      return this;
    }

    Builder weights(LiteralWeights value) {
      this.weights = value;
      return this;
    }

    Builder maxChecks(int value) {
      this.maxChecks = value;
      return this;
    }

    Builder siblingExclusion(boolean value) {
      this.siblingExclusion = value;
      return this;
    }

    Builder downstreamOf(String value) {
      this.downstreamOf = value;
      return this;
    }

    Builder edgeId(String value) {
      this.edgeId = value;
      return this;
    }

    Builder parallelism(int value) {
      this.parallelism = value;
      return this;
    }

    Builder condition(String value) {
      this.condition = value;
      return this;
    }

    Builder connectionName(String value) {
      this.connectionName = value;
      return this;
    }

    Builder provider(String value) {
      this.provider = value;
      return this;
    }

    CliOptions build() {
      DataSource dataSource =
          connectionName == null && provider == null
              ? null
              : new DataSource(connectionName, provider);
      return new CliOptions(
          graphPath,
          capabilitiesPath,
          outputPath,
          reportPath,
          weights,
          maxChecks,
          siblingExclusion,
          downstreamOf,
          edgeId,
          parallelism,
          condition,
          dataSource);
    }
  }
}
