package querycompiler.pipeline;

import querycompiler.core.CompilerOptions;
import querycompiler.core.LiteralWeights;

/**
 * Configuration for a whole-graph compilation pass.
 *
 * @param downstreamOf when set, only edges leaving this node or its descendants are compiled
 * @param edgeId when set, only this edge is compiled
 * @param parallelism number of worker threads; 1 compiles on the calling thread
 */
public record BatchOptions(
    CompilerOptions compilerOptions,
    LiteralWeights weights,
    String downstreamOf,
    String edgeId,
    int parallelism) {

  public static BatchOptions defaults() {
    return new BatchOptions(CompilerOptions.defaults(), LiteralWeights.defaults(), null, null, 1);
  }

  public static BatchOptions normalize(BatchOptions options) {
    if (options == null) {
      return defaults();
    }
    CompilerOptions compilerOptions = CompilerOptions.normalize(options.compilerOptions());
    LiteralWeights weights =
        options.weights() != null ? options.weights() : LiteralWeights.defaults();
    String downstreamOf = blankToNull(options.downstreamOf());
    String edgeId = blankToNull(options.edgeId());
    int parallelism = Math.max(1, options.parallelism());
    return new BatchOptions(compilerOptions, weights, downstreamOf, edgeId, parallelism);
  }

  public BatchOptions withDownstreamOf(String node) {
    return new BatchOptions(compilerOptions, weights, node, edgeId, parallelism);
  }

  public BatchOptions withEdgeId(String id) {
    return new BatchOptions(compilerOptions, weights, downstreamOf, id, parallelism);
  }

  public BatchOptions withParallelism(int threads) {
    return new BatchOptions(compilerOptions, weights, downstreamOf, edgeId, threads);
  }

  public BatchOptions withWeights(LiteralWeights updated) {
    return new BatchOptions(compilerOptions, updated, downstreamOf, edgeId, parallelism);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
