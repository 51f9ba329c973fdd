package querycompiler.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import querycompiler.model.Graph;

/** Outcome of a compilation pass: the rewritten graph plus per-slot detail. */
public record BatchResult(
    Graph graph,
    List<SlotQuery> queries,
    List<SlotFailure> failures,
    long elapsedMillis,
    Map<String, Long> phaseMillis) {

  public BatchResult {
    Objects.requireNonNull(graph, "graph");
    queries = queries == null ? List.of() : List.copyOf(queries);
    failures = failures == null ? List.of() : List.copyOf(failures);
    phaseMillis =
        phaseMillis == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(phaseMillis));
  }

  public long cappedCount() {
    return queries.stream().filter(query -> query.compiled().capped()).count();
  }

  public long degradedCount() {
    return queries.stream().filter(query -> query.compiled().capability().degraded()).count();
  }

  public long expandedCount() {
    return queries.stream().filter(query -> query.compiled().expanded()).count();
  }
}
