package querycompiler.capability;

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import querycompiler.model.ConditionalProbability;
import querycompiler.model.DataSource;
import querycompiler.model.Edge;
import querycompiler.model.Parameter;

/** Distinct data sources referenced by any slot of one edge, sorted. */
public record EdgeDataSources(List<DataSource> sources) {

  public EdgeDataSources {
    sources = sources == null ? List.of() : List.copyOf(new TreeSet<>(sources));
  }

  public static EdgeDataSources none() {
    return new EdgeDataSources(List.of());
  }

  public static EdgeDataSources of(DataSource... sources) {
    return new EdgeDataSources(List.of(sources));
  }

  /** Collects the sources of the base probability, every conditional probability and each cost. */
  public static EdgeDataSources of(Edge edge) {
    Objects.requireNonNull(edge, "edge");
    TreeSet<DataSource> sources = new TreeSet<>();
    add(sources, edge.probability());
    for (ConditionalProbability conditional : edge.conditionalProbabilities()) {
      add(sources, conditional.probability());
    }
    edge.costs().values().forEach(cost -> add(sources, cost));
    return new EdgeDataSources(List.copyOf(sources));
  }

  private static void add(TreeSet<DataSource> sources, Parameter parameter) {
    if (parameter != null && parameter.hasDataSource()) {
      sources.add(parameter.dataSource());
    }
  }

  public boolean isEmpty() {
    return sources.isEmpty();
  }
}
