package querycompiler.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A transition between two nodes with its parameter slots: base probability, conditional
 * probabilities and named cost dimensions ({@code cost_gbp}, {@code cost_time}, ...).
 */
public record Edge(
    String id,
    String from,
    String to,
    Parameter probability,
    List<ConditionalProbability> conditionalProbabilities,
    SortedMap<String, Parameter> costs) {

  public Edge {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    probability = probability == null ? Parameter.empty() : probability;
    conditionalProbabilities =
        conditionalProbabilities == null ? List.of() : List.copyOf(conditionalProbabilities);
    costs =
        costs == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(costs));
  }

  public static Edge between(String id, String from, String to) {
    return new Edge(id, from, to, null, null, null);
  }

  public Edge withProbability(Parameter updated) {
    return new Edge(id, from, to, updated, conditionalProbabilities, costs);
  }

  public Edge withConditionalProbabilities(List<ConditionalProbability> updated) {
    return new Edge(id, from, to, probability, updated, costs);
  }

  public Edge withCosts(SortedMap<String, Parameter> updated) {
    return new Edge(id, from, to, probability, conditionalProbabilities, updated);
  }

  /** Display key used in reports. */
  public String key() {
    return from + "->" + to;
  }
}
