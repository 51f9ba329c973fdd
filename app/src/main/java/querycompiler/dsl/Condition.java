package querycompiler.dsl;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Parsed form of a query DSL string. Node collections are sorted so that two conditions with the
 * same meaning compare equal and serialize identically.
 *
 * @param from source node of the journey, or {@code null}
 * @param to target node of the journey, or {@code null}
 * @param visited nodes that must all be on the journey
 * @param visitedAny groups of which at least one node each must be on the journey
 * @param exclude nodes that must not be on the journey
 * @param context context key/value filters
 * @param dateRange window or cohort bounds, or {@code null}
 * @param caseFilter case variant filter, or {@code null}
 * @param minus sub-queries subtracted from the base query
 * @param plus sub-queries added back to the base query
 */
public record Condition(
    String from,
    String to,
    SortedSet<String> visited,
    List<SortedSet<String>> visitedAny,
    SortedSet<String> exclude,
    SortedMap<String, String> context,
    DateRange dateRange,
    CaseFilter caseFilter,
    List<SortedSet<String>> minus,
    List<SortedSet<String>> plus) {

  private static final Condition EMPTY = builder().build();

  public Condition {
    visited = NodeSets.freeze(visited);
    visitedAny = NodeSets.freezeGroups(visitedAny);
    exclude = NodeSets.freeze(exclude);
    context = NodeSets.freezeMap(context);
    minus = NodeSets.freezeGroups(minus);
    plus = NodeSets.freezeGroups(plus);
  }

  public static Condition empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .from(from)
        .to(to)
        .visited(visited)
        .visitedAnyGroups(visitedAny)
        .exclude(exclude)
        .context(context)
        .dateRange(dateRange)
        .caseFilter(caseFilter)
        .minusGroups(minus)
        .plusGroups(plus);
  }

  /** True when the condition constrains which nodes the journey passes through. */
  public boolean hasPathLiterals() {
    return !visited.isEmpty() || !visitedAny.isEmpty() || !exclude.isEmpty();
  }

  public boolean hasEndpoints() {
    return from != null && to != null;
  }

  @Override
  public String toString() {
    return QuerySerializer.serialize(this);
  }

  /** Mutable accumulator used by the parser and by the compilers. */
  public static final class Builder {
    private String from;
    private String to;
    private final TreeSet<String> visited = new TreeSet<>();
    private final List<SortedSet<String>> visitedAny = new ArrayList<>();
    private final TreeSet<String> exclude = new TreeSet<>();
    private final TreeMap<String, String> context = new TreeMap<>();
    private DateRange dateRange;
    private CaseFilter caseFilter;
    private final List<SortedSet<String>> minus = new ArrayList<>();
    private final List<SortedSet<String>> plus = new ArrayList<>();

    private Builder() {}

    public Builder from(String from) {
      this.from = from;
      return this;
    }

    public Builder to(String to) {
      this.to = to;
      return this;
    }

    public Builder visited(Collection<String> ids) {
      visited.addAll(ids);
      return this;
    }

    public Builder clearVisited() {
      visited.clear();
      return this;
    }

    public Builder visitedAny(Collection<String> group) {
      visitedAny.add(NodeSets.freeze(group));
      return this;
    }

    public Builder visitedAnyGroups(Collection<? extends Collection<String>> groups) {
      groups.forEach(this::visitedAny);
      return this;
    }

    public Builder exclude(Collection<String> ids) {
      exclude.addAll(ids);
      return this;
    }

    public Builder clearExclude() {
      exclude.clear();
      return this;
    }

    public Builder context(String key, String value) {
      context.put(key, value);
      return this;
    }

    public Builder context(Map<String, String> values) {
      context.putAll(values);
      return this;
    }

    public Builder dateRange(DateRange dateRange) {
      this.dateRange = dateRange;
      return this;
    }

    public Builder caseFilter(CaseFilter caseFilter) {
      this.caseFilter = caseFilter;
      return this;
    }

    public Builder minus(Collection<String> group) {
      minus.add(NodeSets.freeze(group));
      return this;
    }

    public Builder minusGroups(Collection<? extends Collection<String>> groups) {
      groups.forEach(this::minus);
      return this;
    }

    public Builder plus(Collection<String> group) {
      plus.add(NodeSets.freeze(group));
      return this;
    }

    public Builder plusGroups(Collection<? extends Collection<String>> groups) {
      groups.forEach(this::plus);
      return this;
    }

    public Builder clearTerms() {
      minus.clear();
      plus.clear();
      return this;
    }

    String currentFrom() {
      return from;
    }

    String currentTo() {
      return to;
    }

    Map<String, String> currentContext() {
      return context;
    }

    DateRange currentDateRange() {
      return dateRange;
    }

    CaseFilter currentCaseFilter() {
      return caseFilter;
    }

    public Condition build() {
      return new Condition(
          from, to, visited, visitedAny, exclude, context, dateRange, caseFilter, minus, plus);
    }
  }
}
