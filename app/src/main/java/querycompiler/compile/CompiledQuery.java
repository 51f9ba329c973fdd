package querycompiler.compile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import querycompiler.capability.EdgeCapability;
import querycompiler.dsl.Condition;

/**
 * Result of compiling one edge query.
 *
 * @param query canonical DSL string, persisted verbatim by consumers
 * @param condition parsed form of {@code query}
 * @param terms sub-fetches the query expands to; a single +1 term when nothing was expanded
 * @param capability edge capability verdict the compilation was based on
 * @param checks reachability checks spent
 * @param capped true when the check budget ran out and the expansion may be incomplete
 * @param satisfiable false when no journey satisfies the condition
 * @param warnings human-readable notes, such as terms exceeding the provider's path length
 */
public record CompiledQuery(
    String query,
    Condition condition,
    List<QueryTerm> terms,
    EdgeCapability capability,
    int checks,
    boolean capped,
    boolean satisfiable,
    List<String> warnings) {

  public CompiledQuery {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(condition, "condition");
    Objects.requireNonNull(capability, "capability");
    terms = terms == null ? List.of() : List.copyOf(terms);
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public CompiledQuery withCapability(EdgeCapability updated) {
    return new CompiledQuery(
        query, condition, terms, updated, checks, capped, satisfiable, warnings);
  }

  public CompiledQuery withChecks(int updatedChecks, boolean updatedCapped) {
    return new CompiledQuery(
        query, condition, terms, capability, updatedChecks, updatedCapped, satisfiable, warnings);
  }

  public CompiledQuery withSatisfiable(boolean updated) {
    return new CompiledQuery(
        query, condition, terms, capability, checks, capped, updated, warnings);
  }

  public CompiledQuery withWarning(String warning) {
    List<String> updated = new ArrayList<>(warnings);
    updated.add(warning);
    return new CompiledQuery(
        query, condition, terms, capability, checks, capped, satisfiable, updated);
  }

  public boolean expanded() {
    return terms.size() > 1;
  }
}
