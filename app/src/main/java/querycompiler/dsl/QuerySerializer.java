package querycompiler.dsl;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;

/** Emits the canonical DSL text for a {@link Condition}. */
public final class QuerySerializer {

  private QuerySerializer() {}

  public static String serialize(Condition condition) {
    Objects.requireNonNull(condition, "condition");
    StringBuilder out = new StringBuilder();
    if (condition.from() != null) {
      append(out, QueryFunction.FROM.dslName(), condition.from());
    }
    if (condition.to() != null) {
      append(out, QueryFunction.TO.dslName(), condition.to());
    }
    if (!condition.visited().isEmpty()) {
      append(out, QueryFunction.VISITED.dslName(), join(condition.visited()));
    }
    for (SortedSet<String> group : condition.visitedAny()) {
      append(out, QueryFunction.VISITED_ANY.dslName(), join(group));
    }
    if (!condition.exclude().isEmpty()) {
      append(out, QueryFunction.EXCLUDE.dslName(), join(condition.exclude()));
    }
    if (!condition.context().isEmpty()) {
      StringBuilder pairs = new StringBuilder();
      for (Map.Entry<String, String> entry : condition.context().entrySet()) {
        if (pairs.length() > 0) {
          pairs.append(',');
        }
        pairs.append(entry.getKey()).append('=').append(entry.getValue());
      }
      append(out, QueryFunction.CONTEXT.dslName(), pairs.toString());
    }
    DateRange range = condition.dateRange();
    if (range != null) {
      append(out, range.mode().dslName(), range.start() + ":" + range.end());
    }
    CaseFilter caseFilter = condition.caseFilter();
    if (caseFilter != null) {
      append(out, QueryFunction.CASE.dslName(), caseFilter.caseId() + ":" + caseFilter.variant());
    }
    for (SortedSet<String> group : condition.minus()) {
      append(out, QueryFunction.MINUS.dslName(), join(group));
    }
    for (SortedSet<String> group : condition.plus()) {
      append(out, QueryFunction.PLUS.dslName(), join(group));
    }
    return out.toString();
  }

  private static void append(StringBuilder out, String name, String args) {
    if (out.length() > 0) {
      out.append('.');
    }
    out.append(name).append('(').append(args).append(')');
  }

  private static String join(Collection<String> ids) {
    return String.join(",", ids);
  }
}
