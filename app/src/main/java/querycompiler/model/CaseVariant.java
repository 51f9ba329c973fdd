package querycompiler.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/** One variant of an experiment node, with the compiled query per outgoing edge id. */
public record CaseVariant(String name, SortedMap<String, String> queries) {

  public CaseVariant {
    Objects.requireNonNull(name, "name");
    queries =
        queries == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(queries));
  }

  public static CaseVariant named(String name) {
    return new CaseVariant(name, null);
  }

  public CaseVariant withQueries(Map<String, String> updated) {
    return new CaseVariant(name, new TreeMap<>(updated));
  }
}
