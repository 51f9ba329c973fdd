package querycompiler.dsl;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/** Helpers for the immutable, sorted node-id collections used throughout the AST. */
public final class NodeSets {

  /** Orders node sets by size, then element-wise lexicographically. */
  public static final Comparator<SortedSet<String>> CANONICAL_ORDER = NodeSets::compare;

  private NodeSets() {}

  public static SortedSet<String> freeze(Collection<String> ids) {
    if (ids == null || ids.isEmpty()) {
      return Collections.emptySortedSet();
    }
    return Collections.unmodifiableSortedSet(new TreeSet<>(ids));
  }

  public static SortedSet<String> of(String... ids) {
    return freeze(List.of(ids));
  }

  /** Freezes every group, drops empty groups and duplicates, and sorts canonically. */
  public static List<SortedSet<String>> freezeGroups(
      Collection<? extends Collection<String>> groups) {
    if (groups == null || groups.isEmpty()) {
      return List.of();
    }
    TreeSet<SortedSet<String>> unique = new TreeSet<>(CANONICAL_ORDER);
    for (Collection<String> group : groups) {
      if (group != null && !group.isEmpty()) {
        unique.add(freeze(group));
      }
    }
    return List.copyOf(new ArrayList<>(unique));
  }

  public static SortedMap<String, String> freezeMap(Map<String, String> map) {
    if (map == null || map.isEmpty()) {
      return Collections.emptySortedMap();
    }
    return Collections.unmodifiableSortedMap(new TreeMap<>(map));
  }

  public static SortedSet<String> union(Collection<String> left, Collection<String> right) {
    TreeSet<String> merged = new TreeSet<>(left);
    merged.addAll(right);
    return Collections.unmodifiableSortedSet(merged);
  }

  public static SortedSet<String> difference(Collection<String> left, Collection<String> right) {
    TreeSet<String> remaining = new TreeSet<>(left);
    remaining.removeAll(right);
    return Collections.unmodifiableSortedSet(remaining);
  }

  private static int compare(SortedSet<String> left, SortedSet<String> right) {
    int bySize = Integer.compare(left.size(), right.size());
    if (bySize != 0) {
      return bySize;
    }
    Iterator<String> l = left.iterator();
    Iterator<String> r = right.iterator();
    while (l.hasNext()) {
      int cmp = l.next().compareTo(r.next());
      if (cmp != 0) {
        return cmp;
      }
    }
    return 0;
  }
}
