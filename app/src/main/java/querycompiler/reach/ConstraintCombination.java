package querycompiler.reach;

import java.util.Collection;
import java.util.List;
import java.util.SortedSet;
import querycompiler.dsl.NodeSets;

/**
 * Path constraint tested by the analyzer: every {@code required} node, at least one node of each
 * {@code anyOf} group, and none of the {@code avoided} nodes.
 */
public record ConstraintCombination(
    SortedSet<String> required, SortedSet<String> avoided, List<SortedSet<String>> anyOf) {

  public ConstraintCombination {
    required = NodeSets.freeze(required);
    avoided = NodeSets.freeze(avoided);
    anyOf = NodeSets.freezeGroups(anyOf);
  }

  public static ConstraintCombination requiring(Collection<String> required) {
    return new ConstraintCombination(NodeSets.freeze(required), null, null);
  }

  public ConstraintCombination withAnyOf(List<SortedSet<String>> groups) {
    return new ConstraintCombination(required, avoided, groups);
  }

  public ConstraintCombination withAvoided(Collection<String> nodes) {
    return new ConstraintCombination(required, NodeSets.freeze(nodes), anyOf);
  }
}
