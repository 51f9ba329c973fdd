package querycompiler.graph;

import java.util.List;
import java.util.Optional;

/**
 * Read-only adjacency view over an acyclic funnel graph. All node ids returned are canonical ids;
 * neighbour lists are sorted.
 */
public interface GraphView {

  /** Node ids in topological order. */
  List<String> nodeIds();

  boolean contains(String nodeId);

  /** Resolves a node id or uuid to the canonical id. */
  Optional<String> canonicalId(String idOrUuid);

  List<String> successors(String nodeId);

  List<String> predecessors(String nodeId);

  boolean hasEdge(String from, String to);

  /** Position of the node in {@link #nodeIds()}; -1 when absent. */
  int topologicalIndex(String nodeId);

  Optional<EdgeEndpoints> edge(String edgeId);

  default boolean isEntry(String nodeId) {
    return predecessors(nodeId).isEmpty();
  }

  default String requireCanonical(String idOrUuid) {
    return canonicalId(idOrUuid).orElseThrow(() -> new UnknownNodeException(idOrUuid));
  }
}
