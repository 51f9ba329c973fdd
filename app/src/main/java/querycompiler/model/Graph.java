package querycompiler.model;

import java.util.List;
import java.util.Optional;

/** Immutable snapshot of a funnel graph. */
public record Graph(List<Node> nodes, List<Edge> edges) {

  public Graph {
    nodes = nodes == null ? List.of() : List.copyOf(nodes);
    edges = edges == null ? List.of() : List.copyOf(edges);
  }

  public Optional<Edge> edge(String edgeId) {
    return edges.stream().filter(edge -> edge.id().equals(edgeId)).findFirst();
  }

  public Optional<Node> node(String idOrUuid) {
    return nodes.stream()
        .filter(node -> node.id().equals(idOrUuid) || idOrUuid.equals(node.uuid()))
        .findFirst();
  }

  public Graph withEdges(List<Edge> updated) {
    return new Graph(nodes, updated);
  }

  public Graph withNodes(List<Node> updated) {
    return new Graph(updated, edges);
  }
}
