package querycompiler.testing;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import querycompiler.model.DataSource;
import querycompiler.model.Edge;
import querycompiler.model.Graph;
import querycompiler.model.Node;
import querycompiler.model.Parameter;

/** Small graph fixtures written as {@code "a>b"} edge specs; edge ids are {@code a->b}. */
public final class TestGraphs {
  public static final DataSource AMPLITUDE = new DataSource("amplitude-prod", "amplitude");
  public static final DataSource SHEETS = new DataSource("sheets-readonly", "sheets");

  private TestGraphs() {}

  public static Graph graph(String... specs) {
    Set<String> nodeIds = new LinkedHashSet<>();
    List<Edge> edges = new ArrayList<>();
    for (String spec : specs) {
      String[] parts = spec.split(">");
      nodeIds.add(parts[0]);
      nodeIds.add(parts[1]);
      edges.add(Edge.between(parts[0] + "->" + parts[1], parts[0], parts[1]));
    }
    List<Node> nodes = new ArrayList<>();
    nodeIds.forEach(id -> nodes.add(Node.of(id)));
    return new Graph(nodes, edges);
  }

  /** Diamond with a direct shortcut: a>b>c, a>d>c and a>c. */
  public static Graph diamond() {
    return graph("a>b", "b>c", "a>d", "d>c", "a>c");
  }

  /** Three mutually exclusive routes into e, then e>f. */
  public static Graph fanIn() {
    return graph("a>b", "a>c", "a>d", "b>e", "c>e", "d>e", "e>f");
  }

  /** Dense graph where b, d and g all compete with the direct a>m transition. */
  public static Graph complex() {
    return graph(
        "a>m", "a>b", "b>m", "a>f", "f>b", "f>g", "a>e", "e>b", "e>g", "a>d", "d>m", "d>g",
        "d>e", "g>m");
  }

  /** Sets the base-probability data source of every edge. */
  public static Graph withSource(Graph graph, DataSource source) {
    List<Edge> edges = new ArrayList<>();
    for (Edge edge : graph.edges()) {
      edges.add(edge.withProbability(new Parameter(null, source, null)));
    }
    return graph.withEdges(edges);
  }
}
