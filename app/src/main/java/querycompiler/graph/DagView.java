package querycompiler.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.TreeSet;
import querycompiler.model.Edge;
import querycompiler.model.Graph;
import querycompiler.model.Node;

/**
 * {@link GraphView} built once from a {@link Graph} snapshot. Edge endpoints given by uuid are
 * resolved to node ids; endpoints naming no declared node are added as implicit nodes. Ties in
 * the topological order are broken by declaration order, so the order is deterministic.
 */
public final class DagView implements GraphView {
  private final List<String> order;
  private final Map<String, Integer> index;
  private final Map<String, String> aliases;
  private final Map<String, List<String>> successors;
  private final Map<String, List<String>> predecessors;
  private final Map<String, EdgeEndpoints> edges;

  private DagView(
      List<String> order,
      Map<String, String> aliases,
      Map<String, List<String>> successors,
      Map<String, List<String>> predecessors,
      Map<String, EdgeEndpoints> edges) {
    this.order = List.copyOf(order);
    this.aliases = Map.copyOf(aliases);
    this.successors = successors;
    this.predecessors = predecessors;
    this.edges = Map.copyOf(edges);
    Map<String, Integer> positions = new HashMap<>();
    for (int i = 0; i < order.size(); i++) {
      positions.put(order.get(i), i);
    }
    this.index = Map.copyOf(positions);
  }

  /**
   * Builds the view.
   *
   * @throws CyclicGraphException when the edges form a cycle
   */
  public static DagView of(Graph graph) {
    Objects.requireNonNull(graph, "graph");
    Map<String, String> aliases = new HashMap<>();
    Map<String, Integer> declared = new LinkedHashMap<>();
    for (Node node : graph.nodes()) {
      declared.putIfAbsent(node.id(), declared.size());
      aliases.put(node.id(), node.id());
      if (node.uuid() != null && !node.uuid().isBlank()) {
        aliases.putIfAbsent(node.uuid(), node.id());
      }
    }
    Map<String, TreeSet<String>> out = new HashMap<>();
    Map<String, TreeSet<String>> in = new HashMap<>();
    Map<String, EdgeEndpoints> edges = new HashMap<>();
    for (Edge edge : graph.edges()) {
      String from = resolve(edge.from(), aliases, declared);
      String to = resolve(edge.to(), aliases, declared);
      out.computeIfAbsent(from, k -> new TreeSet<>()).add(to);
      in.computeIfAbsent(to, k -> new TreeSet<>()).add(from);
      edges.put(edge.id(), new EdgeEndpoints(edge.id(), from, to));
    }

    List<String> order = topologicalOrder(declared, out, in);
    Map<String, List<String>> successors = new HashMap<>();
    Map<String, List<String>> predecessors = new HashMap<>();
    for (String id : order) {
      successors.put(id, List.copyOf(out.getOrDefault(id, new TreeSet<>())));
      predecessors.put(id, List.copyOf(in.getOrDefault(id, new TreeSet<>())));
    }
    return new DagView(order, aliases, Map.copyOf(successors), Map.copyOf(predecessors), edges);
  }

  private static String resolve(
      String reference, Map<String, String> aliases, Map<String, Integer> declared) {
    String id = aliases.get(reference);
    if (id != null) {
      return id;
    }
    declared.putIfAbsent(reference, declared.size());
    aliases.put(reference, reference);
    return reference;
  }

  private static List<String> topologicalOrder(
      Map<String, Integer> declared,
      Map<String, TreeSet<String>> out,
      Map<String, TreeSet<String>> in) {
    Map<String, Integer> inDegree = new HashMap<>();
    PriorityQueue<String> ready = new PriorityQueue<>((a, b) -> declared.get(a) - declared.get(b));
    for (String id : declared.keySet()) {
      int degree = in.getOrDefault(id, new TreeSet<>()).size();
      inDegree.put(id, degree);
      if (degree == 0) {
        ready.add(id);
      }
    }
    List<String> order = new ArrayList<>(declared.size());
    while (!ready.isEmpty()) {
      String next = ready.poll();
      order.add(next);
      for (String successor : out.getOrDefault(next, new TreeSet<>())) {
        int remaining = inDegree.merge(successor, -1, Integer::sum);
        if (remaining == 0) {
          ready.add(successor);
        }
      }
    }
    if (order.size() != declared.size()) {
      List<String> unresolved = new ArrayList<>();
      for (String id : declared.keySet()) {
        if (inDegree.get(id) > 0) {
          unresolved.add(id);
        }
      }
      throw new CyclicGraphException(unresolved);
    }
    return order;
  }

  @Override
  public List<String> nodeIds() {
    return order;
  }

  @Override
  public boolean contains(String nodeId) {
    return index.containsKey(nodeId);
  }

  @Override
  public Optional<String> canonicalId(String idOrUuid) {
    return Optional.ofNullable(idOrUuid).map(aliases::get);
  }

  @Override
  public List<String> successors(String nodeId) {
    return successors.getOrDefault(nodeId, List.of());
  }

  @Override
  public List<String> predecessors(String nodeId) {
    return predecessors.getOrDefault(nodeId, List.of());
  }

  @Override
  public boolean hasEdge(String from, String to) {
    return successors(from).contains(to);
  }

  @Override
  public int topologicalIndex(String nodeId) {
    Integer position = index.get(nodeId);
    return position == null ? -1 : position;
  }

  @Override
  public Optional<EdgeEndpoints> edge(String edgeId) {
    return Optional.ofNullable(edges.get(edgeId));
  }
}
