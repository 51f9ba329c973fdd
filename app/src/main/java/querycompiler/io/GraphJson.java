package querycompiler.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import querycompiler.model.CaseDefinition;
import querycompiler.model.CaseVariant;
import querycompiler.model.ConditionalProbability;
import querycompiler.model.DataSource;
import querycompiler.model.Edge;
import querycompiler.model.Graph;
import querycompiler.model.Node;
import querycompiler.model.Parameter;

/**
 * Graph snapshot JSON.
 *
 * <p>Edges are identified by {@code uuid} (or {@code id}); the base query lives in the edge's
 * {@code query} field, conditional queries in {@code conditional_p[i].query} and cost queries in
 * {@code cost_*.query}. Writing back patches those fields on a copy of the input, so fields this
 * tool does not model survive the round trip.
 */
public final class GraphJson {
  private static final Gson GSON =
      new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
  private static final String COST_PREFIX = "cost_";

  private GraphJson() {}

  public static JsonObject readTree(Path path) throws IOException {
    if (!Files.exists(path)) {
      throw new IllegalArgumentException("Graph file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      JsonElement root = JsonParser.parseReader(reader);
      if (!root.isJsonObject()) {
        throw new IllegalArgumentException("Graph JSON must be an object: " + path);
      }
      return root.getAsJsonObject();
    } catch (JsonParseException ex) {
      throw new IllegalArgumentException("Malformed graph JSON in " + path, ex);
    }
  }

  public static Graph read(Path path) throws IOException {
    return fromJson(readTree(path));
  }

  public static Graph fromJson(JsonObject root) {
    List<Node> nodes = new ArrayList<>();
    for (JsonElement element : array(root, "nodes")) {
      nodes.add(readNode(element.getAsJsonObject()));
    }
    List<Edge> edges = new ArrayList<>();
    for (JsonElement element : array(root, "edges")) {
      edges.add(readEdge(element.getAsJsonObject()));
    }
    return new Graph(nodes, edges);
  }

  /** Copies {@code original} and writes the compiled queries of {@code graph} into it. */
  public static JsonObject apply(JsonObject original, Graph graph) {
    JsonObject copy = original.deepCopy();
    for (JsonElement element : array(copy, "edges")) {
      JsonObject edgeJson = element.getAsJsonObject();
      graph.edge(edgeId(edgeJson)).ifPresent(edge -> patchEdge(edgeJson, edge));
    }
    for (JsonElement element : array(copy, "nodes")) {
      JsonObject nodeJson = element.getAsJsonObject();
      String id = string(nodeJson, "id");
      if (id == null || !nodeJson.has("case")) {
        continue;
      }
      graph.node(id)
          .filter(Node::isCase)
          .ifPresent(node -> patchCase(nodeJson.getAsJsonObject("case"), node.caseDefinition()));
    }
    return copy;
  }

  /** Serializes a graph built in code; no fields beyond the model are emitted. */
  public static JsonObject toJson(Graph graph) {
    JsonObject root = new JsonObject();
    JsonArray nodes = new JsonArray();
    for (Node node : graph.nodes()) {
      JsonObject nodeJson = new JsonObject();
      nodeJson.addProperty("id", node.id());
      if (node.uuid() != null) {
        nodeJson.addProperty("uuid", node.uuid());
      }
      if (node.isCase()) {
        JsonObject caseJson = new JsonObject();
        caseJson.addProperty("id", node.caseDefinition().id());
        JsonArray variants = new JsonArray();
        for (CaseVariant variant : node.caseDefinition().variants()) {
          JsonObject variantJson = new JsonObject();
          variantJson.addProperty("name", variant.name());
          variants.add(variantJson);
        }
        caseJson.add("variants", variants);
        patchCase(caseJson, node.caseDefinition());
        nodeJson.addProperty("type", "case");
        nodeJson.add("case", caseJson);
      }
      nodes.add(nodeJson);
    }
    JsonArray edges = new JsonArray();
    for (Edge edge : graph.edges()) {
      JsonObject edgeJson = new JsonObject();
      edgeJson.addProperty("uuid", edge.id());
      edgeJson.addProperty("from", edge.from());
      edgeJson.addProperty("to", edge.to());
      edgeJson.add("p", writeParameter(edge.probability()));
      if (!edge.conditionalProbabilities().isEmpty()) {
        JsonArray conditionals = new JsonArray();
        for (ConditionalProbability conditional : edge.conditionalProbabilities()) {
          JsonObject conditionalJson = new JsonObject();
          conditionalJson.addProperty("condition", conditional.condition());
          conditionalJson.add("p", writeParameter(conditional.probability()));
          conditionals.add(conditionalJson);
        }
        edgeJson.add("conditional_p", conditionals);
      }
      for (Map.Entry<String, Parameter> cost : edge.costs().entrySet()) {
        edgeJson.add(cost.getKey(), writeParameter(cost.getValue()));
      }
      patchEdge(edgeJson, edge);
      edges.add(edgeJson);
    }
    root.add("nodes", nodes);
    root.add("edges", edges);
    return root;
  }

  public static String toPrettyString(JsonElement element) {
    return GSON.toJson(element);
  }

  public static void write(Path path, JsonElement element) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(path, toPrettyString(element), StandardCharsets.UTF_8);
  }

  private static Node readNode(JsonObject json) {
    String id = string(json, "id");
    String uuid = string(json, "uuid");
    if (id == null) {
      id = uuid;
    }
    if (id == null) {
      throw new IllegalArgumentException("Node without id or uuid: " + json);
    }
    CaseDefinition caseDefinition = null;
    if (json.has("case") && json.get("case").isJsonObject()) {
      JsonObject caseJson = json.getAsJsonObject("case");
      List<CaseVariant> variants = new ArrayList<>();
      for (JsonElement element : array(caseJson, "variants")) {
        JsonObject variantJson = element.getAsJsonObject();
        Map<String, String> queries = new TreeMap<>();
        if (variantJson.has("queries")) {
          for (Map.Entry<String, JsonElement> query :
              variantJson.getAsJsonObject("queries").entrySet()) {
            queries.put(query.getKey(), query.getValue().getAsString());
          }
        }
        variants.add(new CaseVariant(string(variantJson, "name"), new TreeMap<>(queries)));
      }
      String caseId = string(caseJson, "id");
      caseDefinition = new CaseDefinition(caseId == null ? id : caseId, variants);
    }
    return new Node(id, uuid, caseDefinition);
  }

  private static Edge readEdge(JsonObject json) {
    String id = edgeId(json);
    String from = string(json, "from");
    String to = string(json, "to");
    if (id == null || from == null || to == null) {
      throw new IllegalArgumentException("Edge requires uuid/id, from and to: " + json);
    }
    Parameter probability = readParameter(json.get("p")).withQuery(string(json, "query"));
    List<ConditionalProbability> conditionals = new ArrayList<>();
    for (JsonElement element : array(json, "conditional_p")) {
      JsonObject conditionalJson = element.getAsJsonObject();
      Parameter parameter =
          readParameter(conditionalJson.get("p")).withQuery(string(conditionalJson, "query"));
      String condition = string(conditionalJson, "condition");
      conditionals.add(new ConditionalProbability(condition == null ? "" : condition, parameter));
    }
    TreeMap<String, Parameter> costs = new TreeMap<>();
    for (Map.Entry<String, JsonElement> field : json.entrySet()) {
      if (field.getKey().startsWith(COST_PREFIX) && field.getValue().isJsonObject()) {
        costs.put(field.getKey(), readParameter(field.getValue()));
      }
    }
    return new Edge(id, from, to, probability, conditionals, costs);
  }

  private static Parameter readParameter(JsonElement element) {
    if (element == null || !element.isJsonObject()) {
      return Parameter.empty();
    }
    JsonObject json = element.getAsJsonObject();
    String connection = string(json, "connection");
    String provider = null;
    if (json.has("data_source") && json.get("data_source").isJsonObject()) {
      JsonObject source = json.getAsJsonObject("data_source");
      if (connection == null) {
        connection = string(source, "connection_name");
      }
      provider = string(source, "source_type");
      if (provider == null) {
        provider = string(source, "type");
      }
    }
    DataSource dataSource =
        connection == null && provider == null ? null : new DataSource(connection, provider);
    String id = string(json, "id");
    if (id == null) {
      id = string(json, "parameter_id");
    }
    return new Parameter(id, dataSource, string(json, "query"));
  }

  private static JsonObject writeParameter(Parameter parameter) {
    JsonObject json = new JsonObject();
    if (parameter.id() != null) {
      json.addProperty("id", parameter.id());
    }
    if (parameter.hasDataSource()) {
      JsonObject source = new JsonObject();
      source.addProperty("connection_name", parameter.dataSource().connectionName());
      source.addProperty("source_type", parameter.dataSource().provider());
      json.add("data_source", source);
    }
    return json;
  }

  private static void patchEdge(JsonObject json, Edge edge) {
    setQuery(json, edge.probability().query());
    JsonArray conditionals = array(json, "conditional_p");
    for (int i = 0; i < conditionals.size() && i < edge.conditionalProbabilities().size(); i++) {
      setQuery(
          conditionals.get(i).getAsJsonObject(),
          edge.conditionalProbabilities().get(i).probability().query());
    }
    for (Map.Entry<String, Parameter> cost : edge.costs().entrySet()) {
      JsonElement costJson = json.get(cost.getKey());
      if (costJson != null && costJson.isJsonObject()) {
        setQuery(costJson.getAsJsonObject(), cost.getValue().query());
      }
    }
  }

  private static void patchCase(JsonObject caseJson, CaseDefinition definition) {
    for (JsonElement element : array(caseJson, "variants")) {
      JsonObject variantJson = element.getAsJsonObject();
      String name = string(variantJson, "name");
      for (CaseVariant variant : definition.variants()) {
        if (variant.name().equals(name) && !variant.queries().isEmpty()) {
          JsonObject queries = new JsonObject();
          variant.queries().forEach(queries::addProperty);
          variantJson.add("queries", queries);
        }
      }
    }
  }

  private static void setQuery(JsonObject json, String query) {
    if (query != null) {
      json.addProperty("query", query);
    }
  }

  private static String edgeId(JsonObject json) {
    String uuid = string(json, "uuid");
    return uuid != null ? uuid : string(json, "id");
  }

  private static JsonArray array(JsonObject json, String key) {
    JsonElement value = json.get(key);
    return value != null && value.isJsonArray() ? value.getAsJsonArray() : new JsonArray();
  }

  private static String string(JsonObject json, String key) {
    JsonElement value = json.get(key);
    return value == null || value.isJsonNull() ? null : value.getAsString();
  }
}
