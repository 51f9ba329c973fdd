package querycompiler.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonObject;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import querycompiler.capability.CapabilityTableLoader;
import querycompiler.model.DataSource;
import querycompiler.model.Edge;
import querycompiler.model.Graph;
import querycompiler.model.Node;
import querycompiler.pipeline.BatchOptions;
import querycompiler.pipeline.BatchOrchestrator;
import querycompiler.pipeline.BatchResult;
import querycompiler.testing.TestGraphs;

final class GraphJsonTest {

  @Test
  void readsNodesEdgesAndSlots() throws Exception {
    Graph graph = GraphJson.read(fixture());

    assertEquals(5, graph.nodes().size());
    assertEquals(5, graph.edges().size());
    Node paywall = graph.node("n-0004").orElseThrow();
    assertEquals("paywall", paywall.id());
    assertEquals("paywall-test", paywall.caseDefinition().id());
    assertEquals(2, paywall.caseDefinition().variants().size());

    Edge landingSignup = graph.edge("e-landing-signup").orElseThrow();
    assertEquals(
        new DataSource("amplitude-prod", null), landingSignup.probability().dataSource());
    Edge signupPaywall = graph.edge("e-signup-paywall").orElseThrow();
    assertEquals("visited(pricing)", signupPaywall.conditionalProbabilities().get(0).condition());
    Edge paywallPurchase = graph.edge("e-paywall-purchase").orElseThrow();
    assertEquals("paywall-purchase-gbp", paywallPurchase.costs().get("cost_gbp").id());
    assertNull(paywallPurchase.probability().query());
  }

  @Test
  void applyPatchesQueriesAndKeepsUnknownFields() throws Exception {
    JsonObject original = GraphJson.readTree(fixture());
    Graph graph = GraphJson.fromJson(original);
    BatchResult result =
        BatchOrchestrator.compileAll(
            graph, CapabilityTableLoader.loadDefaults(), BatchOptions.defaults());

    JsonObject patched = GraphJson.apply(original, result.graph());

    assertEquals(7, patched.getAsJsonObject("metadata").get("revision").getAsInt());
    JsonObject landingSignup = edge(patched, 1);
    assertEquals(
        "from(landing).to(signup).exclude(pricing)", landingSignup.get("query").getAsString());
    JsonObject signupPaywall = edge(patched, 3);
    assertEquals(
        "from(signup).to(paywall).visited(pricing)",
        signupPaywall
            .getAsJsonArray("conditional_p")
            .get(0)
            .getAsJsonObject()
            .get("query")
            .getAsString());
    JsonObject paywallPurchase = edge(patched, 4);
    assertEquals(1.5, paywallPurchase.getAsJsonObject("cost_gbp").get("mean").getAsDouble());
    assertTrue(paywallPurchase.getAsJsonObject("cost_gbp").has("query"));
    assertEquals(0.4, edge(patched, 0).getAsJsonObject("p").get("mean").getAsDouble());

    JsonObject treatment =
        patched
            .getAsJsonArray("nodes")
            .get(3)
            .getAsJsonObject()
            .getAsJsonObject("case")
            .getAsJsonArray("variants")
            .get(1)
            .getAsJsonObject();
    assertEquals(0.5, treatment.get("weight").getAsDouble());
    assertEquals(
        "from(paywall).to(purchase).case(paywall-test:treatment)",
        treatment.getAsJsonObject("queries").get("e-paywall-purchase").getAsString());
    assertNull(original.getAsJsonArray("edges").get(1).getAsJsonObject().get("query"));
  }

  @Test
  void builtGraphSurvivesWriteAndRead(@TempDir Path dir) throws IOException {
    Graph graph = TestGraphs.withSource(TestGraphs.diamond(), TestGraphs.AMPLITUDE);
    Path out = dir.resolve("nested").resolve("graph.json");

    GraphJson.write(out, GraphJson.toJson(graph));

    assertEquals(graph, GraphJson.read(out));
  }

  @Test
  void rejectsMissingAndMalformedFiles(@TempDir Path dir) throws IOException {
    assertThrows(
        IllegalArgumentException.class, () -> GraphJson.read(dir.resolve("absent.json")));
    Path broken = Files.writeString(dir.resolve("broken.json"), "{\"nodes\": [");
    assertThrows(IllegalArgumentException.class, () -> GraphJson.read(broken));
    Path edgeless = Files.writeString(dir.resolve("edge.json"), "{\"edges\": [{\"from\": \"a\"}]}");
    assertThrows(IllegalArgumentException.class, () -> GraphJson.read(edgeless));
  }

  private static JsonObject edge(JsonObject root, int index) {
    return root.getAsJsonArray("edges").get(index).getAsJsonObject();
  }

  static Path fixture() throws URISyntaxException {
    return Path.of(GraphJsonTest.class.getResource("/graphs/checkout.json").toURI());
  }
}
