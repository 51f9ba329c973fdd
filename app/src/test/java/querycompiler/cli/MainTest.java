package querycompiler.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class MainTest {

  @Test
  void queryWithoutGraphCanonicalizes() {
    assertEquals(0, Main.run(new String[] {"query", "--condition", "visited(c,b).from(a).to(d)"}));
  }

  @Test
  void exitCodesFollowErrorKind() {
    assertEquals(1, Main.run(new String[] {}));
    assertEquals(1, Main.run(new String[] {"explode"}));
    assertEquals(1, Main.run(new String[] {"compile"}), "compile without --graph");
    assertEquals(2, Main.run(new String[] {"query", "--condition", "visited(b"}));
    assertEquals(0, Main.run(new String[] {"help"}));
  }

  @Test
  void compileWritesGraphAndReport(@TempDir Path dir) throws Exception {
    Path graph = Path.of(MainTest.class.getResource("/graphs/checkout.json").toURI());
    Path out = dir.resolve("compiled.json");
    Path report = dir.resolve("report.json");

    int code =
        Main.run(
            new String[] {
              "compile",
              "--graph",
              graph.toString(),
              "--out",
              out.toString(),
              "--report",
              report.toString(),
              "--parallelism",
              "2"
            });

    assertEquals(0, code);
    JsonObject compiled =
        JsonParser.parseString(Files.readString(out, StandardCharsets.UTF_8)).getAsJsonObject();
    assertEquals("checkout-funnel", compiled.get("id").getAsString());
    JsonObject meta =
        JsonParser.parseString(Files.readString(report, StandardCharsets.UTF_8))
            .getAsJsonObject()
            .getAsJsonObject("meta");
    assertEquals(5, meta.get("edge_count").getAsInt());
    assertEquals(0, meta.get("failure_count").getAsInt());
    assertTrue(meta.getAsJsonObject("timings").has("compile"));
  }

  @Test
  void queryAgainstGraphCompilesOneEdge() throws Exception {
    Path graph = Path.of(MainTest.class.getResource("/graphs/checkout.json").toURI());
    assertEquals(
        0,
        Main.run(
            new String[] {
              "query",
              "--graph",
              graph.toString(),
              "--edge",
              "e-landing-signup",
              "--connection",
              "sheets-readonly"
            }));
    assertEquals(
        1,
        Main.run(new String[] {"query", "--graph", graph.toString(), "--edge", "missing"}));
  }
}
