package querycompiler.capability;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import querycompiler.model.DataSource;

final class CapabilityTableLoaderTest {

  @Test
  void childConnectionsInheritAndOverride() throws IOException {
    CapabilityTable table = load("/capabilities/inheritance.json");

    ProviderCapability replica =
        table.lookup(new DataSource("warehouse-replica", "")).capability();
    assertEquals("postgres", replica.provider(), "Provider is inherited");
    assertTrue(replica.supportsNativeExclude());
    assertFalse(replica.supportsOrdered(), "Child field wins");
    assertEquals(8, replica.maxPathLength());

    ProviderCapability shortReplica =
        table.lookup(new DataSource("warehouse-replica-short", "")).capability();
    assertFalse(shortReplica.supportsOrdered(), "Inherited through two levels");
    assertEquals(4, shortReplica.maxPathLength());
  }

  @Test
  void inheritanceCycleIsRejected() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> load("/capabilities/cycle.json"));
    assertTrue(ex.getMessage().contains("cycle"), ex.getMessage());
  }

  @Test
  void unknownParentIsRejected() {
    String json = "{\"connections\": [{\"name\": \"a\", \"extends\": \"missing\"}]}";
    assertThrows(
        IllegalArgumentException.class, () -> CapabilityTableLoader.read(new StringReader(json)));
  }

  @Test
  void bundledDefaultsLoad() {
    CapabilityTable table = CapabilityTableLoader.loadDefaults();
    CapabilityLookup amplitude = table.lookup(new DataSource("amplitude-staging", "amplitude"));
    assertEquals(CapabilityLookup.Resolution.CONNECTION, amplitude.resolution());
    assertTrue(amplitude.capability().supportsNativeExclude());
    assertFalse(
        table.lookup(new DataSource("sheets-readonly", "sheets")).capability().supportsVisited());
  }

  @Test
  void acceptsFunnelLengthAlias() {
    String json =
        "{\"providers\": {\"amplitude\": {\"supports_native_exclude\": true,"
            + " \"max_funnel_length\": 10}}}";
    CapabilityTable table = CapabilityTableLoader.read(new StringReader(json));
    assertEquals(
        10, table.lookup(new DataSource("", "amplitude")).capability().maxPathLength());
  }

  private static CapabilityTable load(String resource) throws IOException {
    try (Reader reader =
        new InputStreamReader(
            CapabilityTableLoaderTest.class.getResourceAsStream(resource),
            StandardCharsets.UTF_8)) {
      return CapabilityTableLoader.read(reader);
    }
  }
}
