package querycompiler.capability;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads capability configuration JSON.
 *
 * <pre>
 * { "connections": [ {"name": "...", "provider": "...", "extends": "...",
 *                     "capabilities": {"supports_native_exclude": true, ...}} ],
 *   "providers": { "amplitude": {"supports_native_exclude": true, ...} } }
 * </pre>
 *
 * A connection that {@code extends} another inherits its provider and any capability field it
 * does not set itself.
 */
public final class CapabilityTableLoader {
  private static final Logger LOG = LoggerFactory.getLogger(CapabilityTableLoader.class);

  /** Classpath resource used when no configuration file is given. */
  public static final String DEFAULT_RESOURCE = "/default-connections.json";

  private CapabilityTableLoader() {}

  public static CapabilityTable load(Path path) throws IOException {
    if (!Files.exists(path)) {
      throw new IllegalArgumentException("Capability file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      CapabilityTable table = read(reader);
      LOG.info(
          "Loaded {} connections and {} provider defaults from {}",
          table.connectionNames().size(),
          table.providerNames().size(),
          path);
      return table;
    }
  }

  public static CapabilityTable loadDefaults() {
    InputStream stream = CapabilityTableLoader.class.getResourceAsStream(DEFAULT_RESOURCE);
    if (stream == null) {
      throw new IllegalStateException("Missing resource " + DEFAULT_RESOURCE);
    }
    try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  public static CapabilityTable read(Reader reader) {
    JsonElement root;
    try {
      root = JsonParser.parseReader(reader);
    } catch (JsonParseException ex) {
      throw new IllegalArgumentException("Malformed capability JSON: " + ex.getMessage(), ex);
    }
    if (!root.isJsonObject()) {
      throw new IllegalArgumentException("Capability JSON must be an object");
    }
    JsonObject object = root.getAsJsonObject();
    return new CapabilityTable(readConnections(object), readProviders(object));
  }

  private static Map<String, ProviderCapability> readProviders(JsonObject root) {
    Map<String, ProviderCapability> providers = new LinkedHashMap<>();
    if (!root.has("providers")) {
      return providers;
    }
    for (Map.Entry<String, JsonElement> entry : root.getAsJsonObject("providers").entrySet()) {
      JsonObject flags = entry.getValue().getAsJsonObject();
      if (flags.has("capabilities")) {
        flags = flags.getAsJsonObject("capabilities");
      }
      providers.put(entry.getKey(), toCapability("", entry.getKey(), flags));
    }
    return providers;
  }

  private static Map<String, ProviderCapability> readConnections(JsonObject root) {
    Map<String, JsonObject> raw = new LinkedHashMap<>();
    if (root.has("connections")) {
      JsonArray array = root.getAsJsonArray("connections");
      for (JsonElement element : array) {
        JsonObject connection = element.getAsJsonObject();
        String name = string(connection, "name");
        if (name == null || name.isBlank()) {
          throw new IllegalArgumentException("Connection without a name: " + connection);
        }
        if (raw.put(name, connection) != null) {
          throw new IllegalArgumentException("Duplicate connection: " + name);
        }
      }
    }
    Map<String, ProviderCapability> resolved = new LinkedHashMap<>();
    for (String name : raw.keySet()) {
      JsonObject merged = resolve(name, raw, new ArrayList<>());
      String provider = string(merged, "provider");
      JsonObject flags =
          merged.has("capabilities") ? merged.getAsJsonObject("capabilities") : new JsonObject();
      resolved.put(name, toCapability(name, provider == null ? "" : provider, flags));
    }
    return resolved;
  }

  private static JsonObject resolve(String name, Map<String, JsonObject> raw, List<String> chain) {
    if (chain.contains(name)) {
      chain.add(name);
      throw new IllegalArgumentException("Connection inheritance cycle: " + chain);
    }
    JsonObject own = raw.get(name);
    if (own == null) {
      throw new IllegalArgumentException(
          "Connection '" + chain.get(chain.size() - 1) + "' extends unknown connection " + name);
    }
    String parentName = string(own, "extends");
    if (parentName == null) {
      return own;
    }
    chain.add(name);
    JsonObject parent = resolve(parentName, raw, chain);
    JsonObject merged = parent.deepCopy();
    JsonObject mergedFlags =
        merged.has("capabilities") ? merged.getAsJsonObject("capabilities") : new JsonObject();
    for (Map.Entry<String, JsonElement> field : own.entrySet()) {
      if (field.getKey().equals("capabilities")) {
        for (Map.Entry<String, JsonElement> flag : field.getValue().getAsJsonObject().entrySet()) {
          mergedFlags.add(flag.getKey(), flag.getValue());
        }
      } else if (!field.getKey().equals("extends")) {
        merged.add(field.getKey(), field.getValue());
      }
    }
    merged.remove("extends");
    merged.add("capabilities", mergedFlags);
    return merged;
  }

  private static ProviderCapability toCapability(String name, String provider, JsonObject flags) {
    int maxPathLength = 0;
    if (flags.has("max_path_length") && !flags.get("max_path_length").isJsonNull()) {
      maxPathLength = flags.get("max_path_length").getAsInt();
    } else if (flags.has("max_funnel_length") && !flags.get("max_funnel_length").isJsonNull()) {
      maxPathLength = flags.get("max_funnel_length").getAsInt();
    }
    return new ProviderCapability(
        name,
        provider,
        flag(flags, "supports_native_exclude"),
        flag(flags, "supports_visited"),
        flag(flags, "supports_ordered"),
        maxPathLength);
  }

  private static boolean flag(JsonObject flags, String key) {
    JsonElement value = flags.get(key);
    return value != null && !value.isJsonNull() && value.getAsBoolean();
  }

  private static String string(JsonObject object, String key) {
    JsonElement value = object.get(key);
    return value == null || value.isJsonNull() ? null : value.getAsString();
  }
}
