package io.intellixity.docclients.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.docclients.ClientConfig;
import io.intellixity.docclients.ClientRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reads named client configs from JSON.\n
 *
 * <pre>\n
 * {\n
 *   "clients": {\n
 *     "primary": { "uri": "mongodb://localhost:27017/app", "options": { "appName": "app" } },\n
 *     "audit":   { "uri": null }\n
 *   }\n
 * }\n
 * </pre>\n
 *
 * Client order in the document is preserved.\n
 */
public final class ClientConfigJson {
  private static final ObjectMapper JSON = new ObjectMapper();

  private ClientConfigJson() {}

  public static Map<String, ClientConfig> read(String json) {
    Objects.requireNonNull(json, "json");
    try {
      return parse(JSON.readTree(json));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid client config JSON: " + e.getOriginalMessage(), e);
    }
  }

  public static Map<String, ClientConfig> read(InputStream in) throws IOException {
    Objects.requireNonNull(in, "in");
    try {
      return parse(JSON.readTree(in));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid client config JSON: " + e.getOriginalMessage(), e);
    }
  }

  public static Map<String, ClientConfig> read(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return read(in);
    }
  }

  /** Adds every config to the registry, in order. */
  public static <C> void registerAll(ClientRegistry<C> registry, Map<String, ClientConfig> configs) {
    Objects.requireNonNull(registry, "registry");
    if (configs == null) return;
    for (var e : configs.entrySet()) registry.add(e.getKey(), e.getValue());
  }

  private static Map<String, ClientConfig> parse(JsonNode root) {
    if (root == null || root.isNull() || root.isMissingNode()) return Map.of();
    if (!root.isObject()) throw new IllegalArgumentException("Client config JSON must be an object");

    JsonNode clients = root.get("clients");
    if (clients == null || clients.isNull()) return Map.of();
    if (!clients.isObject()) throw new IllegalArgumentException("'clients' must be an object");

    Map<String, ClientConfig> out = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = clients.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      out.put(e.getKey(), parseClient(e.getKey(), e.getValue()));
    }
    return out;
  }

  private static ClientConfig parseClient(String name, JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException("Client '" + name + "' must be an object");
    }
    JsonNode uri = node.get("uri");
    if (uri != null && !uri.isNull() && !uri.isTextual()) {
      throw new IllegalArgumentException("Client '" + name + "' uri must be a string");
    }

    JsonNode options = node.get("options");
    Map<String, Object> opts = Map.of();
    if (options != null && !options.isNull()) {
      if (!options.isObject()) throw new IllegalArgumentException("Client '" + name + "' options must be an object");
      @SuppressWarnings("unchecked")
      Map<String, Object> m = JSON.convertValue(options, LinkedHashMap.class);
      opts = m;
    }
    return new ClientConfig((uri == null || uri.isNull()) ? null : uri.asText(), opts);
  }
}
