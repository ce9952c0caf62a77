package io.intellixity.docclients.config;

import io.intellixity.docclients.ClientConfig;
import io.intellixity.docclients.ClientConnectionException;
import io.intellixity.docclients.DefaultClientRegistry;
import io.intellixity.docclients.spi.ConnectionDriver;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

final class ClientConfigJsonTest {

  private static final class NoConnectDriver implements ConnectionDriver<Object> {
    @Override public String id() { return "none"; }
    @Override public Map<String, Object> defaultOptions() { return Map.of("retryWrites", true); }
    @Override public CompletableFuture<Object> establish(String uri, Map<String, Object> options) {
      return CompletableFuture.failedFuture(new ClientConnectionException("not connecting in tests"));
    }
    @Override public CompletableFuture<Void> close(Object connection, boolean force) {
      return CompletableFuture.completedFuture(null);
    }
  }

  @Test
  void readsClientsInDocumentOrder() {
    String s = """
        {
          "clients": {
            "primary": { "uri": "mongodb://localhost:27017/app", "options": { "appName": "app", "maxPoolSize": 20 } },
            "audit":   { "uri": null },
            "archive": { }
          }
        }
        """;
    Map<String, ClientConfig> configs = ClientConfigJson.read(s);

    assertEquals(List.of("primary", "audit", "archive"), List.copyOf(configs.keySet()));
    assertEquals("mongodb://localhost:27017/app", configs.get("primary").uri());
    assertEquals("app", configs.get("primary").options().get("appName"));
    assertEquals(20, configs.get("primary").options().get("maxPoolSize"));
    assertNull(configs.get("audit").uri());
    assertEquals(Map.of(), configs.get("archive").options());
  }

  @Test
  void readsFromStream() throws Exception {
    byte[] json = "{\"clients\":{\"a\":{\"uri\":\"mongodb://a\"}}}".getBytes(StandardCharsets.UTF_8);
    Map<String, ClientConfig> configs = ClientConfigJson.read(new ByteArrayInputStream(json));
    assertEquals("mongodb://a", configs.get("a").uri());
  }

  @Test
  void missingClients_yieldsEmpty() {
    assertTrue(ClientConfigJson.read("{}").isEmpty());
  }

  @Test
  void malformedDocuments_areRejected() {
    assertThrows(IllegalArgumentException.class, () -> ClientConfigJson.read("{ not json"));
    assertThrows(IllegalArgumentException.class, () -> ClientConfigJson.read("[]"));
    assertThrows(IllegalArgumentException.class, () -> ClientConfigJson.read("{\"clients\": []}"));
    assertThrows(IllegalArgumentException.class, () -> ClientConfigJson.read("{\"clients\": {\"a\": 1}}"));
    assertThrows(IllegalArgumentException.class, () -> ClientConfigJson.read("{\"clients\": {\"a\": {\"uri\": 5}}}"));
    assertThrows(IllegalArgumentException.class, () -> ClientConfigJson.read("{\"clients\": {\"a\": {\"options\": \"x\"}}}"));
  }

  @Test
  void registerAll_addsEveryClientMergedOverDefaults() {
    DefaultClientRegistry<Object> registry = DefaultClientRegistry.create(new NoConnectDriver());
    ClientConfigJson.registerAll(registry, ClientConfigJson.read("""
        { "clients": { "a": { "uri": "mongodb://a", "options": { "appName": "x" } }, "b": { "uri": "mongodb://b" } } }
        """));

    assertEquals(List.of("a", "b"), registry.keys());
    assertEquals(Map.of("retryWrites", true, "appName", "x"), registry.get("a").options());
    assertNull(registry.connection("a"));
  }
}
