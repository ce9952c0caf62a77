package io.intellixity.docclients.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import io.intellixity.docclients.ClientConfig;
import io.intellixity.docclients.ClientConnectionException;
import io.intellixity.docclients.DefaultClientRegistry;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

final class MongoConnectionDriverTest {
  /** Nothing listens on port 1; server selection fails fast with the short timeouts below. */
  private static final String UNREACHABLE = "mongodb://127.0.0.1:1/app";
  private static final Map<String, Object> FAST_FAIL = Map.of(
      "serverSelectionTimeoutMS", 300,
      "connectTimeoutMS", 300);

  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    executor = Executors.newSingleThreadExecutor();
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private static Throwable failureOf(CompletableFuture<?> f) {
    CompletionException e = assertThrows(CompletionException.class, () -> f.orTimeout(30, TimeUnit.SECONDS).join());
    return e.getCause();
  }

  @Test
  void defaultOptions_areMongoDefaults() {
    MongoConnectionDriver d = new MongoConnectionDriver(executor);
    assertEquals("mongo", d.id());
    assertEquals(MongoClientOptions.DEFAULTS, d.defaultOptions());
  }

  @Test
  void establish_withoutUri_fails() {
    MongoConnectionDriver d = new MongoConnectionDriver(executor);

    assertInstanceOf(ClientConnectionException.class, failureOf(d.establish(null, Map.of())));
    assertInstanceOf(ClientConnectionException.class, failureOf(d.establish("  ", Map.of())));
  }

  @Test
  void establish_invalidUriOrOptions_failsWithoutCreatingClient() {
    AtomicInteger created = new AtomicInteger();
    MongoConnectionDriver d = new MongoConnectionDriver(executor, s -> {
      created.incrementAndGet();
      return MongoClients.create(s);
    });

    Throwable badUri = failureOf(d.establish("http://localhost", Map.of()));
    Throwable badOption = failureOf(d.establish("mongodb://localhost", Map.of("useNewUrlParser", true)));

    assertInstanceOf(ClientConnectionException.class, badUri);
    assertInstanceOf(IllegalArgumentException.class, badUri.getCause());
    assertInstanceOf(ClientConnectionException.class, badOption);
    assertEquals(0, created.get());
  }

  @Test
  void establish_unreachableServer_failsAfterPing() {
    AtomicInteger created = new AtomicInteger();
    MongoConnectionDriver d = new MongoConnectionDriver(executor, s -> {
      created.incrementAndGet();
      return MongoClients.create(s);
    });

    Throwable cause = failureOf(d.establish(UNREACHABLE, FAST_FAIL));

    assertInstanceOf(ClientConnectionException.class, cause);
    assertTrue(cause.getMessage().contains("mongo:127.0.0.1:1/app"));
    assertEquals(1, created.get());
  }

  @Test
  void registry_leavesClientDisconnected_whenServerUnreachable() {
    DefaultClientRegistry<MongoConnection> registry = DefaultClientRegistry.create(new MongoConnectionDriver(executor));
    registry.add("primary", ClientConfig.of(UNREACHABLE, FAST_FAIL));

    assertEquals(300, registry.get("primary").options().get("serverSelectionTimeoutMS"));
    assertEquals(true, registry.get("primary").options().get("retryWrites"));
    assertInstanceOf(ClientConnectionException.class, failureOf(registry.connect("primary")));
    assertNull(registry.connection("primary"));
  }

  @Test
  void close_closesMongoClient() throws Exception {
    MongoConnectionDriver d = new MongoConnectionDriver(executor);
    MongoClient client = mock(MongoClient.class);
    MongoConnection conn = new MongoConnection("mongo:test", client, null);

    d.close(conn, true).get(10, TimeUnit.SECONDS);

    verify(client).close();
  }

  @Test
  void close_clientFailure_isReportedAsConnectionError() {
    MongoConnectionDriver d = new MongoConnectionDriver(executor);
    MongoClient client = mock(MongoClient.class);
    doThrow(new IllegalStateException("boom")).when(client).close();

    Throwable cause = failureOf(d.close(new MongoConnection("mongo:test", client, null), false));

    assertInstanceOf(ClientConnectionException.class, cause);
    assertEquals("Failed to close mongo:test: boom", cause.getMessage());
  }

  @Test
  void establish_reachableServer_yieldsConnectionOnUriDatabase() {
    MongoClient client = mock(MongoClient.class);
    MongoDatabase admin = mock(MongoDatabase.class);
    MongoDatabase app = mock(MongoDatabase.class);
    when(client.getDatabase("admin")).thenReturn(admin);
    when(client.getDatabase("app")).thenReturn(app);
    List<MongoClientSettings> seen = new ArrayList<>();
    MongoConnectionDriver d = new MongoConnectionDriver(executor, s -> {
      seen.add(s);
      return client;
    });

    MongoConnection conn = d.establish("mongodb://db1:27017/app", Map.of("appName", "orders"))
        .orTimeout(10, TimeUnit.SECONDS).join();

    assertEquals("mongo:db1:27017/app", conn.id());
    assertSame(client, conn.client());
    assertEquals("app", conn.database());
    assertSame(app, conn.defaultDatabase());
    verify(admin).runCommand(new Document("ping", 1));
    assertEquals(1, seen.size());
    assertEquals("orders", seen.get(0).getApplicationName());
    verify(client, never()).close();
  }

  @Test
  void establish_pingFailingWithAnyRuntimeError_closesClient() {
    MongoClient client = mock(MongoClient.class);
    MongoDatabase admin = mock(MongoDatabase.class);
    when(client.getDatabase("admin")).thenReturn(admin);
    when(admin.runCommand(any(Bson.class))).thenThrow(new IllegalStateException("state should be: open"));
    MongoConnectionDriver d = new MongoConnectionDriver(executor, s -> client);

    Throwable cause = failureOf(d.establish("mongodb://db1:27017/app", Map.of()));

    assertInstanceOf(ClientConnectionException.class, cause);
    assertInstanceOf(IllegalStateException.class, cause.getCause());
    verify(client).close();
  }

  @Test
  void registry_connectThenDisconnect_closesTheMongoClientOnce() {
    MongoClient client = mock(MongoClient.class);
    when(client.getDatabase("admin")).thenReturn(mock(MongoDatabase.class));
    AtomicInteger created = new AtomicInteger();
    DefaultClientRegistry<MongoConnection> registry = DefaultClientRegistry.create(
        new MongoConnectionDriver(executor, s -> {
          created.incrementAndGet();
          return client;
        }));
    registry.add("primary", ClientConfig.of("mongodb://db1:27017/app"));

    MongoConnection conn = registry.connect("primary").orTimeout(10, TimeUnit.SECONDS).join();
    assertSame(conn, registry.connect("primary").join());
    assertSame(conn, registry.connection("primary"));
    assertEquals("app", conn.database());

    registry.disconnect("primary").orTimeout(10, TimeUnit.SECONDS).join();
    registry.disconnect("primary").orTimeout(10, TimeUnit.SECONDS).join();

    assertNull(registry.connection("primary"));
    assertEquals(1, created.get());
    verify(client, times(1)).close();
  }

  @Test
  void close_noArgDriver_shutsDownItsPoolAndRejectsLaterWork() {
    MongoConnectionDriver d = new MongoConnectionDriver();
    d.close();

    Throwable cause = failureOf(d.establish("mongodb://db1:27017/app", Map.of()));
    assertInstanceOf(ClientConnectionException.class, cause);
    assertEquals("Mongo driver is closed", cause.getMessage());
  }

  @Test
  void close_callerSuppliedExecutor_isLeftRunning() {
    new MongoConnectionDriver(executor).close();

    assertFalse(executor.isShutdown());
  }

  @Test
  void connectionId_includesHostsAndDatabase() {
    assertEquals("mongo:a:27017,b:27017/app",
        MongoConnectionDriver.connectionId(new ConnectionString("mongodb://a:27017,b:27017/app")));
    assertEquals("mongo:localhost", MongoConnectionDriver.connectionId(new ConnectionString("mongodb://localhost")));
  }

  @Test
  void connection_withoutDatabase_rejectsDefaultDatabase() {
    try (MongoClient client = MongoClients.create("mongodb://127.0.0.1:1")) {
      MongoConnection conn = new MongoConnection("mongo:x", client, " ");
      assertNull(conn.database());
      assertThrows(IllegalStateException.class, conn::defaultDatabase);

      MongoConnection withDb = new MongoConnection("mongo:x", client, "app");
      assertEquals("app", withDb.defaultDatabase().getName());
    }
  }
}
