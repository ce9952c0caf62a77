package io.intellixity.docclients.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.intellixity.docclients.ClientConnectionException;
import io.intellixity.docclients.spi.ConnectionDriver;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * {@link ConnectionDriver} using the official MongoDB Java sync driver.\n
 *
 * establish(): parse URI, apply options, create the MongoClient, then ping admin so unreachable servers fail here.\n
 * close(): closes the MongoClient. The sync driver has no graceful drain, so force only shows up in logs.\n
 * Blocking work runs on the supplied executor. The no-arg constructor creates its own pool, shut down by {@link #close()}.\n
 */
public final class MongoConnectionDriver implements ConnectionDriver<MongoConnection>, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MongoConnectionDriver.class);

  private static final Document PING = new Document("ping", 1);

  private final Executor executor;
  private final Function<MongoClientSettings, MongoClient> clientFactory;
  private final ExecutorService ownedExecutor;

  public MongoConnectionDriver() {
    this(defaultExecutor(), MongoClients::create, true);
  }

  public MongoConnectionDriver(Executor executor) {
    this(executor, MongoClients::create, false);
  }

  public MongoConnectionDriver(Executor executor, Function<MongoClientSettings, MongoClient> clientFactory) {
    this(executor, clientFactory, false);
  }

  private MongoConnectionDriver(Executor executor, Function<MongoClientSettings, MongoClient> clientFactory, boolean owned) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    this.ownedExecutor = owned ? (ExecutorService) executor : null;
  }

  @Override
  public String id() {
    return "mongo";
  }

  @Override
  public Map<String, Object> defaultOptions() {
    return MongoClientOptions.DEFAULTS;
  }

  @Override
  public CompletableFuture<MongoConnection> establish(String uri, Map<String, Object> options) {
    if (uri == null || uri.isBlank()) {
      return CompletableFuture.failedFuture(new ClientConnectionException("No Mongo URI configured"));
    }
    try {
      return CompletableFuture.supplyAsync(() -> open(uri, options), executor);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(new ClientConnectionException("Mongo driver is closed", e));
    }
  }

  private MongoConnection open(String uri, Map<String, Object> options) {
    ConnectionString cs;
    MongoClientSettings settings;
    try {
      cs = new ConnectionString(uri);
      settings = MongoClientOptions.apply(MongoClientSettings.builder().applyConnectionString(cs), options).build();
    } catch (IllegalArgumentException e) {
      throw new ClientConnectionException("Invalid Mongo client configuration: " + e.getMessage(), e);
    }

    String id = connectionId(cs);
    long start = System.nanoTime();
    MongoClient client;
    try {
      client = clientFactory.apply(settings);
    } catch (MongoException | IllegalArgumentException e) {
      throw new ClientConnectionException("Failed to create Mongo client " + id + ": " + e.getMessage(), e);
    }
    try {
      client.getDatabase("admin").runCommand(PING);
    } catch (RuntimeException e) {
      try {
        client.close();
      } catch (RuntimeException closeErr) {
        e.addSuppressed(closeErr);
      }
      throw new ClientConnectionException("Failed to connect " + id + ": " + e.getMessage(), e);
    }
    log.debug("docclients.mongo_connected id={} durationMs={}", id, (System.nanoTime() - start) / 1_000_000.0);
    return new MongoConnection(id, client, cs.getDatabase());
  }

  @Override
  public CompletableFuture<Void> close(MongoConnection connection, boolean force) {
    Objects.requireNonNull(connection, "connection");
    try {
      return CompletableFuture.runAsync(() -> {
        log.debug("docclients.mongo_close id={} force={}", connection.id(), force);
        try {
          connection.client().close();
        } catch (RuntimeException e) {
          throw new ClientConnectionException("Failed to close " + connection.id() + ": " + e.getMessage(), e);
        }
      }, executor);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(new ClientConnectionException("Mongo driver is closed", e));
    }
  }

  /** Shuts down the pool created by the no-arg constructor; a caller-supplied executor is left alone. */
  @Override
  public void close() {
    if (ownedExecutor != null) {
      log.debug("docclients.mongo_driver_closed");
      ownedExecutor.shutdown();
    }
  }

  static String connectionId(ConnectionString cs) {
    String hosts = String.join(",", cs.getHosts());
    return cs.getDatabase() == null ? "mongo:" + hosts : "mongo:" + hosts + "/" + cs.getDatabase();
  }

  private static ExecutorService defaultExecutor() {
    AtomicInteger n = new AtomicInteger();
    ThreadFactory tf = r -> {
      Thread t = new Thread(r, "docclients-mongo-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
    return Executors.newCachedThreadPool(tf);
  }
}
