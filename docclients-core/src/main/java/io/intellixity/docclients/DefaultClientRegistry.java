package io.intellixity.docclients;

import io.intellixity.docclients.spi.ConnectionDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * {@link ClientRegistry} backed by an insertion-ordered map guarded by this instance's monitor.\n
 *
 * - map mutations are synchronous and atomic; the monitor is never held across driver calls\n
 * - first connects per name are collapsed through an in-flight future table\n
 * - closes per name are collapsed the same way; a connect issued during a close waits for it\n
 * - futures handed to callers complete with the unwrapped cause and are detached from the shared ones\n
 * - driver continuations run on whatever thread completes the driver's future\n
 */
public final class DefaultClientRegistry<C> implements ClientRegistry<C> {
  private static final Logger log = LoggerFactory.getLogger(DefaultClientRegistry.class);

  private final ConnectionDriver<C> driver;
  private final DisconnectPolicy policy;
  private final ClientConfig defaults;

  private final LinkedHashMap<String, Client<C>> clients = new LinkedHashMap<>();
  private final Map<String, CompletableFuture<C>> connecting = new HashMap<>();
  private final Map<String, CompletableFuture<Void>> closing = new HashMap<>();

  public DefaultClientRegistry(ConnectionDriver<C> driver, DisconnectPolicy policy) {
    this.driver = Objects.requireNonNull(driver, "driver");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.defaults = new ClientConfig(null, driver.defaultOptions());
  }

  public static <C> DefaultClientRegistry<C> create(ConnectionDriver<C> driver) {
    return new DefaultClientRegistry<>(driver, DisconnectPolicy.ATTEMPT_ALL);
  }

  public static <C> DefaultClientRegistry<C> create(ConnectionDriver<C> driver, DisconnectPolicy policy) {
    return new DefaultClientRegistry<>(driver, policy);
  }

  @Override
  public ClientConfig defaults() {
    return defaults;
  }

  @Override
  public DisconnectPolicy policy() {
    return policy;
  }

  @Override
  public Client<C> add(String name, ClientConfig config) {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("Client name must not be null or blank");
    if (config == null) throw new IllegalArgumentException("Client config must not be null (client '" + name + "')");

    ClientConfig merged = defaults.mergedWith(config);
    synchronized (this) {
      Client<C> prev = clients.get(name);
      Client<C> client = Client.of(name, merged, prev == null ? null : prev.connection());
      clients.put(name, client);
      return client;
    }
  }

  @Override
  public synchronized C connection(String name) {
    Client<C> c = (name == null) ? null : clients.get(name);
    return c == null ? null : c.connection();
  }

  @Override
  public synchronized Client<C> get(String name) {
    return name == null ? null : clients.get(name);
  }

  @Override
  public CompletableFuture<C> connect(String name) {
    CompletableFuture<C> attempt;
    Client<C> client;
    synchronized (this) {
      client = (name == null) ? null : clients.get(name);
      if (client == null) return CompletableFuture.failedFuture(new UnknownClientException(name));
      CompletableFuture<Void> closingNow = closing.get(name);
      if (closingNow != null) {
        // The held handle is on its way out; connect again once the close settles.
        log.debug("docclients.connect client={} driver={} afterClose=true", name, driver.id());
        return relay(closingNow.handle((v, err) -> null).thenCompose(ignored -> connect(name)));
      }
      if (client.connected()) {
        log.debug("docclients.connect client={} driver={} reuse=true", name, driver.id());
        return CompletableFuture.completedFuture(client.connection());
      }
      CompletableFuture<C> pending = connecting.get(name);
      if (pending != null) {
        log.debug("docclients.connect client={} driver={} joinPending=true", name, driver.id());
        return relay(pending);
      }
      attempt = new CompletableFuture<>();
      connecting.put(name, attempt);
    }

    log.debug("docclients.connect client={} driver={} reuse=false", name, driver.id());
    invoke(() -> driver.establish(client.uri(), client.options()))
        .whenComplete((conn, err) -> onEstablished(name, attempt, conn, err));
    return relay(attempt);
  }

  private void onEstablished(String name, CompletableFuture<C> attempt, C conn, Throwable err) {
    Throwable cause = unwrap(err);
    boolean orphaned = false;
    synchronized (this) {
      connecting.remove(name, attempt);
      if (cause == null && conn == null) {
        cause = new ClientConnectionException("Driver '" + driver.id() + "' returned no connection for client '" + name + "'");
      }
      if (cause == null) {
        Client<C> current = clients.get(name);
        if (current == null) {
          orphaned = true;
        } else {
          clients.put(name, current.withConnection(conn));
        }
      }
    }

    if (cause != null) {
      log.warn("docclients.connect_failed client={} driver={} error={}", name, driver.id(), cause.toString());
      attempt.completeExceptionally(cause);
      return;
    }
    if (orphaned) {
      // Removed while establishing: nobody owns this connection anymore.
      log.debug("docclients.connect client={} state=removed_while_connecting", name);
      invoke(() -> driver.close(conn, true)).whenComplete((v, closeErr) -> {
        if (closeErr != null) {
          log.warn("docclients.disconnect_failed client={} driver={} error={}", name, driver.id(), unwrap(closeErr).toString());
        }
        attempt.completeExceptionally(new UnknownClientException(name));
      });
      return;
    }
    attempt.complete(conn);
  }

  @Override
  public CompletableFuture<Void> disconnect(String name, boolean force) {
    CompletableFuture<C> pending;
    synchronized (this) {
      if (name == null || !clients.containsKey(name)) {
        return CompletableFuture.failedFuture(new UnknownClientException(name));
      }
      pending = connecting.get(name);
    }
    if (pending != null) {
      // Let the pending connect settle, then close whatever it produced.
      return relay(pending.handle((c, err) -> null).thenCompose(ignored -> closeHeld(name, force)));
    }
    return closeHeld(name, force);
  }

  private CompletableFuture<Void> closeHeld(String name, boolean force) {
    C conn;
    CompletableFuture<Void> done;
    synchronized (this) {
      Client<C> client = clients.get(name);
      if (client == null) return CompletableFuture.failedFuture(new UnknownClientException(name));
      CompletableFuture<Void> inFlight = closing.get(name);
      if (inFlight != null) {
        log.debug("docclients.disconnect client={} driver={} joinPending=true", name, driver.id());
        return relay(inFlight);
      }
      conn = client.connection();
      if (conn == null) {
        log.debug("docclients.disconnect client={} state=already_disconnected", name);
        return CompletableFuture.completedFuture(null);
      }
      done = new CompletableFuture<>();
      closing.put(name, done);
    }

    log.debug("docclients.disconnect client={} driver={} force={}", name, driver.id(), force);
    invoke(() -> driver.close(conn, force)).whenComplete((v, err) -> {
      releaseConnection(name, conn, done);
      if (err != null) {
        Throwable cause = unwrap(err);
        log.warn("docclients.disconnect_failed client={} driver={} error={}", name, driver.id(), cause.toString());
        done.completeExceptionally(cause);
      } else {
        done.complete(null);
      }
    });
    return relay(done);
  }

  private synchronized void releaseConnection(String name, C conn, CompletableFuture<Void> close) {
    closing.remove(name, close);
    Client<C> current = clients.get(name);
    // A re-add keeps the handle, so compare by identity before clearing.
    if (current != null && current.connection() == conn) {
      clients.put(name, current.withConnection(null));
    }
  }

  @Override
  public CompletableFuture<Void> disconnectAll(boolean force) {
    List<String> names = keys();
    Map<String, Throwable> failures = new LinkedHashMap<>();

    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
    for (String name : names) {
      chain = chain.thenCompose(v -> {
        if (!has(name)) return CompletableFuture.<Void>completedFuture(null);
        CompletableFuture<Void> one = disconnect(name, force);
        if (policy == DisconnectPolicy.FAIL_FAST) return one;
        return one.<Void>handle((ok, err) -> {
          if (err != null) failures.put(name, unwrap(err));
          return null;
        });
      });
    }

    CompletableFuture<Void> result = new CompletableFuture<>();
    chain.whenComplete((v, err) -> {
      if (err != null) {
        result.completeExceptionally(unwrap(err));
      } else if (!failures.isEmpty()) {
        result.completeExceptionally(new DisconnectAllException(failures));
      } else {
        result.complete(null);
      }
    });
    return result;
  }

  @Override
  public CompletableFuture<Client<C>> remove(String name, boolean force) {
    if (!has(name)) return CompletableFuture.completedFuture(null);

    CompletableFuture<Client<C>> result = new CompletableFuture<>();
    disconnect(name, force).whenComplete((v, err) -> {
      Client<C> removed;
      synchronized (this) {
        removed = clients.remove(name);
      }
      if (removed != null && removed.connected()) removed = removed.withConnection(null);
      if (err != null) {
        result.completeExceptionally(unwrap(err));
      } else {
        result.complete(removed);
      }
    });
    return result;
  }

  @Override
  public synchronized boolean has(String name) {
    return name != null && clients.containsKey(name);
  }

  @Override
  public synchronized int size() {
    return clients.size();
  }

  @Override
  public synchronized List<String> keys() {
    return List.copyOf(clients.keySet());
  }

  @Override
  public synchronized List<Client<C>> values() {
    return List.copyOf(clients.values());
  }

  @Override
  public synchronized List<Map.Entry<String, Client<C>>> entries() {
    List<Map.Entry<String, Client<C>>> out = new ArrayList<>(clients.size());
    for (var e : clients.entrySet()) out.add(Map.entry(e.getKey(), e.getValue()));
    return Collections.unmodifiableList(out);
  }

  @Override
  public synchronized Map<String, Client<C>> asMap() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(clients));
  }

  private static <T> CompletableFuture<T> relay(CompletableFuture<T> source) {
    CompletableFuture<T> out = new CompletableFuture<>();
    source.whenComplete((v, err) -> {
      if (err != null) {
        out.completeExceptionally(unwrap(err));
      } else {
        out.complete(v);
      }
    });
    return out;
  }

  private static <T> CompletableFuture<T> invoke(DriverCall<T> call) {
    try {
      CompletableFuture<T> f = call.run();
      if (f == null) return CompletableFuture.failedFuture(new ClientConnectionException("Driver returned no future"));
      return f;
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  static Throwable unwrap(Throwable t) {
    Throwable cur = t;
    while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
      cur = cur.getCause();
    }
    return cur;
  }

  @FunctionalInterface
  private interface DriverCall<T> {
    CompletableFuture<T> run();
  }
}
