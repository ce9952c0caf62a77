package io.intellixity.docclients;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Named clients and their connection lifecycle.\n
 *
 * Lifecycle per name: {@link #add} registers (disconnected), {@link #connect} opens or reuses, {@link #disconnect}
 * closes. Read accessors are total and return insertion-ordered snapshots.\n
 *
 * @param <C> driver connection handle type
 */
public interface ClientRegistry<C> {

  /** Default config new clients are merged over: null uri plus the driver's default options. */
  ClientConfig defaults();

  /**
   * Adds or replaces a named client. Options are merged over {@link #defaults()} only, never over the previously
   * stored options. A connection already held under {@code name} is kept.
   *
   * @throws IllegalArgumentException if name is null/blank or config is null (registry left unchanged)
   */
  Client<C> add(String name, ClientConfig config);

  /** Live connection for {@code name}, or null if unknown or disconnected. */
  C connection(String name);

  /** Current entry for {@code name}, or null if unknown. */
  Client<C> get(String name);

  /**
   * Connects {@code name}, reusing the held connection if there is one. Concurrent first connects share one driver call.
   * Fails with {@link UnknownClientException} for unregistered names, or with the driver's error.
   */
  CompletableFuture<C> connect(String name);

  default CompletableFuture<Void> disconnect(String name) {
    return disconnect(name, false);
  }

  /**
   * Closes the connection held for {@code name}. No-op if not connected. The entry is cleared even if the driver fails
   * to close; that failure is still propagated.
   */
  CompletableFuture<Void> disconnect(String name, boolean force);

  default CompletableFuture<Void> disconnectAll() {
    return disconnectAll(false);
  }

  /** Disconnects every client, one at a time, in insertion order. Failure handling follows {@link #policy()}. */
  CompletableFuture<Void> disconnectAll(boolean force);

  default CompletableFuture<Client<C>> remove(String name) {
    return remove(name, false);
  }

  /** Disconnects and drops {@code name}; completes with the dropped entry, or null if unknown. */
  CompletableFuture<Client<C>> remove(String name, boolean force);

  DisconnectPolicy policy();

  boolean has(String name);

  int size();

  default boolean isEmpty() {
    return size() == 0;
  }

  List<String> keys();

  List<Client<C>> values();

  List<Map.Entry<String, Client<C>>> entries();

  /** Immutable, insertion-ordered snapshot of all entries. */
  Map<String, Client<C>> asMap();
}
