package io.intellixity.docclients.spi;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Backend driver used by the registry to open and close connections.\n
 *
 * Example:\n
 * - Mongo: C is MongoConnection, establish() creates a MongoClient and pings the server\n
 *
 * Failures should be reported as exceptional completion with a
 * {@link io.intellixity.docclients.ClientConnectionException}. A driver that throws instead is treated the same way.\n
 */
public interface ConnectionDriver<C> {
  /** Driver family name (used for logging). */
  String id();

  /** Baseline options every client of this driver starts from. */
  default Map<String, Object> defaultOptions() {
    return Map.of();
  }

  CompletableFuture<C> establish(String uri, Map<String, Object> options);

  /** Close a connection. {@code force} skips draining in-flight operations where the backend supports draining. */
  CompletableFuture<Void> close(C connection, boolean force);
}
