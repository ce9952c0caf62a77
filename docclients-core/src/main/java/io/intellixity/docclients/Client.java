package io.intellixity.docclients;

import java.util.Map;
import java.util.Objects;

/**
 * Registry entry: a named {@link ClientConfig} (already merged over driver defaults) plus the live connection, if any.
 * <p>
 * Instances are snapshots. The registry replaces the stored entry on every state change, so a {@code Client} obtained
 * earlier does not observe later connects or disconnects.
 */
public record Client<C>(String name, String uri, Map<String, Object> options, C connection) {

  public Client {
    Objects.requireNonNull(name, "name");
    options = ClientConfig.copyOptions(options);
  }

  static <C> Client<C> of(String name, ClientConfig config, C connection) {
    return new Client<>(name, config.uri(), config.options(), connection);
  }

  /** True while the registry holds a live connection for this entry. */
  public boolean connected() {
    return connection != null;
  }

  public ClientConfig config() {
    return new ClientConfig(uri, options);
  }

  public Client<C> withConnection(C connection) {
    return new Client<>(name, uri, options, connection);
  }
}
