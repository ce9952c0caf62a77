package io.intellixity.docclients;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable request to register a named client.\n
 *
 * - uri: connection string; null means "not yet configured"\n
 * - options: driver-specific settings, merged over the driver defaults by the registry\n
 */
public record ClientConfig(String uri, Map<String, Object> options) {

  public ClientConfig {
    options = copyOptions(options);
  }

  public static ClientConfig of(String uri) {
    return new ClientConfig(uri, Map.of());
  }

  public static ClientConfig of(String uri, Map<String, ?> options) {
    return new ClientConfig(uri, copyOptions(options));
  }

  /** Returns a copy with {@code overrides} applied key by key over this config's options. */
  public ClientConfig mergedWith(ClientConfig overrides) {
    if (overrides == null) return this;
    Map<String, Object> merged = new LinkedHashMap<>(options);
    merged.putAll(overrides.options());
    return new ClientConfig(overrides.uri(), merged);
  }

  static Map<String, Object> copyOptions(Map<String, ?> in) {
    if (in == null || in.isEmpty()) return Map.of();
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : in.entrySet()) {
      if (e.getKey() == null) throw new IllegalArgumentException("Client option key must not be null");
      if (e.getValue() == null) throw new IllegalArgumentException("Client option '" + e.getKey() + "' must not be null");
      out.put(e.getKey(), e.getValue());
    }
    return Collections.unmodifiableMap(out);
  }
}
