package io.intellixity.docclients;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate failure of {@link ClientRegistry#disconnectAll(boolean)} under {@link DisconnectPolicy#ATTEMPT_ALL}.\n
 *
 * Every entry was attempted; {@link #failures()} lists the ones whose close failed, in disconnect order.\n
 */
public final class DisconnectAllException extends RuntimeException {
  private final Map<String, Throwable> failures;

  public DisconnectAllException(Map<String, Throwable> failures) {
    super("Failed to disconnect clients: " + failures.keySet());
    this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    for (Throwable t : this.failures.values()) addSuppressed(t);
  }

  public Map<String, Throwable> failures() {
    return failures;
  }
}
