package io.intellixity.docclients;

/** How {@link ClientRegistry#disconnectAll(boolean)} reacts when one client fails to disconnect. */
public enum DisconnectPolicy {
  /** Attempt every client, then fail with a {@link DisconnectAllException} listing the failures. */
  ATTEMPT_ALL,

  /** Stop at the first failure and propagate it; later clients keep their connections. */
  FAIL_FAST
}
