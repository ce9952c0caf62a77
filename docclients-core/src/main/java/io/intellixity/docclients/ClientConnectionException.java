package io.intellixity.docclients;

/**
 * Raised by a {@link io.intellixity.docclients.spi.ConnectionDriver} when a connection cannot be established or closed.
 * <p>
 * The registry never retries and never wraps these; they reach the caller as the cause of the failed future.
 */
public class ClientConnectionException extends RuntimeException {
  public ClientConnectionException(String message) {
    super(message);
  }

  public ClientConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
