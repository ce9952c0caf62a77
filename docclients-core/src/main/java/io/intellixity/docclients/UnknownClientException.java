package io.intellixity.docclients;

/** Raised when a lifecycle operation names a client that was never added to the registry. */
public final class UnknownClientException extends RuntimeException {
  private final String clientName;

  public UnknownClientException(String clientName) {
    super("Unknown client: " + clientName);
    this.clientName = clientName;
  }

  public String clientName() {
    return clientName;
  }
}
