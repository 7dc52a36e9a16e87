package com.example.vaultagent.core;

/**
 * The secret store could not be reached, or did not answer within the configured call timeout.
 */
public class StoreUnavailableException extends VaultAgentException {

  private final boolean timeout;

  public StoreUnavailableException(final String message, final Throwable cause) {
    this(message, cause, false);
  }

  public StoreUnavailableException(
      final String message, final Throwable cause, final boolean timeout) {
    super(message, cause);
    this.timeout = timeout;
  }

  /**
   * @return true when the failure was a call timeout rather than a connectivity error
   */
  public boolean isTimeout() {
    return timeout;
  }
}
