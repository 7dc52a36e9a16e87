package com.example.vaultagent.core.secrets;

/** Failure reported by a {@link SecretStore}. */
public class SecretStoreException extends RuntimeException {

  /** Failure classes a store can report. */
  public enum Reason {
    /** Token missing, expired or lacking permission. */
    UNAUTHORIZED,
    /** No such path or role. */
    NOT_FOUND,
    /** Store unreachable or answering with a server error. */
    UNAVAILABLE,
    /** Call did not complete within its time bound. */
    TIMEOUT
  }

  private final Reason reason;

  public SecretStoreException(final Reason reason, final String message) {
    super(message);
    this.reason = reason;
  }

  public SecretStoreException(final Reason reason, final String message, final Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
