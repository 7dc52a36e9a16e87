package com.example.vaultagent.core;

/** A freshly built pool failed its validation probe and was discarded. */
public class ValidationException extends VaultAgentException {

  public ValidationException(final String message) {
    super(message);
  }

  public ValidationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
