package com.example.vaultagent.core;

/** The secret store reports no secret at the requested path, or no such role. */
public class SecretNotFoundException extends VaultAgentException {

  public SecretNotFoundException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
