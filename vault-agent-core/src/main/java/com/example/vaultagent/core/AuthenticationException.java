package com.example.vaultagent.core;

/** Login or re-authentication against the secret store failed. */
public class AuthenticationException extends VaultAgentException {

  public AuthenticationException(final String message) {
    super(message);
  }

  public AuthenticationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
