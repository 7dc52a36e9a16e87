package com.example.vaultagent.core;

/**
 * Base type for every failure surfaced by the vault agent.
 *
 * <p>All subtypes are unchecked: a read or credential issuance either returns a value or throws
 * exactly one of them.
 */
public class VaultAgentException extends RuntimeException {

  public VaultAgentException(final String message) {
    super(message);
  }

  public VaultAgentException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
