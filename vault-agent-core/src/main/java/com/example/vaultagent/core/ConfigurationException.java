package com.example.vaultagent.core;

/** Invalid TTL, capacity, refresh buffer or interval supplied at construction time. */
public class ConfigurationException extends VaultAgentException {

  public ConfigurationException(final String message) {
    super(message);
  }

  public ConfigurationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
