package com.example.vaultagent.core.secrets;

/**
 * Cache key for broker lookups.
 *
 * @param kind what was looked up
 * @param path secret path or role name
 * @param version KV version, or null for the latest
 */
public record SecretKey(Kind kind, String path, String version) {

  /** Lookup kinds sharing the broker cache. */
  public enum Kind {
    KV,
    LIST,
    STATIC_CREDENTIAL
  }

  static SecretKey kv(final String path, final String version) {
    return new SecretKey(Kind.KV, path, version);
  }

  static SecretKey list(final String path) {
    return new SecretKey(Kind.LIST, path, null);
  }

  static SecretKey staticCredential(final String role) {
    return new SecretKey(Kind.STATIC_CREDENTIAL, role, null);
  }
}
