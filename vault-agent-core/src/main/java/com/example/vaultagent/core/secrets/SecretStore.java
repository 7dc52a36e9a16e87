package com.example.vaultagent.core.secrets;

import java.util.List;

/**
 * Authenticated access to a remote secret-management service.
 *
 * <p>Implementations own transport and wire encoding. Every method fails with a {@link
 * SecretStoreException} whose {@link SecretStoreException.Reason reason} tells callers whether to
 * re-authenticate, give up, or retry.
 */
public interface SecretStore {

  /**
   * Logs in with role credentials.
   *
   * @param roleId role identifier
   * @param secretId role secret
   * @return a token and its lease
   */
  Session login(String roleId, String secretId);

  /**
   * Reads a key/value secret.
   *
   * @param token session token
   * @param path secret path
   * @param version secret version, or null for the latest
   * @return the secret payload
   */
  SecretValue read(String token, String path, String version);

  /**
   * Lists secret names under a path prefix.
   *
   * @param token session token
   * @param path path prefix, empty for the root
   * @return secret names
   */
  List<String> list(String token, String path);

  /**
   * Mints a new dynamic database credential.
   *
   * @param token session token
   * @param role database role
   * @return the new lease
   */
  DatabaseLease issueCredential(String token, String role);

  /**
   * Reads the current password of a static database role. Does not mint a lease.
   *
   * @param token session token
   * @param role static database role
   * @return current static credential
   */
  StaticCredential staticCredential(String token, String role);
}
