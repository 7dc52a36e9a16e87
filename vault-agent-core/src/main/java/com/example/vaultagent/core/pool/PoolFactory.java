package com.example.vaultagent.core.pool;

import com.example.vaultagent.core.secrets.Credential;

/**
 * Builds, validates and closes downstream resource pools for a credential. Supplied by the
 * application, or by the JDBC and R2DBC bindings.
 *
 * @param <P> pool type
 */
public interface PoolFactory<P> {

  /**
   * Creates a new pool authenticating with {@code credential}.
   *
   * @param credential database credential
   * @return the new pool
   */
  P build(Credential credential);

  /**
   * Runs {@code probe} against at least one freshly acquired resource of the pool.
   *
   * @param pool pool to check
   * @param probe validation probe, e.g. {@code SELECT 1}
   * @return true if the pool is usable
   */
  boolean validate(P pool, String probe);

  /**
   * Releases every resource held by the pool.
   *
   * @param pool pool to close
   */
  void close(P pool);
}
