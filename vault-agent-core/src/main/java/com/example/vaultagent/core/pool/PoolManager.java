package com.example.vaultagent.core.pool;

import com.example.vaultagent.core.secrets.Credential;
import java.util.Optional;

/**
 * Keeps the pool of one database role backed by valid credentials.
 *
 * @param <P> pool type
 */
public interface PoolManager<P> extends AutoCloseable {

  String role();

  /**
   * Borrows the active pool. Close the result to return it.
   *
   * @return scoped borrow of the active pool
   */
  BorrowedPool<P> borrow();

  /**
   * Issues a new credential and adopts a pool built from it, regardless of the current lease.
   *
   * @return the credential now backing the active pool
   */
  Credential refreshNow();

  /**
   * @return the credential of the active pool, if any
   */
  Optional<Credential> currentCredential();

  @Override
  void close();
}
