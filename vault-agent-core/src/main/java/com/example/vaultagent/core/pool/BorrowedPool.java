package com.example.vaultagent.core.pool;

import com.example.vaultagent.core.secrets.Credential;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped access to the active pool of a role. Closing it returns the borrow; a handle replaced
 * meanwhile is retired once its last borrow is returned.
 *
 * <pre>{@code
 * try (var borrowed = manager.borrow()) {
 *   try (var conn = borrowed.pool().getConnection()) {
 *     ...
 *   }
 * }
 * }</pre>
 *
 * @param <P> pool type
 */
public final class BorrowedPool<P> implements AutoCloseable {

  private final PoolHandle<P> handle;
  private final AtomicBoolean released = new AtomicBoolean(false);

  BorrowedPool(final PoolHandle<P> handle) {
    this.handle = handle;
  }

  public P pool() {
    return handle.pool();
  }

  public Credential credential() {
    return handle.credential();
  }

  PoolHandle<P> handle() {
    return handle;
  }

  /** Returns the borrow. Idempotent. */
  @Override
  public void close() {
    if (released.compareAndSet(false, true)) handle.release();
  }
}
