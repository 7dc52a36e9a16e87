package com.example.vaultagent.core.pool;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.vaultagent.core.ValidationException;
import com.example.vaultagent.core.secrets.Credential;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the pools of one or more roles and replaces them when credentials change.
 *
 * <p>{@link #adopt(String, Credential)} builds and validates a new pool before publishing it with a
 * single atomic reference swap, so borrowers never observe a half-built pool. The replaced handle
 * drains: it takes no new borrows and is closed once the borrows it already handed out are
 * returned. A pool that fails validation is closed and the current one keeps serving.
 *
 * @param <P> pool type
 */
public final class PoolCoordinator<P> implements AutoCloseable {

  private static final System.Logger logger = System.getLogger(PoolCoordinator.class.getName());

  private final PoolFactory<P> factory;
  private final String validationProbe;
  private final ConcurrentHashMap<String, AtomicReference<PoolHandle<P>>> active =
      new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Object> adoptLocks = new ConcurrentHashMap<>();
  private final Set<PoolHandle<P>> draining = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * @param factory builds, validates and closes pools
   * @param validationProbe probe passed to {@link PoolFactory#validate(Object, String)}
   */
  public PoolCoordinator(final PoolFactory<P> factory, final String validationProbe) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.validationProbe = Objects.requireNonNull(validationProbe, "validationProbe");
  }

  /**
   * @param role role name
   * @return the active handle of the role, if a pool was adopted
   */
  public Optional<PoolHandle<P>> currentHandle(final String role) {
    return Optional.ofNullable(slot(role).get());
  }

  /**
   * Builds and validates a pool for {@code credential} and makes it the active pool of the role.
   *
   * @param role role name
   * @param credential credential for the new pool
   * @return the new active handle
   * @throws ValidationException if the pool cannot be built or fails validation; the previous
   *     handle stays active
   * @throws IllegalStateException if the coordinator is closed
   */
  public PoolHandle<P> adopt(final String role, final Credential credential) {
    synchronized (adoptLocks.computeIfAbsent(role, r -> new Object())) {
      ensureOpen();

      final P pool;
      try {
        pool = factory.build(credential);
      } catch (final RuntimeException e) {
        throw new ValidationException("Failed to build pool for role " + role, e);
      }

      if (!validate(pool)) {
        closePool(pool);
        throw new ValidationException(
            "New pool for role " + role + " failed validation probe, keeping current pool");
      }

      if (closed.get()) {
        closePool(pool);
        throw new IllegalStateException("Pool coordinator closed while adopting for role " + role);
      }

      final var handle = new PoolHandle<>(role, pool, credential, this::onRetired);
      final var ref = slot(role);
      final var previous = ref.getAndSet(handle);
      if (previous != null) {
        draining.add(previous);
        previous.drain();
      }
      // close() may have swept the slots between the check above and the swap.
      if (closed.get()) {
        if (ref.compareAndSet(handle, null)) handle.retireNow();
        if (previous != null) previous.retireNow();
        throw new IllegalStateException("Pool coordinator closed while adopting for role " + role);
      }
      logger.log(INFO, "Adopted pool for role {0} with lease {1}", role, credential.leaseId());
      return handle;
    }
  }

  /**
   * Borrows the active pool of the role. Never returns a draining or retired pool.
   *
   * @param role role name
   * @return scoped borrow, to be closed when done
   * @throws IllegalStateException if no pool was adopted for the role or the coordinator is closed
   */
  public BorrowedPool<P> borrow(final String role) {
    final var ref = slot(role);
    while (true) {
      ensureOpen();
      final var handle = ref.get();
      if (handle == null) throw new IllegalStateException("No active pool for role " + role);
      if (handle.tryAcquire()) return new BorrowedPool<>(handle);
      logger.log(DEBUG, "Pool for role {0} was swapped while borrowing, retrying", role);
    }
  }

  /**
   * @return handles replaced but still serving outstanding borrows
   */
  public List<PoolHandle<P>> drainingHandles() {
    return List.copyOf(draining);
  }

  /** Closes every active and draining pool. Outstanding borrows are not waited for. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;
    for (final var ref : active.values()) {
      final var handle = ref.getAndSet(null);
      if (handle != null) handle.retireNow();
    }
    for (final var handle : List.copyOf(draining)) handle.retireNow();
  }

  private AtomicReference<PoolHandle<P>> slot(final String role) {
    return active.computeIfAbsent(role, r -> new AtomicReference<>());
  }

  private boolean validate(final P pool) {
    try {
      return factory.validate(pool, validationProbe);
    } catch (final RuntimeException e) {
      logger.log(WARNING, "Validation probe threw", e);
      return false;
    }
  }

  private void onRetired(final PoolHandle<P> handle) {
    draining.remove(handle);
    closePool(handle.pool());
    logger.log(
        INFO,
        "Retired pool for role {0} with lease {1}",
        handle.role(),
        handle.credential().leaseId());
  }

  private void closePool(final P pool) {
    try {
      factory.close(pool);
    } catch (final RuntimeException e) {
      logger.log(WARNING, "Failed to close pool", e);
    }
  }

  private void ensureOpen() {
    if (closed.get()) throw new IllegalStateException("Pool coordinator is closed");
  }
}
