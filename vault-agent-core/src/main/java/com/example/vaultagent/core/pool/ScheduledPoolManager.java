package com.example.vaultagent.core.pool;

import com.example.vaultagent.core.secrets.Credential;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Pool manager refreshed by a background {@link RefreshScheduler}. Borrows never wait for
 * credential I/O.
 *
 * <pre>{@code
 * var manager = client.scheduledPool("orders-rw", new DataSourcePoolFactory(hikariProvider));
 * manager.start();
 * try (var borrowed = manager.borrow(); var conn = borrowed.pool().getConnection()) {
 *   ...
 * }
 * manager.stop();
 * }</pre>
 *
 * @param <P> pool type
 */
public final class ScheduledPoolManager<P> implements PoolManager<P> {

  private final PoolCoordinator<P> coordinator;
  private final RefreshScheduler scheduler;

  public ScheduledPoolManager(
      final PoolCoordinator<P> coordinator, final RefreshScheduler scheduler) {
    this.coordinator = coordinator;
    this.scheduler = scheduler;
  }

  /**
   * Adopts an initial pool synchronously, then starts background refresh.
   *
   * @throws com.example.vaultagent.core.VaultAgentException if the initial pool cannot be created
   */
  public void start() {
    if (coordinator.currentHandle(scheduler.role()).isEmpty()) scheduler.refreshNow();
    scheduler.start();
  }

  /** Stops background refresh, letting an in-flight refresh complete. The pool keeps serving. */
  public void stop() {
    scheduler.stop();
  }

  public void onRefresh(final Consumer<Credential> listener) {
    scheduler.onRefresh(listener);
  }

  public RefreshStatus status() {
    return scheduler.status();
  }

  @Override
  public String role() {
    return scheduler.role();
  }

  @Override
  public BorrowedPool<P> borrow() {
    return coordinator.borrow(scheduler.role());
  }

  @Override
  public Credential refreshNow() {
    return scheduler.refreshNow();
  }

  @Override
  public Optional<Credential> currentCredential() {
    return coordinator.currentHandle(scheduler.role()).map(PoolHandle::credential);
  }

  /** Stops refresh and closes every pool. */
  @Override
  public void close() {
    scheduler.stop();
    coordinator.close();
  }
}
