package com.example.vaultagent.core.pool;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.vaultagent.core.ConfigurationException;
import com.example.vaultagent.core.secrets.Credential;
import com.example.vaultagent.core.secrets.CredentialBroker;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Renews the credential of one role before its lease runs out and hands it to a {@link
 * PoolCoordinator}.
 *
 * <p>Every {@code checkInterval} the scheduler checks whether {@code issuedAt + leaseDuration *
 * refreshBuffer} has passed and, if so, issues a new credential and adopts a pool built from it.
 * A failed refresh is recorded in {@link #status()} and retried on the next tick; the current pool
 * keeps serving.
 *
 * <p>Scheduled and manual refreshes of the same role never overlap. {@link #stop()} is
 * cooperative: a refresh already running completes, nothing starts afterwards, and no in-flight
 * call is interrupted.
 */
public final class RefreshScheduler implements AutoCloseable {

  private static final System.Logger logger = System.getLogger(RefreshScheduler.class.getName());

  private final String role;
  private final CredentialBroker broker;
  private final PoolCoordinator<?> coordinator;
  private final double refreshBuffer;
  private final Duration checkInterval;
  private final Clock clock;

  private final ReentrantLock refreshLock = new ReentrantLock();
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean stopped = new AtomicBoolean(false);
  private final AtomicReference<RefreshStatus> status =
      new AtomicReference<>(RefreshStatus.INITIAL);
  private final List<Consumer<Credential>> listeners = new CopyOnWriteArrayList<>();

  private volatile ScheduledExecutorService executor;

  public RefreshScheduler(
      final String role,
      final CredentialBroker broker,
      final PoolCoordinator<?> coordinator,
      final double refreshBuffer,
      final Duration checkInterval,
      final Clock clock) {
    if (!(refreshBuffer > 0.0 && refreshBuffer <= 1.0))
      throw new ConfigurationException("refreshBuffer must be in (0, 1], was " + refreshBuffer);
    if (checkInterval == null || checkInterval.isZero() || checkInterval.isNegative())
      throw new ConfigurationException("checkInterval must be positive, was " + checkInterval);
    this.role = Objects.requireNonNull(role, "role");
    this.broker = Objects.requireNonNull(broker, "broker");
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    this.refreshBuffer = refreshBuffer;
    this.checkInterval = checkInterval;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Registers a callback invoked with every credential successfully adopted.
   *
   * @param listener callback; exceptions it throws are logged and ignored
   */
  public void onRefresh(final Consumer<Credential> listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  /**
   * Starts the background timer. The first check runs after one interval.
   *
   * @throws IllegalStateException if already started or stopped
   */
  public void start() {
    if (stopped.get()) throw new IllegalStateException("Refresh scheduler is stopped");
    if (!started.compareAndSet(false, true))
      throw new IllegalStateException("Refresh scheduler already started");

    final var scheduler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              final var t = new Thread(r, "RefreshScheduler-" + role);
              t.setDaemon(true);
              return t;
            });
    executor = scheduler;
    final var millis = checkInterval.toMillis();
    scheduler.scheduleAtFixedRate(this::tick, millis, millis, TimeUnit.MILLISECONDS);
    logger.log(INFO, "Started credential refresh for role {0} every {1}", role, checkInterval);
  }

  /**
   * Whether the active credential has reached its refresh point. True when there is none.
   *
   * @return true if a refresh is due
   */
  public boolean isRefreshDue() {
    return coordinator
        .currentHandle(role)
        .map(handle -> handle.credential().isDueForRefresh(clock.instant(), refreshBuffer))
        .orElse(true);
  }

  /** One timer tick. Never throws. */
  void tick() {
    if (stopped.get()) return;
    if (!refreshLock.tryLock()) {
      logger.log(DEBUG, "Refresh for role {0} already running, skipping tick", role);
      return;
    }
    try {
      if (stopped.get() || !isRefreshDue()) return;
      refreshLocked();
    } catch (final RuntimeException e) {
      logger.log(
          WARNING,
          "Scheduled refresh for role {0} failed, keeping current pool: {1}",
          role,
          e.getMessage());
    } finally {
      refreshLock.unlock();
    }
  }

  /**
   * Refreshes immediately, waiting for a scheduled refresh of the same role to finish first.
   *
   * @return the newly adopted credential
   * @throws IllegalStateException if the scheduler is stopped
   * @throws RuntimeException the failure of the refresh; it is also recorded in {@link #status()}
   */
  public Credential refreshNow() {
    ensureRunning();
    refreshLock.lock();
    try {
      ensureRunning();
      return refreshLocked();
    } finally {
      refreshLock.unlock();
    }
  }

  /**
   * Stops the timer and waits for a refresh in progress to complete. Idempotent.
   *
   * <p>If the calling thread is interrupted while waiting, the interrupt flag is restored and the
   * method returns without waiting further.
   */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) return;
    final var scheduler = executor;
    try {
      if (scheduler != null) {
        scheduler.shutdown();
        while (!scheduler.awaitTermination(1, TimeUnit.SECONDS)) {
          logger.log(DEBUG, "Waiting for in-flight refresh of role {0}", role);
        }
      }
      refreshLock.lockInterruptibly();
      refreshLock.unlock();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    logger.log(INFO, "Stopped credential refresh for role {0}", role);
  }

  @Override
  public void close() {
    stop();
  }

  public boolean isStopped() {
    return stopped.get();
  }

  public RefreshStatus status() {
    return status.get();
  }

  public String role() {
    return role;
  }

  private Credential refreshLocked() {
    try {
      final var credential = broker.issueCredential(role);
      coordinator.adopt(role, credential);
      status.updateAndGet(s -> s.succeeded(clock.instant()));
      logger.log(
          INFO,
          "Refreshed credential for role {0}, next refresh at {1}",
          role,
          credential.refreshAt(refreshBuffer));
      notifyListeners(credential);
      return credential;
    } catch (final RuntimeException e) {
      status.updateAndGet(s -> s.failed(clock.instant(), e.getMessage()));
      throw e;
    }
  }

  private void notifyListeners(final Credential credential) {
    for (final var listener : listeners) {
      try {
        listener.accept(credential);
      } catch (final RuntimeException e) {
        logger.log(WARNING, "Refresh listener for role " + role + " failed", e);
      }
    }
  }

  private void ensureRunning() {
    if (stopped.get())
      throw new IllegalStateException("Refresh scheduler for role " + role + " is stopped");
  }
}
