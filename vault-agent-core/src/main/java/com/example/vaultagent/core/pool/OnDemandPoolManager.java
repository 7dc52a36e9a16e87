package com.example.vaultagent.core.pool;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.vaultagent.core.ConfigurationException;
import com.example.vaultagent.core.VaultAgentException;
import com.example.vaultagent.core.secrets.Credential;
import com.example.vaultagent.core.secrets.CredentialBroker;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Pool manager without a background thread: every borrow checks the credential first and, when it
 * has reached its refresh point, issues a new one and adopts a fresh pool before lending.
 *
 * <p>The caller that finds the credential stale pays for the refresh; callers arriving meanwhile
 * wait for it rather than refreshing again. If the refresh fails while the current credential has
 * not yet expired, the current pool is lent and the refresh is attempted again on the next borrow.
 *
 * @param <P> pool type
 */
public final class OnDemandPoolManager<P> implements PoolManager<P> {

  private static final System.Logger logger =
      System.getLogger(OnDemandPoolManager.class.getName());

  private final String role;
  private final CredentialBroker broker;
  private final PoolCoordinator<P> coordinator;
  private final double refreshBuffer;
  private final Clock clock;
  private final Object refreshLock = new Object();

  public OnDemandPoolManager(
      final String role,
      final CredentialBroker broker,
      final PoolCoordinator<P> coordinator,
      final double refreshBuffer,
      final Clock clock) {
    if (!(refreshBuffer > 0.0 && refreshBuffer <= 1.0))
      throw new ConfigurationException("refreshBuffer must be in (0, 1], was " + refreshBuffer);
    this.role = Objects.requireNonNull(role, "role");
    this.broker = Objects.requireNonNull(broker, "broker");
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    this.refreshBuffer = refreshBuffer;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public String role() {
    return role;
  }

  @Override
  public BorrowedPool<P> borrow() {
    ensureFresh();
    return coordinator.borrow(role);
  }

  @Override
  public Credential refreshNow() {
    synchronized (refreshLock) {
      return adoptNewCredential();
    }
  }

  @Override
  public Optional<Credential> currentCredential() {
    return coordinator.currentHandle(role).map(PoolHandle::credential);
  }

  @Override
  public void close() {
    coordinator.close();
  }

  private void ensureFresh() {
    if (!needsRefresh(coordinator.currentHandle(role))) return;

    synchronized (refreshLock) {
      final var current = coordinator.currentHandle(role);
      if (!needsRefresh(current)) return;
      try {
        adoptNewCredential();
      } catch (final VaultAgentException e) {
        final var usable =
            current.filter(handle -> !handle.credential().isExpired(clock.instant()));
        if (usable.isEmpty()) throw e;
        logger.log(
            WARNING,
            "Refresh for role {0} failed, lending current pool until {1}: {2}",
            role,
            usable.get().credential().expiresAt(),
            e.getMessage());
      }
    }
  }

  private boolean needsRefresh(final Optional<PoolHandle<P>> handle) {
    return handle
        .map(h -> h.credential().isDueForRefresh(clock.instant(), refreshBuffer))
        .orElse(true);
  }

  private Credential adoptNewCredential() {
    final var credential = broker.issueCredential(role);
    coordinator.adopt(role, credential);
    logger.log(INFO, "Credential for role {0} refreshed on demand", role);
    return credential;
  }
}
