package com.example.vaultagent.core.secrets;

import static java.lang.System.Logger.Level.WARNING;

import com.example.vaultagent.core.ConfigurationException;
import com.example.vaultagent.core.secrets.SecretStoreException.Reason;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * {@link SecretStore} decorator that bounds every call by a timeout.
 *
 * <p>A call that exceeds the bound fails with {@link Reason#TIMEOUT}. The underlying call is not
 * interrupted; it is left to finish on its worker thread and its result is discarded.
 *
 * <p>At most {@code maxInFlight} calls run at once, timed-out ones included. A call arriving while
 * every worker is busy fails straight away with {@link Reason#UNAVAILABLE}.
 */
public final class TimeBoundedSecretStore implements SecretStore, AutoCloseable {

  private static final System.Logger logger =
      System.getLogger(TimeBoundedSecretStore.class.getName());

  private static final AtomicInteger THREAD_IDS = new AtomicInteger();

  /** Worker cap used when none is given. */
  public static final int DEFAULT_MAX_IN_FLIGHT = 16;

  private final SecretStore delegate;
  private final Duration timeout;
  private final ExecutorService executor;

  /**
   * @param delegate store performing the calls
   * @param timeout per-call bound, positive
   */
  public TimeBoundedSecretStore(final SecretStore delegate, final Duration timeout) {
    this(delegate, timeout, DEFAULT_MAX_IN_FLIGHT);
  }

  /**
   * @param delegate store performing the calls
   * @param timeout per-call bound, positive
   * @param maxInFlight worker threads, at least 1
   */
  public TimeBoundedSecretStore(
      final SecretStore delegate, final Duration timeout, final int maxInFlight) {
    if (timeout == null || timeout.isZero() || timeout.isNegative())
      throw new ConfigurationException("call timeout must be positive, was " + timeout);
    if (maxInFlight < 1)
      throw new ConfigurationException("maxInFlight must be >= 1, was " + maxInFlight);
    this.delegate = delegate;
    this.timeout = timeout;
    this.executor =
        new ThreadPoolExecutor(
            0,
            maxInFlight,
            60L,
            TimeUnit.SECONDS,
            new SynchronousQueue<>(),
            r -> {
              final var t = new Thread(r, "vault-agent-store-" + THREAD_IDS.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  @Override
  public Session login(final String roleId, final String secretId) {
    return call("login", () -> delegate.login(roleId, secretId));
  }

  @Override
  public SecretValue read(final String token, final String path, final String version) {
    return call("read " + path, () -> delegate.read(token, path, version));
  }

  @Override
  public List<String> list(final String token, final String path) {
    return call("list " + path, () -> delegate.list(token, path));
  }

  @Override
  public DatabaseLease issueCredential(final String token, final String role) {
    return call("issue credential for " + role, () -> delegate.issueCredential(token, role));
  }

  @Override
  public StaticCredential staticCredential(final String token, final String role) {
    return call("static credential for " + role, () -> delegate.staticCredential(token, role));
  }

  /** Stops the worker threads and closes the delegate when it is {@link AutoCloseable}. */
  @Override
  public void close() {
    executor.shutdown();
    if (delegate instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (final Exception e) {
        logger.log(WARNING, "Failed to close secret store", e);
      }
    }
  }

  private <T> T call(final String operation, final Supplier<T> body) {
    final CompletableFuture<T> future;
    try {
      future = CompletableFuture.supplyAsync(body, executor);
    } catch (final RejectedExecutionException e) {
      logger.log(WARNING, "Secret store call ''{0}'' rejected, all workers busy", operation);
      throw new SecretStoreException(
          Reason.UNAVAILABLE, operation + " rejected: too many calls in flight", e);
    }
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final TimeoutException e) {
      logger.log(WARNING, "Secret store call ''{0}'' timed out after {1}", operation, timeout);
      throw new SecretStoreException(
          Reason.TIMEOUT, operation + " timed out after " + timeout.toMillis() + "ms", e);
    } catch (final ExecutionException e) {
      final var cause = e.getCause();
      if (cause instanceof RuntimeException re) throw re;
      if (cause instanceof Error err) throw err;
      throw new SecretStoreException(Reason.UNAVAILABLE, operation + " failed", cause);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SecretStoreException(Reason.UNAVAILABLE, operation + " interrupted", e);
    }
  }
}
