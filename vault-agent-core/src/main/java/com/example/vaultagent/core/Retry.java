package com.example.vaultagent.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Attempt loops used around secret store calls and JDBC connection acquisition.
 *
 * <p>Store calls go through {@link #transientRetry} with a backoff {@link Policy}. JDBC work goes
 * through {@link #onException}, which runs a hook (typically a credential refresh) between
 * attempts.
 */
public final class Retry {

  private static final System.Logger logger = System.getLogger(Retry.class.getName());

  private static final Set<String> AUTH_SQL_STATES = Set.of("28000", "28P01");

  private static final List<String> AUTH_MESSAGES =
      List.of(
          "access denied",
          "authentication failed",
          "invalid password",
          "permission denied",
          "wrong user name or password",
          "is not permitted to log in");

  private static final long EXPONENTIAL_CAP_MILLIS = 30_000L;

  private Retry() {}

  /**
   * JDBC unit of work.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface SqlExceptionSupplier<T> {
    T get() throws SQLException;
  }

  /**
   * How many times to try and how long to wait in between.
   *
   * @param maxAttempts attempts including the first, at least 1
   * @param baseDelayMillis wait before the second attempt
   * @param maxDelayMillis ceiling for any wait, at least {@code baseDelayMillis}
   * @param multiplier growth factor per attempt, 1.0 for a fixed delay
   * @param jitter adds up to 25% random extra wait
   */
  public record Policy(
      int maxAttempts,
      long baseDelayMillis,
      long maxDelayMillis,
      double multiplier,
      boolean jitter) {

    public Policy {
      if (maxAttempts < 1)
        throw new ConfigurationException("maxAttempts must be >= 1, was " + maxAttempts);
      if (baseDelayMillis < 0)
        throw new ConfigurationException("baseDelayMillis must be >= 0, was " + baseDelayMillis);
      if (maxDelayMillis < baseDelayMillis)
        throw new ConfigurationException(
            "maxDelayMillis (" + maxDelayMillis + ") is below baseDelayMillis");
      if (multiplier < 1.0)
        throw new ConfigurationException("multiplier must be >= 1.0, was " + multiplier);
    }

    public static Policy fixed(final int attempts, final long delayMillis) {
      return new Policy(attempts, delayMillis, delayMillis, 1.0, false);
    }

    /** A single attempt. */
    public static Policy none() {
      return fixed(1, 0L);
    }

    /**
     * Doubling waits from {@code baseDelayMillis}, capped at 30 seconds, with jitter.
     *
     * @param attempts attempts including the first
     * @param baseDelayMillis wait before the second attempt
     * @return exponential policy
     */
    public static Policy exponential(final int attempts, final long baseDelayMillis) {
      return new Policy(
          attempts, baseDelayMillis, Math.max(baseDelayMillis, EXPONENTIAL_CAP_MILLIS), 2.0, true);
    }

    /**
     * Wait before the given attempt. The first attempt never waits.
     *
     * @param attempt 1-based attempt number
     * @return wait in milliseconds
     */
    public long calculateDelay(final int attempt) {
      if (attempt < 2) return 0L;
      final var grown = baseDelayMillis * Math.pow(multiplier, attempt - 2.0);
      final var delay = (long) Math.min(grown, (double) maxDelayMillis);
      if (!jitter || delay == 0L) return delay;
      return delay + (long) (delay * 0.25 * ThreadLocalRandom.current().nextDouble());
    }
  }

  /**
   * Runs {@code op} until it succeeds, fails with an error {@code isTransient} rejects, or the
   * policy runs out of attempts.
   *
   * @param op operation
   * @param isTransient whether a failure deserves another attempt
   * @param policy attempts and waits
   * @param <T> result type
   * @return the operation's result
   * @throws RuntimeException the first non-transient failure, or the last transient one
   */
  public static <T> T transientRetry(
      final Supplier<? extends T> op,
      final Predicate<RuntimeException> isTransient,
      final Policy policy) {
    return loop(
        op::get,
        RuntimeException.class,
        isTransient,
        () -> {},
        policy::calculateDelay,
        policy.maxAttempts());
  }

  /**
   * Runs a JDBC unit of work, calling {@code beforeRetry} and trying again while it fails with an
   * exception {@code shouldRetry} accepts.
   *
   * <pre>{@code
   * Connection conn = Retry.onException(
   *     this::borrowConnection, Retry::isAuthError, manager::refreshNow, 2, 0L);
   * }</pre>
   *
   * @param supplier unit of work
   * @param shouldRetry whether a failure deserves another attempt
   * @param beforeRetry runs before every attempt but the first
   * @param maxAttempts attempts including the first, at least 1
   * @param delayMillis fixed wait between attempts
   * @param <T> result type
   * @return the unit of work's result
   * @throws SQLException the first failure {@code shouldRetry} rejects, or the last one
   */
  public static <T> T onException(
      final SqlExceptionSupplier<T> supplier,
      final Predicate<SQLException> shouldRetry,
      final Runnable beforeRetry,
      final int maxAttempts,
      final long delayMillis)
      throws SQLException {
    if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
    return loop(
        supplier::get, SQLException.class, shouldRetry, beforeRetry, n -> delayMillis, maxAttempts);
  }

  /**
   * Whether the database refused the credential: SQLSTATE class 28, or a well-known message,
   * anywhere in the cause chain.
   *
   * @param e failure to inspect, may be null
   * @return true for authentication failures
   */
  public static boolean isAuthError(final SQLException e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof SQLException sql
          && sql.getSQLState() != null
          && AUTH_SQL_STATES.contains(sql.getSQLState())) return true;
      final var msg = t.getMessage();
      if (msg == null) continue;
      final var lower = msg.toLowerCase(Locale.ROOT);
      if (AUTH_MESSAGES.stream().anyMatch(lower::contains)) return true;
    }
    return false;
  }

  @FunctionalInterface
  private interface Attempt<T, E extends Exception> {
    T run() throws E;
  }

  @FunctionalInterface
  private interface Backoff {
    long before(int attempt);
  }

  private static <T, E extends Exception> T loop(
      final Attempt<T, E> attempt,
      final Class<E> failureType,
      final Predicate<? super E> retryable,
      final Runnable beforeRetry,
      final Backoff backoff,
      final int maxAttempts)
      throws E {
    for (var n = 1; ; n++) {
      try {
        return attempt.run();
      } catch (final Exception e) {
        // Attempt only declares E, so anything else is unchecked.
        if (!failureType.isInstance(e)) throw (RuntimeException) e;
        final var failure = failureType.cast(e);
        if (!retryable.test(failure)) throw failure;
        if (n >= maxAttempts) {
          if (n > 1) logger.log(WARNING, "Giving up after {0} attempts: {1}", n, e.getMessage());
          throw failure;
        }
        logger.log(DEBUG, "Attempt {0} failed, retrying: {1}", n, e.getMessage());
        beforeRetry.run();
        pause(backoff.before(n + 1), failure);
      }
    }
  }

  private static <E extends Exception> void pause(final long millis, final E pending) throws E {
    if (millis <= 0) return;
    try {
      Thread.sleep(millis);
    } catch (final InterruptedException ie) {
      Thread.currentThread().interrupt();
      pending.addSuppressed(ie);
      throw pending;
    }
  }
}
