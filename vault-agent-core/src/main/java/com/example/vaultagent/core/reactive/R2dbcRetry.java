package com.example.vaultagent.core.reactive;

import com.example.vaultagent.core.Retry;
import io.r2dbc.spi.R2dbcException;
import io.r2dbc.spi.R2dbcTransientResourceException;
import java.time.Duration;
import java.util.Locale;
import java.util.function.Predicate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.RetryBackoffSpec;

/**
 * Reactive counterparts of the {@link Retry} helpers for R2DBC.
 *
 * <pre>{@code
 * var detector = R2dbcRetry.AuthErrorDetector.defaultDetector()
 *     .or(R2dbcRetry.AuthErrorDetector.custom(t -> t.getMessage().contains("FATAL: role")));
 *
 * R2dbcRetry.authRetry(query, refresh, detector)
 *     .retryWhen(R2dbcRetry.toReactorRetry(Retry.Policy.exponential(3, 250))
 *         .filter(R2dbcRetry::isTransientConnectionError));
 * }</pre>
 */
public final class R2dbcRetry {
  private static final String[] AUTH_KEYWORDS = {
    "access denied",
    "authentication failed",
    "password authentication failed",
    "invalid password",
    "permission denied"
  };
  private static final String[] TRANSIENT_KEYWORDS = {
    "connection refused",
    "connection reset",
    "i/o error",
    "socket closed",
    "broken pipe",
    "timeout"
  };

  private R2dbcRetry() {}

  /**
   * Whether the error, or an {@link R2dbcException} in its cause chain, reports an authentication
   * failure: SQLSTATE 28000 or 28P01, or a well-known message.
   *
   * @param error failure to inspect
   * @return true for authentication errors
   */
  public static boolean isAuthError(final Throwable error) {
    final var r2dbcEx = findR2dbcException(error);
    if (r2dbcEx != null) {
      final var sqlState = r2dbcEx.getSqlState();
      if ("28000".equals(sqlState) || "28P01".equals(sqlState)) return true;
      if (containsAny(r2dbcEx.getMessage(), AUTH_KEYWORDS)) return true;
    }
    return error != null && containsAny(error.getMessage(), AUTH_KEYWORDS);
  }

  /**
   * Whether the error looks like a connectivity problem worth retrying: a {@link
   * R2dbcTransientResourceException}, SQLSTATE class 08, or a transport-level message.
   *
   * @param error failure to inspect
   * @return true for transient connection errors
   */
  public static boolean isTransientConnectionError(final Throwable error) {
    final var r2dbcEx = findR2dbcException(error);
    if (r2dbcEx != null) {
      if (r2dbcEx instanceof R2dbcTransientResourceException) return true;
      final var sqlState = r2dbcEx.getSqlState();
      if (sqlState != null && sqlState.startsWith("08")) return true;
      if (containsAny(r2dbcEx.getMessage(), TRANSIENT_KEYWORDS)) return true;
    }
    return error != null && containsAny(error.getMessage(), TRANSIENT_KEYWORDS);
  }

  /**
   * Adapts a {@link Retry.Policy} to a Reactor retry spec. Once attempts are exhausted the last
   * failure is propagated as is.
   */
  public static RetryBackoffSpec toReactorRetry(final Retry.Policy p) {
    final int retries = Math.max(0, p.maxAttempts() - 1);
    final RetryBackoffSpec spec;
    if (p.multiplier() > 1.0) {
      spec =
          reactor.util.retry.Retry.backoff(retries, Duration.ofMillis(p.baseDelayMillis()))
              .maxBackoff(Duration.ofMillis(p.maxDelayMillis()))
              .jitter(p.jitter() ? 0.25d : 0.0d);
    } else {
      spec =
          reactor.util.retry.Retry.fixedDelay(retries, Duration.ofMillis(p.baseDelayMillis()));
    }
    return spec.onRetryExhaustedThrow((s, signal) -> signal.failure());
  }

  /**
   * Resubscribes to {@code source} once after running {@code reset} when it fails with an
   * authentication error.
   */
  public static <T> Mono<T> authRetry(
      final Mono<T> source, final Mono<Void> reset, final AuthErrorDetector detector) {
    return source.onErrorResume(t -> detector.isAuthError(t) ? reset.then(source) : Mono.error(t));
  }

  /** {@link Flux} variant of {@link #authRetry(Mono, Mono, AuthErrorDetector)}. */
  public static <T> Flux<T> authRetry(
      final Flux<T> source, final Mono<Void> reset, final AuthErrorDetector detector) {
    return source.onErrorResume(
        t -> detector.isAuthError(t) ? reset.thenMany(source) : Flux.error(t));
  }

  private static boolean containsAny(final String msg, final String[] keywords) {
    if (msg == null) return false;
    final var lower = msg.toLowerCase(Locale.ROOT);
    for (var keyword : keywords) if (lower.contains(keyword)) return true;
    return false;
  }

  private static R2dbcException findR2dbcException(final Throwable t) {
    Throwable cur = t;
    while (cur != null) {
      if (cur instanceof R2dbcException ex) return ex;
      cur = cur.getCause();
    }
    return null;
  }

  /** Pluggable detector for driver-specific authentication failures. */
  @FunctionalInterface
  public interface AuthErrorDetector {

    static AuthErrorDetector defaultDetector() {
      return R2dbcRetry::isAuthError;
    }

    static AuthErrorDetector custom(final Predicate<Throwable> predicate) {
      return predicate::test;
    }

    boolean isAuthError(Throwable error);

    default AuthErrorDetector or(final AuthErrorDetector other) {
      return e -> this.isAuthError(e) || other.isAuthError(e);
    }
  }
}
