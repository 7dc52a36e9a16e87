package com.example.vaultagent.core.pool;

import java.time.Instant;
import java.util.Optional;

/**
 * Outcome history of a {@link RefreshScheduler}.
 *
 * @param lastSuccess time of the last successful refresh, or null
 * @param lastFailure time of the last failed refresh, or null
 * @param lastError message of the last failure, or null
 * @param successCount successful refreshes so far
 * @param failureCount failed refreshes so far
 */
public record RefreshStatus(
    Instant lastSuccess,
    Instant lastFailure,
    String lastError,
    long successCount,
    long failureCount) {

  static final RefreshStatus INITIAL = new RefreshStatus(null, null, null, 0, 0);

  public Optional<Instant> lastSuccessTime() {
    return Optional.ofNullable(lastSuccess);
  }

  public Optional<String> lastErrorMessage() {
    return Optional.ofNullable(lastError);
  }

  /**
   * @return true when no refresh failed since the last success
   */
  public boolean healthy() {
    return lastFailure == null || (lastSuccess != null && lastSuccess.isAfter(lastFailure));
  }

  RefreshStatus succeeded(final Instant at) {
    return new RefreshStatus(at, lastFailure, lastError, successCount + 1, failureCount);
  }

  RefreshStatus failed(final Instant at, final String error) {
    return new RefreshStatus(lastSuccess, at, error, successCount, failureCount + 1);
  }
}
