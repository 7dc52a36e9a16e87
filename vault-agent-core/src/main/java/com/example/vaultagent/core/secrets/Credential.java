package com.example.vaultagent.core.secrets;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable database credential with the lease it was issued under.
 *
 * <p>A refresh never mutates a credential; it produces a new one.
 *
 * @param leaseId store lease identifier
 * @param username database user
 * @param password database password
 * @param issuedAt when the client obtained the credential
 * @param leaseDuration lease lifetime
 */
public record Credential(
    String leaseId, String username, String password, Instant issuedAt, Duration leaseDuration) {

  public Credential {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
    Objects.requireNonNull(issuedAt, "issuedAt");
    Objects.requireNonNull(leaseDuration, "leaseDuration");
  }

  public Instant expiresAt() {
    return issuedAt.plus(leaseDuration);
  }

  /**
   * Instant at which proactive renewal should start.
   *
   * @param refreshBuffer fraction of the lease, in (0, 1]
   * @return {@code issuedAt + leaseDuration * refreshBuffer}
   */
  public Instant refreshAt(final double refreshBuffer) {
    final var millis = (long) (leaseDuration.toMillis() * refreshBuffer);
    return issuedAt.plusMillis(millis);
  }

  public boolean isDueForRefresh(final Instant now, final double refreshBuffer) {
    return !now.isBefore(refreshAt(refreshBuffer));
  }

  public boolean isExpired(final Instant now) {
    return !now.isBefore(expiresAt());
  }

  @Override
  public String toString() {
    return "Credential[leaseId="
        + leaseId
        + ", username="
        + username
        + ", password=***, issuedAt="
        + issuedAt
        + ", leaseDuration="
        + leaseDuration
        + "]";
  }
}
