package com.example.vaultagent.core.secrets;

import java.time.Duration;

/**
 * Dynamic database credential as returned by the store, before the client stamps its issue time.
 *
 * @param leaseId store lease identifier
 * @param username generated database user
 * @param password generated password
 * @param leaseDuration lease lifetime
 */
public record DatabaseLease(
    String leaseId, String username, String password, Duration leaseDuration) {

  @Override
  public String toString() {
    return "DatabaseLease[leaseId=" + leaseId + ", username=" + username + ", password=***]";
  }
}
