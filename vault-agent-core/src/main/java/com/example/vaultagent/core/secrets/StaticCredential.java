package com.example.vaultagent.core.secrets;

import java.time.Duration;
import java.time.Instant;

/**
 * Credential of a static database role, rotated by the store on its own schedule.
 *
 * @param username database user
 * @param password current password
 * @param lastRotation when the store last rotated the password, or null if unknown
 * @param rotationPeriod rotation interval, or null if unknown
 */
public record StaticCredential(
    String username, String password, Instant lastRotation, Duration rotationPeriod) {

  @Override
  public String toString() {
    return "StaticCredential[username=" + username + ", password=***]";
  }
}
