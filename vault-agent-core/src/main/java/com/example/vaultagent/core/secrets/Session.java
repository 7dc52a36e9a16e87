package com.example.vaultagent.core.secrets;

import java.time.Duration;

/**
 * Result of a successful login.
 *
 * @param token session token
 * @param leaseDuration token lifetime; zero means the token does not expire
 */
public record Session(String token, Duration leaseDuration) {

  @Override
  public String toString() {
    return "Session[token=***, leaseDuration=" + leaseDuration + "]";
  }
}
