package com.example.vaultagent.core.aws;

import com.example.vaultagent.core.secrets.DatabaseLease;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;

/**
 * Database secret in the RDS JSON layout ({@code username}, {@code password}, {@code engine},
 * {@code host}, {@code port}, {@code dbname}). Only the login is required.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record DbSecret(
    String username, String password, String engine, String host, Integer port, String dbname) {

  boolean hasLogin() {
    return username != null && !username.isBlank() && password != null;
  }

  DatabaseLease toLease(final String versionId, final Duration lease) {
    return new DatabaseLease(versionId, username, password, lease);
  }

  @Override
  public String toString() {
    return "DbSecret[username=" + username + ", engine=" + engine + ", host=" + host + "]";
  }
}
