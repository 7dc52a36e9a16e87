package com.example.vaultagent.core;

import com.example.vaultagent.core.secrets.DatabaseLease;
import com.example.vaultagent.core.secrets.SecretStore;
import com.example.vaultagent.core.secrets.SecretStoreException;
import com.example.vaultagent.core.secrets.SecretValue;
import com.example.vaultagent.core.secrets.Session;
import com.example.vaultagent.core.secrets.StaticCredential;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.testcontainers.containers.PostgreSQLContainer;

/** Store that creates a PostgreSQL role per lease, the way a dynamic secrets engine does. */
public final class PostgresRoleStore implements SecretStore {

  private final PostgreSQLContainer<?> postgres;
  private final String prefix = "it_" + Long.toHexString(System.nanoTime()) + "_";
  private final AtomicInteger counter = new AtomicInteger();
  private final Duration lease;

  public PostgresRoleStore(final PostgreSQLContainer<?> postgres, final Duration lease) {
    this.postgres = postgres;
    this.lease = lease;
  }

  @Override
  public Session login(final String roleId, final String secretId) {
    return new Session("it-token", Duration.ZERO);
  }

  @Override
  public SecretValue read(final String token, final String path, final String version) {
    throw new SecretStoreException(SecretStoreException.Reason.NOT_FOUND, "No KV secrets");
  }

  @Override
  public List<String> list(final String token, final String path) {
    return List.of();
  }

  @Override
  public DatabaseLease issueCredential(final String token, final String role) {
    final var n = counter.incrementAndGet();
    final var password = "pw" + n;
    admin("CREATE ROLE " + roleName(n) + " LOGIN PASSWORD '" + password + "'");
    return new DatabaseLease("lease-" + n, roleName(n), password, lease);
  }

  @Override
  public StaticCredential staticCredential(final String token, final String role) {
    throw new SecretStoreException(SecretStoreException.Reason.NOT_FOUND, "No static roles");
  }

  public int issued() {
    return counter.get();
  }

  public String roleName(final int n) {
    return prefix + n;
  }

  /** Disables login for the n-th issued role. Open sessions survive. */
  public void revoke(final int n) {
    admin("ALTER ROLE " + roleName(n) + " NOLOGIN");
  }

  private void admin(final String sql) {
    try (final var conn =
            DriverManager.getConnection(
                postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        final var st = conn.createStatement()) {
      st.execute(sql);
    } catch (final SQLException e) {
      throw new SecretStoreException(
          SecretStoreException.Reason.UNAVAILABLE, "Role statement failed: " + sql, e);
    }
  }
}
