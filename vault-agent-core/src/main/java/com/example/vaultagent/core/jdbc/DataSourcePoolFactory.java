package com.example.vaultagent.core.jdbc;

import static java.lang.System.Logger.Level.WARNING;

import com.example.vaultagent.core.pool.PoolFactory;
import com.example.vaultagent.core.secrets.Credential;
import java.sql.SQLException;
import java.util.Objects;
import javax.sql.DataSource;

/**
 * {@link PoolFactory} for JDBC pools. Validation opens one connection and executes the probe;
 * closing applies to pools implementing {@link AutoCloseable}, such as HikariCP.
 */
public final class DataSourcePoolFactory implements PoolFactory<DataSource> {

  private static final System.Logger logger =
      System.getLogger(DataSourcePoolFactory.class.getName());

  private final DataSourceFactoryProvider provider;

  public DataSourcePoolFactory(final DataSourceFactoryProvider provider) {
    this.provider = Objects.requireNonNull(provider, "provider");
  }

  @Override
  public DataSource build(final Credential credential) {
    return provider.create(credential);
  }

  @Override
  public boolean validate(final DataSource pool, final String probe) {
    try (final var conn = pool.getConnection();
        final var stmt = conn.createStatement()) {
      stmt.execute(probe);
      return true;
    } catch (final SQLException e) {
      logger.log(
          WARNING,
          "Validation probe failed (SQLState {0}): {1}",
          e.getSQLState(),
          e.getMessage());
      return false;
    }
  }

  @Override
  public void close(final DataSource pool) {
    if (pool instanceof AutoCloseable ac) {
      try {
        ac.close();
      } catch (final Exception e) {
        logger.log(WARNING, "Failed to close DataSource", e);
      }
    }
  }
}
