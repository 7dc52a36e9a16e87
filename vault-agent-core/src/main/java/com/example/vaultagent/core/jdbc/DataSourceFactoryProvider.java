package com.example.vaultagent.core.jdbc;

import com.example.vaultagent.core.secrets.Credential;
import javax.sql.DataSource;

/**
 * Factory that creates a {@link DataSource} from a {@link Credential}. Implementations typically
 * configure a connection pool with the credential's user and password.
 *
 * <pre>{@code
 * DataSourceFactoryProvider hikari = credential -> {
 *   var config = new HikariConfig();
 *   config.setJdbcUrl("jdbc:postgresql://db:5432/orders");
 *   config.setUsername(credential.username());
 *   config.setPassword(credential.password());
 *   return new HikariDataSource(config);
 * };
 * }</pre>
 */
@FunctionalInterface
public interface DataSourceFactoryProvider {
  /**
   * Creates a new {@link DataSource} configured for the provided credential.
   *
   * @param credential the database credential
   * @return a new {@link DataSource}
   */
  DataSource create(final Credential credential);
}
