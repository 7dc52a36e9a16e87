package com.example.vaultagent.core.jdbc;

import com.example.vaultagent.core.Retry;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Thin database client running units of work on a {@link RotatingDataSource}.
 *
 * <p>A unit of work failing with an authentication error, typically because the database revoked
 * the lease mid-operation, is run once more against a pool built from a fresh credential.
 *
 * @param dataSource rotating data source
 */
public record DbClient(RotatingDataSource dataSource) {

  /**
   * Runs the operation, refreshing credentials and retrying once on an authentication failure.
   *
   * @param operation unit of work using an open {@link Connection}
   * @param <T> result type
   * @return operation result
   * @throws SQLException if the operation fails, after the retry when one applies
   */
  public <T> T executeWithRetry(final DbOperation<T> operation) throws SQLException {
    return Retry.onException(() -> run(operation), Retry::isAuthError, dataSource::refresh, 2, 0L);
  }

  private <T> T run(final DbOperation<T> operation) throws SQLException {
    try (final var conn = dataSource.getConnection()) {
      return operation.execute(conn);
    }
  }

  /**
   * Database operation executed against an open {@link Connection}.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface DbOperation<T> {
    T execute(final Connection conn) throws SQLException;
  }
}
