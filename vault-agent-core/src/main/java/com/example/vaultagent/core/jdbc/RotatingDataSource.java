package com.example.vaultagent.core.jdbc;

import static java.lang.System.Logger.Level.WARNING;

import com.example.vaultagent.core.Retry;
import com.example.vaultagent.core.pool.BorrowedPool;
import com.example.vaultagent.core.pool.PoolManager;
import java.io.PrintWriter;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Objects;
import javax.sql.DataSource;

/**
 * {@link DataSource} backed by a {@link PoolManager}, so JDBC code and frameworks can use rotated
 * credentials without knowing about them.
 *
 * <p>Every connection handed out holds a borrow on the pool it came from; closing the connection
 * returns the borrow, which lets a replaced pool drain and close once its last connection is
 * returned. A connection attempt rejected with an authentication error forces a credential
 * refresh and is retried once.
 *
 * <h2>On-demand refresh</h2>
 *
 * <pre>{@code
 * var dataSource = new RotatingDataSource(
 *     client.onDemandPool("orders-rw", new DataSourcePoolFactory(hikariProvider)));
 *
 * try (var conn = dataSource.getConnection()) {
 *     // credentials are checked before the connection is lent
 * }
 * }</pre>
 *
 * <h2>Background refresh</h2>
 *
 * <pre>{@code
 * var manager = client.scheduledPool("orders-rw", new DataSourcePoolFactory(hikariProvider));
 * manager.start();
 * var dataSource = new RotatingDataSource(manager);
 * }</pre>
 */
public final class RotatingDataSource implements DataSource, AutoCloseable {

  private static final System.Logger logger = System.getLogger(RotatingDataSource.class.getName());

  private final PoolManager<DataSource> manager;

  public RotatingDataSource(final PoolManager<DataSource> manager) {
    this.manager = Objects.requireNonNull(manager, "manager");
  }

  @Override
  public Connection getConnection() throws SQLException {
    return Retry.onException(this::borrowConnection, Retry::isAuthError, this::refresh, 2, 0L);
  }

  @Override
  public Connection getConnection(final String username, final String password) {
    throw new UnsupportedOperationException(
        "Credentials are managed at the pool level via DataSourceFactoryProvider");
  }

  /** Issues a new credential and swaps in a pool built from it. */
  public void refresh() {
    logger.log(WARNING, "Authentication error detected, refreshing credentials");
    manager.refreshNow();
  }

  /** Closes the underlying manager and its pools. */
  @Override
  public void close() {
    manager.close();
  }

  @Override
  public PrintWriter getLogWriter() throws SQLException {
    return withPool(DataSource::getLogWriter);
  }

  @Override
  public void setLogWriter(final PrintWriter out) throws SQLException {
    withPool(
        ds -> {
          ds.setLogWriter(out);
          return null;
        });
  }

  @Override
  public void setLoginTimeout(final int seconds) throws SQLException {
    withPool(
        ds -> {
          ds.setLoginTimeout(seconds);
          return null;
        });
  }

  @Override
  public int getLoginTimeout() throws SQLException {
    return withPool(DataSource::getLoginTimeout);
  }

  @Override
  public java.util.logging.Logger getParentLogger() throws SQLFeatureNotSupportedException {
    throw new SQLFeatureNotSupportedException("RotatingDataSource does not use java.util.logging");
  }

  @Override
  public <T> T unwrap(final Class<T> clazz) throws SQLException {
    if (clazz.isInstance(this)) return clazz.cast(this);
    return withPool(ds -> ds.unwrap(clazz));
  }

  @Override
  public boolean isWrapperFor(final Class<?> iface) throws SQLException {
    return iface.isInstance(this) || withPool(ds -> ds.isWrapperFor(iface));
  }

  private Connection borrowConnection() throws SQLException {
    final var borrowed = manager.borrow();
    try {
      return releasingOnClose(borrowed.pool().getConnection(), borrowed);
    } catch (final SQLException | RuntimeException e) {
      borrowed.close();
      throw e;
    }
  }

  private <T> T withPool(final DataSourceCall<T> call) throws SQLException {
    try (final var borrowed = manager.borrow()) {
      return call.apply(borrowed.pool());
    }
  }

  private static Connection releasingOnClose(
      final Connection target, final BorrowedPool<DataSource> borrowed) {
    return (Connection)
        Proxy.newProxyInstance(
            RotatingDataSource.class.getClassLoader(),
            new Class<?>[] {Connection.class},
            (proxy, method, args) -> {
              if ("close".equals(method.getName()) && method.getParameterCount() == 0) {
                try {
                  target.close();
                } finally {
                  borrowed.close();
                }
                return null;
              }
              if ("unwrap".equals(method.getName()) && ((Class<?>) args[0]).isInstance(proxy)) {
                return proxy;
              }
              try {
                return method.invoke(target, args);
              } catch (final InvocationTargetException e) {
                throw e.getCause();
              }
            });
  }

  @FunctionalInterface
  private interface DataSourceCall<T> {
    T apply(DataSource dataSource) throws SQLException;
  }
}
