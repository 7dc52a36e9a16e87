package com.example.vaultagent.core.jdbc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.vaultagent.core.pool.SequencePoolManager;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import javax.sql.DataSource;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class RotatingDataSourceTest {

  private DataSource firstPool;
  private DataSource secondPool;
  private Connection firstConnection;
  private Connection secondConnection;
  private SequencePoolManager<DataSource> manager;
  private RotatingDataSource dataSource;

  @BeforeEach
  void setUp() throws SQLException {
    firstPool = mock(DataSource.class);
    secondPool = mock(DataSource.class);
    firstConnection = mock(Connection.class);
    secondConnection = mock(Connection.class);
    when(firstPool.getConnection()).thenReturn(firstConnection);
    when(secondPool.getConnection()).thenReturn(secondConnection);
    manager = new SequencePoolManager<>(firstPool, secondPool);
    dataSource = new RotatingDataSource(manager);
  }

  @AfterEach
  void tearDown() {
    dataSource.close();
  }

  private static SQLException authFailure() {
    return new SQLException("FATAL: password authentication failed for user \"v-app\"", "28P01");
  }

  @Nested
  @DisplayName("Connections")
  class Connections {

    @Test
    @DisplayName("Should delegate to the connection of the active pool")
    void shouldDelegateToActivePool() throws SQLException {
      final var statement = mock(Statement.class);
      when(firstConnection.createStatement()).thenReturn(statement);

      try (var conn = dataSource.getConnection()) {
        assertSame(statement, conn.createStatement());
      }
      verify(firstConnection).close();
    }

    @Test
    @DisplayName("Should hold a borrow until the connection is closed")
    void shouldHoldBorrowWhileOpen() throws SQLException {
      final var conn = dataSource.getConnection();
      assertEquals(1, manager.borrowCount());

      conn.close();

      assertEquals(0, manager.borrowCount());
    }

    @Test
    @DisplayName("Should keep a replaced pool open until its last connection is closed")
    void shouldDrainReplacedPool() throws SQLException {
      final var conn = dataSource.getConnection();
      manager.refreshNow();

      try (var fresh = dataSource.getConnection()) {
        fresh.isValid(1);
      }
      verify(secondConnection).isValid(1);
      assertFalse(manager.closed.contains(firstPool));

      conn.close();

      assertTrue(manager.closed.contains(firstPool));
    }

    @Test
    @DisplayName("Should propagate exceptions thrown by the wrapped connection")
    void shouldUnwrapInvocationExceptions() throws SQLException {
      when(firstConnection.prepareStatement("SELECT nope"))
          .thenThrow(new SQLException("syntax error", "42601"));

      try (var conn = dataSource.getConnection()) {
        final var ex = assertThrows(SQLException.class, () -> conn.prepareStatement("SELECT nope"));
        assertEquals("42601", ex.getSQLState());
      }
    }

    @Test
    @DisplayName("Should unwrap the proxy to Connection")
    void shouldUnwrapProxy() throws SQLException {
      try (var conn = dataSource.getConnection()) {
        assertSame(conn, conn.unwrap(Connection.class));
      }
    }

    @Test
    @DisplayName("Should reject per-call credentials")
    void shouldRejectPerCallCredentials() {
      assertThrows(UnsupportedOperationException.class, () -> dataSource.getConnection("u", "p"));
    }
  }

  @Nested
  @DisplayName("Authentication failures")
  class AuthenticationFailures {

    @Test
    @DisplayName("Should refresh credentials and retry once")
    void shouldRefreshAndRetry() throws SQLException {
      when(firstPool.getConnection()).thenThrow(authFailure());

      try (var conn = dataSource.getConnection()) {
        conn.getAutoCommit();
      }

      verify(secondConnection).getAutoCommit();
      assertEquals(1, manager.refreshes.get());
      assertTrue(manager.closed.contains(firstPool));
    }

    @Test
    @DisplayName("Should give up when the fresh pool is rejected too")
    void shouldGiveUpAfterSecondRejection() throws SQLException {
      when(firstPool.getConnection()).thenThrow(authFailure());
      when(secondPool.getConnection()).thenThrow(authFailure());

      final var ex = assertThrows(SQLException.class, () -> dataSource.getConnection());

      assertEquals("28P01", ex.getSQLState());
      assertEquals(1, manager.refreshes.get());
      assertEquals(0, manager.borrowCount());
    }

    @Test
    @DisplayName("Should not refresh on other errors")
    void shouldNotRefreshOnOtherErrors() throws SQLException {
      when(firstPool.getConnection()).thenThrow(new SQLException("too many clients", "53300"));

      assertThrows(SQLException.class, () -> dataSource.getConnection());

      assertEquals(0, manager.refreshes.get());
      assertEquals(0, manager.borrowCount());
    }
  }

  @Nested
  @DisplayName("DataSource contract")
  class DataSourceContract {

    @Test
    @DisplayName("Should delegate login timeout to the active pool")
    void shouldDelegateLoginTimeout() throws SQLException {
      when(firstPool.getLoginTimeout()).thenReturn(7);

      dataSource.setLoginTimeout(7);

      verify(firstPool).setLoginTimeout(7);
      assertEquals(7, dataSource.getLoginTimeout());
      assertEquals(0, manager.borrowCount());
    }

    @Test
    @DisplayName("Should unwrap to itself before asking the pool")
    void shouldUnwrapToItself() throws SQLException {
      assertSame(dataSource, dataSource.unwrap(RotatingDataSource.class));
      assertTrue(dataSource.isWrapperFor(DataSource.class));
      verify(firstPool, never()).unwrap(any());
    }

    @Test
    @DisplayName("Should not expose a java.util.logging parent logger")
    void shouldNotExposeParentLogger() {
      assertThrows(SQLFeatureNotSupportedException.class, () -> dataSource.getParentLogger());
    }

    @Test
    @DisplayName("Should close the manager")
    void shouldCloseManager() {
      dataSource.close();

      assertTrue(manager.isClosed());
      assertTrue(manager.closed.contains(firstPool));
    }
  }
}
