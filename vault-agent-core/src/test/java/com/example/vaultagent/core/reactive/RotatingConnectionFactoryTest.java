package com.example.vaultagent.core.reactive;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.vaultagent.core.Retry;
import com.example.vaultagent.core.pool.SequencePoolManager;
import io.r2dbc.spi.Connection;
import io.r2dbc.spi.ConnectionFactory;
import io.r2dbc.spi.R2dbcBadGrammarException;
import io.r2dbc.spi.R2dbcNonTransientResourceException;
import io.r2dbc.spi.R2dbcTransientResourceException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class RotatingConnectionFactoryTest {

  private ConnectionFactory firstPool;
  private ConnectionFactory secondPool;
  private Connection firstConn;
  private Connection secondConn;
  private SequencePoolManager<ConnectionFactory> manager;

  @BeforeEach
  void setUp() {
    firstPool = mock(ConnectionFactory.class);
    secondPool = mock(ConnectionFactory.class);
    firstConn = mock(Connection.class);
    secondConn = mock(Connection.class);
    doReturn(Mono.just(firstConn)).when(firstPool).create();
    doReturn(Mono.just(secondConn)).when(secondPool).create();
    doReturn(Mono.empty()).when(firstConn).close();
    doReturn(Mono.empty()).when(secondConn).close();
    manager = new SequencePoolManager<>(firstPool, secondPool);
  }

  @AfterEach
  void tearDown() {
    manager.close();
  }

  private static R2dbcNonTransientResourceException authFailure() {
    return new R2dbcNonTransientResourceException("password authentication failed", "28P01", 0);
  }

  @Test
  @DisplayName("Should run work on a connection and release connection and borrow afterwards")
  void shouldReleaseAfterWork() {
    final var factory = new RotatingConnectionFactory(manager);

    final var borrowsDuringWork =
        factory.withConnection(conn -> Mono.fromCallable(manager::borrowCount)).block();

    assertEquals(1, borrowsDuringWork);
    assertEquals(0, manager.borrowCount());
    verify(firstConn).close();
  }

  @Test
  @DisplayName("Should keep a replaced pool open until in-flight work completes")
  void shouldDrainReplacedPool() {
    final var factory = new RotatingConnectionFactory(manager);

    final var result =
        factory
            .withConnection(
                conn ->
                    Mono.fromCallable(
                        () -> {
                          manager.refreshNow();
                          return manager.closed.contains(firstPool);
                        }))
            .block();

    assertEquals(false, result);
    assertTrue(manager.closed.contains(firstPool));
  }

  @Test
  @DisplayName("Should refresh and retry once when the connection is rejected")
  void shouldRefreshWhenConnectRejected() {
    doReturn(Mono.error(authFailure())).when(firstPool).create();
    final var factory = new RotatingConnectionFactory(manager);

    final var used = factory.withConnection(conn -> Mono.just(conn)).block();

    assertSame(secondConn, used);
    assertEquals(1, manager.refreshes.get());
  }

  @Test
  @DisplayName("Should refresh and rerun the work when it fails with an auth error")
  void shouldRefreshWhenWorkRejected() {
    final var factory = new RotatingConnectionFactory(manager);
    final var attempts = new AtomicInteger();

    final var result =
        factory
            .withConnection(
                conn ->
                    attempts.incrementAndGet() == 1
                        ? Mono.<String>error(authFailure())
                        : Mono.just("ok"))
            .block();

    assertEquals("ok", result);
    assertEquals(1, manager.refreshes.get());
    verify(firstConn).close();
    verify(secondConn).close();
  }

  @Test
  @DisplayName("Should give up after a second auth error")
  void shouldGiveUpAfterSecondAuthError() {
    final var factory = new RotatingConnectionFactory(manager);

    final var mono = factory.withConnection(conn -> Mono.<String>error(authFailure()));

    assertThrows(R2dbcNonTransientResourceException.class, mono::block);
    assertEquals(1, manager.refreshes.get());
    assertEquals(0, manager.borrowCount());
  }

  @Test
  @DisplayName("Should propagate other errors without refreshing")
  void shouldPropagateOtherErrors() {
    final var factory = new RotatingConnectionFactory(manager);

    final var mono =
        factory.withConnection(
            conn -> Mono.<String>error(new R2dbcBadGrammarException("bad sql", "42601", 0)));

    assertThrows(R2dbcBadGrammarException.class, mono::block);
    assertEquals(0, manager.refreshes.get());
  }

  @Test
  @DisplayName("Should retry transient errors per policy without refreshing")
  void shouldRetryTransientErrors() {
    final var factory =
        new RotatingConnectionFactory(
            manager, R2dbcRetry.AuthErrorDetector.defaultDetector(), Retry.Policy.fixed(3, 1));
    final var attempts = new AtomicInteger();

    final var result =
        factory
            .withConnection(
                conn ->
                    attempts.incrementAndGet() < 3
                        ? Mono.<String>error(
                            new R2dbcTransientResourceException("connection reset", "08006", 0))
                        : Mono.just("ok"))
            .block();

    assertEquals("ok", result);
    assertEquals(3, attempts.get());
    assertEquals(0, manager.refreshes.get());
  }

  @Test
  @DisplayName("Should use a custom auth detector")
  void shouldUseCustomDetector() {
    final var detector =
        R2dbcRetry.AuthErrorDetector.custom(t -> "token expired".equals(t.getMessage()));
    final var factory = new RotatingConnectionFactory(manager, detector, Retry.Policy.none());
    final var attempts = new AtomicInteger();

    final var result =
        factory
            .withConnection(
                conn ->
                    attempts.incrementAndGet() == 1
                        ? Mono.<String>error(new IllegalStateException("token expired"))
                        : Mono.just("ok"))
            .block();

    assertEquals("ok", result);
    assertEquals(1, manager.refreshes.get());
  }

  @Test
  @DisplayName("Should stream results and refresh on auth error")
  void shouldStreamResults() {
    final var factory = new RotatingConnectionFactory(manager);
    final var attempts = new AtomicInteger();

    final var rows =
        factory
            .withConnectionMany(
                conn ->
                    attempts.incrementAndGet() == 1
                        ? Flux.<Integer>error(authFailure())
                        : Flux.just(1, 2, 3))
            .collectList()
            .block();

    assertEquals(List.of(1, 2, 3), rows);
    assertEquals(1, manager.refreshes.get());
    assertEquals(0, manager.borrowCount());
  }

  @Test
  @DisplayName("Should close the manager")
  void shouldCloseManager() {
    new RotatingConnectionFactory(manager).close();

    assertTrue(manager.isClosed());
  }
}
