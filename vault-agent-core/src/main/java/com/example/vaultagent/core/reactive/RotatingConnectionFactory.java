package com.example.vaultagent.core.reactive;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.vaultagent.core.Retry;
import com.example.vaultagent.core.pool.BorrowedPool;
import com.example.vaultagent.core.pool.PoolManager;
import io.r2dbc.spi.Connection;
import io.r2dbc.spi.ConnectionFactory;
import java.util.Objects;
import java.util.function.Function;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.RetryBackoffSpec;

/**
 * Runs R2DBC work on the pools of a {@link PoolManager}.
 *
 * <p>Each unit of work borrows the active pool, acquires a connection, and returns both when the
 * work terminates or is cancelled, so a replaced pool is closed only after its last unit of work
 * completes. Authentication failures trigger one credential refresh and one resubscription;
 * transient connection errors are retried per the {@link Retry.Policy}.
 *
 * <pre>{@code
 * var factory = new RotatingConnectionFactory(
 *     client.scheduledPool("orders-ro", new ConnectionFactoryPoolFactory(provider)));
 *
 * Mono<Long> count = factory.withConnection(conn ->
 *     Mono.from(conn.createStatement("SELECT count(*) FROM orders").execute())
 *         .flatMap(r -> Mono.from(r.map((row, md) -> row.get(0, Long.class)))));
 * }</pre>
 */
public final class RotatingConnectionFactory implements AutoCloseable {

  private static final System.Logger logger =
      System.getLogger(RotatingConnectionFactory.class.getName());

  private final PoolManager<ConnectionFactory> manager;
  private final R2dbcRetry.AuthErrorDetector authErrorDetector;
  private final Retry.Policy transientPolicy;

  public RotatingConnectionFactory(final PoolManager<ConnectionFactory> manager) {
    this(manager, R2dbcRetry.AuthErrorDetector.defaultDetector(), Retry.Policy.none());
  }

  public RotatingConnectionFactory(
      final PoolManager<ConnectionFactory> manager,
      final R2dbcRetry.AuthErrorDetector authErrorDetector,
      final Retry.Policy transientPolicy) {
    this.manager = Objects.requireNonNull(manager, "manager");
    this.authErrorDetector = Objects.requireNonNull(authErrorDetector, "authErrorDetector");
    this.transientPolicy = Objects.requireNonNull(transientPolicy, "transientPolicy");
  }

  /**
   * Runs {@code work} with a connection from the active pool.
   *
   * @param work unit of work
   * @param <T> result type
   * @return the result of the work
   */
  public <T> Mono<T> withConnection(final Function<Connection, Mono<T>> work) {
    final var attempt =
        Mono.defer(() -> Mono.usingWhen(borrow(), b -> run(b, work), this::release));
    return R2dbcRetry.authRetry(attempt, refresh(), authErrorDetector)
        .retryWhen(transientRetry());
  }

  /**
   * Streaming variant of {@link #withConnection(Function)}.
   *
   * @param work unit of work
   * @param <T> element type
   * @return the elements emitted by the work
   */
  public <T> Flux<T> withConnectionMany(final Function<Connection, Flux<T>> work) {
    final var attempt =
        Flux.defer(() -> Flux.usingWhen(borrow(), b -> runMany(b, work), this::release));
    return R2dbcRetry.authRetry(attempt, refresh(), authErrorDetector)
        .retryWhen(transientRetry());
  }

  /**
   * Forces a credential refresh on a worker thread.
   *
   * @return completes once the new pool is active
   */
  public Mono<Void> refresh() {
    return Mono.fromRunnable(
            () -> {
              logger.log(WARNING, "Authentication error detected, refreshing credentials");
              manager.refreshNow();
            })
        .subscribeOn(Schedulers.boundedElastic())
        .then();
  }

  /** Closes the underlying manager and its pools. */
  @Override
  public void close() {
    manager.close();
  }

  private Mono<BorrowedPool<ConnectionFactory>> borrow() {
    return Mono.fromCallable(manager::borrow).subscribeOn(Schedulers.boundedElastic());
  }

  private Mono<Void> release(final BorrowedPool<ConnectionFactory> borrowed) {
    return Mono.fromRunnable(borrowed::close);
  }

  private static <T> Mono<T> run(
      final BorrowedPool<ConnectionFactory> borrowed, final Function<Connection, Mono<T>> work) {
    return Mono.usingWhen(connect(borrowed), work, Connection::close);
  }

  private static <T> Flux<T> runMany(
      final BorrowedPool<ConnectionFactory> borrowed, final Function<Connection, Flux<T>> work) {
    return Flux.usingWhen(connect(borrowed), work, Connection::close);
  }

  private static Mono<Connection> connect(final BorrowedPool<ConnectionFactory> borrowed) {
    return Mono.from(borrowed.pool().create());
  }

  private RetryBackoffSpec transientRetry() {
    return R2dbcRetry.toReactorRetry(transientPolicy)
        .filter(R2dbcRetry::isTransientConnectionError)
        .doBeforeRetry(
            signal ->
                logger.log(
                    DEBUG,
                    "Transient error on attempt {0}, retrying...",
                    signal.totalRetries() + 1));
  }
}
