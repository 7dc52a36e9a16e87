package com.example.vaultagent.core.reactive;

import static java.lang.System.Logger.Level.WARNING;

import com.example.vaultagent.core.pool.PoolFactory;
import com.example.vaultagent.core.secrets.Credential;
import io.r2dbc.spi.Closeable;
import io.r2dbc.spi.Connection;
import io.r2dbc.spi.ConnectionFactory;
import java.time.Duration;
import java.util.Objects;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@link PoolFactory} for R2DBC connection factories.
 *
 * <p>Validation acquires one connection, runs the probe and releases the connection, blocking for
 * at most {@code timeout}. Pools are closed through {@link Closeable} when the factory implements
 * it (r2dbc-pool does), or disposed when it is a Reactor {@link Disposable}.
 */
public final class ConnectionFactoryPoolFactory implements PoolFactory<ConnectionFactory> {

  private static final System.Logger logger =
      System.getLogger(ConnectionFactoryPoolFactory.class.getName());

  private final ConnectionFactoryProvider provider;
  private final Duration timeout;

  public ConnectionFactoryPoolFactory(final ConnectionFactoryProvider provider) {
    this(provider, Duration.ofSeconds(10));
  }

  public ConnectionFactoryPoolFactory(
      final ConnectionFactoryProvider provider, final Duration timeout) {
    this.provider = Objects.requireNonNull(provider, "provider");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public ConnectionFactory build(final Credential credential) {
    return provider.create(credential);
  }

  @Override
  public boolean validate(final ConnectionFactory pool, final String probe) {
    final Boolean valid =
        Mono.usingWhen(
                Mono.<Connection>from(pool.create()),
                conn -> runProbe(conn, probe),
                Connection::close)
            .thenReturn(true)
            .timeout(timeout)
            .onErrorResume(
                e -> {
                  logger.log(WARNING, "Validation probe failed: {0}", e.getMessage());
                  return Mono.just(false);
                })
            .block();
    return Boolean.TRUE.equals(valid);
  }

  @Override
  public void close(final ConnectionFactory pool) {
    if (pool instanceof Closeable closeable) {
      Mono.from(closeable.close())
          .timeout(timeout)
          .doOnError(e -> logger.log(WARNING, "Failed to close ConnectionFactory", e))
          .onErrorResume(e -> Mono.empty())
          .block();
    } else if (pool instanceof Disposable disposable) {
      disposable.dispose();
    }
  }

  private static Mono<Void> runProbe(final Connection conn, final String probe) {
    return Flux.from(conn.createStatement(probe).execute())
        .flatMap(result -> result.getRowsUpdated())
        .then();
  }
}
