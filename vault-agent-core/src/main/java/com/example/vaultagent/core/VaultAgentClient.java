package com.example.vaultagent.core;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.vaultagent.core.auth.AuthSession;
import com.example.vaultagent.core.cache.CacheStats;
import com.example.vaultagent.core.cache.TtlCache;
import com.example.vaultagent.core.pool.OnDemandPoolManager;
import com.example.vaultagent.core.pool.PoolCoordinator;
import com.example.vaultagent.core.pool.PoolFactory;
import com.example.vaultagent.core.pool.PoolManager;
import com.example.vaultagent.core.pool.RefreshScheduler;
import com.example.vaultagent.core.pool.ScheduledPoolManager;
import com.example.vaultagent.core.secrets.Credential;
import com.example.vaultagent.core.secrets.CredentialBroker;
import com.example.vaultagent.core.secrets.SecretKey;
import com.example.vaultagent.core.secrets.SecretStore;
import com.example.vaultagent.core.secrets.SecretValue;
import com.example.vaultagent.core.secrets.TimeBoundedSecretStore;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point of the library: authenticated, cached secret reads and rotating database pools.
 *
 * <h2>Reading secrets</h2>
 *
 * <pre>{@code
 * var store = AwsSecretsManagerStore.builder().fromEnvironment().build();
 * try (var client = new VaultAgentClient(store, accessKeyId, secretAccessKey,
 *     ClientOptions.fromEnvironment().build())) {
 *   var apiKey = client.read("payments/api").get("key").orElseThrow();
 * }
 * }</pre>
 *
 * <h2>Rotating pools</h2>
 *
 * <pre>{@code
 * var manager = client.scheduledPool("orders-rw", new DataSourcePoolFactory(hikariProvider));
 * manager.start();
 * var dataSource = new RotatingDataSource(manager);
 * }</pre>
 *
 * <p>Closing the client stops every scheduler and closes every pool it created, then the store.
 */
public final class VaultAgentClient implements AutoCloseable {

  private static final System.Logger logger = System.getLogger(VaultAgentClient.class.getName());

  private final ClientOptions options;
  private final TimeBoundedSecretStore store;
  private final AuthSession session;
  private final TtlCache<SecretKey, Object> cache;
  private final CredentialBroker broker;
  private final List<PoolManager<?>> managers = new CopyOnWriteArrayList<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * @param store secret store; every call to it is bounded by {@link ClientOptions#callTimeout()}
   * @param roleId login role identifier
   * @param secretId login role secret
   * @param options client settings
   */
  public VaultAgentClient(
      final SecretStore store,
      final String roleId,
      final String secretId,
      final ClientOptions options) {
    this.options = Objects.requireNonNull(options, "options");
    this.store =
        new TimeBoundedSecretStore(Objects.requireNonNull(store, "store"), options.callTimeout());
    this.session = new AuthSession(this.store, roleId, secretId, options.clock());
    this.cache = new TtlCache<>(options.cacheTtl(), options.maxCacheSize(), options.clock());
    this.broker =
        new CredentialBroker(
            this.store,
            session,
            cache,
            options.staticCredentialTtl(),
            options.retryPolicy(),
            options.clock());
  }

  public VaultAgentClient(final SecretStore store, final String roleId, final String secretId) {
    this(store, roleId, secretId, ClientOptions.defaults());
  }

  public SecretValue read(final String path) {
    return broker.read(path);
  }

  public SecretValue read(final String path, final String version) {
    return broker.read(path, version);
  }

  public List<String> list(final String path) {
    return broker.list(path);
  }

  public Credential issueCredential(final String role) {
    return broker.issueCredential(role);
  }

  public Credential getStaticCredential(final String role) {
    return broker.getStaticCredential(role);
  }

  /**
   * Formats a connection string from a freshly issued credential of {@code role}.
   *
   * @see CredentialBroker#connectionString(String, String, Map)
   */
  public String connectionString(
      final String role, final String template, final Map<String, String> params) {
    return broker.connectionString(role, template, params);
  }

  /** Drops every cached version of a KV path. */
  public void invalidate(final String path) {
    broker.invalidate(path);
  }

  public CacheStats cacheStats() {
    return cache.stats();
  }

  /** Empties the cache. Hit and miss counters are kept. */
  public void clearCache() {
    cache.clear();
  }

  /**
   * Changes the default TTL of entries cached from now on.
   *
   * @param ttl new TTL, zero disables caching
   * @throws ConfigurationException if negative
   */
  public void setCacheTtl(final Duration ttl) {
    cache.setDefaultTtl(ttl);
    logger.log(INFO, "Cache TTL set to {0}", ttl);
  }

  /**
   * Pool manager for {@code role} that checks the credential on every borrow and refreshes it
   * in the calling thread when due.
   *
   * @param role database role
   * @param factory builds, validates and closes pools
   * @param <P> pool type
   * @return manager owned by this client
   */
  public <P> OnDemandPoolManager<P> onDemandPool(final String role, final PoolFactory<P> factory) {
    ensureOpen();
    final var manager =
        new OnDemandPoolManager<>(
            role,
            broker,
            new PoolCoordinator<>(factory, options.validationProbe()),
            options.refreshBuffer(),
            options.clock());
    managers.add(manager);
    return manager;
  }

  /**
   * Pool manager for {@code role} refreshed by a background scheduler. Call {@link
   * ScheduledPoolManager#start()} to adopt the first pool and start the timer.
   *
   * @param role database role
   * @param factory builds, validates and closes pools
   * @param <P> pool type
   * @return manager owned by this client
   */
  public <P> ScheduledPoolManager<P> scheduledPool(
      final String role, final PoolFactory<P> factory) {
    ensureOpen();
    final var coordinator = new PoolCoordinator<>(factory, options.validationProbe());
    final var scheduler =
        new RefreshScheduler(
            role,
            broker,
            coordinator,
            options.refreshBuffer(),
            options.checkInterval(),
            options.clock());
    final var manager = new ScheduledPoolManager<>(coordinator, scheduler);
    managers.add(manager);
    return manager;
  }

  public CredentialBroker broker() {
    return broker;
  }

  public ClientOptions options() {
    return options;
  }

  /** Stops schedulers, closes every pool created by this client, then closes the store. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;
    for (final var manager : managers) {
      try {
        manager.close();
      } catch (final RuntimeException e) {
        logger.log(WARNING, "Failed to close pool manager for role " + manager.role(), e);
      }
    }
    managers.clear();
    store.close();
    logger.log(INFO, "Vault agent client closed");
  }

  private void ensureOpen() {
    if (closed.get()) throw new IllegalStateException("Client is closed");
  }
}
