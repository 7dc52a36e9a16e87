package com.example.vaultagent.core;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Settings of a {@link VaultAgentClient}.
 *
 * <p>Defaults: cache TTL 300 s, cache capacity 1000, refresh buffer 0.8, check interval 60 s,
 * validation probe {@code SELECT 1}, store call timeout 10 s, static credential TTL 300 s, three
 * attempts with exponential backoff from 250 ms for transient store failures, system UTC clock.
 *
 * <pre>{@code
 * var options = ClientOptions.builder()
 *     .cacheTtl(Duration.ofMinutes(2))
 *     .refreshBuffer(0.75)
 *     .build();
 * }</pre>
 */
public final class ClientOptions {

  private final Duration cacheTtl;
  private final int maxCacheSize;
  private final double refreshBuffer;
  private final Duration checkInterval;
  private final String validationProbe;
  private final Duration callTimeout;
  private final Duration staticCredentialTtl;
  private final Retry.Policy retryPolicy;
  private final Clock clock;

  private ClientOptions(final Builder builder) {
    this.cacheTtl = builder.cacheTtl;
    this.maxCacheSize = builder.maxCacheSize;
    this.refreshBuffer = builder.refreshBuffer;
    this.checkInterval = builder.checkInterval;
    this.validationProbe = builder.validationProbe;
    this.callTimeout = builder.callTimeout;
    this.staticCredentialTtl = builder.staticCredentialTtl;
    this.retryPolicy = builder.retryPolicy;
    this.clock = builder.clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Options with every default. */
  public static ClientOptions defaults() {
    return builder().build();
  }

  /**
   * Options overridden from system properties, falling back to environment variables:
   *
   * <ul>
   *   <li>vault.agent.cache.ttl.seconds / VAULT_AGENT_CACHE_TTL_SECONDS
   *   <li>vault.agent.cache.max.size / VAULT_AGENT_CACHE_MAX_SIZE
   *   <li>vault.agent.refresh.buffer / VAULT_AGENT_REFRESH_BUFFER
   *   <li>vault.agent.check.interval.seconds / VAULT_AGENT_CHECK_INTERVAL_SECONDS
   *   <li>vault.agent.call.timeout.millis / VAULT_AGENT_CALL_TIMEOUT_MILLIS
   * </ul>
   *
   * @return builder pre-populated from the environment
   * @throws ConfigurationException if a value cannot be parsed
   */
  public static Builder fromEnvironment() {
    final var builder = builder();
    setting("vault.agent.cache.ttl.seconds", Long::parseLong)
        .map(Duration::ofSeconds)
        .ifPresent(builder::cacheTtl);
    setting("vault.agent.cache.max.size", Integer::parseInt).ifPresent(builder::maxCacheSize);
    setting("vault.agent.refresh.buffer", Double::parseDouble).ifPresent(builder::refreshBuffer);
    setting("vault.agent.check.interval.seconds", Long::parseLong)
        .map(Duration::ofSeconds)
        .ifPresent(builder::checkInterval);
    setting("vault.agent.call.timeout.millis", Long::parseLong)
        .map(Duration::ofMillis)
        .ifPresent(builder::callTimeout);
    return builder;
  }

  private static <T> Optional<T> setting(final String property, final Function<String, T> parser) {
    final var env = property.toUpperCase(Locale.ROOT).replace('.', '_');
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .filter(val -> !val.isBlank())
        .map(String::trim)
        .map(
            val -> {
              try {
                return parser.apply(val);
              } catch (final NumberFormatException e) {
                throw new ConfigurationException(
                    "Invalid value for " + property + ": '" + val + "'", e);
              }
            });
  }

  public Duration cacheTtl() {
    return cacheTtl;
  }

  public int maxCacheSize() {
    return maxCacheSize;
  }

  public double refreshBuffer() {
    return refreshBuffer;
  }

  public Duration checkInterval() {
    return checkInterval;
  }

  public String validationProbe() {
    return validationProbe;
  }

  public Duration callTimeout() {
    return callTimeout;
  }

  public Duration staticCredentialTtl() {
    return staticCredentialTtl;
  }

  public Retry.Policy retryPolicy() {
    return retryPolicy;
  }

  public Clock clock() {
    return clock;
  }

  /** Fluent builder; {@link #build()} validates every field. */
  public static final class Builder {
    private Duration cacheTtl = Duration.ofSeconds(300);
    private int maxCacheSize = 1000;
    private double refreshBuffer = 0.8;
    private Duration checkInterval = Duration.ofSeconds(60);
    private String validationProbe = "SELECT 1";
    private Duration callTimeout = Duration.ofSeconds(10);
    private Duration staticCredentialTtl = Duration.ofSeconds(300);
    private Retry.Policy retryPolicy = Retry.Policy.exponential(3, 250L);
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    /**
     * Default lifetime of cached secrets and ceiling for store-reported leases. Zero disables
     * caching.
     */
    public Builder cacheTtl(final Duration cacheTtl) {
      this.cacheTtl = cacheTtl;
      return this;
    }

    public Builder maxCacheSize(final int maxCacheSize) {
      this.maxCacheSize = maxCacheSize;
      return this;
    }

    /** Fraction of a lease after which a credential is refreshed, in (0, 1]. */
    public Builder refreshBuffer(final double refreshBuffer) {
      this.refreshBuffer = refreshBuffer;
      return this;
    }

    public Builder checkInterval(final Duration checkInterval) {
      this.checkInterval = checkInterval;
      return this;
    }

    public Builder validationProbe(final String validationProbe) {
      this.validationProbe = validationProbe;
      return this;
    }

    public Builder callTimeout(final Duration callTimeout) {
      this.callTimeout = callTimeout;
      return this;
    }

    public Builder staticCredentialTtl(final Duration staticCredentialTtl) {
      this.staticCredentialTtl = staticCredentialTtl;
      return this;
    }

    public Builder retryPolicy(final Retry.Policy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * @return validated options
     * @throws ConfigurationException if a value is out of range
     * @throws IllegalStateException if a required value is missing
     */
    public ClientOptions build() {
      if (cacheTtl == null || cacheTtl.isNegative())
        throw new ConfigurationException("cacheTtl must be >= 0, was " + cacheTtl);
      if (maxCacheSize < 1)
        throw new ConfigurationException("maxCacheSize must be >= 1, was " + maxCacheSize);
      if (!(refreshBuffer > 0.0 && refreshBuffer <= 1.0))
        throw new ConfigurationException("refreshBuffer must be in (0, 1], was " + refreshBuffer);
      requirePositive("checkInterval", checkInterval);
      requirePositive("callTimeout", callTimeout);
      if (staticCredentialTtl == null || staticCredentialTtl.isNegative())
        throw new ConfigurationException(
            "staticCredentialTtl must be >= 0, was " + staticCredentialTtl);
      if (validationProbe == null || validationProbe.isBlank())
        throw new IllegalStateException("validationProbe is required");
      if (retryPolicy == null) throw new IllegalStateException("retryPolicy is required");
      if (clock == null) throw new IllegalStateException("clock is required");
      return new ClientOptions(this);
    }

    private static void requirePositive(final String name, final Duration value) {
      if (value == null || value.isZero() || value.isNegative())
        throw new ConfigurationException(name + " must be positive, was " + value);
    }
  }
}
