package com.example.vaultagent.core.secrets;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.vaultagent.core.AuthenticationException;
import com.example.vaultagent.core.Retry;
import com.example.vaultagent.core.SecretNotFoundException;
import com.example.vaultagent.core.StoreUnavailableException;
import com.example.vaultagent.core.auth.AuthSession;
import com.example.vaultagent.core.cache.TtlCache;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Authenticated, cached access to secrets.
 *
 * <ul>
 *   <li>KV reads, listings and static credentials are served from the cache while fresh.
 *   <li>Dynamic credentials bypass the cache; concurrent issuance for one role shares a single
 *       store call.
 *   <li>A call rejected as unauthorized invalidates the session and is attempted exactly once more.
 *   <li>Store outages and timeouts are retried per the configured {@link Retry.Policy} and then
 *       surface as {@link StoreUnavailableException}.
 * </ul>
 */
public final class CredentialBroker {

  private static final System.Logger logger = System.getLogger(CredentialBroker.class.getName());

  static final Duration LIST_TTL = Duration.ofSeconds(60);

  private final SecretStore store;
  private final AuthSession session;
  private final TtlCache<SecretKey, Object> cache;
  private final Duration staticCredentialTtl;
  private final Retry.Policy retryPolicy;
  private final Clock clock;
  private final SingleFlight<String, Credential> issuance = new SingleFlight<>();

  public CredentialBroker(
      final SecretStore store,
      final AuthSession session,
      final TtlCache<SecretKey, Object> cache,
      final Duration staticCredentialTtl,
      final Retry.Policy retryPolicy,
      final Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.session = Objects.requireNonNull(session, "session");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.staticCredentialTtl = Objects.requireNonNull(staticCredentialTtl, "staticCredentialTtl");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Reads the latest version of a KV secret.
   *
   * @param path secret path
   * @return the secret
   * @throws SecretNotFoundException if the store has no such path
   */
  public SecretValue read(final String path) {
    return read(path, null);
  }

  /**
   * Reads a KV secret, from the cache when fresh.
   *
   * <p>The entry lives for the cache's default TTL, or for the store-reported lease when that is
   * shorter.
   *
   * @param path secret path
   * @param version version to read, or null for the latest
   * @return the secret
   */
  public SecretValue read(final String path, final String version) {
    final var key = SecretKey.kv(path, version);
    final var cached = cache.get(key);
    if (cached.isPresent()) {
      logger.log(DEBUG, "Cache hit for secret {0}", path);
      return (SecretValue) cached.get();
    }

    logger.log(DEBUG, "Cache miss for secret {0}, fetching from store", path);
    final var value = call("read " + path, token -> store.read(token, path, version));
    cache.put(key, value, leaseTtl(value.lease().orElse(null)));
    return value;
  }

  /**
   * Lists secret names under a prefix. Listings are cached for at most 60 seconds.
   *
   * @param path path prefix
   * @return secret names
   */
  public List<String> list(final String path) {
    final var key = SecretKey.list(path);
    final var cached = cache.get(key);
    if (cached.isPresent()) {
      @SuppressWarnings("unchecked")
      final var names = (List<String>) cached.get();
      return names;
    }

    final var names = List.copyOf(call("list " + path, token -> store.list(token, path)));
    cache.put(key, names, cappedTtl(LIST_TTL));
    return names;
  }

  /**
   * Mints a fresh dynamic credential. Never cached; concurrent callers for the same role share
   * one store call and receive the same credential.
   *
   * @param role database role
   * @return newly issued credential
   */
  public Credential issueCredential(final String role) {
    return issuance.execute(
        role,
        () -> {
          final var lease =
              call("issue credential for " + role, token -> store.issueCredential(token, role));
          final var credential =
              new Credential(
                  lease.leaseId(),
                  lease.username(),
                  lease.password(),
                  clock.instant(),
                  lease.leaseDuration());
          logger.log(
              INFO,
              "Issued credential for role {0}, lease {1} valid for {2}",
              role,
              lease.leaseId(),
              lease.leaseDuration());
          return credential;
        });
  }

  /**
   * Returns the credential of a static role, cached like KV reads.
   *
   * <p>The returned lease duration is the store's rotation period when known, the static
   * credential TTL otherwise.
   *
   * @param role static database role
   * @return current credential
   */
  public Credential getStaticCredential(final String role) {
    final var key = SecretKey.staticCredential(role);
    final var cached = cache.get(key);
    if (cached.isPresent()) {
      logger.log(DEBUG, "Cache hit for static role {0}", role);
      return (Credential) cached.get();
    }

    final var fetched =
        call("static credential for " + role, token -> store.staticCredential(token, role));
    final var credential =
        new Credential(
            "static:" + role,
            fetched.username(),
            fetched.password(),
            fetched.lastRotation() != null ? fetched.lastRotation() : clock.instant(),
            fetched.rotationPeriod() != null ? fetched.rotationPeriod() : staticCredentialTtl);
    cache.put(key, credential, cappedTtl(staticCredentialTtl));
    return credential;
  }

  /**
   * Formats a connection string from a freshly issued credential.
   *
   * <p>{@code {username}} and {@code {password}} are replaced with the credential, every other
   * {@code {name}} with the matching entry of {@code params}.
   *
   * @param role database role
   * @param template e.g. {@code postgresql://{username}:{password}@{host}/{database}}
   * @param params additional placeholders
   * @return the formatted string
   */
  public String connectionString(
      final String role, final String template, final Map<String, String> params) {
    final var credential = issueCredential(role);
    var result =
        template
            .replace("{username}", credential.username())
            .replace("{password}", credential.password());
    for (final var param : params.entrySet()) {
      result = result.replace("{" + param.getKey() + "}", param.getValue());
    }
    return result;
  }

  /**
   * Drops every cached version of a KV path.
   *
   * @param path secret path
   */
  public void invalidate(final String path) {
    cache.invalidateIf(key -> key.kind() == SecretKey.Kind.KV && key.path().equals(path));
  }

  /**
   * Drops the cached static credential of a role.
   *
   * @param role static database role
   */
  public void invalidateStaticCredential(final String role) {
    cache.invalidate(SecretKey.staticCredential(role));
  }

  // A missing, zero or negative store lease leaves the value unbounded by the store.
  private Duration leaseTtl(final Duration lease) {
    if (lease == null || lease.isNegative() || lease.isZero()) return cache.defaultTtl();
    return cappedTtl(lease);
  }

  private Duration cappedTtl(final Duration requested) {
    final var ceiling = cache.defaultTtl();
    if (requested == null || requested.isNegative()) return ceiling;
    return requested.compareTo(ceiling) < 0 ? requested : ceiling;
  }

  private <T> T call(final String operation, final Function<String, T> storeCall) {
    return Retry.transientRetry(
        () -> authenticated(operation, storeCall),
        e -> e instanceof StoreUnavailableException,
        retryPolicy);
  }

  /** Outcome of the previous attempt in {@link #authenticated}. */
  private enum Attempt {
    FIRST,
    AFTER_REAUTHENTICATION
  }

  private <T> T authenticated(final String operation, final Function<String, T> storeCall) {
    var attempt = Attempt.FIRST;
    while (true) {
      final var token = session.ensureValid();
      try {
        return storeCall.apply(token);
      } catch (final SecretStoreException e) {
        switch (e.reason()) {
          case UNAUTHORIZED -> {
            if (attempt == Attempt.AFTER_REAUTHENTICATION) {
              throw new AuthenticationException(
                  operation + " rejected after re-authentication", e);
            }
            logger.log(WARNING, "Token rejected during {0}, re-authenticating", operation);
            session.invalidate(token);
            attempt = Attempt.AFTER_REAUTHENTICATION;
          }
          case NOT_FOUND -> throw new SecretNotFoundException(operation + ": not found", e);
          case TIMEOUT -> throw new StoreUnavailableException(operation + " timed out", e, true);
          case UNAVAILABLE -> throw new StoreUnavailableException(operation + " failed", e);
        }
      }
    }
  }
}
