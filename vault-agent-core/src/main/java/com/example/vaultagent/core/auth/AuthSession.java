package com.example.vaultagent.core.auth;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.vaultagent.core.AuthenticationException;
import com.example.vaultagent.core.StoreUnavailableException;
import com.example.vaultagent.core.secrets.SecretStore;
import com.example.vaultagent.core.secrets.SecretStoreException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Holds the current store token and logs in again when it has expired.
 *
 * <p>State machine:
 *
 * <pre>
 * UNAUTHENTICATED  --ensureValid-->   REAUTHENTICATING
 * VALID            --expired lease--> REAUTHENTICATING
 * VALID            --invalidate-->    UNAUTHENTICATED
 * REAUTHENTICATING --success-->       VALID
 * REAUTHENTICATING --failure-->       UNAUTHENTICATED
 * </pre>
 *
 * <p>At most one login is in flight. Callers arriving while it runs wait for it and receive the
 * same token, or the same exception. The login call itself runs outside the state lock. A failed
 * login is reported once per caller; it is never retried here.
 */
public final class AuthSession {

  private static final System.Logger logger = System.getLogger(AuthSession.class.getName());

  /** Authentication state. */
  public enum State {
    UNAUTHENTICATED,
    VALID,
    REAUTHENTICATING
  }

  private final SecretStore store;
  private final String roleId;
  private final String secretId;
  private final Clock clock;

  private final Object lock = new Object();
  private State state = State.UNAUTHENTICATED;
  private String token;
  private Instant issuedAt;
  private Duration leaseDuration;
  private CompletableFuture<String> inFlight;

  public AuthSession(
      final SecretStore store, final String roleId, final String secretId, final Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.roleId = Objects.requireNonNull(roleId, "roleId");
    this.secretId = Objects.requireNonNull(secretId, "secretId");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns a token valid at the time of the call, logging in first if needed.
   *
   * @return the session token
   * @throws AuthenticationException if the login is rejected
   * @throws StoreUnavailableException if the store cannot be reached or times out
   */
  public String ensureValid() {
    final CompletableFuture<String> pending;
    final boolean leader;
    synchronized (lock) {
      if (isValidLocked(clock.instant())) return token;
      leader = inFlight == null;
      if (leader) {
        inFlight = new CompletableFuture<>();
        state = State.REAUTHENTICATING;
      }
      pending = inFlight;
    }
    if (leader) return login(pending);

    logger.log(DEBUG, "Waiting for in-flight authentication");
    return await(pending);
  }

  /** Forces the next {@link #ensureValid()} to log in again. */
  public void invalidate() {
    synchronized (lock) {
      if (state == State.VALID) {
        state = State.UNAUTHENTICATED;
        token = null;
        logger.log(DEBUG, "Session token invalidated");
      }
    }
  }

  /**
   * Invalidates the session only if {@code rejectedToken} is still the current token, so a token
   * renewed by another caller in the meantime survives.
   *
   * @param rejectedToken token the store refused
   */
  public void invalidate(final String rejectedToken) {
    synchronized (lock) {
      if (state == State.VALID && Objects.equals(token, rejectedToken)) {
        state = State.UNAUTHENTICATED;
        token = null;
        logger.log(DEBUG, "Session token invalidated after rejection");
      }
    }
  }

  public State state() {
    synchronized (lock) {
      return state;
    }
  }

  public boolean isValid() {
    synchronized (lock) {
      return isValidLocked(clock.instant());
    }
  }

  private boolean isValidLocked(final Instant now) {
    if (state != State.VALID) return false;
    return leaseDuration.isZero() || now.isBefore(issuedAt.plus(leaseDuration));
  }

  private String login(final CompletableFuture<String> pending) {
    final var requestedAt = clock.instant();
    try {
      final var session = store.login(roleId, secretId);
      synchronized (lock) {
        token = session.token();
        issuedAt = requestedAt;
        leaseDuration = session.leaseDuration() == null ? Duration.ZERO : session.leaseDuration();
        state = State.VALID;
        inFlight = null;
      }
      logger.log(INFO, "Authenticated with secret store, token lease {0}", leaseDuration);
      pending.complete(session.token());
      return session.token();
    } catch (final RuntimeException e) {
      final var failure = translate(e);
      synchronized (lock) {
        token = null;
        state = State.UNAUTHENTICATED;
        inFlight = null;
      }
      logger.log(WARNING, "Authentication with secret store failed: {0}", failure.getMessage());
      pending.completeExceptionally(failure);
      throw failure;
    } catch (final Error e) {
      synchronized (lock) {
        token = null;
        state = State.UNAUTHENTICATED;
        inFlight = null;
      }
      logger.log(ERROR, "Authentication with secret store failed unexpectedly", e);
      pending.completeExceptionally(e);
      throw e;
    }
  }

  private static RuntimeException translate(final RuntimeException e) {
    if (e instanceof SecretStoreException sse) {
      return switch (sse.reason()) {
        case UNAVAILABLE -> new StoreUnavailableException("Store unavailable during login", e);
        case TIMEOUT -> new StoreUnavailableException("Login timed out", e, true);
        case UNAUTHORIZED, NOT_FOUND -> new AuthenticationException(
            "Failed to authenticate: " + e.getMessage(), e);
      };
    }
    if (e instanceof AuthenticationException || e instanceof StoreUnavailableException) return e;
    return new AuthenticationException("Failed to authenticate: " + e.getMessage(), e);
  }

  private static String await(final CompletableFuture<String> pending) {
    try {
      return pending.join();
    } catch (final CompletionException e) {
      if (e.getCause() instanceof RuntimeException re) throw re;
      if (e.getCause() instanceof Error err) throw err;
      throw e;
    }
  }
}
