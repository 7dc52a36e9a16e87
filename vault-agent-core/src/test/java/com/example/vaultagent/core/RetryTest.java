package com.example.vaultagent.core;

import static com.example.vaultagent.core.Retry.*;
import static org.junit.jupiter.api.Assertions.*;

import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class RetryTest {

  @AfterEach
  void clearInterruptFlag() {
    if (Thread.currentThread().isInterrupted()) Thread.interrupted();
  }

  @Nested
  @DisplayName("onException")
  class BasicRetryBehavior {

    @Test
    @DisplayName("Should succeed on first attempt")
    void shouldSucceedOnFirstAttempt() throws Exception {
      final var result = onException(() -> "success", ex -> true, () -> {}, 1, 0L);
      assertEquals("success", result);
    }

    @Test
    @DisplayName("Should run the recovery hook before retrying")
    void shouldRunRecoveryHook() throws Exception {
      final var attempts = new AtomicInteger(0);
      final var refreshes = new AtomicInteger(0);

      final var result =
          onException(
              () -> {
                if (attempts.incrementAndGet() < 2) throw new SQLException("auth", "28P01");
                return "recovered";
              },
              Retry::isAuthError,
              refreshes::incrementAndGet,
              2,
              0L);

      assertEquals("recovered", result);
      assertEquals(2, attempts.get());
      assertEquals(1, refreshes.get());
    }

    @Test
    @DisplayName("Should fail after max attempts")
    void shouldFailAfterMaxAttempts() {
      final var attempts = new AtomicInteger(0);

      assertThrows(
          SQLException.class,
          () ->
              onException(
                  () -> {
                    attempts.incrementAndGet();
                    throw new SQLException("always fails");
                  },
                  ex -> true,
                  () -> {},
                  2,
                  0L));

      assertEquals(2, attempts.get());
    }

    @Test
    @DisplayName("Should not retry when predicate returns false")
    void shouldNotRetryWhenPredicateReturnsFalse() {
      final var attempts = new AtomicInteger(0);
      final var hooks = new AtomicInteger(0);

      assertThrows(
          SQLException.class,
          () ->
              onException(
                  () -> {
                    attempts.incrementAndGet();
                    throw new SQLException("syntax error", "42601");
                  },
                  ex -> false,
                  hooks::incrementAndGet,
                  3,
                  0L));

      assertEquals(1, attempts.get());
      assertEquals(0, hooks.get());
    }
  }

  @Nested
  @DisplayName("onException edge cases")
  class ValidationAndErrorHandling {

    @Test
    @DisplayName("Should throw on invalid max attempts")
    void onExceptionThrowsOnInvalidMaxAttempts() {
      assertThrows(
          IllegalArgumentException.class,
          () -> onException(() -> "test", ex -> true, () -> {}, 0, 0L));
    }

    @Test
    @DisplayName("Should re-interrupt and throw original exception on interrupted delay")
    void onExceptionInterruptedDuringDelayReinterruptsAndThrowsOriginal() {
      Thread.currentThread().interrupt();

      final SQLException thrown =
          assertThrows(
              SQLException.class,
              () ->
                  onException(
                      () -> {
                        throw new SQLException("to retry");
                      },
                      ex -> true,
                      () -> {},
                      2,
                      1000L));

      assertEquals("to retry", thrown.getMessage());
      assertInstanceOf(InterruptedException.class, thrown.getSuppressed()[0]);
      assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    @DisplayName("Should let unchecked failures through without retrying")
    void shouldNotRetryUncheckedFailures() {
      final var attempts = new AtomicInteger(0);

      assertThrows(
          IllegalStateException.class,
          () ->
              onException(
                  () -> {
                    attempts.incrementAndGet();
                    throw new IllegalStateException("pool closed");
                  },
                  ex -> true,
                  () -> {},
                  3,
                  0L));

      assertEquals(1, attempts.get());
    }
  }

  @Nested
  @DisplayName("isAuthError")
  class AuthErrorDetection {

    @Test
    @DisplayName("Should detect auth error from SQL state 28000 and 28P01")
    void shouldDetectAuthStates() {
      assertTrue(isAuthError(new SQLException("denied", "28000")));
      assertTrue(isAuthError(new SQLException("denied", "28P01")));
    }

    @Test
    @DisplayName("Should detect auth error from common message keywords")
    void shouldDetectAuthKeywords() {
      assertTrue(isAuthError(new SQLException("FATAL: password authentication failed for user")));
      assertTrue(isAuthError(new SQLException("Access denied for user 'app'@'%'")));
      assertTrue(isAuthError(new SQLException("Wrong user name or password [28000-224]")));
    }

    @Test
    @DisplayName("Should detect a revoked login and auth failures wrapped in other exceptions")
    void shouldDetectRevokedAndWrappedAuthErrors() {
      assertTrue(isAuthError(new SQLException("FATAL: role \"v_1\" is not permitted to log in")));
      final var wrapped =
          new SQLException("Connection is not available", new SQLException("denied", "28P01"));
      assertTrue(isAuthError(wrapped));
    }

    @Test
    @DisplayName("Should return false when no auth indicators present")
    void shouldReturnFalseWithoutAuthIndicators() {
      assertFalse(isAuthError(new SQLException("duplicate key", "23505")));
      assertFalse(isAuthError(null));
    }
  }

  @Nested
  @DisplayName("Policy")
  class PolicyTests {

    @Test
    @DisplayName("Fixed policy should return constant delay")
    void fixedPolicyShouldReturnConstantDelay() {
      final var policy = Policy.fixed(5, 100L);

      assertEquals(0L, policy.calculateDelay(1), "First attempt should have no delay");
      assertEquals(100L, policy.calculateDelay(2));
      assertEquals(100L, policy.calculateDelay(5));
    }

    @Test
    @DisplayName("Exponential policy should increase delay exponentially")
    void exponentialPolicyShouldIncreaseDelayExponentially() {
      final var policy = Policy.exponential(5, 100L);

      final var delay2 = policy.calculateDelay(2);
      final var delay3 = policy.calculateDelay(3);
      final var delay4 = policy.calculateDelay(4);

      assertEquals(0L, policy.calculateDelay(1));
      assertTrue(delay2 >= 100L && delay2 <= 125L, "Second delay should be ~100ms ± jitter");
      assertTrue(delay3 >= 200L && delay3 <= 250L, "Third delay should be ~200ms ± jitter");
      assertTrue(delay4 >= 400L && delay4 <= 500L, "Fourth delay should be ~400ms ± jitter");
    }

    @Test
    @DisplayName("Exponential policy should respect max delay cap")
    void exponentialPolicyShouldRespectMaxDelayCap() {
      final var policy = new Policy(10, 1000L, 5000L, 2.0, false);

      assertEquals(4000L, policy.calculateDelay(4));
      assertEquals(5000L, policy.calculateDelay(5));
      assertEquals(5000L, policy.calculateDelay(10));
    }

    @Test
    @DisplayName("None policy should allow a single attempt")
    void nonePolicyShouldAllowSingleAttempt() {
      assertEquals(1, Policy.none().maxAttempts());
    }

    @Test
    @DisplayName("Policy should validate constructor arguments")
    void policyShouldValidateConstructorArguments() {
      assertThrows(ConfigurationException.class, () -> new Policy(0, 100L, 100L, 1.0, false));
      assertThrows(ConfigurationException.class, () -> new Policy(1, -1L, 100L, 1.0, false));
      assertThrows(ConfigurationException.class, () -> new Policy(1, 200L, 100L, 1.0, false));
      assertThrows(ConfigurationException.class, () -> new Policy(1, 100L, 100L, 0.5, false));
    }
  }

  @Nested
  @DisplayName("transientRetry")
  class TransientRetryWithPolicy {

    @Test
    @DisplayName("Should succeed on first attempt")
    void shouldSucceedOnFirstAttempt() {
      assertEquals("ok", transientRetry(() -> "ok", e -> true, Policy.fixed(3, 0L)));
    }

    @Test
    @DisplayName("Should retry while the failure is transient")
    void shouldRetryTransientFailures() {
      final var attempts = new AtomicInteger(0);

      final var result =
          transientRetry(
              () -> {
                if (attempts.incrementAndGet() < 3) throw new IllegalStateException("503");
                return "ok";
              },
              e -> e instanceof IllegalStateException,
              Policy.fixed(3, 1L));

      assertEquals("ok", result);
      assertEquals(3, attempts.get());
    }

    @Test
    @DisplayName("Should throw on non-transient error without retrying")
    void shouldThrowOnNonTransientError() {
      final var attempts = new AtomicInteger(0);

      assertThrows(
          IllegalArgumentException.class,
          () ->
              transientRetry(
                  () -> {
                    attempts.incrementAndGet();
                    throw new IllegalArgumentException("bad path");
                  },
                  e -> e instanceof IllegalStateException,
                  Policy.fixed(3, 0L)));

      assertEquals(1, attempts.get());
    }

    @Test
    @DisplayName("Should throw the last failure after max attempts exhausted")
    void shouldThrowAfterMaxAttempts() {
      final var attempts = new AtomicInteger(0);

      final var ex =
          assertThrows(
              IllegalStateException.class,
              () ->
                  transientRetry(
                      () -> {
                        throw new IllegalStateException("attempt " + attempts.incrementAndGet());
                      },
                      e -> true,
                      Policy.fixed(3, 0L)));

      assertEquals("attempt 3", ex.getMessage());
    }

    @Test
    @DisplayName("Should stop waiting when interrupted and keep the interrupt flag")
    void shouldStopOnInterrupt() {
      Thread.currentThread().interrupt();

      final var ex =
          assertThrows(
              IllegalStateException.class,
              () ->
                  transientRetry(
                      () -> {
                        throw new IllegalStateException("503");
                      },
                      e -> true,
                      Policy.fixed(3, 1000L)));

      assertEquals(1, ex.getSuppressed().length);
      assertTrue(Thread.currentThread().isInterrupted());
    }
  }
}
