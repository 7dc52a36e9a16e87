package com.example.vaultagent.core.pool;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.example.vaultagent.core.ConfigurationException;
import com.example.vaultagent.core.MutableClock;
import com.example.vaultagent.core.Retry;
import com.example.vaultagent.core.StoreUnavailableException;
import com.example.vaultagent.core.TestThreads;
import com.example.vaultagent.core.auth.AuthSession;
import com.example.vaultagent.core.cache.TtlCache;
import com.example.vaultagent.core.secrets.CredentialBroker;
import com.example.vaultagent.core.secrets.DatabaseLease;
import com.example.vaultagent.core.secrets.SecretStore;
import com.example.vaultagent.core.secrets.SecretStoreException;
import com.example.vaultagent.core.secrets.SecretStoreException.Reason;
import com.example.vaultagent.core.secrets.Session;
import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class OnDemandPoolManagerTest {

  private static final String ROLE = "reports-ro";

  private SecretStore store;
  private MutableClock clock;
  private FakePoolFactory factory;
  private CredentialBroker broker;
  private OnDemandPoolManager<FakePoolFactory.FakePool> manager;
  private AtomicInteger leases;

  @BeforeEach
  void setUp() {
    store = mock(SecretStore.class);
    clock = MutableClock.atEpoch();
    leases = new AtomicInteger();
    when(store.login(anyString(), anyString())).thenReturn(new Session("t1", Duration.ZERO));
    doAnswer(inv -> nextLease()).when(store).issueCredential("t1", ROLE);
    factory = new FakePoolFactory();
    broker =
        new CredentialBroker(
            store,
            new AuthSession(store, "role-id", "secret-id", clock),
            new TtlCache<>(Duration.ofSeconds(300), 100, clock),
            Duration.ofSeconds(300),
            Retry.Policy.none(),
            clock);
    manager =
        new OnDemandPoolManager<>(
            ROLE, broker, new PoolCoordinator<>(factory, "SELECT 1"), 0.8, clock);
  }

  @AfterEach
  void tearDown() {
    manager.close();
  }

  private DatabaseLease nextLease() {
    final var n = leases.incrementAndGet();
    return new DatabaseLease("lease-" + n, "v-user-" + n, "pw-" + n, Duration.ofSeconds(100));
  }

  private void failIssuance() {
    doThrow(new SecretStoreException(Reason.UNAVAILABLE, "503"))
        .when(store)
        .issueCredential("t1", ROLE);
  }

  @Test
  @DisplayName("Should create the first pool on the first borrow")
  void shouldCreatePoolOnFirstBorrow() {
    assertTrue(manager.currentCredential().isEmpty());

    try (var borrowed = manager.borrow()) {
      assertEquals("lease-1", borrowed.credential().leaseId());
      assertEquals("v-user-1", borrowed.pool().credential.username());
    }
  }

  @Test
  @DisplayName("Should reuse the pool until the refresh point")
  void shouldReusePoolBeforeRefreshPoint() {
    manager.borrow().close();
    clock.advanceSeconds(79);

    try (var borrowed = manager.borrow()) {
      assertEquals("lease-1", borrowed.credential().leaseId());
    }
    verify(store, times(1)).issueCredential("t1", ROLE);
  }

  @Test
  @DisplayName("Should refresh in the borrowing thread once the refresh point is reached")
  void shouldRefreshWhenDue() {
    final var outstanding = manager.borrow();
    clock.advanceSeconds(80);

    try (var borrowed = manager.borrow()) {
      assertEquals("lease-2", borrowed.credential().leaseId());
    }
    assertFalse(outstanding.pool().closed);
    outstanding.close();
    assertTrue(outstanding.pool().closed);
  }

  @Test
  @DisplayName("Should lend the current pool when a refresh fails before expiry")
  void shouldFallBackToUnexpiredPool() {
    manager.borrow().close();
    clock.advanceSeconds(90);
    failIssuance();

    try (var borrowed = manager.borrow()) {
      assertEquals("lease-1", borrowed.credential().leaseId());
    }
  }

  @Test
  @DisplayName("Should lend the current pool when the new pool fails validation")
  void shouldFallBackWhenValidationFails() {
    manager.borrow().close();
    clock.advanceSeconds(90);
    factory.valid = false;

    try (var borrowed = manager.borrow()) {
      assertEquals("lease-1", borrowed.credential().leaseId());
    }
    assertTrue(factory.built.get(1).closed);
  }

  @Test
  @DisplayName("Should fail when the refresh fails and the credential has expired")
  void shouldFailWhenExpired() {
    manager.borrow().close();
    clock.advanceSeconds(100);
    failIssuance();

    assertThrows(StoreUnavailableException.class, () -> manager.borrow());
  }

  @Test
  @DisplayName("Should fail when the first pool cannot be created")
  void shouldFailWithoutAnyPool() {
    failIssuance();

    assertThrows(StoreUnavailableException.class, () -> manager.borrow());
  }

  @Test
  @DisplayName("Should refresh on demand regardless of the lease")
  void shouldForceRefresh() {
    manager.borrow().close();

    assertEquals("lease-2", manager.refreshNow().leaseId());
    assertEquals("lease-2", manager.currentCredential().orElseThrow().leaseId());
  }

  @Test
  @DisplayName("Should refresh once when many borrowers find the credential stale")
  void shouldRefreshOnceForConcurrentBorrowers() throws Exception {
    manager.borrow().close();
    clock.advanceSeconds(85);
    final var release = new CountDownLatch(1);
    doAnswer(
            inv -> {
              release.await(5, TimeUnit.SECONDS);
              return nextLease();
            })
        .when(store)
        .issueCredential("t1", ROLE);

    final var threads = new ArrayList<Thread>();
    final var results =
        TestThreads.startAll(
            threads,
            6,
            () -> {
              try (var borrowed = manager.borrow()) {
                return borrowed.credential().leaseId();
              }
            });
    TestThreads.awaitParked(threads);
    release.countDown();

    for (final var result : results) assertEquals("lease-2", result.get(5, TimeUnit.SECONDS));
    verify(store, times(2)).issueCredential("t1", ROLE);
  }

  @Test
  @DisplayName("Should reject a refresh buffer outside (0, 1]")
  void shouldRejectBadBuffer() {
    final var coordinator = new PoolCoordinator<>(factory, "SELECT 1");
    assertThrows(
        ConfigurationException.class,
        () -> new OnDemandPoolManager<>(ROLE, broker, coordinator, 1.01, clock));
  }
}
