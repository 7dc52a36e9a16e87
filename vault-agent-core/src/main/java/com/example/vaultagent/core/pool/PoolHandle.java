package com.example.vaultagent.core.pool;

import com.example.vaultagent.core.secrets.Credential;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * A pool together with the credential it was built from and its lifecycle state.
 *
 * <p>Borrowing increments a counter before checking the state, so a handle moved to {@link
 * State#DRAINING} is retired exactly once, by whichever side observes the counter reach zero
 * last.
 *
 * @param <P> pool type
 */
public final class PoolHandle<P> {

  /** Lifecycle of a handle. */
  public enum State {
    /** Serving new borrows. */
    ACTIVE,
    /** Replaced; waiting for outstanding borrows to be returned. */
    DRAINING,
    /** Closed. */
    RETIRED
  }

  private final String role;
  private final P pool;
  private final Credential credential;
  private final Consumer<PoolHandle<P>> onRetire;
  private final AtomicReference<State> state = new AtomicReference<>(State.ACTIVE);
  private final AtomicInteger borrows = new AtomicInteger();

  PoolHandle(
      final String role,
      final P pool,
      final Credential credential,
      final Consumer<PoolHandle<P>> onRetire) {
    this.role = role;
    this.pool = pool;
    this.credential = credential;
    this.onRetire = onRetire;
  }

  public String role() {
    return role;
  }

  public P pool() {
    return pool;
  }

  public Credential credential() {
    return credential;
  }

  public State state() {
    return state.get();
  }

  public int borrowCount() {
    return borrows.get();
  }

  boolean tryAcquire() {
    borrows.incrementAndGet();
    if (state.get() == State.ACTIVE) return true;
    release();
    return false;
  }

  void release() {
    if (borrows.decrementAndGet() == 0 && state.get() == State.DRAINING) retire();
  }

  void drain() {
    if (state.compareAndSet(State.ACTIVE, State.DRAINING) && borrows.get() == 0) retire();
  }

  void retireNow() {
    if (state.getAndSet(State.RETIRED) != State.RETIRED) onRetire.accept(this);
  }

  private void retire() {
    if (state.compareAndSet(State.DRAINING, State.RETIRED)) onRetire.accept(this);
  }

  @Override
  public String toString() {
    return "PoolHandle[role="
        + role
        + ", lease="
        + credential.leaseId()
        + ", state="
        + state.get()
        + ", borrows="
        + borrows.get()
        + "]";
  }
}
