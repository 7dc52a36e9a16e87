package com.example.vaultagent.core.secrets;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Runs at most one unit of work per key at a time; concurrent callers for the same key wait for
 * and share the outcome of the call already in flight.
 *
 * @param <K> key type
 * @param <V> result type
 */
final class SingleFlight<K, V> {

  private final ConcurrentHashMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

  V execute(final K key, final Supplier<V> work) {
    final var mine = new CompletableFuture<V>();
    final var existing = inFlight.putIfAbsent(key, mine);
    if (existing != null) return await(existing);

    try {
      final var result = work.get();
      mine.complete(result);
      return result;
    } catch (final RuntimeException | Error e) {
      mine.completeExceptionally(e);
      throw e;
    } finally {
      inFlight.remove(key, mine);
    }
  }

  boolean isInFlight(final K key) {
    return inFlight.containsKey(key);
  }

  private static <V> V await(final CompletableFuture<V> future) {
    try {
      return future.join();
    } catch (final CompletionException e) {
      final var cause = e.getCause();
      if (cause instanceof RuntimeException re) throw re;
      if (cause instanceof Error err) throw err;
      throw e;
    }
  }
}
