package com.example.vaultagent.core.cache;

/**
 * Point-in-time snapshot of cache counters.
 *
 * @param hits lookups answered from the cache
 * @param misses lookups that found nothing or an expired entry
 * @param size entries currently held, expired ones included until they are purged
 * @param capacity maximum number of entries
 */
public record CacheStats(long hits, long misses, int size, int capacity) {

  /**
   * @return hits divided by total lookups, or 0 when nothing was looked up yet
   */
  public double hitRatio() {
    final var total = hits + misses;
    return total == 0 ? 0.0 : (double) hits / total;
  }
}
