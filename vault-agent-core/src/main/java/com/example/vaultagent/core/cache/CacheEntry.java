package com.example.vaultagent.core.cache;

import java.time.Instant;

/**
 * Single cached value with its lifetime.
 *
 * @param key the cache key
 * @param value the cached value
 * @param createdAt when the entry was inserted
 * @param expiresAt first instant at which the entry is no longer served, always after {@code
 *     createdAt}
 * @param <K> key type
 * @param <V> value type
 */
public record CacheEntry<K, V>(K key, V value, Instant createdAt, Instant expiresAt) {

  public CacheEntry {
    if (!expiresAt.isAfter(createdAt))
      throw new IllegalArgumentException("expiresAt must be after createdAt");
  }

  boolean isExpired(final Instant now) {
    return !now.isBefore(expiresAt);
  }
}
