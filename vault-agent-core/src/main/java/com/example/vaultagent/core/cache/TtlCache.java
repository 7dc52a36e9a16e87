package com.example.vaultagent.core.cache;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.vaultagent.core.ConfigurationException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Thread-safe in-memory cache bounded by entry lifetime and entry count.
 *
 * <p>Entries are evicted in insertion order once the cache is full; reads do not promote entries.
 * Expired entries are dropped lazily when a lookup meets them, and in bulk when a put finds the
 * cache full or {@link #purgeExpired()} is called.
 *
 * <p>A default TTL of zero turns the cache into a pass-through: every lookup misses and puts are
 * ignored.
 *
 * <pre>{@code
 * var cache = new TtlCache<String, String>(Duration.ofMinutes(5), 1000, Clock.systemUTC());
 * cache.put("db/password", "s3cr3t");
 * cache.get("db/password").ifPresent(this::connect);
 * }</pre>
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class TtlCache<K, V> {

  private static final System.Logger logger = System.getLogger(TtlCache.class.getName());

  private final Object lock = new Object();
  private final LinkedHashMap<K, CacheEntry<K, V>> entries = new LinkedHashMap<>();
  private final int capacity;
  private final Clock clock;

  private Duration defaultTtl;
  private long hits;
  private long misses;

  /**
   * @param defaultTtl lifetime applied by {@link #put(Object, Object)}; zero disables caching
   * @param capacity maximum number of entries, at least 1
   * @param clock time source
   * @throws ConfigurationException if the TTL is negative or the capacity is below 1
   */
  public TtlCache(final Duration defaultTtl, final int capacity, final Clock clock) {
    if (capacity < 1) throw new ConfigurationException("capacity must be >= 1, was " + capacity);
    this.defaultTtl = checkTtl(defaultTtl);
    this.capacity = capacity;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Looks up a live entry.
   *
   * @param key the key
   * @return the value, or empty when absent or expired
   */
  public Optional<V> get(final K key) {
    synchronized (lock) {
      final var entry = entries.get(key);
      if (entry != null) {
        if (!entry.isExpired(clock.instant())) {
          hits++;
          return Optional.of(entry.value());
        }
        entries.remove(key);
      }
      misses++;
      return Optional.empty();
    }
  }

  /**
   * Stores a value with the default TTL.
   *
   * @param key the key
   * @param value the value, not null
   */
  public void put(final K key, final V value) {
    final Duration ttl;
    synchronized (lock) {
      ttl = defaultTtl;
    }
    put(key, value, ttl);
  }

  /**
   * Stores a value with an explicit TTL. Replacing a key re-inserts it as the newest entry.
   *
   * @param key the key
   * @param value the value, not null
   * @param ttl entry lifetime; zero makes this call a no-op
   */
  public void put(final K key, final V value, final Duration ttl) {
    Objects.requireNonNull(value, "value");
    checkTtl(ttl);
    if (ttl.isZero()) return;

    synchronized (lock) {
      final var now = clock.instant();
      final var replaced = entries.remove(key) != null;
      if (!replaced && entries.size() >= capacity) {
        purgeExpiredLocked();
        if (entries.size() >= capacity) evictOldestLocked();
      }
      entries.put(key, new CacheEntry<>(key, value, now, now.plus(ttl)));
    }
  }

  /**
   * Removes a single key.
   *
   * @param key the key
   * @return true if an entry was removed
   */
  public boolean invalidate(final K key) {
    synchronized (lock) {
      return entries.remove(key) != null;
    }
  }

  /**
   * Removes every key matching the predicate.
   *
   * @param predicate key filter
   * @return number of entries removed
   */
  public int invalidateIf(final Predicate<? super K> predicate) {
    synchronized (lock) {
      final var before = entries.size();
      entries.keySet().removeIf(predicate);
      return before - entries.size();
    }
  }

  /** Removes all entries, keeping hit and miss counters. */
  public void clear() {
    clear(false);
  }

  /**
   * Removes all entries.
   *
   * @param resetCounters whether hit and miss counters are reset too
   */
  public void clear(final boolean resetCounters) {
    synchronized (lock) {
      entries.clear();
      if (resetCounters) {
        hits = 0;
        misses = 0;
      }
    }
  }

  /**
   * Drops every expired entry.
   *
   * @return number of entries removed
   */
  public int purgeExpired() {
    synchronized (lock) {
      return purgeExpiredLocked();
    }
  }

  public CacheStats stats() {
    synchronized (lock) {
      return new CacheStats(hits, misses, entries.size(), capacity);
    }
  }

  public Duration defaultTtl() {
    synchronized (lock) {
      return defaultTtl;
    }
  }

  /**
   * Changes the TTL used by subsequent {@link #put(Object, Object)} calls. Existing entries keep
   * their expiry.
   *
   * @param ttl new default TTL; zero disables caching
   */
  public void setDefaultTtl(final Duration ttl) {
    checkTtl(ttl);
    synchronized (lock) {
      defaultTtl = ttl;
    }
  }

  public int capacity() {
    return capacity;
  }

  private int purgeExpiredLocked() {
    final var now = clock.instant();
    final var before = entries.size();
    entries.values().removeIf(entry -> entry.isExpired(now));
    return before - entries.size();
  }

  private void evictOldestLocked() {
    final var eldest = entries.keySet().iterator();
    if (eldest.hasNext()) {
      final var key = eldest.next();
      eldest.remove();
      logger.log(DEBUG, "Cache full, evicted oldest entry {0}", key);
    }
  }

  private static Duration checkTtl(final Duration ttl) {
    if (ttl == null || ttl.isNegative())
      throw new ConfigurationException("ttl must be non-negative, was " + ttl);
    return ttl;
  }
}
