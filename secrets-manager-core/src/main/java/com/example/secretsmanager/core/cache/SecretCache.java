package com.example.secretsmanager.core.cache;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.secretsmanager.core.crypto.KeyRotationListener;
import com.example.secretsmanager.core.model.Secret;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded cache of decrypted secrets keyed by {@code path:version} or {@code path:latest}.
 *
 * <p>Every entry carries its own TTL and is never returned once it has expired. A secondary index
 * from path to cache keys lets {@link #invalidate(String)} remove exactly the keys of matching
 * paths. Invalidation bumps an epoch; a put stamped with an older epoch is discarded, so a read
 * that raced with a write cannot repopulate the cache with the value it replaced.
 */
public class SecretCache implements KeyRotationListener {

  private static final System.Logger LOGGER = System.getLogger(SecretCache.class.getName());

  public static final String LATEST = "latest";
  private static final int PRUNE_EVERY_PUTS = 1_024;

  private final Cache<String, Entry> cache;
  private final ConcurrentHashMap<String, Set<String>> keysByPath = new ConcurrentHashMap<>();
  private final AtomicLong epoch = new AtomicLong();
  private final AtomicInteger putsSincePrune = new AtomicInteger();

  public SecretCache(final long maxSize) {
    this(maxSize, Ticker.systemTicker());
  }

  public SecretCache(final long maxSize, final Ticker ticker) {
    if (maxSize < 1) throw new IllegalArgumentException("maxSize must be >= 1");
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfter(new PerEntryExpiry())
            .ticker(ticker)
            .executor(Runnable::run)
            .recordStats()
            .build();
  }

  /** Cache key of a specific version, or of the latest one when {@code version} is null. */
  public static String key(final String path, final Integer version) {
    return path + ":" + (version == null ? LATEST : version.toString());
  }

  static String pathOf(final String key) {
    return key.substring(0, key.lastIndexOf(':'));
  }

  /** Returns the cached secret unless absent or expired. */
  public Optional<Secret> get(final String key) {
    return Optional.ofNullable(cache.getIfPresent(key)).map(Entry::secret);
  }

  /** Current invalidation epoch, to be passed to {@link #put(String, Secret, Duration, long)}. */
  public long stamp() {
    return epoch.get();
  }

  public void put(final String key, final Secret secret, final Duration ttl) {
    put(key, secret, ttl, epoch.get());
  }

  /**
   * Caches {@code secret} for {@code ttl} unless an invalidation happened after {@code stamp} was
   * taken.
   *
   * @return whether the entry was stored
   */
  public boolean put(final String key, final Secret secret, final Duration ttl, final long stamp) {
    if (ttl.isZero() || ttl.isNegative()) return false;
    final var stored = new boolean[1];
    keysByPath.compute(
        pathOf(key),
        (path, keys) -> {
          if (epoch.get() != stamp) return keys;
          final var indexed = keys == null ? ConcurrentHashMap.<String>newKeySet() : keys;
          indexed.add(key);
          cache.put(key, new Entry(secret, ttl.toNanos()));
          stored[0] = true;
          return indexed;
        });
    if (!stored[0]) LOGGER.log(DEBUG, "Discarded stale cache fill for {0}", key);
    if (putsSincePrune.incrementAndGet() >= PRUNE_EVERY_PUTS) pruneIndex();
    return stored[0];
  }

  /**
   * Removes every entry whose path starts with {@code prefix}. Completes before returning.
   *
   * @return number of removed keys
   */
  public int invalidate(final String prefix) {
    epoch.incrementAndGet();
    final var removed = new AtomicInteger();
    for (final var path : List.copyOf(keysByPath.keySet())) {
      if (!path.startsWith(prefix)) continue;
      keysByPath.computeIfPresent(
          path,
          (p, keys) -> {
            cache.invalidateAll(keys);
            removed.addAndGet(keys.size());
            return null;
          });
    }
    LOGGER.log(DEBUG, "Invalidated {0} cache keys under {1}", removed.get(), prefix);
    return removed.get();
  }

  public void clear() {
    epoch.incrementAndGet();
    cache.invalidateAll();
    keysByPath.clear();
  }

  @Override
  public void onKeyRotated(final String newKeyId) {
    clear();
    LOGGER.log(DEBUG, "Cache flushed after key rotation to {0}", newKeyId);
  }

  public long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  public long hitCount() {
    return cache.stats().hitCount();
  }

  public long missCount() {
    return cache.stats().missCount();
  }

  public double hitRate() {
    return cache.stats().hitRate();
  }

  /** Drops index entries for keys the cache evicted on its own. */
  void pruneIndex() {
    putsSincePrune.set(0);
    for (final var path : List.copyOf(keysByPath.keySet())) {
      keysByPath.computeIfPresent(
          path,
          (p, keys) -> {
            keys.removeIf(k -> !cache.asMap().containsKey(k));
            return keys.isEmpty() ? null : keys;
          });
    }
  }

  int indexedPaths() {
    return keysByPath.size();
  }

  private record Entry(Secret secret, long ttlNanos) {}

  private static final class PerEntryExpiry implements Expiry<String, Entry> {
    @Override
    public long expireAfterCreate(final String key, final Entry value, final long currentTime) {
      return value.ttlNanos();
    }

    @Override
    public long expireAfterUpdate(
        final String key, final Entry value, final long currentTime, final long currentDuration) {
      return value.ttlNanos();
    }

    @Override
    public long expireAfterRead(
        final String key, final Entry value, final long currentTime, final long currentDuration) {
      return currentDuration;
    }
  }
}
