package com.gentoro.contextmcp.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import java.time.Duration;
import java.util.Optional;
import org.apache.commons.configuration2.Configuration;

/**
 * In-process cache backed by Caffeine, bounded by entry count and write age.
 *
 * <p>Configuration: {@code cache.enabled} (true), {@code cache.max-size} (10000), {@code
 * cache.ttl} (ISO-8601, PT5M).
 */
public class CaffeineContextCache implements ContextCache {
  private static final org.slf4j.Logger log =
      com.gentoro.contextmcp.logging.LoggingService.getLogger(CaffeineContextCache.class);

  private final Cache<String, Object> cache;

  public CaffeineContextCache(long maxSize, Duration ttl) {
    this.cache =
        Caffeine.newBuilder().maximumSize(maxSize).expireAfterWrite(ttl).recordStats().build();
  }

  /** Caffeine cache when enabled, otherwise a {@link NoOpContextCache}. */
  public static ContextCache fromConfiguration(Configuration cfg) {
    if (!cfg.getBoolean("cache.enabled", true)) {
      log.info("Context cache disabled");
      return new NoOpContextCache();
    }
    long maxSize = cfg.getLong("cache.max-size", 10_000L);
    Duration ttl = Duration.parse(cfg.getString("cache.ttl", "PT5M"));
    log.info("Context cache enabled (max-size={}, ttl={})", maxSize, ttl);
    return new CaffeineContextCache(maxSize, ttl);
  }

  @Override
  public <T> Optional<T> get(String key, Class<T> type) {
    try {
      Object value = cache.getIfPresent(key);
      return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    } catch (RuntimeException e) {
      log.warn("Cache read failed for {}; treating as miss", key, e);
      return Optional.empty();
    }
  }

  @Override
  public void put(String key, Object value) {
    if (value == null) return;
    try {
      cache.put(key, value);
    } catch (RuntimeException e) {
      log.warn("Cache write failed for {}", key, e);
    }
  }

  @Override
  public void invalidate(String key) {
    try {
      cache.invalidate(key);
    } catch (RuntimeException e) {
      log.warn("Cache invalidation failed for {}", key, e);
    }
  }

  @Override
  public CacheStatistics stats() {
    CacheStats s = cache.stats();
    return new CacheStatistics(
        true, cache.estimatedSize(), s.hitCount(), s.missCount(), s.evictionCount());
  }
}
