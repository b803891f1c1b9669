package com.gentoro.contextmcp.cache;

import java.util.Optional;

/** Used when caching is disabled; every lookup misses. */
public class NoOpContextCache implements ContextCache {

  @Override
  public <T> Optional<T> get(String key, Class<T> type) {
    return Optional.empty();
  }

  @Override
  public void put(String key, Object value) {}

  @Override
  public void invalidate(String key) {}

  @Override
  public CacheStatistics stats() {
    return CacheStatistics.disabled();
  }
}
