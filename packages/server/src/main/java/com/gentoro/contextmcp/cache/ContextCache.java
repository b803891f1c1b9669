package com.gentoro.contextmcp.cache;

import java.util.Optional;
import java.util.UUID;

/**
 * Read-through cache in front of item reads. Never authoritative: implementations must treat any
 * internal failure as a miss and must not throw.
 */
public interface ContextCache {

  <T> Optional<T> get(String key, Class<T> type);

  void put(String key, Object value);

  void invalidate(String key);

  CacheStatistics stats();

  static String itemKey(UUID itemId, boolean includeVersions) {
    return "item:" + itemId + (includeVersions ? ":versions" : "");
  }
}
