package com.gentoro.contextmcp.cache;

public record CacheStatistics(
    boolean enabled, long size, long hitCount, long missCount, long evictionCount) {

  public static CacheStatistics disabled() {
    return new CacheStatistics(false, 0, 0, 0, 0);
  }
}
