package com.gentoro.contextmcp.cache;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;

class CaffeineContextCacheTest {

  private final CaffeineContextCache cache = new CaffeineContextCache(100, Duration.ofMinutes(5));

  @Test
  void testPutAndGet() {
    cache.put("k", "value");
    assertEquals(Optional.of("value"), cache.get("k", String.class));
  }

  @Test
  void testTypeMismatchIsMiss() {
    cache.put("k", 42);
    assertTrue(cache.get("k", String.class).isEmpty());
    assertEquals(Optional.of(42), cache.get("k", Integer.class));
  }

  @Test
  void testNullValueIgnored() {
    cache.put("k", null);
    assertTrue(cache.get("k", Object.class).isEmpty());
  }

  @Test
  void testInvalidate() {
    cache.put("k", "value");
    cache.invalidate("k");
    assertTrue(cache.get("k", String.class).isEmpty());
  }

  @Test
  void testStatistics() {
    cache.put("k", "value");
    cache.get("k", String.class);
    cache.get("missing", String.class);

    CacheStatistics stats = cache.stats();
    assertTrue(stats.enabled());
    assertEquals(1, stats.size());
    assertEquals(1, stats.hitCount());
    assertEquals(1, stats.missCount());
  }

  @Test
  void testItemKey() {
    UUID id = UUID.fromString("00000000-0000-0000-0000-000000000001");
    assertEquals("item:" + id, ContextCache.itemKey(id, false));
    assertEquals("item:" + id + ":versions", ContextCache.itemKey(id, true));
  }

  @Test
  void testFromConfigurationDisabled() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("cache.enabled", false);

    ContextCache disabled = CaffeineContextCache.fromConfiguration(cfg);
    assertInstanceOf(NoOpContextCache.class, disabled);
    disabled.put("k", "value");
    assertTrue(disabled.get("k", String.class).isEmpty());
    assertEquals(CacheStatistics.disabled(), disabled.stats());
  }

  @Test
  void testFromConfigurationDefaults() {
    ContextCache enabled = CaffeineContextCache.fromConfiguration(new BaseConfiguration());
    assertInstanceOf(CaffeineContextCache.class, enabled);
    assertTrue(enabled.stats().enabled());
  }
}
