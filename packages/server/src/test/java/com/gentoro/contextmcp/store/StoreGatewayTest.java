package com.gentoro.contextmcp.store;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.contextmcp.TestStores;
import com.gentoro.contextmcp.exception.NotFoundException;
import com.gentoro.contextmcp.exception.StoreException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class StoreGatewayTest {

  private final StoreGateway store = TestStores.h2();

  @AfterEach
  void tearDown() {
    store.close();
  }

  private int insertUsage(StoreHandle h, String endpoint) {
    return h.update(
        "INSERT INTO api_usage (id, endpoint, method, status_code, response_time_ms, created_at)"
            + " VALUES (?, ?, 'TOOL', 200, 5, ?)",
        UUID.randomUUID(),
        endpoint,
        Instant.parse("2026-01-01T00:00:00Z"));
  }

  private long usageRows() {
    return store.execute("SELECT COUNT(*) AS n FROM api_usage").get(0).getLong("n");
  }

  @Test
  void testTransactionCommits() {
    int inserted = store.withTransaction(null, h -> insertUsage(h, "a"));
    assertEquals(1, inserted);
    assertEquals(1, usageRows());
  }

  @Test
  void testDomainExceptionRollsBackAndPropagatesUnchanged() {
    NotFoundException thrown =
        assertThrows(
            NotFoundException.class,
            () ->
                store.withTransaction(
                    UUID.randomUUID(),
                    h -> {
                      insertUsage(h, "a");
                      throw new NotFoundException("gone");
                    }));
    assertEquals("gone", thrown.getMessage());
    assertEquals(0, usageRows());
  }

  @Test
  void testSavepointDiscardsOnlyFailedWork() {
    store.withTransaction(
        null,
        h -> {
          insertUsage(h, "kept");
          assertThrows(
              StoreException.class,
              () -> h.savepoint("broken", () -> h.update("INSERT INTO no_such_table VALUES (1)")));
          h.savepoint("second", () -> insertUsage(h, "also-kept"));
          return null;
        });
    assertEquals(2, usageRows());
  }

  @Test
  void testUniqueViolationIsRecognized() {
    UUID id = UUID.randomUUID();
    Instant now = Instant.parse("2026-01-01T00:00:00Z");
    String sql =
        "INSERT INTO users (id, username, email, role, created_at, updated_at)"
            + " VALUES (?, ?, ?, 'user', ?, ?)";
    store.update(sql, id, "dup", "dup@example.com", now, now);
    StoreException e =
        assertThrows(
            StoreException.class,
            () -> store.update(sql, UUID.randomUUID(), "dup", "x@example.com", now, now));
    assertTrue(e.isUniqueViolation());
  }

  @Test
  void testRowsNormalizeTypes() {
    Instant now = Instant.parse("2026-01-01T12:30:00Z");
    UUID id = UUID.randomUUID();
    store.update(
        "INSERT INTO context_collections (id, name, owner_id, is_public, tags, metadata,"
            + " created_at, updated_at) VALUES (?, ?, ?, TRUE, ?, ?, ?, ?)",
        id,
        "docs",
        UUID.randomUUID(),
        List.of("x", "y"),
        "{\"k\":1}",
        now,
        now);

    Row row = store.execute("SELECT * FROM context_collections WHERE id = ?", id).get(0);
    assertEquals(id, row.getUuid("id"));
    assertEquals(now, row.getInstant("created_at"));
    assertEquals(List.of("x", "y"), row.getStringList("tags"));
    assertEquals(1, row.getJson("metadata").get("k"));
    assertTrue(row.getBoolean("is_public"));
  }

  @Test
  void testHealthCheck() {
    StoreHealth health = store.healthCheck();
    assertTrue(health.isHealthy());
    assertNull(health.error());
  }

  @Test
  void testQueryWithComposedStatement() {
    store.withTransaction(null, h -> insertUsage(h, "b") + insertUsage(h, "a"));
    List<Row> rows =
        store.query(
            SqlQuery.select("endpoint").from("api_usage").orderBy("endpoint").limit(1).build());
    assertEquals(1, rows.size());
    assertEquals("a", rows.get(0).getString("endpoint"));
  }

  @Test
  void testSchemaDescription() {
    List<Row> columns = store.describeSchema();
    assertTrue(
        columns.stream()
            .anyMatch(
                r ->
                    "context_items".equals(r.getString("table_name"))
                        && "content_hash".equals(r.getString("column_name"))));
  }
}
