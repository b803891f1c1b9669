package com.gentoro.contextmcp.store;

import com.gentoro.contextmcp.utility.JacksonUtility;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One result row with lower-case column labels. Values are normalized by {@link StoreHandle}:
 * timestamps become {@link Instant}, dates {@link LocalDate}, SQL arrays {@code List}.
 */
public final class Row {
  private final Map<String, Object> values;

  Row(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  public Map<String, Object> asMap() {
    return values;
  }

  public boolean has(String column) {
    return values.containsKey(column);
  }

  public Object get(String column) {
    return values.get(column);
  }

  public String getString(String column) {
    Object v = values.get(column);
    return v == null ? null : v.toString();
  }

  public UUID getUuid(String column) {
    Object v = values.get(column);
    if (v == null) return null;
    if (v instanceof UUID uuid) return uuid;
    return UUID.fromString(v.toString());
  }

  public Instant getInstant(String column) {
    return (Instant) values.get(column);
  }

  public LocalDate getDate(String column) {
    return (LocalDate) values.get(column);
  }

  public long getLong(String column) {
    Object v = values.get(column);
    return v == null ? 0L : ((Number) v).longValue();
  }

  public int getInt(String column) {
    Object v = values.get(column);
    return v == null ? 0 : ((Number) v).intValue();
  }

  public Integer getNullableInt(String column) {
    Object v = values.get(column);
    return v == null ? null : ((Number) v).intValue();
  }

  public double getDouble(String column) {
    Object v = values.get(column);
    return v == null ? 0d : ((Number) v).doubleValue();
  }

  public boolean getBoolean(String column) {
    Object v = values.get(column);
    return v instanceof Boolean b ? b : v != null && Boolean.parseBoolean(v.toString());
  }

  public List<String> getStringList(String column) {
    Object v = values.get(column);
    if (v == null) return List.of();
    return ((List<?>) v).stream().map(String::valueOf).toList();
  }

  /** JSON object columns (JSONB on PostgreSQL, character data on H2) decoded to a map. */
  public Map<String, Object> getJson(String column) {
    Object v = values.get(column);
    return v == null ? null : JacksonUtility.toMap(v.toString());
  }

  @Override
  public String toString() {
    return "Row" + values;
  }
}
