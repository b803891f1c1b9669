package com.gentoro.contextmcp.tool;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Validated tool arguments with defaults applied. Values are already converted by {@link
 * ArgumentValidator}: UUID-formatted strings are {@link UUID}s, dates are {@link LocalDate}s and
 * integers are {@link Integer}s. Absent optional arguments read as {@code null}.
 */
public final class ToolArguments {
  private final Map<String, Object> values;

  ToolArguments(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  public boolean has(String name) {
    return values.get(name) != null;
  }

  public String getString(String name) {
    return (String) values.get(name);
  }

  public UUID getUuid(String name) {
    return (UUID) values.get(name);
  }

  public Integer getInt(String name) {
    return (Integer) values.get(name);
  }

  public boolean getBoolean(String name) {
    return Boolean.TRUE.equals(values.get(name));
  }

  public LocalDate getDate(String name) {
    return (LocalDate) values.get(name);
  }

  @SuppressWarnings("unchecked")
  public List<String> getStringList(String name) {
    return (List<String>) values.get(name);
  }

  @SuppressWarnings("unchecked")
  public List<UUID> getUuidList(String name) {
    return (List<UUID>) values.get(name);
  }

  @SuppressWarnings("unchecked")
  public Map<String, Object> getMap(String name) {
    return (Map<String, Object>) values.get(name);
  }

  public Map<String, Object> asMap() {
    return values;
  }
}
