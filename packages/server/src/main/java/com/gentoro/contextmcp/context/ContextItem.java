package com.gentoro.contextmcp.context;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** A versioned unit of stored text content. */
public record ContextItem(
    UUID id,
    UUID collectionId,
    String collectionName,
    String title,
    String content,
    String contentType,
    String contentHash,
    int sizeBytes,
    String sourceUrl,
    String sourceType,
    List<String> tags,
    Map<String, Object> metadata,
    int version,
    boolean active,
    UUID createdBy,
    UUID updatedBy,
    Instant createdAt,
    Instant updatedAt) {

  /** Snapshot of the user-editable fields, as recorded in the audit trail. */
  public Map<String, Object> auditSnapshot() {
    LinkedHashMap<String, Object> values = new LinkedHashMap<>();
    values.put("title", title);
    values.put("content_hash", contentHash);
    values.put("size_bytes", sizeBytes);
    values.put("tags", tags);
    values.put("metadata", metadata);
    values.put("version", version);
    values.put("is_active", active);
    return values;
  }
}
