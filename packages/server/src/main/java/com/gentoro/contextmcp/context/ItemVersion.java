package com.gentoro.contextmcp.context;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Immutable snapshot of an item as it was right after reaching {@code version}. */
public record ItemVersion(
    UUID id,
    UUID itemId,
    int version,
    String title,
    String content,
    String contentHash,
    List<String> tags,
    Map<String, Object> metadata,
    String changeSummary,
    UUID createdBy,
    Instant createdAt) {}
