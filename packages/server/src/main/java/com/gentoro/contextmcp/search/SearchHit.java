package com.gentoro.contextmcp.search;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** One ranked item in a search result. */
public record SearchHit(
    UUID id,
    UUID collectionId,
    String collectionName,
    String title,
    String content,
    String contentType,
    String sourceUrl,
    String sourceType,
    List<String> tags,
    Map<String, Object> metadata,
    int version,
    Instant createdAt,
    Instant updatedAt,
    double relevanceScore) {}
