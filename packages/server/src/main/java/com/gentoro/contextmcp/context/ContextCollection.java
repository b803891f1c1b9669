package com.gentoro.contextmcp.context;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A named, owned grouping of items. {@code itemCount} is the live number of active items and is
 * only populated by listings.
 */
public record ContextCollection(
    UUID id,
    String name,
    String description,
    UUID ownerId,
    @JsonProperty("is_public") boolean isPublic,
    List<String> tags,
    Map<String, Object> metadata,
    Long itemCount,
    Instant createdAt,
    Instant updatedAt) {}
