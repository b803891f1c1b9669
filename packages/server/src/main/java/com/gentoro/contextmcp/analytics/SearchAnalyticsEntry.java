package com.gentoro.contextmcp.analytics;

import java.util.List;
import java.util.UUID;

/** One executed search, successful or not. */
public record SearchAnalyticsEntry(
    String query,
    String searchType,
    UUID userId,
    List<UUID> collectionIds,
    int resultsCount,
    long executionTimeMs) {}
