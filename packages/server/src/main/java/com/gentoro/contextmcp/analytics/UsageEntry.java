package com.gentoro.contextmcp.analytics;

import java.util.UUID;

/** One tool invocation as seen by the dispatcher. */
public record UsageEntry(
    UUID userId,
    String endpoint,
    String method,
    int statusCode,
    long responseTimeMs,
    int requestSize,
    int responseSize) {}
