package com.gentoro.contextmcp.audit;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** One immutable row of the audit trail. */
public record AuditEntry(
    UUID id,
    UUID userId,
    String action,
    String resourceType,
    String resourceId,
    Map<String, Object> oldValues,
    Map<String, Object> newValues,
    String ipAddress,
    String userAgent,
    Instant createdAt) {}
