package com.gentoro.contextmcp.audit;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Aggregated view of the audit trail over one {@link AuditWindow}. */
public record AuditStats(
    String timeframe,
    long totalActions,
    List<ActionCount> byAction,
    List<UserCount> byUser,
    List<HourCount> byHour) {

  public record ActionCount(String action, long count) {}

  public record UserCount(UUID userId, String username, long count) {}

  public record HourCount(Instant hour, long count) {}
}
