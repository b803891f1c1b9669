package com.gentoro.contextmcp.analytics;

import java.time.LocalDate;
import java.util.List;

/** Aggregated analytics for a date window, both ends inclusive. */
public record AnalyticsReport(String type, LocalDate startDate, LocalDate endDate, List<?> data) {

  public record SearchDay(
      LocalDate day, long searchCount, double avgExecutionTimeMs, double avgResultsCount) {}

  public record UsageDay(
      LocalDate day, long requestCount, double avgResponseTimeMs, long uniqueUsers) {}

  public record EndpointPerformance(
      String endpoint,
      long requestCount,
      double avgResponseTimeMs,
      long minResponseTimeMs,
      long maxResponseTimeMs) {}
}
