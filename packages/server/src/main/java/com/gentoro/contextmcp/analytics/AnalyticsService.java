package com.gentoro.contextmcp.analytics;

import com.gentoro.contextmcp.audit.AuditChannel;
import com.gentoro.contextmcp.exception.ValidationException;
import com.gentoro.contextmcp.store.SqlDialect;
import com.gentoro.contextmcp.store.SqlQuery;
import com.gentoro.contextmcp.store.StoreGateway;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

/**
 * Records search and usage metrics through the {@link AuditChannel} and aggregates them into daily
 * or per-endpoint reports.
 */
public class AnalyticsService {
  private static final org.slf4j.Logger log =
      com.gentoro.contextmcp.logging.LoggingService.getLogger(AnalyticsService.class);

  private final StoreGateway store;
  private final AuditChannel channel;
  private final Clock clock;

  public AnalyticsService(StoreGateway store, AuditChannel channel, Clock clock) {
    this.store = store;
    this.channel = channel;
    this.clock = clock;
  }

  public void recordSearch(SearchAnalyticsEntry entry) {
    Instant now = clock.instant();
    List<String> collections =
        entry.collectionIds() == null
            ? null
            : entry.collectionIds().stream().map(UUID::toString).toList();
    channel.submit(
        "search analytics",
        () ->
            store.update(
                "INSERT INTO search_analytics (id, query, search_type, user_id, collection_ids,"
                    + " results_count, execution_time_ms, created_at)"
                    + " VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                UUID.randomUUID(),
                entry.query(),
                entry.searchType(),
                entry.userId(),
                collections,
                entry.resultsCount(),
                entry.executionTimeMs(),
                now));
  }

  public void recordUsage(UsageEntry entry) {
    Instant now = clock.instant();
    channel.submit(
        "usage",
        () ->
            store.update(
                "INSERT INTO api_usage (id, user_id, endpoint, method, status_code,"
                    + " response_time_ms, request_size, response_size, created_at)"
                    + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                UUID.randomUUID(),
                entry.userId(),
                entry.endpoint(),
                entry.method(),
                entry.statusCode(),
                entry.responseTimeMs(),
                entry.requestSize(),
                entry.responseSize(),
                now));
  }

  /**
   * Build a report. Missing dates default to today (end) and to the type's default window before
   * the end (start). {@code collectionIds} narrows search reports to searches that touched any of
   * the given collections and is ignored for other types.
   */
  public AnalyticsReport report(
      AnalyticsType type, LocalDate startDate, LocalDate endDate, List<UUID> collectionIds) {
    LocalDate end =
        endDate != null ? endDate : LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    LocalDate start = startDate != null ? startDate : end.minusDays(type.defaultWindowDays());
    if (start.isAfter(end)) {
      throw new ValidationException("start_date must not be after end_date");
    }
    Instant from = start.atStartOfDay(ZoneOffset.UTC).toInstant();
    Instant to = end.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    log.debug("Building {} analytics for [{}, {}]", type.wireName(), start, end);

    List<?> data =
        switch (type) {
          case SEARCH -> searchReport(from, to, collectionIds);
          case USAGE -> usageReport(from, to);
          case PERFORMANCE -> performanceReport(from, to);
        };
    return new AnalyticsReport(type.wireName(), start, end, data);
  }

  private List<AnalyticsReport.SearchDay> searchReport(
      Instant from, Instant to, List<UUID> collectionIds) {
    SqlDialect dialect = store.dialect();
    String day = dialect.dayBucket("created_at");
    SqlQuery query =
        SqlQuery.select(
                day
                    + " AS bucket_day, COUNT(*) AS search_count,"
                    + " AVG(CAST(execution_time_ms AS DOUBLE PRECISION)) AS avg_execution_time_ms,"
                    + " AVG(CAST(results_count AS DOUBLE PRECISION)) AS avg_results_count")
            .from("search_analytics")
            .where("created_at >= ?", from)
            .where("created_at < ?", to);
    if (collectionIds != null && !collectionIds.isEmpty()) {
      query.where(
          dialect.arrayOverlap(
              "collection_ids", collectionIds.stream().map(UUID::toString).toList()));
    }
    return store.query(query.groupBy(day).orderBy("bucket_day DESC").build()).stream()
        .map(
            r ->
                new AnalyticsReport.SearchDay(
                    r.getDate("bucket_day"),
                    r.getLong("search_count"),
                    r.getDouble("avg_execution_time_ms"),
                    r.getDouble("avg_results_count")))
        .toList();
  }

  private List<AnalyticsReport.UsageDay> usageReport(Instant from, Instant to) {
    String day = store.dialect().dayBucket("created_at");
    SqlQuery query =
        SqlQuery.select(
                day
                    + " AS bucket_day, COUNT(*) AS request_count,"
                    + " AVG(CAST(response_time_ms AS DOUBLE PRECISION)) AS avg_response_time_ms,"
                    + " COUNT(DISTINCT user_id) AS unique_users")
            .from("api_usage")
            .where("created_at >= ?", from)
            .where("created_at < ?", to)
            .groupBy(day)
            .orderBy("bucket_day DESC");
    return store.query(query.build()).stream()
        .map(
            r ->
                new AnalyticsReport.UsageDay(
                    r.getDate("bucket_day"),
                    r.getLong("request_count"),
                    r.getDouble("avg_response_time_ms"),
                    r.getLong("unique_users")))
        .toList();
  }

  private List<AnalyticsReport.EndpointPerformance> performanceReport(Instant from, Instant to) {
    SqlQuery query =
        SqlQuery.select(
                "endpoint, COUNT(*) AS request_count,"
                    + " AVG(CAST(response_time_ms AS DOUBLE PRECISION)) AS avg_response_time_ms,"
                    + " MIN(response_time_ms) AS min_response_time_ms,"
                    + " MAX(response_time_ms) AS max_response_time_ms")
            .from("api_usage")
            .where("created_at >= ?", from)
            .where("created_at < ?", to)
            .groupBy("endpoint")
            .orderBy("request_count DESC")
            .orderBy("endpoint");
    return store.query(query.build()).stream()
        .map(
            r ->
                new AnalyticsReport.EndpointPerformance(
                    r.getString("endpoint"),
                    r.getLong("request_count"),
                    r.getDouble("avg_response_time_ms"),
                    r.getLong("min_response_time_ms"),
                    r.getLong("max_response_time_ms")))
        .toList();
  }
}
