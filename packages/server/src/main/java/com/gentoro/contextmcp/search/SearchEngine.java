package com.gentoro.contextmcp.search;

import com.gentoro.contextmcp.analytics.AnalyticsService;
import com.gentoro.contextmcp.analytics.SearchAnalyticsEntry;
import com.gentoro.contextmcp.context.Visibility;
import com.gentoro.contextmcp.exception.ValidationException;
import com.gentoro.contextmcp.identity.User;
import com.gentoro.contextmcp.store.Row;
import com.gentoro.contextmcp.store.SqlDialect;
import com.gentoro.contextmcp.store.SqlFragment;
import com.gentoro.contextmcp.store.SqlQuery;
import com.gentoro.contextmcp.store.SqlStatement;
import com.gentoro.contextmcp.store.StoreGateway;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ranked lexical search over active items the caller can read.
 *
 * <p>The statement is composed as text match, collection restriction, tag overlap and caller
 * visibility, in that order. Results are ranked by relevance, then by most recent update. Each
 * call records one search analytics entry, including calls that fail.
 */
public class SearchEngine {
  private static final org.slf4j.Logger log =
      com.gentoro.contextmcp.logging.LoggingService.getLogger(SearchEngine.class);

  private final StoreGateway store;
  private final AnalyticsService analytics;

  public SearchEngine(StoreGateway store, AnalyticsService analytics) {
    this.store = store;
    this.analytics = analytics;
  }

  public SearchResult search(SearchRequest request, User caller) {
    long start = System.nanoTime();
    if (request.limit() < 1 || request.limit() > SearchRequest.MAX_LIMIT) {
      record(request, caller, 0, elapsedMs(start));
      throw new ValidationException(
          "limit must be between 1 and " + SearchRequest.MAX_LIMIT,
          Map.of("limit", request.limit()));
    }
    if (request.query() == null || request.query().isBlank()) {
      SearchResult result = SearchResult.empty(request.searchType(), elapsedMs(start));
      record(request, caller, 0, result.executionTimeMs());
      return result;
    }

    int resultCount = 0;
    try {
      SqlStatement statement = compose(request, caller);
      List<SearchHit> hits =
          store.withTransaction(caller.id(), h -> h.query(statement)).stream()
              .map(SearchEngine::toHit)
              .toList();
      resultCount = hits.size();
      long elapsed = elapsedMs(start);
      log.debug(
          "Search '{}' ({}) returned {} item(s) in {} ms",
          request.query(),
          request.searchType().wireName(),
          resultCount,
          elapsed);
      return new SearchResult(hits, hits.size(), request.searchType().wireName(), elapsed);
    } finally {
      record(request, caller, resultCount, elapsedMs(start));
    }
  }

  /** Build the ranked statement; exposed for tests that inspect clause and parameter order. */
  SqlStatement compose(SearchRequest request, User caller) {
    SqlDialect dialect = store.dialect();
    String query = request.query().trim();
    SqlQuery sql =
        SqlQuery.select(
                "ci.id, ci.collection_id, cc.name AS collection_name, ci.title, ci.content,"
                    + " ci.content_type, ci.source_url, ci.source_type, ci.tags, ci.metadata,"
                    + " ci.version, ci.created_at, ci.updated_at")
            .column(dialect.lexicalScore("ci", query), "relevance_score")
            .from("context_items ci")
            .join("JOIN context_collections cc ON cc.id = ci.collection_id")
            .where(dialect.lexicalMatch("ci", query));
    if (!request.collectionIds().isEmpty()) {
      sql.where(SqlFragment.in("ci.collection_id", request.collectionIds()));
    }
    if (!request.tags().isEmpty()) {
      sql.where(dialect.arrayOverlap("ci.tags", request.tags()));
    }
    Visibility.readableCollections("cc", caller, true).ifPresent(sql::where);
    return sql.where("ci.is_active = TRUE")
        .orderBy("relevance_score DESC")
        .orderBy("ci.updated_at DESC")
        .limit(request.limit())
        .build();
  }

  private void record(SearchRequest request, User caller, int resultCount, long elapsedMs) {
    try {
      analytics.recordSearch(
          new SearchAnalyticsEntry(
              Objects.requireNonNullElse(request.query(), ""),
              request.searchType().wireName(),
              caller.id(),
              request.collectionIds(),
              resultCount,
              elapsedMs));
    } catch (RuntimeException e) {
      log.warn("Could not queue search analytics", e);
    }
  }

  private static SearchHit toHit(Row r) {
    Map<String, Object> metadata = r.getJson("metadata");
    return new SearchHit(
        r.getUuid("id"),
        r.getUuid("collection_id"),
        r.getString("collection_name"),
        r.getString("title"),
        r.getString("content"),
        r.getString("content_type"),
        r.getString("source_url"),
        r.getString("source_type"),
        r.getStringList("tags"),
        metadata == null ? Map.of() : metadata,
        r.getInt("version"),
        r.getInstant("created_at"),
        r.getInstant("updated_at"),
        r.getDouble("relevance_score"));
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000L;
  }
}
