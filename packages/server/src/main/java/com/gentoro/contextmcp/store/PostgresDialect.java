package com.gentoro.contextmcp.store;

import java.util.List;

/** PostgreSQL: tsvector full text search, native array operators and JSONB. */
public class PostgresDialect implements SqlDialect {

  @Override
  public String name() {
    return "postgres";
  }

  @Override
  public String textArrayType() {
    return "text";
  }

  @Override
  public String jsonParameter() {
    return "CAST(? AS jsonb)";
  }

  @Override
  public String actingUserStatement() {
    // transaction-local, consumed by row level security policies
    return "SELECT set_config('app.current_user_id', ?, true)";
  }

  @Override
  public SqlFragment lexicalMatch(String alias, String query) {
    return SqlFragment.of(alias + ".search_vector @@ plainto_tsquery('english', ?)", query);
  }

  @Override
  public SqlFragment lexicalScore(String alias, String query) {
    return SqlFragment.of(
        "ts_rank(" + alias + ".search_vector, plainto_tsquery('english', ?))", query);
  }

  @Override
  public SqlFragment arrayOverlap(String column, List<String> values) {
    if (values == null || values.isEmpty()) return SqlFragment.NONE;
    return SqlFragment.of(column + " && ?", List.copyOf(values));
  }

  @Override
  public String hourBucket(String column) {
    return "date_trunc('hour', " + column + ")";
  }
}
