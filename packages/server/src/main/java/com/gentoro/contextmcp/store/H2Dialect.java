package com.gentoro.contextmcp.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * H2 in PostgreSQL compatibility mode. H2 has no text search vectors, so lexical search becomes a
 * conjunction of per-term substring matches over title and content, scored by where the terms hit
 * (title hits count double).
 */
public class H2Dialect implements SqlDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public String textArrayType() {
    return "VARCHAR";
  }

  @Override
  public String jsonParameter() {
    return "?";
  }

  @Override
  public String actingUserStatement() {
    return null;
  }

  @Override
  public SqlFragment lexicalMatch(String alias, String query) {
    List<String> terms = terms(query);
    if (terms.isEmpty()) return SqlFragment.NONE;
    List<SqlFragment> parts = new ArrayList<>();
    for (String term : terms) {
      String pattern = likePattern(term);
      parts.add(
          SqlFragment.of(
              "(LOWER("
                  + alias
                  + ".title) LIKE ? ESCAPE '\\' OR LOWER("
                  + alias
                  + ".content) LIKE ? ESCAPE '\\')",
              pattern,
              pattern));
    }
    return SqlFragment.and(parts);
  }

  @Override
  public SqlFragment lexicalScore(String alias, String query) {
    List<String> terms = terms(query);
    if (terms.isEmpty()) return SqlFragment.of("CAST(0 AS DOUBLE PRECISION)");
    StringBuilder sql = new StringBuilder("CAST((");
    List<Object> params = new ArrayList<>();
    for (int i = 0; i < terms.size(); i++) {
      if (i > 0) sql.append(" + ");
      sql.append("CASE WHEN LOWER(")
          .append(alias)
          .append(".title) LIKE ? ESCAPE '\\' THEN 2 ELSE 0 END + CASE WHEN LOWER(")
          .append(alias)
          .append(".content) LIKE ? ESCAPE '\\' THEN 1 ELSE 0 END");
      String pattern = likePattern(terms.get(i));
      params.add(pattern);
      params.add(pattern);
    }
    sql.append(") AS DOUBLE PRECISION)");
    return new SqlFragment(sql.toString(), params);
  }

  @Override
  public SqlFragment arrayOverlap(String column, List<String> values) {
    if (values == null || values.isEmpty()) return SqlFragment.NONE;
    List<SqlFragment> parts = new ArrayList<>();
    for (String value : values) {
      parts.add(SqlFragment.of("ARRAY_CONTAINS(" + column + ", ?)", value));
    }
    return SqlFragment.or(parts);
  }

  static List<String> terms(String query) {
    if (query == null || query.isBlank()) return List.of();
    return Arrays.stream(query.toLowerCase(Locale.ROOT).trim().split("\\s+"))
        .filter(t -> !t.isEmpty())
        .distinct()
        .toList();
  }

  private static String likePattern(String term) {
    String escaped = term.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    return "%" + escaped + "%";
  }
}
