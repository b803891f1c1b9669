package com.gentoro.contextmcp.store;

import java.util.List;

/**
 * SQL flavour adapter. Services compose their statements through this interface so the same
 * repository code runs against PostgreSQL in production and H2 in tests.
 */
public interface SqlDialect {

  /** Logical identifier, e.g. {@code postgres}. */
  String name();

  /** Element type name passed to {@link java.sql.Connection#createArrayOf}. */
  String textArrayType();

  /** Placeholder expression for a JSON document bound as a string. */
  String jsonParameter();

  /**
   * Statement that records the acting user for the current transaction, with one placeholder for
   * the user id, or {@code null} when the store has no such notion.
   */
  String actingUserStatement();

  /** Predicate matching items of table alias {@code alias} against a free-text query. */
  SqlFragment lexicalMatch(String alias, String query);

  /** Numeric relevance expression for the same query; higher is better. */
  SqlFragment lexicalScore(String alias, String query);

  /** Predicate true when text-array {@code column} shares at least one element with values. */
  SqlFragment arrayOverlap(String column, List<String> values);

  default String dayBucket(String column) {
    return "CAST(" + column + " AS DATE)";
  }

  default String hourBucket(String column) {
    return "DATE_TRUNC('HOUR', " + column + ")";
  }

  /** Pick the dialect from a JDBC url; anything that is not H2 is treated as PostgreSQL. */
  static SqlDialect forUrl(String jdbcUrl) {
    if (jdbcUrl != null && jdbcUrl.startsWith("jdbc:h2:")) {
      return new H2Dialect();
    }
    return new PostgresDialect();
  }

  static SqlDialect forName(String name) {
    if ("h2".equalsIgnoreCase(name)) return new H2Dialect();
    if ("postgres".equalsIgnoreCase(name) || "postgresql".equalsIgnoreCase(name)) {
      return new PostgresDialect();
    }
    throw new IllegalArgumentException("Unsupported store dialect: " + name);
  }
}
