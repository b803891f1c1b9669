package com.gentoro.contextmcp.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structured SELECT builder. Each clause owns its parameter values and clauses are rendered in a
 * fixed order (select, from, where, group by, order by, limit, offset), so parameters always line
 * up with their placeholders whatever combination of optional filters is applied.
 *
 * <pre>{@code
 * SqlStatement st =
 *     SqlQuery.select("ci.id, ci.title")
 *         .from("context_items ci")
 *         .where("ci.is_active = TRUE")
 *         .where(SqlFragment.in("ci.collection_id", ids))
 *         .orderBy("ci.updated_at DESC")
 *         .limit(10)
 *         .build();
 * }</pre>
 */
public final class SqlQuery {
  private final List<SqlFragment> select = new ArrayList<>();
  private final List<SqlFragment> from = new ArrayList<>();
  private final List<SqlFragment> where = new ArrayList<>();
  private final List<String> groupBy = new ArrayList<>();
  private final List<String> orderBy = new ArrayList<>();
  private Integer limit;
  private Integer offset;

  private SqlQuery() {}

  public static SqlQuery select(String columns) {
    return new SqlQuery().column(SqlFragment.of(columns));
  }

  /** Add a computed select expression; its parameters bind before any from/where parameter. */
  public SqlQuery column(SqlFragment expression) {
    select.add(Objects.requireNonNull(expression));
    return this;
  }

  public SqlQuery column(SqlFragment expression, String alias) {
    return column(new SqlFragment(expression.sql() + " AS " + alias, expression.params()));
  }

  public SqlQuery from(String tableExpression) {
    from.add(SqlFragment.of(tableExpression));
    return this;
  }

  /** Join clauses (e.g. {@code LEFT JOIN ... ON ...}) appended after the from clause. */
  public SqlQuery join(SqlFragment joinClause) {
    from.add(joinClause);
    return this;
  }

  public SqlQuery join(String joinClause) {
    return join(SqlFragment.of(joinClause));
  }

  public SqlQuery where(String predicate, Object... params) {
    return where(SqlFragment.of(predicate, params));
  }

  public SqlQuery where(SqlFragment predicate) {
    where.add(Objects.requireNonNull(predicate));
    return this;
  }

  public SqlQuery groupBy(String expression) {
    groupBy.add(expression);
    return this;
  }

  public SqlQuery orderBy(String expression) {
    orderBy.add(expression);
    return this;
  }

  public SqlQuery limit(int limit) {
    this.limit = limit;
    return this;
  }

  public SqlQuery offset(int offset) {
    this.offset = offset;
    return this;
  }

  public SqlStatement build() {
    List<Object> params = new ArrayList<>();
    StringBuilder sql = new StringBuilder(body(params));
    if (!orderBy.isEmpty()) {
      sql.append(" ORDER BY ").append(String.join(", ", orderBy));
    }
    if (limit != null) {
      sql.append(" LIMIT ?");
      params.add(limit);
    }
    if (offset != null) {
      sql.append(" OFFSET ?");
      params.add(offset);
    }
    return new SqlStatement(sql.toString(), params);
  }

  /** Row count of the same query without ordering and paging. */
  public SqlStatement buildCount() {
    List<Object> params = new ArrayList<>();
    String inner = body(params);
    return new SqlStatement("SELECT COUNT(*) AS total FROM (" + inner + ") counted", params);
  }

  private String body(List<Object> params) {
    StringBuilder sql = new StringBuilder("SELECT ");
    for (int i = 0; i < select.size(); i++) {
      if (i > 0) sql.append(", ");
      sql.append(select.get(i).sql());
      params.addAll(select.get(i).params());
    }
    if (from.isEmpty()) {
      throw new IllegalStateException("SqlQuery requires a from clause");
    }
    sql.append(" FROM ");
    for (int i = 0; i < from.size(); i++) {
      if (i > 0) sql.append(' ');
      sql.append(from.get(i).sql());
      params.addAll(from.get(i).params());
    }
    if (!where.isEmpty()) {
      sql.append(" WHERE ");
      for (int i = 0; i < where.size(); i++) {
        if (i > 0) sql.append(" AND ");
        sql.append(where.get(i).sql());
        params.addAll(where.get(i).params());
      }
    }
    if (!groupBy.isEmpty()) {
      sql.append(" GROUP BY ").append(String.join(", ", groupBy));
    }
    return sql.toString();
  }
}
