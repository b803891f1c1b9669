package com.gentoro.contextmcp.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A piece of SQL text together with the values bound to its {@code ?} placeholders, in textual
 * order. Fragments are composed by {@link SqlQuery}; nobody counts placeholder positions by hand.
 */
public record SqlFragment(String sql, List<Object> params) {

  /** Always-false predicate, used when a filter degenerates to an empty set. */
  public static final SqlFragment NONE = new SqlFragment("1 = 0", List.of());

  public SqlFragment {
    Objects.requireNonNull(sql, "sql");
    params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public static SqlFragment of(String sql, Object... params) {
    List<Object> values = new ArrayList<>(params.length);
    Collections.addAll(values, params);
    return new SqlFragment(sql, values);
  }

  /** {@code column IN (?, ?, ...)}; an empty collection yields {@link #NONE}. */
  public static SqlFragment in(String column, Collection<?> values) {
    if (values == null || values.isEmpty()) return NONE;
    String placeholders = values.stream().map(v -> "?").collect(Collectors.joining(", "));
    return new SqlFragment(column + " IN (" + placeholders + ")", new ArrayList<>(values));
  }

  public static SqlFragment and(List<SqlFragment> parts) {
    return join(" AND ", parts);
  }

  public static SqlFragment or(List<SqlFragment> parts) {
    return join(" OR ", parts);
  }

  private static SqlFragment join(String operator, List<SqlFragment> parts) {
    if (parts.isEmpty()) return NONE;
    if (parts.size() == 1) return parts.get(0);
    StringBuilder sb = new StringBuilder("(");
    List<Object> values = new ArrayList<>();
    for (int i = 0; i < parts.size(); i++) {
      if (i > 0) sb.append(operator);
      sb.append(parts.get(i).sql());
      values.addAll(parts.get(i).params());
    }
    return new SqlFragment(sb.append(')').toString(), values);
  }
}
