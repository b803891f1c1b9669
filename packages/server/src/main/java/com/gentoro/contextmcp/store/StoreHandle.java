package com.gentoro.contextmcp.store;

import com.gentoro.contextmcp.exception.StoreException;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Scoped access to one borrowed connection. Within {@link StoreGateway#withTransaction} every call
 * on the handle participates in the same transaction; outside of it each statement auto-commits.
 *
 * <p>Every statement is timed and logged at DEBUG. Failures are logged and surfaced as {@link
 * StoreException}, carrying the SQLState, without retry.
 */
public class StoreHandle {
  private static final org.slf4j.Logger log =
      com.gentoro.contextmcp.logging.LoggingService.getLogger(StoreHandle.class);

  private final Connection connection;
  private final SqlDialect dialect;
  private final int statementTimeoutSeconds;
  private final boolean transactional;

  StoreHandle(
      Connection connection,
      SqlDialect dialect,
      int statementTimeoutSeconds,
      boolean transactional) {
    this.connection = connection;
    this.dialect = dialect;
    this.statementTimeoutSeconds = statementTimeoutSeconds;
    this.transactional = transactional;
  }

  public SqlDialect dialect() {
    return dialect;
  }

  public List<Row> query(SqlStatement statement) {
    return query(statement.sql(), statement.params());
  }

  public List<Row> query(String sql, Object... params) {
    return query(sql, Arrays.asList(params));
  }

  public Optional<Row> queryOne(SqlStatement statement) {
    List<Row> rows = query(statement);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  public Optional<Row> queryOne(String sql, Object... params) {
    List<Row> rows = query(sql, Arrays.asList(params));
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  public int update(SqlStatement statement) {
    return update(statement.sql(), statement.params());
  }

  public int update(String sql, Object... params) {
    return update(sql, Arrays.asList(params));
  }

  /** Record the acting user for the rest of the transaction. No-op for dialects without one. */
  public void setActingUser(UUID userId) {
    String sql = dialect.actingUserStatement();
    if (sql == null || userId == null) return;
    query(sql, List.of(userId.toString()));
  }

  /**
   * Run {@code work} under a savepoint: when it fails only its own statements are rolled back and
   * the exception is rethrown, leaving the surrounding transaction usable.
   */
  public <T> T savepoint(String name, Supplier<T> work) {
    if (!transactional) return work.get();
    Savepoint sp;
    try {
      sp = connection.setSavepoint(name);
    } catch (SQLException e) {
      throw new StoreException("Could not create savepoint " + name, e.getSQLState(), e);
    }
    try {
      T result = work.get();
      connection.releaseSavepoint(sp);
      return result;
    } catch (SQLException e) {
      throw new StoreException("Could not release savepoint " + name, e.getSQLState(), e);
    } catch (RuntimeException e) {
      try {
        connection.rollback(sp);
      } catch (SQLException rollbackError) {
        e.addSuppressed(rollbackError);
      }
      throw e;
    }
  }

  private List<Row> query(String sql, List<Object> params) {
    long start = System.nanoTime();
    try (PreparedStatement ps = prepare(sql, params);
        ResultSet rs = ps.executeQuery()) {
      List<Row> rows = readRows(rs);
      log.debug("Query returned {} row(s) in {} ms: {}", rows.size(), elapsedMs(start), sql);
      return rows;
    } catch (SQLException e) {
      log.error("Query failed after {} ms: {}", elapsedMs(start), sql, e);
      throw new StoreException("Store operation failed", e.getSQLState(), e);
    }
  }

  private int update(String sql, List<Object> params) {
    long start = System.nanoTime();
    try (PreparedStatement ps = prepare(sql, params)) {
      int count = ps.executeUpdate();
      log.debug("Statement affected {} row(s) in {} ms: {}", count, elapsedMs(start), sql);
      return count;
    } catch (SQLException e) {
      log.error("Statement failed after {} ms: {}", elapsedMs(start), sql, e);
      throw new StoreException("Store operation failed", e.getSQLState(), e);
    }
  }

  private PreparedStatement prepare(String sql, List<Object> params) throws SQLException {
    PreparedStatement ps = connection.prepareStatement(sql);
    try {
      if (statementTimeoutSeconds > 0) {
        ps.setQueryTimeout(statementTimeoutSeconds);
      }
      for (int i = 0; i < params.size(); i++) {
        bind(ps, i + 1, params.get(i));
      }
      return ps;
    } catch (SQLException | RuntimeException e) {
      ps.close();
      throw e;
    }
  }

  private void bind(PreparedStatement ps, int index, Object value) throws SQLException {
    if (value == null) {
      ps.setNull(index, Types.NULL);
    } else if (value instanceof Instant instant) {
      ps.setObject(index, OffsetDateTime.ofInstant(instant, ZoneOffset.UTC));
    } else if (value instanceof List<?> list) {
      Object[] elements = list.stream().map(String::valueOf).toArray();
      ps.setArray(index, connection.createArrayOf(dialect.textArrayType(), elements));
    } else if (value instanceof Enum<?> e) {
      ps.setString(index, e.name().toLowerCase(Locale.ROOT));
    } else {
      ps.setObject(index, value);
    }
  }

  private static List<Row> readRows(ResultSet rs) throws SQLException {
    ResultSetMetaData meta = rs.getMetaData();
    int columns = meta.getColumnCount();
    List<Row> rows = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> values = new LinkedHashMap<>();
      for (int c = 1; c <= columns; c++) {
        values.put(meta.getColumnLabel(c).toLowerCase(Locale.ROOT), normalize(rs.getObject(c)));
      }
      rows.add(new Row(values));
    }
    return rows;
  }

  private static Object normalize(Object value) throws SQLException {
    if (value == null) return null;
    if (value instanceof Timestamp ts) return ts.toInstant();
    if (value instanceof OffsetDateTime odt) return odt.toInstant();
    if (value instanceof java.sql.Date date) return date.toLocalDate();
    if (value instanceof LocalDate) return value;
    if (value instanceof Array array) {
      try {
        Object[] elements = (Object[]) array.getArray();
        List<Object> list = new ArrayList<>(elements.length);
        for (Object element : elements) list.add(normalize(element));
        return list;
      } finally {
        array.free();
      }
    }
    if (value instanceof Object[] elements) {
      List<Object> list = new ArrayList<>(elements.length);
      for (Object element : elements) list.add(normalize(element));
      return list;
    }
    if (value instanceof java.sql.Clob clob) {
      return clob.getSubString(1, (int) clob.length());
    }
    return value;
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000L;
  }
}
