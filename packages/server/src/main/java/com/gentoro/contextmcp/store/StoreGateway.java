package com.gentoro.contextmcp.store;

import com.gentoro.contextmcp.exception.ConfigException;
import com.gentoro.contextmcp.exception.ContextMcpException;
import com.gentoro.contextmcp.exception.StoreException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import javax.sql.DataSource;
import org.apache.commons.configuration2.Configuration;

/**
 * Single entry point to the relational store. Owns the connection pool, runs parameterized
 * statements and scopes transactions.
 *
 * <p>Configuration keys (prefix {@code store.}):
 *
 * <ul>
 *   <li><b>url</b>, <b>username</b>, <b>password</b>: JDBC coordinates
 *   <li><b>dialect</b>: {@code postgres} or {@code h2}; derived from the url when absent
 *   <li><b>pool.min-idle</b> (2), <b>pool.max-size</b> (20), <b>pool.connection-timeout-ms</b>
 *       (2000), <b>pool.idle-timeout-ms</b> (30000)
 *   <li><b>statement-timeout-seconds</b> (30)
 * </ul>
 */
public class StoreGateway implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.contextmcp.logging.LoggingService.getLogger(StoreGateway.class);

  private final DataSource dataSource;
  private final SqlDialect dialect;
  private final int statementTimeoutSeconds;

  public StoreGateway(DataSource dataSource, SqlDialect dialect, int statementTimeoutSeconds) {
    this.dataSource = dataSource;
    this.dialect = dialect;
    this.statementTimeoutSeconds = statementTimeoutSeconds;
  }

  /** Build a pooled gateway from the {@code store.*} configuration block. */
  public static StoreGateway fromConfiguration(Configuration cfg) {
    String url = cfg.getString("store.url", null);
    if (url == null || url.isBlank()) {
      throw new ConfigException("Missing store.url configuration");
    }
    String dialectName = cfg.getString("store.dialect", null);
    SqlDialect dialect =
        dialectName == null || dialectName.isBlank()
            ? SqlDialect.forUrl(url)
            : SqlDialect.forName(dialectName.trim());

    HikariConfig hikari = new HikariConfig();
    hikari.setPoolName("context-store");
    hikari.setJdbcUrl(url.trim());
    hikari.setUsername(cfg.getString("store.username", null));
    hikari.setPassword(cfg.getString("store.password", null));
    hikari.setMinimumIdle(cfg.getInt("store.pool.min-idle", 2));
    hikari.setMaximumPoolSize(cfg.getInt("store.pool.max-size", 20));
    hikari.setConnectionTimeout(cfg.getLong("store.pool.connection-timeout-ms", 2000L));
    hikari.setIdleTimeout(cfg.getLong("store.pool.idle-timeout-ms", 30000L));
    hikari.setAutoCommit(true);

    HikariDataSource ds;
    try {
      ds = new HikariDataSource(hikari);
    } catch (RuntimeException e) {
      throw new StoreException("Could not initialize the store connection pool", e);
    }
    log.info(
        "Store pool '{}' ready (dialect={}, min-idle={}, max-size={})",
        hikari.getPoolName(),
        dialect.name(),
        hikari.getMinimumIdle(),
        hikari.getMaximumPoolSize());
    return new StoreGateway(ds, dialect, cfg.getInt("store.statement-timeout-seconds", 30));
  }

  public SqlDialect dialect() {
    return dialect;
  }

  /** Run a single auto-committed statement returning rows. */
  public List<Row> execute(String sql, Object... params) {
    try (Connection connection = borrow()) {
      return handle(connection, false).query(sql, params);
    } catch (SQLException e) {
      throw new StoreException("Could not release store connection", e.getSQLState(), e);
    }
  }

  public List<Row> query(SqlStatement statement) {
    try (Connection connection = borrow()) {
      return handle(connection, false).query(statement);
    } catch (SQLException e) {
      throw new StoreException("Could not release store connection", e.getSQLState(), e);
    }
  }

  /** Run a single auto-committed data modification statement. */
  public int update(String sql, Object... params) {
    try (Connection connection = borrow()) {
      return handle(connection, false).update(sql, params);
    } catch (SQLException e) {
      throw new StoreException("Could not release store connection", e.getSQLState(), e);
    }
  }

  /**
   * Execute {@code work} atomically. The acting user is established before any other statement;
   * the transaction commits when {@code work} returns and rolls back on any exception, which is
   * rethrown unchanged when it is already a domain exception.
   */
  public <T> T withTransaction(UUID actingUser, TransactionCallback<T> work) {
    try (Connection connection = borrow()) {
      boolean autoCommit = connection.getAutoCommit();
      connection.setAutoCommit(false);
      try {
        StoreHandle handle = handle(connection, true);
        handle.setActingUser(actingUser);
        T result = work.execute(handle);
        connection.commit();
        return result;
      } catch (RuntimeException e) {
        rollback(connection, e);
        throw e;
      } catch (SQLException e) {
        rollback(connection, e);
        throw new StoreException("Could not commit transaction", e.getSQLState(), e);
      } finally {
        restoreAutoCommit(connection, autoCommit);
      }
    } catch (SQLException e) {
      throw new StoreException("Store transaction failed", e.getSQLState(), e);
    }
  }

  /** Round-trip probe with latency and pool utilization. Never throws. */
  public StoreHealth healthCheck() {
    long start = System.nanoTime();
    Integer active = null;
    Integer idle = null;
    Integer total = null;
    if (dataSource instanceof HikariDataSource hikari) {
      HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
      if (pool != null) {
        active = pool.getActiveConnections();
        idle = pool.getIdleConnections();
        total = pool.getTotalConnections();
      }
    }
    try {
      execute("SELECT 1 AS ok");
      long latency = (System.nanoTime() - start) / 1_000_000L;
      return new StoreHealth("healthy", latency, active, idle, total, null);
    } catch (ContextMcpException e) {
      long latency = (System.nanoTime() - start) / 1_000_000L;
      log.warn("Store health check failed", e);
      return new StoreHealth("unhealthy", latency, active, idle, total, e.getMessage());
    }
  }

  /** Column listing of the application tables, used by the schema resource. */
  public List<Row> describeSchema() {
    return execute(
        "SELECT LOWER(table_name) AS table_name, LOWER(column_name) AS column_name,"
            + " data_type, is_nullable FROM information_schema.columns"
            + " WHERE LOWER(table_name) IN ('users', 'context_collections', 'context_items',"
            + " 'context_item_versions', 'context_permissions', 'audit_logs',"
            + " 'search_analytics', 'api_usage')"
            + " ORDER BY LOWER(table_name), ordinal_position");
  }

  @Override
  public void close() {
    if (dataSource instanceof HikariDataSource hikari && !hikari.isClosed()) {
      log.info("Closing store pool '{}'", hikari.getPoolName());
      hikari.close();
    }
  }

  private Connection borrow() {
    try {
      return dataSource.getConnection();
    } catch (SQLException e) {
      log.error("Could not obtain a store connection", e);
      throw new StoreException("Store unavailable", e.getSQLState(), e);
    }
  }

  private StoreHandle handle(Connection connection, boolean transactional) {
    return new StoreHandle(connection, dialect, statementTimeoutSeconds, transactional);
  }

  private static void rollback(Connection connection, Exception cause) {
    try {
      connection.rollback();
      log.debug("Transaction rolled back: {}", cause.toString());
    } catch (SQLException rollbackError) {
      log.error("Rollback failed", rollbackError);
      cause.addSuppressed(rollbackError);
    }
  }

  private static void restoreAutoCommit(Connection connection, boolean autoCommit) {
    try {
      connection.setAutoCommit(autoCommit);
    } catch (SQLException e) {
      log.warn("Could not restore auto-commit on pooled connection", e);
    }
  }
}
