package com.gentoro.contextmcp.audit;

import com.gentoro.contextmcp.exception.AuditWriteException;
import com.gentoro.contextmcp.exception.ContextMcpException;
import com.gentoro.contextmcp.exception.ValidationException;
import com.gentoro.contextmcp.logging.LoggingService;
import com.gentoro.contextmcp.store.Row;
import com.gentoro.contextmcp.store.SqlDialect;
import com.gentoro.contextmcp.store.SqlQuery;
import com.gentoro.contextmcp.store.StoreGateway;
import com.gentoro.contextmcp.store.StoreHandle;
import com.gentoro.contextmcp.utility.JacksonUtility;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Writes and reads the audit trail.
 *
 * <p>Data changes are written on the caller's transaction under a savepoint, so the audit row
 * commits or rolls back together with the change it describes, while a failing audit insert only
 * discards itself. Tool calls and security events are delivered through the {@link AuditChannel}.
 * When auditing is disabled every write is a no-op; reads keep working.
 */
public class AuditService {
  private static final org.slf4j.Logger log =
      com.gentoro.contextmcp.logging.LoggingService.getLogger(AuditService.class);

  public static final String TOOL_CALL = "tool_call";
  public static final String SECURITY_EVENT = "security_event";

  private static final int TOP_N = 20;

  private final StoreGateway store;
  private final AuditChannel channel;
  private final Clock clock;
  private final boolean enabled;

  public AuditService(StoreGateway store, AuditChannel channel, Clock clock, boolean enabled) {
    this.store = store;
    this.channel = channel;
    this.clock = clock;
    this.enabled = enabled;
  }

  public boolean isEnabled() {
    return enabled;
  }

  /** Asynchronously append a free-form action. */
  public void logAction(
      String action,
      String resourceType,
      String resourceId,
      UUID userId,
      Map<String, Object> oldValues,
      Map<String, Object> newValues,
      RequestOrigin origin) {
    if (!enabled) return;
    AuditEntry entry =
        entry(action, resourceType, resourceId, userId, oldValues, newValues, origin);
    LoggingService.audit(action, resourceType, resourceId, String.valueOf(userId));
    channel.submit("audit", () -> store.withTransaction(null, h -> insert(h, entry)));
  }

  public void logToolCall(
      String toolName, UUID userId, Map<String, Object> arguments, RequestOrigin origin) {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("arguments", arguments);
    logAction(TOOL_CALL, "mcp_tool", toolName, userId, null, values, origin);
  }

  /** Security events always reach the SECURITY log marker, even with auditing disabled. */
  public void logSecurityEvent(String event, UUID userId, Map<String, Object> details) {
    LoggingService.security(event, details);
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("event", event);
    if (details != null) values.putAll(details);
    logAction(SECURITY_EVENT, "security", event, userId, null, values, RequestOrigin.UNKNOWN);
  }

  /**
   * Record a data change inside the caller's transaction. Never throws: a failed insert is rolled
   * back to its savepoint, logged and counted on the channel.
   */
  public void recordDataChange(
      StoreHandle handle,
      String resourceType,
      ChangeKind kind,
      String resourceId,
      UUID userId,
      Map<String, Object> oldValues,
      Map<String, Object> newValues) {
    if (!enabled) return;
    String action = kind.actionFor(resourceType);
    AuditEntry entry =
        entry(
            action, resourceType, resourceId, userId, oldValues, newValues, RequestOrigin.UNKNOWN);
    try {
      handle.savepoint("audit_write", () -> insert(handle, entry));
      LoggingService.audit(action, resourceType, resourceId, String.valueOf(userId));
    } catch (ContextMcpException e) {
      channel.recordFailure("audit", new AuditWriteException("Could not write " + action, e));
    }
  }

  public AuditPage getAuditLog(AuditQuery query) {
    SqlQuery select =
        SqlQuery.select(
                "id, user_id, action, resource_type, resource_id, old_values, new_values,"
                    + " ip_address, user_agent, created_at")
            .from("audit_logs");
    if (query.getUserId() != null) select.where("user_id = ?", query.getUserId());
    if (query.getAction() != null) select.where("action = ?", query.getAction());
    if (query.getResourceType() != null) {
      select.where("resource_type = ?", query.getResourceType());
    }
    if (query.getResourceId() != null) select.where("resource_id = ?", query.getResourceId());
    if (query.getStart() != null) select.where("created_at >= ?", query.getStart());
    if (query.getEnd() != null) select.where("created_at <= ?", query.getEnd());

    long total = store.query(select.buildCount()).get(0).getLong("total");
    List<AuditEntry> logs =
        store
            .query(
                select
                    .orderBy("created_at DESC")
                    .orderBy("id")
                    .limit(query.getLimit())
                    .offset(query.getOffset())
                    .build())
            .stream()
            .map(AuditService::toEntry)
            .toList();
    return new AuditPage(logs, total, query.getLimit(), query.getOffset());
  }

  public AuditStats getAuditStats(AuditWindow window) {
    Instant now = clock.instant();
    Instant since = now.minus(window.duration());
    SqlDialect dialect = store.dialect();

    long total =
        store
            .execute("SELECT COUNT(*) AS total FROM audit_logs WHERE created_at >= ?", since)
            .get(0)
            .getLong("total");

    List<AuditStats.ActionCount> byAction =
        store
            .execute(
                "SELECT action, COUNT(*) AS action_count FROM audit_logs WHERE created_at >= ?"
                    + " GROUP BY action ORDER BY action_count DESC, action LIMIT ?",
                since,
                TOP_N)
            .stream()
            .map(
                r -> new AuditStats.ActionCount(r.getString("action"), r.getLong("action_count")))
            .toList();

    List<AuditStats.UserCount> byUser =
        store
            .execute(
                "SELECT a.user_id, u.username, COUNT(*) AS action_count FROM audit_logs a"
                    + " LEFT JOIN users u ON u.id = a.user_id"
                    + " WHERE a.created_at >= ? AND a.user_id IS NOT NULL"
                    + " GROUP BY a.user_id, u.username ORDER BY action_count DESC LIMIT ?",
                since,
                TOP_N)
            .stream()
            .map(
                r ->
                    new AuditStats.UserCount(
                        r.getUuid("user_id"), r.getString("username"), r.getLong("action_count")))
            .toList();

    String bucket = dialect.hourBucket("created_at");
    List<AuditStats.HourCount> byHour =
        store
            .execute(
                "SELECT "
                    + bucket
                    + " AS bucket_hour, COUNT(*) AS action_count FROM audit_logs"
                    + " WHERE created_at >= ? GROUP BY "
                    + bucket
                    + " ORDER BY bucket_hour DESC LIMIT 24",
                now.minus(Duration.ofHours(24)))
            .stream()
            .map(
                r ->
                    new AuditStats.HourCount(
                        r.getInstant("bucket_hour"), r.getLong("action_count")))
            .toList();

    return new AuditStats(window.label(), total, byAction, byUser, byHour);
  }

  /** Delete audit rows older than {@code retentionDays}; returns the number removed. */
  public int cleanupOldLogs(int retentionDays) {
    if (retentionDays < 1) {
      throw new ValidationException("retention days must be at least 1");
    }
    Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
    int deleted = store.update("DELETE FROM audit_logs WHERE created_at < ?", cutoff);
    log.info("Removed {} audit entries older than {} days", deleted, retentionDays);
    return deleted;
  }

  private AuditEntry entry(
      String action,
      String resourceType,
      String resourceId,
      UUID userId,
      Map<String, Object> oldValues,
      Map<String, Object> newValues,
      RequestOrigin origin) {
    RequestOrigin o = origin == null ? RequestOrigin.UNKNOWN : origin;
    return new AuditEntry(
        UUID.randomUUID(),
        userId,
        action,
        resourceType,
        resourceId,
        oldValues,
        newValues,
        o.ipAddress(),
        o.userAgent(),
        clock.instant());
  }

  private static Integer insert(StoreHandle handle, AuditEntry e) {
    String json = handle.dialect().jsonParameter();
    return handle.update(
        "INSERT INTO audit_logs (id, user_id, action, resource_type, resource_id, old_values,"
            + " new_values, ip_address, user_agent, created_at) VALUES (?, ?, ?, ?, ?, "
            + json
            + ", "
            + json
            + ", ?, ?, ?)",
        e.id(),
        e.userId(),
        e.action(),
        e.resourceType(),
        e.resourceId(),
        e.oldValues() == null ? null : JacksonUtility.toJson(e.oldValues()),
        e.newValues() == null ? null : JacksonUtility.toJson(e.newValues()),
        e.ipAddress(),
        e.userAgent(),
        e.createdAt());
  }

  private static AuditEntry toEntry(Row r) {
    return new AuditEntry(
        r.getUuid("id"),
        r.getUuid("user_id"),
        r.getString("action"),
        r.getString("resource_type"),
        r.getString("resource_id"),
        r.getJson("old_values"),
        r.getJson("new_values"),
        r.getString("ip_address"),
        r.getString("user_agent"),
        r.getInstant("created_at"));
  }
}
