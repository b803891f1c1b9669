package com.gentoro.contextmcp.identity;

import com.gentoro.contextmcp.audit.AuditService;
import com.gentoro.contextmcp.audit.ChangeKind;
import com.gentoro.contextmcp.exception.NotFoundException;
import com.gentoro.contextmcp.exception.PermissionDeniedException;
import com.gentoro.contextmcp.store.Row;
import com.gentoro.contextmcp.store.StoreGateway;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides whether a user may perform an action on a resource, and manages collection grants.
 *
 * <p>Rules, first match wins: unknown or inactive user is denied; admins are allowed; readonly
 * users are denied anything but reads. For {@code collection:<id>} resources the owner is allowed,
 * then an explicit grant at or above the requested level, then public collections for reads. Any
 * other resource is open to regular users. Resolution errors deny.
 */
public class PermissionResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.contextmcp.logging.LoggingService.getLogger(PermissionResolver.class);

  public static final String COLLECTION_PREFIX = "collection:";

  private final StoreGateway store;
  private final AuditService audit;
  private final Clock clock;

  public PermissionResolver(StoreGateway store, AuditService audit, Clock clock) {
    this.store = store;
    this.audit = audit;
    this.clock = clock;
  }

  public static String collectionResource(UUID collectionId) {
    return COLLECTION_PREFIX + collectionId;
  }

  public boolean hasPermission(UUID userId, String resource, PermissionLevel action) {
    try {
      Optional<User> found =
          store.execute(IdentityService.selectUser("id = ? AND is_active = TRUE"), userId).stream()
              .findFirst()
              .map(IdentityService::toUser);
      if (found.isEmpty()) return false;
      User user = found.get();
      if (user.role() == Role.ADMIN) return true;
      if (user.role() == Role.READONLY && action != PermissionLevel.READ) return false;

      if (resource != null && resource.startsWith(COLLECTION_PREFIX)) {
        UUID collectionId = UUID.fromString(resource.substring(COLLECTION_PREFIX.length()));
        return collectionAccess(user.id(), collectionId, action);
      }
      return user.role() == Role.USER || action == PermissionLevel.READ;
    } catch (RuntimeException e) {
      log.error("Permission check failed for user {} on {}; denying", userId, resource, e);
      return false;
    }
  }

  /** Throw {@link PermissionDeniedException} unless the caller may act on the resource. */
  public void check(User caller, String resource, PermissionLevel action) {
    if (!hasPermission(caller.id(), resource, action)) {
      throw new PermissionDeniedException(
          "Insufficient permissions to " + action.wireName() + " " + resource,
          Map.of("resource", resource, "action", action.wireName()));
    }
  }

  /** Create or replace the grant of {@code userId} on a collection. */
  public void grant(UUID collectionId, UUID userId, PermissionLevel level, User grantor) {
    check(grantor, collectionResource(collectionId), PermissionLevel.ADMIN);
    store.withTransaction(
        grantor.id(),
        h -> {
          if (h.queryOne("SELECT id FROM context_collections WHERE id = ?", collectionId)
              .isEmpty()) {
            throw new NotFoundException("Collection not found: " + collectionId);
          }
          List<Row> existing =
              h.query(
                  "SELECT permission_level FROM context_permissions"
                      + " WHERE collection_id = ? AND user_id = ?",
                  collectionId,
                  userId);
          if (existing.isEmpty()) {
            h.update(
                "INSERT INTO context_permissions (id, collection_id, user_id, permission_level,"
                    + " granted_by, granted_at) VALUES (?, ?, ?, ?, ?, ?)",
                UUID.randomUUID(),
                collectionId,
                userId,
                level,
                grantor.id(),
                clock.instant());
          } else {
            h.update(
                "UPDATE context_permissions SET permission_level = ?, granted_by = ?,"
                    + " granted_at = ? WHERE collection_id = ? AND user_id = ?",
                level,
                grantor.id(),
                clock.instant(),
                collectionId,
                userId);
          }
          audit.recordDataChange(
              h,
              "permission",
              existing.isEmpty() ? ChangeKind.CREATE : ChangeKind.UPDATE,
              collectionId + ":" + userId,
              grantor.id(),
              existing.isEmpty()
                  ? null
                  : Map.of("permission_level", existing.get(0).getString("permission_level")),
              Map.of("permission_level", level.wireName()));
          return null;
        });
  }

  public boolean revoke(UUID collectionId, UUID userId, User grantor) {
    check(grantor, collectionResource(collectionId), PermissionLevel.ADMIN);
    return store.withTransaction(
        grantor.id(),
        h -> {
          int removed =
              h.update(
                  "DELETE FROM context_permissions WHERE collection_id = ? AND user_id = ?",
                  collectionId,
                  userId);
          if (removed > 0) {
            audit.recordDataChange(
                h,
                "permission",
                ChangeKind.DELETE,
                collectionId + ":" + userId,
                grantor.id(),
                null,
                null);
          }
          return removed > 0;
        });
  }

  private boolean collectionAccess(UUID userId, UUID collectionId, PermissionLevel action) {
    List<Row> rows =
        store.execute(
            "SELECT c.owner_id, c.is_public, p.permission_level FROM context_collections c"
                + " LEFT JOIN context_permissions p"
                + " ON p.collection_id = c.id AND p.user_id = ?"
                + " WHERE c.id = ?",
            userId,
            collectionId);
    if (rows.isEmpty()) return false;
    Row row = rows.get(0);
    if (userId.equals(row.getUuid("owner_id"))) return true;
    String granted = row.getString("permission_level");
    if (granted != null && PermissionLevel.fromString(granted).satisfies(action)) return true;
    return action == PermissionLevel.READ && row.getBoolean("is_public");
  }
}
