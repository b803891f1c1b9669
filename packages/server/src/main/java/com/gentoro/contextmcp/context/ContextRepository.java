package com.gentoro.contextmcp.context;

import com.gentoro.contextmcp.identity.User;
import com.gentoro.contextmcp.store.Row;
import com.gentoro.contextmcp.store.SqlFragment;
import com.gentoro.contextmcp.store.SqlQuery;
import com.gentoro.contextmcp.store.StoreHandle;
import com.gentoro.contextmcp.utility.JacksonUtility;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Row-level persistence for items, versions and collections. Every method runs on a handle supplied
 * by the caller, so transaction boundaries and the acting user are decided one level up.
 */
public class ContextRepository {

  private static final String ITEM_COLUMNS =
      "ci.id, ci.collection_id, cc.name AS collection_name, ci.title, ci.content,"
          + " ci.content_type, ci.content_hash, ci.size_bytes, ci.source_url, ci.source_type,"
          + " ci.tags, ci.metadata, ci.version, ci.is_active, ci.created_by, ci.updated_by,"
          + " ci.created_at, ci.updated_at";

  private static final String COLLECTION_COLUMNS =
      "c.id, c.name, c.description, c.owner_id, c.is_public, c.tags, c.metadata, c.created_at,"
          + " c.updated_at";

  /** Id of the active item holding content with this digest, if any. */
  public Optional<UUID> findActiveByHash(StoreHandle h, String contentHash) {
    return h.queryOne(
            "SELECT id FROM context_items WHERE content_hash = ? AND is_active = TRUE",
            contentHash)
        .map(r -> r.getUuid("id"));
  }

  public Optional<ContextItem> findActiveItem(StoreHandle h, UUID itemId) {
    return h.queryOne(
            "SELECT "
                + ITEM_COLUMNS
                + " FROM context_items ci JOIN context_collections cc ON cc.id = ci.collection_id"
                + " WHERE ci.id = ? AND ci.is_active = TRUE",
            itemId)
        .map(ContextRepository::toItem);
  }

  public void insertItem(StoreHandle h, ContextItem item) {
    String json = h.dialect().jsonParameter();
    h.update(
        "INSERT INTO context_items (id, collection_id, title, content, content_type,"
            + " content_hash, size_bytes, source_url, source_type, tags, metadata, version,"
            + " is_active, created_by, updated_by, created_at, updated_at)"
            + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, "
            + json
            + ", ?, TRUE, ?, ?, ?, ?)",
        item.id(),
        item.collectionId(),
        item.title(),
        item.content(),
        item.contentType(),
        item.contentHash(),
        item.sizeBytes(),
        item.sourceUrl(),
        item.sourceType(),
        item.tags(),
        JacksonUtility.toJson(item.metadata()),
        item.version(),
        item.createdBy(),
        item.updatedBy(),
        item.createdAt(),
        item.updatedAt());
  }

  /**
   * Persist the new state of an item; only the changed columns are written. Returns 0 when the
   * stored version no longer matches {@code before}.
   */
  public int updateItem(StoreHandle h, ContextItem before, ContextItem after) {
    List<String> assignments = new ArrayList<>();
    List<Object> params = new ArrayList<>();
    if (!after.title().equals(before.title())) {
      assignments.add("title = ?");
      params.add(after.title());
    }
    if (!after.content().equals(before.content())) {
      assignments.add("content = ?");
      params.add(after.content());
      assignments.add("content_hash = ?");
      params.add(after.contentHash());
      assignments.add("size_bytes = ?");
      params.add(after.sizeBytes());
    }
    if (!after.tags().equals(before.tags())) {
      assignments.add("tags = ?");
      params.add(after.tags());
    }
    if (!after.metadata().equals(before.metadata())) {
      assignments.add("metadata = " + h.dialect().jsonParameter());
      params.add(JacksonUtility.toJson(after.metadata()));
    }
    assignments.add("version = ?");
    params.add(after.version());
    assignments.add("updated_by = ?");
    params.add(after.updatedBy());
    assignments.add("updated_at = ?");
    params.add(after.updatedAt());
    params.add(after.id());
    params.add(before.version());
    return h.update(
        "UPDATE context_items SET "
            + String.join(", ", assignments)
            + " WHERE id = ? AND version = ?",
        params.toArray());
  }

  public int deactivateItem(StoreHandle h, UUID itemId, UUID actor, Instant now) {
    return h.update(
        "UPDATE context_items SET is_active = FALSE, updated_by = ?, updated_at = ?"
            + " WHERE id = ? AND is_active = TRUE",
        actor,
        now,
        itemId);
  }

  public void insertVersion(StoreHandle h, ItemVersion v) {
    String json = h.dialect().jsonParameter();
    h.update(
        "INSERT INTO context_item_versions (id, item_id, version, title, content, content_hash,"
            + " tags, metadata, change_summary, created_by, created_at)"
            + " VALUES (?, ?, ?, ?, ?, ?, ?, "
            + json
            + ", ?, ?, ?)",
        v.id(),
        v.itemId(),
        v.version(),
        v.title(),
        v.content(),
        v.contentHash(),
        v.tags(),
        JacksonUtility.toJson(v.metadata()),
        v.changeSummary(),
        v.createdBy(),
        v.createdAt());
  }

  /** Version history, newest first. */
  public List<ItemVersion> listVersions(StoreHandle h, UUID itemId) {
    return h
        .query(
            "SELECT id, item_id, version, title, content, content_hash, tags, metadata,"
                + " change_summary, created_by, created_at FROM context_item_versions"
                + " WHERE item_id = ? ORDER BY version DESC",
            itemId)
        .stream()
        .map(ContextRepository::toVersion)
        .toList();
  }

  public Optional<ContextCollection> findCollection(StoreHandle h, UUID collectionId) {
    return h.queryOne(
            "SELECT " + COLLECTION_COLUMNS + " FROM context_collections c WHERE c.id = ?",
            collectionId)
        .map(r -> toCollection(r, null));
  }

  public void insertCollection(StoreHandle h, ContextCollection c) {
    String json = h.dialect().jsonParameter();
    h.update(
        "INSERT INTO context_collections (id, name, description, owner_id, is_public, tags,"
            + " metadata, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, "
            + json
            + ", ?, ?)",
        c.id(),
        c.name(),
        c.description(),
        c.ownerId(),
        c.isPublic(),
        c.tags(),
        JacksonUtility.toJson(c.metadata()),
        c.createdAt(),
        c.updatedAt());
  }

  /**
   * Collections visible to the caller, newest first (ties by id), each with its live active item
   * count. Tag filtering keeps collections sharing at least one tag with the request.
   */
  public CollectionPage listCollections(StoreHandle h, CollectionQuery query, User caller) {
    SqlQuery select =
        SqlQuery.select(COLLECTION_COLUMNS)
            .column(
                SqlFragment.of(
                    "(SELECT COUNT(*) FROM context_items ci"
                        + " WHERE ci.collection_id = c.id AND ci.is_active = TRUE)"),
                "item_count")
            .from("context_collections c");
    if (query.tags() != null && !query.tags().isEmpty()) {
      select.where(h.dialect().arrayOverlap("c.tags", query.tags()));
    }
    Visibility.readableCollections("c", caller, query.includePublic()).ifPresent(select::where);

    long total = h.queryOne(select.buildCount()).map(r -> r.getLong("total")).orElse(0L);
    List<ContextCollection> collections =
        h
            .query(
                select
                    .orderBy("c.created_at DESC")
                    .orderBy("c.id")
                    .limit(query.limit())
                    .offset(query.offset())
                    .build())
            .stream()
            .map(r -> toCollection(r, r.getLong("item_count")))
            .toList();
    return new CollectionPage(collections, total, query.limit(), query.offset());
  }

  static ContextItem toItem(Row r) {
    return new ContextItem(
        r.getUuid("id"),
        r.getUuid("collection_id"),
        r.getString("collection_name"),
        r.getString("title"),
        r.getString("content"),
        r.getString("content_type"),
        r.getString("content_hash"),
        r.getInt("size_bytes"),
        r.getString("source_url"),
        r.getString("source_type"),
        r.getStringList("tags"),
        jsonOrEmpty(r, "metadata"),
        r.getInt("version"),
        r.getBoolean("is_active"),
        r.getUuid("created_by"),
        r.getUuid("updated_by"),
        r.getInstant("created_at"),
        r.getInstant("updated_at"));
  }

  static ItemVersion toVersion(Row r) {
    return new ItemVersion(
        r.getUuid("id"),
        r.getUuid("item_id"),
        r.getInt("version"),
        r.getString("title"),
        r.getString("content"),
        r.getString("content_hash"),
        r.getStringList("tags"),
        jsonOrEmpty(r, "metadata"),
        r.getString("change_summary"),
        r.getUuid("created_by"),
        r.getInstant("created_at"));
  }

  static ContextCollection toCollection(Row r, Long itemCount) {
    return new ContextCollection(
        r.getUuid("id"),
        r.getString("name"),
        r.getString("description"),
        r.getUuid("owner_id"),
        r.getBoolean("is_public"),
        r.getStringList("tags"),
        jsonOrEmpty(r, "metadata"),
        itemCount,
        r.getInstant("created_at"),
        r.getInstant("updated_at"));
  }

  private static Map<String, Object> jsonOrEmpty(Row r, String column) {
    Map<String, Object> value = r.getJson(column);
    return value == null ? Map.of() : value;
  }
}
