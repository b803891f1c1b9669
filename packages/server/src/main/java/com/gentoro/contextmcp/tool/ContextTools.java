package com.gentoro.contextmcp.tool;

import com.gentoro.contextmcp.analytics.AnalyticsService;
import com.gentoro.contextmcp.analytics.AnalyticsType;
import com.gentoro.contextmcp.audit.AuditQuery;
import com.gentoro.contextmcp.audit.AuditService;
import com.gentoro.contextmcp.audit.AuditWindow;
import com.gentoro.contextmcp.context.CollectionQuery;
import com.gentoro.contextmcp.context.ContextService;
import com.gentoro.contextmcp.context.ItemUpdate;
import com.gentoro.contextmcp.context.NewCollection;
import com.gentoro.contextmcp.context.NewItem;
import com.gentoro.contextmcp.context.SourceType;
import com.gentoro.contextmcp.identity.PermissionLevel;
import com.gentoro.contextmcp.identity.PermissionResolver;
import com.gentoro.contextmcp.identity.User;
import com.gentoro.contextmcp.search.SearchEngine;
import com.gentoro.contextmcp.search.SearchRequest;
import com.gentoro.contextmcp.search.SearchType;
import com.gentoro.contextmcp.tool.ToolProperty.Format;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** The context tool catalog and the handlers that bind each tool to its service call. */
public class ContextTools {

  public static final String SEARCH_CONTEXT = "search_context";
  public static final String GET_CONTEXT_ITEM = "get_context_item";
  public static final String CREATE_CONTEXT_ITEM = "create_context_item";
  public static final String UPDATE_CONTEXT_ITEM = "update_context_item";
  public static final String DELETE_CONTEXT_ITEM = "delete_context_item";
  public static final String LIST_COLLECTIONS = "list_collections";
  public static final String CREATE_COLLECTION = "create_collection";
  public static final String GET_ANALYTICS = "get_analytics";
  public static final String GET_AUDIT_LOG = "get_audit_log";
  public static final String GET_AUDIT_STATS = "get_audit_stats";

  private final ContextService contexts;
  private final SearchEngine search;
  private final AnalyticsService analytics;
  private final AuditService audit;
  private final PermissionResolver permissions;

  public ContextTools(
      ContextService contexts,
      SearchEngine search,
      AnalyticsService analytics,
      AuditService audit,
      PermissionResolver permissions) {
    this.contexts = contexts;
    this.search = search;
    this.analytics = analytics;
    this.audit = audit;
    this.permissions = permissions;
  }

  public ToolDispatcher registerAll(ToolDispatcher dispatcher) {
    return dispatcher
        .register(searchContext(), this::searchContext)
        .register(getContextItem(), this::getContextItem)
        .register(createContextItem(), this::createContextItem)
        .register(updateContextItem(), this::updateContextItem)
        .register(deleteContextItem(), this::deleteContextItem)
        .register(listCollections(), this::listCollections)
        .register(createCollection(), this::createCollection)
        .register(getAnalytics(), this::getAnalytics)
        .register(getAuditLog(), this::getAuditLog)
        .register(getAuditStats(), this::getAuditStats);
  }

  // ---------------------------------------------------------------------------
  // Definitions
  // ---------------------------------------------------------------------------

  static ToolDefinition searchContext() {
    return ToolDefinition.builder()
        .name(SEARCH_CONTEXT)
        .description(
            "Search stored context items by text, optionally restricted to collections and tags."
                + " Results are ranked by relevance.")
        .argument(ToolProperty.string("query", "Free-text search query").required())
        .argument(ToolProperty.uuidArray("collection_ids", "Only search these collections"))
        .argument(
            ToolProperty.string("search_type", "Search strategy")
                .enumValues("fulltext", "semantic", "hybrid")
                .defaultValue("hybrid"))
        .argument(
            ToolProperty.integer("limit", "Maximum number of results")
                .range(1, SearchRequest.MAX_LIMIT)
                .defaultValue(SearchRequest.DEFAULT_LIMIT))
        .argument(ToolProperty.stringArray("tags", "Only items carrying any of these tags"))
        .build();
  }

  static ToolDefinition getContextItem() {
    return ToolDefinition.builder()
        .name(GET_CONTEXT_ITEM)
        .description("Fetch one context item, optionally with its version history.")
        .argument(
            ToolProperty.string("item_id", "Context item id").format(Format.UUID).required())
        .argument(
            ToolProperty.bool("include_versions", "Include version history, newest first")
                .defaultValue(false))
        .build();
  }

  static ToolDefinition createContextItem() {
    return ToolDefinition.builder()
        .name(CREATE_CONTEXT_ITEM)
        .description("Store a new context item in a collection. Identical content is rejected.")
        .argument(
            ToolProperty.string("collection_id", "Target collection id")
                .format(Format.UUID)
                .required())
        .argument(
            ToolProperty.string("title", "Item title").minLength(1).maxLength(500).required())
        .argument(ToolProperty.string("content", "Item content").minLength(1).required())
        .argument(
            ToolProperty.string("content_type", "MIME type of the content")
                .maxLength(100)
                .defaultValue("text/plain"))
        .argument(
            ToolProperty.string("source_url", "Where the content came from").format(Format.URL))
        .argument(
            ToolProperty.string("source_type", "Kind of source")
                .enumValues("file", "url", "api", "manual")
                .defaultValue("manual"))
        .argument(ToolProperty.stringArray("tags", "Tags").defaultValue(List.of()))
        .argument(ToolProperty.object("metadata", "Arbitrary metadata").defaultValue(Map.of()))
        .build();
  }

  static ToolDefinition updateContextItem() {
    return ToolDefinition.builder()
        .name(UPDATE_CONTEXT_ITEM)
        .description(
            "Update fields of a context item. Each successful update creates a new version.")
        .argument(
            ToolProperty.string("item_id", "Context item id").format(Format.UUID).required())
        .argument(ToolProperty.string("title", "New title").minLength(1).maxLength(500))
        .argument(ToolProperty.string("content", "New content").minLength(1))
        .argument(ToolProperty.stringArray("tags", "Replacement tags"))
        .argument(ToolProperty.object("metadata", "Replacement metadata"))
        .argument(ToolProperty.string("change_summary", "Description of the change"))
        .build();
  }

  static ToolDefinition deleteContextItem() {
    return ToolDefinition.builder()
        .name(DELETE_CONTEXT_ITEM)
        .description("Deactivate a context item. Its versions and audit trail are kept.")
        .argument(
            ToolProperty.string("item_id", "Context item id").format(Format.UUID).required())
        .build();
  }

  static ToolDefinition listCollections() {
    return ToolDefinition.builder()
        .name(LIST_COLLECTIONS)
        .description("List the collections visible to the caller, newest first.")
        .argument(
            ToolProperty.bool("include_public", "Include public collections").defaultValue(true))
        .argument(ToolProperty.stringArray("tags", "Only collections carrying any of these tags"))
        .argument(ToolProperty.integer("limit", "Page size").range(1, 200).defaultValue(50))
        .argument(ToolProperty.integer("offset", "Page offset").minimum(0).defaultValue(0))
        .build();
  }

  static ToolDefinition createCollection() {
    return ToolDefinition.builder()
        .name(CREATE_COLLECTION)
        .description("Create a collection owned by the caller.")
        .argument(
            ToolProperty.string("name", "Collection name").minLength(1).maxLength(255).required())
        .argument(ToolProperty.string("description", "Collection description"))
        .argument(
            ToolProperty.bool("is_public", "Readable by every user").defaultValue(false))
        .argument(ToolProperty.stringArray("tags", "Tags").defaultValue(List.of()))
        .argument(ToolProperty.object("metadata", "Arbitrary metadata").defaultValue(Map.of()))
        .build();
  }

  static ToolDefinition getAnalytics() {
    return ToolDefinition.builder()
        .name(GET_ANALYTICS)
        .description("Aggregated search, usage or per-tool performance analytics.")
        .argument(
            ToolProperty.string("type", "Report type")
                .enumValues("search", "usage", "performance")
                .defaultValue("usage"))
        .argument(ToolProperty.string("start_date", "First day, YYYY-MM-DD").format(Format.DATE))
        .argument(ToolProperty.string("end_date", "Last day, YYYY-MM-DD").format(Format.DATE))
        .argument(ToolProperty.uuidArray("collection_ids", "Scope search analytics"))
        .build();
  }

  static ToolDefinition getAuditLog() {
    return ToolDefinition.builder()
        .name(GET_AUDIT_LOG)
        .description("Query the audit log, newest first. Admin only.")
        .argument(ToolProperty.string("user_id", "Acting user").format(Format.UUID))
        .argument(ToolProperty.string("action", "Action, e.g. context_item_update"))
        .argument(ToolProperty.string("resource_type", "Resource type"))
        .argument(ToolProperty.string("resource_id", "Resource id"))
        .argument(ToolProperty.string("start_date", "First day, YYYY-MM-DD").format(Format.DATE))
        .argument(ToolProperty.string("end_date", "Last day, YYYY-MM-DD").format(Format.DATE))
        .argument(ToolProperty.integer("limit", "Page size").range(1, 500).defaultValue(50))
        .argument(ToolProperty.integer("offset", "Page offset").minimum(0).defaultValue(0))
        .adminOnly()
        .build();
  }

  static ToolDefinition getAuditStats() {
    return ToolDefinition.builder()
        .name(GET_AUDIT_STATS)
        .description("Audit activity totals and top actions and users. Admin only.")
        .argument(
            ToolProperty.string("timeframe", "Window")
                .enumValues("24h", "7d", "30d", "90d")
                .defaultValue("7d"))
        .adminOnly()
        .build();
  }

  // ---------------------------------------------------------------------------
  // Handlers
  // ---------------------------------------------------------------------------

  private Object searchContext(ToolArguments args, User caller) {
    return search.search(
        new SearchRequest(
            args.getString("query"),
            SearchType.fromString(args.getString("search_type")),
            args.getUuidList("collection_ids"),
            args.getStringList("tags"),
            args.getInt("limit")),
        caller);
  }

  private Object getContextItem(ToolArguments args, User caller) {
    return contexts.getItem(args.getUuid("item_id"), args.getBoolean("include_versions"), caller);
  }

  private Object createContextItem(ToolArguments args, User caller) {
    return contexts.createItem(
        new NewItem(
            args.getUuid("collection_id"),
            args.getString("title"),
            args.getString("content"),
            args.getString("content_type"),
            args.getString("source_url"),
            SourceType.fromString(args.getString("source_type")),
            args.getStringList("tags"),
            args.getMap("metadata")),
        caller);
  }

  private Object updateContextItem(ToolArguments args, User caller) {
    return contexts.updateItem(
        args.getUuid("item_id"),
        new ItemUpdate(
            args.getString("title"),
            args.getString("content"),
            args.getStringList("tags"),
            args.getMap("metadata"),
            args.getString("change_summary")),
        caller);
  }

  private Object deleteContextItem(ToolArguments args, User caller) {
    UUID itemId = args.getUuid("item_id");
    contexts.deleteItem(itemId, caller);
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("id", itemId);
    result.put("deleted", true);
    return result;
  }

  private Object listCollections(ToolArguments args, User caller) {
    return contexts.listCollections(
        new CollectionQuery(
            args.getBoolean("include_public"),
            args.getStringList("tags"),
            args.getInt("limit"),
            args.getInt("offset")),
        caller);
  }

  private Object createCollection(ToolArguments args, User caller) {
    return contexts.createCollection(
        new NewCollection(
            args.getString("name"),
            args.getString("description"),
            args.getBoolean("is_public"),
            args.getStringList("tags"),
            args.getMap("metadata")),
        caller);
  }

  private Object getAnalytics(ToolArguments args, User caller) {
    List<UUID> collectionIds = args.getUuidList("collection_ids");
    if (collectionIds != null) {
      for (UUID collectionId : collectionIds) {
        permissions.check(
            caller, PermissionResolver.collectionResource(collectionId), PermissionLevel.READ);
      }
    }
    return analytics.report(
        AnalyticsType.fromString(args.getString("type")),
        args.getDate("start_date"),
        args.getDate("end_date"),
        collectionIds);
  }

  private Object getAuditLog(ToolArguments args, User caller) {
    AuditQuery.Builder query =
        AuditQuery.builder()
            .userId(args.getUuid("user_id"))
            .action(args.getString("action"))
            .resourceType(args.getString("resource_type"))
            .resourceId(args.getString("resource_id"))
            .limit(args.getInt("limit"))
            .offset(args.getInt("offset"));
    LocalDate start = args.getDate("start_date");
    if (start != null) query.start(start.atStartOfDay(ZoneOffset.UTC).toInstant());
    LocalDate end = args.getDate("end_date");
    if (end != null) query.end(end.atTime(LocalTime.MAX).toInstant(ZoneOffset.UTC));
    return audit.getAuditLog(query.build());
  }

  private Object getAuditStats(ToolArguments args, User caller) {
    return audit.getAuditStats(AuditWindow.fromLabel(args.getString("timeframe")));
  }
}
