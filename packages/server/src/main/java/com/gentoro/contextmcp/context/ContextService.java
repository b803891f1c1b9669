package com.gentoro.contextmcp.context;

import com.gentoro.contextmcp.audit.AuditService;
import com.gentoro.contextmcp.audit.ChangeKind;
import com.gentoro.contextmcp.cache.ContextCache;
import com.gentoro.contextmcp.exception.AlreadyExistsException;
import com.gentoro.contextmcp.exception.DuplicateContentException;
import com.gentoro.contextmcp.exception.NoChangesException;
import com.gentoro.contextmcp.exception.NotFoundException;
import com.gentoro.contextmcp.exception.StateException;
import com.gentoro.contextmcp.exception.StoreException;
import com.gentoro.contextmcp.exception.ValidationException;
import com.gentoro.contextmcp.identity.PermissionLevel;
import com.gentoro.contextmcp.identity.PermissionResolver;
import com.gentoro.contextmcp.identity.User;
import com.gentoro.contextmcp.store.StoreGateway;
import com.gentoro.contextmcp.utility.HashUtility;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Item and collection operations. Permission checks happen before a transaction is opened; each
 * mutation, its version row and its audit row share one transaction that starts by recording the
 * acting user.
 */
public class ContextService {
  private static final org.slf4j.Logger log =
      com.gentoro.contextmcp.logging.LoggingService.getLogger(ContextService.class);

  static final String ITEM_RESOURCE = "context_item";
  static final String COLLECTION_RESOURCE = "collection";
  static final String COLLECTIONS_RESOURCE = "collections";

  private final StoreGateway store;
  private final ContextRepository repository;
  private final PermissionResolver permissions;
  private final AuditService audit;
  private final ContextCache cache;
  private final Clock clock;
  // bumped on every eviction; a read only fills the cache if no eviction happened meanwhile
  private final ConcurrentMap<UUID, Long> evictions = new ConcurrentHashMap<>();

  public ContextService(
      StoreGateway store,
      ContextRepository repository,
      PermissionResolver permissions,
      AuditService audit,
      ContextCache cache,
      Clock clock) {
    this.store = store;
    this.repository = repository;
    this.permissions = permissions;
    this.audit = audit;
    this.cache = cache;
    this.clock = clock;
  }

  public ContextItem createItem(NewItem request, User caller) {
    permissions.check(
        caller,
        PermissionResolver.collectionResource(request.collectionId()),
        PermissionLevel.WRITE);
    String hash = HashUtility.sha256Hex(request.content());
    Instant now = clock.instant();
    UUID itemId = UUID.randomUUID();

    try {
      return store.withTransaction(
          caller.id(),
          h -> {
            Optional<UUID> duplicate = repository.findActiveByHash(h, hash);
            if (duplicate.isPresent()) {
              throw duplicateContent(hash, duplicate.get());
            }
            if (repository.findCollection(h, request.collectionId()).isEmpty()) {
              throw new NotFoundException("Collection not found: " + request.collectionId());
            }
            ContextItem draft =
                new ContextItem(
                    itemId,
                    request.collectionId(),
                    null,
                    request.title(),
                    request.content(),
                    Objects.requireNonNullElse(request.contentType(), "text/plain"),
                    hash,
                    HashUtility.utf8Length(request.content()),
                    request.sourceUrl(),
                    Objects.requireNonNullElse(request.sourceType(), SourceType.MANUAL).wireName(),
                    Objects.requireNonNullElse(request.tags(), List.of()),
                    Objects.requireNonNullElse(request.metadata(), Map.of()),
                    1,
                    true,
                    caller.id(),
                    caller.id(),
                    now,
                    now);
            repository.insertItem(h, draft);
            repository.insertVersion(h, snapshot(draft, "Initial version", now));
            ContextItem created = repository.findActiveItem(h, itemId).orElseThrow();
            audit.recordDataChange(
                h,
                ITEM_RESOURCE,
                ChangeKind.CREATE,
                itemId.toString(),
                caller.id(),
                null,
                created.auditSnapshot());
            log.debug("Created item {} in collection {}", itemId, request.collectionId());
            return created;
          });
    } catch (StoreException e) {
      if (e.isUniqueViolation()) throw duplicateContent(hash, null);
      throw e;
    }
  }

  public ContextItem updateItem(UUID itemId, ItemUpdate update, User caller) {
    if (update == null || update.isEmpty()) {
      throw new NoChangesException("No updates provided");
    }
    ContextItem current =
        store
            .withTransaction(caller.id(), h -> repository.findActiveItem(h, itemId))
            .orElseThrow(() -> new NotFoundException("Context item not found: " + itemId));
    permissions.check(
        caller,
        PermissionResolver.collectionResource(current.collectionId()),
        PermissionLevel.WRITE);

    try {
      ContextItem updated =
          store.withTransaction(
              caller.id(),
              h -> {
                ContextItem before =
                    repository
                        .findActiveItem(h, itemId)
                        .orElseThrow(
                            () -> new NotFoundException("Context item not found: " + itemId));
                Instant now = clock.instant();
                ContextItem after = apply(before, update, caller.id(), now);
                if (!after.contentHash().equals(before.contentHash())) {
                  Optional<UUID> duplicate = repository.findActiveByHash(h, after.contentHash());
                  if (duplicate.isPresent() && !duplicate.get().equals(itemId)) {
                    throw duplicateContent(after.contentHash(), duplicate.get());
                  }
                }
                if (repository.updateItem(h, before, after) == 0) {
                  throw new StateException(
                      "Context item was modified concurrently: " + itemId,
                      Map.of("expected_version", before.version()));
                }
                repository.insertVersion(h, snapshot(after, update.changeSummary(), now));
                ContextItem persisted = repository.findActiveItem(h, itemId).orElseThrow();
                audit.recordDataChange(
                    h,
                    ITEM_RESOURCE,
                    ChangeKind.UPDATE,
                    itemId.toString(),
                    caller.id(),
                    before.auditSnapshot(),
                    persisted.auditSnapshot());
                return persisted;
              });
      evict(itemId);
      return updated;
    } catch (StoreException e) {
      if (e.isUniqueViolation()) throw duplicateContent(null, null);
      throw e;
    }
  }

  /** Soft-delete: the item stops being visible but its row and versions are kept. */
  public void deleteItem(UUID itemId, User caller) {
    ContextItem current =
        store
            .withTransaction(caller.id(), h -> repository.findActiveItem(h, itemId))
            .orElseThrow(() -> new NotFoundException("Context item not found: " + itemId));
    permissions.check(
        caller,
        PermissionResolver.collectionResource(current.collectionId()),
        PermissionLevel.WRITE);
    store.withTransaction(
        caller.id(),
        h -> {
          if (repository.deactivateItem(h, itemId, caller.id(), clock.instant()) == 0) {
            throw new NotFoundException("Context item not found: " + itemId);
          }
          audit.recordDataChange(
              h,
              ITEM_RESOURCE,
              ChangeKind.DELETE,
              itemId.toString(),
              caller.id(),
              current.auditSnapshot(),
              Map.of("is_active", false));
          return null;
        });
    evict(itemId);
  }

  public ItemDetails getItem(UUID itemId, boolean includeVersions, User caller) {
    String key = ContextCache.itemKey(itemId, includeVersions);
    Optional<ItemDetails> cached = cache.get(key, ItemDetails.class);
    if (cached.isPresent()) {
      // access may have changed since the entry was cached
      permissions.check(
          caller,
          PermissionResolver.collectionResource(cached.get().item().collectionId()),
          PermissionLevel.READ);
      return cached.get();
    }

    long generation = evictionGeneration(itemId);
    ItemDetails details =
        store.withTransaction(
            caller.id(),
            h -> {
              ContextItem item =
                  repository
                      .findActiveItem(h, itemId)
                      .orElseThrow(
                          () -> new NotFoundException("Context item not found: " + itemId));
              List<ItemVersion> versions =
                  includeVersions ? repository.listVersions(h, itemId) : null;
              return new ItemDetails(item, versions);
            });
    permissions.check(
        caller,
        PermissionResolver.collectionResource(details.item().collectionId()),
        PermissionLevel.READ);
    fill(key, itemId, generation, details);
    return details;
  }

  public CollectionPage listCollections(CollectionQuery query, User caller) {
    if (query.limit() < 1 || query.offset() < 0) {
      throw new ValidationException("limit must be positive and offset non-negative");
    }
    return store.withTransaction(
        caller.id(), h -> repository.listCollections(h, query, caller));
  }

  public ContextCollection createCollection(NewCollection request, User caller) {
    permissions.check(caller, COLLECTIONS_RESOURCE, PermissionLevel.WRITE);
    Instant now = clock.instant();
    ContextCollection draft =
        new ContextCollection(
            UUID.randomUUID(),
            request.name(),
            request.description(),
            caller.id(),
            request.isPublic(),
            Objects.requireNonNullElse(request.tags(), List.of()),
            Objects.requireNonNullElse(request.metadata(), Map.of()),
            null,
            now,
            now);
    try {
      return store.withTransaction(
          caller.id(),
          h -> {
            repository.insertCollection(h, draft);
            ContextCollection created = repository.findCollection(h, draft.id()).orElseThrow();
            audit.recordDataChange(
                h,
                COLLECTION_RESOURCE,
                ChangeKind.CREATE,
                created.id().toString(),
                caller.id(),
                null,
                Map.of(
                    "name", created.name(),
                    "is_public", created.isPublic(),
                    "tags", created.tags()));
            return created;
          });
    } catch (StoreException e) {
      if (e.isUniqueViolation()) {
        throw new AlreadyExistsException(
            "A collection named '" + request.name() + "' already exists for this owner",
            Map.of("name", request.name()));
      }
      throw e;
    }
  }

  private ContextItem apply(ContextItem before, ItemUpdate update, UUID actor, Instant now) {
    String content = update.content() != null ? update.content() : before.content();
    boolean contentChanged = update.content() != null && !update.content().equals(before.content());
    return new ContextItem(
        before.id(),
        before.collectionId(),
        before.collectionName(),
        update.title() != null ? update.title() : before.title(),
        content,
        before.contentType(),
        contentChanged ? HashUtility.sha256Hex(content) : before.contentHash(),
        contentChanged ? HashUtility.utf8Length(content) : before.sizeBytes(),
        before.sourceUrl(),
        before.sourceType(),
        update.tags() != null ? update.tags() : before.tags(),
        update.metadata() != null ? update.metadata() : before.metadata(),
        before.version() + 1,
        true,
        before.createdBy(),
        actor,
        before.createdAt(),
        now);
  }

  private static ItemVersion snapshot(ContextItem item, String changeSummary, Instant now) {
    return new ItemVersion(
        UUID.randomUUID(),
        item.id(),
        item.version(),
        item.title(),
        item.content(),
        item.contentHash(),
        item.tags(),
        item.metadata(),
        changeSummary,
        item.updatedBy(),
        now);
  }

  private void evict(UUID itemId) {
    evictions.merge(itemId, 1L, Long::sum);
    cache.invalidate(ContextCache.itemKey(itemId, false));
    cache.invalidate(ContextCache.itemKey(itemId, true));
  }

  private long evictionGeneration(UUID itemId) {
    return evictions.getOrDefault(itemId, 0L);
  }

  /**
   * Cache a read taken at {@code generation}. A write that committed after the read was taken has
   * already evicted, so the entry is either skipped or withdrawn again.
   */
  private void fill(String key, UUID itemId, long generation, ItemDetails details) {
    if (evictionGeneration(itemId) != generation) {
      log.trace("Skipping cache fill for {}: evicted during read", itemId);
      return;
    }
    cache.put(key, details);
    if (evictionGeneration(itemId) != generation) {
      cache.invalidate(key);
    }
  }

  private static DuplicateContentException duplicateContent(String hash, UUID existingId) {
    Map<String, Object> context = new LinkedHashMap<>();
    if (hash != null) context.put("content_hash", hash);
    if (existingId != null) context.put("existing_item_id", existingId.toString());
    return new DuplicateContentException(
        "Content with this hash already exists in an active item", context);
  }
}
