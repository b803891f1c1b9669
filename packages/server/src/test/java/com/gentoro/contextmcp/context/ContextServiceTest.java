package com.gentoro.contextmcp.context;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.contextmcp.ServiceFixture;
import com.gentoro.contextmcp.cache.CacheStatistics;
import com.gentoro.contextmcp.cache.CaffeineContextCache;
import com.gentoro.contextmcp.cache.ContextCache;
import com.gentoro.contextmcp.exception.AlreadyExistsException;
import com.gentoro.contextmcp.exception.DuplicateContentException;
import com.gentoro.contextmcp.exception.NoChangesException;
import com.gentoro.contextmcp.exception.NotFoundException;
import com.gentoro.contextmcp.exception.PermissionDeniedException;
import com.gentoro.contextmcp.exception.ValidationException;
import com.gentoro.contextmcp.identity.PermissionLevel;
import com.gentoro.contextmcp.identity.Role;
import com.gentoro.contextmcp.identity.User;
import com.gentoro.contextmcp.store.StoreHandle;
import com.gentoro.contextmcp.utility.HashUtility;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ContextServiceTest {

  private ServiceFixture fx;
  private ContextService contexts;
  private User alice;
  private User bob;
  private ContextCollection notes;

  @BeforeEach
  void setUp() {
    fx = new ServiceFixture();
    contexts = fx.contexts;
    alice = fx.user("alice", Role.USER);
    bob = fx.user("bob", Role.USER);
    notes = fx.collection(alice, "notes", false);
  }

  @AfterEach
  void tearDown() {
    fx.store.close();
  }

  @Nested
  class Create {

    @Test
    void testCreateItemStartsAtVersionOne() {
      ContextItem item = fx.item(alice, notes.id(), "Intro", "héllo world");

      assertEquals(1, item.version());
      assertTrue(item.active());
      assertEquals("notes", item.collectionName());
      assertEquals(HashUtility.sha256Hex("héllo world"), item.contentHash());
      assertEquals(12, item.sizeBytes());
      assertEquals("text/plain", item.contentType());
      assertEquals("manual", item.sourceType());
      assertEquals(alice.id(), item.createdBy());

      ItemDetails details = contexts.getItem(item.id(), true, alice);
      assertEquals(1, details.versions().size());
      assertEquals("Initial version", details.versions().get(0).changeSummary());
    }

    @Test
    void testCreateItemIsAudited() {
      ContextItem item = fx.item(alice, notes.id(), "Intro", "content");
      long rows =
          fx.store
              .execute(
                  "SELECT COUNT(*) AS n FROM audit_logs WHERE action = ? AND resource_id = ?",
                  "context_item_create",
                  item.id().toString())
              .get(0)
              .getLong("n");
      assertEquals(1, rows);
    }

    @Test
    void testDuplicateContentIsRejected() {
      ContextItem first = fx.item(alice, notes.id(), "One", "same text");
      ContextCollection other = fx.collection(alice, "other", false);

      DuplicateContentException e =
          assertThrows(
              DuplicateContentException.class,
              () -> fx.item(alice, other.id(), "Two", "same text"));
      assertEquals(first.id().toString(), e.getContext().get("existing_item_id"));
      assertEquals(1, fx.count("context_items"));
    }

    @Test
    void testUniqueIndexRejectsDuplicateMissedByLookup() {
      ContextRepository blindToHashes =
          new ContextRepository() {
            @Override
            public Optional<UUID> findActiveByHash(StoreHandle h, String contentHash) {
              return Optional.empty();
            }
          };
      ContextService unchecked =
          new ContextService(fx.store, blindToHashes, fx.permissions, fx.audit, fx.cache, fx.clock);
      NewItem draft =
          new NewItem(
              notes.id(), "One", "racing text", null, null, SourceType.MANUAL, List.of(), Map.of());
      unchecked.createItem(draft, alice);

      assertThrows(DuplicateContentException.class, () -> unchecked.createItem(draft, alice));
      assertEquals(1, fx.count("context_items"));
      assertEquals(1, fx.count("context_item_versions"));
    }

    @Test
    void testContentCanBeReusedAfterDelete() {
      ContextItem first = fx.item(alice, notes.id(), "One", "recycled");
      contexts.deleteItem(first.id(), alice);

      ContextItem second = fx.item(alice, notes.id(), "Two", "recycled");
      assertNotEquals(first.id(), second.id());
      assertEquals(2, fx.count("context_items"));
    }

    @Test
    void testWriterWithoutAccessIsDenied() {
      assertThrows(
          PermissionDeniedException.class,
          () -> fx.item(bob, notes.id(), "Nope", "bob was here"));
      assertEquals(0, fx.count("context_items"));
    }

    @Test
    void testGrantedWriterMayCreate() {
      fx.permissions.grant(notes.id(), bob.id(), PermissionLevel.WRITE, alice);
      ContextItem item = fx.item(bob, notes.id(), "Shared", "bob was here");
      assertEquals(bob.id(), item.createdBy());
    }

    @Test
    void testUnknownCollection() {
      UUID missing = UUID.randomUUID();
      assertThrows(PermissionDeniedException.class, () -> fx.item(alice, missing, "t", "c"));

      User admin = fx.user("root", Role.ADMIN);
      assertThrows(NotFoundException.class, () -> fx.item(admin, missing, "t", "c"));
    }
  }

  @Nested
  class Update {

    @Test
    void testUpdateCreatesNewVersion() {
      ContextItem item = fx.item(alice, notes.id(), "Draft", "v1 text", List.of("a"));
      fx.clock.advance(Duration.ofMinutes(1));

      ContextItem updated =
          contexts.updateItem(
              item.id(), new ItemUpdate(null, "v2 text", null, null, "rewrite"), alice);

      assertEquals(2, updated.version());
      assertEquals("Draft", updated.title());
      assertEquals(List.of("a"), updated.tags());
      assertEquals(HashUtility.sha256Hex("v2 text"), updated.contentHash());
      assertTrue(updated.updatedAt().isAfter(item.updatedAt()));

      List<ItemVersion> versions = contexts.getItem(item.id(), true, alice).versions();
      assertEquals(List.of(2, 1), versions.stream().map(ItemVersion::version).toList());
      assertEquals("rewrite", versions.get(0).changeSummary());
      assertEquals("v1 text", versions.get(1).content());
    }

    @Test
    void testSequentialUpdatesKeepVersionsContiguous() {
      ContextItem item = fx.item(alice, notes.id(), "Log", "entry 0", List.of("t0"));
      int updates = 6;
      for (int i = 1; i <= updates; i++) {
        fx.clock.advance(Duration.ofSeconds(1));
        ContextItem updated =
            contexts.updateItem(
                item.id(),
                new ItemUpdate(null, "entry " + i, List.of("t" + i), null, "step " + i),
                alice);
        assertEquals(i + 1, updated.version());
      }

      List<ItemVersion> versions = contexts.getItem(item.id(), true, alice).versions();
      assertEquals(updates + 1, versions.size());
      assertEquals(updates + 1, fx.count("context_item_versions"));
      for (ItemVersion v : versions) {
        int step = v.version() - 1;
        assertEquals("entry " + step, v.content());
        assertEquals(List.of("t" + step), v.tags());
        assertEquals(HashUtility.sha256Hex("entry " + step), v.contentHash());
      }
      assertEquals(
          IntStream.rangeClosed(1, updates + 1).boxed().toList(),
          versions.stream().map(ItemVersion::version).sorted().toList());
    }

    @Test
    void testMetadataOnlyUpdateKeepsHash() {
      ContextItem item = fx.item(alice, notes.id(), "Doc", "stable");
      ContextItem updated =
          contexts.updateItem(
              item.id(), new ItemUpdate(null, null, null, Map.of("k", "v"), null), alice);
      assertEquals(item.contentHash(), updated.contentHash());
      assertEquals(Map.of("k", "v"), updated.metadata());
      assertEquals(2, updated.version());
    }

    @Test
    void testEmptyUpdateIsRejected() {
      ContextItem item = fx.item(alice, notes.id(), "Doc", "stable");
      assertThrows(
          NoChangesException.class,
          () -> contexts.updateItem(item.id(), new ItemUpdate(null, null, null, null, "x"), alice));
      assertEquals(1, contexts.getItem(item.id(), false, alice).item().version());
    }

    @Test
    void testUpdateToExistingContentIsRejected() {
      fx.item(alice, notes.id(), "A", "taken");
      ContextItem b = fx.item(alice, notes.id(), "B", "free");
      ItemUpdate update = new ItemUpdate(null, "taken", null, null, null);
      assertThrows(
          DuplicateContentException.class, () -> contexts.updateItem(b.id(), update, alice));
    }

    @Test
    void testUpdateMissingItem() {
      assertThrows(
          NotFoundException.class,
          () ->
              contexts.updateItem(
                  UUID.randomUUID(), new ItemUpdate("t", null, null, null, null), alice));
    }

    @Test
    void testReaderCannotUpdate() {
      ContextCollection shared = fx.collection(alice, "shared", true);
      ContextItem item = fx.item(alice, shared.id(), "Doc", "public text");
      assertThrows(
          PermissionDeniedException.class,
          () -> contexts.updateItem(item.id(), new ItemUpdate("t", null, null, null, null), bob));
    }

    @Test
    void testUpdateEvictsCachedItem() {
      ContextItem item = fx.item(alice, notes.id(), "Doc", "first");
      contexts.getItem(item.id(), false, alice);
      contexts.updateItem(item.id(), new ItemUpdate("Renamed", null, null, null, null), alice);
      assertEquals("Renamed", contexts.getItem(item.id(), false, alice).item().title());
    }
  }

  @Nested
  class Delete {

    @Test
    void testDeletedItemIsHidden() {
      ContextItem item = fx.item(alice, notes.id(), "Doc", "to delete");
      contexts.getItem(item.id(), false, alice);
      contexts.deleteItem(item.id(), alice);

      assertThrows(NotFoundException.class, () -> contexts.getItem(item.id(), false, alice));
      assertThrows(NotFoundException.class, () -> contexts.deleteItem(item.id(), alice));
      assertEquals(1, fx.count("context_item_versions"));
    }

    @Test
    void testDeleteRequiresWriteAccess() {
      ContextItem item = fx.item(alice, notes.id(), "Doc", "private");
      assertThrows(PermissionDeniedException.class, () -> contexts.deleteItem(item.id(), bob));
    }
  }

  @Nested
  class Read {

    @Test
    void testPrivateItemIsNotReadableByOthers() {
      ContextItem item = fx.item(alice, notes.id(), "Doc", "secret");
      assertThrows(PermissionDeniedException.class, () -> contexts.getItem(item.id(), false, bob));
    }

    @Test
    void testCachedItemStillChecksAccess() {
      ContextItem item = fx.item(alice, notes.id(), "Doc", "secret");
      contexts.getItem(item.id(), false, alice);
      assertThrows(PermissionDeniedException.class, () -> contexts.getItem(item.id(), false, bob));
    }

    @Test
    void testUpdateDuringCacheFillIsNotHidden() {
      ContextItem item = fx.item(alice, notes.id(), "old", "cached body");
      CaffeineContextCache backing = new CaffeineContextCache(100, Duration.ofMinutes(5));
      ContextService[] service = new ContextService[1];
      ContextCache racing =
          new ContextCache() {
            private boolean raced;

            @Override
            public <T> Optional<T> get(String key, Class<T> type) {
              return backing.get(key, type);
            }

            @Override
            public void put(String key, Object value) {
              if (!raced) {
                raced = true;
                service[0].updateItem(
                    item.id(), new ItemUpdate("new", null, null, null, null), alice);
              }
              backing.put(key, value);
            }

            @Override
            public void invalidate(String key) {
              backing.invalidate(key);
            }

            @Override
            public CacheStatistics stats() {
              return backing.stats();
            }
          };
      service[0] =
          new ContextService(
              fx.store, new ContextRepository(), fx.permissions, fx.audit, racing, fx.clock);

      ItemDetails first = service[0].getItem(item.id(), false, alice);
      assertEquals("old", first.item().title());

      ItemDetails next = service[0].getItem(item.id(), false, alice);
      assertEquals(2, next.item().version());
      assertEquals("new", next.item().title());
    }

    @Test
    void testPublicItemIsReadable() {
      ContextCollection shared = fx.collection(alice, "shared", true);
      ContextItem item = fx.item(alice, shared.id(), "Doc", "public text");
      ItemDetails details = contexts.getItem(item.id(), false, bob);
      assertEquals(item.id(), details.item().id());
      assertNull(details.versions());
    }
  }

  @Nested
  class Collections {

    @Test
    void testDuplicateNamePerOwner() {
      assertThrows(AlreadyExistsException.class, () -> fx.collection(alice, "notes", false));
      ContextCollection bobs = fx.collection(bob, "notes", false);
      assertEquals(bob.id(), bobs.ownerId());
    }

    @Test
    void testReadonlyUserCannotCreateCollection() {
      User viewer = fx.user("viewer", Role.READONLY);
      assertThrows(PermissionDeniedException.class, () -> fx.collection(viewer, "mine", false));
    }

    @Test
    void testListingHonoursVisibility() {
      fx.clock.advance(Duration.ofSeconds(1));
      ContextCollection open = fx.collection(alice, "open", true, "docs");
      fx.clock.advance(Duration.ofSeconds(1));
      ContextCollection bobs = fx.collection(bob, "bobs", false, "misc");

      CollectionPage forBob = contexts.listCollections(new CollectionQuery(true, null, 50, 0), bob);
      assertEquals(List.of(bobs.id(), open.id()), ids(forBob));
      assertEquals(2, forBob.total());

      CollectionPage ownOnly =
          contexts.listCollections(new CollectionQuery(false, null, 50, 0), bob);
      assertEquals(List.of(bobs.id()), ids(ownOnly));

      User admin = fx.user("root", Role.ADMIN);
      assertEquals(
          3, contexts.listCollections(new CollectionQuery(false, null, 50, 0), admin).total());
    }

    @Test
    void testGrantMakesPrivateCollectionVisible() {
      fx.permissions.grant(notes.id(), bob.id(), PermissionLevel.READ, alice);
      CollectionPage page = contexts.listCollections(new CollectionQuery(false, null, 50, 0), bob);
      assertEquals(List.of(notes.id()), ids(page));
    }

    @Test
    void testTagFilterAndPaging() {
      fx.clock.advance(Duration.ofSeconds(1));
      ContextCollection a = fx.collection(alice, "a", false, "x", "y");
      fx.clock.advance(Duration.ofSeconds(1));
      ContextCollection b = fx.collection(alice, "b", false, "y");
      fx.clock.advance(Duration.ofSeconds(1));
      fx.collection(alice, "c", false, "z");

      CollectionPage tagged =
          contexts.listCollections(new CollectionQuery(true, List.of("y", "q"), 50, 0), alice);
      assertEquals(List.of(b.id(), a.id()), ids(tagged));

      CollectionPage second =
          contexts.listCollections(new CollectionQuery(true, null, 2, 2), alice);
      assertEquals(4, second.total());
      assertEquals(List.of(a.id(), notes.id()), ids(second));
    }

    @Test
    void testItemCountTracksActiveItems() {
      ContextItem one = fx.item(alice, notes.id(), "1", "one");
      fx.item(alice, notes.id(), "2", "two");
      contexts.deleteItem(one.id(), alice);

      ContextCollection listed =
          contexts.listCollections(new CollectionQuery(true, null, 50, 0), alice)
              .collections()
              .get(0);
      assertEquals(1L, listed.itemCount());
    }

    @Test
    void testInvalidPaging() {
      assertThrows(
          ValidationException.class,
          () -> contexts.listCollections(new CollectionQuery(true, null, 0, 0), alice));
      assertThrows(
          ValidationException.class,
          () -> contexts.listCollections(new CollectionQuery(true, null, 10, -1), alice));
    }

    private List<UUID> ids(CollectionPage page) {
      return page.collections().stream().map(ContextCollection::id).toList();
    }
  }
}
