package com.gentoro.contextmcp.identity;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.contextmcp.ServiceFixture;
import com.gentoro.contextmcp.context.ContextCollection;
import com.gentoro.contextmcp.exception.PermissionDeniedException;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PermissionResolverTest {

  private ServiceFixture fx;
  private PermissionResolver permissions;
  private User owner;
  private User other;
  private User viewer;
  private User admin;
  private ContextCollection privateOne;
  private ContextCollection publicOne;

  @BeforeEach
  void setUp() {
    fx = new ServiceFixture();
    permissions = fx.permissions;
    owner = fx.user("owner", Role.USER);
    other = fx.user("other", Role.USER);
    viewer = fx.user("viewer", Role.READONLY);
    admin = fx.user("admin", Role.ADMIN);
    privateOne = fx.collection(owner, "private", false);
    publicOne = fx.collection(owner, "public", true);
  }

  @AfterEach
  void tearDown() {
    fx.store.close();
  }

  private boolean can(User user, ContextCollection c, PermissionLevel level) {
    return permissions.hasPermission(
        user.id(), PermissionResolver.collectionResource(c.id()), level);
  }

  @Test
  void testOwnerHasFullAccess() {
    assertTrue(can(owner, privateOne, PermissionLevel.READ));
    assertTrue(can(owner, privateOne, PermissionLevel.WRITE));
    assertTrue(can(owner, privateOne, PermissionLevel.ADMIN));
  }

  @Test
  void testAdminBypassesOwnership() {
    assertTrue(can(admin, privateOne, PermissionLevel.ADMIN));
  }

  @Test
  void testPublicCollectionsAreReadOnlyForOthers() {
    assertTrue(can(other, publicOne, PermissionLevel.READ));
    assertFalse(can(other, publicOne, PermissionLevel.WRITE));
    assertFalse(can(other, privateOne, PermissionLevel.READ));
  }

  @Test
  void testGrantLevelsAreOrdered() {
    permissions.grant(privateOne.id(), other.id(), PermissionLevel.WRITE, owner);
    assertTrue(can(other, privateOne, PermissionLevel.READ));
    assertTrue(can(other, privateOne, PermissionLevel.WRITE));
    assertFalse(can(other, privateOne, PermissionLevel.ADMIN));

    permissions.grant(privateOne.id(), other.id(), PermissionLevel.READ, owner);
    assertFalse(can(other, privateOne, PermissionLevel.WRITE));
    assertEquals(1, fx.count("context_permissions"));
  }

  @Test
  void testRevoke() {
    permissions.grant(privateOne.id(), other.id(), PermissionLevel.READ, owner);
    assertTrue(permissions.revoke(privateOne.id(), other.id(), owner));
    assertFalse(permissions.revoke(privateOne.id(), other.id(), owner));
    assertFalse(can(other, privateOne, PermissionLevel.READ));
  }

  @Test
  void testOnlyCollectionAdminsMayGrant() {
    assertThrows(
        PermissionDeniedException.class,
        () -> permissions.grant(privateOne.id(), other.id(), PermissionLevel.READ, other));
  }

  @Test
  void testReadonlyRoleNeverWrites() {
    permissions.grant(privateOne.id(), viewer.id(), PermissionLevel.WRITE, owner);
    assertTrue(can(viewer, privateOne, PermissionLevel.READ));
    assertFalse(can(viewer, privateOne, PermissionLevel.WRITE));
    assertFalse(permissions.hasPermission(viewer.id(), "collections", PermissionLevel.WRITE));
    assertTrue(permissions.hasPermission(other.id(), "collections", PermissionLevel.WRITE));
  }

  @Test
  void testUnknownOrInactiveUserIsDenied() {
    assertFalse(
        permissions.hasPermission(
            UUID.randomUUID(),
            PermissionResolver.collectionResource(publicOne.id()),
            PermissionLevel.READ));
    fx.identity.deactivateUser(owner.id(), admin.id());
    assertFalse(can(owner, privateOne, PermissionLevel.READ));
  }

  @Test
  void testMalformedResourceIsDenied() {
    assertFalse(
        permissions.hasPermission(other.id(), "collection:not-a-uuid", PermissionLevel.READ));
  }

  @Test
  void testCheckReportsResourceAndAction() {
    PermissionDeniedException e =
        assertThrows(
            PermissionDeniedException.class,
            () ->
                permissions.check(
                    other,
                    PermissionResolver.collectionResource(privateOne.id()),
                    PermissionLevel.WRITE));
    assertEquals("write", e.getContext().get("action"));
  }
}
