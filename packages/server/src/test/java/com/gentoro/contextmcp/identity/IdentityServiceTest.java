package com.gentoro.contextmcp.identity;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.contextmcp.ServiceFixture;
import com.gentoro.contextmcp.exception.AlreadyExistsException;
import com.gentoro.contextmcp.exception.ConfigException;
import com.gentoro.contextmcp.exception.NotFoundException;
import com.gentoro.contextmcp.exception.StateException;
import com.gentoro.contextmcp.exception.ValidationException;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IdentityServiceTest {

  private ServiceFixture fx;
  private IdentityService identity;

  @BeforeEach
  void setUp() {
    fx = new ServiceFixture();
    identity = fx.identity;
  }

  @AfterEach
  void tearDown() {
    fx.store.close();
  }

  private long securityEvents(String event) {
    return fx.store
        .execute(
            "SELECT COUNT(*) AS n FROM audit_logs WHERE action = 'security_event'"
                + " AND resource_id = ?",
            event)
        .get(0)
        .getLong("n");
  }

  @Test
  void testCreateUserDefaults() {
    User user = identity.createUser("carol", "carol@example.com", null, null, null);
    assertEquals(Role.USER, user.role());
    assertTrue(user.active());
    assertNotNull(user.createdAt());
    assertNull(user.lastLogin());
  }

  @Test
  void testCreateUserRejectsDuplicates() {
    identity.createUser("carol", "carol@example.com", null, Role.USER, null);
    assertThrows(
        AlreadyExistsException.class,
        () -> identity.createUser("carol", "other@example.com", null, Role.USER, null));
    assertThrows(
        AlreadyExistsException.class,
        () -> identity.createUser("other", "carol@example.com", null, Role.USER, null));
  }

  @Test
  void testCreateUserValidatesInput() {
    assertThrows(
        ValidationException.class,
        () -> identity.createUser(" ", "x@example.com", null, Role.USER, null));
    assertThrows(
        ValidationException.class,
        () -> identity.createUser("x", "not-an-email", null, Role.USER, null));
  }

  @Test
  void testApiKeyAuthentication() {
    User user = fx.user("dave", Role.USER);
    String apiKey = identity.generateApiKey(user.id());

    Optional<User> resolved = identity.authenticate(apiKey);
    assertTrue(resolved.isPresent());
    assertEquals(user.id(), resolved.get().id());
    assertEquals(user.id(), identity.authenticate("Bearer " + apiKey).orElseThrow().id());

    String stored =
        fx.store
            .execute("SELECT api_key_hash FROM users WHERE id = ?", user.id())
            .get(0)
            .getString("api_key_hash");
    assertNotEquals(apiKey, stored);
    assertEquals(64, stored.length());
    assertEquals(fx.clock.instant(), identity.findActiveUser(user.id()).orElseThrow().lastLogin());
  }

  @Test
  void testRotatedKeyReplacesPrevious() {
    User user = fx.user("dave", Role.USER);
    String first = identity.generateApiKey(user.id());
    String second = identity.generateApiKey(user.id());

    assertTrue(identity.authenticate(first).isEmpty());
    assertTrue(identity.authenticate(second).isPresent());
  }

  @Test
  void testUnknownApiKeyIsRejectedAndReported() {
    assertTrue(identity.authenticate("definitely-not-a-key").isEmpty());
    assertTrue(identity.authenticate("   ").isEmpty());
    assertEquals(1, securityEvents("invalid_api_key"));
  }

  @Test
  void testRevokedKeyStopsWorking() {
    User user = fx.user("dave", Role.USER);
    String apiKey = identity.generateApiKey(user.id());
    identity.revokeApiKey(user.id());
    assertTrue(identity.authenticate(apiKey).isEmpty());
  }

  @Test
  void testDeactivatedUserCannotAuthenticate() {
    User user = fx.user("dave", Role.USER);
    String apiKey = identity.generateApiKey(user.id());
    identity.deactivateUser(user.id(), null);

    assertTrue(identity.authenticate(apiKey).isEmpty());
    assertTrue(identity.findActiveUser(user.id()).isEmpty());
    assertThrows(NotFoundException.class, () -> identity.generateApiKey(user.id()));
  }

  @Test
  void testJwtRoundTripAndExpiry() {
    User user = fx.user("erin", Role.ADMIN);
    String token = identity.issueToken(user);

    assertEquals(user.id(), identity.authenticate("Bearer " + token).orElseThrow().id());

    fx.clock.advance(Duration.ofHours(2));
    assertTrue(identity.authenticate(token).isEmpty());
    assertEquals(1, securityEvents("invalid_jwt_token"));
  }

  @Test
  void testJwtSignedWithAnotherSecretIsRejected() {
    User user = fx.user("erin", Role.USER);
    IdentityService foreign =
        new IdentityService(
            fx.store,
            fx.audit,
            fx.clock,
            new SecuritySettings(
                "another-signing-secret-that-is-long-enough!",
                Duration.ofHours(1),
                4,
                3,
                Duration.ofMinutes(15)));
    String token = foreign.issueToken(user);

    assertTrue(identity.authenticate(token).isEmpty());
    assertTrue(identity.authenticate("not.a.jwt").isEmpty());
  }

  @Test
  void testJwtDisabledWithoutSecret() {
    IdentityService noJwt =
        new IdentityService(
            fx.store,
            fx.audit,
            fx.clock,
            new SecuritySettings(" ", Duration.ofHours(1), 4, 3, Duration.ofMinutes(15)));
    User user = fx.user("erin", Role.USER);
    assertThrows(StateException.class, () -> noJwt.issueToken(user));
    assertTrue(noJwt.authenticate(identity.issueToken(user)).isEmpty());
  }

  @Test
  void testShortSecretIsRejected() {
    assertThrows(
        ConfigException.class,
        () -> new SecuritySettings("short", Duration.ofHours(1), 4, 3, Duration.ofMinutes(1)));
  }

  @Test
  void testPasswordLockout() {
    User user = identity.createUser("frank", "frank@example.com", "s3cret!", Role.USER, null);

    assertTrue(identity.validatePassword(user.id(), "s3cret!"));
    assertFalse(identity.validatePassword(user.id(), "wrong"));
    assertFalse(identity.validatePassword(user.id(), "wrong"));
    assertFalse(identity.validatePassword(user.id(), "wrong"));
    assertEquals(1, securityEvents("account_locked"));

    // locked: even the right password fails
    assertFalse(identity.validatePassword(user.id(), "s3cret!"));
    assertEquals(1, securityEvents("account_locked_attempt"));

    fx.clock.advance(Duration.ofMinutes(16));
    assertTrue(identity.validatePassword(user.id(), "s3cret!"));
    assertEquals(
        0,
        fx.store
            .execute("SELECT failed_login_attempts FROM users WHERE id = ?", user.id())
            .get(0)
            .getInt("failed_login_attempts"));
  }

  @Test
  void testDefaultLockoutPolicy() {
    SecuritySettings defaults = SecuritySettings.defaults();
    assertEquals(5, defaults.maxFailedAttempts());
    assertEquals(Duration.ofMinutes(30), defaults.lockoutDuration());
    // cheap hashing, default lockout policy
    IdentityService service =
        new IdentityService(
            fx.store,
            fx.audit,
            fx.clock,
            new SecuritySettings(
                null,
                defaults.jwtTtl(),
                4,
                defaults.maxFailedAttempts(),
                defaults.lockoutDuration()));
    User user = service.createUser("hank", "hank@example.com", "s3cret!", Role.USER, null);

    for (int i = 0; i < 4; i++) assertFalse(service.validatePassword(user.id(), "wrong"));
    assertEquals(0, securityEvents("account_locked"));
    assertTrue(service.validatePassword(user.id(), "s3cret!"));

    for (int i = 0; i < 5; i++) assertFalse(service.validatePassword(user.id(), "wrong"));
    assertEquals(1, securityEvents("account_locked"));

    fx.clock.advance(Duration.ofMinutes(29));
    assertFalse(service.validatePassword(user.id(), "s3cret!"));
    assertEquals(1, securityEvents("account_locked_attempt"));

    fx.clock.advance(Duration.ofMinutes(2));
    assertTrue(service.validatePassword(user.id(), "s3cret!"));
  }

  @Test
  void testExpiredLockRestartsCount() {
    User user = identity.createUser("frank", "frank@example.com", "s3cret!", Role.USER, null);
    for (int i = 0; i < 3; i++) identity.validatePassword(user.id(), "wrong");
    fx.clock.advance(Duration.ofMinutes(16));

    assertFalse(identity.validatePassword(user.id(), "wrong"));
    assertEquals(1, securityEvents("account_locked"));
    assertTrue(identity.validatePassword(user.id(), "s3cret!"));
  }

  @Test
  void testPasswordlessAccount() {
    User user = fx.user("gina", Role.USER);
    assertFalse(identity.validatePassword(user.id(), "anything"));
  }

  @Test
  void testServiceUserCreatedOnce() {
    User first = identity.ensureServiceUser("svc");
    User second = identity.ensureServiceUser("svc");
    assertEquals(first.id(), second.id());
    assertTrue(first.isAdmin());
  }

  @Test
  void testDeactivatedServiceUserFails() {
    User svc = identity.ensureServiceUser("svc");
    identity.deactivateUser(svc.id(), null);
    assertThrows(StateException.class, () -> identity.ensureServiceUser("svc"));
  }
}
