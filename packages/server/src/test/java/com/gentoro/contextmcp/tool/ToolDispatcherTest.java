package com.gentoro.contextmcp.tool;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.gentoro.contextmcp.analytics.AnalyticsService;
import com.gentoro.contextmcp.analytics.UsageEntry;
import com.gentoro.contextmcp.audit.AuditService;
import com.gentoro.contextmcp.audit.RequestOrigin;
import com.gentoro.contextmcp.exception.ContextMcpErrorCode;
import com.gentoro.contextmcp.exception.NotFoundException;
import com.gentoro.contextmcp.identity.IdentityService;
import com.gentoro.contextmcp.identity.Role;
import com.gentoro.contextmcp.identity.User;
import com.gentoro.contextmcp.utility.JacksonUtility;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ToolDispatcherTest {

  @Mock private IdentityService identity;
  @Mock private AuditService audit;
  @Mock private AnalyticsService analytics;

  private final User regular =
      new User(UUID.randomUUID(), "reg", "reg@example.com", Role.USER, true, null, Instant.EPOCH);
  private final User admin =
      new User(UUID.randomUUID(), "adm", "adm@example.com", Role.ADMIN, true, null, Instant.EPOCH);

  private static final ToolDefinition ECHO =
      ToolDefinition.builder()
          .name("echo")
          .description("Echo")
          .argument(ToolProperty.string("text", "Text").required())
          .build();

  private static final ToolDefinition SECRET =
      ToolDefinition.builder().name("secret").description("Admin only").adminOnly().build();

  private ToolDispatcher dispatcher(boolean authEnabled) {
    return new ToolDispatcher(
            new ArgumentValidator(), identity, audit, analytics, authEnabled, "svc")
        .register(
            ECHO,
            (args, caller) -> Map.of("text", args.getString("text"), "by", caller.username()))
        .register(SECRET, (args, caller) -> Map.of("ok", true));
  }

  private Map<String, Object> body(ToolOutcome outcome) {
    return JacksonUtility.toMap(outcome.content());
  }

  @Test
  void testSuccessfulCallWithApiKey() {
    when(identity.authenticate("key-1")).thenReturn(Optional.of(regular));
    RequestOrigin origin = new RequestOrigin("127.0.0.1", "test");

    ToolOutcome outcome =
        dispatcher(true).dispatch("echo", Map.of("text", "hi"), Map.of("api_key", "key-1"), origin);

    assertFalse(outcome.error());
    assertEquals(200, outcome.statusCode());
    assertEquals("hi", body(outcome).get("text"));
    assertEquals("reg", body(outcome).get("by"));
    verify(audit).logToolCall("echo", regular.id(), Map.of("text", "hi"), origin);

    ArgumentCaptor<UsageEntry> usage = ArgumentCaptor.forClass(UsageEntry.class);
    verify(analytics).recordUsage(usage.capture());
    assertEquals("echo", usage.getValue().endpoint());
    assertEquals("TOOL", usage.getValue().method());
    assertEquals(200, usage.getValue().statusCode());
    assertEquals(regular.id(), usage.getValue().userId());
  }

  @Test
  void testAuthorizationHeaderIsAccepted() {
    when(identity.authenticate("Bearer tok")).thenReturn(Optional.of(regular));
    ToolOutcome outcome =
        dispatcher(true)
            .dispatch("echo", Map.of("text", "hi"), Map.of("authorization", "Bearer tok"));
    assertFalse(outcome.error());
  }

  @Test
  void testMissingCredentials() {
    ToolOutcome outcome = dispatcher(true).dispatch("echo", Map.of("text", "hi"), null);

    assertTrue(outcome.error());
    assertEquals(401, outcome.statusCode());
    assertEquals("UNAUTHENTICATED", body(outcome).get("code"));
    verifyNoInteractions(audit);
    verify(analytics).recordUsage(any());
  }

  @Test
  void testInvalidCredentials() {
    when(identity.authenticate("wrong")).thenReturn(Optional.empty());
    ToolOutcome outcome =
        dispatcher(true).dispatch("echo", Map.of("text", "hi"), Map.of("api_key", "wrong"));
    assertEquals(401, outcome.statusCode());
    assertEquals("Invalid or expired credentials", body(outcome).get("message"));
  }

  @Test
  void testValidationHappensBeforeAuthentication() {
    ToolOutcome outcome = dispatcher(true).dispatch("echo", Map.of(), Map.of());
    assertEquals(400, outcome.statusCode());
    assertEquals("INVALID_ARGUMENT", body(outcome).get("code"));
    verifyNoInteractions(identity);
  }

  @Test
  void testUnknownTool() {
    ToolOutcome outcome = dispatcher(true).dispatch("nope", Map.of(), Map.of());
    assertEquals(404, outcome.statusCode());
    assertTrue(outcome.error());
  }

  @Test
  void testAdminOnlyTool() {
    when(identity.authenticate("k")).thenReturn(Optional.of(regular));
    ToolOutcome denied = dispatcher(true).dispatch("secret", Map.of(), Map.of("api_key", "k"));
    assertEquals(403, denied.statusCode());

    when(identity.authenticate("a")).thenReturn(Optional.of(admin));
    ToolOutcome allowed = dispatcher(true).dispatch("secret", Map.of(), Map.of("api_key", "a"));
    assertEquals(200, allowed.statusCode());
  }

  @Test
  void testServiceUserWhenAuthDisabled() {
    when(identity.ensureServiceUser("svc")).thenReturn(admin);
    ToolDispatcher dispatcher = dispatcher(false);

    dispatcher.dispatch("echo", Map.of("text", "a"), null);
    ToolOutcome outcome = dispatcher.dispatch("echo", Map.of("text", "b"), null);

    assertEquals("adm", body(outcome).get("by"));
    verify(identity, times(1)).ensureServiceUser("svc");
    verify(identity, never()).authenticate(anyString());
  }

  @Test
  void testHandlerFailuresBecomeErrorOutcomes() {
    when(identity.ensureServiceUser("svc")).thenReturn(admin);
    ToolDispatcher dispatcher =
        new ToolDispatcher(new ArgumentValidator(), identity, audit, analytics, false, "svc")
            .register(
                ToolDefinition.builder().name("missing").description("Missing").build(),
                (args, caller) -> {
                  throw new NotFoundException("Context item not found: x");
                })
            .register(
                ToolDefinition.builder().name("crash").description("Crash").build(),
                (args, caller) -> {
                  throw new IllegalStateException("internal detail");
                });

    ToolOutcome missing = dispatcher.dispatch("missing", Map.of(), null);
    assertEquals(404, missing.statusCode());
    assertEquals("Context item not found: x", body(missing).get("message"));

    ToolOutcome crash = dispatcher.dispatch("crash", Map.of(), null);
    assertEquals(500, crash.statusCode());
    assertEquals("Internal server error", body(crash).get("message"));
    assertFalse(crash.content().contains("internal detail"));
  }

  @Test
  void testUsageFailureDoesNotChangeOutcome() {
    when(identity.ensureServiceUser("svc")).thenReturn(admin);
    doThrow(new IllegalStateException("down")).when(analytics).recordUsage(any());
    ToolOutcome outcome = dispatcher(false).dispatch("echo", Map.of("text", "x"), null);
    assertEquals(200, outcome.statusCode());
  }

  @Test
  void testDuplicateRegistration() {
    ToolDispatcher dispatcher = dispatcher(true);
    assertThrows(IllegalArgumentException.class, () -> dispatcher.register(ECHO, (a, c) -> null));
    assertEquals(2, dispatcher.definitions().size());
  }

  @Test
  void testStatusMapping() {
    assertEquals(400, ContextMcpErrorCode.NO_CHANGES.status());
    assertEquals(400, ContextMcpErrorCode.FAILED_PRECONDITION.status());
    assertEquals(409, ContextMcpErrorCode.DUPLICATE_CONTENT.status());
    assertEquals(409, ContextMcpErrorCode.ALREADY_EXISTS.status());
    assertEquals(403, ContextMcpErrorCode.PERMISSION_DENIED.status());
    assertEquals(500, ContextMcpErrorCode.STORE_ERROR.status());
  }
}
