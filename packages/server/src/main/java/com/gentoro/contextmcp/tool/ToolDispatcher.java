package com.gentoro.contextmcp.tool;

import com.gentoro.contextmcp.analytics.AnalyticsService;
import com.gentoro.contextmcp.analytics.UsageEntry;
import com.gentoro.contextmcp.audit.AuditService;
import com.gentoro.contextmcp.audit.RequestOrigin;
import com.gentoro.contextmcp.exception.AuthenticationException;
import com.gentoro.contextmcp.exception.ContextMcpErrorCode;
import com.gentoro.contextmcp.exception.ContextMcpException;
import com.gentoro.contextmcp.exception.ExceptionUtil;
import com.gentoro.contextmcp.exception.NotFoundException;
import com.gentoro.contextmcp.exception.PermissionDeniedException;
import com.gentoro.contextmcp.identity.IdentityService;
import com.gentoro.contextmcp.identity.User;
import com.gentoro.contextmcp.logging.LoggingService;
import com.gentoro.contextmcp.utility.HashUtility;
import com.gentoro.contextmcp.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs tool calls: validate arguments, resolve the caller, audit the invocation, execute, and
 * record usage metrics. Failures never escape as exceptions; they are rendered as an error
 * outcome carrying {@link com.gentoro.contextmcp.exception.ErrorDetails}.
 */
public class ToolDispatcher {
  private static final org.slf4j.Logger log =
      com.gentoro.contextmcp.logging.LoggingService.getLogger(ToolDispatcher.class);

  public static final String META_API_KEY = "api_key";
  public static final String META_AUTHORIZATION = "authorization";

  private record Registration(ToolDefinition definition, ToolHandler handler) {}

  private final Map<String, Registration> tools = new LinkedHashMap<>();
  private final ArgumentValidator validator;
  private final IdentityService identity;
  private final AuditService audit;
  private final AnalyticsService analytics;
  private final boolean authEnabled;
  private final String serviceUsername;
  private volatile User serviceUser;

  public ToolDispatcher(
      ArgumentValidator validator,
      IdentityService identity,
      AuditService audit,
      AnalyticsService analytics,
      boolean authEnabled,
      String serviceUsername) {
    this.validator = validator;
    this.identity = identity;
    this.audit = audit;
    this.analytics = analytics;
    this.authEnabled = authEnabled;
    this.serviceUsername = serviceUsername;
  }

  public ToolDispatcher register(ToolDefinition definition, ToolHandler handler) {
    if (tools.putIfAbsent(definition.name(), new Registration(definition, handler)) != null) {
      throw new IllegalArgumentException("Tool already registered: " + definition.name());
    }
    return this;
  }

  public List<ToolDefinition> definitions() {
    List<ToolDefinition> result = new ArrayList<>();
    tools.values().forEach(r -> result.add(r.definition()));
    return result;
  }

  public ToolOutcome dispatch(
      String toolName, Map<String, Object> arguments, Map<String, Object> meta) {
    return dispatch(toolName, arguments, meta, RequestOrigin.UNKNOWN);
  }

  public ToolOutcome dispatch(
      String toolName,
      Map<String, Object> arguments,
      Map<String, Object> meta,
      RequestOrigin origin) {
    long start = System.nanoTime();
    UUID callerId = null;
    ToolOutcome outcome;
    try {
      Registration registration = tools.get(toolName);
      if (registration == null) {
        throw new NotFoundException("Unknown tool: " + toolName);
      }
      ToolArguments args = validator.validate(registration.definition(), arguments);
      User caller = resolveCaller(meta);
      callerId = caller.id();
      if (registration.definition().adminOnly() && !caller.isAdmin()) {
        throw new PermissionDeniedException("Tool " + toolName + " requires the admin role");
      }
      audit.logToolCall(toolName, caller.id(), arguments, origin);
      Object result = registration.handler().handle(args, caller);
      outcome = new ToolOutcome(JacksonUtility.toWireJson(result), false, 200);
    } catch (ContextMcpException e) {
      int status = e.getStatus();
      if (status >= 500) {
        log.error("Tool {} failed", toolName, e);
      } else {
        log.warn("Tool {} rejected: {}", toolName, e.getMessage());
      }
      outcome = failure(e, status);
    } catch (RuntimeException e) {
      log.error("Tool {} failed unexpectedly", toolName, e);
      outcome = failure(e, ContextMcpErrorCode.UNKNOWN.status());
    }

    long elapsed = (System.nanoTime() - start) / 1_000_000L;
    recordUsage(toolName, callerId, arguments, outcome, elapsed);
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("status", outcome.statusCode());
    details.put("user", callerId);
    LoggingService.performance("tool." + toolName, elapsed, details);
    return outcome;
  }

  private User resolveCaller(Map<String, Object> meta) {
    if (!authEnabled) {
      User cached = serviceUser;
      if (cached == null) {
        cached = identity.ensureServiceUser(serviceUsername);
        serviceUser = cached;
      }
      return cached;
    }
    String credential = credentialFrom(meta);
    if (credential == null) {
      throw new AuthenticationException("Missing credentials");
    }
    return identity
        .authenticate(credential)
        .orElseThrow(() -> new AuthenticationException("Invalid or expired credentials"));
  }

  private static String credentialFrom(Map<String, Object> meta) {
    if (meta == null) return null;
    for (String key : List.of(META_API_KEY, META_AUTHORIZATION)) {
      Object value = meta.get(key);
      if (value instanceof String s && !s.isBlank()) return s.trim();
    }
    return null;
  }

  private void recordUsage(
      String toolName,
      UUID callerId,
      Map<String, Object> arguments,
      ToolOutcome outcome,
      long elapsedMs) {
    try {
      int requestSize =
          arguments == null ? 0 : HashUtility.utf8Length(JacksonUtility.toJson(arguments));
      analytics.recordUsage(
          new UsageEntry(
              callerId,
              toolName,
              "TOOL",
              outcome.statusCode(),
              elapsedMs,
              requestSize,
              HashUtility.utf8Length(outcome.content())));
    } catch (RuntimeException e) {
      log.warn("Could not record usage for tool {}", toolName, e);
    }
  }

  private static ToolOutcome failure(Throwable t, int status) {
    return new ToolOutcome(
        JacksonUtility.toWireJson(ExceptionUtil.toErrorDetails(t)), true, status);
  }
}
