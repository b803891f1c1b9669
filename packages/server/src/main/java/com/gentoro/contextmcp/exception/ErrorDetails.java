package com.gentoro.contextmcp.exception;

import java.time.Instant;
import java.util.Map;

/**
 * Failure payload returned to tool callers and resource readers. {@code context} is {@code null}
 * for failures that are not {@link ContextMcpException}s.
 */
public record ErrorDetails(
    String type,
    String message,
    ContextMcpErrorCode code,
    int status,
    boolean retryable,
    Map<String, Object> context,
    Instant timestamp) {}
