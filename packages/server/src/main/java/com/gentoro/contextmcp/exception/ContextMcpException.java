package com.gentoro.contextmcp.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for the context server with a stable {@link ContextMcpErrorCode} and
 * optional context.
 *
 * <p>The context map is copied and unmodifiable. Messages are meant for humans, codes for
 * machines; specific failures extend this class instead of inventing new codes.
 */
public class ContextMcpException extends RuntimeException {
  private final ContextMcpErrorCode code;
  private final Map<String, Object> context;

  public ContextMcpException(ContextMcpErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public ContextMcpException(ContextMcpErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public ContextMcpException(ContextMcpErrorCode code, String message, Map<String, ?> context) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public ContextMcpException(
      ContextMcpErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public ContextMcpErrorCode getCode() {
    return code;
  }

  public boolean isRetryable() {
    return code.isRetryable();
  }

  /** Additional key/value details that help diagnosing the error. */
  public Map<String, Object> getContext() {
    return context;
  }

  private static Map<String, Object> copy(Map<String, ?> input) {
    if (input == null || input.isEmpty()) return Collections.emptyMap();
    Map<String, Object> m = new LinkedHashMap<>();
    input.forEach(m::put);
    return Collections.unmodifiableMap(m);
  }

  /** Status reported to tool callers; see {@link ContextMcpErrorCode#status()}. */
  public int getStatus() {
    return code.status();
  }

  @Override
  public String toString() {
    StringBuilder sb =
        new StringBuilder(getClass().getSimpleName())
            .append('[')
            .append(code)
            .append('/')
            .append(code.status())
            .append("]: ")
            .append(getMessage());
    if (!context.isEmpty()) sb.append(' ').append(context);
    if (getCause() != null) {
      sb.append(" (caused by ").append(getCause().getClass().getName()).append(')');
    }
    return sb.toString();
  }
}
