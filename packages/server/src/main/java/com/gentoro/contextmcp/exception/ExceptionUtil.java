package com.gentoro.contextmcp.exception;

import java.time.Clock;
import java.util.Arrays;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Helpers for turning failures into payloads and log lines. */
public final class ExceptionUtil {
  private static final String INTERNAL_ERROR = "Internal server error";

  private ExceptionUtil() {}

  public static ErrorDetails toErrorDetails(Throwable t) {
    return toErrorDetails(t, Clock.systemUTC());
  }

  /**
   * Domain failures keep their code, message and context. Anything else becomes {@link
   * ContextMcpErrorCode#UNKNOWN} with a fixed message, so driver or stack details never reach the
   * caller.
   */
  public static ErrorDetails toErrorDetails(Throwable t, Clock clock) {
    if (t instanceof ContextMcpException ex) {
      ContextMcpErrorCode code = ex.getCode();
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          ex.getMessage() == null ? "" : ex.getMessage(),
          code,
          code.status(),
          code.isRetryable(),
          ex.getContext(),
          clock.instant());
    }
    ContextMcpErrorCode code = ContextMcpErrorCode.UNKNOWN;
    return new ErrorDetails(
        "InternalError", INTERNAL_ERROR, code, code.status(), false, null, clock.instant());
  }

  /**
   * Returns {@code t} itself when it already is a {@link ContextMcpException}, otherwise the
   * exception built by {@code wrapper}. Meant for {@code throw toDomainException(e, ...)} at
   * boundaries with checked-exception APIs.
   */
  public static ContextMcpException toDomainException(
      Throwable t, Function<Throwable, ContextMcpException> wrapper) {
    if (t instanceof ContextMcpException ex) return ex;
    return wrapper.apply(t);
  }

  /** Innermost cause, guarding against cause cycles. */
  public static Throwable rootCause(Throwable t) {
    if (t == null) return null;
    Throwable current = t;
    int depth = 0;
    while (current.getCause() != null && current.getCause() != current && depth++ < 32) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * Top stack frames in call order, joined on one line, e.g. {@code
   * com.example.Foo.bar(Foo.java:42) > com.example.App.main(App.java:10)}. A non-positive {@code
   * maxFrames} keeps every frame.
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] frames = t.getStackTrace();
    if (frames == null) return "";
    return Arrays.stream(frames)
        .limit(maxFrames <= 0 ? frames.length : maxFrames)
        .map(StackTraceElement::toString)
        .collect(Collectors.joining(" > "));
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }
}
