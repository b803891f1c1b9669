package com.gentoro.contextmcp.exception;

import java.util.Map;

/** Missing, invalid or locked credentials. */
public class AuthenticationException extends ContextMcpException {
  public AuthenticationException(String message) {
    super(ContextMcpErrorCode.UNAUTHENTICATED, message);
  }

  public AuthenticationException(String message, Throwable cause) {
    super(ContextMcpErrorCode.UNAUTHENTICATED, message, cause);
  }

  public AuthenticationException(String message, Map<String, ?> context) {
    super(ContextMcpErrorCode.UNAUTHENTICATED, message, context);
  }
}
