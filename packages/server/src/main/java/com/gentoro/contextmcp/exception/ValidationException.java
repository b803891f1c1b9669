package com.gentoro.contextmcp.exception;

import java.util.Map;

/** Input validation failure or illegal argument. */
public class ValidationException extends ContextMcpException {
  public ValidationException(String message) {
    super(ContextMcpErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(ContextMcpErrorCode.INVALID_ARGUMENT, message, cause);
  }

  public ValidationException(String message, Map<String, ?> context) {
    super(ContextMcpErrorCode.INVALID_ARGUMENT, message, context);
  }
}
