package com.gentoro.contextmcp.exception;

import java.util.Map;

/** Operation is not allowed in the current component state. */
public class StateException extends ContextMcpException {
  public StateException(String message) {
    super(ContextMcpErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(ContextMcpErrorCode.FAILED_PRECONDITION, message, cause);
  }

  public StateException(String message, Map<String, ?> context) {
    super(ContextMcpErrorCode.FAILED_PRECONDITION, message, context);
  }
}
