package com.gentoro.contextmcp.exception;

import java.util.Map;

/** An update request carried no field to change. */
public class NoChangesException extends ContextMcpException {
  public NoChangesException(String message) {
    super(ContextMcpErrorCode.NO_CHANGES, message);
  }

  public NoChangesException(String message, Throwable cause) {
    super(ContextMcpErrorCode.NO_CHANGES, message, cause);
  }

  public NoChangesException(String message, Map<String, ?> context) {
    super(ContextMcpErrorCode.NO_CHANGES, message, context);
  }
}
