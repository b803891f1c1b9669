package com.gentoro.contextmcp.exception;

import java.util.Map;

/** Caller is authenticated but lacks the required permission level. */
public class PermissionDeniedException extends ContextMcpException {
  public PermissionDeniedException(String message) {
    super(ContextMcpErrorCode.PERMISSION_DENIED, message);
  }

  public PermissionDeniedException(String message, Throwable cause) {
    super(ContextMcpErrorCode.PERMISSION_DENIED, message, cause);
  }

  public PermissionDeniedException(String message, Map<String, ?> context) {
    super(ContextMcpErrorCode.PERMISSION_DENIED, message, context);
  }
}
