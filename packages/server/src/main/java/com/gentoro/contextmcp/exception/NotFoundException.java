package com.gentoro.contextmcp.exception;

import java.util.Map;

/** Requested item, collection or user does not exist or is inactive. */
public class NotFoundException extends ContextMcpException {
  public NotFoundException(String message) {
    super(ContextMcpErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(ContextMcpErrorCode.NOT_FOUND, message, cause);
  }

  public NotFoundException(String message, Map<String, ?> context) {
    super(ContextMcpErrorCode.NOT_FOUND, message, context);
  }
}
