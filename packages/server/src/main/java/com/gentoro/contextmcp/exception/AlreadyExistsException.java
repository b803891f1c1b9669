package com.gentoro.contextmcp.exception;

import java.util.Map;

/** A uniquely named resource already exists, e.g. a collection name for the same owner. */
public class AlreadyExistsException extends ContextMcpException {
  public AlreadyExistsException(String message) {
    super(ContextMcpErrorCode.ALREADY_EXISTS, message);
  }

  public AlreadyExistsException(String message, Throwable cause) {
    super(ContextMcpErrorCode.ALREADY_EXISTS, message, cause);
  }

  public AlreadyExistsException(String message, Map<String, ?> context) {
    super(ContextMcpErrorCode.ALREADY_EXISTS, message, context);
  }
}
