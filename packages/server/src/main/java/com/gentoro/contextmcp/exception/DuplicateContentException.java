package com.gentoro.contextmcp.exception;

import java.util.Map;

/** An active item with identical content already exists. */
public class DuplicateContentException extends ContextMcpException {
  public DuplicateContentException(String message) {
    super(ContextMcpErrorCode.DUPLICATE_CONTENT, message);
  }

  public DuplicateContentException(String message, Throwable cause) {
    super(ContextMcpErrorCode.DUPLICATE_CONTENT, message, cause);
  }

  public DuplicateContentException(String message, Map<String, ?> context) {
    super(ContextMcpErrorCode.DUPLICATE_CONTENT, message, context);
  }
}
