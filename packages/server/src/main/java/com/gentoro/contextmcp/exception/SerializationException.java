package com.gentoro.contextmcp.exception;

import java.util.Map;

/** Serialization/Deserialization failures (JSON/YAML). */
public class SerializationException extends ContextMcpException {
  public SerializationException(String message) {
    super(ContextMcpErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(ContextMcpErrorCode.SERIALIZATION_ERROR, message, cause);
  }

  public SerializationException(String message, Map<String, ?> context) {
    super(ContextMcpErrorCode.SERIALIZATION_ERROR, message, context);
  }
}
