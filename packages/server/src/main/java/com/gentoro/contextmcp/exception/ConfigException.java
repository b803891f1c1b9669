package com.gentoro.contextmcp.exception;

import java.util.Map;

/** Configuration related errors (missing/invalid settings). */
public class ConfigException extends ContextMcpException {
  public ConfigException(String message) {
    super(ContextMcpErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(ContextMcpErrorCode.CONFIGURATION_ERROR, message, cause);
  }

  public ConfigException(String message, Map<String, ?> context) {
    super(ContextMcpErrorCode.CONFIGURATION_ERROR, message, context);
  }
}
