package com.gentoro.contextmcp.exception;

import java.util.Map;

/** Network related failures (listener binding, transport). */
public class NetworkException extends ContextMcpException {
  public NetworkException(String message) {
    super(ContextMcpErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(ContextMcpErrorCode.NETWORK_ERROR, message, cause);
  }

  public NetworkException(String message, Map<String, ?> context) {
    super(ContextMcpErrorCode.NETWORK_ERROR, message, context);
  }
}
