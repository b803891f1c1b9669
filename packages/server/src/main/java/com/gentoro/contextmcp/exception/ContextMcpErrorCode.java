package com.gentoro.contextmcp.exception;

/**
 * Canonical error codes for the context server. Each code fixes the status reported to tool
 * callers and whether the same call may be retried unchanged. Codes are part of the failure
 * payload, so prefer the most specific one.
 */
public enum ContextMcpErrorCode {
  UNKNOWN(500, false),

  // Caller errors
  INVALID_ARGUMENT(400, false),
  FAILED_PRECONDITION(400, false),
  NO_CHANGES(400, false),
  UNAUTHENTICATED(401, false),
  PERMISSION_DENIED(403, false),
  NOT_FOUND(404, false),
  ALREADY_EXISTS(409, false),
  DUPLICATE_CONTENT(409, false),

  // Server side
  STORE_ERROR(500, true),
  AUDIT_WRITE_ERROR(500, true),
  CONFIGURATION_ERROR(500, false),
  SERIALIZATION_ERROR(500, false),
  NETWORK_ERROR(503, true);

  private final int status;
  private final boolean retryable;

  ContextMcpErrorCode(int status, boolean retryable) {
    this.status = status;
    this.retryable = retryable;
  }

  /** HTTP-style status used in tool outcomes and usage analytics. */
  public int status() {
    return status;
  }

  public boolean isRetryable() {
    return retryable;
  }

  /** True for failures caused by the request rather than the server. */
  public boolean isClientError() {
    return status >= 400 && status < 500;
  }
}
