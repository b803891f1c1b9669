package com.gentoro.contextmcp.exception;

/** An audit or analytics row could not be written. Logged and counted, never surfaced. */
public class AuditWriteException extends ContextMcpException {
  public AuditWriteException(String message, Throwable cause) {
    super(ContextMcpErrorCode.AUDIT_WRITE_ERROR, message, cause);
  }
}
