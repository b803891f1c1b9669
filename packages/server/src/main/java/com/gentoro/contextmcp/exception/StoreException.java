package com.gentoro.contextmcp.exception;

import java.util.Map;

/**
 * Failure reported by the relational store. Carries the SQLState when one was available so callers
 * can translate constraint violations into domain errors.
 */
public class StoreException extends ContextMcpException {
  public static final String UNIQUE_VIOLATION = "23505";

  private final String sqlState;

  public StoreException(String message) {
    this(message, null, null);
  }

  public StoreException(String message, Throwable cause) {
    this(message, null, cause);
  }

  public StoreException(String message, String sqlState, Throwable cause) {
    super(
        ContextMcpErrorCode.STORE_ERROR,
        message,
        sqlState == null ? Map.of() : Map.of("sqlState", sqlState),
        cause);
    this.sqlState = sqlState;
  }

  public String getSqlState() {
    return sqlState;
  }

  public boolean isUniqueViolation() {
    return UNIQUE_VIOLATION.equals(sqlState);
  }
}
