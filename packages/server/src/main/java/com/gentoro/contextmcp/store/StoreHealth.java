package com.gentoro.contextmcp.store;

/**
 * Result of a store round-trip probe. Pool figures are {@code null} when the data source is not a
 * HikariCP pool.
 */
public record StoreHealth(
    String status,
    long latencyMs,
    Integer activeConnections,
    Integer idleConnections,
    Integer totalConnections,
    String error) {

  public boolean isHealthy() {
    return "healthy".equals(status);
  }
}
