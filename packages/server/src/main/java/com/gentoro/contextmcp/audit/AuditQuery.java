package com.gentoro.contextmcp.audit;

import java.time.Instant;
import java.util.UUID;

/**
 * Filters for reading the audit trail; every filter is optional. Use {@link #builder()}; limit
 * defaults to 50 and offset to 0.
 */
public final class AuditQuery {
  private final UUID userId;
  private final String action;
  private final String resourceType;
  private final String resourceId;
  private final Instant start;
  private final Instant end;
  private final int limit;
  private final int offset;

  private AuditQuery(Builder b) {
    this.userId = b.userId;
    this.action = b.action;
    this.resourceType = b.resourceType;
    this.resourceId = b.resourceId;
    this.start = b.start;
    this.end = b.end;
    this.limit = b.limit;
    this.offset = b.offset;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getAction() {
    return action;
  }

  public String getResourceType() {
    return resourceType;
  }

  public String getResourceId() {
    return resourceId;
  }

  public Instant getStart() {
    return start;
  }

  public Instant getEnd() {
    return end;
  }

  public int getLimit() {
    return limit;
  }

  public int getOffset() {
    return offset;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private UUID userId;
    private String action;
    private String resourceType;
    private String resourceId;
    private Instant start;
    private Instant end;
    private int limit = 50;
    private int offset = 0;

    public Builder userId(UUID userId) {
      this.userId = userId;
      return this;
    }

    public Builder action(String action) {
      this.action = action;
      return this;
    }

    public Builder resourceType(String resourceType) {
      this.resourceType = resourceType;
      return this;
    }

    public Builder resourceId(String resourceId) {
      this.resourceId = resourceId;
      return this;
    }

    public Builder start(Instant start) {
      this.start = start;
      return this;
    }

    public Builder end(Instant end) {
      this.end = end;
      return this;
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public Builder offset(int offset) {
      this.offset = offset;
      return this;
    }

    public AuditQuery build() {
      return new AuditQuery(this);
    }
  }
}
