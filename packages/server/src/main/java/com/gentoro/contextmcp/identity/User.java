package com.gentoro.contextmcp.identity;

import java.time.Instant;
import java.util.UUID;

/** A registered principal. Credential hashes are never part of this view. */
public record User(
    UUID id,
    String username,
    String email,
    Role role,
    boolean active,
    Instant lastLogin,
    Instant createdAt) {

  /**
   * Read-only principal without an account, used for unauthenticated resource reads. It matches no
   * owner or grant, so only public collections are visible to it.
   */
  public static User anonymous() {
    return new User(null, "anonymous", null, Role.READONLY, true, null, null);
  }

  public boolean isAdmin() {
    return role == Role.ADMIN;
  }
}
