package com.gentoro.contextmcp.context;

import com.gentoro.contextmcp.identity.User;
import com.gentoro.contextmcp.store.SqlFragment;
import java.util.Optional;

/** Row filter restricting collections to those a caller may read. */
public final class Visibility {
  private Visibility() {}

  /**
   * Predicate over collection alias {@code c}: owned, explicitly granted, or (when {@code
   * includePublic}) public. Admins see everything, so no predicate applies.
   */
  public static Optional<SqlFragment> readableCollections(
      String c, User caller, boolean includePublic) {
    if (caller.isAdmin()) return Optional.empty();
    String sql =
        "("
            + c
            + ".owner_id = ? OR EXISTS (SELECT 1 FROM context_permissions vp"
            + " WHERE vp.collection_id = "
            + c
            + ".id AND vp.user_id = ?)"
            + (includePublic ? " OR " + c + ".is_public = TRUE" : "")
            + ")";
    return Optional.of(SqlFragment.of(sql, caller.id(), caller.id()));
  }
}
