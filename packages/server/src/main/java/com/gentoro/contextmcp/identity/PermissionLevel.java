package com.gentoro.contextmcp.identity;

import com.gentoro.contextmcp.exception.ValidationException;
import java.util.Locale;

/**
 * Access levels, ordered: a grant at some level satisfies every action at or below it (read is
 * implied by write, write by admin). Used both for grants and for requested actions.
 */
public enum PermissionLevel {
  READ,
  WRITE,
  ADMIN;

  public boolean satisfies(PermissionLevel requested) {
    return ordinal() >= requested.ordinal();
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static PermissionLevel fromString(String value) {
    if (value == null) throw new ValidationException("permission level is required");
    try {
      return PermissionLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Unsupported permission level: " + value, e);
    }
  }
}
