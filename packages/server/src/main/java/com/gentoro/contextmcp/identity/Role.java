package com.gentoro.contextmcp.identity;

import com.gentoro.contextmcp.exception.ValidationException;
import java.util.Locale;

public enum Role {
  ADMIN,
  USER,
  READONLY;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Role fromString(String value) {
    if (value == null) throw new ValidationException("role is required");
    try {
      return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Unsupported role: " + value, e);
    }
  }
}
