package com.gentoro.contextmcp.context;

import com.gentoro.contextmcp.exception.ValidationException;
import java.util.Locale;

/** Provenance of an item's content. */
public enum SourceType {
  FILE,
  URL,
  API,
  MANUAL;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static SourceType fromString(String value) {
    if (value == null) return MANUAL;
    try {
      return SourceType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Unsupported source type: " + value, e);
    }
  }
}
