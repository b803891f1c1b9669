package com.gentoro.contextmcp.search;

import com.gentoro.contextmcp.exception.ValidationException;
import java.util.Locale;

/**
 * Requested search strategy. Only lexical ranking is implemented; {@link #SEMANTIC} and {@link
 * #HYBRID} are accepted and served by the same path so clients written against them keep working.
 */
public enum SearchType {
  FULLTEXT,
  SEMANTIC,
  HYBRID;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static SearchType fromString(String value) {
    if (value == null || value.isBlank()) return HYBRID;
    try {
      return SearchType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Unsupported search_type: " + value, e);
    }
  }
}
