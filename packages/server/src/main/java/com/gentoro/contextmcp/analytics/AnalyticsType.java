package com.gentoro.contextmcp.analytics;

import com.gentoro.contextmcp.exception.ValidationException;
import java.util.Locale;

public enum AnalyticsType {
  SEARCH(30),
  USAGE(30),
  PERFORMANCE(7);

  private final int defaultWindowDays;

  AnalyticsType(int defaultWindowDays) {
    this.defaultWindowDays = defaultWindowDays;
  }

  /** Look-back used when the caller gives no start date. */
  public int defaultWindowDays() {
    return defaultWindowDays;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static AnalyticsType fromString(String value) {
    if (value == null) return USAGE;
    try {
      return AnalyticsType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Unsupported analytics type: " + value, e);
    }
  }
}
