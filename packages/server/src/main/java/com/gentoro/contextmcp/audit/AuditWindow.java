package com.gentoro.contextmcp.audit;

import com.gentoro.contextmcp.exception.ValidationException;
import java.time.Duration;

/** Look-back windows supported by audit statistics. */
public enum AuditWindow {
  LAST_24_HOURS("24h", Duration.ofHours(24)),
  LAST_7_DAYS("7d", Duration.ofDays(7)),
  LAST_30_DAYS("30d", Duration.ofDays(30)),
  LAST_90_DAYS("90d", Duration.ofDays(90));

  private final String label;
  private final Duration duration;

  AuditWindow(String label, Duration duration) {
    this.label = label;
    this.duration = duration;
  }

  public String label() {
    return label;
  }

  public Duration duration() {
    return duration;
  }

  public static AuditWindow fromLabel(String label) {
    if (label == null) return LAST_7_DAYS;
    for (AuditWindow w : values()) {
      if (w.label.equalsIgnoreCase(label.trim())) return w;
    }
    throw new ValidationException("Unsupported timeframe: " + label);
  }
}
