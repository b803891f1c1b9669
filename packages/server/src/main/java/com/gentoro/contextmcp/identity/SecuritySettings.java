package com.gentoro.contextmcp.identity;

import com.gentoro.contextmcp.exception.ConfigException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Credential and lockout settings, read from the {@code security.*} block.
 *
 * <ul>
 *   <li><b>security.jwt.secret</b>: HMAC secret, at least 32 bytes; JWT credentials are disabled
 *       when absent
 *   <li><b>security.jwt.ttl</b>: ISO-8601 token lifetime; default P7D
 *   <li><b>security.bcrypt.strength</b>: default 12
 *   <li><b>security.lockout.max-attempts</b>: default 5
 *   <li><b>security.lockout.duration</b>: ISO-8601; default PT30M
 * </ul>
 */
public record SecuritySettings(
    String jwtSecret,
    Duration jwtTtl,
    int bcryptStrength,
    int maxFailedAttempts,
    Duration lockoutDuration) {

  public static final int MIN_SECRET_BYTES = 32;

  public SecuritySettings {
    if (jwtSecret != null && jwtSecret.isBlank()) jwtSecret = null;
    if (jwtSecret != null && jwtSecret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
      throw new ConfigException("security.jwt.secret must be at least 32 bytes long");
    }
    if (maxFailedAttempts < 1) {
      throw new ConfigException("security.lockout.max-attempts must be positive");
    }
  }

  public static SecuritySettings defaults() {
    return new SecuritySettings(null, Duration.ofDays(7), 12, 5, Duration.ofMinutes(30));
  }

  public static SecuritySettings fromConfiguration(Configuration cfg) {
    try {
      return new SecuritySettings(
          cfg.getString("security.jwt.secret", null),
          Duration.parse(cfg.getString("security.jwt.ttl", "P7D")),
          cfg.getInt("security.bcrypt.strength", 12),
          cfg.getInt("security.lockout.max-attempts", 5),
          Duration.parse(cfg.getString("security.lockout.duration", "PT30M")));
    } catch (ConfigException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ConfigException("Invalid security configuration", e);
    }
  }

  public boolean jwtEnabled() {
    return jwtSecret != null;
  }
}
