package com.gentoro.contextmcp.logging;

import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Central place to obtain SLF4J loggers and the markers used for structured events.
 *
 * <p>Audit, security and performance events are regular log lines tagged with a marker so they can
 * be routed to a dedicated appender from logback.xml.
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  public static final Marker AUDIT = MarkerFactory.getMarker("AUDIT");
  public static final Marker SECURITY = MarkerFactory.getMarker("SECURITY");
  public static final Marker PERFORMANCE = MarkerFactory.getMarker("PERFORMANCE");

  private static final Logger eventLog = LoggerFactory.getLogger("com.gentoro.contextmcp.events");

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  public static void audit(String action, String resourceType, String resourceId, String actor) {
    eventLog.info(
        AUDIT,
        "action={} resourceType={} resourceId={} actor={}",
        action,
        resourceType,
        resourceId,
        actor);
  }

  public static void security(String event, Map<String, ?> details) {
    eventLog.warn(SECURITY, "event={} {}", event, format(details));
  }

  public static void performance(String operation, long durationMs, Map<String, ?> details) {
    eventLog.info(
        PERFORMANCE, "operation={} durationMs={} {}", operation, durationMs, format(details));
  }

  private static String format(Map<String, ?> details) {
    if (details == null || details.isEmpty()) return "";
    return details.entrySet().stream()
        .map(e -> e.getKey() + "=" + e.getValue())
        .collect(Collectors.joining(" "));
  }

  /**
   * Apply logging levels from application configuration.
   *
   * <p>Expected YAML structure: logging: level: root: INFO com.gentoro.contextmcp: DEBUG
   * org.eclipse.jetty: WARN
   */
  public static void applyConfiguration(Configuration cfg) {
    if (cfg == null) return;
    try {
      ch.qos.logback.classic.LoggerContext ctx =
          (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();

      String rootLvl = cfg.getString("logging.level.root", null);
      if (rootLvl != null && !rootLvl.isBlank()) {
        setLevel(ctx.getLogger(Logger.ROOT_LOGGER_NAME), rootLvl);
      }

      Configuration levels = cfg.subset("logging.level");
      if (levels != null) {
        java.util.Iterator<String> it = levels.getKeys();
        while (it.hasNext()) {
          String key = it.next();
          if ("root".equalsIgnoreCase(key)) continue;
          String lvl = levels.getString(key, null);
          if (lvl == null || lvl.isBlank()) continue;
          setLevel(ctx.getLogger(key), lvl);
        }
      }
    } catch (Exception e) {
      log.warn(
          "Failed to apply logging configuration from YAML; falling back to logback.xml settings",
          e);
    }
  }

  private static void setLevel(ch.qos.logback.classic.Logger logger, String levelStr) {
    if (logger == null || levelStr == null) return;
    ch.qos.logback.classic.Level level =
        ch.qos.logback.classic.Level.toLevel(levelStr.trim(), null);
    if (level == null) {
      log.warn("Unknown log level '{}'; ignoring for logger {}", levelStr, logger.getName());
      return;
    }
    logger.setLevel(level);
    log.debug("Set logger '{}' to level {}", logger.getName(), level);
  }
}
