package org.maap.client.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for obtaining loggers and applying log levels from the client configuration.
 *
 * <p>Levels are read from keys of the form {@code logging.level.<logger-name>}, for example:
 *
 * <pre>
 * logging:
 *   level:
 *     org.maap.client.http: DEBUG
 * </pre>
 *
 * Level changes are only applied when Logback is the active SLF4J binding.
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply {@code logging.level.*} entries to Logback. Returns the number of loggers changed. */
  public static int applyConfiguration(Configuration configuration) {
    if (configuration == null) return 0;
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      getLogger(LoggingService.class)
          .debug("Logback is not the active binding; skipping level configuration");
      return 0;
    }

    int applied = 0;
    Configuration levels = configuration.subset(LEVEL_PREFIX);
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String key = it.next();
      String value = levels.getString(key);
      // hierarchical configurations escape dots inside node names by doubling them
      String loggerName = key.replace("..", ".");
      if (value == null || value.isBlank()) continue;
      // Level.toLevel falls back to DEBUG for unknown names; keep the current level instead.
      Level level = Level.toLevel(value.trim(), null);
      if (level == null) {
        getLogger(LoggingService.class)
            .warn("Ignoring unknown log level {} for {}", value, loggerName);
        continue;
      }
      context.getLogger(loggerName).setLevel(level);
      applied++;
    }
    return applied;
  }
}
