package com.gentoro.warmpath.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Hands out SLF4J loggers and applies the {@code logging.level} overrides of the config file. */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Apply every entry under {@code logging.level}, where the key is a logger name (or {@code
   * root}) and the value a logback level. Unknown levels are skipped with a warning, the levels
   * from logback.xml stay in place for everything else.
   *
   * @return number of loggers whose level was changed
   */
  public static int applyConfiguration(Configuration cfg) {
    if (cfg == null || !(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      return 0;
    }
    Configuration levels = cfg.subset("logging.level");
    int applied = 0;
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      String value = levels.getString(key, "");
      if (value.isBlank()) continue;
      // dotted logger names come back with escaped dots
      String name = "root".equalsIgnoreCase(key) ? Logger.ROOT_LOGGER_NAME : key.replace("..", ".");
      Level level = Level.toLevel(value.trim(), null);
      if (level == null) {
        log.warn("Ignoring unknown log level '{}' for logger {}", value, name);
        continue;
      }
      ctx.getLogger(name).setLevel(level);
      applied++;
    }
    log.debug("Applied {} log level override(s)", applied);
    return applied;
  }
}
