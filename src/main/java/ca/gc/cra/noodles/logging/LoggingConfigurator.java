package ca.gc.cra.noodles.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Adjusts Logback levels at runtime for the {@code --verbose} CLI flag.
 *
 * <p>Other SLF4J backends are left untouched with a warning.</p>
 *
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /** Raises the root logger to DEBUG. */
  public static void enableVerboseLogging() {
    setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, Level.DEBUG);
  }

  /**
   * Sets the level of one named logger.
   *
   * @param loggerName logger name, or {@link org.slf4j.Logger#ROOT_LOGGER_NAME}
   * @param level new level
   * @return {@code true} if the backend accepted the change
   */
  static boolean setLevel(String loggerName, Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger target = context.getLogger(loggerName);
      if (!level.equals(target.getLevel())) {
        target.setLevel(level);
      }
      return true;
    }
    log.warn("Cannot change level of {}: backend {} does not support dynamic level updates",
        loggerName, factory.getClass().getName());
    return false;
  }
}
