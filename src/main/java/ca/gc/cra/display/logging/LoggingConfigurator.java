package ca.gc.cra.display.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts the level of the library's own diagnostics at runtime.
 * <p><strong>Why:</strong> Lets {@code --verbose} surface terminal detection, stream rebinding and config loading
 * without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings keep their defaults and get a warning.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  /** Logger namespace shared by all display classes. */
  public static final String DISPLAY_LOGGER = "ca.gc.cra.display";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the display logger namespace to DEBUG.
   *
   * @return {@code true} if the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    return setLevel(DISPLAY_LOGGER, Level.DEBUG);
  }

  /**
   * Sets the level of a named logger.
   *
   * @param loggerName logger to change; {@link org.slf4j.Logger#ROOT_LOGGER_NAME} for the root
   * @param level new level
   * @return {@code true} if the backend accepted the change
   */
  public static boolean setLevel(String loggerName, Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(loggerName);
      if (!level.equals(logger.getLevel())) {
        logger.setLevel(level);
      }
      return true;
    }
    log.warn("Level change for {} requested but backend {} does not support dynamic level updates",
        loggerName, factory.getClass().getName());
    return false;
  }
}
