package ca.gc.cra.display.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private Logger displayLogger;
  private Level original;

  @BeforeEach
  void setUp() {
    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    displayLogger = context.getLogger(LoggingConfigurator.DISPLAY_LOGGER);
    original = displayLogger.getLevel();
  }

  @AfterEach
  void restore() {
    displayLogger.setLevel(original);
  }

  @Test
  void verboseLoggingRaisesDisplayNamespaceToDebug() {
    assertTrue(LoggingConfigurator.enableVerboseLogging());

    assertEquals(Level.DEBUG, displayLogger.getLevel());
    assertTrue(LoggerFactory.getLogger("ca.gc.cra.display.api.Display").isDebugEnabled());
  }

  @Test
  void setLevelTargetsNamedLogger() {
    assertTrue(LoggingConfigurator.setLevel(LoggingConfigurator.DISPLAY_LOGGER, Level.ERROR));

    assertEquals(Level.ERROR, displayLogger.getLevel());
  }
}
