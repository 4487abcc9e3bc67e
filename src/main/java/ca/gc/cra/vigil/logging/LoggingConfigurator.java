package ca.gc.cra.vigil.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Adjusts VIGIL logging at runtime from CLI flags.
 *
 * @implNote Level changes need Logback; other SLF4J backends keep their configuration and a warning is logged.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String BASE_LOGGER = "ca.gc.cra.vigil";

  private LoggingConfigurator() {}

  /**
   * Lowers the root and VIGIL logger levels to DEBUG for the rest of the process.
   *
   * @return {@code true} if the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      setDebug(context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME));
      setDebug(context.getLogger(BASE_LOGGER));
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }

  private static void setDebug(Logger logger) {
    if (!Level.DEBUG.equals(logger.getLevel())) {
      logger.setLevel(Level.DEBUG);
    }
  }
}
