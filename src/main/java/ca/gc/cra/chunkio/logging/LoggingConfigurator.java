package ca.gc.cra.chunkio.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts logging verbosity of the running command process.
 * <p><strong>Role:</strong> Bridges a host-requested debug mode to the Logback backend.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded start-up; level changes are applied by Logback.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String PACKAGE_LOGGER = "ca.gc.cra.chunkio";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    return setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, Level.DEBUG);
  }

  /**
   * Sets the level of the {@code ca.gc.cra.chunkio} logger hierarchy.
   *
   * @param level level name such as {@code "INFO"}; unknown names fall back to DEBUG
   * @return {@code true} when the backend accepted the change
   */
  public static boolean setEngineLevel(String level) {
    return setLevel(PACKAGE_LOGGER, Level.toLevel(level, Level.DEBUG));
  }

  private static boolean setLevel(String loggerName, Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(loggerName);
      if (!level.equals(logger.getLevel())) {
        logger.setLevel(level);
      }
      return true;
    }
    log.warn("Logging level change for {} requested but backend {} does not support dynamic level updates",
        loggerName, factory.getClass().getName());
    return false;
  }
}
