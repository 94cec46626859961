package dev.ito.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts logging verbosity for CLI runs.
 * <p><strong>Why:</strong> {@code --verbose} surfaces skipped lines, git invocations and cursor resyncs without
 * editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings keep their configuration and a warning is logged.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  static final String PROJECT_LOGGER = "dev.ito";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root and {@code dev.ito} loggers to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      for (String name : new String[] {org.slf4j.Logger.ROOT_LOGGER_NAME, PROJECT_LOGGER}) {
        Logger logger = context.getLogger(name);
        if (!Level.DEBUG.equals(logger.getLevel())) {
          logger.setLevel(Level.DEBUG);
        }
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
