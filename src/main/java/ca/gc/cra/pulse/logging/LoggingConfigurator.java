package ca.gc.cra.pulse.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts PULSE logging verbosity at runtime.
 * <p><strong>Why:</strong> The {@code logging.verbose} setting turns on per-summary DEBUG output without a
 * custom Logback file.</p>
 * <p><strong>Role:</strong> Called once by {@code CompositionRoot} while wiring the engine.</p>
 * <p><strong>Thread-safety:</strong> Relies on Logback's own synchronization; intended for startup.</p>
 *
 * @implNote Only Logback supports the level change; other SLF4J bindings log a warning and keep defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  /** Logger hierarchy owned by PULSE. */
  public static final String PULSE_LOGGER = "ca.gc.cra.pulse";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the PULSE logger hierarchy to DEBUG.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    return setLevel(Level.DEBUG);
  }

  /**
   * Sets the PULSE logger hierarchy to an explicit level.
   *
   * @param level Logback level; {@code null} reverts to inheriting from the root logger
   * @return {@code true} when the backend accepted the change
   */
  public static boolean setLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger pulse = context.getLogger(PULSE_LOGGER);
      pulse.setLevel(level);
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
