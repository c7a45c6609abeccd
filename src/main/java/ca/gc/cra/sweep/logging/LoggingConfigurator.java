package ca.gc.cra.sweep.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Raises sweep logging verbosity when the operator passes {@code --verbose}.
 * <p><strong>Why:</strong> Long sweeps are diagnosed from logs after the fact; DEBUG output includes every
 * progress transition and checkpoint decision.</p>
 * <p><strong>Role:</strong> Adapter-side utility called by the CLI before the run starts.</p>
 *
 * <p>Only the {@code ca.gc.cra.sweep} hierarchy is raised. The OpenTelemetry exporter stays at its configured
 * level so a missing collector does not flood the console.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their level.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  static final String SWEEP_LOGGER = "ca.gc.cra.sweep";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Sets the sweep loggers to DEBUG within the running JVM.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("--verbose ignored: logging backend {} cannot change levels at runtime",
          factory.getClass().getName());
      return false;
    }
    Logger sweep = context.getLogger(SWEEP_LOGGER);
    Level previous = sweep.getEffectiveLevel();
    sweep.setLevel(Level.DEBUG);
    log.debug("Sweep logging raised from {} to DEBUG", previous);
    return true;
  }
}
