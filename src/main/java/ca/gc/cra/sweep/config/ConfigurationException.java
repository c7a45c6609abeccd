package ca.gc.cra.sweep.config;

/**
 * Raised when the effective sweep configuration is invalid or self-contradictory.
 *
 * <p>Always thrown before any scenario runs, so no artifact reflects a partially configured run.</p>
 *
 * @since 0.1.0
 */
public class ConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message naming the offending setting.
   *
   * @param message description of the problem
   */
  public ConfigurationException(String message) {
    super(message);
  }

  /**
   * Creates an exception that wraps a lower-level parse failure.
   *
   * @param message description of the problem
   * @param cause underlying failure
   */
  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
