package ca.gc.cra.sweep.application.port;

/**
 * Receives diagnostic warning messages emitted by the evaluation collaborator during one scenario.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface DiagnosticSink {
  /**
   * Accepts one warning message.
   *
   * @param message warning text as emitted
   */
  void warn(String message);
}
