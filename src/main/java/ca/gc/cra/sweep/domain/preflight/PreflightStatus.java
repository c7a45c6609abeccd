package ca.gc.cra.sweep.domain.preflight;

/**
 * Release preflight outcome.
 *
 * @since 0.1.0
 */
public enum PreflightStatus {
  PREFLIGHT_OK,
  BLOCKED
}
