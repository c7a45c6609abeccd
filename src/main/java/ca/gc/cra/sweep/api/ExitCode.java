package ca.gc.cra.sweep.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by the sweep command-line tools.
 * <p><strong>Why:</strong> Release automation distinguishes a blocked release from a broken run; each outcome
 * maps to one stable process status.</p>
 * <p><strong>Role:</strong> Adapter-facing enum returned by CLI entry points.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Release preflight blocked, dataset unusable, or readiness audit failed. */
  BLOCKED(1),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Artifact or input file could not be read or written. */
  IO_ERROR(3),
  /** Configuration was missing, malformed or contradictory. */
  CONFIG_ERROR(4),
  /** A scenario failed or an unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
