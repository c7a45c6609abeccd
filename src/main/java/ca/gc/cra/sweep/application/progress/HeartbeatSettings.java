package ca.gc.cra.sweep.application.progress;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing for the full-battery heartbeat.
 *
 * @param period interval between beats
 * @param joinTimeout bound on waiting for the worker to stop
 * @since 0.1.0
 */
public record HeartbeatSettings(Duration period, Duration joinTimeout) {
  /** Default beat interval. */
  public static final Duration DEFAULT_PERIOD = Duration.ofSeconds(30);
  /** Default stop bound. */
  public static final Duration DEFAULT_JOIN_TIMEOUT = Duration.ofMillis(500);

  public HeartbeatSettings {
    Objects.requireNonNull(period, "period");
    Objects.requireNonNull(joinTimeout, "joinTimeout");
    if (period.isZero() || period.isNegative()) {
      throw new IllegalArgumentException("heartbeat period must be positive");
    }
    if (joinTimeout.isNegative()) {
      throw new IllegalArgumentException("heartbeat join timeout must not be negative");
    }
  }

  /**
   * Returns the default settings.
   *
   * @return 30 second period, 500 ms join timeout
   */
  public static HeartbeatSettings defaults() {
    return new HeartbeatSettings(DEFAULT_PERIOD, DEFAULT_JOIN_TIMEOUT);
  }
}
