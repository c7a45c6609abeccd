package ca.gc.cra.sweep.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the sweep orchestrator.
 * <p><strong>Why:</strong> Elapsed/ETA timing and artifact timestamps must be deterministic under test.</p>
 * <p><strong>Role:</strong> Domain port consumed by application use cases and progress components.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; the heartbeat worker reads the clock
 * from its own thread.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see ca.gc.cra.sweep.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current time as an {@link Instant}.
   *
   * @return current instant derived from {@link #nowMillis()}
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
