package ca.gc.cra.sweep.application.port;

import ca.gc.cra.sweep.domain.run.ProgressSnapshot;
import java.io.IOException;

/**
 * Persistence port for the progress snapshot document.
 *
 * @since 0.1.0
 */
public interface ProgressPort {
  /**
   * Replaces the progress document atomically.
   *
   * @param snapshot complete snapshot
   * @throws IOException when the write fails
   */
  void write(ProgressSnapshot snapshot) throws IOException;
}
