package ca.gc.cra.sweep.application.port;

import ca.gc.cra.sweep.domain.run.ReleaseRunStatus;
import java.io.IOException;

/**
 * Persistence port for the release-run status document.
 *
 * @since 0.1.0
 */
public interface ReleaseRunStatusPort {
  /**
   * Replaces the status document atomically.
   *
   * @param status complete status snapshot
   * @throws IOException when the write fails
   */
  void write(ReleaseRunStatus status) throws IOException;
}
