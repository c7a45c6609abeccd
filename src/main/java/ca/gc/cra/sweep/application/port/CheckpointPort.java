package ca.gc.cra.sweep.application.port;

import ca.gc.cra.sweep.domain.checkpoint.CheckpointState;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * <strong>What:</strong> Persistence port for the checkpoint document.
 * <p><strong>Why:</strong> Keeps the resume logic independent of the on-disk encoding.</p>
 * <p><strong>Role:</strong> Implemented by {@code FileCheckpointAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Single writer (the orchestrator thread).</p>
 *
 * @since 0.1.0
 */
public interface CheckpointPort {
  /**
   * Reads the stored checkpoint.
   *
   * @return stored state; empty when no file exists or it cannot be decoded
   * @throws IOException when the file exists but cannot be read
   */
  Optional<CheckpointState> read() throws IOException;

  /**
   * Replaces the stored checkpoint atomically.
   *
   * @param state full state to persist
   * @throws IOException when the write fails; the previous document stays intact
   */
  void write(CheckpointState state) throws IOException;

  /**
   * Returns where the checkpoint lives, for progress documents.
   *
   * @return checkpoint path
   */
  Path location();
}
