package ca.gc.cra.sweep.infrastructure.persistence;

import ca.gc.cra.sweep.application.port.ProgressPort;
import ca.gc.cra.sweep.domain.run.ProgressSnapshot;
import ca.gc.cra.sweep.infrastructure.persistence.json.SweepDocuments;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Overwrites a single progress document with the latest snapshot.
 *
 * @since 0.1.0
 */
public final class FileProgressAdapter implements ProgressPort {
  private final Path path;
  private final AtomicFileWriter writer;

  public FileProgressAdapter(Path path, AtomicFileWriter writer) {
    this.path = Objects.requireNonNull(path, "path");
    this.writer = Objects.requireNonNull(writer, "writer");
  }

  @Override
  public void write(ProgressSnapshot snapshot) throws IOException {
    writer.writeJson(path, SweepDocuments.progress(snapshot), true);
  }
}
