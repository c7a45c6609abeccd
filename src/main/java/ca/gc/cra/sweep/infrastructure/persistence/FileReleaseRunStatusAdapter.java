package ca.gc.cra.sweep.infrastructure.persistence;

import ca.gc.cra.sweep.application.port.ReleaseRunStatusPort;
import ca.gc.cra.sweep.domain.run.ReleaseRunStatus;
import ca.gc.cra.sweep.infrastructure.persistence.json.SweepDocuments;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Writes the release run status document, advertising where release evidence and runtime files live.
 *
 * @since 0.1.0
 */
public final class FileReleaseRunStatusAdapter implements ReleaseRunStatusPort {
  private final ArtifactLayout layout;
  private final AtomicFileWriter writer;

  public FileReleaseRunStatusAdapter(ArtifactLayout layout, AtomicFileWriter writer) {
    this.layout = Objects.requireNonNull(layout, "layout");
    this.writer = Objects.requireNonNull(writer, "writer");
  }

  @Override
  public void write(ReleaseRunStatus status) throws IOException {
    Map<String, Object> extras = new LinkedHashMap<>();
    extras.put("artifact_targets", layout.releaseTargets());
    extras.put("runtime_paths", layout.runtimePaths());
    writer.writeJson(layout.releaseRunStatus(), SweepDocuments.releaseRunStatus(status, extras), true);
  }
}
