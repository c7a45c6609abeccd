package ca.gc.cra.sweep.infrastructure.persistence;

import ca.gc.cra.sweep.application.port.CheckpointPort;
import ca.gc.cra.sweep.application.port.ClockPort;
import ca.gc.cra.sweep.domain.checkpoint.CheckpointState;
import ca.gc.cra.sweep.infrastructure.persistence.json.JsonSupport;
import ca.gc.cra.sweep.infrastructure.persistence.json.SweepDocuments;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON file implementation of {@link CheckpointPort}.
 *
 * <p>An undecodable document is treated like a missing one: the sweep starts fresh and the next write
 * replaces it. Keys are written sorted so successive checkpoints diff cleanly.</p>
 *
 * @since 0.1.0
 */
public final class FileCheckpointAdapter implements CheckpointPort {
  private static final Logger log = LoggerFactory.getLogger(FileCheckpointAdapter.class);

  private final Path path;
  private final AtomicFileWriter writer;
  private final JsonSupport json;
  private final ClockPort clock;

  public FileCheckpointAdapter(Path path, AtomicFileWriter writer, JsonSupport json, ClockPort clock) {
    this.path = Objects.requireNonNull(path, "path");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.json = Objects.requireNonNull(json, "json");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Optional<CheckpointState> read() throws IOException {
    if (!Files.isRegularFile(path)) {
      return Optional.empty();
    }
    String text = Files.readString(path, StandardCharsets.UTF_8);
    try {
      return Optional.of(SweepDocuments.checkpointFrom(json.parseObject(text)));
    } catch (IllegalArgumentException ex) {
      log.warn("Ignoring undecodable checkpoint {}: {}", path, ex.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public void write(CheckpointState state) throws IOException {
    writer.writeJson(path, SweepDocuments.checkpoint(state, clock.now()), true);
  }

  @Override
  public Path location() {
    return path;
  }
}
