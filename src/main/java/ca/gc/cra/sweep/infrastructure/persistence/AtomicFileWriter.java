package ca.gc.cra.sweep.infrastructure.persistence;

import ca.gc.cra.sweep.infrastructure.persistence.json.JsonSupport;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes artifacts through a sibling temp file followed by a rename onto the target.
 * <p><strong>Why:</strong> Progress and status files are polled by operators while a sweep runs; a reader must
 * see either the previous complete document or the new one, never a truncated file.</p>
 * <p><strong>Role:</strong> Shared by every file adapter in this package.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the codec; each target has one writer at a time.</p>
 *
 * @since 0.1.0
 */
public final class AtomicFileWriter {
  private static final Logger log = LoggerFactory.getLogger(AtomicFileWriter.class);
  static final String SNAPSHOT_DIR = "by_run";

  private final JsonSupport json;

  public AtomicFileWriter(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Atomically replaces {@code target} with the supplied text.
   *
   * @param target destination file; parent directories are created
   * @param text UTF-8 content
   * @throws IOException if the temp file cannot be written or moved
   */
  public void writeText(Path target, String text) throws IOException {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(text, "text");
    Path dir = target.toAbsolutePath().getParent();
    Files.createDirectories(dir);
    Path tmp = Files.createTempFile(dir, "." + target.getFileName() + ".tmp.", "");
    try {
      Files.writeString(tmp, text, StandardCharsets.UTF_8);
      try {
        Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException ex) {
        log.debug("Atomic move unsupported for {}; falling back to replace", target);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  /**
   * Renders a document as JSON and writes it atomically.
   *
   * @param target destination file
   * @param document map/list object graph
   * @param sortKeys whether object keys are written in natural order
   * @throws IOException if the write fails
   */
  public void writeJson(Path target, Object document, boolean sortKeys) throws IOException {
    writeText(target, json.render(document, sortKeys));
  }

  /**
   * Writes an immutable per-run snapshot under {@code by_run/} and then replaces the latest path.
   *
   * @param latest canonical artifact path
   * @param runId run identifier embedded in the snapshot name
   * @param document document to write to both paths
   * @return snapshot path
   * @throws IOException if either write fails
   */
  public Path writeSnapshot(Path latest, String runId, Object document) throws IOException {
    Path snapshot = snapshotPath(latest, runId);
    String text = json.render(document, false);
    writeText(snapshot, text);
    writeText(latest, text);
    return snapshot;
  }

  /**
   * Resolves {@code <dir>/by_run/<stem>.<runId><suffix>} for a canonical artifact path.
   *
   * @param latest canonical artifact path
   * @param runId run identifier
   * @return snapshot path
   */
  public static Path snapshotPath(Path latest, String runId) {
    Objects.requireNonNull(latest, "latest");
    Objects.requireNonNull(runId, "runId");
    String name = latest.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String stem = dot > 0 ? name.substring(0, dot) : name;
    String suffix = dot > 0 ? name.substring(dot) : "";
    return latest.toAbsolutePath().getParent().resolve(SNAPSHOT_DIR).resolve(stem + "." + runId + suffix);
  }
}
