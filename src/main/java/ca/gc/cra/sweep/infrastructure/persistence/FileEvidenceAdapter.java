package ca.gc.cra.sweep.infrastructure.persistence;

import ca.gc.cra.sweep.application.port.EvidencePort;
import ca.gc.cra.sweep.domain.preflight.PreflightReport;
import ca.gc.cra.sweep.domain.result.ScenarioResult;
import ca.gc.cra.sweep.domain.robustness.RunSummary;
import ca.gc.cra.sweep.domain.run.SweepMode;
import ca.gc.cra.sweep.infrastructure.persistence.json.SweepDocuments;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes run summaries, quality diagnostics and preflight reports.
 * <p><strong>Why:</strong> Release gates consume these files; each run keeps an immutable
 * {@code by_run/} snapshot so a later run cannot erase the evidence of an earlier one.</p>
 * <p><strong>Role:</strong> {@link EvidencePort} adapter over {@link AtomicFileWriter}.</p>
 *
 * @since 0.1.0
 */
public final class FileEvidenceAdapter implements EvidencePort {
  private static final Logger log = LoggerFactory.getLogger(FileEvidenceAdapter.class);

  private final ArtifactLayout layout;
  private final AtomicFileWriter writer;

  public FileEvidenceAdapter(ArtifactLayout layout, AtomicFileWriter writer) {
    this.layout = Objects.requireNonNull(layout, "layout");
    this.writer = Objects.requireNonNull(writer, "writer");
  }

  @Override
  public EvidenceLocations writeRunSummary(RunSummary summary, List<ScenarioResult> results) throws IOException {
    Path latest = layout.summary(summary.mode());
    Path diagnostics = layout.diagnostics(summary.mode());
    Map<String, String> paths = new LinkedHashMap<>();
    paths.put("artifact_path", latest.toString());
    paths.put("diagnostics_path", diagnostics.toString());
    if (summary.mode() == SweepMode.RELEASE) {
      paths.put("release_run_status_path", layout.releaseRunStatus().toString());
    }
    Map<String, Object> summaryBlock = SweepDocuments.runSummary(summary, paths);

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("summary", summaryBlock);
    payload.put("dataset_profile", SweepDocuments.datasetProfile(summary.datasetProfile()));
    payload.put("results", results.stream().map(SweepDocuments::resultRow).toList());

    Path snapshot = writer.writeSnapshot(latest, summary.runId(),
        withProvenance(summary.runId(), summary.generatedUtc(), payload));
    writer.writeJson(diagnostics,
        SweepDocuments.diagnostics(summaryBlock, summary.datasetProfile(), results), true);
    log.info("Wrote sweep summary {} (snapshot {}) and diagnostics {}", latest, snapshot, diagnostics);
    return new EvidenceLocations(snapshot, latest, diagnostics);
  }

  @Override
  public EvidenceLocations writePreflight(PreflightReport report) throws IOException {
    Map<String, Object> extras = new LinkedHashMap<>();
    extras.put("artifact_targets", layout.releaseTargets());
    Path latest = layout.preflight();
    Path snapshot = writer.writeSnapshot(latest, report.runId(),
        withProvenance(report.runId(), report.generatedUtc(), SweepDocuments.preflight(report, extras)));
    log.info("Wrote release preflight {} (status {})", latest, report.status());
    return new EvidenceLocations(snapshot, latest, null);
  }

  private static Map<String, Object> withProvenance(String runId, Instant generatedUtc, Object payload) {
    Map<String, Object> provenance = new LinkedHashMap<>();
    provenance.put("run_id", runId);
    provenance.put("timestamp", SweepDocuments.utc(generatedUtc));
    provenance.put("generated_by", SweepDocuments.GENERATED_BY);
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("provenance", provenance);
    document.put("results", payload);
    return document;
  }
}
