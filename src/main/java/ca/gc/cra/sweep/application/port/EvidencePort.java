package ca.gc.cra.sweep.application.port;

import ca.gc.cra.sweep.domain.preflight.PreflightReport;
import ca.gc.cra.sweep.domain.result.ScenarioResult;
import ca.gc.cra.sweep.domain.robustness.RunSummary;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * <strong>What:</strong> Persistence port for end-of-run evidence documents.
 * <p><strong>Why:</strong> Release gates read these files; each is written as a per-run snapshot first and
 * the latest pointer second, both atomically.</p>
 * <p><strong>Role:</strong> Implemented by {@code FileEvidenceAdapter}.</p>
 *
 * @since 0.1.0
 */
public interface EvidencePort {
  /**
   * Writes the run summary with every result row, plus the quality diagnostics document.
   *
   * @param summary run summary
   * @param results result rows in scenario order
   * @return locations written
   * @throws IOException when a write fails
   */
  EvidenceLocations writeRunSummary(RunSummary summary, List<ScenarioResult> results) throws IOException;

  /**
   * Writes the standalone preflight document.
   *
   * @param report preflight report
   * @return locations written; {@code diagnostics} is {@code null}
   * @throws IOException when a write fails
   */
  EvidenceLocations writePreflight(PreflightReport report) throws IOException;

  /**
   * Paths written for one evidence document.
   *
   * @param snapshot per-run snapshot path
   * @param latest latest pointer path
   * @param diagnostics quality diagnostics path, when one was written
   */
  record EvidenceLocations(Path snapshot, Path latest, Path diagnostics) {}
}
