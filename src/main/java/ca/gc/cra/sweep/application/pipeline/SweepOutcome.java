package ca.gc.cra.sweep.application.pipeline;

import ca.gc.cra.sweep.application.port.EvidencePort.EvidenceLocations;
import ca.gc.cra.sweep.domain.result.ScenarioResult;
import ca.gc.cra.sweep.domain.robustness.RunSummary;
import java.util.List;
import java.util.Objects;

/**
 * Result of a completed sweep.
 *
 * @param summary run summary as written to disk
 * @param results all results in scenario order, resumed and fresh
 * @param locations where the evidence documents were written
 * @param executedScenarios scenarios executed by this process
 * @param resumedScenarios scenarios reused from the checkpoint
 * @since 0.1.0
 */
public record SweepOutcome(
    RunSummary summary,
    List<ScenarioResult> results,
    EvidenceLocations locations,
    int executedScenarios,
    int resumedScenarios) {

  public SweepOutcome {
    Objects.requireNonNull(summary, "summary");
    results = List.copyOf(Objects.requireNonNull(results, "results"));
    Objects.requireNonNull(locations, "locations");
  }
}
