package ca.gc.cra.sweep.domain.run;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Set;

/**
 * <strong>What:</strong> Complete release-run status snapshot for external gates.
 * <p><strong>Why:</strong> Gates poll this document instead of tailing logs; its absence means the run was
 * never a release run.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param generatedUtc time of this write
 * @param runId run identifier
 * @param runStartedUtc time the run started
 * @param mode execution mode (always release when written)
 * @param datasetId dataset under evaluation
 * @param status coarse status
 * @param reasonCodes every reason that currently justifies {@code status}
 * @param stage fine-grained stage label
 * @param maxScenarios scenario cap, if any
 * @param scenarioTotal scenarios in the run
 * @param completedScenarios scenarios finished or resumed
 * @param lastScenarioId most recent scenario, if any
 * @param preflightStatus preflight status label
 * @param elapsedSec seconds since run start
 * @param etaSec projected seconds remaining, if known
 * @param details stage-specific details
 * @since 0.1.0
 */
public record ReleaseRunStatus(
    Instant generatedUtc,
    String runId,
    Instant runStartedUtc,
    SweepMode mode,
    String datasetId,
    ReleaseRunState status,
    Set<ReleaseRunReason> reasonCodes,
    String stage,
    OptionalInt maxScenarios,
    int scenarioTotal,
    int completedScenarios,
    Optional<String> lastScenarioId,
    String preflightStatus,
    double elapsedSec,
    OptionalDouble etaSec,
    Map<String, Object> details) {

  public ReleaseRunStatus {
    Objects.requireNonNull(generatedUtc, "generatedUtc");
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(runStartedUtc, "runStartedUtc");
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(datasetId, "datasetId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(reasonCodes, "reasonCodes");
    if (reasonCodes.isEmpty()) {
      throw new IllegalArgumentException("at least one reason code is required");
    }
    reasonCodes = Collections.unmodifiableSet(EnumSet.copyOf(reasonCodes));
    Objects.requireNonNull(stage, "stage");
    Objects.requireNonNull(maxScenarios, "maxScenarios");
    Objects.requireNonNull(lastScenarioId, "lastScenarioId");
    Objects.requireNonNull(preflightStatus, "preflightStatus");
    Objects.requireNonNull(etaSec, "etaSec");
    details = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(details, "details")));
  }
}
