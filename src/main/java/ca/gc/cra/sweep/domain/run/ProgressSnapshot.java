package ca.gc.cra.sweep.domain.run;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> One complete progress document.
 * <p><strong>Why:</strong> Each write replaces the previous snapshot whole so a poller never needs history.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param timestamp time of the transition
 * @param stage stage label
 * @param datasetId dataset under evaluation
 * @param mode execution mode
 * @param scenarioId current scenario, if any
 * @param scenarioIndex one-based index of the current scenario, if any
 * @param scenarioTotal scenarios in the run, if known
 * @param timing timing block, absent for preflight snapshots
 * @param attributes additional stage-specific fields
 * @since 0.1.0
 */
public record ProgressSnapshot(
    Instant timestamp,
    String stage,
    String datasetId,
    SweepMode mode,
    Optional<String> scenarioId,
    OptionalInt scenarioIndex,
    OptionalInt scenarioTotal,
    Optional<ProgressTiming> timing,
    Map<String, Object> attributes) {

  public ProgressSnapshot {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(stage, "stage");
    Objects.requireNonNull(datasetId, "datasetId");
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(scenarioId, "scenarioId");
    Objects.requireNonNull(scenarioIndex, "scenarioIndex");
    Objects.requireNonNull(scenarioTotal, "scenarioTotal");
    Objects.requireNonNull(timing, "timing");
    attributes = Collections.unmodifiableMap(
        new LinkedHashMap<>(Objects.requireNonNull(attributes, "attributes")));
  }
}
