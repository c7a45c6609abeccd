package ca.gc.cra.sweep.domain.checkpoint;

import java.time.Instant;
import java.util.Objects;

/**
 * Failure note stored when a scenario raised.
 *
 * @param timestamp time the failure was recorded
 * @param scenarioId failing scenario
 * @param scenarioIndex one-based position of the failing scenario
 * @param errorType simple class name of the error
 * @param errorMessage error message, empty when none was given
 * @since 0.1.0
 */
public record CheckpointFailure(
    Instant timestamp, String scenarioId, int scenarioIndex, String errorType, String errorMessage) {
  public CheckpointFailure {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(scenarioId, "scenarioId");
    Objects.requireNonNull(errorType, "errorType");
    errorMessage = errorMessage == null ? "" : errorMessage;
  }
}
