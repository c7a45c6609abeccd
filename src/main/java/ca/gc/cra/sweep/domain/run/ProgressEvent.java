package ca.gc.cra.sweep.domain.run;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured event emitted by the scenario executor while a scenario runs.
 *
 * @param stage event stage such as {@code model_started} or {@code full_battery_heartbeat}
 * @param scenarioId scenario the event belongs to
 * @param attributes stage-specific fields in emission order
 * @since 0.1.0
 */
public record ProgressEvent(String stage, String scenarioId, Map<String, Object> attributes) {

  /** Scenario execution started. */
  public static final String SCENARIO_STARTED = "scenario_started";
  /** A candidate model started. */
  public static final String MODEL_STARTED = "model_started";
  /** Prediction tests finished for a model. */
  public static final String PREDICTION_TESTS_COMPLETED = "prediction_tests_completed";
  /** Liveness beat emitted during the full battery. */
  public static final String FULL_BATTERY_HEARTBEAT = "full_battery_heartbeat";
  /** A candidate model finished. */
  public static final String MODEL_COMPLETED = "model_completed";
  /** Scenario execution finished. */
  public static final String SCENARIO_COMPLETED = "scenario_completed";

  public ProgressEvent {
    Objects.requireNonNull(stage, "stage");
    Objects.requireNonNull(scenarioId, "scenarioId");
    attributes = Collections.unmodifiableMap(
        new LinkedHashMap<>(Objects.requireNonNull(attributes, "attributes")));
  }
}
