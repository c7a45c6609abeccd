package ca.gc.cra.sweep.application.progress;

import ca.gc.cra.sweep.application.context.SweepContext;
import ca.gc.cra.sweep.application.port.ClockPort;
import ca.gc.cra.sweep.application.port.ProgressPort;
import ca.gc.cra.sweep.domain.run.ProgressSnapshot;
import ca.gc.cra.sweep.domain.run.SweepMode;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Publishes the "latest progress" snapshot for a sweep run.
 * <p><strong>Why:</strong> Operators tail a single file to see which stage and scenario is active and how
 * long the remainder should take.</p>
 * <p><strong>Role:</strong> Application service called by the orchestrator and, through executor events, by the
 * heartbeat thread.</p>
 * <p><strong>Thread-safety:</strong> {@link #publish} and friends are synchronized so snapshots from the
 * orchestrator and heartbeat threads never interleave.</p>
 *
 * @since 0.1.0
 */
public final class ProgressReporter {
  public static final String RUN_STARTED = "run_started";
  public static final String SCENARIO_RESUMED = "scenario_resumed";
  public static final String SCENARIO_DISPATCH = "scenario_dispatch";
  public static final String SCENARIO_COMPLETED = "scenario_completed";
  public static final String RUN_FAILED = "run_failed";
  public static final String RUN_COMPLETED = "run_completed";
  public static final String PREFLIGHT_COMPLETED = "preflight_completed";
  public static final String PREFLIGHT_BLOCKED = "preflight_blocked";

  private final ProgressPort port;
  private final ClockPort clock;

  /**
   * Creates a reporter writing through the given port.
   *
   * @param port progress sink
   * @param clock time source for snapshot timestamps
   */
  public ProgressReporter(ProgressPort port, ClockPort clock) {
    this.port = Objects.requireNonNull(port, "port");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Publishes a run-level stage with timing but no scenario.
   *
   * @param context active run
   * @param stage stage name
   * @param attributes stage-specific attributes
   * @throws IOException if the snapshot cannot be written
   */
  public synchronized void publish(SweepContext context, String stage, Map<String, Object> attributes)
      throws IOException {
    port.write(new ProgressSnapshot(
        clock.now(),
        stage,
        context.datasetId(),
        context.mode(),
        Optional.empty(),
        OptionalInt.empty(),
        OptionalInt.of(context.scenarioTotal()),
        Optional.of(context.timing()),
        attributes));
  }

  /**
   * Publishes a scenario-level stage.
   *
   * @param context active run
   * @param stage stage name
   * @param scenarioId scenario the stage belongs to
   * @param scenarioIndex one-based scenario index
   * @param attributes stage-specific attributes
   * @throws IOException if the snapshot cannot be written
   */
  public synchronized void publishScenario(
      SweepContext context,
      String stage,
      String scenarioId,
      int scenarioIndex,
      Map<String, Object> attributes) throws IOException {
    port.write(new ProgressSnapshot(
        clock.now(),
        stage,
        context.datasetId(),
        context.mode(),
        Optional.of(scenarioId),
        OptionalInt.of(scenarioIndex),
        OptionalInt.of(context.scenarioTotal()),
        Optional.of(context.timing()),
        attributes));
  }

  /**
   * Publishes a preflight stage. Preflight runs have no scenario timing.
   *
   * @param stage {@link #PREFLIGHT_COMPLETED} or {@link #PREFLIGHT_BLOCKED}
   * @param datasetId dataset that was checked
   * @param mode requested execution mode
   * @param attributes preflight details
   * @throws IOException if the snapshot cannot be written
   */
  public synchronized void publishPreflight(
      String stage, String datasetId, SweepMode mode, Map<String, Object> attributes) throws IOException {
    port.write(new ProgressSnapshot(
        clock.now(),
        stage,
        datasetId,
        mode,
        Optional.empty(),
        OptionalInt.empty(),
        OptionalInt.empty(),
        Optional.empty(),
        attributes));
  }
}
