package ca.gc.cra.sweep.application.context;

import ca.gc.cra.sweep.application.port.ClockPort;
import ca.gc.cra.sweep.domain.run.ProgressTiming;
import ca.gc.cra.sweep.domain.run.SweepMode;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Explicit run context created at sweep start and passed to every component call.
 * <p><strong>Why:</strong> Replaces ambient global run state; everything a progress or status write needs is
 * reachable from here.</p>
 * <p><strong>Role:</strong> Owned by {@code SensitivitySweepUseCase}; read by the progress reporter and the
 * release-run status tracker.</p>
 * <p><strong>Thread-safety:</strong> Mutated only by the orchestrator thread; mutable fields are volatile so
 * the heartbeat thread reads current values.</p>
 *
 * @since 0.1.0
 */
public final class SweepContext {
  private final String runId;
  private final Instant runStartedUtc;
  private final long startMillis;
  private final ClockPort clock;
  private final SweepMode mode;
  private final String datasetId;
  private final OptionalInt maxScenarios;
  private final int scenarioTotal;
  private volatile int completedScenarios;
  private volatile int resumedScenarios;
  private volatile String currentScenarioId;
  private volatile int currentScenarioIndex;
  private volatile boolean finished;

  private SweepContext(
      String runId,
      ClockPort clock,
      SweepMode mode,
      String datasetId,
      OptionalInt maxScenarios,
      int scenarioTotal) {
    this.runId = Objects.requireNonNull(runId, "runId");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.mode = Objects.requireNonNull(mode, "mode");
    this.datasetId = Objects.requireNonNull(datasetId, "datasetId");
    this.maxScenarios = Objects.requireNonNull(maxScenarios, "maxScenarios");
    if (scenarioTotal < 0) {
      throw new IllegalArgumentException("scenarioTotal must be non-negative");
    }
    this.scenarioTotal = scenarioTotal;
    this.startMillis = clock.nowMillis();
    this.runStartedUtc = Instant.ofEpochMilli(startMillis);
  }

  /**
   * Opens a context and starts the run clock.
   *
   * @param runId run identifier
   * @param clock time source
   * @param mode execution mode
   * @param datasetId dataset under evaluation
   * @param maxScenarios scenario cap, if any
   * @param scenarioTotal scenarios this run will execute
   * @return new context
   */
  public static SweepContext start(
      String runId,
      ClockPort clock,
      SweepMode mode,
      String datasetId,
      OptionalInt maxScenarios,
      int scenarioTotal) {
    return new SweepContext(runId, clock, mode, datasetId, maxScenarios, scenarioTotal);
  }

  /**
   * Recomputes elapsed time and ETA from the current completion count.
   *
   * @return fresh timing block
   */
  public ProgressTiming timing() {
    return ProgressTiming.compute(elapsedMillis(), completedScenarios, scenarioTotal);
  }

  /**
   * Returns milliseconds since the run started.
   *
   * @return elapsed milliseconds
   */
  public long elapsedMillis() {
    return clock.nowMillis() - startMillis;
  }

  /**
   * Marks a scenario as the one currently dispatched.
   *
   * @param scenarioId scenario id
   * @param index one-based scenario index
   */
  public void enterScenario(String scenarioId, int index) {
    this.currentScenarioId = Objects.requireNonNull(scenarioId, "scenarioId");
    this.currentScenarioIndex = index;
  }

  /** Counts a freshly executed scenario. */
  public void scenarioCompleted() {
    completedScenarios++;
  }

  /** Counts a scenario reused from the checkpoint. */
  public void scenarioResumed() {
    completedScenarios++;
    resumedScenarios++;
  }

  /**
   * Closes the run and returns the final timing block.
   *
   * @return timing at completion
   * @throws IllegalStateException when the context was already finished
   */
  public ProgressTiming finish() {
    if (finished) {
      throw new IllegalStateException("run " + runId + " already finished");
    }
    finished = true;
    return timing();
  }

  public String runId() {
    return runId;
  }

  public Instant runStartedUtc() {
    return runStartedUtc;
  }

  public ClockPort clock() {
    return clock;
  }

  public SweepMode mode() {
    return mode;
  }

  public String datasetId() {
    return datasetId;
  }

  public OptionalInt maxScenarios() {
    return maxScenarios;
  }

  public int scenarioTotal() {
    return scenarioTotal;
  }

  public int completedScenarios() {
    return completedScenarios;
  }

  public int resumedScenarios() {
    return resumedScenarios;
  }

  /**
   * Indicates whether any scenario was reused from the checkpoint.
   *
   * @return {@code true} after the first resumed scenario
   */
  public boolean resumed() {
    return resumedScenarios > 0;
  }

  public Optional<String> currentScenarioId() {
    return Optional.ofNullable(currentScenarioId);
  }

  public int currentScenarioIndex() {
    return currentScenarioIndex;
  }

  public boolean finished() {
    return finished;
  }
}
