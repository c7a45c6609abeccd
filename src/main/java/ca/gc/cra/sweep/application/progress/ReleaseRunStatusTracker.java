package ca.gc.cra.sweep.application.progress;

import ca.gc.cra.sweep.application.context.SweepContext;
import ca.gc.cra.sweep.application.port.ClockPort;
import ca.gc.cra.sweep.application.port.ReleaseRunStatusPort;
import ca.gc.cra.sweep.domain.run.ProgressTiming;
import ca.gc.cra.sweep.domain.run.ReleaseRunReason;
import ca.gc.cra.sweep.domain.run.ReleaseRunState;
import ca.gc.cra.sweep.domain.run.ReleaseRunStatus;
import ca.gc.cra.sweep.domain.run.SweepMode;
import java.io.IOException;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Maintains the release-run status file across a release sweep.
 * <p><strong>Why:</strong> Release evidence reviewers need a machine-readable record of how far the run got
 * and why it stopped.</p>
 * <p><strong>Role:</strong> Application service; every call is a no-op outside {@link SweepMode#RELEASE}.</p>
 * <p><strong>Thread-safety:</strong> Writes are synchronized; heartbeat-driven updates may race the
 * orchestrator.</p>
 *
 * @since 0.1.0
 */
public final class ReleaseRunStatusTracker {
  static final String PREFLIGHT_OK = "PREFLIGHT_OK";

  private final ReleaseRunStatusPort port;
  private final ClockPort clock;

  public ReleaseRunStatusTracker(ReleaseRunStatusPort port, ClockPort clock) {
    this.port = Objects.requireNonNull(port, "port");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Records that the run started.
   *
   * @param context active run
   * @param resumeRequested whether checkpoint resume was requested
   * @param resumedScenarios scenarios restored from the checkpoint
   * @throws IOException if the status cannot be written
   */
  public void started(SweepContext context, boolean resumeRequested, int resumedScenarios)
      throws IOException {
    write(context, ReleaseRunState.STARTED, EnumSet.of(ReleaseRunReason.RELEASE_RUN_STARTED), "run_started",
        Map.of("resume", resumeRequested, "resumed_scenarios", resumedScenarios));
  }

  /**
   * Records a running stage. Once a scenario has been resumed every later running status also carries
   * {@link ReleaseRunReason#RELEASE_RUN_RESUMED}.
   *
   * @param context active run
   * @param reason primary reason for this stage
   * @param stage stage name
   * @throws IOException if the status cannot be written
   */
  public void running(SweepContext context, ReleaseRunReason reason, String stage) throws IOException {
    Objects.requireNonNull(reason, "reason");
    EnumSet<ReleaseRunReason> reasons = EnumSet.of(reason);
    if (context.resumed()) {
      reasons.add(ReleaseRunReason.RELEASE_RUN_RESUMED);
    }
    write(context, ReleaseRunState.RUNNING, reasons, stage, Map.of());
  }

  /**
   * Records run completion.
   *
   * @param context active run
   * @param details completion summary
   * @throws IOException if the status cannot be written
   */
  public void completed(SweepContext context, Map<String, Object> details) throws IOException {
    write(context, ReleaseRunState.COMPLETED, EnumSet.of(ReleaseRunReason.RELEASE_RUN_COMPLETED),
        "run_completed", details);
  }

  /**
   * Records run failure.
   *
   * @param context active run
   * @param errorType simple name of the failure
   * @param errorMessage failure message
   * @throws IOException if the status cannot be written
   */
  public void failed(SweepContext context, String errorType, String errorMessage) throws IOException {
    write(context, ReleaseRunState.FAILED, EnumSet.of(ReleaseRunReason.RELEASE_RUN_FAILED), "run_failed",
        Map.of("error_type", errorType, "error_message", errorMessage == null ? "" : errorMessage));
  }

  /**
   * Indicates whether status writes are active for the given run.
   *
   * @param context active run
   * @return {@code true} for release runs
   */
  public boolean enabled(SweepContext context) {
    return context.mode() == SweepMode.RELEASE;
  }

  private synchronized void write(
      SweepContext context,
      ReleaseRunState state,
      Set<ReleaseRunReason> reasons,
      String stage,
      Map<String, Object> details) throws IOException {
    if (!enabled(context)) {
      return;
    }
    ProgressTiming timing = context.timing();
    port.write(new ReleaseRunStatus(
        clock.now(),
        context.runId(),
        context.runStartedUtc(),
        context.mode(),
        context.datasetId(),
        state,
        reasons,
        stage,
        context.maxScenarios(),
        context.scenarioTotal(),
        context.completedScenarios(),
        context.currentScenarioId(),
        PREFLIGHT_OK,
        timing.elapsedSec(),
        timing.etaSec(),
        details));
  }
}
