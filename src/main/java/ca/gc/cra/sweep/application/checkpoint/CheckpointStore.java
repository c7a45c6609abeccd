package ca.gc.cra.sweep.application.checkpoint;

import ca.gc.cra.sweep.application.port.CheckpointPort;
import ca.gc.cra.sweep.application.port.ClockPort;
import ca.gc.cra.sweep.application.port.MetricsPort;
import ca.gc.cra.sweep.domain.checkpoint.CheckpointFailure;
import ca.gc.cra.sweep.domain.checkpoint.CheckpointSignature;
import ca.gc.cra.sweep.domain.checkpoint.CheckpointState;
import ca.gc.cra.sweep.domain.checkpoint.CheckpointSummary;
import ca.gc.cra.sweep.domain.checkpoint.CompletedScenario;
import ca.gc.cra.sweep.domain.result.ScenarioResult;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Persists, validates and resumes per-scenario completion state for one sweep run.
 * <p><strong>Why:</strong> Sweeps run for hours; a crash must not force completed scenarios to re-execute,
 * and stale progress from a differently shaped run must never be trusted.</p>
 * <p><strong>Role:</strong> Application service owning the active {@link CheckpointState}; every mutation is
 * followed by a full atomic rewrite through {@link CheckpointPort}.</p>
 * <p><strong>Thread-safety:</strong> Confined to the orchestrator thread.</p>
 * <p><strong>Observability:</strong> Logs resume and mismatch decisions; increments
 * {@code sweep.checkpoint.mismatch}.</p>
 *
 * @since 0.1.0
 */
public final class CheckpointStore {
  private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

  /** Outcome of validating the stored checkpoint against the current signature. */
  public enum Outcome {
    /** No checkpoint file, or the file could not be decoded. */
    ABSENT,
    /** A checkpoint exists but was written for a different run shape. */
    SIGNATURE_MISMATCH,
    /** Signature matches but no stored row belongs to the current scenario list. */
    NOTHING_TO_RESUME,
    /** Signature matches and at least one row is reusable. */
    RESUMABLE
  }

  /**
   * Result of {@link #load(CheckpointSignature)}.
   *
   * @param outcome validation outcome
   * @param state stored state, present only for {@link Outcome#RESUMABLE}
   */
  public record LoadResult(Outcome outcome, Optional<CheckpointState> state) {
    public LoadResult {
      Objects.requireNonNull(outcome, "outcome");
      Objects.requireNonNull(state, "state");
    }
  }

  private final CheckpointPort port;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private CheckpointState active;

  public CheckpointStore(CheckpointPort port, ClockPort clock, MetricsPort metrics) {
    this.port = Objects.requireNonNull(port, "port");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Reads the stored checkpoint and validates it field-for-field against {@code signature}. Rows whose ids
   * are not part of the signature's scenario list are dropped.
   *
   * @param signature signature of the current run
   * @return validation outcome, with the usable state when resumable
   * @throws IOException if the checkpoint exists but cannot be read
   */
  public LoadResult load(CheckpointSignature signature) throws IOException {
    Objects.requireNonNull(signature, "signature");
    Optional<CheckpointState> stored = port.read();
    if (stored.isEmpty()) {
      return new LoadResult(Outcome.ABSENT, Optional.empty());
    }
    CheckpointState state = stored.get();
    if (!state.signature().equals(signature)) {
      metrics.increment("sweep.checkpoint.mismatch");
      log.warn("Existing checkpoint {} signature mismatch; starting fresh", port.location());
      log.debug("Stored signature {} differs from requested {}", state.signature(), signature);
      return new LoadResult(Outcome.SIGNATURE_MISMATCH, Optional.empty());
    }
    state.retainScenarios(signature.scenarioIds());
    if (state.completedCount() == 0) {
      return new LoadResult(Outcome.NOTHING_TO_RESUME, Optional.empty());
    }
    return new LoadResult(Outcome.RESUMABLE, Optional.of(state));
  }

  /**
   * Activates the checkpoint for this run and writes it. A resumable stored state is reopened as
   * IN_PROGRESS; otherwise a fresh state replaces whatever was on disk.
   *
   * @param signature signature of the current run
   * @param scenarioTotal scenarios this run executes
   * @param resume whether stored progress may be reused
   * @return the active state
   * @throws IOException if the checkpoint cannot be read or written
   */
  public CheckpointState begin(CheckpointSignature signature, int scenarioTotal, boolean resume)
      throws IOException {
    CheckpointState state = null;
    if (resume) {
      LoadResult loaded = load(signature);
      if (loaded.outcome() == Outcome.RESUMABLE) {
        state = loaded.state().orElseThrow();
        state.markInProgress();
        log.info("Resuming sweep from checkpoint ({}/{} scenarios)", state.completedCount(), scenarioTotal);
      }
    } else {
      log.info("Checkpoint resume disabled; starting fresh");
    }
    if (state == null) {
      state = CheckpointState.fresh(signature, scenarioTotal);
    }
    active = state;
    port.write(active);
    return active;
  }

  /**
   * Appends or replaces a completed scenario by id and rewrites the checkpoint. Recording the same id and
   * result twice leaves the stored content unchanged.
   *
   * @param scenarioId scenario id
   * @param index one-based scenario index
   * @param result scenario result
   * @throws IOException if the checkpoint cannot be written
   */
  public void record(String scenarioId, int index, ScenarioResult result) throws IOException {
    requireActive().record(new CompletedScenario(scenarioId, index, result));
    port.write(active);
  }

  /**
   * Stores a failure note. The state stays resumable for a later run with the same signature.
   *
   * @param scenarioId scenario that failed
   * @param index one-based scenario index
   * @param error failure raised by the scenario
   * @throws IOException if the checkpoint cannot be written
   */
  public void markFailed(String scenarioId, int index, Throwable error) throws IOException {
    Objects.requireNonNull(error, "error");
    requireActive().markFailed(new CheckpointFailure(
        clock.now(), scenarioId, index, error.getClass().getSimpleName(), error.getMessage()));
    port.write(active);
  }

  /**
   * Marks the run completed with its summary block.
   *
   * @param summary completion summary
   * @throws IOException if the checkpoint cannot be written
   */
  public void markCompleted(CheckpointSummary summary) throws IOException {
    requireActive().markCompleted(summary);
    port.write(active);
  }

  /**
   * Returns the active state.
   *
   * @return active checkpoint state
   * @throws IllegalStateException before {@link #begin}
   */
  public CheckpointState state() {
    return requireActive();
  }

  private CheckpointState requireActive() {
    if (active == null) {
      throw new IllegalStateException("checkpoint not started");
    }
    return active;
  }
}
