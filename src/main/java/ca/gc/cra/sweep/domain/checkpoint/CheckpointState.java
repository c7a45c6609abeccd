package ca.gc.cra.sweep.domain.checkpoint;

import ca.gc.cra.sweep.domain.result.ScenarioResult;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Mutable per-run checkpoint aggregate: signature, lifecycle status, and completed rows.
 * <p><strong>Why:</strong> Rewritten after every scenario so a restart executes only the remaining work.</p>
 * <p><strong>Role:</strong> Owned by the checkpoint store; persisted whole through the checkpoint port.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the orchestrator thread.</p>
 *
 * @since 0.1.0
 */
public final class CheckpointState {
  private final CheckpointSignature signature;
  private final int scenarioTotal;
  private final Map<String, CompletedScenario> completed = new LinkedHashMap<>();
  private CheckpointStatus status;
  private Integer lastCompletedIndex;
  private CheckpointFailure failure;
  private CheckpointSummary summary;

  private CheckpointState(CheckpointSignature signature, int scenarioTotal, CheckpointStatus status) {
    this.signature = Objects.requireNonNull(signature, "signature");
    if (scenarioTotal < 0) {
      throw new IllegalArgumentException("scenarioTotal must be non-negative");
    }
    this.scenarioTotal = scenarioTotal;
    this.status = Objects.requireNonNull(status, "status");
  }

  /**
   * Creates an empty {@link CheckpointStatus#IN_PROGRESS} state.
   *
   * @param signature run signature
   * @param scenarioTotal number of scenarios the run will execute
   * @return new state
   */
  public static CheckpointState fresh(CheckpointSignature signature, int scenarioTotal) {
    return new CheckpointState(signature, scenarioTotal, CheckpointStatus.IN_PROGRESS);
  }

  /**
   * Rebuilds a state read back from storage.
   *
   * @param signature stored signature
   * @param scenarioTotal stored scenario total
   * @param status stored status
   * @param rows stored rows in their stored order
   * @param lastCompletedIndex stored last completed index, if any
   * @param failure stored failure note, if any
   * @param summary stored completion summary, if any
   * @return restored state
   */
  public static CheckpointState restore(
      CheckpointSignature signature,
      int scenarioTotal,
      CheckpointStatus status,
      Collection<CompletedScenario> rows,
      OptionalInt lastCompletedIndex,
      Optional<CheckpointFailure> failure,
      Optional<CheckpointSummary> summary) {
    CheckpointState state = new CheckpointState(signature, scenarioTotal, status);
    for (CompletedScenario row : rows) {
      state.completed.put(row.id(), row);
    }
    state.lastCompletedIndex = lastCompletedIndex.isPresent() ? lastCompletedIndex.getAsInt() : null;
    state.failure = failure.orElse(null);
    state.summary = summary.orElse(null);
    return state;
  }

  /**
   * Appends a row, or replaces the row with the same id in place.
   *
   * @param row completed scenario row
   */
  public void record(CompletedScenario row) {
    Objects.requireNonNull(row, "row");
    completed.put(row.id(), row);
    lastCompletedIndex = row.index();
  }

  /**
   * Keeps only rows whose ids appear in {@code allowedIds}.
   *
   * @param allowedIds scenario ids of the current run
   */
  public void retainScenarios(Collection<String> allowedIds) {
    completed.keySet().retainAll(allowedIds);
  }

  /** Returns the state to {@link CheckpointStatus#IN_PROGRESS} when a run resumes. */
  public void markInProgress() {
    status = CheckpointStatus.IN_PROGRESS;
  }

  /**
   * Records a failure note and sets {@link CheckpointStatus#FAILED}.
   *
   * @param note failure details
   */
  public void markFailed(CheckpointFailure note) {
    failure = Objects.requireNonNull(note, "note");
    status = CheckpointStatus.FAILED;
  }

  /**
   * Records the completion summary and sets {@link CheckpointStatus#COMPLETED}.
   *
   * @param completion headline outcome of the run
   */
  public void markCompleted(CheckpointSummary completion) {
    summary = Objects.requireNonNull(completion, "completion");
    status = CheckpointStatus.COMPLETED;
  }

  public CheckpointSignature signature() {
    return signature;
  }

  public CheckpointStatus status() {
    return status;
  }

  public int scenarioTotal() {
    return scenarioTotal;
  }

  public int completedCount() {
    return completed.size();
  }

  public List<String> completedScenarioIds() {
    return List.copyOf(completed.keySet());
  }

  public List<CompletedScenario> completedScenarios() {
    return List.copyOf(new ArrayList<>(completed.values()));
  }

  /**
   * Looks up a stored result by scenario id.
   *
   * @param scenarioId scenario id
   * @return stored result when present
   */
  public Optional<ScenarioResult> result(String scenarioId) {
    CompletedScenario row = completed.get(scenarioId);
    return row == null ? Optional.empty() : Optional.of(row.result());
  }

  public OptionalInt lastCompletedIndex() {
    return lastCompletedIndex == null ? OptionalInt.empty() : OptionalInt.of(lastCompletedIndex);
  }

  public Optional<CheckpointFailure> failure() {
    return Optional.ofNullable(failure);
  }

  public Optional<CheckpointSummary> summary() {
    return Optional.ofNullable(summary);
  }
}
