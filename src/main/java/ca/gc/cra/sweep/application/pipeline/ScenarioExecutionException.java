package ca.gc.cra.sweep.application.pipeline;

/**
 * Raised when a scenario fails after the failure has been recorded in the checkpoint, progress and
 * release-run status artifacts. The original failure is the cause.
 *
 * @since 0.1.0
 */
public class ScenarioExecutionException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String scenarioId;
  private final int scenarioIndex;

  /**
   * Creates the exception.
   *
   * @param scenarioId failing scenario
   * @param scenarioIndex one-based index of the failing scenario
   * @param cause failure raised by the evaluation collaborator
   */
  public ScenarioExecutionException(String scenarioId, int scenarioIndex, Throwable cause) {
    super("Scenario " + scenarioId + " (#" + scenarioIndex + ") failed: "
        + cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
    this.scenarioId = scenarioId;
    this.scenarioIndex = scenarioIndex;
  }

  public String scenarioId() {
    return scenarioId;
  }

  public int scenarioIndex() {
    return scenarioIndex;
  }
}
