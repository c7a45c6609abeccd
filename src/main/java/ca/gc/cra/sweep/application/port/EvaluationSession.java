package ca.gc.cra.sweep.application.port;

import ca.gc.cra.sweep.domain.result.ScenarioMetrics;

/**
 * <strong>What:</strong> One scenario's conversation with the evaluation collaborator.
 * <p><strong>Why:</strong> Separating the per-model steps lets the executor report progress between them and
 * scope the heartbeat to the full battery alone.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; used only from the orchestrator thread.</p>
 *
 * @since 0.1.0
 */
public interface EvaluationSession extends AutoCloseable {
  /**
   * Runs the prediction tests for one candidate model.
   *
   * @param model candidate model name
   * @throws Exception when the collaborator fails
   */
  void runPredictionTests(String model) throws Exception;

  /**
   * Runs the full perturbation battery for one candidate model. May take minutes and reports nothing until it
   * returns.
   *
   * @param model candidate model name
   * @throws Exception when the collaborator fails
   */
  void runFullBattery(String model) throws Exception;

  /**
   * Produces the cross-model report once every model has been evaluated.
   *
   * @return ranking and anomaly metrics
   * @throws Exception when the collaborator fails
   */
  ScenarioMetrics report() throws Exception;

  @Override
  void close() throws Exception;
}
