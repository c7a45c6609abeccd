package ca.gc.cra.sweep.application.port;

import ca.gc.cra.sweep.domain.dataset.DatasetProfile;
import ca.gc.cra.sweep.domain.scenario.ScenarioSpec;
import java.util.List;

/**
 * <strong>What:</strong> Port to the statistical evaluation battery.
 * <p><strong>Why:</strong> The candidate models and their tests are an external collaborator; the sweep only
 * drives them with an explicit scenario configuration.</p>
 * <p><strong>Role:</strong> Domain port implemented by {@code ProcessEvaluationAdapter} and by test fakes.</p>
 * <p><strong>Thread-safety:</strong> Sessions must not be used concurrently; scenarios run strictly in order.</p>
 *
 * @since 0.1.0
 */
public interface EvaluationPort {
  /**
   * Returns the candidate models evaluated in every scenario, in evaluation order.
   *
   * @return model names
   */
  List<String> candidateModels();

  /**
   * Opens a session for one scenario. The scenario configuration is passed explicitly and must be the only
   * parameter source the collaborator consults.
   *
   * @param dataset dataset under evaluation
   * @param scenario scenario whose configuration applies
   * @param diagnostics receives every diagnostic warning emitted during the session
   * @return open session; callers close it
   * @throws Exception when the collaborator cannot start
   */
  EvaluationSession openSession(DatasetProfile dataset, ScenarioSpec scenario, DiagnosticSink diagnostics)
      throws Exception;
}
