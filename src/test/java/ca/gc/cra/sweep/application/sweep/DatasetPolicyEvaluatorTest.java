package ca.gc.cra.sweep.application.sweep;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sweep.domain.dataset.DatasetPolicyEvaluation;
import ca.gc.cra.sweep.domain.dataset.DatasetProfile;
import ca.gc.cra.sweep.domain.policy.DatasetPolicy;
import java.util.List;
import org.junit.jupiter.api.Test;

class DatasetPolicyEvaluatorTest {

  @Test
  void releaseDatasetAboveMinimumsPasses() {
    DatasetPolicy policy = DatasetPolicy.defaults();

    DatasetPolicyEvaluation evaluation =
        DatasetPolicyEvaluator.evaluate(new DatasetProfile("voynich_real", 240, 250_000), policy);

    assertTrue(evaluation.pass());
    assertEquals(List.of(), evaluation.reasons());
    assertSame(policy, evaluation.constraints());
  }

  @Test
  void everyViolationIsReported() {
    DatasetPolicyEvaluation evaluation = DatasetPolicyEvaluator.evaluate(
        new DatasetProfile("voynich_synthetic_grammar", 12, 900), DatasetPolicy.defaults());

    assertFalse(evaluation.pass());
    assertEquals(List.of(
        "dataset_id='voynich_synthetic_grammar' is not in allowed release datasets: ['voynich_real']",
        "dataset_pages=12 below minimum 200",
        "dataset_tokens=900 below minimum 200000"), evaluation.reasons());
  }

  @Test
  void emptyAllowListAdmitsAnyDataset() {
    DatasetPolicy policy = new DatasetPolicy(List.of(), 1, 1);

    assertTrue(DatasetPolicyEvaluator.evaluate(new DatasetProfile("anything", 1, 1), policy).pass());
  }
}
