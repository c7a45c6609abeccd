package ca.gc.cra.sweep.domain.robustness;

/**
 * Statistical robustness verdict.
 *
 * @since 0.1.0
 */
public enum RobustnessDecision {
  /** Conclusions held across the matrix. */
  PASS,
  /** Conclusions shifted under perturbation or a ceiling was breached. */
  FAIL,
  /** No legitimate baseline existed, so no verdict is defensible. */
  INCONCLUSIVE
}
