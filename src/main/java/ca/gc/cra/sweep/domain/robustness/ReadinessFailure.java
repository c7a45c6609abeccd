package ca.gc.cra.sweep.domain.robustness;

/**
 * Reasons a run does not qualify as release evidence.
 *
 * @since 0.1.0
 */
public enum ReadinessFailure {
  EXECUTION_MODE_NOT_RELEASE("execution_mode_not_release"),
  MAX_SCENARIOS_OVERRIDE_PRESENT("max_scenarios_override_present"),
  INCOMPLETE_SCENARIO_EXECUTION("incomplete_scenario_execution"),
  QUALITY_GATE_FAILED("quality_gate_failed"),
  ROBUSTNESS_NOT_CONCLUSIVE("robustness_not_conclusive"),
  DATASET_POLICY_FAILED("dataset_policy_failed"),
  WARNING_POLICY_FAILED("warning_policy_failed");

  private final String token;

  ReadinessFailure(String token) {
    this.token = token;
  }

  /**
   * Returns the token written into summaries.
   *
   * @return failure token such as {@code quality_gate_failed}
   */
  public String token() {
    return token;
  }
}
