package ca.gc.cra.sweep.domain.policy;

/**
 * <strong>What:</strong> Warning-volume ceilings applied per scenario and across the whole sweep.
 * <p><strong>Role:</strong> Consumed by the scenario executor (per-scenario flags) and the robustness
 * evaluator (sweep-wide ceiling check).</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param maxTotalWarningCount ceiling on warnings summed over all scenarios
 * @param maxWarningDensityPerScenario ceiling on warnings per scenario, both for the per-scenario flag and the
 *     sweep-wide average
 * @param maxInsufficientDataScenarios ceiling on scenarios flagged {@code insufficient_data}
 * @param maxSparseDataScenarios ceiling on scenarios flagged {@code sparse_data}
 * @param maxNanSanitizedScenarios ceiling on scenarios flagged {@code nan_sanitized}
 * @param maxFallbackHeavyScenarios ceiling on scenarios flagged {@code fallback_heavy}
 * @param fallbackHeavyThresholdPerScenario fallback-estimate count that marks a scenario fallback-heavy
 * @param maxFallbackWarningRatioPerScenario fallback-related share above which a scenario is flagged
 * @since 0.1.0
 */
public record WarningPolicy(
    long maxTotalWarningCount,
    double maxWarningDensityPerScenario,
    long maxInsufficientDataScenarios,
    long maxSparseDataScenarios,
    long maxNanSanitizedScenarios,
    long maxFallbackHeavyScenarios,
    int fallbackHeavyThresholdPerScenario,
    double maxFallbackWarningRatioPerScenario) {

  private static final WarningPolicy DEFAULTS = new WarningPolicy(400, 20.0, 0, 0, 0, 0, 3, 0.25);

  public WarningPolicy {
    if (maxTotalWarningCount < 0
        || maxInsufficientDataScenarios < 0
        || maxSparseDataScenarios < 0
        || maxNanSanitizedScenarios < 0
        || maxFallbackHeavyScenarios < 0) {
      throw new IllegalArgumentException("warning policy ceilings must be non-negative");
    }
    if (Double.isNaN(maxWarningDensityPerScenario) || maxWarningDensityPerScenario < 0) {
      throw new IllegalArgumentException("maxWarningDensityPerScenario must be non-negative");
    }
    if (fallbackHeavyThresholdPerScenario < 1) {
      throw new IllegalArgumentException("fallbackHeavyThresholdPerScenario must be at least 1");
    }
    if (Double.isNaN(maxFallbackWarningRatioPerScenario)
        || maxFallbackWarningRatioPerScenario < 0
        || maxFallbackWarningRatioPerScenario > 1) {
      throw new IllegalArgumentException("maxFallbackWarningRatioPerScenario must be within [0, 1]");
    }
  }

  /**
   * Returns the built-in ceilings used when no policy document overrides them.
   *
   * @return default warning policy
   */
  public static WarningPolicy defaults() {
    return DEFAULTS;
  }
}
