package ca.gc.cra.sweep.application.sweep;

import ca.gc.cra.sweep.domain.policy.WarningPolicy;
import ca.gc.cra.sweep.domain.result.QualityFlag;
import ca.gc.cra.sweep.domain.result.ScenarioResult;
import ca.gc.cra.sweep.domain.robustness.RobustnessDecision;
import ca.gc.cra.sweep.domain.robustness.RobustnessSummary;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Aggregates scenario results into a robustness verdict.
 * <p><strong>Why:</strong> A single PASS/FAIL/INCONCLUSIVE decision with caveats is what the release gate and
 * reviewers consume.</p>
 * <p><strong>Role:</strong> Pure application service; no I/O.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * @implNote Match rates are anchored to the first valid result in declared order. When the literal baseline
 *     scenario is invalid the anchor moves to the next valid scenario; {@link
 *     RobustnessSummary#baselineScenarioId()} records which one was used.
 * @since 0.1.0
 */
public final class RobustnessEvaluator {
  /** Default minimum share of valid scenarios. */
  public static final double DEFAULT_MIN_VALID_RATE = 0.80;
  static final double MIN_MATCH_RATE = 0.90;
  static final String NO_SCENARIOS_CAVEAT = "No scenarios were executed.";
  static final String ALL_FALSIFIED_CAVEAT =
      "All scenarios reported zero surviving models; robustness PASS is not defensible.";
  static final String QUALIFIED_EVIDENCE_CAVEAT =
      "Warnings were emitted across scenarios; treat robustness as qualified evidence.";

  private final double minValidRate;

  public RobustnessEvaluator() {
    this(DEFAULT_MIN_VALID_RATE);
  }

  /**
   * Creates an evaluator with a custom valid-rate floor.
   *
   * @param minValidRate minimum share of valid scenarios, within [0, 1]
   */
  public RobustnessEvaluator(double minValidRate) {
    if (Double.isNaN(minValidRate) || minValidRate < 0 || minValidRate > 1) {
      throw new IllegalArgumentException("minValidRate must be within [0, 1]");
    }
    this.minValidRate = minValidRate;
  }

  public double minValidRate() {
    return minValidRate;
  }

  /**
   * Evaluates robustness over all results in declared order.
   *
   * @param results scenario results, resumed and fresh
   * @param policy warning ceilings
   * @return robustness summary
   */
  public RobustnessSummary evaluate(List<ScenarioResult> results, WarningPolicy policy) {
    Objects.requireNonNull(results, "results");
    Objects.requireNonNull(policy, "policy");
    int total = results.size();
    if (total == 0) {
      return new RobustnessSummary(
          0, 0, 0.0,
          Optional.empty(), Optional.empty(), Optional.empty(),
          0.0, 0.0,
          true, false, false,
          0, 0, 0, 0, 0,
          0L, 0.0,
          false, policy,
          false, RobustnessDecision.INCONCLUSIVE,
          List.of(NO_SCENARIOS_CAVEAT));
    }

    List<ScenarioResult> valid = results.stream().filter(ScenarioResult::valid).toList();
    double validRate = (double) valid.size() / total;
    boolean allFalsified = results.stream().allMatch(r -> r.metrics().survivingModels() == 0);
    int insufficient = countFlag(results, QualityFlag.INSUFFICIENT_DATA);
    int sparse = countFlag(results, QualityFlag.SPARSE_DATA);
    int nanSanitized = countFlag(results, QualityFlag.NAN_SANITIZED);
    int fallbackHeavy = countFlag(results, QualityFlag.FALLBACK_HEAVY);
    int ratioExceeded = countFlag(results, QualityFlag.FALLBACK_RATIO_EXCEEDED);
    long totalWarnings = results.stream().mapToLong(r -> r.warnings().totalWarnings()).sum();
    double density = (double) totalWarnings / total;

    ScenarioResult baseline = valid.isEmpty() ? results.get(0) : valid.get(0);
    double topModelMatchRate = 0.0;
    double anomalyMatchRate = 0.0;
    if (!valid.isEmpty()) {
      String topModel = baseline.metrics().topModel();
      boolean anomaly = baseline.metrics().anomalyConfirmed();
      topModelMatchRate = (double) valid.stream()
          .filter(r -> r.metrics().topModel().equals(topModel)).count() / valid.size();
      anomalyMatchRate = (double) valid.stream()
          .filter(r -> r.metrics().anomalyConfirmed() == anomaly).count() / valid.size();
    }

    List<String> caveats = new ArrayList<>();
    if (insufficient > 0) {
      caveats.add(insufficient + "/" + total + " scenarios emitted insufficient-data warnings.");
    }
    if (allFalsified) {
      caveats.add(ALL_FALSIFIED_CAVEAT);
    }
    if (validRate < minValidRate) {
      caveats.add(String.format(Locale.ROOT, "Valid scenario rate %.2f%% is below required %.0f%%.",
          validRate * 100.0, minValidRate * 100.0));
    }
    if (totalWarnings > 0 && caveats.isEmpty()) {
      caveats.add(QUALIFIED_EVIDENCE_CAVEAT);
    }

    boolean warningPolicyPass = true;
    if (totalWarnings > policy.maxTotalWarningCount()) {
      warningPolicyPass = false;
      caveats.add("Total warnings " + totalWarnings + " exceed policy max " + policy.maxTotalWarningCount() + ".");
    }
    if (density > policy.maxWarningDensityPerScenario()) {
      warningPolicyPass = false;
      caveats.add(String.format(Locale.ROOT, "Warning density per scenario %.2f exceeds policy max %.2f.",
          density, policy.maxWarningDensityPerScenario()));
    }
    warningPolicyPass &= checkCeiling(caveats, "Insufficient-data", insufficient,
        policy.maxInsufficientDataScenarios());
    warningPolicyPass &= checkCeiling(caveats, "Sparse-data", sparse, policy.maxSparseDataScenarios());
    warningPolicyPass &= checkCeiling(caveats, "NaN-sanitized", nanSanitized, policy.maxNanSanitizedScenarios());
    warningPolicyPass &= checkCeiling(caveats, "Fallback-heavy", fallbackHeavy,
        policy.maxFallbackHeavyScenarios());

    boolean robust = !allFalsified
        && validRate >= minValidRate
        && topModelMatchRate >= MIN_MATCH_RATE
        && anomalyMatchRate >= MIN_MATCH_RATE
        && warningPolicyPass;
    RobustnessDecision decision;
    if (allFalsified || valid.isEmpty()) {
      decision = RobustnessDecision.INCONCLUSIVE;
    } else {
      decision = robust ? RobustnessDecision.PASS : RobustnessDecision.FAIL;
    }
    boolean qualityGatePassed = !allFalsified && validRate >= minValidRate && warningPolicyPass;
    boolean conclusive = decision != RobustnessDecision.INCONCLUSIVE;

    return new RobustnessSummary(
        total, valid.size(), validRate,
        Optional.of(baseline.id()),
        Optional.of(baseline.metrics().topModel()),
        Optional.of(baseline.metrics().anomalyConfirmed()),
        topModelMatchRate, anomalyMatchRate,
        allFalsified, qualityGatePassed, conclusive,
        insufficient, sparse, nanSanitized, fallbackHeavy, ratioExceeded,
        totalWarnings, density,
        warningPolicyPass, policy,
        robust, decision,
        dedupe(caveats));
  }

  private static boolean checkCeiling(List<String> caveats, String label, int count, long max) {
    if (count > max) {
      caveats.add(label + " scenario count " + count + " exceeds policy max " + max + ".");
      return false;
    }
    return true;
  }

  private static int countFlag(List<ScenarioResult> results, QualityFlag flag) {
    return (int) results.stream().filter(r -> r.hasFlag(flag)).count();
  }

  private static List<String> dedupe(List<String> caveats) {
    Set<String> unique = new LinkedHashSet<>(caveats);
    return List.copyOf(unique);
  }
}
