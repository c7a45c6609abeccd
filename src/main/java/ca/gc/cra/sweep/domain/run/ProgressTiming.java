package ca.gc.cra.sweep.domain.run;

import java.util.OptionalDouble;

/**
 * <strong>What:</strong> Timing block recomputed for every progress and status write.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param elapsedSec seconds since the run started, rounded to milliseconds
 * @param completedScenarios scenarios finished or resumed so far
 * @param remainingScenarios scenarios still to run, never negative
 * @param etaSec projected seconds remaining; empty while nothing has completed
 * @since 0.1.0
 */
public record ProgressTiming(
    double elapsedSec, int completedScenarios, int remainingScenarios, OptionalDouble etaSec) {

  /**
   * Computes timing from elapsed time and scenario counts.
   *
   * @param elapsedMillis milliseconds since the run started
   * @param completedScenarios scenarios finished so far
   * @param scenarioTotal scenarios in the run
   * @return timing block
   */
  public static ProgressTiming compute(long elapsedMillis, int completedScenarios, int scenarioTotal) {
    double elapsed = Math.max(elapsedMillis, 0L) / 1000.0;
    int remaining = Math.max(scenarioTotal - completedScenarios, 0);
    OptionalDouble eta = OptionalDouble.empty();
    if (completedScenarios > 0 && scenarioTotal >= completedScenarios) {
      eta = OptionalDouble.of(round3((elapsed / completedScenarios) * remaining));
    }
    return new ProgressTiming(round3(elapsed), completedScenarios, remaining, eta);
  }

  private static double round3(double value) {
    return Math.round(value * 1000.0) / 1000.0;
  }
}
