package ca.gc.cra.sweep.domain.result;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Classified warning counts captured while one scenario ran.
 * <p><strong>Role:</strong> Part of {@link ScenarioResult}; feeds quality flags and warning-policy ceilings.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param totalWarnings number of captured messages
 * @param categoryCounts per-category counts; absent categories are stored as zero
 * @param fallbackRelatedWarnings sum of all category counts
 * @param fallbackWarningRatio fallback-related share of all warnings, {@code 0.0} when none were emitted
 * @param sampleMessages first few captured messages for diagnostics
 * @since 0.1.0
 */
public record WarningSummary(
    int totalWarnings,
    Map<WarningCategory, Integer> categoryCounts,
    int fallbackRelatedWarnings,
    double fallbackWarningRatio,
    List<String> sampleMessages) {

  private static final WarningSummary EMPTY = new WarningSummary(0, Map.of(), 0, 0.0, List.of());

  public WarningSummary {
    if (totalWarnings < 0) {
      throw new IllegalArgumentException("totalWarnings must be non-negative");
    }
    Objects.requireNonNull(categoryCounts, "categoryCounts");
    EnumMap<WarningCategory, Integer> copy = new EnumMap<>(WarningCategory.class);
    for (WarningCategory category : WarningCategory.values()) {
      copy.put(category, 0);
    }
    categoryCounts.forEach((category, count) -> copy.put(
        Objects.requireNonNull(category, "category"), Objects.requireNonNull(count, "count")));
    categoryCounts = Collections.unmodifiableMap(copy);
    sampleMessages = List.copyOf(Objects.requireNonNull(sampleMessages, "sampleMessages"));
  }

  /**
   * Returns a summary for a scenario that emitted no warnings.
   *
   * @return shared empty summary
   */
  public static WarningSummary empty() {
    return EMPTY;
  }

  /**
   * Returns the count for a single category.
   *
   * @param category category to query
   * @return count, zero when the category never matched
   */
  public int count(WarningCategory category) {
    return categoryCounts.getOrDefault(category, 0);
  }
}
