package ca.gc.cra.sweep.application.sweep;

import ca.gc.cra.sweep.domain.result.WarningCategory;
import ca.gc.cra.sweep.domain.result.WarningSummary;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies captured warning messages into {@link WarningCategory} counts.
 *
 * @since 0.1.0
 */
public final class WarningClassifier {
  static final int SAMPLE_LIMIT = 5;

  private WarningClassifier() {}

  /**
   * Summarizes captured messages.
   *
   * @param messages messages in emission order
   * @return classified summary
   */
  public static WarningSummary summarize(List<String> messages) {
    Map<WarningCategory, Integer> counts = new EnumMap<>(WarningCategory.class);
    int related = 0;
    for (WarningCategory category : WarningCategory.values()) {
      int count = 0;
      for (String message : messages) {
        if (category.matches(message)) {
          count++;
        }
      }
      counts.put(category, count);
      related += count;
    }
    int total = messages.size();
    double ratio = total > 0 ? (double) related / total : 0.0;
    List<String> samples = messages.subList(0, Math.min(SAMPLE_LIMIT, total));
    return new WarningSummary(total, counts, related, ratio, samples);
  }
}
