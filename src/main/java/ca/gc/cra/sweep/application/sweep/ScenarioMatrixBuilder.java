package ca.gc.cra.sweep.application.sweep;

import ca.gc.cra.sweep.domain.scenario.ScenarioConfig;
import ca.gc.cra.sweep.domain.scenario.ScenarioFamily;
import ca.gc.cra.sweep.domain.scenario.ScenarioSpec;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the ordered scenario matrix from one base configuration.
 *
 * <p>The matrix is a baseline, a threshold sweep over {@code [0.40, 0.80]} in steps of {@code 0.05}, two
 * sensitivity scales, and one weight permutation per dimension found under
 * {@code evaluation.dimension_weights}. Output depends only on the input.</p>
 *
 * @since 0.1.0
 */
public final class ScenarioMatrixBuilder {
  /** Scenario ids kept by the reduced matrix. */
  public static final Set<String> REDUCED_SCENARIO_IDS = Set.of(
      "baseline", "threshold_0.50", "threshold_0.70", "sensitivity_x1.20", "weights_focus_robustness");

  static final double THRESHOLD_START = 0.40;
  static final double THRESHOLD_STEP = 0.05;
  static final int THRESHOLD_STEPS = 9;
  static final double[] SENSITIVITY_FACTORS = {0.8, 1.2};
  static final double WEIGHT_FOCUS_FACTOR = 1.2;

  /**
   * Builds the full matrix.
   *
   * @param base base configuration
   * @return scenarios in declared order
   */
  public List<ScenarioSpec> build(ScenarioConfig base) {
    Objects.requireNonNull(base, "base");
    List<ScenarioSpec> scenarios = new ArrayList<>();
    scenarios.add(new ScenarioSpec("baseline", ScenarioFamily.BASELINE, base));

    for (int step = 0; step < THRESHOLD_STEPS; step++) {
      double threshold = round(THRESHOLD_START + step * THRESHOLD_STEP, 2);
      scenarios.add(new ScenarioSpec(
          String.format(Locale.ROOT, "threshold_%.2f", threshold),
          ScenarioFamily.THRESHOLD_SWEEP,
          applyThreshold(base, threshold)));
    }

    for (double factor : SENSITIVITY_FACTORS) {
      scenarios.add(new ScenarioSpec(
          String.format(Locale.ROOT, "sensitivity_x%.2f", factor),
          ScenarioFamily.SENSITIVITY_SCALE,
          applySensitivityScale(base, factor)));
    }

    for (String dimension : dimensionWeights(base.asMap()).keySet()) {
      scenarios.add(new ScenarioSpec(
          "weights_focus_" + dimension,
          ScenarioFamily.WEIGHT_PERMUTATION,
          applyWeightFocus(base, dimension, WEIGHT_FOCUS_FACTOR)));
    }
    return List.copyOf(scenarios);
  }

  /**
   * Builds the reduced matrix used by iterative runs.
   *
   * @param base base configuration
   * @return allow-listed scenarios in matrix order, or the full matrix when no id matches
   */
  public List<ScenarioSpec> buildReduced(ScenarioConfig base) {
    return reduce(build(base));
  }

  /**
   * Filters a matrix down to {@link #REDUCED_SCENARIO_IDS}.
   *
   * @param all full matrix
   * @return allow-listed scenarios, or {@code all} when none match
   */
  public static List<ScenarioSpec> reduce(List<ScenarioSpec> all) {
    List<ScenarioSpec> selected = all.stream()
        .filter(spec -> REDUCED_SCENARIO_IDS.contains(spec.id()))
        .toList();
    return selected.isEmpty() ? List.copyOf(all) : selected;
  }

  static ScenarioConfig applyThreshold(ScenarioConfig base, double threshold) {
    Map<String, Object> copy = base.mutableCopy();
    if (copy.get("disconfirmation") instanceof Map<?, ?> raw) {
      Map<String, Object> section = stringKeyed(raw);
      if (section.get("perturbation_battery") instanceof List<?> battery) {
        List<Object> updated = new ArrayList<>(battery.size());
        for (Object item : battery) {
          if (item instanceof Map<?, ?> entry) {
            Map<String, Object> perturbation = stringKeyed(entry);
            perturbation.put("failure_threshold", threshold);
            updated.add(perturbation);
          } else {
            updated.add(item);
          }
        }
        section.put("perturbation_battery", updated);
      }
      copy.put("disconfirmation", section);
    }
    return ScenarioConfig.of(copy);
  }

  static ScenarioConfig applySensitivityScale(ScenarioConfig base, double factor) {
    Map<String, Object> copy = base.mutableCopy();
    if (copy.get("models") instanceof Map<?, ?> raw) {
      Map<String, Object> models = stringKeyed(raw);
      for (Map.Entry<String, Object> model : models.entrySet()) {
        if (model.getValue() instanceof Map<?, ?> rawModel
            && rawModel.get("sensitivities") instanceof Map<?, ?> rawSensitivities) {
          Map<String, Object> modelData = stringKeyed(rawModel);
          Map<String, Object> sensitivities = stringKeyed(rawSensitivities);
          for (Map.Entry<String, Object> entry : sensitivities.entrySet()) {
            if (entry.getValue() instanceof Number value) {
              entry.setValue(round(value.doubleValue() * factor, 6));
            }
          }
          modelData.put("sensitivities", sensitivities);
          model.setValue(modelData);
        }
      }
      copy.put("models", models);
    }
    return ScenarioConfig.of(copy);
  }

  static ScenarioConfig applyWeightFocus(ScenarioConfig base, String focus, double factor) {
    Map<String, Object> copy = base.mutableCopy();
    Map<String, Object> evaluation = copy.get("evaluation") instanceof Map<?, ?> raw
        ? stringKeyed(raw)
        : new LinkedHashMap<>();
    Map<String, Double> adjusted = new LinkedHashMap<>();
    dimensionWeights(copy).forEach((dimension, weight) ->
        adjusted.put(dimension, dimension.equals(focus) ? weight * factor : weight));
    evaluation.put("dimension_weights", new LinkedHashMap<String, Object>(normalize(adjusted)));
    copy.put("evaluation", evaluation);
    return ScenarioConfig.of(copy);
  }

  static Map<String, Double> normalize(Map<String, Double> weights) {
    double total = weights.values().stream().mapToDouble(Double::doubleValue).sum();
    if (total <= 0) {
      return weights;
    }
    Map<String, Double> normalized = new LinkedHashMap<>();
    weights.forEach((dimension, weight) -> normalized.put(dimension, weight / total));
    return normalized;
  }

  private static Map<String, Double> dimensionWeights(Map<String, Object> root) {
    Map<String, Double> weights = new LinkedHashMap<>();
    if (root.get("evaluation") instanceof Map<?, ?> evaluation
        && evaluation.get("dimension_weights") instanceof Map<?, ?> raw) {
      for (Map.Entry<?, ?> entry : raw.entrySet()) {
        if (!(entry.getValue() instanceof Number number)) {
          throw new IllegalArgumentException(
              "dimension weight " + entry.getKey() + " must be numeric");
        }
        weights.put(String.valueOf(entry.getKey()), number.doubleValue());
      }
    }
    return weights;
  }

  private static Map<String, Object> stringKeyed(Map<?, ?> map) {
    Map<String, Object> copy = new LinkedHashMap<>();
    map.forEach((key, value) -> copy.put(String.valueOf(key), value));
    return copy;
  }

  private static double round(double value, int places) {
    double scale = Math.pow(10, places);
    return Math.round(value * scale) / scale;
  }
}
