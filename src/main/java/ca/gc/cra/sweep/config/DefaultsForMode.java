package ca.gc.cra.sweep.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each sweep CLI command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys and CLI invocations.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param command target CLI command ({@code sweep} or {@code readiness})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws ConfigurationException if the command is unknown
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    String normalized = command.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "sweep" -> buildSweepDefaults();
      case "readiness" -> buildReadinessDefaults();
      default -> throw new ConfigurationException("Unsupported command: " + command);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("outDir", SweepConfig.DEFAULT_OUT_DIR.toString());
    return Map.copyOf(map);
  }

  private static Map<String, String> buildSweepDefaults() {
    SweepConfig defaults = SweepConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("mode", defaults.mode().wireName());
    map.put("datasetId", defaults.datasetId());
    map.put("maxScenarios", "");
    map.put("quick", Boolean.toString(defaults.quick()));
    map.put("resume", Boolean.toString(defaults.resume()));
    map.put("preflightOnly", Boolean.toString(defaults.preflightOnly()));
    map.put("baseConfig", "");
    map.put("policy", "");
    map.put("datasets", defaults.datasets().toString());
    map.put("evaluator.command", "");
    map.put("evaluator.models", String.join(",", defaults.evaluatorModels()));
    map.put("heartbeatSeconds", Long.toString(defaults.heartbeatPeriod().toSeconds()));
    map.put("heartbeatJoinMillis", Long.toString(defaults.heartbeatJoinTimeout().toMillis()));
    map.put("minValidRate", Double.toString(defaults.minValidRate()));
    return map;
  }

  private static Map<String, String> buildReadinessDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("summary", "");
    map.put("mode", "release");
    return map;
  }
}
