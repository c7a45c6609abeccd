package ca.gc.cra.sweep.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {
  private static final Map<String, String> CLI_ALIASES = Map.of(
      "dataset", "datasetId",
      "dataset-id", "datasetId",
      "max-scenarios", "maxScenarios",
      "out", "outDir");
  private static final Set<String> BOOLEAN_KEYS = Set.of("quick", "resume", "preflightOnly", "verbose");
  private static final Set<String> INTEGER_KEYS =
      Set.of("maxScenarios", "heartbeatSeconds", "heartbeatJoinMillis");

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param command active command ({@code sweep} or {@code readiness})
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty); short aliases such as {@code out} are canonicalized
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws ConfigurationException when a boolean or integer setting is malformed
   */
  public static Map<String, String> buildEffectiveConfig(
      String command,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : canonicalize(cli);

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static Map<String, String> canonicalize(Map<String, String> cli) {
    Map<String, String> canonical = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : cli.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String target = CLI_ALIASES.getOrDefault(key, key);
      if (!target.equals(key) && cli.containsKey(target)) {
        throw new ConfigurationException("Both " + key + " and " + target + " were supplied");
      }
      canonical.put(target, entry.getValue());
    }
    return canonical;
  }

  private static void validate(Map<String, String> effective) {
    for (String key : BOOLEAN_KEYS) {
      String value = trim(effective.get(key));
      if (!value.isEmpty()) {
        String lower = value.toLowerCase(Locale.ROOT);
        if (!lower.equals("true") && !lower.equals("false")) {
          throw new ConfigurationException(key + " must be true or false (was '" + value + "')");
        }
      }
    }
    for (String key : INTEGER_KEYS) {
      String value = trim(effective.get(key));
      if (!value.isEmpty()) {
        try {
          Integer.parseInt(value);
        } catch (NumberFormatException ex) {
          throw new ConfigurationException(key + " must be an integer (was '" + value + "')", ex);
        }
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
