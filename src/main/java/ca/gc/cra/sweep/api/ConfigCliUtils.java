package ca.gc.cra.sweep.api;

import ca.gc.cra.sweep.config.ConfigurationException;
import ca.gc.cra.sweep.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} argument.
   *
   * @param args mutable CLI map
   * @return trimmed config path or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Loads the command's YAML section when a config file was named.
   *
   * @param configPath path given on the command line, or {@code null}
   * @param command YAML section to merge with {@code common}
   * @return flattened YAML settings, empty when no file was named
   * @throws ConfigurationException if the named file does not exist or is malformed
   * @throws IOException if the file cannot be read
   */
  static Optional<Map<String, String>> loadYaml(String configPath, String command) throws IOException {
    if (configPath == null) {
      return Optional.empty();
    }
    Path yamlPath = Path.of(configPath);
    if (!Files.exists(yamlPath)) {
      throw new ConfigurationException("Configuration file does not exist: " + yamlPath);
    }
    return YamlConfigLoader.load(yamlPath, command);
  }

  /**
   * Translates switch flags into configuration entries, overriding any {@code key=value} form.
   *
   * @param input parsed CLI input
   * @param args mutable CLI map receiving the entries
   * @param switches flag to {@code key=value} pair, e.g. {@code --no-resume} to {@code resume=false}
   */
  static void applySwitches(CliInput input, Map<String, String> args, Map<String, Map.Entry<String, String>> switches) {
    for (Map.Entry<String, Map.Entry<String, String>> entry : switches.entrySet()) {
      if (input.hasFlag(entry.getKey())) {
        args.put(entry.getValue().getKey(), entry.getValue().getValue());
      }
    }
  }
}
