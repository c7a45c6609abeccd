package ca.gc.cra.sweep.config;

import ca.gc.cra.sweep.application.pipeline.SweepRequest;
import ca.gc.cra.sweep.application.progress.HeartbeatSettings;
import ca.gc.cra.sweep.domain.policy.ReleaseEvidencePolicy;
import ca.gc.cra.sweep.domain.run.SweepMode;
import ca.gc.cra.sweep.domain.scenario.ScenarioConfig;
import ca.gc.cra.sweep.validation.Numbers;
import ca.gc.cra.sweep.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Typed, normalized configuration for one sensitivity sweep invocation.
 * <p><strong>Why:</strong> Mode shortcuts (quick, iterative, smoke) rewrite the dataset and scenario cap; doing
 * it once here keeps the use cases free of CLI concerns.</p>
 * <p><strong>Role:</strong> Configuration record bound from the merged flat map and handed to
 * {@link CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse and bound every sweep setting.</li>
 *   <li>Apply mode normalization and reject contradictory combinations.</li>
 *   <li>Produce the {@link SweepRequest} consumed by the use cases.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param mode normalized execution mode
 * @param datasetId dataset to evaluate
 * @param maxScenarios optional scenario cap; empty in release mode
 * @param quick whether the quick shortcut was requested
 * @param resume whether checkpoint rows may be reused
 * @param preflightOnly validate release prerequisites without executing scenarios
 * @param outDir directory receiving every artifact
 * @param baseConfig optional JSON file with base model parameters
 * @param policy optional JSON release evidence policy
 * @param datasets YAML dataset catalog
 * @param evaluatorCommand argv prefix of the external evaluator; empty when not configured
 * @param evaluatorModels candidate model names in evaluation order
 * @param heartbeatPeriod interval between full-battery heartbeats
 * @param heartbeatJoinTimeout bounded wait when stopping the heartbeat worker
 * @param minValidRate minimum share of valid scenarios for the quality gate
 * @since 0.1.0
 */
public record SweepConfig(
    SweepMode mode,
    String datasetId,
    OptionalInt maxScenarios,
    boolean quick,
    boolean resume,
    boolean preflightOnly,
    Path outDir,
    Optional<Path> baseConfig,
    Optional<Path> policy,
    Path datasets,
    List<String> evaluatorCommand,
    List<String> evaluatorModels,
    Duration heartbeatPeriod,
    Duration heartbeatJoinTimeout,
    double minValidRate) {

  /** Dataset used by release and smoke runs unless overridden. */
  public static final String DEFAULT_DATASET_ID = "voynich_real";
  /** Dataset substituted for the default one in iterative runs. */
  public static final String ITERATIVE_DATASET_ID = "voynich_synthetic_grammar";
  /** Scenario cap applied to iterative runs when none is given. */
  public static final int ITERATIVE_MAX_SCENARIOS = 5;
  /** Scenario cap applied to smoke runs when none is given. */
  public static final int SMOKE_MAX_SCENARIOS = 1;

  static final Path DEFAULT_OUT_DIR = Path.of("core_status", "core_audit");
  private static final Path DEFAULT_DATASETS = Path.of("config", "datasets.yaml");
  private static final List<String> DEFAULT_MODELS = List.of(
      "adjacency_grammar",
      "containment_grammar",
      "diagram_annotation",
      "procedural_generation",
      "glossalial_system",
      "meaningful_construct");

  public SweepConfig {
    Objects.requireNonNull(mode, "mode");
    datasetId = Strings.requireIdentifier("datasetId", datasetId);
    Objects.requireNonNull(maxScenarios, "maxScenarios");
    Objects.requireNonNull(outDir, "outDir");
    Objects.requireNonNull(baseConfig, "baseConfig");
    Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(datasets, "datasets");
    evaluatorCommand = List.copyOf(Objects.requireNonNull(evaluatorCommand, "evaluatorCommand"));
    evaluatorModels = List.copyOf(Objects.requireNonNull(evaluatorModels, "evaluatorModels"));
    Objects.requireNonNull(heartbeatPeriod, "heartbeatPeriod");
    Objects.requireNonNull(heartbeatJoinTimeout, "heartbeatJoinTimeout");
    Numbers.requireRange("minValidRate", minValidRate, 0.0, 1.0);

    if (maxScenarios.isPresent() && maxScenarios.getAsInt() < 1) {
      throw new ConfigurationException("maxScenarios must be at least 1");
    }
    if (evaluatorModels.isEmpty()) {
      throw new ConfigurationException("evaluator.models must name at least one model");
    }
    if (quick && mode != SweepMode.ITERATIVE) {
      throw new ConfigurationException("Quick mode runs as iterative mode (was " + mode.wireName() + ")");
    }
    if (mode == SweepMode.RELEASE && maxScenarios.isPresent()) {
      throw new ConfigurationException(
          "Release mode requires full scenario execution; do not pass --max-scenarios.");
    }
    if (preflightOnly && mode != SweepMode.RELEASE) {
      throw new ConfigurationException("Preflight-only mode requires --mode release.");
    }
  }

  /**
   * Returns the release-mode defaults.
   *
   * @return default configuration
   */
  public static SweepConfig defaults() {
    return new SweepConfig(
        SweepMode.RELEASE,
        DEFAULT_DATASET_ID,
        OptionalInt.empty(),
        false,
        true,
        false,
        DEFAULT_OUT_DIR,
        Optional.empty(),
        Optional.empty(),
        DEFAULT_DATASETS,
        List.of(),
        DEFAULT_MODELS,
        HeartbeatSettings.DEFAULT_PERIOD,
        HeartbeatSettings.DEFAULT_JOIN_TIMEOUT,
        0.80);
  }

  /**
   * Binds and normalizes a merged flat configuration map.
   *
   * @param options merged settings keyed by their flat names
   * @return normalized configuration
   * @throws ConfigurationException if a value is malformed or the combination is contradictory
   */
  public static SweepConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    SweepConfig defaults = defaults();

    SweepMode mode = parseMode(options.get("mode"), defaults.mode());
    String datasetId = nonBlankOr(options.get("datasetId"), defaults.datasetId());
    OptionalInt maxScenarios = parseOptionalInt("maxScenarios", options.get("maxScenarios"));
    boolean quick = parseBoolean(options.get("quick"), defaults.quick());
    boolean resume = parseBoolean(options.get("resume"), defaults.resume());
    boolean preflightOnly = parseBoolean(options.get("preflightOnly"), defaults.preflightOnly());

    if (preflightOnly && mode != SweepMode.RELEASE) {
      throw new ConfigurationException("Preflight-only mode requires --mode release.");
    }
    if (quick) {
      if (mode == SweepMode.RELEASE) {
        throw new ConfigurationException("Quick mode cannot be combined with release mode.");
      }
      mode = SweepMode.ITERATIVE;
    }
    if (mode == SweepMode.ITERATIVE) {
      if (datasetId.equals(DEFAULT_DATASET_ID)) {
        datasetId = ITERATIVE_DATASET_ID;
      }
      if (maxScenarios.isEmpty()) {
        maxScenarios = OptionalInt.of(ITERATIVE_MAX_SCENARIOS);
      }
    }
    if (mode == SweepMode.SMOKE && maxScenarios.isEmpty()) {
      maxScenarios = OptionalInt.of(SMOKE_MAX_SCENARIOS);
    }
    if (mode == SweepMode.RELEASE && maxScenarios.isPresent()) {
      throw new ConfigurationException(
          "Release mode requires full scenario execution; do not pass --max-scenarios.");
    }

    Path outDir = parsePath("outDir", nonBlankOr(options.get("outDir"), defaults.outDir().toString()));
    Optional<Path> baseConfig = optionalPath("baseConfig", options.get("baseConfig"));
    Optional<Path> policy = optionalPath("policy", options.get("policy"));
    Path datasets = parsePath("datasets", nonBlankOr(options.get("datasets"), defaults.datasets().toString()));
    List<String> command = split(options.get("evaluator.command"), "\\s+");
    List<String> models = split(options.get("evaluator.models"), ",");
    if (models.isEmpty()) {
      models = defaults.evaluatorModels();
    }
    long heartbeatSeconds = parseBoundedLong(
        "heartbeatSeconds", options.get("heartbeatSeconds"), defaults.heartbeatPeriod().toSeconds(), 1, 3_600);
    long joinMillis = parseBoundedLong(
        "heartbeatJoinMillis", options.get("heartbeatJoinMillis"),
        defaults.heartbeatJoinTimeout().toMillis(), 0, 60_000);
    double minValidRate = parseDouble("minValidRate", options.get("minValidRate"), defaults.minValidRate());

    return new SweepConfig(
        mode,
        datasetId,
        maxScenarios,
        quick,
        resume,
        preflightOnly,
        outDir,
        baseConfig,
        policy,
        datasets,
        command,
        models,
        Duration.ofSeconds(heartbeatSeconds),
        Duration.ofMillis(joinMillis),
        minValidRate);
  }

  /**
   * Builds the use-case request for this configuration.
   *
   * @param base base model parameters loaded from {@link #baseConfig()}
   * @param evidencePolicy effective release evidence policy
   * @return sweep request
   */
  public SweepRequest toRequest(ScenarioConfig base, ReleaseEvidencePolicy evidencePolicy) {
    return new SweepRequest(mode, datasetId, maxScenarios, quick, resume, base, evidencePolicy);
  }

  /**
   * Returns the heartbeat timing as a settings object.
   *
   * @return heartbeat settings
   */
  public HeartbeatSettings heartbeatSettings() {
    return new HeartbeatSettings(heartbeatPeriod, heartbeatJoinTimeout);
  }

  private static SweepMode parseMode(String value, SweepMode defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return SweepMode.fromString(value);
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException("Unsupported sensitivity sweep mode: " + value.trim(), ex);
    }
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static OptionalInt parseOptionalInt(String name, String value) {
    if (value == null || value.isBlank()) {
      return OptionalInt.empty();
    }
    try {
      int parsed = Integer.parseInt(value.trim());
      if (parsed < 1) {
        throw new ConfigurationException(name + " must be at least 1 (was " + parsed + ")");
      }
      return OptionalInt.of(parsed);
    } catch (NumberFormatException ex) {
      throw new ConfigurationException(name + " must be an integer (was '" + value + "')", ex);
    }
  }

  private static long parseBoundedLong(String name, String value, long defaultValue, long min, long max) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Numbers.requireRange(name, Long.parseLong(value.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new ConfigurationException(name + " must be an integer (was '" + value + "')", ex);
    }
  }

  private static double parseDouble(String name, String value, double defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException ex) {
      throw new ConfigurationException(name + " must be a number (was '" + value + "')", ex);
    }
  }

  private static Path parsePath(String name, String value) {
    try {
      return Path.of(value.trim()).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new ConfigurationException(name + " is not a valid path: " + value, ex);
    }
  }

  private static Optional<Path> optionalPath(String name, String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(parsePath(name, value));
  }

  private static String nonBlankOr(String value, String defaultValue) {
    return value == null || value.isBlank() ? defaultValue : value.trim();
  }

  private static List<String> split(String value, String separator) {
    List<String> parts = new ArrayList<>();
    if (value == null || value.isBlank()) {
      return parts;
    }
    for (String part : value.trim().split(separator)) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        parts.add(trimmed);
      }
    }
    return parts;
  }
}
