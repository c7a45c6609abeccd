package ca.gc.cra.sweep.api;

import ca.gc.cra.sweep.application.pipeline.ReleasePreflightUseCase;
import ca.gc.cra.sweep.application.pipeline.ScenarioExecutionException;
import ca.gc.cra.sweep.application.pipeline.SensitivitySweepUseCase;
import ca.gc.cra.sweep.application.pipeline.SweepOutcome;
import ca.gc.cra.sweep.application.pipeline.SweepRequest;
import ca.gc.cra.sweep.config.CompositionRoot;
import ca.gc.cra.sweep.config.ConfigMerger;
import ca.gc.cra.sweep.config.ConfigurationException;
import ca.gc.cra.sweep.config.DefaultsForMode;
import ca.gc.cra.sweep.config.ReleaseEvidencePolicyLoader;
import ca.gc.cra.sweep.config.SweepConfig;
import ca.gc.cra.sweep.domain.dataset.DatasetException;
import ca.gc.cra.sweep.domain.policy.ReleaseEvidencePolicy;
import ca.gc.cra.sweep.domain.preflight.PreflightReason;
import ca.gc.cra.sweep.domain.preflight.PreflightReport;
import ca.gc.cra.sweep.domain.robustness.RunSummary;
import ca.gc.cra.sweep.domain.scenario.ScenarioConfig;
import ca.gc.cra.sweep.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.sweep.logging.LoggingConfigurator;
import ca.gc.cra.sweep.validation.Paths;
import java.io.IOException;
import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for running the sensitivity sweep or its release preflight.
 *
 * @since 0.1.0
 */
public final class SweepCli {
  private static final Logger log = LoggerFactory.getLogger(SweepCli.class);
  private static final String COMMAND = "sweep";
  private static final String SUMMARY_USAGE =
      "usage: sweep [mode=release|smoke|iterative] [datasetId=ID] [maxScenarios=N] [outDir=PATH] "
          + "[datasets=PATH] [baseConfig=PATH] [policy=PATH] [evaluator.command=CMD] "
          + "[evaluator.models=A,B] [config=PATH] [--quick] [--no-resume] [--preflight-only] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      Sensitivity sweep

      Usage:
        sweep [options]

      Options:
        mode=release|smoke|iterative  Execution mode (default release)
        datasetId=ID                  Dataset to evaluate (default voynich_real)
        maxScenarios=N                Scenario cap; rejected in release mode
        outDir=PATH                   Artifact directory (default core_status/core_audit)
        datasets=PATH                 YAML dataset catalog (default config/datasets.yaml)
        baseConfig=PATH               JSON base model parameters
        policy=PATH                   JSON release evidence policy (defaults apply when absent)
        evaluator.command=CMD         External evaluator command line
        evaluator.models=A,B          Candidate models in evaluation order
        heartbeatSeconds=N            Full-battery heartbeat period (default 30)
        minValidRate=R                Minimum valid scenario rate (default 0.80)
        config=PATH                   YAML file; reads the common and sweep sections
        --quick                       Iterative shortcut: synthetic dataset, 5 scenarios
        --no-resume                   Ignore any existing checkpoint
        --preflight-only              Validate release prerequisites without running scenarios
        metricsExporter=otlp|none     Configure metrics exporter (default otlp)
        otelEndpoint=URL              OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V    Comma-separated OTel resource attributes
        --verbose                     Enable DEBUG logging
        --help                        Show this message

      Exit codes:
        0 success, 1 preflight blocked or dataset unavailable, 2 invalid arguments, 3 I/O failure,
        4 configuration error, 5 scenario failure, 130 interrupted
      """;
  private static final Map<String, Map.Entry<String, String>> SWITCHES = Map.of(
      "--quick", new SimpleImmutableEntry<>("quick", "true"),
      "--no-resume", new SimpleImmutableEntry<>("resume", "false"),
      "--preflight-only", new SimpleImmutableEntry<>("preflightOnly", "true"));

  /**
   * Builds the composition root and the sweep use case for a configuration.
   */
  interface Wiring {
    CompositionRoot root(SweepConfig config, TelemetrySettings telemetry);

    SensitivitySweepUseCase sweep(CompositionRoot root);
  }

  static final Wiring DEFAULT_WIRING = new Wiring() {
    @Override
    public CompositionRoot root(SweepConfig config, TelemetrySettings telemetry) {
      return new CompositionRoot(config, telemetry);
    }

    @Override
    public SensitivitySweepUseCase sweep(CompositionRoot root) {
      return root.sweepUseCase();
    }
  };

  private SweepCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the sweep CLI logic using structured logging and exit codes.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, DEFAULT_WIRING);
  }

  static ExitCode run(String[] args, Wiring wiring) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for sweep CLI");
    }

    List<String> unknown = input.unknownFlags(SWITCHES.keySet());
    if (!unknown.isEmpty()) {
      log.error("Unknown flag(s): {}", unknown);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    ConfigCliUtils.applySwitches(input, kv, SWITCHES);

    SweepConfig config;
    TelemetrySettings telemetry;
    try {
      Optional<Map<String, String>> yaml =
          ConfigCliUtils.loadYaml(ConfigCliUtils.extractConfigPath(kv), COMMAND);
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          COMMAND, yaml, kv, DefaultsForMode.asFlatMap(COMMAND), log::warn);
      Map<String, String> configInputs = new LinkedHashMap<>(effective);
      telemetry = TelemetryConfigurator.configureMetrics(configInputs);
      config = SweepConfig.fromMap(configInputs);
      Paths.requireWritableDir("outDir", config.outDir());
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid sweep configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    log.info("Configured sensitivity sweep: mode={}, dataset={}, maxScenarios={}, outDir={}, metricsExporter={}",
        config.mode().wireName(),
        config.datasetId(),
        config.maxScenarios().isPresent() ? config.maxScenarios().getAsInt() : "none",
        config.outDir(),
        telemetry.exporter());

    try (CompositionRoot root = wiring.root(config, telemetry)) {
      ReleaseEvidencePolicyLoader loader = root.documentLoader();
      ReleaseEvidencePolicy policy = loader.loadPolicy(config.policy());
      ScenarioConfig base = loader.loadBaseConfig(config.baseConfig());
      SweepRequest request = config.toRequest(base, policy);
      if (config.preflightOnly()) {
        return runPreflight(root.preflightUseCase(), request);
      }
      return runSweep(wiring.sweep(root), request);
    } catch (DatasetException ex) {
      log.error("Dataset {} unavailable: {}", ex.datasetId(), ex.getMessage());
      return ExitCode.BLOCKED;
    } catch (ScenarioExecutionException ex) {
      if (ex.getCause() instanceof InterruptedException) {
        Thread.currentThread().interrupt();
        log.error("Sensitivity sweep interrupted during scenario {}; checkpoint kept for resume", ex.scenarioId());
        return ExitCode.INTERRUPTED;
      }
      log.error("Sensitivity sweep failed at scenario {} (#{}); re-run to resume from the checkpoint",
          ex.scenarioId(), ex.scenarioIndex(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (IOException ex) {
      log.error("Sensitivity sweep I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Sensitivity sweep configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in sensitivity sweep", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode runPreflight(ReleasePreflightUseCase preflight, SweepRequest request)
      throws IOException {
    PreflightReport report = preflight.run(request);
    Map<String, Object> rows = new LinkedHashMap<>();
    rows.put("Status", report.status());
    rows.put("Dataset", report.datasetId());
    rows.put("Policy version", report.policyVersion());
    rows.put("Scenarios expected", report.scenarioCountExpected());
    rows.put("Reason codes", report.reasons().stream().map(PreflightReason::name).toList());
    rows.put("Dataset policy", report.datasetPolicy().pass() ? "pass" : report.datasetPolicy().reasons());
    CliPrinter.printReport("Release preflight:", rows);
    return report.passed() ? ExitCode.SUCCESS : ExitCode.BLOCKED;
  }

  private static ExitCode runSweep(SensitivitySweepUseCase sweep, SweepRequest request)
      throws DatasetException, ScenarioExecutionException, IOException {
    SweepOutcome outcome = sweep.run(request);
    RunSummary summary = outcome.summary();
    Map<String, Object> rows = new LinkedHashMap<>();
    rows.put("Run id", summary.runId());
    rows.put("Mode", summary.mode().wireName());
    rows.put("Scenarios", summary.scenarioCountExecuted() + "/" + summary.scenarioCountExpected()
        + " (" + outcome.resumedScenarios() + " resumed)");
    rows.put("Robustness", summary.robustness().decision());
    rows.put("Quality gate", summary.robustness().qualityGatePassed() ? "passed" : "failed");
    rows.put("Release evidence", summary.releaseEvidenceReady() ? "ready" : summary.readiness().tokens());
    rows.put("Summary", outcome.locations().latest());
    rows.put("Diagnostics", outcome.locations().diagnostics());
    CliPrinter.printReport("Sensitivity sweep complete:", rows);
    return ExitCode.SUCCESS;
  }
}
