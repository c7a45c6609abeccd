package ca.gc.cra.sweep.api;

import ca.gc.cra.sweep.application.sweep.ReleaseReadinessGate;
import ca.gc.cra.sweep.config.ConfigMerger;
import ca.gc.cra.sweep.config.DefaultsForMode;
import ca.gc.cra.sweep.domain.robustness.ReadinessEvidence;
import ca.gc.cra.sweep.domain.robustness.ReadinessVerdict;
import ca.gc.cra.sweep.domain.run.SweepMode;
import ca.gc.cra.sweep.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.sweep.infrastructure.persistence.ArtifactLayout;
import ca.gc.cra.sweep.infrastructure.persistence.json.JsonSupport;
import ca.gc.cra.sweep.infrastructure.persistence.json.SweepDocuments;
import ca.gc.cra.sweep.logging.LoggingConfigurator;
import ca.gc.cra.sweep.validation.Paths;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Re-evaluates release readiness from a written run summary.
 * <p><strong>Why:</strong> Release checks run long after the sweep; recomputing the gate from the recorded
 * evidence catches summaries edited by hand or written by an older gate.</p>
 * <p><strong>Role:</strong> CLI adapter over {@link ReleaseReadinessGate}; never executes a scenario.</p>
 * <p><strong>Observability:</strong> Logs a warning when the recorded verdict differs from the recomputed
 * one.</p>
 *
 * @since 0.1.0
 */
public final class ReadinessAuditCli {
  private static final Logger log = LoggerFactory.getLogger(ReadinessAuditCli.class);
  private static final String COMMAND = "readiness";
  private static final String SUMMARY_USAGE =
      "usage: readiness [summary=PATH] [outDir=PATH] [mode=release|smoke|iterative] [config=PATH]";
  private static final String HELP_TEXT = """
      Release readiness audit

      Usage:
        readiness [options]

      Options:
        summary=PATH                  Run summary document to audit
        outDir=PATH                   Artifact directory used when summary is omitted
        mode=release|smoke|iterative  Selects the summary file name when summary is omitted (default release)
        config=PATH                   YAML file; reads the common and readiness sections
        --verbose                     Enable DEBUG logging
        --help                        Show this message

      Exit codes:
        0 release evidence ready, 1 not ready or unreadable evidence, 2 invalid arguments, 3 I/O failure,
        4 configuration error
      """;

  private ReadinessAuditCli() {}

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
   * Executes the readiness audit.
   *
   * @param args raw CLI arguments
   * @return {@link ExitCode#SUCCESS} when release evidence is ready, {@link ExitCode#BLOCKED} otherwise
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for readiness CLI");
    }
    List<String> unknown = input.unknownFlags(Set.of());
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

    Path summaryPath;
    try {
      Optional<Map<String, String>> yaml =
          ConfigCliUtils.loadYaml(ConfigCliUtils.extractConfigPath(kv), COMMAND);
      Map<String, String> effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          COMMAND, yaml, kv, DefaultsForMode.asFlatMap(COMMAND), log::warn));
      TelemetrySettings telemetry = TelemetryConfigurator.configureMetrics(effective);
      log.debug("Readiness audit does not export metrics (exporter setting {})", telemetry.exporter());
      summaryPath = resolveSummaryPath(effective);
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid readiness configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    try {
      Paths.requireReadableFile("summary", summaryPath);
    } catch (IllegalArgumentException ex) {
      log.error("Run summary unavailable: {}", ex.getMessage());
      return ExitCode.BLOCKED;
    }

    Map<String, Object> document;
    try {
      document = new JsonSupport().parseObject(Files.readString(summaryPath, StandardCharsets.UTF_8));
    } catch (IOException ex) {
      log.error("Unable to read run summary {}", summaryPath, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Run summary {} is not valid JSON: {}", summaryPath, ex.getMessage());
      return ExitCode.BLOCKED;
    }

    ReadinessEvidence evidence;
    try {
      evidence = SweepDocuments.readinessEvidence(document);
    } catch (IllegalArgumentException ex) {
      log.error("Run summary {} lacks readiness evidence: {}", summaryPath, ex.getMessage());
      return ExitCode.BLOCKED;
    }

    ReadinessVerdict verdict = ReleaseReadinessGate.evaluate(evidence);
    recordedReady(document).ifPresent(recorded -> {
      if (recorded != verdict.releaseEvidenceReady()) {
        log.warn("Recorded release_evidence_ready={} disagrees with recomputed verdict {} for {}",
            recorded, verdict.releaseEvidenceReady(), summaryPath);
      }
    });

    Map<String, Object> rows = new LinkedHashMap<>();
    rows.put("Summary", summaryPath);
    rows.put("Execution mode", evidence.mode().wireName());
    rows.put("Scenarios", evidence.scenarioCountExecuted() + "/" + evidence.scenarioCountExpected());
    rows.put("Release evidence", verdict.releaseEvidenceReady() ? "ready" : "not ready");
    rows.put("Failures", verdict.tokens());
    CliPrinter.printReport("Release readiness audit:", rows);
    if (verdict.releaseEvidenceReady()) {
      log.info("Release evidence ready: {}", summaryPath);
      return ExitCode.SUCCESS;
    }
    log.error("Release evidence not ready ({}): {}", summaryPath, verdict.tokens());
    return ExitCode.BLOCKED;
  }

  private static Path resolveSummaryPath(Map<String, String> effective) {
    String explicit = effective.get("summary");
    if (explicit != null && !explicit.isBlank()) {
      return Path.of(explicit.trim()).toAbsolutePath().normalize();
    }
    SweepMode mode = SweepMode.fromString(effective.getOrDefault("mode", "release"));
    Path outDir = Path.of(effective.get("outDir").trim()).toAbsolutePath().normalize();
    return new ArtifactLayout(outDir).summary(mode);
  }

  private static Optional<Boolean> recordedReady(Map<String, Object> document) {
    Object node = document;
    for (String key : new String[] {"results", "summary"}) {
      if (node instanceof Map<?, ?> map && map.get(key) instanceof Map<?, ?> nested) {
        node = nested;
      }
    }
    if (node instanceof Map<?, ?> map && map.get("release_evidence_ready") instanceof Boolean ready) {
      return Optional.of(ready);
    }
    return Optional.empty();
  }
}
