package ca.gc.cra.sweep.infrastructure.evaluation;

import ca.gc.cra.sweep.application.port.DiagnosticSink;
import ca.gc.cra.sweep.application.port.EvaluationSession;
import ca.gc.cra.sweep.domain.result.ScenarioMetrics;
import ca.gc.cra.sweep.infrastructure.persistence.json.JsonSupport;
import ca.gc.cra.sweep.infrastructure.persistence.json.SweepDocuments;
import ca.gc.cra.sweep.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One scenario's worth of evaluator invocations sharing a config file.
 *
 * <p>Stdout goes to a temp file so that draining stderr on the calling thread cannot deadlock on a full
 * stdout pipe.</p>
 *
 * @since 0.1.0
 */
final class ProcessEvaluationSession implements EvaluationSession {
  private static final Logger log = LoggerFactory.getLogger(ProcessEvaluationSession.class);
  static final String PREDICT = "predict";
  static final String BATTERY = "battery";
  static final String REPORT = "report";

  private final List<String> command;
  private final List<String> models;
  private final String datasetId;
  private final Path config;
  private final Path workDir;
  private final JsonSupport json;
  private final DiagnosticSink diagnostics;

  ProcessEvaluationSession(
      List<String> command,
      List<String> models,
      String datasetId,
      Path config,
      Path workDir,
      JsonSupport json,
      DiagnosticSink diagnostics) {
    this.command = command;
    this.models = models;
    this.datasetId = datasetId;
    this.config = config;
    this.workDir = workDir;
    this.json = json;
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
  }

  @Override
  public void runPredictionTests(String model) throws IOException, InterruptedException {
    run(PREDICT, List.of("--model", model));
  }

  @Override
  public void runFullBattery(String model) throws IOException, InterruptedException {
    run(BATTERY, List.of("--model", model));
  }

  @Override
  public ScenarioMetrics report() throws IOException, InterruptedException {
    String stdout = run(REPORT, List.of("--models", String.join(",", models)));
    try {
      return SweepDocuments.metricsFrom(json.parseObject(stdout));
    } catch (IllegalArgumentException ex) {
      throw new IOException("Evaluator report is not a valid cross-model report: "
          + Logs.truncate(stdout.strip()), ex);
    }
  }

  @Override
  public void close() throws IOException {
    Files.deleteIfExists(config);
  }

  List<String> argv(String step, List<String> extra) {
    List<String> argv = new ArrayList<>(command);
    argv.add(step);
    argv.add("--dataset");
    argv.add(datasetId);
    argv.add("--config");
    argv.add(config.toString());
    argv.addAll(extra);
    return argv;
  }

  private String run(String step, List<String> extra) throws IOException, InterruptedException {
    List<String> argv = argv(step, extra);
    Path stdout = Files.createTempFile(workDir, "evaluator-" + step + "-", ".out");
    try {
      log.debug("Running evaluator: {}", argv);
      Process process = new ProcessBuilder(argv)
          .redirectOutput(stdout.toFile())
          .start();
      try {
        process.getOutputStream().close();
        try (BufferedReader stderr = new BufferedReader(
            new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
          String line;
          while ((line = stderr.readLine()) != null) {
            if (!line.isBlank()) {
              diagnostics.warn(line.strip());
            }
          }
        }
        int exit = process.waitFor();
        if (exit != 0) {
          throw new IOException("Evaluator step '" + step + "' exited with status " + exit);
        }
      } finally {
        if (process.isAlive()) {
          process.destroyForcibly();
        }
      }
      return Files.readString(stdout, StandardCharsets.UTF_8);
    } finally {
      Files.deleteIfExists(stdout);
    }
  }
}
