package ca.gc.cra.sweep.infrastructure.evaluation;

import ca.gc.cra.sweep.application.port.DiagnosticSink;
import ca.gc.cra.sweep.application.port.EvaluationPort;
import ca.gc.cra.sweep.application.port.EvaluationSession;
import ca.gc.cra.sweep.domain.dataset.DatasetProfile;
import ca.gc.cra.sweep.domain.scenario.ScenarioSpec;
import ca.gc.cra.sweep.infrastructure.persistence.json.JsonSupport;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link EvaluationPort} backed by an external evaluator command.
 * <p><strong>Why:</strong> The model battery is maintained outside this code base; each scenario hands it an
 * explicit configuration file instead of relying on shared configuration state.</p>
 * <p><strong>Contract:</strong> The command is invoked once per step as
 * {@code <command...> <step> --dataset <id> --config <file> [--model <name> | --models <a,b>]} where step is
 * {@code predict}, {@code battery} or {@code report}. Every non-blank stderr line is a diagnostic warning; a
 * nonzero exit status fails the step; {@code report} prints the cross-model report JSON on stdout.</p>
 * <p><strong>Thread-safety:</strong> Sessions are confined to the orchestrator thread.</p>
 *
 * @since 0.1.0
 */
public final class ProcessEvaluationAdapter implements EvaluationPort {
  private static final Logger log = LoggerFactory.getLogger(ProcessEvaluationAdapter.class);

  private final List<String> command;
  private final List<String> models;
  private final Path workDir;
  private final JsonSupport json;

  /**
   * Creates an adapter.
   *
   * @param command evaluator argv prefix; must not be empty
   * @param models candidate model names in evaluation order; must not be empty
   * @param workDir directory for per-scenario config files and captured stdout
   * @param json codec for config files and the report
   */
  public ProcessEvaluationAdapter(List<String> command, List<String> models, Path workDir, JsonSupport json) {
    this.command = List.copyOf(Objects.requireNonNull(command, "command"));
    this.models = List.copyOf(Objects.requireNonNull(models, "models"));
    if (this.command.isEmpty()) {
      throw new IllegalArgumentException("evaluator command must not be empty");
    }
    if (this.models.isEmpty()) {
      throw new IllegalArgumentException("at least one candidate model is required");
    }
    this.workDir = Objects.requireNonNull(workDir, "workDir");
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public List<String> candidateModels() {
    return models;
  }

  @Override
  public EvaluationSession openSession(DatasetProfile dataset, ScenarioSpec scenario, DiagnosticSink diagnostics)
      throws IOException {
    Files.createDirectories(workDir);
    Path config = Files.createTempFile(workDir, "scenario-" + scenario.id() + "-", ".json");
    Files.writeString(config, json.render(scenario.config().asMap(), true), StandardCharsets.UTF_8);
    log.debug("Wrote scenario {} config to {}", scenario.id(), config);
    return new ProcessEvaluationSession(command, models, dataset.datasetId(), config, workDir, json, diagnostics);
  }
}
