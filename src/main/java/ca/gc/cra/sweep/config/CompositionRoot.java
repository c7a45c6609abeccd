package ca.gc.cra.sweep.config;

import ca.gc.cra.sweep.application.pipeline.ReleasePreflightUseCase;
import ca.gc.cra.sweep.application.pipeline.SensitivitySweepUseCase;
import ca.gc.cra.sweep.application.port.CheckpointPort;
import ca.gc.cra.sweep.application.port.ClockPort;
import ca.gc.cra.sweep.application.port.DatasetProfilePort;
import ca.gc.cra.sweep.application.port.EvaluationPort;
import ca.gc.cra.sweep.application.port.EvidencePort;
import ca.gc.cra.sweep.application.port.MetricsPort;
import ca.gc.cra.sweep.application.port.ProgressPort;
import ca.gc.cra.sweep.application.port.ReleaseRunStatusPort;
import ca.gc.cra.sweep.application.sweep.RobustnessEvaluator;
import ca.gc.cra.sweep.application.sweep.ScenarioExecutor;
import ca.gc.cra.sweep.infrastructure.dataset.YamlDatasetCatalogAdapter;
import ca.gc.cra.sweep.infrastructure.evaluation.ProcessEvaluationAdapter;
import ca.gc.cra.sweep.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.sweep.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.sweep.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.sweep.infrastructure.persistence.ArtifactLayout;
import ca.gc.cra.sweep.infrastructure.persistence.AtomicFileWriter;
import ca.gc.cra.sweep.infrastructure.persistence.FileCheckpointAdapter;
import ca.gc.cra.sweep.infrastructure.persistence.FileEvidenceAdapter;
import ca.gc.cra.sweep.infrastructure.persistence.FileProgressAdapter;
import ca.gc.cra.sweep.infrastructure.persistence.FileReleaseRunStatusAdapter;
import ca.gc.cra.sweep.infrastructure.persistence.json.JsonSupport;
import ca.gc.cra.sweep.infrastructure.time.SystemClockAdapter;
import java.util.Objects;

/**
 * <strong>What:</strong> Central composition root that wires the sweep use cases to concrete adapters.
 * <p><strong>Why:</strong> Provides a single place to translate {@link SweepConfig} into runnable use cases.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning dataset catalog, evaluator, artifact files and
 * metrics.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Choose the metrics adapter from the telemetry settings.</li>
 *   <li>Lay out every artifact under the configured output directory.</li>
 *   <li>Construct the sweep orchestrator and the release preflight.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and use on the CLI thread.</p>
 * <p><strong>Observability:</strong> Owns the metrics adapter; {@link #close()} flushes and shuts it down.</p>
 *
 * @since 0.1.0
 * @see SensitivitySweepUseCase
 * @see ReleasePreflightUseCase
 */
public final class CompositionRoot implements AutoCloseable {
  private static final String EVALUATOR_WORK_DIR = "evaluator_work";

  private final SweepConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final JsonSupport json = new JsonSupport();
  private final AtomicFileWriter writer = new AtomicFileWriter(json);
  private final ArtifactLayout layout;

  /**
   * Creates a composition root whose telemetry resolves from system properties and the environment.
   *
   * @param config sweep configuration; must not be {@code null}
   */
  public CompositionRoot(SweepConfig config) {
    this(config, TelemetrySettings.fromEnvironment());
  }

  /**
   * Creates a composition root with explicit telemetry settings.
   *
   * @param config sweep configuration; must not be {@code null}
   * @param telemetry exporter settings; {@code none} selects the no-op adapter
   */
  public CompositionRoot(SweepConfig config, TelemetrySettings telemetry) {
    this(config, metricsFor(telemetry), new SystemClockAdapter());
  }

  /**
   * Creates a composition root with explicit metrics and clock adapters.
   *
   * @param config sweep configuration; must not be {@code null}
   * @param metricsPort metrics adapter used by constructed use cases; must not be {@code null}
   * @param clock time source; must not be {@code null}
   */
  public CompositionRoot(SweepConfig config, MetricsPort metricsPort, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metricsPort, "metricsPort");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.layout = new ArtifactLayout(config.outDir());
  }

  /**
   * Builds the sweep orchestrator backed by the configured external evaluator.
   *
   * @return sweep use case
   * @throws ConfigurationException if no evaluator command is configured
   */
  public SensitivitySweepUseCase sweepUseCase() {
    if (config.evaluatorCommand().isEmpty()) {
      throw new ConfigurationException("evaluator.command is required to execute scenarios");
    }
    return sweepUseCase(new ProcessEvaluationAdapter(
        config.evaluatorCommand(),
        config.evaluatorModels(),
        config.outDir().resolve(EVALUATOR_WORK_DIR),
        json));
  }

  /**
   * Builds the sweep orchestrator around an explicit evaluation collaborator.
   *
   * @param evaluation evaluation collaborator
   * @return sweep use case
   */
  public SensitivitySweepUseCase sweepUseCase(EvaluationPort evaluation) {
    return new SensitivitySweepUseCase(
        datasets(),
        checkpoint(),
        progress(),
        releaseRunStatus(),
        evidence(),
        new ScenarioExecutor(evaluation, clock, metrics, config.heartbeatSettings()),
        new RobustnessEvaluator(config.minValidRate()),
        clock,
        metrics);
  }

  /**
   * Builds the release preflight.
   *
   * @return preflight use case
   */
  public ReleasePreflightUseCase preflightUseCase() {
    return new ReleasePreflightUseCase(datasets(), evidence(), progress(), clock, metrics);
  }

  /**
   * Returns the loader for the policy and base-config documents.
   *
   * @return document loader sharing this root's JSON codec
   */
  public ReleaseEvidencePolicyLoader documentLoader() {
    return new ReleaseEvidencePolicyLoader(json);
  }

  /**
   * Returns the artifact layout under the configured output directory.
   *
   * @return artifact layout
   */
  public ArtifactLayout layout() {
    return layout;
  }

  /**
   * Returns the metrics adapter shared by every use case built here.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Returns the clock shared by every use case built here.
   *
   * @return clock port
   */
  public ClockPort clock() {
    return clock;
  }

  /**
   * Flushes and shuts down the OpenTelemetry adapter when one was created here or injected.
   */
  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }

  private DatasetProfilePort datasets() {
    return new YamlDatasetCatalogAdapter(config.datasets());
  }

  private CheckpointPort checkpoint() {
    return new FileCheckpointAdapter(layout.checkpoint(), writer, json, clock);
  }

  private ProgressPort progress() {
    return new FileProgressAdapter(layout.progress(), writer);
  }

  private ReleaseRunStatusPort releaseRunStatus() {
    return new FileReleaseRunStatusAdapter(layout, writer);
  }

  private EvidencePort evidence() {
    return new FileEvidenceAdapter(layout, writer);
  }

  private static MetricsPort metricsFor(TelemetrySettings telemetry) {
    Objects.requireNonNull(telemetry, "telemetry");
    if (telemetry.disabled()) {
      return NoOpMetricsAdapter.INSTANCE;
    }
    return new OpenTelemetryMetricsAdapter(telemetry);
  }
}
