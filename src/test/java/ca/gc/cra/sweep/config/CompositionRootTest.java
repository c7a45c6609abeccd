package ca.gc.cra.sweep.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sweep.application.pipeline.SweepOutcome;
import ca.gc.cra.sweep.application.port.MetricsPort;
import ca.gc.cra.sweep.domain.policy.ReleaseEvidencePolicy;
import ca.gc.cra.sweep.domain.preflight.PreflightReport;
import ca.gc.cra.sweep.domain.run.SweepMode;
import ca.gc.cra.sweep.domain.scenario.ScenarioConfig;
import ca.gc.cra.sweep.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.sweep.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.sweep.testutil.ManualClock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir Path tempDir;

  private Path catalog;

  @BeforeEach
  void writeCatalog() throws Exception {
    catalog = tempDir.resolve("datasets.yaml");
    Files.writeString(catalog, """
        datasets:
          voynich_real:
            pages: 225
            tokens: 231000
        """, StandardCharsets.UTF_8);
  }

  @Test
  void disabledTelemetrySelectsNoopMetrics() {
    SweepConfig config = config(Map.of());
    TelemetrySettings none = new TelemetrySettings("none", "http://localhost:4317", "", Duration.ofSeconds(30));

    try (CompositionRoot root = new CompositionRoot(config, none)) {
      assertInstanceOf(NoOpMetricsAdapter.class, root.metrics());
      assertEquals(tempDir.resolve("out").toAbsolutePath().normalize().resolve("sensitivity_checkpoint.json"),
          root.layout().checkpoint());
    }
  }

  @Test
  void sweepWithoutEvaluatorCommandIsRejected() {
    try (CompositionRoot root = new CompositionRoot(config(Map.of()), MetricsPort.NO_OP, new ManualClock())) {
      ConfigurationException ex = assertThrows(ConfigurationException.class, root::sweepUseCase);
      assertEquals("evaluator.command is required to execute scenarios", ex.getMessage());
    }
  }

  @Test
  void preflightWritesItsReportUnderTheOutputDirectory() throws Exception {
    SweepConfig config = config(Map.of());

    try (CompositionRoot root = new CompositionRoot(config, MetricsPort.NO_OP, new ManualClock())) {
      PreflightReport report = root.preflightUseCase()
          .run(config.toRequest(ScenarioConfig.empty(), ReleaseEvidencePolicy.defaults()));

      assertTrue(report.passed(), () -> report.reasons().toString());
      assertTrue(Files.isRegularFile(root.layout().preflight()));
      assertTrue(Files.isRegularFile(root.layout().progress()));
    }
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void smokeSweepRunsTheConfiguredEvaluatorCommand() throws Exception {
    Path evaluator = tempDir.resolve("evaluator.sh");
    Files.writeString(evaluator, """
        #!/bin/sh
        if [ "$1" = report ]; then
          echo '{"top_model":"adjacency_grammar","top_score":0.8,"surviving_models":1,"falsified_models":1,"anomaly_confirmed":true,"anomaly_stable":true}'
        fi
        """, StandardCharsets.UTF_8);
    Map<String, String> options = new LinkedHashMap<>();
    options.put("mode", "smoke");
    options.put("evaluator.command", "sh " + evaluator);
    options.put("evaluator.models", "adjacency_grammar,glossalial_system");
    SweepConfig config = config(options);

    try (CompositionRoot root = new CompositionRoot(config, MetricsPort.NO_OP, new ManualClock())) {
      SweepOutcome outcome = root.sweepUseCase()
          .run(config.toRequest(ScenarioConfig.empty(), ReleaseEvidencePolicy.defaults()));

      assertEquals(1, outcome.executedScenarios());
      assertEquals(SweepMode.SMOKE, outcome.summary().mode());
      assertEquals(root.layout().summary(SweepMode.SMOKE), outcome.locations().latest());
      assertTrue(Files.isRegularFile(outcome.locations().latest()));
    }
  }

  private SweepConfig config(Map<String, String> overrides) {
    Map<String, String> options = new LinkedHashMap<>(overrides);
    options.put("outDir", tempDir.resolve("out").toString());
    options.put("datasets", catalog.toString());
    return SweepConfig.fromMap(options);
  }
}
