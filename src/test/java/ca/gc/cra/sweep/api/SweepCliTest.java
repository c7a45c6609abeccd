package ca.gc.cra.sweep.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sweep.application.pipeline.SensitivitySweepUseCase;
import ca.gc.cra.sweep.application.port.MetricsPort;
import ca.gc.cra.sweep.config.CompositionRoot;
import ca.gc.cra.sweep.config.SweepConfig;
import ca.gc.cra.sweep.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.sweep.testutil.ManualClock;
import ca.gc.cra.sweep.testutil.ScriptedEvaluationPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class SweepCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;
  private Path catalog;

  @BeforeEach
  void setUp() throws Exception {
    logger = (Logger) LoggerFactory.getLogger(SweepCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    catalog = tempDir.resolve("datasets.yaml");
    Files.writeString(catalog, """
        datasets:
          voynich_real:
            pages: 225
            tokens: 231000
          voynich_synthetic_grammar:
            pages: 40
            tokens: 12000
        """, StandardCharsets.UTF_8);
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpPrintsUsageAndSucceeds() {
    ExitCode code = SweepCli.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Sensitivity sweep"));
    assertTrue(buffer.toString().contains("--preflight-only"));
  }

  @Test
  void unknownFlagIsRejected() {
    ExitCode code = SweepCli.run(new String[] {"--fast"}, wiring(new ScriptedEvaluationPort()));

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: sweep"));
    assertTrue(hasLog(Level.ERROR, "--fast"));
  }

  @Test
  void bareWordIsRejected() {
    ExitCode code = SweepCli.run(new String[] {"foo"}, wiring(new ScriptedEvaluationPort()));

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasLog(Level.ERROR, "key=value"));
  }

  @Test
  void quickReleaseCombinationIsAConfigurationError() {
    ExitCode code = SweepCli.run(args("mode=release", "--quick"), wiring(new ScriptedEvaluationPort()));

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(hasLog(Level.ERROR, "Quick mode cannot be combined with release mode."));
  }

  @Test
  void smokeRunPrintsTheCompletionReport() {
    ScriptedEvaluationPort evaluation = new ScriptedEvaluationPort();

    ExitCode code = SweepCli.run(args("mode=smoke"), wiring(evaluation));

    assertEquals(ExitCode.SUCCESS, code, () -> appender.list.toString());
    assertEquals(List.of("baseline"), evaluation.openedScenarios());
    String output = buffer.toString();
    assertTrue(output.contains("Sensitivity sweep complete:"), output);
    assertTrue(output.contains(": 1/"), output);
    assertTrue(Files.isRegularFile(tempDir.resolve("out").resolve("sensitivity_sweep.json")));
  }

  @Test
  void preflightOnlyBlocksASyntheticReleaseDataset() {
    ScriptedEvaluationPort evaluation = new ScriptedEvaluationPort();

    ExitCode code = SweepCli.run(args("mode=release", "datasetId=voynich_synthetic_grammar", "--preflight-only"),
        wiring(evaluation));

    assertEquals(ExitCode.BLOCKED, code);
    assertTrue(evaluation.openedScenarios().isEmpty());
    assertTrue(buffer.toString().contains("Release preflight:"));
    assertTrue(buffer.toString().contains("DATASET_POLICY_FAILED"), buffer.toString());
  }

  @Test
  void missingDatasetBlocksTheSweep() {
    ScriptedEvaluationPort evaluation = new ScriptedEvaluationPort();

    ExitCode code = SweepCli.run(args("mode=smoke", "datasetId=voynich_unknown"), wiring(evaluation));

    assertEquals(ExitCode.BLOCKED, code);
    assertTrue(evaluation.openedScenarios().isEmpty());
    assertTrue(hasLog(Level.ERROR, "voynich_unknown"));
  }

  @Test
  void scenarioFailureReportsRuntimeFailure() {
    ScriptedEvaluationPort evaluation = new ScriptedEvaluationPort()
        .failOn("baseline", new IOException("evaluator exited with status 3"));

    ExitCode code = SweepCli.run(args("mode=smoke"), wiring(evaluation));

    assertEquals(ExitCode.RUNTIME_FAILURE, code);
    assertTrue(hasLog(Level.ERROR, "re-run to resume"));
    assertFalse(buffer.toString().contains("Sensitivity sweep complete:"));
  }

  private String[] args(String... extra) {
    List<String> all = new ArrayList<>(Arrays.asList(extra));
    all.add("datasets=" + catalog);
    all.add("outDir=" + tempDir.resolve("out"));
    all.add("metricsExporter=none");
    return all.toArray(String[]::new);
  }

  private boolean hasLog(Level level, String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == level && event.getFormattedMessage().contains(fragment));
  }

  private static SweepCli.Wiring wiring(ScriptedEvaluationPort evaluation) {
    return new SweepCli.Wiring() {
      @Override
      public CompositionRoot root(SweepConfig config, TelemetrySettings telemetry) {
        return new CompositionRoot(config, MetricsPort.NO_OP, new ManualClock());
      }

      @Override
      public SensitivitySweepUseCase sweep(CompositionRoot root) {
        return root.sweepUseCase(evaluation);
      }
    };
  }
}
