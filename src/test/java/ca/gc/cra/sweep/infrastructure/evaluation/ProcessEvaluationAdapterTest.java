package ca.gc.cra.sweep.infrastructure.evaluation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sweep.application.port.EvaluationSession;
import ca.gc.cra.sweep.domain.dataset.DatasetProfile;
import ca.gc.cra.sweep.domain.result.ScenarioMetrics;
import ca.gc.cra.sweep.domain.scenario.ScenarioConfig;
import ca.gc.cra.sweep.domain.scenario.ScenarioFamily;
import ca.gc.cra.sweep.domain.scenario.ScenarioSpec;
import ca.gc.cra.sweep.infrastructure.persistence.json.JsonSupport;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessEvaluationAdapterTest {
  private static final DatasetProfile DATASET = new DatasetProfile("voynich_real", 240, 250_000);
  private static final ScenarioSpec SCENARIO = new ScenarioSpec("threshold_0.50", ScenarioFamily.THRESHOLD_SWEEP,
      ScenarioConfig.of(Map.of("disconfirmation", Map.of("mode", "strict"))));
  private static final String REPORT_JSON = "{\"top_model\":\"adjacency_grammar\",\"top_score\":0.81,"
      + "\"surviving_models\":2,\"falsified_models\":4,\"anomaly_confirmed\":true,\"anomaly_stable\":false}";

  @TempDir Path dir;

  private final JsonSupport json = new JsonSupport();

  @Test
  void drivesEachStepAndForwardsStderrAsDiagnostics() throws Exception {
    Path calls = dir.resolve("calls.log");
    Path script = script(
        "echo \"$@\" >> '" + calls + "'",
        "case \"$1\" in",
        "  predict) echo \"Sparse data for $7\" >&2 ;;",
        "  battery) echo '   ' >&2 ;;",
        "  report) cat \"$5\" > '" + dir.resolve("seen-config.json") + "'; echo '" + REPORT_JSON + "' ;;",
        "esac");
    ProcessEvaluationAdapter adapter = adapter(script);
    List<String> warnings = new ArrayList<>();

    ScenarioMetrics metrics;
    try (EvaluationSession session = adapter.openSession(DATASET, SCENARIO, warnings::add)) {
      session.runPredictionTests("adjacency_grammar");
      session.runFullBattery("adjacency_grammar");
      metrics = session.report();
    }

    assertEquals(new ScenarioMetrics("adjacency_grammar", 0.81, 2, 4, true, false), metrics);
    assertEquals(List.of("Sparse data for adjacency_grammar"), warnings);
    List<String> lines = Files.readAllLines(calls, StandardCharsets.UTF_8);
    assertEquals(3, lines.size());
    assertTrue(lines.get(0).startsWith("predict --dataset voynich_real --config "), lines.get(0));
    assertTrue(lines.get(0).endsWith("--model adjacency_grammar"), lines.get(0));
    assertTrue(lines.get(2).endsWith("--models adjacency_grammar,glossalial_system"), lines.get(2));
    Map<String, Object> seen = json.parseObject(
        Files.readString(dir.resolve("seen-config.json"), StandardCharsets.UTF_8));
    assertEquals(Map.of("mode", "strict"), seen.get("disconfirmation"));
    assertNoScenarioFilesLeft();
  }

  @Test
  void nonZeroExitFailsTheStep() throws Exception {
    ProcessEvaluationAdapter adapter = adapter(script("echo 'model crashed' >&2", "exit 3"));
    List<String> warnings = new ArrayList<>();

    try (EvaluationSession session = adapter.openSession(DATASET, SCENARIO, warnings::add)) {
      IOException ex = assertThrows(IOException.class, () -> session.runPredictionTests("adjacency_grammar"));
      assertEquals("Evaluator step 'predict' exited with status 3", ex.getMessage());
    }
    assertEquals(List.of("model crashed"), warnings);
  }

  @Test
  void malformedReportIsRejected() throws Exception {
    ProcessEvaluationAdapter adapter = adapter(script("echo '{\"top_model\": 7}'"));

    try (EvaluationSession session = adapter.openSession(DATASET, SCENARIO, message -> {})) {
      IOException ex = assertThrows(IOException.class, session::report);
      assertTrue(ex.getMessage().startsWith("Evaluator report is not a valid cross-model report"), ex.getMessage());
    }
  }

  @Test
  void constructorRejectsEmptyCommandOrModels() {
    Path work = dir.resolve("work");
    assertThrows(IllegalArgumentException.class,
        () -> new ProcessEvaluationAdapter(List.of(), List.of("a"), work, json));
    assertThrows(IllegalArgumentException.class,
        () -> new ProcessEvaluationAdapter(List.of("sh"), List.of(), work, json));
  }

  private ProcessEvaluationAdapter adapter(Path script) {
    return new ProcessEvaluationAdapter(List.of("sh", script.toString()),
        List.of("adjacency_grammar", "glossalial_system"), dir.resolve("work"), json);
  }

  private Path script(String... lines) throws IOException {
    Path script = dir.resolve("evaluator.sh");
    Files.writeString(script, "#!/bin/sh\n" + String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
    return script;
  }

  private void assertNoScenarioFilesLeft() throws IOException {
    try (Stream<Path> files = Files.list(dir.resolve("work"))) {
      assertFalse(files.findAny().isPresent());
    }
  }
}
