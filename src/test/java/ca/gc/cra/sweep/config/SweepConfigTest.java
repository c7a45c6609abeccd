package ca.gc.cra.sweep.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sweep.domain.run.SweepMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class SweepConfigTest {

  @Test
  void releaseIsTheDefaultModeWithoutCap() {
    SweepConfig config = SweepConfig.fromMap(Map.of());

    assertEquals(SweepMode.RELEASE, config.mode());
    assertEquals("voynich_real", config.datasetId());
    assertEquals(OptionalInt.empty(), config.maxScenarios());
    assertTrue(config.resume());
  }

  @Test
  void smokeRunsOneScenarioUnlessCapped() {
    assertEquals(OptionalInt.of(1), SweepConfig.fromMap(Map.of("mode", "smoke")).maxScenarios());
    assertEquals(OptionalInt.of(4),
        SweepConfig.fromMap(Map.of("mode", "smoke", "maxScenarios", "4")).maxScenarios());
  }

  @Test
  void quickSwitchesToIterativeOnTheSyntheticDataset() {
    SweepConfig config = SweepConfig.fromMap(Map.of("mode", "smoke", "quick", "true"));

    assertEquals(SweepMode.ITERATIVE, config.mode());
    assertEquals(SweepConfig.ITERATIVE_DATASET_ID, config.datasetId());
    assertEquals(OptionalInt.of(SweepConfig.ITERATIVE_MAX_SCENARIOS), config.maxScenarios());
  }

  @Test
  void iterativeKeepsAnExplicitDataset() {
    SweepConfig config = SweepConfig.fromMap(Map.of("mode", "iterative", "datasetId", "voynich_scrambled"));

    assertEquals("voynich_scrambled", config.datasetId());
  }

  @Test
  void quickCannotBeCombinedWithRelease() {
    ConfigurationException ex = assertThrows(ConfigurationException.class,
        () -> SweepConfig.fromMap(Map.of("mode", "release", "quick", "true")));
    assertEquals("Quick mode cannot be combined with release mode.", ex.getMessage());
  }

  @Test
  void releaseRejectsScenarioCap() {
    ConfigurationException ex = assertThrows(ConfigurationException.class,
        () -> SweepConfig.fromMap(Map.of("maxScenarios", "3")));
    assertTrue(ex.getMessage().startsWith("Release mode requires full scenario execution"), ex.getMessage());
  }

  @Test
  void preflightOnlyRequiresRelease() {
    assertThrows(ConfigurationException.class,
        () -> SweepConfig.fromMap(Map.of("mode", "smoke", "preflightOnly", "true")));
  }

  @Test
  void rejectsUnknownModeAndOutOfRangeValues() {
    assertThrows(ConfigurationException.class, () -> SweepConfig.fromMap(Map.of("mode", "nightly")));
    assertThrows(IllegalArgumentException.class,
        () -> SweepConfig.fromMap(Map.of("mode", "smoke", "maxScenarios", "0")));
    assertThrows(IllegalArgumentException.class, () -> SweepConfig.fromMap(Map.of("heartbeatSeconds", "0")));
    assertThrows(IllegalArgumentException.class, () -> SweepConfig.fromMap(Map.of("minValidRate", "1.5")));
    assertThrows(IllegalArgumentException.class, () -> SweepConfig.fromMap(Map.of("datasetId", "voynich real")));
  }

  @Test
  void evaluatorSettingsAreSplit() {
    SweepConfig config = SweepConfig.fromMap(Map.of(
        "evaluator.command", "  python3   -m evaluator ",
        "evaluator.models", "adjacency_grammar, glossalial_system,,",
        "heartbeatSeconds", "5",
        "heartbeatJoinMillis", "250",
        "outDir", "out/../audit"));

    assertEquals(List.of("python3", "-m", "evaluator"), config.evaluatorCommand());
    assertEquals(List.of("adjacency_grammar", "glossalial_system"), config.evaluatorModels());
    assertEquals(Duration.ofSeconds(5), config.heartbeatSettings().period());
    assertEquals(Duration.ofMillis(250), config.heartbeatSettings().joinTimeout());
    assertEquals(Path.of("audit").toAbsolutePath(), config.outDir());
  }
}
