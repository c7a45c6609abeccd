package ca.gc.cra.sweep.domain.scenario;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ScenarioConfigTest {
  @Test
  void copiesTheDocumentDeeply() {
    Map<String, Object> thresholds = new LinkedHashMap<>();
    thresholds.put("falsification", 0.6);
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("thresholds", thresholds);
    document.put("models", new ArrayList<>(List.of("adjacency_grammar")));

    ScenarioConfig config = ScenarioConfig.of(document);
    thresholds.put("falsification", 0.9);

    assertEquals(Map.of("falsification", 0.6), config.asMap().get("thresholds"));
    assertThrows(UnsupportedOperationException.class, () -> config.asMap().put("extra", 1));
  }

  @Test
  void mutableCopyLeavesTheOriginalUntouched() {
    ScenarioConfig config = ScenarioConfig.of(Map.of("thresholds", Map.of("falsification", 0.5)));

    Map<String, Object> copy = config.mutableCopy();
    ((Map<?, ?>) copy.get("thresholds")).clear();

    assertEquals(0.5, ((Map<?, ?>) config.asMap().get("thresholds")).get("falsification"));
    assertEquals(config, ScenarioConfig.of(Map.of("thresholds", Map.of("falsification", 0.5))));
  }

  @Test
  void rejectsUnsupportedNodes() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ScenarioConfig.of(Map.of("started", Instant.EPOCH)));

    assertTrue(ex.getMessage().contains("java.time.Instant"), ex.getMessage());
  }

  @Test
  void rejectsNonStringKeysAtAnyDepth() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ScenarioConfig.of(Map.of("weights", Map.of(1, 0.5))));

    assertTrue(ex.getMessage().contains("keys must be strings"), ex.getMessage());
  }
}
