package ca.gc.cra.sweep.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void splitsOnFirstEqualsAndKeepsOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "--mode=smoke", "evaluator.command=python eval.py --flag=1", " ", "-datasetId=voynich_real"});

    assertEquals(List.of("mode", "evaluator.command", "datasetId"), List.copyOf(map.keySet()));
    assertEquals("python eval.py --flag=1", map.get("evaluator.command"));
    assertEquals("voynich_real", map.get("datasetId"));
  }

  @Test
  void nullArgsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"mode"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"mode="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=smoke"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"mo de=smoke"}));
  }

  @Test
  void rejectsDuplicateKeysAcrossDashForms() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"mode=smoke", "--mode=release"}));

    assertTrue(ex.getMessage().contains("more than once"), ex.getMessage());
  }

  @Test
  void rejectsControlCharactersInValues() {
    assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"outDir=out\u0000dir"}));
  }
}
