package ca.gc.cra.sweep.infrastructure.dataset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sweep.domain.dataset.DatasetException;
import ca.gc.cra.sweep.domain.dataset.DatasetProfile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlDatasetCatalogAdapterTest {
  @TempDir Path dir;

  @Test
  void resolvesProfileFromDatasetsSection() throws Exception {
    YamlDatasetCatalogAdapter adapter = catalog("""
        datasets:
          voynich_real:
            pages: 225
            tokens: 231000
          voynich_synthetic_grammar:
            pages: 40
            tokens: 12000
        """);

    assertEquals(new DatasetProfile("voynich_real", 225, 231_000), adapter.load("voynich_real"));
    assertEquals(new DatasetProfile("voynich_synthetic_grammar", 40, 12_000),
        adapter.load("voynich_synthetic_grammar"));
  }

  @Test
  void topLevelMappingIsReadAsDatasetMap() throws Exception {
    YamlDatasetCatalogAdapter adapter = catalog("""
        voynich_real:
          pages: 225
          tokens: 231000
        """);

    assertEquals(225, adapter.load("voynich_real").pages());
  }

  @Test
  void unknownDatasetIsRejected() throws Exception {
    YamlDatasetCatalogAdapter adapter = catalog("datasets: {}\n");

    DatasetException ex = assertThrows(DatasetException.class, () -> adapter.load("voynich_real"));

    assertEquals("voynich_real", ex.datasetId());
    assertTrue(ex.getMessage().contains("does not exist in metadata store"), ex.getMessage());
  }

  @Test
  void emptyDatasetsAreRejected() throws Exception {
    YamlDatasetCatalogAdapter adapter = catalog("""
        datasets:
          no_pages:
            tokens: 10
          no_tokens:
            pages: 10
            tokens: 0
        """);

    assertTrue(assertThrows(DatasetException.class, () -> adapter.load("no_pages"))
        .getMessage().contains("zero pages"));
    assertTrue(assertThrows(DatasetException.class, () -> adapter.load("no_tokens"))
        .getMessage().contains("zero transcription tokens"));
  }

  @Test
  void malformedCountsAndCatalogsAreRejected() throws Exception {
    YamlDatasetCatalogAdapter adapter = catalog("""
        datasets:
          voynich_real:
            pages: many
            tokens: 10
        """);
    assertTrue(assertThrows(DatasetException.class, () -> adapter.load("voynich_real"))
        .getMessage().contains("invalid pages count"));

    YamlDatasetCatalogAdapter list = catalog("- voynich_real\n");
    assertTrue(assertThrows(DatasetException.class, () -> list.load("voynich_real"))
        .getMessage().contains("must be a mapping"));
  }

  @Test
  void missingCatalogIsRejected() {
    YamlDatasetCatalogAdapter adapter = new YamlDatasetCatalogAdapter(dir.resolve("absent.yaml"));

    assertTrue(assertThrows(DatasetException.class, () -> adapter.load("voynich_real"))
        .getMessage().contains("does not exist"));
  }

  private YamlDatasetCatalogAdapter catalog(String yaml) throws Exception {
    Path file = dir.resolve("datasets-" + System.nanoTime() + ".yaml");
    Files.writeString(file, yaml, StandardCharsets.UTF_8);
    return new YamlDatasetCatalogAdapter(file);
  }
}
