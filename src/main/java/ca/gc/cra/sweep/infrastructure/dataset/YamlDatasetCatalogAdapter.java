package ca.gc.cra.sweep.infrastructure.dataset;

import ca.gc.cra.sweep.application.port.DatasetProfilePort;
import ca.gc.cra.sweep.domain.dataset.DatasetException;
import ca.gc.cra.sweep.domain.dataset.DatasetProfile;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Resolves dataset profiles from a YAML catalog.
 * <p><strong>Why:</strong> A sweep must refuse to run against a dataset that was never built or that is
 * empty; the catalog is the record of what the corpus build produced.</p>
 * <p><strong>Format:</strong></p>
 * <pre>
 * datasets:
 *   voynich_real:
 *     pages: 225
 *     tokens: 231000
 * </pre>
 * A top-level mapping without the {@code datasets} key is read as the dataset map itself. The file is
 * re-read on every lookup.
 *
 * @since 0.1.0
 */
public final class YamlDatasetCatalogAdapter implements DatasetProfilePort {
  private static final Logger log = LoggerFactory.getLogger(YamlDatasetCatalogAdapter.class);

  private final Path catalog;

  public YamlDatasetCatalogAdapter(Path catalog) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
  }

  @Override
  public DatasetProfile load(String datasetId) throws DatasetException {
    Objects.requireNonNull(datasetId, "datasetId");
    Map<?, ?> datasets = readDatasets(datasetId);
    Object entry = datasets.get(datasetId);
    if (!(entry instanceof Map<?, ?> fields)) {
      throw new DatasetException(datasetId, "Dataset '" + datasetId + "' does not exist in metadata store. "
          + "Run corpus build scripts before sensitivity analysis.");
    }
    long pages = count(datasetId, fields, "pages");
    long tokens = count(datasetId, fields, "tokens");
    if (pages == 0) {
      throw new DatasetException(datasetId,
          "Dataset '" + datasetId + "' has zero pages. Sensitivity sweep cannot proceed.");
    }
    if (tokens == 0) {
      throw new DatasetException(datasetId,
          "Dataset '" + datasetId + "' has zero transcription tokens. Sensitivity sweep cannot proceed.");
    }
    log.debug("Resolved dataset {} ({} pages, {} tokens) from {}", datasetId, pages, tokens, catalog);
    return new DatasetProfile(datasetId, pages, tokens);
  }

  private Map<?, ?> readDatasets(String datasetId) throws DatasetException {
    if (!Files.isRegularFile(catalog)) {
      throw new DatasetException(datasetId, "Dataset catalog " + catalog + " does not exist");
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(catalog, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (IOException | YAMLException ex) {
      throw new DatasetException(datasetId, "Failed to read dataset catalog " + catalog, ex);
    }
    if (document == null) {
      return Map.of();
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new DatasetException(datasetId, "Dataset catalog " + catalog + " must be a mapping");
    }
    Object section = root.get("datasets");
    if (section == null) {
      return root;
    }
    if (!(section instanceof Map<?, ?> datasets)) {
      throw new DatasetException(datasetId, "'datasets' in " + catalog + " must be a mapping");
    }
    return datasets;
  }

  private long count(String datasetId, Map<?, ?> fields, String key) throws DatasetException {
    Object value = fields.get(key);
    if (value == null) {
      return 0;
    }
    if (!(value instanceof Number number) || number.longValue() < 0) {
      throw new DatasetException(datasetId,
          "Dataset '" + datasetId + "' has an invalid " + key + " count: " + value);
    }
    return number.longValue();
  }
}
