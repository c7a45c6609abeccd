package ca.gc.cra.sweep.config;

import ca.gc.cra.sweep.domain.policy.ReleaseEvidencePolicy;
import ca.gc.cra.sweep.domain.scenario.ScenarioConfig;
import ca.gc.cra.sweep.infrastructure.persistence.json.JsonSupport;
import ca.gc.cra.sweep.infrastructure.persistence.json.SweepDocuments;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the JSON documents a sweep reads at startup: the release evidence policy and the base model
 * parameters.
 *
 * <p>A policy document only needs the sections and keys it changes; everything else falls back to
 * {@link ReleaseEvidencePolicy#defaults()}.</p>
 */
public final class ReleaseEvidencePolicyLoader {
  private static final Logger log = LoggerFactory.getLogger(ReleaseEvidencePolicyLoader.class);

  private final JsonSupport json;

  /**
   * Creates a loader.
   *
   * @param json JSON codec
   */
  public ReleaseEvidencePolicyLoader(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Loads the effective release evidence policy.
   *
   * @param path optional policy document; absent or missing files yield the defaults
   * @return effective policy
   * @throws IOException if the file exists but cannot be read
   * @throws ConfigurationException if the document is malformed
   */
  public ReleaseEvidencePolicy loadPolicy(Optional<Path> path) throws IOException {
    Objects.requireNonNull(path, "path");
    ReleaseEvidencePolicy defaults = ReleaseEvidencePolicy.defaults();
    if (path.isEmpty()) {
      return defaults;
    }
    if (!Files.exists(path.get())) {
      log.warn("Release evidence policy {} not found; using defaults (version {})",
          path.get(), defaults.policyVersion());
      return defaults;
    }
    Map<String, Object> document = readObject(path.get(), "release evidence policy");
    try {
      ReleaseEvidencePolicy policy = SweepDocuments.releaseEvidencePolicy(document, defaults);
      log.debug("Loaded release evidence policy version {} from {}", policy.policyVersion(), path.get());
      return policy;
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException("Invalid release evidence policy " + path.get() + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Loads the base model parameters every scenario starts from.
   *
   * @param path optional JSON object; absent yields an empty configuration
   * @return base scenario configuration
   * @throws IOException if the file cannot be read
   * @throws ConfigurationException if the file is missing or not a JSON object
   */
  public ScenarioConfig loadBaseConfig(Optional<Path> path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (path.isEmpty()) {
      return ScenarioConfig.empty();
    }
    if (!Files.exists(path.get())) {
      throw new ConfigurationException("Base config " + path.get() + " does not exist");
    }
    Map<String, Object> document = readObject(path.get(), "base config");
    try {
      return ScenarioConfig.of(document);
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException("Invalid base config " + path.get() + ": " + ex.getMessage(), ex);
    }
  }

  private Map<String, Object> readObject(Path path, String label) throws IOException {
    String text = Files.readString(path, StandardCharsets.UTF_8);
    try {
      return json.parseObject(text);
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException("Invalid " + label + " " + path + ": " + ex.getMessage(), ex);
    }
  }
}
