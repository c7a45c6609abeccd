package ca.gc.cra.sweep.domain.scenario;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable tree of model parameters handed to the evaluation collaborator for one
 * scenario.
 * <p><strong>Why:</strong> Scenario isolation relies on every scenario carrying its own fully materialized
 * parameter set rather than patching shared lookups.</p>
 * <p><strong>Role:</strong> Opaque domain value; only the matrix builder interprets its structure.</p>
 * <p><strong>Thread-safety:</strong> Deeply immutable; safe to share.</p>
 *
 * <p>Nodes are {@link Map} (string keys, insertion order kept), {@link List}, {@link String},
 * {@link Number}, {@link Boolean}, or {@code null}.</p>
 *
 * @since 0.1.0
 */
public final class ScenarioConfig {
  private static final ScenarioConfig EMPTY = new ScenarioConfig(Map.of());

  private final Map<String, Object> root;

  private ScenarioConfig(Map<String, Object> root) {
    this.root = root;
  }

  /**
   * Creates a configuration from a parsed document, copying every nested node.
   *
   * @param document parsed map tree; must not be {@code null}
   * @return immutable configuration
   * @throws IllegalArgumentException when a node has an unsupported type or a non-string key
   */
  public static ScenarioConfig of(Map<String, ?> document) {
    Objects.requireNonNull(document, "document");
    return new ScenarioConfig(freezeMap(document));
  }

  /**
   * Returns an empty configuration.
   *
   * @return shared empty instance
   */
  public static ScenarioConfig empty() {
    return EMPTY;
  }

  /**
   * Returns the unmodifiable root mapping.
   *
   * @return root node view
   */
  public Map<String, Object> asMap() {
    return root;
  }

  /**
   * Returns a deep, mutable copy of the tree for building derived configurations.
   *
   * @return mutable map tree owned by the caller
   */
  public Map<String, Object> mutableCopy() {
    return thawMap(root);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof ScenarioConfig that && root.equals(that.root);
  }

  @Override
  public int hashCode() {
    return root.hashCode();
  }

  @Override
  public String toString() {
    return "ScenarioConfig" + root;
  }

  private static Map<String, Object> freezeMap(Map<?, ?> map) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException("configuration keys must be strings: " + entry.getKey());
      }
      copy.put(key, freeze(entry.getValue()));
    }
    return Collections.unmodifiableMap(copy);
  }

  private static Object freeze(Object node) {
    if (node instanceof Map<?, ?> map) {
      return freezeMap(map);
    }
    if (node instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object item : list) {
        copy.add(freeze(item));
      }
      return Collections.unmodifiableList(copy);
    }
    if (node == null || node instanceof String || node instanceof Number || node instanceof Boolean) {
      return node;
    }
    throw new IllegalArgumentException("unsupported configuration value type: " + node.getClass().getName());
  }

  private static Map<String, Object> thawMap(Map<?, ?> map) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      copy.put(String.valueOf(entry.getKey()), thaw(entry.getValue()));
    }
    return copy;
  }

  private static Object thaw(Object node) {
    if (node instanceof Map<?, ?> map) {
      return thawMap(map);
    }
    if (node instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object item : list) {
        copy.add(thaw(item));
      }
      return copy;
    }
    return node;
  }
}
