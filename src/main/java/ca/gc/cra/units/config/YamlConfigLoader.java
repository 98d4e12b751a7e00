package ca.gc.cra.units.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads calculation inputs from a YAML document and flattens one top-level section into a key/value map.
 *
 * <p>Scalar values keep the type SnakeYAML gives them, so numbers stay {@link Number}s. Nested mappings are
 * flattened with {@code .} separators.</p>
 */
public final class YamlConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and returns the flattened contents of {@code section}.
   *
   * @param path location of the YAML document
   * @param section top-level key to extract, matched case-insensitively
   * @return flat insertion-ordered map, empty optional when the file does not exist; an absent section yields an
   *     empty map
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or the section is not a mapping
   */
  public static Optional<Map<String, Object>> loadSection(Path path, String section) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(section, "section");
    if (!Files.exists(path)) {
      log.debug("Config file {} does not exist", path);
      return Optional.empty();
    }

    String normalized = section.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");
      Object sectionNode = findSection(root, normalized);
      if (sectionNode == null) {
        log.debug("Section '{}' not found in {}", section, path);
        return Optional.of(Map.of());
      }
      Map<String, Object> flattened = new LinkedHashMap<>();
      flatten(asMap(sectionNode, normalized), "", flattened);
      log.debug("Loaded {} keys from section '{}' of {}", flattened.size(), section, path);
      return Optional.of(Collections.unmodifiableMap(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key " + entry.getKey());
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, Object> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value);
      }
    }
  }
}
