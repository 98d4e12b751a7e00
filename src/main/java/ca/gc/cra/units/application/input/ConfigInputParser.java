package ca.gc.cra.units.application.input;

import ca.gc.cra.units.application.policy.UnitSystems;
import ca.gc.cra.units.config.YamlConfigLoader;
import ca.gc.cra.units.domain.error.UnknownUnitException;
import ca.gc.cra.units.domain.quantity.TrackedQuantity;
import ca.gc.cra.units.validation.Numbers;
import ca.gc.cra.units.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns flat configuration mappings into {@link TrackedQuantity} values.
 * <p><strong>Why:</strong> Config files carry bare numbers; the unit each one is in follows from its field name and
 * the declared input unit system, and must be pinned down before any arithmetic happens.</p>
 * <p><strong>Role:</strong> Application service between the config layer and calculations.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Infer each field's unit through a {@link FieldQuantityMap} and {@link UnitSystems}.</li>
 *   <li>Fail the whole parse on the first unmapped field or non-numeric value.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class ConfigInputParser {
  /** Section key naming the input unit system inside a YAML section. */
  public static final String UNIT_SYSTEM_KEY = "unit_system";

  private static final Logger log = LoggerFactory.getLogger(ConfigInputParser.class);

  private final FieldQuantityMap fields;
  private final Clock clock;

  /**
   * Creates a parser over the general field map.
   */
  public ConfigInputParser() {
    this(FieldQuantityMap.GENERAL, Clock.systemUTC());
  }

  /**
   * Creates a parser.
   *
   * @param fields field to category map, e.g. {@link FieldQuantityMap#OFFSHORE}
   * @param clock timestamp source for created quantities
   */
  public ConfigInputParser(FieldQuantityMap fields, Clock clock) {
    this.fields = Objects.requireNonNull(fields, "fields");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Parses every entry of a flat mapping.
   *
   * @param config field name to numeric value
   * @param unitSystem input unit system, e.g. {@code metric_engineering}
   * @param source provenance label for every created quantity
   * @return insertion-ordered, unmodifiable map of field name to quantity
   * @throws IllegalArgumentException when the system is unknown or a value is not numeric
   * @throws UnknownUnitException when a field has no unit under {@code unitSystem}
   */
  public Map<String, TrackedQuantity> parseConfigSection(
      Map<String, ?> config, String unitSystem, String source) {
    Objects.requireNonNull(config, "config");
    UnitSystems.require(unitSystem);
    Map<String, TrackedQuantity> parsed = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : config.entrySet()) {
      parsed.put(entry.getKey(), parseConfigValue(entry.getValue(), entry.getKey(), unitSystem, null, source));
    }
    log.debug("Parsed {} config fields under {} from '{}'", parsed.size(), unitSystem, source);
    return Collections.unmodifiableMap(parsed);
  }

  /**
   * Parses a single value.
   *
   * @param value numeric value or numeric string
   * @param field configuration key; used for unit inference and diagnostics
   * @param unitSystem input unit system
   * @param explicitUnit unit to use instead of inference; may be {@code null}
   * @param source provenance label
   * @return created quantity
   * @throws IllegalArgumentException when the system is unknown or the value is not numeric
   * @throws UnknownUnitException when no unit can be determined for {@code field}
   */
  public TrackedQuantity parseConfigValue(
      Object value, String field, String unitSystem, String explicitUnit, String source) {
    String name = Strings.requireNonBlank("field", field);
    double magnitude = Numbers.requireFinite(name, value);
    String label = Strings.normalizeLabel("source", source);
    if (explicitUnit != null) {
      return TrackedQuantity.create(magnitude, explicitUnit, label, clock);
    }
    String unit = fields.categoryOf(name)
        .flatMap(category -> UnitSystems.unitFor(unitSystem, category))
        .orElseThrow(() -> UnknownUnitException.forField(name, unitSystem));
    return TrackedQuantity.create(magnitude, unit, label, clock);
  }

  /**
   * Loads a YAML section and parses it under the system named by its {@code unit_system} key.
   *
   * @param path YAML file
   * @param section top-level section name
   * @param defaultUnitSystem system used when the section has no {@code unit_system} key
   * @return parsed quantities labelled {@code <file name>#<section>}, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   */
  public Optional<Map<String, TrackedQuantity>> parseYamlSection(
      Path path, String section, String defaultUnitSystem) throws IOException {
    Optional<Map<String, Object>> loaded = YamlConfigLoader.loadSection(path, section);
    if (loaded.isEmpty()) {
      return Optional.empty();
    }
    Map<String, Object> values = new LinkedHashMap<>(loaded.get());
    Object declared = values.remove(UNIT_SYSTEM_KEY);
    String system = declared == null ? defaultUnitSystem : declared.toString();
    String source = path.getFileName() + "#" + section;
    return Optional.of(parseConfigSection(values, system, source));
  }
}
