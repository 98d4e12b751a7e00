package ca.gc.cra.units.application.domains;

import ca.gc.cra.units.domain.error.UnknownUnitException;
import ca.gc.cra.units.domain.unit.UnitRegistry;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Per-domain tables mapping engineering short keys (e.g. {@code knots}, {@code BOE},
 * {@code hPa}) onto registry unit strings, with a plain-number conversion.
 * <p><strong>Why:</strong> Data feeds label their columns with domain vocabulary rather than registry symbols;
 * each adapter pins down which keys are accepted and what they mean.</p>
 * <p><strong>Role:</strong> Standalone conversion utility; results carry no provenance.</p>
 * <p><strong>Thread-safety:</strong> Enum constants hold unmodifiable maps and are safe to share.</p>
 *
 * @since 0.1.0
 * @see DomainConversions
 */
public enum DomainUnitAdapter {
  SPEED("speed", "m/s", mapping(
      "m/s", "m/s",
      "knots", "knot",
      "km/h", "km/hr",
      "mph", "mph",
      "ft/s", "ft/s")),
  LENGTH("length", "m", mapping(
      "m", "m",
      "feet", "ft",
      "cm", "cm",
      "inches", "inch",
      "nm", "nautical_mile",
      "km", "km",
      "mm", "mm")),
  TEMPERATURE("temperature", "celsius", mapping(
      "celsius", "degC",
      "fahrenheit", "degF",
      "kelvin", "kelvin")),
  PRESSURE("pressure", "hPa", mapping(
      "hPa", "hectopascal",
      "mbar", "millibar",
      "inHg", "inHg",
      "mmHg", "mmHg",
      "Pa", "Pa",
      "kPa", "kPa",
      "atm", "atm",
      "psi", "psi")),
  ENERGY("energy", null, mapping(
      "BTU", "BTU",
      "MMBTU", "MMBTU",
      "THERM", "therm",
      "GJ", "GJ",
      "MWH", "MWh",
      "KWH", "kWh",
      "TOE", "TOE",
      "BOE", "BOE",
      "BBL", "oil_barrel",
      "BBL_OIL", "oil_barrel",
      "GAL", "gallon",
      "L", "liter",
      "M3", "m**3",
      "MCF", "MCF",
      "MMCF", "MMCF",
      "BCF", "BCF",
      "TCF", "TCF",
      "SCF", "SCF",
      "TONNE", "metric_ton",
      "SHORT_TON", "short_ton",
      "LONG_TON", "long_ton",
      "KG", "kg",
      "LB", "lb")),
  MASS("mass", "kg", mapping(
      "kg", "kg",
      "g", "g",
      "tonne", "metric_ton",
      "lb", "lb",
      "oz", "oz",
      "short_ton", "short_ton",
      "long_ton", "long_ton")),
  VOLUME("volume", "m3", mapping(
      "m3", "m**3",
      "L", "liter",
      "mL", "mL",
      "gal", "gallon",
      "bbl", "oil_barrel",
      "ft3", "ft**3"));

  private static final Logger log = LoggerFactory.getLogger(DomainUnitAdapter.class);

  private final String domain;
  private final String defaultTargetKey;
  private final Map<String, String> mapping;

  DomainUnitAdapter(String domain, String defaultTargetKey, Map<String, String> mapping) {
    this.domain = domain;
    this.defaultTargetKey = defaultTargetKey;
    this.mapping = mapping;
  }

  /**
   * Returns the label used in error messages, e.g. {@code pressure}.
   *
   * @return domain label
   */
  public String domain() {
    return domain;
  }

  /**
   * Returns the key used when callers omit a target, if this domain has one.
   *
   * @return default target key such as {@code m/s}
   */
  public Optional<String> defaultTargetKey() {
    return Optional.ofNullable(defaultTargetKey);
  }

  /**
   * Returns the key to registry-unit table.
   *
   * @return unmodifiable, insertion-ordered mapping
   */
  public Map<String, String> mapping() {
    return mapping;
  }

  /**
   * Converts a plain number between two domain keys.
   *
   * @param value magnitude; {@code null} is passed through
   * @param fromKey source key from {@link #mapping()}
   * @param toKey target key from {@link #mapping()}
   * @return converted magnitude, or {@code null} when {@code value} is {@code null}
   * @throws UnknownUnitException when either key is not mapped
   * @throws ca.gc.cra.units.domain.error.DimensionMismatchException when the mapped units have different
   *     dimensions (e.g. {@code BBL} to {@code BOE})
   */
  public Double convert(Double value, String fromKey, String toKey) {
    if (value == null) {
      return null;
    }
    String from = registryUnit(fromKey);
    String to = registryUnit(toKey);
    double converted = UnitRegistry.getInstance().convert(value, from, to);
    log.debug("Converted {} {} to {} {} ({})", value, fromKey, converted, toKey, domain);
    return converted;
  }

  private String registryUnit(String key) {
    String unit = key == null ? null : mapping.get(key);
    if (unit == null) {
      throw UnknownUnitException.forDomain(domain, Objects.toString(key), mapping.keySet());
    }
    return unit;
  }

  private static Map<String, String> mapping(String... pairs) {
    Map<String, String> map = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      map.put(pairs[i], pairs[i + 1]);
    }
    return Collections.unmodifiableMap(map);
  }
}
