package ca.gc.cra.units.domain.unit;

import java.util.Locale;
import java.util.Optional;

/**
 * <strong>What:</strong> SI base dimensions over which every {@link Dimension} is expressed.
 * <p><strong>Role:</strong> Domain enumeration; declaration order is the rendering order of
 * dimensionality strings (e.g., {@code [mass] * [length] / [time] ** 2}).</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 */
public enum BaseDimension {
  /** Mass, base unit kilogram. */
  MASS("mass"),
  /** Length, base unit meter. */
  LENGTH("length"),
  /** Time, base unit second. */
  TIME("time"),
  /** Thermodynamic temperature, base unit kelvin. */
  TEMPERATURE("temperature"),
  /** Electric current, base unit ampere. */
  CURRENT("current"),
  /** Amount of substance, base unit mole. */
  SUBSTANCE("substance"),
  /** Luminous intensity, base unit candela. */
  LUMINOSITY("luminosity");

  private final String label;

  BaseDimension(String label) {
    this.label = label;
  }

  /**
   * Returns the lower-case name used inside brackets, e.g. {@code length}.
   *
   * @return dimension label
   */
  public String label() {
    return label;
  }

  /**
   * Looks up a base dimension by its bracketless label.
   *
   * @param label label such as {@code mass}; case-insensitive
   * @return matching dimension, or empty when unknown
   */
  public static Optional<BaseDimension> fromLabel(String label) {
    if (label == null) {
      return Optional.empty();
    }
    String normalized = label.trim().toLowerCase(Locale.ROOT);
    for (BaseDimension dimension : values()) {
      if (dimension.label.equals(normalized)) {
        return Optional.of(dimension);
      }
    }
    return Optional.empty();
  }
}
