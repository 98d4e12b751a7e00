package ca.gc.cra.units.domain.unit;

import java.util.Locale;
import java.util.Optional;

/**
 * Named semantic categories of physical quantity and the dimension each one carries.
 *
 * <p>Several kinds share a dimension (pressure and stress, energy and moment); the name is what a policy or a
 * format template keys on.</p>
 *
 * @since 0.1.0
 */
public enum QuantityKind {
  LENGTH("length", Dimensions.LENGTH),
  AREA("area", Dimensions.LENGTH.pow(2)),
  VOLUME("volume", Dimensions.LENGTH.pow(3)),
  MASS("mass", Dimensions.MASS),
  TIME("time", Dimensions.TIME),
  TEMPERATURE("temperature", Dimension.of(BaseDimension.TEMPERATURE)),
  SPEED("speed", Dimensions.LENGTH.dividedBy(Dimensions.TIME)),
  FORCE("force", Dimensions.FORCE),
  PRESSURE("pressure", Dimensions.FORCE.dividedBy(Dimensions.LENGTH.pow(2))),
  STRESS("stress", Dimensions.FORCE.dividedBy(Dimensions.LENGTH.pow(2))),
  MOMENT("moment", Dimensions.FORCE.times(Dimensions.LENGTH)),
  ENERGY("energy", Dimensions.FORCE.times(Dimensions.LENGTH)),
  POWER("power", Dimensions.FORCE.times(Dimensions.LENGTH).dividedBy(Dimensions.TIME)),
  DENSITY("density", Dimensions.MASS.dividedBy(Dimensions.LENGTH.pow(3)));

  private final String key;
  private final Dimension dimension;

  QuantityKind(String key, Dimension dimension) {
    this.key = key;
    this.dimension = dimension;
  }

  /**
   * Returns the lower-case key used in configuration and templates, e.g. {@code pressure}.
   *
   * @return key
   */
  public String key() {
    return key;
  }

  /**
   * Returns the dimension shared by quantities of this kind.
   *
   * @return dimension
   */
  public Dimension dimension() {
    return dimension;
  }

  /**
   * Looks a kind up by key.
   *
   * @param key category key such as {@code length}; case-insensitive
   * @return matching kind, or empty when unknown
   */
  public static Optional<QuantityKind> fromKey(String key) {
    if (key == null) {
      return Optional.empty();
    }
    String normalized = key.trim().toLowerCase(Locale.ROOT);
    for (QuantityKind kind : values()) {
      if (kind.key.equals(normalized)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }

  private static final class Dimensions {
    static final Dimension LENGTH = Dimension.of(BaseDimension.LENGTH);
    static final Dimension MASS = Dimension.of(BaseDimension.MASS);
    static final Dimension TIME = Dimension.of(BaseDimension.TIME);
    static final Dimension FORCE = MASS.times(LENGTH).dividedBy(TIME.pow(2));
  }
}
