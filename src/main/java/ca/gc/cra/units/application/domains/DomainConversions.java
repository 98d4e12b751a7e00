package ca.gc.cra.units.application.domains;

/**
 * Static shortcuts over {@link DomainUnitAdapter} for metocean, energy and commodity feeds.
 *
 * <p>The two-argument overloads convert into the domain default: {@code m/s} for speed, {@code m} for length,
 * {@code celsius} for temperature, {@code hPa} for pressure, {@code kg} for mass and {@code m3} for volume.</p>
 *
 * @since 0.1.0
 */
public final class DomainConversions {
  private DomainConversions() {
    // Utility
  }

  public static Double convertSpeed(Double value, String fromKey) {
    return toDefault(DomainUnitAdapter.SPEED, value, fromKey);
  }

  public static Double convertSpeed(Double value, String fromKey, String toKey) {
    return DomainUnitAdapter.SPEED.convert(value, fromKey, toKey);
  }

  public static Double convertLength(Double value, String fromKey) {
    return toDefault(DomainUnitAdapter.LENGTH, value, fromKey);
  }

  public static Double convertLength(Double value, String fromKey, String toKey) {
    return DomainUnitAdapter.LENGTH.convert(value, fromKey, toKey);
  }

  public static Double convertTemperature(Double value, String fromKey) {
    return toDefault(DomainUnitAdapter.TEMPERATURE, value, fromKey);
  }

  public static Double convertTemperature(Double value, String fromKey, String toKey) {
    return DomainUnitAdapter.TEMPERATURE.convert(value, fromKey, toKey);
  }

  public static Double convertPressure(Double value, String fromKey) {
    return toDefault(DomainUnitAdapter.PRESSURE, value, fromKey);
  }

  public static Double convertPressure(Double value, String fromKey, String toKey) {
    return DomainUnitAdapter.PRESSURE.convert(value, fromKey, toKey);
  }

  /**
   * Converts between energy and commodity keys such as {@code BOE}, {@code MMBTU} or {@code MCF}.
   *
   * @param value magnitude
   * @param fromKey source key
   * @param toKey target key
   * @return converted magnitude
   * @throws ca.gc.cra.units.domain.error.UnknownUnitException when a key is not an energy key
   * @throws ca.gc.cra.units.domain.error.DimensionMismatchException for cross-dimension pairs like {@code BBL}
   *     to {@code BOE}
   */
  public static double convertEnergyUnits(double value, String fromKey, String toKey) {
    return DomainUnitAdapter.ENERGY.convert(value, fromKey, toKey);
  }

  public static Double convertMass(Double value, String fromKey) {
    return toDefault(DomainUnitAdapter.MASS, value, fromKey);
  }

  public static Double convertMass(Double value, String fromKey, String toKey) {
    return DomainUnitAdapter.MASS.convert(value, fromKey, toKey);
  }

  public static Double convertVolume(Double value, String fromKey) {
    return toDefault(DomainUnitAdapter.VOLUME, value, fromKey);
  }

  public static Double convertVolume(Double value, String fromKey, String toKey) {
    return DomainUnitAdapter.VOLUME.convert(value, fromKey, toKey);
  }

  private static Double toDefault(DomainUnitAdapter adapter, Double value, String fromKey) {
    String target = adapter.defaultTargetKey()
        .orElseThrow(() -> new IllegalStateException(adapter.domain() + " has no default target unit"));
    return adapter.convert(value, fromKey, target);
  }
}
