package ca.gc.cra.units.domain.error;

import java.util.Collection;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Raised when a unit string, or a domain adapter key, cannot be resolved.
 *
 * @since 0.1.0
 */
public final class UnknownUnitException extends UnitException {
  private final String unit;
  private final String domain;

  /**
   * Creates an exception for an unresolvable registry unit string.
   *
   * @param unit offending unit text
   * @param message human-readable error
   */
  public UnknownUnitException(String unit, String message) {
    this(unit, null, message);
  }

  private UnknownUnitException(String unit, String domain, String message) {
    super(message);
    this.unit = unit;
    this.domain = domain;
  }

  /**
   * Builds the error for a registry lookup failure.
   *
   * @param unit offending unit text
   * @return exception whose message quotes {@code unit}
   */
  public static UnknownUnitException forUnit(String unit) {
    return new UnknownUnitException(unit, "Unknown unit '" + unit + "'");
  }

  /**
   * Builds the error for a domain adapter key, e.g. {@code Unknown speed unit 'furlongs'}.
   *
   * @param domain adapter label such as {@code speed}
   * @param key offending key
   * @param knownKeys keys the adapter accepts; listed sorted in the message
   * @return domain-typed exception
   */
  public static UnknownUnitException forDomain(String domain, String key, Collection<String> knownKeys) {
    Objects.requireNonNull(domain, "domain");
    return new UnknownUnitException(key, domain,
        "Unknown " + domain + " unit '" + key + "'. Known units: " + new TreeSet<>(knownKeys));
  }

  /**
   * Builds the error for a configuration field with no known physical quantity.
   *
   * @param field offending field name
   * @param unitSystem unit system the field was parsed under
   * @return exception naming the field
   */
  public static UnknownUnitException forField(String field, String unitSystem) {
    return new UnknownUnitException(field, "field",
        "Cannot determine unit for config field '" + field + "' under unit system '" + unitSystem + "'");
  }

  /**
   * Returns the unit string or key that failed to resolve.
   *
   * @return offending text
   */
  public String unit() {
    return unit;
  }

  /**
   * Returns the adapter domain when raised by a domain adapter.
   *
   * @return domain label, or {@code null} for registry failures
   */
  public String domain() {
    return domain;
  }
}
