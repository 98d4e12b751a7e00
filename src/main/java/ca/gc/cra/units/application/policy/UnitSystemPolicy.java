package ca.gc.cra.units.application.policy;

import ca.gc.cra.units.application.port.MetricsPort;
import ca.gc.cra.units.domain.error.PolicyViolationException;
import ca.gc.cra.units.domain.quantity.TrackedQuantity;
import ca.gc.cra.units.domain.unit.Unit;
import ca.gc.cra.units.domain.unit.UnitRegistry;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Enforces that quantities are expressed in the unit a named system expects for their
 * category.
 * <p><strong>Why:</strong> Keeps a project from silently mixing, say, millimetres and inches across calculation
 * boundaries.</p>
 * <p><strong>Role:</strong> Application service invoked at the edge of each calculation.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Report whether a quantity already uses the expected unit ({@link #validate}).</li>
 *   <li>Convert or reject quantities that do not ({@link #enforce}).</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 * <p><strong>Observability:</strong> Increments {@code policy.enforce.passed}, {@code policy.enforce.converted}
 * and {@code policy.enforce.violation}.</p>
 *
 * @since 0.1.0
 */
public final class UnitSystemPolicy {
  private static final Logger log = LoggerFactory.getLogger(UnitSystemPolicy.class);

  private final String system;
  private final boolean strict;
  private final boolean autoConvert;
  private final Map<String, String> units;
  private final MetricsPort metrics;

  /**
   * Creates a lenient, auto-converting policy.
   *
   * @param system unit system name
   * @throws IllegalArgumentException when the system is unknown
   */
  public UnitSystemPolicy(String system) {
    this(system, false, true);
  }

  /**
   * Creates a policy without metrics.
   *
   * @param system unit system name
   * @param strict reject categories the system does not define
   * @param autoConvert convert compatible quantities instead of rejecting them
   * @throws IllegalArgumentException when the system is unknown
   */
  public UnitSystemPolicy(String system, boolean strict, boolean autoConvert) {
    this(system, strict, autoConvert, MetricsPort.NO_OP);
  }

  /**
   * Creates a policy.
   *
   * @param system unit system name
   * @param strict reject categories the system does not define
   * @param autoConvert convert compatible quantities instead of rejecting them
   * @param metrics metrics sink; must not be {@code null}
   * @throws IllegalArgumentException when the system is unknown
   */
  public UnitSystemPolicy(String system, boolean strict, boolean autoConvert, MetricsPort metrics) {
    this.units = UnitSystems.require(system);
    this.system = system;
    this.strict = strict;
    this.autoConvert = autoConvert;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public String system() {
    return system;
  }

  public boolean strict() {
    return strict;
  }

  public boolean autoConvert() {
    return autoConvert;
  }

  /**
   * Returns the unit expected for a category.
   *
   * @param category quantity category
   * @return unit text, or {@code null} when the system does not define the category
   */
  public String expectedUnit(String category) {
    return units.get(category);
  }

  /**
   * Indicates whether a quantity already uses the expected unit.
   *
   * @param quantity quantity to check
   * @param category quantity category such as {@code length}
   * @return {@code true} when the canonical symbols match or the category is not defined by this system
   */
  public boolean validate(TrackedQuantity quantity, String category) {
    Objects.requireNonNull(quantity, "quantity");
    String expected = units.get(category);
    if (expected == null) {
      return true;
    }
    return quantity.unit().equals(UnitRegistry.getInstance().resolve(expected));
  }

  /**
   * Applies the policy.
   *
   * <p>Categories the system does not define pass through unchanged in lenient mode. Strict mode extends the
   * check to them and treats an undefined category as a violation.
   * Unit mismatches within a defined category are governed by {@code autoConvert} alone.</p>
   *
   * @param quantity quantity to check
   * @param category quantity category such as {@code pressure}
   * @return {@code quantity} itself when it passes, otherwise a converted copy
   * @throws PolicyViolationException when the unit differs and auto-conversion is off, or when the category is
   *     unknown in strict mode
   * @throws ca.gc.cra.units.domain.error.DimensionMismatchException when the quantity cannot be expressed in the
   *     expected unit at all
   */
  public TrackedQuantity enforce(TrackedQuantity quantity, String category) {
    Objects.requireNonNull(quantity, "quantity");
    Objects.requireNonNull(category, "category");
    String expected = units.get(category);
    if (expected == null) {
      if (strict) {
        metrics.increment("policy.enforce.violation");
        throw new PolicyViolationException(category, null, quantity.unitSymbol(),
            "Unit policy violation: category '" + category + "' is not defined by unit system '" + system
                + "'");
      }
      metrics.increment("policy.enforce.passed");
      return quantity;
    }
    Unit expectedUnit = UnitRegistry.getInstance().resolve(expected);
    quantity.checkDimensions(expected);
    if (quantity.unit().equals(expectedUnit)) {
      metrics.increment("policy.enforce.passed");
      return quantity;
    }
    if (!autoConvert) {
      metrics.increment("policy.enforce.violation");
      throw new PolicyViolationException(category, expected, quantity.unitSymbol(),
          "Unit policy violation: expected '" + expected + "' for '" + category + "', got '"
              + quantity.unitSymbol() + "'");
    }
    log.debug("Converting {} from {} to {} under {}", category, quantity.unitSymbol(), expected, system);
    metrics.increment("policy.enforce.converted");
    return quantity.to(expectedUnit);
  }

  @Override
  public String toString() {
    return "UnitSystemPolicy{system=" + system + ", strict=" + strict + ", autoConvert=" + autoConvert + '}';
  }
}
