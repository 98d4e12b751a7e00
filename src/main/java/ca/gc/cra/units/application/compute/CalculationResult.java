package ca.gc.cra.units.application.compute;

import ca.gc.cra.units.domain.quantity.TrackedQuantity;
import java.util.Optional;

/**
 * Outcome of a {@link UnitCheckedCalculation}: always a number, and a tracked quantity when one was produced.
 *
 * @since 0.1.0
 */
public final class CalculationResult {
  private final double value;
  private final TrackedQuantity tracked;

  private CalculationResult(double value, TrackedQuantity tracked) {
    this.value = value;
    this.tracked = tracked;
  }

  static CalculationResult raw(double value) {
    return new CalculationResult(value, null);
  }

  static CalculationResult tracked(TrackedQuantity tracked) {
    return new CalculationResult(tracked.magnitude(), tracked);
  }

  /**
   * Returns the magnitude, in the return unit when the result is tracked.
   *
   * @return result value
   */
  public double value() {
    return value;
  }

  public boolean isTracked() {
    return tracked != null;
  }

  public Optional<TrackedQuantity> tracked() {
    return Optional.ofNullable(tracked);
  }

  @Override
  public String toString() {
    return tracked != null ? tracked.toString() : "CalculationResult(" + value + ")";
  }
}
