package ca.gc.cra.units.domain.error;

/**
 * Raised when an operation requires dimensional compatibility that does not hold.
 *
 * @since 0.1.0
 */
public final class DimensionMismatchException extends UnitException {
  private final String actualDimension;
  private final String expectedDimension;

  /**
   * Creates the exception.
   *
   * @param actualDimension dimensionality of the quantity or source unit
   * @param expectedDimension dimensionality that was required
   * @param message human-readable error quoting both dimensionalities
   */
  public DimensionMismatchException(String actualDimension, String expectedDimension, String message) {
    super(message);
    this.actualDimension = actualDimension;
    this.expectedDimension = expectedDimension;
  }

  /**
   * Returns the dimensionality that was found.
   *
   * @return actual dimensionality string
   */
  public String actualDimension() {
    return actualDimension;
  }

  /**
   * Returns the dimensionality that was required.
   *
   * @return expected dimensionality string
   */
  public String expectedDimension() {
    return expectedDimension;
  }
}
