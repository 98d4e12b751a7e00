package ca.gc.cra.units.domain.error;

/**
 * Raised when a unit-system policy rejects a quantity.
 *
 * @since 0.1.0
 */
public final class PolicyViolationException extends UnitException {
  private final String category;
  private final String expectedUnit;
  private final String actualUnit;

  /**
   * Creates the exception.
   *
   * @param category quantity category being enforced, e.g. {@code length}
   * @param expectedUnit unit required by the policy; {@code null} when the category is unknown
   * @param actualUnit unit carried by the rejected quantity
   * @param message human-readable error
   */
  public PolicyViolationException(String category, String expectedUnit, String actualUnit, String message) {
    super(message);
    this.category = category;
    this.expectedUnit = expectedUnit;
    this.actualUnit = actualUnit;
  }

  /**
   * Returns the enforced category.
   *
   * @return category name
   */
  public String category() {
    return category;
  }

  /**
   * Returns the unit the policy expected.
   *
   * @return expected unit symbol, or {@code null}
   */
  public String expectedUnit() {
    return expectedUnit;
  }

  /**
   * Returns the unit the quantity carried.
   *
   * @return actual unit symbol
   */
  public String actualUnit() {
    return actualUnit;
  }
}
