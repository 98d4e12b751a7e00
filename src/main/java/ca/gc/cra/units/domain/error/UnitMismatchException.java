package ca.gc.cra.units.domain.error;

/**
 * Engineering-friendly failure raised by {@code add}/{@code subtract} across incompatible dimensions.
 *
 * <p>Messages read like {@code Cannot add 'kPa' and 'kN': incompatible dimensions ...}. The underlying
 * {@link DimensionMismatchException} is kept as the cause.</p>
 *
 * @since 0.1.0
 */
public final class UnitMismatchException extends UnitException {
  private final String operation;
  private final String leftUnit;
  private final String rightUnit;

  private UnitMismatchException(
      String message, String operation, String leftUnit, String rightUnit, Throwable cause) {
    super(message, cause);
    this.operation = operation;
    this.leftUnit = leftUnit;
    this.rightUnit = rightUnit;
  }

  /**
   * Builds a mismatch error with operation context.
   *
   * @param operation arithmetic operation that failed, e.g. {@code add}
   * @param leftUnit unit of the left operand
   * @param rightUnit unit of the right operand
   * @param cause lower-level dimension error; may be {@code null}
   * @return the exception
   */
  public static UnitMismatchException fromDimensions(
      String operation, String leftUnit, String rightUnit, DimensionMismatchException cause) {
    StringBuilder message = new StringBuilder()
        .append("Cannot ").append(operation)
        .append(" '").append(leftUnit).append("' and '").append(rightUnit)
        .append("': incompatible dimensions");
    if (cause != null) {
      message.append(' ').append(cause.actualDimension()).append(" vs ").append(cause.expectedDimension());
    }
    return new UnitMismatchException(message.toString(), operation, leftUnit, rightUnit, cause);
  }

  /**
   * Returns the failing operation name.
   *
   * @return operation, e.g. {@code subtract}
   */
  public String operation() {
    return operation;
  }

  /**
   * Returns the left operand unit.
   *
   * @return unit symbol
   */
  public String leftUnit() {
    return leftUnit;
  }

  /**
   * Returns the right operand unit.
   *
   * @return unit symbol
   */
  public String rightUnit() {
    return rightUnit;
  }
}
