package ca.gc.cra.units.domain.error;

/**
 * Raised when an installed graph renderer fails, exits non-zero or exceeds its timeout.
 *
 * @since 0.1.0
 */
public final class LineageRenderException extends UnitException {
  /**
   * Creates the exception.
   *
   * @param message human-readable error
   */
  public LineageRenderException(String message) {
    super(message);
  }

  /**
   * Creates the exception with a cause.
   *
   * @param message human-readable error
   * @param cause underlying IO or interruption failure
   */
  public LineageRenderException(String message, Throwable cause) {
    super(message, cause);
  }
}
