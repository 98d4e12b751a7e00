package ca.gc.cra.units.domain.error;

/**
 * Base type for every failure raised by unit resolution, dimensional analysis and rendering.
 *
 * <p>Unchecked: callers decide whether to recover (for example by re-running with an explicit conversion)
 * or to let the failure propagate.</p>
 *
 * @since 0.1.0
 */
public class UnitException extends RuntimeException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error naming the offending unit(s)
   */
  public UnitException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error naming the offending unit(s)
   * @param cause lower-level failure
   */
  public UnitException(String message, Throwable cause) {
    super(message, cause);
  }
}
