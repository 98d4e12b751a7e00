package ca.gc.cra.units.domain.error;

/**
 * Raised when an optional external capability (the Graphviz renderer) is not installed.
 *
 * @since 0.1.0
 */
public final class OptionalDependencyException extends UnitException {
  private final String dependency;

  /**
   * Creates the exception.
   *
   * @param dependency name of the missing dependency, e.g. {@code graphviz}
   * @param message human-readable error
   * @param cause failure observed while probing, may be {@code null}
   */
  public OptionalDependencyException(String dependency, String message, Throwable cause) {
    super(message, cause);
    this.dependency = dependency;
  }

  /**
   * Returns the missing dependency name.
   *
   * @return dependency name
   */
  public String dependency() {
    return dependency;
  }
}
