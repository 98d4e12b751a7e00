package ca.gc.cra.units.validation;

import java.time.Duration;
import java.util.Objects;

/**
 * <strong>What:</strong> Numeric validation helpers for format templates, timeouts and configuration values.
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a duration is strictly positive.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate duration; must not be {@code null}
   * @return the validated duration
   * @throws IllegalArgumentException if the duration is zero or negative
   */
  public static Duration requirePositive(String name, Duration value) {
    Objects.requireNonNull(value, label(name));
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(label(name) + " must be positive (was " + value + ")");
    }
    return value;
  }

  /**
   * Converts a configuration value to a finite {@code double}.
   *
   * <p>Accepts {@link Number} instances and numeric strings; booleans are rejected even though YAML parsers may
   * produce them for words such as {@code yes}.</p>
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @return the numeric value
   * @throws IllegalArgumentException if the value is missing, non-numeric or not finite
   */
  public static double requireFinite(String name, Object value) {
    double result;
    if (value instanceof Number number) {
      result = number.doubleValue();
    } else if (value instanceof String text && !text.isBlank()) {
      try {
        result = Double.parseDouble(text.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(label(name) + " must be numeric (was '" + text + "')", ex);
      }
    } else {
      throw new IllegalArgumentException(label(name) + " must be numeric (was " + describe(value) + ")");
    }
    if (!Double.isFinite(result)) {
      throw new IllegalArgumentException(label(name) + " must be finite (was " + result + ")");
    }
    return result;
  }

  private static String describe(Object value) {
    if (value == null) {
      return "null";
    }
    return "'" + value + "' of type " + value.getClass().getSimpleName();
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
