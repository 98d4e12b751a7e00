package ca.gc.cra.units.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for names, labels and unit text entering the unit engine.
 * <p><strong>Why:</strong> Rejects blank or control-character input before it reaches the registry or ends up in an
 * audit export.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs supplied via config files or callers.</li>
 *   <li>Produce consistent diagnostics naming the offending parameter.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)} so tabs and newlines cannot
 *     corrupt CSV or DOT exports.
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Normalizes an optional label: {@code null} becomes the empty string, other values are trimmed.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate label; may be {@code null} or empty
   * @return trimmed label, never {@code null}
   * @throws IllegalArgumentException if the label contains ISO control characters
   */
  public static String normalizeLabel(String name, String value) {
    if (value == null) {
      return "";
    }
    if (containsControl(value)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return value.trim();
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
