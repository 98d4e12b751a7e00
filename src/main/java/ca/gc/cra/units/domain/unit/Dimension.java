package ca.gc.cra.units.domain.unit;

import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Physical dimensionality expressed as an exponent vector over {@link BaseDimension}.
 * <p><strong>Why:</strong> Dimensional safety is checked at runtime by comparing these vectors, so config-driven
 * values get the same protection as literals.</p>
 * <p><strong>Role:</strong> Domain value object owned by {@link Unit}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class Dimension {
  /** Dimension with every exponent zero. */
  public static final Dimension DIMENSIONLESS = new Dimension(new int[BaseDimension.values().length]);

  private static final String DIMENSIONLESS_LABEL = "dimensionless";

  private final int[] exponents;

  private Dimension(int[] exponents) {
    this.exponents = exponents;
  }

  /**
   * Returns the dimension consisting of a single base dimension raised to the first power.
   *
   * @param base base dimension; must not be {@code null}
   * @return dimension for {@code base}
   */
  public static Dimension of(BaseDimension base) {
    return of(base, 1);
  }

  /**
   * Returns the dimension {@code base ** exponent}.
   *
   * @param base base dimension; must not be {@code null}
   * @param exponent integer exponent, may be negative
   * @return resulting dimension
   */
  public static Dimension of(BaseDimension base, int exponent) {
    Objects.requireNonNull(base, "base");
    int[] vector = new int[BaseDimension.values().length];
    vector[base.ordinal()] = exponent;
    return new Dimension(vector);
  }

  /**
   * Parses a rendered dimensionality such as {@code [mass] / [length] / [time] ** 2}.
   *
   * <p>Accepts {@code **} or {@code ^} for powers, {@code *} and {@code /} as separators, a leading {@code 1}
   * and the literal {@code dimensionless}.</p>
   *
   * @param text dimensionality string; must not be {@code null}
   * @return parsed dimension
   * @throws IllegalArgumentException when the text is malformed or names an unknown base dimension
   */
  public static Dimension parse(String text) {
    Objects.requireNonNull(text, "text");
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("Dimensionality must not be blank");
    }
    if (trimmed.equals(DIMENSIONLESS_LABEL)) {
      return DIMENSIONLESS;
    }
    int[] vector = new int[BaseDimension.values().length];
    int sign = 1;
    boolean expectTerm = true;
    int i = 0;
    while (i < trimmed.length()) {
      char c = trimmed.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (c == '[') {
        if (!expectTerm) {
          throw malformed(text);
        }
        int close = trimmed.indexOf(']', i);
        if (close < 0) {
          throw malformed(text);
        }
        String label = trimmed.substring(i + 1, close);
        BaseDimension base = BaseDimension.fromLabel(label)
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown base dimension '[" + label + "]' in '" + text + "'"));
        i = close + 1;
        int power = 1;
        int next = skipSpaces(trimmed, i);
        if (trimmed.startsWith("**", next) || trimmed.startsWith("^", next)) {
          int start = skipSpaces(trimmed, next + (trimmed.charAt(next) == '^' ? 1 : 2));
          int end = start;
          if (end < trimmed.length() && trimmed.charAt(end) == '-') {
            end++;
          }
          while (end < trimmed.length() && Character.isDigit(trimmed.charAt(end))) {
            end++;
          }
          try {
            power = Integer.parseInt(trimmed.substring(start, end));
          } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Malformed exponent in dimensionality '" + text + "'", ex);
          }
          i = end;
        }
        vector[base.ordinal()] += sign * power;
        expectTerm = false;
      } else if (c == '1' && expectTerm) {
        i++;
        expectTerm = false;
      } else if (c == '*' && !expectTerm) {
        sign = 1;
        expectTerm = true;
        i++;
      } else if (c == '/' && !expectTerm) {
        sign = -1;
        expectTerm = true;
        i++;
      } else {
        throw malformed(text);
      }
    }
    if (expectTerm) {
      throw malformed(text);
    }
    return new Dimension(vector);
  }

  /**
   * Returns the exponent of the supplied base dimension.
   *
   * @param base base dimension
   * @return exponent, zero when absent
   */
  public int exponent(BaseDimension base) {
    return exponents[base.ordinal()];
  }

  /**
   * Returns the product of this dimension and {@code other}.
   *
   * @param other right operand
   * @return combined dimension
   */
  public Dimension times(Dimension other) {
    int[] vector = new int[exponents.length];
    for (int i = 0; i < vector.length; i++) {
      vector[i] = exponents[i] + other.exponents[i];
    }
    return new Dimension(vector);
  }

  /**
   * Returns the quotient of this dimension by {@code other}.
   *
   * @param other divisor
   * @return combined dimension
   */
  public Dimension dividedBy(Dimension other) {
    int[] vector = new int[exponents.length];
    for (int i = 0; i < vector.length; i++) {
      vector[i] = exponents[i] - other.exponents[i];
    }
    return new Dimension(vector);
  }

  /**
   * Raises this dimension to an integer power.
   *
   * @param power exponent
   * @return resulting dimension
   */
  public Dimension pow(int power) {
    int[] vector = new int[exponents.length];
    for (int i = 0; i < vector.length; i++) {
      vector[i] = exponents[i] * power;
    }
    return new Dimension(vector);
  }

  /**
   * Indicates whether every exponent is zero.
   *
   * @return {@code true} for dimensionless quantities
   */
  public boolean isDimensionless() {
    for (int exponent : exponents) {
      if (exponent != 0) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Dimension that)) {
      return false;
    }
    return Arrays.equals(exponents, that.exponents);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(exponents);
  }

  /**
   * Renders the dimensionality, positive exponents first, e.g. {@code [mass] * [length] / [time] ** 2}.
   *
   * @return rendered dimensionality or {@code dimensionless}
   */
  @Override
  public String toString() {
    if (isDimensionless()) {
      return DIMENSIONLESS_LABEL;
    }
    StringBuilder sb = new StringBuilder();
    BaseDimension[] bases = BaseDimension.values();
    for (BaseDimension base : bases) {
      int exponent = exponents[base.ordinal()];
      if (exponent > 0) {
        if (sb.length() > 0) {
          sb.append(" * ");
        }
        appendTerm(sb, base, exponent);
      }
    }
    if (sb.length() == 0) {
      sb.append('1');
    }
    for (BaseDimension base : bases) {
      int exponent = exponents[base.ordinal()];
      if (exponent < 0) {
        sb.append(" / ");
        appendTerm(sb, base, -exponent);
      }
    }
    return sb.toString();
  }

  private static void appendTerm(StringBuilder sb, BaseDimension base, int exponent) {
    sb.append('[').append(base.label()).append(']');
    if (exponent != 1) {
      sb.append(" ** ").append(exponent);
    }
  }

  private static int skipSpaces(String text, int index) {
    int i = index;
    while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
      i++;
    }
    return i;
  }

  private static IllegalArgumentException malformed(String text) {
    return new IllegalArgumentException("Malformed dimensionality '" + text + "'");
  }
}
