package ca.gc.cra.units.domain.unit;

import java.util.Objects;

/**
 * <strong>What:</strong> Immutable unit handle resolved by {@link UnitRegistry}.
 * <p><strong>Why:</strong> Carries everything needed to convert and compare quantities: a canonical symbol, the
 * physical {@link Dimension}, the scale to the coherent SI unit of that dimension and an additive offset for
 * temperature scales.</p>
 * <p><strong>Role:</strong> Domain value object referenced by every tracked quantity.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Compare by canonical symbol ({@link #equals(Object)}) and by dimension ({@link #isCompatible(Unit)}).</li>
 *   <li>Compose derived units for multiplication, division and integer powers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent sharing.</p>
 *
 * @implNote Composite units always carry a zero offset: an offset scale inside a product behaves as an interval.
 * @since 0.1.0
 */
public final class Unit {
  private static final String DIMENSIONLESS_SYMBOL = "dimensionless";

  /** The unit of pure numbers. */
  public static final Unit DIMENSIONLESS =
      new Unit(DIMENSIONLESS_SYMBOL, Dimension.DIMENSIONLESS, 1.0, 0.0, Form.SIMPLE);

  enum Form {
    SIMPLE,
    POWER,
    COMPOSITE
  }

  private final String symbol;
  private final Dimension dimension;
  private final double scale;
  private final double offset;
  private final Form form;

  Unit(String symbol, Dimension dimension, double scale, double offset) {
    this(symbol, dimension, scale, offset, Form.SIMPLE);
  }

  private Unit(String symbol, Dimension dimension, double scale, double offset, Form form) {
    this.symbol = Objects.requireNonNull(symbol, "symbol");
    this.dimension = Objects.requireNonNull(dimension, "dimension");
    this.scale = scale;
    this.offset = offset;
    this.form = form;
  }

  /**
   * Returns the canonical symbol, e.g. {@code kPa} or {@code kN * m}.
   *
   * @return canonical symbol
   */
  public String symbol() {
    return symbol;
  }

  /**
   * Returns the physical dimension of this unit.
   *
   * @return dimension
   */
  public Dimension dimension() {
    return dimension;
  }

  /**
   * Returns the multiplier converting one of this unit to the coherent SI unit of its dimension.
   *
   * @return scale factor
   */
  public double scale() {
    return scale;
  }

  /**
   * Returns the additive offset applied after scaling (non-zero only for degC, degF).
   *
   * @return offset in SI base units
   */
  public double offset() {
    return offset;
  }

  /**
   * Indicates whether this unit shares the dimension of {@code other}.
   *
   * @param other unit to compare; {@code null} is never compatible
   * @return {@code true} when both dimensions match
   */
  public boolean isCompatible(Unit other) {
    return other != null && dimension.equals(other.dimension);
  }

  /**
   * Returns the product unit {@code this * other}.
   *
   * @param other right operand; must not be {@code null}
   * @return derived unit
   */
  public Unit times(Unit other) {
    Objects.requireNonNull(other, "other");
    if (isPlainDimensionless()) {
      return other;
    }
    if (other.isPlainDimensionless()) {
      return this;
    }
    return new Unit(
        symbol + " * " + other.symbol,
        dimension.times(other.dimension),
        scale * other.scale,
        0.0,
        Form.COMPOSITE);
  }

  /**
   * Returns the quotient unit {@code this / other}.
   *
   * @param other divisor; must not be {@code null}
   * @return derived unit
   */
  public Unit dividedBy(Unit other) {
    Objects.requireNonNull(other, "other");
    if (other.isPlainDimensionless()) {
      return this;
    }
    if (isPlainDimensionless()) {
      return other.pow(-1);
    }
    String divisor = other.form == Form.COMPOSITE ? "(" + other.symbol + ")" : other.symbol;
    return new Unit(
        symbol + " / " + divisor,
        dimension.dividedBy(other.dimension),
        scale / other.scale,
        0.0,
        Form.COMPOSITE);
  }

  /**
   * Raises this unit to an integer power.
   *
   * @param power exponent; zero yields {@link #DIMENSIONLESS}
   * @return derived unit
   */
  public Unit pow(int power) {
    if (power == 1) {
      return this;
    }
    if (power == 0) {
      return DIMENSIONLESS;
    }
    String base = form == Form.SIMPLE ? symbol : "(" + symbol + ")";
    return new Unit(
        base + " ** " + power,
        dimension.pow(power),
        Math.pow(scale, power),
        0.0,
        Form.POWER);
  }

  private boolean isPlainDimensionless() {
    return DIMENSIONLESS_SYMBOL.equals(symbol);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Unit that)) {
      return false;
    }
    return symbol.equals(that.symbol);
  }

  @Override
  public int hashCode() {
    return symbol.hashCode();
  }

  @Override
  public String toString() {
    return symbol;
  }
}
