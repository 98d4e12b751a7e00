package ca.gc.cra.units.domain.quantity;

import ca.gc.cra.units.domain.error.DimensionMismatchException;
import ca.gc.cra.units.domain.error.UnitMismatchException;
import ca.gc.cra.units.domain.unit.Dimension;
import ca.gc.cra.units.domain.unit.Unit;
import ca.gc.cra.units.domain.unit.UnitRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.DoubleBinaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Immutable magnitude (scalar or array) paired with a {@link Unit} and its provenance trail.
 * <p><strong>Why:</strong> Catches arithmetic across incompatible dimensions at the point it happens and keeps
 * enough history to replay how every value was obtained.</p>
 * <p><strong>Role:</strong> Central domain value type consumed by policies, audit logs and formatters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Convert between compatible units, recording a {@code converted} entry.</li>
 *   <li>Combine quantities element-wise, concatenating operand provenance and appending one entry.</li>
 *   <li>Serialize to and from plain maps.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; magnitudes are defensively copied on the way in and out.</p>
 *
 * @implNote Provenance is a flattened append-only log: a derived value carries the left operand history, then the
 *     right operand history, then the new entry.
 * @since 0.1.0
 */
public final class TrackedQuantity {
  private static final Logger log = LoggerFactory.getLogger(TrackedQuantity.class);
  private static final UnitRegistry REGISTRY = UnitRegistry.getInstance();

  private final double[] values;
  private final boolean array;
  private final Unit unit;
  private final List<ProvenanceEntry> provenance;
  private final Clock clock;

  private TrackedQuantity(
      double[] values, boolean array, Unit unit, List<ProvenanceEntry> provenance, Clock clock) {
    this.values = values;
    this.array = array;
    this.unit = unit;
    this.provenance = Collections.unmodifiableList(provenance);
    this.clock = clock;
  }

  /**
   * Creates a scalar quantity with an empty source label.
   *
   * @param magnitude value expressed in {@code unit}
   * @param unit unit text resolvable by {@link UnitRegistry}
   * @return new quantity with a single {@code created} entry
   * @throws ca.gc.cra.units.domain.error.UnknownUnitException when the unit cannot be resolved
   */
  public static TrackedQuantity create(double magnitude, String unit) {
    return create(magnitude, unit, "");
  }

  /**
   * Creates a scalar quantity stamped with the system UTC clock.
   *
   * @param magnitude value expressed in {@code unit}
   * @param unit unit text resolvable by {@link UnitRegistry}
   * @param source provenance label, e.g. {@code config/pipe.yml}; {@code null} is treated as empty
   * @return new quantity
   */
  public static TrackedQuantity create(double magnitude, String unit, String source) {
    return create(magnitude, unit, source, Clock.systemUTC());
  }

  /**
   * Creates a scalar quantity using the supplied clock for every provenance timestamp.
   *
   * @param magnitude value expressed in {@code unit}
   * @param unit unit text resolvable by {@link UnitRegistry}
   * @param source provenance label; {@code null} is treated as empty
   * @param clock timestamp source, inherited by derived quantities
   * @return new quantity
   */
  public static TrackedQuantity create(double magnitude, String unit, String source, Clock clock) {
    return create(new double[] {magnitude}, false, unit, source, clock);
  }

  /**
   * Creates an array quantity with an empty source label.
   *
   * @param magnitudes values expressed in {@code unit}; copied
   * @param unit unit text
   * @return new quantity
   */
  public static TrackedQuantity create(double[] magnitudes, String unit) {
    return create(magnitudes, unit, "");
  }

  /**
   * Creates an array quantity stamped with the system UTC clock.
   *
   * @param magnitudes values expressed in {@code unit}; copied
   * @param unit unit text
   * @param source provenance label
   * @return new quantity
   */
  public static TrackedQuantity create(double[] magnitudes, String unit, String source) {
    return create(magnitudes, unit, source, Clock.systemUTC());
  }

  /**
   * Creates an array quantity using the supplied clock.
   *
   * @param magnitudes values expressed in {@code unit}; copied
   * @param unit unit text
   * @param source provenance label
   * @param clock timestamp source
   * @return new quantity
   */
  public static TrackedQuantity create(double[] magnitudes, String unit, String source, Clock clock) {
    Objects.requireNonNull(magnitudes, "magnitudes");
    return create(magnitudes.clone(), true, unit, source, clock);
  }

  private static TrackedQuantity create(
      double[] values, boolean array, String unitText, String source, Clock clock) {
    Objects.requireNonNull(unitText, "unit");
    Objects.requireNonNull(clock, "clock");
    Unit resolved = REGISTRY.resolve(unitText);
    List<ProvenanceEntry> history = new ArrayList<>(1);
    history.add(new ProvenanceEntry(clock.instant(), OperationKind.CREATED, source, null, resolved.symbol()));
    return new TrackedQuantity(values, array, resolved, history, clock);
  }

  /**
   * Converts this quantity to another unit.
   *
   * @param target unit text; must share this quantity's dimension
   * @return converted quantity with one extra {@code converted} entry
   * @throws DimensionMismatchException when the dimensions differ
   * @throws ca.gc.cra.units.domain.error.UnknownUnitException when the target cannot be resolved
   */
  public TrackedQuantity to(String target) {
    Objects.requireNonNull(target, "target");
    return to(REGISTRY.resolve(target));
  }

  /**
   * Converts this quantity to another unit.
   *
   * @param target resolved unit
   * @return converted quantity
   * @throws DimensionMismatchException when the dimensions differ
   */
  public TrackedQuantity to(Unit target) {
    Objects.requireNonNull(target, "target");
    REGISTRY.requireCompatible(unit, target);
    double[] converted = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      converted[i] = REGISTRY.convert(values[i], unit, target);
    }
    if (log.isDebugEnabled()) {
      log.debug("Converted {} from {} to {}", formatMagnitude(), unit.symbol(), target.symbol());
    }
    List<ProvenanceEntry> history = new ArrayList<>(provenance.size() + 1);
    history.addAll(provenance);
    history.add(new ProvenanceEntry(
        clock.instant(), OperationKind.CONVERTED, "", unit.symbol(), target.symbol()));
    return new TrackedQuantity(converted, array, target, history, clock);
  }

  /**
   * Indicates whether {@code other} has the same dimension as this quantity.
   *
   * @param other quantity to compare; {@code null} yields {@code false}
   * @return {@code true} when compatible
   */
  public boolean isCompatible(TrackedQuantity other) {
    return other != null && unit.isCompatible(other.unit);
  }

  /**
   * Indicates whether this quantity can be expressed in {@code unitText}. Never throws.
   *
   * @param unitText unit text; unknown or {@code null} units yield {@code false}
   * @return {@code true} when compatible
   */
  public boolean isCompatible(String unitText) {
    if (!REGISTRY.isDefined(unitText)) {
      return false;
    }
    return unit.isCompatible(REGISTRY.resolve(unitText));
  }

  /**
   * Verifies the dimension of this quantity.
   *
   * <p>{@code expected} is read as a dimensionality string when it starts with {@code [} or equals
   * {@code dimensionless}, and as a unit string otherwise.</p>
   *
   * @param expected dimensionality or unit text
   * @throws DimensionMismatchException carrying the actual and expected dimensionality when they differ
   */
  public void checkDimensions(String expected) {
    Objects.requireNonNull(expected, "expected");
    String trimmed = expected.trim();
    Dimension wanted;
    if (trimmed.startsWith("[") || trimmed.equals("dimensionless")) {
      wanted = Dimension.parse(trimmed);
    } else {
      wanted = REGISTRY.resolve(trimmed).dimension();
    }
    if (!unit.dimension().equals(wanted)) {
      throw new DimensionMismatchException(
          unit.dimension().toString(),
          wanted.toString(),
          "Dimension mismatch for '" + unit.symbol() + "': expected " + wanted + " ('" + trimmed
              + "'), got " + unit.dimension());
    }
  }

  /**
   * Returns the rendered dimensionality of this quantity, e.g. {@code [mass] / [length] / [time] ** 2}.
   *
   * @return dimensionality string
   */
  public String dimensions() {
    return unit.dimension().toString();
  }

  /**
   * Adds {@code other}, converted into this quantity's unit.
   *
   * @param other right operand
   * @return sum expressed in this unit
   * @throws UnitMismatchException when the dimensions differ
   */
  public TrackedQuantity add(TrackedQuantity other) {
    return combineCompatible(other, OperationKind.ADD, Double::sum);
  }

  /**
   * Subtracts {@code other}, converted into this quantity's unit.
   *
   * @param other right operand
   * @return difference expressed in this unit
   * @throws UnitMismatchException when the dimensions differ
   */
  public TrackedQuantity subtract(TrackedQuantity other) {
    return combineCompatible(other, OperationKind.SUBTRACT, (a, b) -> a - b);
  }

  /**
   * Multiplies by another quantity; the result unit is the product of both units.
   *
   * @param other right operand
   * @return product
   */
  public TrackedQuantity multiply(TrackedQuantity other) {
    Objects.requireNonNull(other, "other");
    return derive(
        combine(values, other.values, (a, b) -> a * b),
        array || other.array,
        unit.times(other.unit),
        other.provenance,
        OperationKind.MULTIPLY);
  }

  /**
   * Multiplies every magnitude by a plain number.
   *
   * @param factor dimensionless factor
   * @return scaled quantity in the same unit
   */
  public TrackedQuantity multiply(double factor) {
    return derive(
        combine(values, new double[] {factor}, (a, b) -> a * b),
        array,
        unit,
        List.of(),
        OperationKind.MULTIPLY);
  }

  /**
   * Divides by another quantity; the result unit is the quotient of both units.
   *
   * @param other divisor
   * @return quotient
   */
  public TrackedQuantity divide(TrackedQuantity other) {
    Objects.requireNonNull(other, "other");
    return derive(
        combine(values, other.values, (a, b) -> a / b),
        array || other.array,
        unit.dividedBy(other.unit),
        other.provenance,
        OperationKind.DIVIDE);
  }

  /**
   * Divides every magnitude by a plain number.
   *
   * @param divisor dimensionless divisor
   * @return scaled quantity in the same unit
   */
  public TrackedQuantity divide(double divisor) {
    return derive(
        combine(values, new double[] {divisor}, (a, b) -> a / b),
        array,
        unit,
        List.of(),
        OperationKind.DIVIDE);
  }

  private TrackedQuantity combineCompatible(
      TrackedQuantity other, OperationKind operation, DoubleBinaryOperator op) {
    Objects.requireNonNull(other, "other");
    double[] right = new double[other.values.length];
    try {
      REGISTRY.requireCompatible(other.unit, unit);
      for (int i = 0; i < right.length; i++) {
        right[i] = REGISTRY.convert(other.values[i], other.unit, unit);
      }
    } catch (DimensionMismatchException ex) {
      throw UnitMismatchException.fromDimensions(
          operation.wireName(), unit.symbol(), other.unit.symbol(), ex);
    }
    return derive(combine(values, right, op), array || other.array, unit, other.provenance, operation);
  }

  private TrackedQuantity derive(
      double[] result,
      boolean resultIsArray,
      Unit resultUnit,
      List<ProvenanceEntry> otherProvenance,
      OperationKind operation) {
    List<ProvenanceEntry> history = new ArrayList<>(provenance.size() + otherProvenance.size() + 1);
    history.addAll(provenance);
    history.addAll(otherProvenance);
    history.add(new ProvenanceEntry(clock.instant(), operation, "", null, null));
    return new TrackedQuantity(result, resultIsArray, resultUnit, history, clock);
  }

  private static double[] combine(double[] left, double[] right, DoubleBinaryOperator op) {
    if (left.length == right.length) {
      double[] out = new double[left.length];
      for (int i = 0; i < out.length; i++) {
        out[i] = op.applyAsDouble(left[i], right[i]);
      }
      return out;
    }
    if (right.length == 1) {
      double[] out = new double[left.length];
      for (int i = 0; i < out.length; i++) {
        out[i] = op.applyAsDouble(left[i], right[0]);
      }
      return out;
    }
    if (left.length == 1) {
      double[] out = new double[right.length];
      for (int i = 0; i < out.length; i++) {
        out[i] = op.applyAsDouble(left[0], right[i]);
      }
      return out;
    }
    throw new IllegalArgumentException(
        "Cannot combine arrays of different lengths: " + left.length + " and " + right.length);
  }

  /**
   * Returns a copy of this quantity whose provenance is {@code prior} followed by this quantity's own history.
   *
   * <p>Used when a calculation re-wraps a raw result and wants to keep the history of its arguments.</p>
   *
   * @param prior entries to prepend; must not be {@code null}
   * @return new quantity with the same magnitude and unit
   */
  public TrackedQuantity withPriorProvenance(List<ProvenanceEntry> prior) {
    Objects.requireNonNull(prior, "prior");
    List<ProvenanceEntry> history = new ArrayList<>(prior.size() + provenance.size());
    history.addAll(prior);
    history.addAll(provenance);
    return new TrackedQuantity(values, array, unit, history, clock);
  }

  /**
   * Returns the scalar magnitude.
   *
   * @return magnitude in {@link #unit()}
   * @throws IllegalStateException when this quantity holds an array
   */
  public double magnitude() {
    if (array) {
      throw new IllegalStateException("Quantity holds an array of " + values.length + " values; use magnitudes()");
    }
    return values[0];
  }

  /**
   * Returns a copy of all magnitudes; a scalar yields a one-element array.
   *
   * @return magnitudes in {@link #unit()}
   */
  public double[] magnitudes() {
    return values.clone();
  }

  /**
   * Indicates whether the magnitude is an array.
   *
   * @return {@code true} for array quantities
   */
  public boolean isArray() {
    return array;
  }

  public Unit unit() {
    return unit;
  }

  public String unitSymbol() {
    return unit.symbol();
  }

  /**
   * Returns the full history, oldest first.
   *
   * @return unmodifiable list; never empty, first entry is {@code created}
   */
  public List<ProvenanceEntry> provenance() {
    return provenance;
  }

  /**
   * Serializes to {@code {magnitude, unit, provenance}}; array magnitudes become lists of doubles.
   *
   * @return insertion-ordered map
   */
  public Map<String, Object> toRecord() {
    Map<String, Object> record = new LinkedHashMap<>();
    if (array) {
      List<Double> list = new ArrayList<>(values.length);
      for (double value : values) {
        list.add(value);
      }
      record.put("magnitude", list);
    } else {
      record.put("magnitude", values[0]);
    }
    record.put("unit", unit.symbol());
    List<Map<String, Object>> entries = new ArrayList<>(provenance.size());
    for (ProvenanceEntry entry : provenance) {
      entries.add(entry.toRecord());
    }
    record.put("provenance", entries);
    return record;
  }

  /**
   * Rebuilds a quantity from a map produced by {@link #toRecord()}.
   *
   * <p>When the record carries no provenance, a fresh {@code created} entry is generated.</p>
   *
   * @param record serialized quantity
   * @return quantity with the recorded magnitude, unit and history
   * @throws IllegalArgumentException when the magnitude or unit is missing or malformed, or the provenance does
   *     not start with a {@code created} entry
   */
  public static TrackedQuantity fromRecord(Map<String, ?> record) {
    Objects.requireNonNull(record, "record");
    Object unitValue = record.get("unit");
    if (unitValue == null) {
      throw new IllegalArgumentException("quantity record is missing 'unit'");
    }
    Unit resolved = REGISTRY.resolve(unitValue.toString());
    Object magnitude = record.get("magnitude");
    double[] values;
    boolean array;
    if (magnitude instanceof List<?> list) {
      values = new double[list.size()];
      for (int i = 0; i < values.length; i++) {
        Object element = list.get(i);
        Double parsed = recordNumber(element);
        if (parsed == null) {
          throw new IllegalArgumentException("Non-numeric magnitude element '" + element + "' at index " + i);
        }
        values[i] = parsed;
      }
      array = true;
    } else {
      Double parsed = recordNumber(magnitude);
      if (parsed == null) {
        throw new IllegalArgumentException("quantity record has invalid 'magnitude': " + magnitude);
      }
      values = new double[] {parsed};
      array = false;
    }
    Clock clock = Clock.systemUTC();
    List<ProvenanceEntry> history = new ArrayList<>();
    Object rawProvenance = record.get("provenance");
    if (rawProvenance instanceof List<?> entries) {
      for (Object entry : entries) {
        if (!(entry instanceof Map<?, ?> map)) {
          throw new IllegalArgumentException("provenance entry must be a mapping: " + entry);
        }
        history.add(ProvenanceEntry.fromRecord(stringKeys(map)));
      }
    }
    if (history.isEmpty()) {
      history.add(new ProvenanceEntry(clock.instant(), OperationKind.CREATED, "", null, resolved.symbol()));
    } else if (history.get(0).operation() != OperationKind.CREATED) {
      throw new IllegalArgumentException(
          "quantity record provenance must start with 'created' but starts with '"
              + history.get(0).operation().wireName() + "'");
    }
    return new TrackedQuantity(values, array, resolved, history, clock);
  }

  // Numbers, or the quoted NaN/Infinity/-Infinity tokens JSON output uses for non-finite values.
  private static Double recordNumber(Object value) {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof String text) {
      switch (text) {
        case "NaN":
          return Double.NaN;
        case "Infinity":
          return Double.POSITIVE_INFINITY;
        case "-Infinity":
          return Double.NEGATIVE_INFINITY;
        default:
          return null;
      }
    }
    return null;
  }

  private static Map<String, Object> stringKeys(Map<?, ?> map) {
    Map<String, Object> copy = new LinkedHashMap<>();
    map.forEach((key, value) -> copy.put(String.valueOf(key), value));
    return copy;
  }

  private String formatMagnitude() {
    return array ? Arrays.toString(values) : Double.toString(values[0]);
  }

  @Override
  public String toString() {
    return String.format(
        Locale.ROOT, "TrackedQuantity(%s %s, provenance=%d)", formatMagnitude(), unit.symbol(), provenance.size());
  }
}
