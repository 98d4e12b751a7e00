package ca.gc.cra.units.domain.quantity;

import java.util.Locale;

/**
 * <strong>What:</strong> Kind of operation recorded in a {@link ProvenanceEntry}.
 * <p><strong>Role:</strong> Domain enumeration serialized by its lower-case {@link #wireName()}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 */
public enum OperationKind {
  /** Quantity was created from a raw magnitude. */
  CREATED,
  /** Quantity was converted to another unit. */
  CONVERTED,
  /** Sum of two quantities. */
  ADD,
  /** Difference of two quantities. */
  SUBTRACT,
  /** Product of two quantities, or of a quantity and a scalar. */
  MULTIPLY,
  /** Quotient of two quantities, or of a quantity and a scalar. */
  DIVIDE;

  /**
   * Returns the serialized name, e.g. {@code subtract}.
   *
   * @return lower-case name
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a serialized operation name.
   *
   * @param wireName lower- or upper-case name
   * @return matching kind
   * @throws IllegalArgumentException when the name is unknown
   */
  public static OperationKind fromWireName(String wireName) {
    if (wireName == null || wireName.isBlank()) {
      throw new IllegalArgumentException("operation must not be blank");
    }
    try {
      return valueOf(wireName.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown provenance operation '" + wireName + "'", ex);
    }
  }
}
