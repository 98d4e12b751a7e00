package ca.gc.cra.units.domain.quantity;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> One immutable step in the history of a {@link TrackedQuantity}.
 * <p><strong>Why:</strong> Lets auditors replay how a value was created, converted and combined.</p>
 * <p><strong>Thread-safety:</strong> Records are immutable and safe to share across threads.</p>
 *
 * @param timestamp when the operation ran (UTC); never {@code null}
 * @param operation operation kind; never {@code null}
 * @param source free-text provenance label such as {@code config/pipe.yml}; never {@code null}, may be empty
 * @param fromUnit source unit for conversions; {@code null} otherwise
 * @param toUnit target unit for creation and conversions; {@code null} for arithmetic
 *
 * @since 0.1.0
 */
public record ProvenanceEntry(
    Instant timestamp,
    OperationKind operation,
    String source,
    String fromUnit,
    String toUnit) {

  /**
   * Validates required fields and normalizes a {@code null} source to the empty string.
   */
  public ProvenanceEntry {
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    operation = Objects.requireNonNull(operation, "operation");
    source = source == null ? "" : source;
  }

  /**
   * Serializes the entry to a plain map with keys {@code timestamp}, {@code operation}, {@code source},
   * {@code from_unit} and {@code to_unit}.
   *
   * @return insertion-ordered map; the timestamp is rendered as ISO-8601
   */
  public Map<String, Object> toRecord() {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put("timestamp", timestamp.toString());
    record.put("operation", operation.wireName());
    record.put("source", source);
    record.put("from_unit", fromUnit);
    record.put("to_unit", toUnit);
    return record;
  }

  /**
   * Rebuilds an entry from the map produced by {@link #toRecord()}.
   *
   * @param record serialized entry; must not be {@code null}
   * @return the entry
   * @throws IllegalArgumentException when the timestamp or operation is missing or malformed
   */
  public static ProvenanceEntry fromRecord(Map<String, ?> record) {
    Objects.requireNonNull(record, "record");
    Object rawTimestamp = record.get("timestamp");
    if (rawTimestamp == null) {
      throw new IllegalArgumentException("provenance entry is missing 'timestamp'");
    }
    Instant timestamp;
    try {
      timestamp = Instant.parse(rawTimestamp.toString());
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("Invalid provenance timestamp '" + rawTimestamp + "'", ex);
    }
    Object operation = record.get("operation");
    return new ProvenanceEntry(
        timestamp,
        OperationKind.fromWireName(operation == null ? null : operation.toString()),
        asString(record.get("source")),
        asString(record.get("from_unit")),
        asString(record.get("to_unit")));
  }

  private static String asString(Object value) {
    return value == null ? null : value.toString();
  }
}
