package ca.gc.cra.units.application.format;

import ca.gc.cra.units.application.audit.CalculationAuditLog;
import ca.gc.cra.units.domain.quantity.ProvenanceEntry;
import ca.gc.cra.units.domain.quantity.TrackedQuantity;
import ca.gc.cra.units.domain.unit.QuantityKind;
import ca.gc.cra.units.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * <strong>What:</strong> Renders tracked quantities, with or without their provenance trail, and exports audit
 * logs.
 * <p><strong>Role:</strong> Application presenter; output is meant for people, use the record/JSON exports for
 * machines.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe while templates are being registered; safe for concurrent
 * formatting afterwards.</p>
 *
 * @since 0.1.0
 */
public final class UnitFormatter {
  private final Map<String, FormatTemplate> templates = new LinkedHashMap<>();

  /**
   * Registers the template for a category; a later registration for the same category replaces it.
   *
   * @param category category such as {@code pressure}
   * @param template display rules
   */
  public void registerTemplate(String category, FormatTemplate template) {
    templates.put(Strings.requireNonBlank("category", category), Objects.requireNonNull(template, "template"));
  }

  /**
   * Formats a quantity using the template inferred from its dimension or unit.
   *
   * @param quantity quantity to render
   * @return text like {@code 12.3456 m}
   */
  public String formatQuantity(TrackedQuantity quantity) {
    Objects.requireNonNull(quantity, "quantity");
    return render(quantity, resolve(quantity));
  }

  /**
   * Formats a quantity using the template registered for {@code category}, or the default template.
   *
   * @param quantity quantity to render
   * @param category category name; {@code null} behaves like {@link #formatQuantity(TrackedQuantity)}
   * @return formatted text
   */
  public String formatQuantity(TrackedQuantity quantity, String category) {
    Objects.requireNonNull(quantity, "quantity");
    if (category == null) {
      return formatQuantity(quantity);
    }
    return render(quantity, templates.getOrDefault(category, FormatTemplate.DEFAULT));
  }

  /**
   * Converts to {@code targetUnit} and formats.
   *
   * @param quantity quantity to render
   * @param category category name; may be {@code null}
   * @param targetUnit unit to convert to first
   * @return formatted text
   * @throws ca.gc.cra.units.domain.error.DimensionMismatchException when the target is incompatible
   */
  public String formatQuantity(TrackedQuantity quantity, String category, String targetUnit) {
    Objects.requireNonNull(quantity, "quantity");
    Objects.requireNonNull(targetUnit, "targetUnit");
    return formatQuantity(quantity.to(targetUnit), category);
  }

  /**
   * Formats with an explicit template, ignoring registrations.
   *
   * @param quantity quantity to render
   * @param template display rules
   * @return formatted text
   */
  public String formatQuantity(TrackedQuantity quantity, FormatTemplate template) {
    Objects.requireNonNull(quantity, "quantity");
    return render(quantity, Objects.requireNonNull(template, "template"));
  }

  /**
   * Renders the value followed by one line per provenance entry.
   *
   * <pre>
   * Value: 100.0 kPa
   * Provenance:
   *   [2024-01-01T00:00:00Z] created | source=config | to=kPa
   * </pre>
   *
   * @param quantity quantity to render
   * @return multi-line text
   */
  public String formatWithProvenance(TrackedQuantity quantity) {
    Objects.requireNonNull(quantity, "quantity");
    StringJoiner lines = new StringJoiner("\n");
    lines.add("Value: " + CalculationAuditLog.magnitudeText(quantity) + " " + quantity.unitSymbol());
    lines.add("Provenance:");
    for (ProvenanceEntry entry : quantity.provenance()) {
      StringJoiner parts = new StringJoiner(" | ");
      parts.add("  [" + entry.timestamp() + "] " + entry.operation().wireName());
      if (!entry.source().isEmpty()) {
        parts.add("source=" + entry.source());
      }
      if (entry.fromUnit() != null) {
        parts.add("from=" + entry.fromUnit());
      }
      if (entry.toUnit() != null) {
        parts.add("to=" + entry.toUnit());
      }
      lines.add(parts.toString());
    }
    return lines.toString();
  }

  /**
   * Converts to {@code targetUnit}, then renders with provenance; the conversion appears in the trail.
   *
   * @param quantity quantity to render
   * @param targetUnit unit to convert to first
   * @return multi-line text
   */
  public String formatWithProvenance(TrackedQuantity quantity, String targetUnit) {
    Objects.requireNonNull(quantity, "quantity");
    Objects.requireNonNull(targetUnit, "targetUnit");
    return formatWithProvenance(quantity.to(targetUnit));
  }

  /**
   * Exports an audit log.
   *
   * @param auditLog log to export
   * @param format {@code json}, {@code text} or {@code csv}, ignoring case
   * @return exported text
   * @throws IllegalArgumentException for other formats
   */
  public String exportAuditTrail(CalculationAuditLog auditLog, String format) {
    Objects.requireNonNull(auditLog, "auditLog");
    String normalized = format == null ? "" : format.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "json" -> auditLog.toJson();
      case "text" -> auditLog.summary();
      case "csv" -> auditLog.toCsv();
      default -> throw new IllegalArgumentException(
          "Unsupported format '" + format + "'. Use 'json', 'text' or 'csv'");
    };
  }

  private FormatTemplate resolve(TrackedQuantity quantity) {
    for (Map.Entry<String, FormatTemplate> entry : templates.entrySet()) {
      Optional<QuantityKind> kind = QuantityKind.fromKey(entry.getKey());
      if (kind.isPresent() && kind.get().dimension().equals(quantity.unit().dimension())) {
        return entry.getValue();
      }
    }
    String symbol = quantity.unitSymbol();
    for (Map.Entry<String, FormatTemplate> entry : templates.entrySet()) {
      if (symbol.contains(entry.getKey())) {
        return entry.getValue();
      }
    }
    return FormatTemplate.DEFAULT;
  }

  private static String render(TrackedQuantity quantity, FormatTemplate template) {
    String magnitude;
    if (quantity.isArray()) {
      StringJoiner joiner = new StringJoiner(", ", "[", "]");
      for (double value : quantity.magnitudes()) {
        joiner.add(template.format(value));
      }
      magnitude = joiner.toString();
    } else {
      magnitude = template.format(quantity.magnitude());
    }
    return magnitude + " " + quantity.unitSymbol() + template.suffix();
  }
}
