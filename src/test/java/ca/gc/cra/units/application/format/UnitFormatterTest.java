package ca.gc.cra.units.application.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.units.application.audit.CalculationAuditLog;
import ca.gc.cra.units.domain.quantity.TrackedQuantity;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class UnitFormatterTest {
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

  @Test
  void defaultTemplateUsesFourDecimals() {
    assertEquals("100.0000 Pa", new UnitFormatter().formatQuantity(TrackedQuantity.create(100.0, "Pa")));
  }

  @Test
  void registeredPrecisionApplies() {
    UnitFormatter formatter = new UnitFormatter();
    formatter.registerTemplate("pressure", FormatTemplate.fixed(1));

    assertEquals("101325.0 Pa", formatter.formatQuantity(TrackedQuantity.create(101325.0, "Pa")));
    assertEquals("101325.0 Pa", formatter.formatQuantity(TrackedQuantity.create(101325.0, "Pa"), "pressure"));
  }

  @Test
  void templateResolvedByDimension() {
    UnitFormatter formatter = new UnitFormatter();
    formatter.registerTemplate("length", FormatTemplate.fixed(2));

    assertEquals("12.35 m", formatter.formatQuantity(TrackedQuantity.create(12.3456, "m")));
    assertEquals("1.5000 kg", formatter.formatQuantity(TrackedQuantity.create(1.5, "kg")));
  }

  @Test
  void templateResolvedBySymbolFragment() {
    UnitFormatter formatter = new UnitFormatter();
    formatter.registerTemplate("Pa", FormatTemplate.fixed(0));
    assertEquals("101 kPa", formatter.formatQuantity(TrackedQuantity.create(101.325, "kPa")));
  }

  @Test
  void scientificNotationAndSuffix() {
    UnitFormatter formatter = new UnitFormatter();
    TrackedQuantity q = TrackedQuantity.create(101325.0, "Pa");

    assertEquals("1.01e+05 Pa", formatter.formatQuantity(q, FormatTemplate.scientific(2)));
    formatter.registerTemplate("pressure", FormatTemplate.fixed(2).withSuffix(" (abs)"));
    assertEquals("101325.00 Pa (abs)", formatter.formatQuantity(q));
  }

  @Test
  void unknownCategoryFallsBackToDefault() {
    UnitFormatter formatter = new UnitFormatter();
    formatter.registerTemplate("length", FormatTemplate.fixed(1));
    assertEquals("2.0000 m", formatter.formatQuantity(TrackedQuantity.create(2.0, "m"), "depth"));
  }

  @Test
  void targetUnitConvertsBeforeFormatting() {
    assertEquals("3.2808 ft", new UnitFormatter().formatQuantity(TrackedQuantity.create(1.0, "m"), null, "ft"));
  }

  @Test
  void arraysRenderElementWise() {
    UnitFormatter formatter = new UnitFormatter();
    assertEquals("[1.00, 2.50] m",
        formatter.formatQuantity(TrackedQuantity.create(new double[] {1.0, 2.5}, "m"), FormatTemplate.fixed(2)));
  }

  @Test
  void provenanceTrailListsEveryEntry() {
    TrackedQuantity q = TrackedQuantity.create(100.0, "kPa", "sensor", CLOCK);

    String text = new UnitFormatter().formatWithProvenance(q);
    assertEquals(String.join("\n",
        "Value: 100.0 kPa",
        "Provenance:",
        "  [2024-01-01T00:00:00Z] created | source=sensor | to=kPa"), text);

    String converted = new UnitFormatter().formatWithProvenance(q, "psi");
    assertTrue(converted.contains("converted | from=kPa | to=psi"));
    assertTrue(converted.startsWith("Value: 14.50"));
  }

  @Test
  void exportAuditTrailSupportsThreeFormats() {
    CalculationAuditLog log = new CalculationAuditLog();
    log.addInput("depth", TrackedQuantity.create(10.0, "m"));
    UnitFormatter formatter = new UnitFormatter();

    assertTrue(formatter.exportAuditTrail(log, "json").contains("\"inputs\""));
    assertTrue(formatter.exportAuditTrail(log, "TEXT").startsWith("Calculation Audit Log"));
    assertTrue(formatter.exportAuditTrail(log, "csv").startsWith("role,name,magnitude,unit"));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> formatter.exportAuditTrail(log, "xml"));
    assertEquals("Unsupported format 'xml'. Use 'json', 'text' or 'csv'", ex.getMessage());
  }

  @Test
  void templatePrecisionIsBounded() {
    assertThrows(IllegalArgumentException.class, () -> FormatTemplate.fixed(18));
    assertThrows(IllegalArgumentException.class, () -> FormatTemplate.fixed(-1));
    assertEquals(Notation.SCIENTIFIC, Notation.fromText("Scientific"));
    assertThrows(IllegalArgumentException.class, () -> Notation.fromText("engineering"));
  }
}
