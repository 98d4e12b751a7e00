package ca.gc.cra.units.domain.quantity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProvenanceEntryTest {

  @Test
  void nullSourceBecomesEmpty() {
    ProvenanceEntry entry = new ProvenanceEntry(Instant.EPOCH, OperationKind.CREATED, null, null, "m");
    assertEquals("", entry.source());
  }

  @Test
  void recordUsesSnakeCaseKeys() {
    ProvenanceEntry entry =
        new ProvenanceEntry(Instant.parse("2024-03-01T12:00:00Z"), OperationKind.CONVERTED, "", "m", "ft");
    Map<String, Object> record = entry.toRecord();

    assertEquals("2024-03-01T12:00:00Z", record.get("timestamp"));
    assertEquals("converted", record.get("operation"));
    assertEquals("m", record.get("from_unit"));
    assertEquals("ft", record.get("to_unit"));
    assertEquals(entry, ProvenanceEntry.fromRecord(record));
  }

  @Test
  void fromRecordRejectsBadInput() {
    Map<String, Object> record = new HashMap<>();
    record.put("operation", "created");
    assertThrows(IllegalArgumentException.class, () -> ProvenanceEntry.fromRecord(record));

    record.put("timestamp", "yesterday");
    assertThrows(IllegalArgumentException.class, () -> ProvenanceEntry.fromRecord(record));

    record.put("timestamp", "2024-01-01T00:00:00Z");
    record.put("operation", "teleported");
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> ProvenanceEntry.fromRecord(record));
    assertTrue(ex.getMessage().contains("teleported"));
  }
}
