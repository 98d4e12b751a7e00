package ca.gc.cra.units.application.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.units.application.json.JsonSupport;
import ca.gc.cra.units.domain.quantity.TrackedQuantity;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CalculationAuditLogTest {
  private static final Instant NOW = Instant.parse("2024-02-02T10:15:30Z");

  private CalculationAuditLog log;

  @BeforeEach
  void setUp() {
    log = new CalculationAuditLog(Clock.fixed(NOW, ZoneOffset.UTC));
    log.addInput("depth", TrackedQuantity.create(100.0, "m"));
    log.addInput("temp", TrackedQuantity.create(4.0, "degC"));
    log.addInput("pressure", TrackedQuantity.create(1013.0, "kPa"));
    log.addStep("hydrostatic head");
    log.addOutput("head_pressure", TrackedQuantity.create(981.0, "kPa"));
  }

  @Test
  void insertionOrderIsPreserved() {
    assertEquals(List.of("depth", "temp", "pressure"), log.inputNames());
    assertEquals(List.of("head_pressure"), log.outputNames());
    assertEquals(List.of(new AuditStep(NOW, "hydrostatic head")), log.steps());
  }

  @Test
  void reAddingNameReplacesValueInPlace() {
    log.addInput("depth", TrackedQuantity.create(120.0, "m"));
    assertEquals(List.of("depth", "temp", "pressure"), log.inputNames());
    assertEquals(120.0, log.inputs().get("depth").magnitude());
  }

  @Test
  void csvListsInputsThenOutputs() {
    String[] lines = log.toCsv().split("\n");
    assertEquals(5, lines.length);
    assertEquals("role,name,magnitude,unit", lines[0]);
    assertEquals("input,depth,100.0,m", lines[1]);
    assertEquals("input,temp,4.0,degC", lines[2]);
    assertEquals("input,pressure,1013.0,kPa", lines[3]);
    assertEquals("output,head_pressure,981.0,kPa", lines[4]);
  }

  @Test
  void csvQuotesSpecialCharactersAndJoinsArrays() {
    CalculationAuditLog audit = new CalculationAuditLog();
    audit.addInput("load, \"peak\"", TrackedQuantity.create(1.0, "kN"));
    audit.addInput("profile", TrackedQuantity.create(new double[] {1.0, 2.5}, "m"));

    String[] lines = audit.toCsv().split("\n");
    assertEquals("input,\"load, \"\"peak\"\"\",1.0,kN", lines[1]);
    assertEquals("input,profile,[1.0;2.5],m", lines[2]);
  }

  @Test
  void filterMatchesCanonicalUnit() {
    assertEquals(List.of("pressure"), List.copyOf(log.filterInputs("kilopascal").keySet()));
    assertEquals(List.of("depth"), List.copyOf(log.filterInputs("meter").keySet()));
    assertEquals(List.of("head_pressure"), List.copyOf(log.filterOutputs("kPa").keySet()));
    assertTrue(log.filterInputs("bogus_unit").isEmpty());
    assertTrue(log.filterOutputs("m").isEmpty());
  }

  @Test
  void jsonCarriesRecordsAndStepDescriptions() {
    Map<String, Object> parsed = new JsonSupport().parseObject(log.toJson());

    assertEquals(List.of("inputs", "outputs", "steps"), List.copyOf(parsed.keySet()));
    @SuppressWarnings("unchecked")
    Map<String, Object> inputs = (Map<String, Object>) parsed.get("inputs");
    assertEquals(List.of("depth", "temp", "pressure"), List.copyOf(inputs.keySet()));
    @SuppressWarnings("unchecked")
    Map<String, Object> depth = (Map<String, Object>) inputs.get("depth");
    assertEquals("m", depth.get("unit"));
    assertEquals(100.0, ((Number) depth.get("magnitude")).doubleValue());
    assertEquals(List.of("hydrostatic head"), parsed.get("steps"));
  }

  @Test
  void summaryListsEverySection() {
    String expected = String.join("\n",
        "Calculation Audit Log",
        "  Inputs (3):",
        "    depth: 100.0 m",
        "    temp: 4.0 degC",
        "    pressure: 1013.0 kPa",
        "  Outputs (1):",
        "    head_pressure: 981.0 kPa",
        "  Steps (1):",
        "    - hydrostatic head");
    assertEquals(expected, log.summary());
  }

  @Test
  void blankNamesAreRejected() {
    TrackedQuantity q = TrackedQuantity.create(1.0, "m");
    assertThrows(IllegalArgumentException.class, () -> log.addInput(" ", q));
    assertThrows(IllegalArgumentException.class, () -> log.addStep(""));
    assertThrows(NullPointerException.class, () -> log.addOutput("x", null));
  }

  @Test
  void viewsAreReadOnly() {
    assertThrows(UnsupportedOperationException.class, () -> log.inputs().clear());
    assertThrows(UnsupportedOperationException.class, () -> log.steps().clear());
  }
}
