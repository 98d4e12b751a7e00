package ca.gc.cra.units.application.compute;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.units.domain.error.DimensionMismatchException;
import ca.gc.cra.units.domain.error.UnknownUnitException;
import ca.gc.cra.units.domain.quantity.OperationKind;
import ca.gc.cra.units.domain.quantity.ProvenanceEntry;
import ca.gc.cra.units.domain.quantity.TrackedQuantity;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class UnitCheckedCalculationTest {
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

  private final UnitCheckedCalculation stress = UnitCheckedCalculation.builder("simple_stress")
      .param("force", "N")
      .param("area", "m**2")
      .returns("Pa")
      .clock(CLOCK)
      .build(args -> args.get("force") / args.get("area"));

  @Test
  void trackedArgumentsAreConvertedAndResultIsTracked() {
    CalculationResult result = stress.apply(Map.of(
        "force", TrackedQuantity.create(500.0, "kN", "load_case", CLOCK),
        "area", 2.0));

    assertTrue(result.isTracked());
    assertEquals(250_000.0, result.value(), 1e-9);
    TrackedQuantity tracked = result.tracked().orElseThrow();
    assertEquals("Pa", tracked.unitSymbol());

    List<ProvenanceEntry> history = tracked.provenance();
    assertEquals(3, history.size());
    assertEquals("load_case", history.get(0).source());
    assertEquals(OperationKind.CONVERTED, history.get(1).operation());
    assertEquals("kN", history.get(1).fromUnit());
    assertEquals(OperationKind.CREATED, history.get(2).operation());
    assertEquals("simple_stress", history.get(2).source());
    assertEquals("Pa", history.get(2).toUnit());
  }

  @Test
  void rawArgumentsYieldRawResult() {
    CalculationResult result = stress.apply(Map.of("force", 10.0, "area", 4));
    assertFalse(result.isTracked());
    assertTrue(result.tracked().isEmpty());
    assertEquals(2.5, result.value());
  }

  @Test
  void noReturnUnitMeansRawResultEvenWithTrackedInput() {
    UnitCheckedCalculation ratio = UnitCheckedCalculation.builder("ratio")
        .param("a", "m")
        .param("b", "m")
        .build(args -> args.get("a") / args.get("b"));

    CalculationResult result = ratio.apply(Map.of(
        "a", TrackedQuantity.create(1.0, "km"),
        "b", TrackedQuantity.create(500.0, "m")));

    assertFalse(result.isTracked());
    assertEquals(2.0, result.value(), 1e-12);
  }

  @Test
  void undeclaredTrackedArgumentKeepsItsUnit() {
    UnitCheckedCalculation passthrough = UnitCheckedCalculation.builder("passthrough")
        .returns("m")
        .build(args -> args.get("x") * 2.0);

    CalculationResult result = passthrough.apply(Map.of("x", TrackedQuantity.create(3.0, "ft")));
    assertEquals(6.0, result.value());
    assertEquals(2, result.tracked().orElseThrow().provenance().size());
  }

  @Test
  void missingArgumentIsReported() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> stress.apply(Map.of("force", 1.0)));
    assertEquals("simple_stress: missing argument 'area'", ex.getMessage());
  }

  @Test
  void incompatibleTrackedArgumentFails() {
    assertThrows(DimensionMismatchException.class, () -> stress.apply(Map.of(
        "force", TrackedQuantity.create(1.0, "kg"),
        "area", 1.0)));
  }

  @Test
  void nonNumericRawArgumentFails() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> stress.apply(Map.of("force", "lots", "area", 1.0)));
    assertTrue(ex.getMessage().contains("simple_stress.force"));
  }

  @Test
  void arrayArgumentIsRejectedByName() {
    Map<String, Object> args = Map.of(
        "force", TrackedQuantity.create(new double[] {1.0, 2.0}, "kN"),
        "area", TrackedQuantity.create(2.0, "m**2"));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> stress.apply(args));

    assertEquals("simple_stress: argument 'force' is an array; only scalar quantities are supported", ex.getMessage());
  }

  @Test
  void builderValidatesUnitsEagerly() {
    assertThrows(UnknownUnitException.class, () -> UnitCheckedCalculation.builder("bad").param("x", "zorkmid"));
    assertThrows(IllegalArgumentException.class, () -> UnitCheckedCalculation.builder(" "));
  }
}
