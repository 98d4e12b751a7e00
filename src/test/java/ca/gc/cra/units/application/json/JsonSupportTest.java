package ca.gc.cra.units.application.json;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.units.domain.quantity.OperationKind;
import ca.gc.cra.units.domain.quantity.TrackedQuantity;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonSupportTest {
  private final JsonSupport json = new JsonSupport();

  @Test
  void writeThenParsePreservesStructure() {
    Map<String, Object> source = new LinkedHashMap<>();
    source.put("name", "depth");
    source.put("count", 3);
    source.put("values", Arrays.asList(1.5, null, "x"));
    source.put("flag", true);
    source.put("array", new double[] {1.0, 2.0});

    Map<String, Object> parsed = json.parseObject(json.write(source));

    assertEquals("depth", parsed.get("name"));
    assertEquals(3, ((Number) parsed.get("count")).intValue());
    assertEquals(Arrays.asList(1.5, null, "x"), parsed.get("values"));
    assertEquals(Boolean.TRUE, parsed.get("flag"));
    assertEquals(List.of(1.0, 2.0), parsed.get("array"));
  }

  @Test
  void rejectsMalformedOrNonObjectDocuments() {
    assertThrows(IllegalArgumentException.class, () -> json.parse("{\"a\": "));
    assertThrows(IllegalArgumentException.class, () -> json.parse("{} {}"));
    assertThrows(IllegalArgumentException.class, () -> json.parseObject("[1, 2]"));
  }

  @Test
  void emptyDocumentParsesToEmptyObject() {
    assertTrue(json.parseObject("  ").isEmpty());
  }

  @Test
  void unsupportedTypesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> json.write(Map.of("when", Instant.EPOCH)));
  }

  @Test
  void quantityJsonRoundTrip() {
    Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
    TrackedQuantity original = TrackedQuantity.create(new double[] {1.0, 2.0}, "kPa", "gauge", clock).to("psi");

    String text = QuantityJson.toJson(original);
    TrackedQuantity restored = QuantityJson.fromJson(text);

    assertTrue(text.contains("\"from_unit\""));
    assertTrue(restored.isArray());
    assertEquals("psi", restored.unitSymbol());
    assertEquals(original.magnitudes()[1], restored.magnitudes()[1]);
    assertEquals(original.provenance(), restored.provenance());
    assertEquals(OperationKind.CONVERTED, restored.provenance().get(1).operation());
  }

  @Test
  void nonFiniteMagnitudesAreQuotedAndReadBack() {
    TrackedQuantity rate = TrackedQuantity.create(1.0, "m").divide(TrackedQuantity.create(0.0, "s"));

    String text = QuantityJson.toJson(rate);
    TrackedQuantity restored = QuantityJson.fromJson(text);

    assertTrue(text.contains("\"Infinity\""));
    assertEquals(Double.POSITIVE_INFINITY, restored.magnitude());
    assertEquals(rate.unitSymbol(), restored.unitSymbol());
    assertEquals(rate.provenance(), restored.provenance());
  }

  @Test
  void nonFiniteArrayElementsSurviveRoundTrip() {
    double[] magnitudes = {Double.NaN, Double.NEGATIVE_INFINITY, 2.5};
    TrackedQuantity restored = QuantityJson.fromJson(QuantityJson.toJson(TrackedQuantity.create(magnitudes, "m")));

    assertArrayEquals(magnitudes, restored.magnitudes());
  }

  @Test
  void parseObjectReturnsMutableStringKeyedCopy() {
    Map<String, Object> parsed = json.parseObject("{\"unit\": \"m\", \"magnitude\": 2}");
    parsed.put("source", "manual");

    assertEquals(List.of("unit", "magnitude", "source"), List.copyOf(parsed.keySet()));
  }
}
