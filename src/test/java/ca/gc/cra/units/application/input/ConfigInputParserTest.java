package ca.gc.cra.units.application.input;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.units.domain.error.UnknownUnitException;
import ca.gc.cra.units.domain.quantity.TrackedQuantity;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigInputParserTest {
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneOffset.UTC);

  @TempDir Path tempDir;

  @Test
  void sectionFieldsPickUpUnitSystemUnits() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put("thickness", 12.7);
    config.put("yield_strength", 355);
    config.put("temp", "20");

    Map<String, TrackedQuantity> parsed = new ConfigInputParser(FieldQuantityMap.GENERAL, CLOCK)
        .parseConfigSection(config, "metric_engineering", "pipe.yml");

    assertEquals(List.of("thickness", "yield_strength", "temp"), List.copyOf(parsed.keySet()));
    assertEquals("mm", parsed.get("thickness").unitSymbol());
    assertEquals("MPa", parsed.get("yield_strength").unitSymbol());
    assertEquals(355.0, parsed.get("yield_strength").magnitude());
    assertEquals("degC", parsed.get("temp").unitSymbol());
    assertEquals(20.0, parsed.get("temp").magnitude());
    assertEquals("pipe.yml", parsed.get("thickness").provenance().get(0).source());
    assertEquals(CLOCK.instant(), parsed.get("thickness").provenance().get(0).timestamp());
  }

  @Test
  void unknownFieldIsNamedInError() {
    UnknownUnitException ex = assertThrows(UnknownUnitException.class,
        () -> new ConfigInputParser().parseConfigSection(Map.of("colour", 3), "SI", "cfg"));
    assertTrue(ex.getMessage().contains("colour"));
    assertTrue(ex.getMessage().contains("SI"));
  }

  @Test
  void nonNumericValuesAreRejected() {
    ConfigInputParser parser = new ConfigInputParser();
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> parser.parseConfigSection(Map.of("thickness", "abc"), "SI", "cfg"));
    assertTrue(ex.getMessage().contains("thickness"));
    assertThrows(IllegalArgumentException.class,
        () -> parser.parseConfigValue(Boolean.TRUE, "depth", "SI", null, "cfg"));
  }

  @Test
  void unknownUnitSystemIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new ConfigInputParser().parseConfigSection(Map.of("depth", 1), "cgs", "cfg"));
  }

  @Test
  void explicitUnitOverridesFieldLookup() {
    TrackedQuantity q = new ConfigInputParser().parseConfigValue(5, "anything", "SI", "ft", "cli");
    assertEquals("ft", q.unitSymbol());
    assertEquals("cli", q.provenance().get(0).source());
  }

  @Test
  void offshoreMapExtendsGeneralFields() {
    ConfigInputParser general = new ConfigInputParser();
    ConfigInputParser offshore = new ConfigInputParser(FieldQuantityMap.OFFSHORE, CLOCK);

    assertThrows(UnknownUnitException.class,
        () -> general.parseConfigValue(0.5, "wall_thickness", "inch", null, ""));
    assertEquals("inch", offshore.parseConfigValue(0.5, "wall_thickness", "inch", null, "").unitSymbol());
    assertEquals("psi", offshore.parseConfigValue(10, "hoop_stress", "inch", null, "").unitSymbol());
    assertEquals(Optional.of("length"), FieldQuantityMap.OFFSHORE.categoryOf("depth"));
    assertEquals(Optional.of("force"), FieldQuantityMap.GENERAL.extend(Map.of("drag", "force")).categoryOf("drag"));
  }

  @Test
  void yamlSectionUsesDeclaredUnitSystem() throws IOException {
    Path file = tempDir.resolve("design.yml");
    Files.writeString(file, """
        pipeline:
          unit_system: inch
          wall_thickness: 0.5
          internal_pressure: 1500
        riser:
          depth: 120
        """, StandardCharsets.UTF_8);
    ConfigInputParser parser = new ConfigInputParser(FieldQuantityMap.OFFSHORE, CLOCK);

    Map<String, TrackedQuantity> pipeline = parser.parseYamlSection(file, "pipeline", "SI").orElseThrow();
    assertEquals(2, pipeline.size());
    assertEquals("inch", pipeline.get("wall_thickness").unitSymbol());
    assertEquals("psi", pipeline.get("internal_pressure").unitSymbol());
    assertEquals("design.yml#pipeline", pipeline.get("wall_thickness").provenance().get(0).source());

    Map<String, TrackedQuantity> riser = parser.parseYamlSection(file, "riser", "SI").orElseThrow();
    assertEquals("m", riser.get("depth").unitSymbol());

    assertTrue(parser.parseYamlSection(tempDir.resolve("missing.yml"), "pipeline", "SI").isEmpty());
  }
}
