package ca.gc.cra.units.application.domains;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.units.domain.error.DimensionMismatchException;
import ca.gc.cra.units.domain.error.UnknownUnitException;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DomainConversionsTest {

  @Test
  void speedDefaultsToMetresPerSecond() {
    assertEquals(12.861, DomainConversions.convertSpeed(25.0, "knots"), 1e-3);
    assertEquals(25.0 * 1.852, DomainConversions.convertSpeed(25.0, "knots", "km/h"), 1e-9);
  }

  @Test
  void nullValuesPassThrough() {
    assertNull(DomainConversions.convertSpeed(null, "knots"));
    assertNull(DomainConversions.convertPressure(null, "psi", "kPa"));
  }

  @Test
  void lengthTemperatureAndPressureDefaults() {
    assertEquals(0.3048, DomainConversions.convertLength(1.0, "feet"), 1e-12);
    assertEquals(1852.0, DomainConversions.convertLength(1.0, "nm"), 1e-9);
    assertEquals(0.0, DomainConversions.convertTemperature(32.0, "fahrenheit"), 1e-9);
    assertEquals(273.15, DomainConversions.convertTemperature(0.0, "celsius", "kelvin"), 1e-9);
    assertEquals(1013.25, DomainConversions.convertPressure(1.0, "atm"), 1e-9);
    assertEquals(1.0, DomainConversions.convertPressure(1.0, "mbar"), 1e-12);
  }

  @Test
  void massAndVolumeDefaults() {
    assertEquals(0.45359237, DomainConversions.convertMass(1.0, "lb"), 1e-12);
    assertEquals(1000.0, DomainConversions.convertMass(1.0, "tonne"), 1e-9);
    assertEquals(0.158987294928, DomainConversions.convertVolume(1.0, "bbl"), 1e-12);
    assertEquals(1000.0, DomainConversions.convertVolume(1.0, "m3", "L"), 1e-9);
  }

  @Test
  void energyCommodityConversions() {
    assertEquals(5.8, DomainConversions.convertEnergyUnits(1.0, "BOE", "MMBTU"), 1e-9);
    assertEquals(1.028, DomainConversions.convertEnergyUnits(1.0, "MCF", "MMBTU"), 1e-9);
    assertEquals(3412.14, DomainConversions.convertEnergyUnits(1.0, "KWH", "BTU"), 1e-2);
    assertEquals(1000.0, DomainConversions.convertEnergyUnits(1.0, "TONNE", "KG"), 1e-9);
    assertEquals(Optional.empty(), DomainUnitAdapter.ENERGY.defaultTargetKey());
  }

  @Test
  void crossDimensionEnergyKeysFail() {
    assertThrows(DimensionMismatchException.class,
        () -> DomainConversions.convertEnergyUnits(1.0, "BBL", "BOE"));
  }

  @Test
  void unknownKeyListsKnownUnits() {
    UnknownUnitException ex = assertThrows(UnknownUnitException.class,
        () -> DomainConversions.convertSpeed(1.0, "furlongs", "m/s"));
    assertEquals("Unknown speed unit 'furlongs'. Known units: [ft/s, km/h, knots, m/s, mph]", ex.getMessage());
    assertEquals("speed", ex.domain());
    assertEquals("furlongs", ex.unit());
  }

  @Test
  void everyMappedKeyResolves() {
    for (DomainUnitAdapter adapter : DomainUnitAdapter.values()) {
      String anchor = adapter.mapping().keySet().iterator().next();
      for (String key : adapter.mapping().keySet()) {
        if (adapter == DomainUnitAdapter.ENERGY && !isEnergy(key)) {
          continue;
        }
        Double value = adapter.convert(1.0, key, anchor);
        assertTrue(value > 0.0 || adapter == DomainUnitAdapter.TEMPERATURE, adapter + " " + key);
      }
    }
  }

  private static boolean isEnergy(String key) {
    switch (key) {
      case "BBL":
      case "BBL_OIL":
      case "GAL":
      case "L":
      case "M3":
      case "TONNE":
      case "SHORT_TON":
      case "LONG_TON":
      case "KG":
      case "LB":
        return false;
      default:
        return true;
    }
  }
}
