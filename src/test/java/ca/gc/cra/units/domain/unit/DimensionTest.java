package ca.gc.cra.units.domain.unit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class DimensionTest {

  @Test
  void rendersPositiveExponentsFirst() {
    UnitRegistry registry = UnitRegistry.getInstance();
    assertEquals("[mass] * [length] / [time] ** 2", registry.resolve("N").dimension().toString());
    assertEquals("[mass] / [length] / [time] ** 2", registry.resolve("Pa").dimension().toString());
    assertEquals("1 / [time]", registry.resolve("Hz").dimension().toString());
    assertEquals("dimensionless", registry.resolve("percent").dimension().toString());
  }

  @Test
  void parseAcceptsRenderedForm() {
    Dimension force = Dimension.parse("[mass] * [length] / [time] ** 2");
    assertEquals(UnitRegistry.getInstance().resolve("kN").dimension(), force);
    assertEquals(Dimension.of(BaseDimension.LENGTH, 3), Dimension.parse("[length]^3"));
    assertTrue(Dimension.parse("dimensionless").isDimensionless());
    assertEquals(Dimension.of(BaseDimension.TIME, -1), Dimension.parse("1 / [time]"));
  }

  @Test
  void parseRejectsUnknownBases() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Dimension.parse("[charm]"));
    assertTrue(ex.getMessage().contains("[charm]"));
    assertThrows(IllegalArgumentException.class, () -> Dimension.parse("[length] *"));
    assertThrows(IllegalArgumentException.class, () -> Dimension.parse(" "));
  }

  @Test
  void algebraCombinesExponents() {
    Dimension length = Dimension.of(BaseDimension.LENGTH);
    Dimension time = Dimension.of(BaseDimension.TIME);
    Dimension speed = length.dividedBy(time);
    assertEquals(1, speed.exponent(BaseDimension.LENGTH));
    assertEquals(-1, speed.exponent(BaseDimension.TIME));
    assertTrue(speed.times(time).dividedBy(length).isDimensionless());
  }
}
