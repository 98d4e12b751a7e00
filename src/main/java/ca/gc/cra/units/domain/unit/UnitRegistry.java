package ca.gc.cra.units.domain.unit;

import static ca.gc.cra.units.domain.unit.BaseDimension.CURRENT;
import static ca.gc.cra.units.domain.unit.BaseDimension.LENGTH;
import static ca.gc.cra.units.domain.unit.BaseDimension.LUMINOSITY;
import static ca.gc.cra.units.domain.unit.BaseDimension.MASS;
import static ca.gc.cra.units.domain.unit.BaseDimension.SUBSTANCE;
import static ca.gc.cra.units.domain.unit.BaseDimension.TEMPERATURE;
import static ca.gc.cra.units.domain.unit.BaseDimension.TIME;

import ca.gc.cra.units.domain.error.DimensionMismatchException;
import ca.gc.cra.units.domain.error.UnknownUnitException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Canonical table resolving unit strings to {@link Unit} handles.
 * <p><strong>Why:</strong> Every component (quantities, adapters, policies, parsers) resolves units through one
 * table so conversion factors cannot drift between call sites.</p>
 * <p><strong>Role:</strong> Process-wide singleton obtained via {@link #getInstance()}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve symbols, long names and aliases, with SI prefixes on prefixable units.</li>
 *   <li>Resolve compound expressions such as {@code kg/m**3} or {@code kN * m}.</li>
 *   <li>Convert magnitudes between compatible units, including offset temperature scales.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Tables are built once in the constructor and never mutated, so reads need no
 * synchronization.</p>
 * <p><strong>Performance:</strong> Resolution is a hash lookup for simple symbols and a linear parse for
 * expressions; no caching.</p>
 *
 * @implNote Custom energy units follow oil and gas conventions: {@code BOE = 5.8e6 BTU},
 * {@code MCF = 1.028e6 BTU}, {@code TOE = 3.968e7 BTU}.
 * @since 0.1.0
 */
public final class UnitRegistry {
  private static final double BTU = 1055.05585262;
  private static final double LBF = 4.4482216152605;
  private static final double INCH = 0.0254;
  private static final double FAHRENHEIT_SCALE = 5.0 / 9.0;

  private static final Dimension L = Dimension.of(LENGTH);
  private static final Dimension M = Dimension.of(MASS);
  private static final Dimension T = Dimension.of(TIME);
  private static final Dimension AREA = L.pow(2);
  private static final Dimension VOLUME = L.pow(3);
  private static final Dimension SPEED = L.dividedBy(T);
  private static final Dimension FORCE = M.times(L).dividedBy(T.pow(2));
  private static final Dimension PRESSURE = FORCE.dividedBy(AREA);
  private static final Dimension ENERGY = FORCE.times(L);
  private static final Dimension POWER = ENERGY.dividedBy(T);

  private final Map<String, Definition> symbols = new HashMap<>();
  private final Map<String, Definition> names = new HashMap<>();
  private final Map<String, Double> symbolPrefixes = new LinkedHashMap<>();
  private final Map<String, Double> namePrefixes = new LinkedHashMap<>();

  private UnitRegistry() {
    definePrefixes();
    defineUnits();
  }

  /**
   * Returns the shared registry, building it on first use.
   *
   * @return process-wide registry
   */
  public static UnitRegistry getInstance() {
    return Holder.INSTANCE;
  }

  /**
   * Resolves a unit string, e.g. {@code kPa}, {@code kilopascal}, {@code m/s} or {@code lbf * inch}.
   *
   * @param unit unit text; must not be {@code null}
   * @return resolved unit
   * @throws UnknownUnitException when any symbol is unknown or the expression is malformed
   */
  public Unit resolve(String unit) {
    Objects.requireNonNull(unit, "unit");
    return new UnitExpressionParser(unit, this::lookup).parse();
  }

  /**
   * Indicates whether {@code unit} resolves without error.
   *
   * @param unit unit text; {@code null} yields {@code false}
   * @return {@code true} when resolvable
   */
  public boolean isDefined(String unit) {
    if (unit == null || unit.isBlank()) {
      return false;
    }
    try {
      resolve(unit);
      return true;
    } catch (UnknownUnitException ex) {
      return false;
    }
  }

  /**
   * Converts a magnitude between two compatible units.
   *
   * @param value magnitude expressed in {@code from}
   * @param from source unit
   * @param to target unit
   * @return magnitude expressed in {@code to}
   * @throws DimensionMismatchException when the units have different dimensions
   */
  public double convert(double value, Unit from, Unit to) {
    requireCompatible(from, to);
    if (from.equals(to)) {
      return value;
    }
    double base = value * from.scale() + from.offset();
    return (base - to.offset()) / to.scale();
  }

  /**
   * Converts a magnitude between two unit strings.
   *
   * @param value magnitude expressed in {@code from}
   * @param from source unit text
   * @param to target unit text
   * @return magnitude expressed in {@code to}
   * @throws UnknownUnitException when either unit is unknown
   * @throws DimensionMismatchException when the units have different dimensions
   */
  public double convert(double value, String from, String to) {
    return convert(value, resolve(from), resolve(to));
  }

  /**
   * Throws unless both units share a dimension.
   *
   * @param from source unit
   * @param to target unit
   * @throws DimensionMismatchException when the dimensions differ
   */
  public void requireCompatible(Unit from, Unit to) {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    if (!from.isCompatible(to)) {
      throw new DimensionMismatchException(
          from.dimension().toString(),
          to.dimension().toString(),
          "Cannot convert from '" + from.symbol() + "' (" + from.dimension() + ") to '"
              + to.symbol() + "' (" + to.dimension() + ")");
    }
  }

  Unit lookup(String token) {
    Definition exact = symbols.get(token);
    if (exact == null) {
      exact = names.get(token);
    }
    if (exact != null) {
      return exact.unit();
    }
    Unit prefixed = lookupPrefixed(token, symbolPrefixes, symbols, true);
    if (prefixed == null) {
      prefixed = lookupPrefixed(token, namePrefixes, names, false);
    }
    if (prefixed == null) {
      throw UnknownUnitException.forUnit(token);
    }
    return prefixed;
  }

  private Unit lookupPrefixed(
      String token, Map<String, Double> prefixes, Map<String, Definition> table, boolean symbolic) {
    for (Map.Entry<String, Double> prefix : prefixes.entrySet()) {
      String key = prefix.getKey();
      if (token.length() <= key.length() || !token.startsWith(key)) {
        continue;
      }
      Definition definition = table.get(token.substring(key.length()));
      if (definition == null || !definition.prefixable()) {
        continue;
      }
      String symbolPrefix = symbolic ? key : prefixSymbolForName(key);
      return new Unit(
          symbolPrefix + definition.symbol(),
          definition.dimension(),
          definition.scale() * prefix.getValue(),
          0.0);
    }
    return null;
  }

  private String prefixSymbolForName(String name) {
    double factor = namePrefixes.get(name);
    for (Map.Entry<String, Double> entry : symbolPrefixes.entrySet()) {
      if (entry.getValue() == factor) {
        return entry.getKey();
      }
    }
    throw new IllegalStateException("No symbol for prefix " + name);
  }

  private void definePrefixes() {
    // Two-letter symbols first so "da" wins over "d".
    symbolPrefixes.put("da", 1e1);
    symbolPrefixes.put("T", 1e12);
    symbolPrefixes.put("G", 1e9);
    symbolPrefixes.put("M", 1e6);
    symbolPrefixes.put("k", 1e3);
    symbolPrefixes.put("h", 1e2);
    symbolPrefixes.put("d", 1e-1);
    symbolPrefixes.put("c", 1e-2);
    symbolPrefixes.put("m", 1e-3);
    symbolPrefixes.put("u", 1e-6);
    symbolPrefixes.put("n", 1e-9);
    symbolPrefixes.put("p", 1e-12);

    namePrefixes.put("tera", 1e12);
    namePrefixes.put("giga", 1e9);
    namePrefixes.put("mega", 1e6);
    namePrefixes.put("kilo", 1e3);
    namePrefixes.put("hecto", 1e2);
    namePrefixes.put("deka", 1e1);
    namePrefixes.put("deci", 1e-1);
    namePrefixes.put("centi", 1e-2);
    namePrefixes.put("milli", 1e-3);
    namePrefixes.put("micro", 1e-6);
    namePrefixes.put("nano", 1e-9);
    namePrefixes.put("pico", 1e-12);
  }

  private void defineUnits() {
    Dimension theta = Dimension.of(TEMPERATURE);

    // length
    prefixable("m", L, 1.0, List.of(), List.of("meter", "meters", "metre", "metres"));
    define("inch", L, INCH, List.of("in"), List.of("inches"));
    define("ft", L, 0.3048, List.of(), List.of("foot", "feet"));
    define("yd", L, 0.9144, List.of(), List.of("yard", "yards"));
    define("mi", L, 1609.344, List.of(), List.of("mile", "miles"));
    define("nautical_mile", L, 1852.0, List.of("nmi"), List.of("nautical_miles"));

    // mass
    prefixable("g", M, 1e-3, List.of(), List.of("gram", "grams"));
    define("t", M, 1000.0, List.of(), List.of("tonne", "tonnes", "metric_ton"));
    define("lb", M, 0.45359237, List.of("lbm"), List.of("pound", "pounds"));
    define("oz", M, 0.028349523125, List.of(), List.of("ounce", "ounces"));
    define("short_ton", M, 907.18474, List.of(), List.of("ton"));
    define("long_ton", M, 1016.0469088, List.of(), List.of());

    // time
    prefixable("s", T, 1.0, List.of("sec"), List.of("second", "seconds"));
    define("min", T, 60.0, List.of(), List.of("minute", "minutes"));
    define("h", T, 3600.0, List.of("hr"), List.of("hour", "hours"));
    define("day", T, 86400.0, List.of(), List.of("days"));
    define("yr", T, 365.25 * 86400.0, List.of(), List.of("year", "years"));

    // temperature
    define("K", theta, 1.0, 0.0, List.of(), List.of("kelvin"));
    define("degC", theta, 1.0, 273.15, List.of("°C"), List.of("celsius", "degree_Celsius"));
    define("degF", theta, FAHRENHEIT_SCALE, 459.67 * FAHRENHEIT_SCALE, List.of("°F"),
        List.of("fahrenheit", "degree_Fahrenheit"));
    define("degR", theta, FAHRENHEIT_SCALE, 0.0, List.of(), List.of("rankine"));

    // remaining SI base units
    prefixable("A", Dimension.of(CURRENT), 1.0, List.of(), List.of("ampere", "amperes"));
    prefixable("mol", Dimension.of(SUBSTANCE), 1.0, List.of(), List.of("mole", "moles"));
    define("cd", Dimension.of(LUMINOSITY), 1.0, List.of(), List.of("candela"));

    // volume
    prefixable("L", VOLUME, 1e-3, List.of("l"), List.of("liter", "liters", "litre", "litres"));
    define("gal", VOLUME, 3.785411784e-3, List.of(), List.of("gallon", "gallons"));
    define("bbl", VOLUME, 0.158987294928, List.of(), List.of("oil_barrel", "barrel", "barrels"));

    // speed
    define("knot", SPEED, 1852.0 / 3600.0, List.of("kt", "kn"), List.of("knots"));
    define("mph", SPEED, 0.44704, List.of(), List.of("mile_per_hour"));

    // force
    prefixable("N", FORCE, 1.0, List.of(), List.of("newton", "newtons"));
    define("lbf", FORCE, LBF, List.of(), List.of("pound_force"));
    define("kip", FORCE, 1000.0 * LBF, List.of(), List.of("kilopound_force"));

    // pressure and stress
    prefixable("Pa", PRESSURE, 1.0, List.of(), List.of("pascal", "pascals"));
    prefixable("bar", PRESSURE, 1e5, List.of(), List.of("bar"));
    define("psi", PRESSURE, LBF / (INCH * INCH), List.of(), List.of("pound_force_per_square_inch"));
    define("ksi", PRESSURE, 1000.0 * LBF / (INCH * INCH), List.of(), List.of("kip_per_square_inch"));
    define("atm", PRESSURE, 101325.0, List.of(), List.of("atmosphere", "atmospheres"));
    define("inHg", PRESSURE, 3386.389, List.of(), List.of("inch_Hg"));
    define("mmHg", PRESSURE, 133.322387415, List.of(), List.of("millimeter_Hg"));
    define("torr", PRESSURE, 101325.0 / 760.0, List.of("Torr"), List.of());

    // energy
    prefixable("J", ENERGY, 1.0, List.of(), List.of("joule", "joules"));
    prefixable("Wh", ENERGY, 3600.0, List.of(), List.of("watt_hour"));
    prefixable("cal", ENERGY, 4.184, List.of(), List.of("calorie", "calories"));
    define("BTU", ENERGY, BTU, List.of("Btu"), List.of("british_thermal_unit"));
    define("MMBTU", ENERGY, 1e6 * BTU, List.of(), List.of());
    define("therm", ENERGY, 1e5 * BTU, List.of(), List.of("therms"));
    define("BOE", ENERGY, 5.8e6 * BTU, List.of(), List.of("barrel_of_oil_equivalent"));
    define("MCF", ENERGY, 1.028e6 * BTU, List.of(), List.of("thousand_cubic_feet"));
    define("MMCF", ENERGY, 1.028e9 * BTU, List.of(), List.of());
    define("BCF", ENERGY, 1.028e12 * BTU, List.of(), List.of());
    define("TCF", ENERGY, 1.028e15 * BTU, List.of(), List.of());
    define("SCF", ENERGY, 1028.0 * BTU, List.of(), List.of("standard_cubic_foot"));
    define("TOE", ENERGY, 3.968e7 * BTU, List.of(), List.of("tonne_of_oil_equivalent"));

    // power and frequency
    prefixable("W", POWER, 1.0, List.of(), List.of("watt", "watts"));
    define("hp", POWER, 745.69987158227, List.of(), List.of("horsepower"));
    prefixable("Hz", Dimension.DIMENSIONLESS.dividedBy(T), 1.0, List.of(), List.of("hertz"));

    // dimensionless
    define("dimensionless", Dimension.DIMENSIONLESS, 1.0, List.of(), List.of());
    define("percent", Dimension.DIMENSIONLESS, 0.01, List.of("pct"), List.of());
    define("rad", Dimension.DIMENSIONLESS, 1.0, List.of(), List.of("radian", "radians"));
    define("deg", Dimension.DIMENSIONLESS, Math.PI / 180.0, List.of(), List.of("degree", "degrees"));
  }

  private void define(String symbol, Dimension dimension, double scale, List<String> aliases, List<String> longNames) {
    register(new Definition(symbol, dimension, scale, 0.0, false), aliases, longNames);
  }

  private void define(
      String symbol,
      Dimension dimension,
      double scale,
      double offset,
      List<String> aliases,
      List<String> longNames) {
    register(new Definition(symbol, dimension, scale, offset, false), aliases, longNames);
  }

  private void prefixable(
      String symbol, Dimension dimension, double scale, List<String> aliases, List<String> longNames) {
    register(new Definition(symbol, dimension, scale, 0.0, true), aliases, longNames);
  }

  private void register(Definition definition, List<String> aliases, List<String> longNames) {
    symbols.put(definition.symbol(), definition);
    for (String alias : aliases) {
      symbols.put(alias, definition);
    }
    for (String name : longNames) {
      names.put(name, definition);
    }
  }

  private record Definition(String symbol, Dimension dimension, double scale, double offset, boolean prefixable) {
    Unit unit() {
      return new Unit(symbol, dimension, scale, offset);
    }
  }

  private static final class Holder {
    private static final UnitRegistry INSTANCE = new UnitRegistry();
  }
}
