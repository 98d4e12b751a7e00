package ca.gc.cra.units.application.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Named unit systems mapping quantity categories ({@code length}, {@code stress}, {@code pressure},
 * {@code force}, {@code moment}, {@code temperature}, {@code mass}) to the unit each category is expressed in.
 *
 * @since 0.1.0
 */
public final class UnitSystems {
  public static final String SI = "SI";
  public static final String INCH = "inch";
  public static final String METRIC_ENGINEERING = "metric_engineering";

  private static final Map<String, Map<String, String>> SYSTEMS;

  static {
    Map<String, Map<String, String>> systems = new LinkedHashMap<>();
    systems.put(INCH, table("inch", "psi", "psi", "lbf", "lbf * inch", "degF", "lb"));
    systems.put(SI, table("m", "Pa", "Pa", "N", "N * m", "degC", "kg"));
    systems.put(METRIC_ENGINEERING, table("mm", "MPa", "MPa", "kN", "kN * m", "degC", "kg"));
    SYSTEMS = Collections.unmodifiableMap(systems);
  }

  private UnitSystems() {
    // Utility
  }

  /**
   * Returns the category table of a system.
   *
   * @param system system name, case-sensitive (e.g. {@code SI})
   * @return unmodifiable category to unit mapping
   * @throws IllegalArgumentException when the system is unknown
   */
  public static Map<String, String> require(String system) {
    Map<String, String> table = system == null ? null : SYSTEMS.get(system);
    if (table == null) {
      throw new IllegalArgumentException(
          "Unknown unit system '" + system + "'. Available: " + new TreeSet<>(SYSTEMS.keySet()));
    }
    return table;
  }

  /**
   * Returns the unit a category is expressed in under a system.
   *
   * @param system system name
   * @param category quantity category such as {@code length}
   * @return unit text, or empty when the system does not define the category
   * @throws IllegalArgumentException when the system is unknown
   */
  public static Optional<String> unitFor(String system, String category) {
    Objects.requireNonNull(category, "category");
    return Optional.ofNullable(require(system).get(category));
  }

  /**
   * Returns the names of every known system, in declaration order.
   *
   * @return system names
   */
  public static Set<String> names() {
    return SYSTEMS.keySet();
  }

  private static Map<String, String> table(
      String length,
      String stress,
      String pressure,
      String force,
      String moment,
      String temperature,
      String mass) {
    Map<String, String> table = new LinkedHashMap<>();
    table.put("length", length);
    table.put("stress", stress);
    table.put("pressure", pressure);
    table.put("force", force);
    table.put("moment", moment);
    table.put("temperature", temperature);
    table.put("mass", mass);
    return Collections.unmodifiableMap(table);
  }
}
