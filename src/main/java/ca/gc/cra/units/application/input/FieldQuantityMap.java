package ca.gc.cra.units.application.input;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps configuration field names to the quantity category whose unit they are read in.
 *
 * <p>{@link #GENERAL} covers structural and metocean fields; {@link #OFFSHORE} adds pipeline and plate fields
 * such as {@code wall_thickness} or {@code hoop_stress}.</p>
 *
 * @since 0.1.0
 */
public final class FieldQuantityMap {
  /** Structural and metocean fields. */
  public static final FieldQuantityMap GENERAL = new FieldQuantityMap(general());

  /** {@link #GENERAL} plus offshore pipeline and plate fields. */
  public static final FieldQuantityMap OFFSHORE = GENERAL.extend(offshore());

  private final Map<String, String> categories;

  private FieldQuantityMap(Map<String, String> categories) {
    this.categories = Collections.unmodifiableMap(categories);
  }

  /**
   * Returns a new map containing these entries plus {@code additions}; additions win on conflict.
   *
   * @param additions field to category entries
   * @return extended map
   */
  public FieldQuantityMap extend(Map<String, String> additions) {
    Objects.requireNonNull(additions, "additions");
    Map<String, String> merged = new LinkedHashMap<>(categories);
    merged.putAll(additions);
    return new FieldQuantityMap(merged);
  }

  /**
   * Looks up the category of a field.
   *
   * @param field configuration key, matched exactly
   * @return category such as {@code length}
   */
  public Optional<String> categoryOf(String field) {
    return Optional.ofNullable(field == null ? null : categories.get(field));
  }

  public Map<String, String> asMap() {
    return categories;
  }

  private static Map<String, String> general() {
    Map<String, String> map = new LinkedHashMap<>();
    for (String field : new String[] {
        "thickness", "breadth", "width", "height", "depth", "diameter", "radius", "length"}) {
      map.put(field, "length");
    }
    map.put("youngs_modulus", "stress");
    map.put("yield_strength", "stress");
    map.put("ultimate_strength", "stress");
    map.put("stress", "stress");
    map.put("pressure", "pressure");
    map.put("wave_height", "length");
    map.put("water_depth", "length");
    map.put("force", "force");
    map.put("weight", "force");
    map.put("temperature", "temperature");
    map.put("temp", "temperature");
    map.put("mass", "mass");
    return map;
  }

  private static Map<String, String> offshore() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("wall_thickness", "length");
    map.put("plate_thickness", "length");
    map.put("stiffener_height", "length");
    map.put("buckling_stress", "stress");
    map.put("von_mises_stress", "stress");
    map.put("hoop_stress", "stress");
    map.put("hydrostatic_pressure", "pressure");
    map.put("internal_pressure", "pressure");
    map.put("external_pressure", "pressure");
    map.put("buoyancy_force", "force");
    map.put("tension", "force");
    map.put("compression", "force");
    return map;
  }
}
