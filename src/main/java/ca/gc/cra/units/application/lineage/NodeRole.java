package ca.gc.cra.units.application.lineage;

import java.util.Locale;

/**
 * Role of a quantity in a lineage graph.
 *
 * @since 0.1.0
 */
public enum NodeRole {
  INPUT,
  OUTPUT;

  /**
   * Returns the serialized role, {@code input} or {@code output}.
   *
   * @return lower-case name
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
