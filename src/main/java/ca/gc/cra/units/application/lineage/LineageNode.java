package ca.gc.cra.units.application.lineage;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Quantity node of a {@link LineageGraph}.
 *
 * @param name input or output name from the audit log
 * @param value magnitude: a {@link Double}, or an unmodifiable list of doubles for array quantities
 * @param valueText magnitude rendered for labels, e.g. {@code 100.0} or {@code [1.0;2.0]}
 * @param unit canonical unit symbol
 * @param role input or output
 * @since 0.1.0
 */
public record LineageNode(String name, Object value, String valueText, String unit, NodeRole role) {
  public LineageNode {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(valueText, "valueText");
    Objects.requireNonNull(unit, "unit");
    Objects.requireNonNull(role, "role");
  }

  Map<String, Object> toRecord() {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put("name", name);
    record.put("value", value);
    record.put("unit", unit);
    record.put("role", role.wireName());
    return record;
  }
}
