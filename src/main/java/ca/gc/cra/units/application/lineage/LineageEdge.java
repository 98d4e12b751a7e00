package ca.gc.cra.units.application.lineage;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Directed edge from an input node to an output node, labelled with a step description.
 *
 * @param source input name
 * @param target output name
 * @param operation step description
 * @since 0.1.0
 */
public record LineageEdge(String source, String target, String operation) {
  public LineageEdge {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(operation, "operation");
  }

  Map<String, Object> toRecord() {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put("source", source);
    record.put("target", target);
    record.put("operation", operation);
    return record;
  }
}
