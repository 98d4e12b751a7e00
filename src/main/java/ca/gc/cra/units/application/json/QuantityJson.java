package ca.gc.cra.units.application.json;

import ca.gc.cra.units.domain.quantity.TrackedQuantity;
import java.util.Objects;

/**
 * JSON form of a {@link TrackedQuantity}: {@code {"magnitude", "unit", "provenance"}}.
 *
 * @since 0.1.0
 */
public final class QuantityJson {
  private static final JsonSupport JSON = new JsonSupport();

  private QuantityJson() {
    // Utility
  }

  public static String toJson(TrackedQuantity quantity) {
    Objects.requireNonNull(quantity, "quantity");
    return JSON.write(quantity.toRecord());
  }

  /**
   * Rebuilds a quantity from {@link #toJson(TrackedQuantity)} output.
   *
   * @param json quantity record as JSON
   * @return quantity with the recorded provenance
   * @throws IllegalArgumentException when the JSON is malformed or lacks required fields
   */
  public static TrackedQuantity fromJson(String json) {
    return TrackedQuantity.fromRecord(JSON.parseObject(json));
  }
}
