package ca.gc.cra.units.application.audit;

import java.time.Instant;
import java.util.Objects;

/**
 * Free-text calculation step with the instant it was recorded.
 *
 * @param timestamp when the step was added
 * @param description step text, e.g. {@code hoop stress = p * D / (2 * t)}
 * @since 0.1.0
 */
public record AuditStep(Instant timestamp, String description) {
  public AuditStep {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(description, "description");
  }
}
