package ca.gc.cra.units.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for unit enforcement and lineage rendering.
 * <p><strong>Why:</strong> Lets policies and renderers count outcomes without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Application port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for outcomes like policy conversions or violations.</li>
 *   <li>Record numeric observations such as render latency.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent updates from independent
 * calculations.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code policy.enforce.converted}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code policy.enforce.violation}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., nanoseconds); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
