/**
 * OpenTelemetry implementation of {@link ca.gc.cra.units.application.port.MetricsPort}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.units.infrastructure.metrics;
