/**
 * <strong>Purpose:</strong> Ports through which the unit engine reaches metrics backends and external renderers.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.units.application.port;
