/**
 * <strong>Purpose:</strong> Canonical unit registry and the dimension and unit value types it hands out.
 * <p><strong>Concurrency:</strong> The registry is built once on first use and read-only afterwards; every type in
 * this package is immutable.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.units.domain.unit;
