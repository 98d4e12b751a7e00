/**
 * Executor construction for infrastructure adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.units.infrastructure.exec;
