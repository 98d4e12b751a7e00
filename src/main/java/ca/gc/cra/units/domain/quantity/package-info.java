/**
 * Tracked quantities and their provenance entries.
 *
 * @since 0.1.0
 */
package ca.gc.cra.units.domain.quantity;
