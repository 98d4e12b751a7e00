/**
 * Human-readable rendering of tracked quantities and audit exports.
 *
 * @since 0.1.0
 */
package ca.gc.cra.units.application.format;
