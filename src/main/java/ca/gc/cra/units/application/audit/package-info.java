/**
 * Calculation audit trail: named inputs, outputs and steps with JSON, CSV and text exports.
 *
 * @since 0.1.0
 */
package ca.gc.cra.units.application.audit;
