/**
 * Argument validation helpers shared by the application and config layers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.units.validation;
