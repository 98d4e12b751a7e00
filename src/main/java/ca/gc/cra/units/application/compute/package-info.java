/**
 * Unit-checked wrappers around plain numeric formulas.
 *
 * @since 0.1.0
 */
package ca.gc.cra.units.application.compute;
