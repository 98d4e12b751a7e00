/**
 * Configuration input parsing: field name to quantity category maps and the parser that applies them.
 *
 * @since 0.1.0
 */
package ca.gc.cra.units.application.input;
