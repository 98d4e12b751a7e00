/**
 * YAML configuration loading for calculation inputs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.units.config;
