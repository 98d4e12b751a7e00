/**
 * Domain vocabularies (metocean, energy, commodity) mapped onto the unit registry.
 *
 * @since 0.1.0
 */
package ca.gc.cra.units.application.domains;
