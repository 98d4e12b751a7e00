/**
 * Graph renderer adapters backing SVG lineage export.
 *
 * @since 0.1.0
 */
package ca.gc.cra.units.infrastructure.render;
