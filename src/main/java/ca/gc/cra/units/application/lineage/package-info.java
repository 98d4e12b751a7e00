/**
 * Lineage graphs derived from calculation audit logs, with DOT, HTML, JSON and SVG exports.
 *
 * @since 0.1.0
 */
package ca.gc.cra.units.application.lineage;
