/**
 * JSON reading and writing over plain map records, backed by Jackson streaming.
 *
 * @since 0.1.0
 */
package ca.gc.cra.units.application.json;
