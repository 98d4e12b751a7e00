/**
 * <strong>Purpose:</strong> Error taxonomy for unit resolution, dimensional analysis, policy enforcement and
 * lineage rendering.
 * <p>All types extend {@link ca.gc.cra.units.domain.error.UnitException} and are unchecked; every message names
 * the offending unit strings or keys so inputs can be fixed without verbose tracing.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.units.domain.error;
