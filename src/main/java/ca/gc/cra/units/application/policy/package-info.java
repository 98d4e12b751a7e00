/**
 * Unit systems and the policy enforcing them on tracked quantities.
 *
 * @since 0.1.0
 */
package ca.gc.cra.units.application.policy;
