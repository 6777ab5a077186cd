/**
 * <strong>Purpose:</strong> Severity levels and the threshold gate consulted before messages are written.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.blog.domain.level.Level} is immutable; the gate publishes its
 * threshold through a volatile field.
 * <p><strong>Performance:</strong> Constant-time comparisons on enum ordinals.
 *
 * @since 0.1.0
 */
package ca.gc.cra.blog.domain.level;
