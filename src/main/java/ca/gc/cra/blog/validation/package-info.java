/**
 * <strong>Purpose:</strong> Input validation for configuration and CLI values.
 * <p><strong>Concurrency:</strong> Stateless helpers.
 * <p><strong>Errors:</strong> Violations raise {@link java.lang.IllegalArgumentException} with the offending key.
 *
 * @since 0.1.0
 */
package ca.gc.cra.blog.validation;
