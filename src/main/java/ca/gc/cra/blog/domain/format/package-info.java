/**
 * <strong>Purpose:</strong> Placeholder scanning and verb rendering for formatted writes.
 * <p><strong>Pipeline role:</strong> Turns a format string and its positional arguments into record bytes.
 * <p><strong>Concurrency:</strong> Stateless helpers; callers own the render target.
 * <p><strong>Errors:</strong> Unresolvable placeholders raise {@link ca.gc.cra.blog.domain.format.FormatException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.blog.domain.format;
