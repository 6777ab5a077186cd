/**
 * Time sources feeding the record timestamp.
 * <p><strong>Role:</strong> Adapter layer implementing {@code ClockPort} and {@code TimestampSource}.</p>
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 * <p><strong>Performance:</strong> Timestamps are rendered once per refresh window and shared as bytes.</p>
 */
package ca.gc.cra.blog.infrastructure.time;
