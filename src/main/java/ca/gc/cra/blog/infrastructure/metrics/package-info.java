/**
 * Metrics adapters that bridge the writer {@code MetricsPort} to OpenTelemetry or a no-op implementation.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and support concurrent metric updates.</p>
 * <p><strong>Performance:</strong> Instruments are created once per key and cached.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code writer.*} namespace.</p>
 */
package ca.gc.cra.blog.infrastructure.metrics;
