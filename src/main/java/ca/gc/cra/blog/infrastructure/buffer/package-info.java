/**
 * Byte buffers backing the formatting writer.
 * <p><strong>Role:</strong> Infrastructure holding the record scratch and the buffered view over a sink.</p>
 * <p><strong>Concurrency:</strong> Neither type is thread-safe; the writer lock serializes access.</p>
 * <p><strong>Performance:</strong> Scratch and buffer arrays are allocated once per writer and reused.</p>
 */
package ca.gc.cra.blog.infrastructure.buffer;
