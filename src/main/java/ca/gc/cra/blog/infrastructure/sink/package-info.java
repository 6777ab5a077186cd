/**
 * Byte sinks for writers: appending files, TCP sockets, and the console.
 * <p><strong>Role:</strong> Adapter layer; writers treat every sink as an opaque {@link java.io.OutputStream}.</p>
 * <p><strong>Concurrency:</strong> Sinks are not thread-safe; the owning writer serializes access.</p>
 */
package ca.gc.cra.blog.infrastructure.sink;
