/**
 * Diagnostic logging helpers (SLF4J over Logback) for the CLI and infrastructure adapters.
 * <p>These concern the library's own diagnostics, not the records a writer produces.</p>
 */
package ca.gc.cra.blog.logging;
