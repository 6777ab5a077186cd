/**
 * Command-line adapters for the {@code blog} tool.
 * <p>{@link ca.gc.cra.blog.api.Main} dispatches to {@link ca.gc.cra.blog.api.PipeCli}; both return
 * {@link ca.gc.cra.blog.api.ExitCode} values from their {@code run} methods so tests can drive them without
 * exiting the JVM.</p>
 */
package ca.gc.cra.blog.api;
