/**
 * Writer configuration: YAML loading, CLI/YAML/default merging, validation, and writer assembly.
 * <p><strong>Thread-safety:</strong> Stateless helpers and immutable records.</p>
 */
package ca.gc.cra.blog.config;
