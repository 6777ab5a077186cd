package ca.gc.cra.blog.config;

import java.util.Locale;

/**
 * Destination kinds a configured writer can open.
 *
 * @since 0.1.0
 */
public enum SinkType {
  /** Process standard output. */
  CONSOLE,
  /** Appending file; requires {@code file}. */
  FILE,
  /** TCP connection; requires {@code address}. */
  SOCKET;

  /**
   * Parses a sink name case-insensitively.
   *
   * @param raw configured value
   * @return matching sink type
   * @throws IllegalArgumentException when the value is not {@code console}, {@code file}, or {@code socket}
   */
  public static SinkType parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("sink must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("sink must be console, file, or socket (was " + raw.trim() + ")", ex);
    }
  }
}
