package ca.gc.cra.blog.domain.format;

/**
 * Raised when a format string cannot be resolved against its arguments.
 *
 * <p>Covers argument-count mismatches, verbs that cannot render the supplied argument, and malformed
 * placeholder modifiers. The failure is local to one call: writers discard the partially rendered record
 * and remain usable.</p>
 *
 * @since 0.1.0
 */
public class FormatException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with the given detail message.
   *
   * @param message description of the unresolved placeholder
   */
  public FormatException(String message) {
    super(message);
  }

  /**
   * Creates an exception wrapping a lower-level formatter failure.
   *
   * @param message description of the unresolved placeholder
   * @param cause underlying formatter exception
   */
  public FormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
