package ca.gc.cra.blog.domain.format;

import java.util.Objects;

/**
 * <strong>What:</strong> Single-pass renderer for {@code %}-placeholder format strings.
 * <p><strong>Why:</strong> Renders literal runs and placeholders straight into the caller's record without
 * building an intermediate message string.</p>
 * <p><strong>Role:</strong> Domain algorithm used by the formatting writer for every formatted call.</p>
 * <p><strong>Grammar:</strong>
 * <ul>
 *   <li>{@code %} opens a placeholder; the first verb character (see {@link VerbRenderer#isVerb(char)}) closes it
 *   and renders the next positional argument.</li>
 *   <li>Characters between {@code %} and the verb are modifiers ({@link FormatModifiers}).</li>
 *   <li>{@code %%} writes one literal {@code %} and consumes no argument.</li>
 *   <li>Inside a placeholder, {@code \\} writes one literal {@code \}; a single {@code \} is an escape marker
 *   and writes nothing. Outside placeholders {@code \} is an ordinary character.</li>
 *   <li>A {@code %} inside an open placeholder abandons it: the abandoned text is written literally and a new
 *   placeholder starts.</li>
 *   <li>A placeholder still open at the end of the format is written literally.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; the render target must not be shared during a call.</p>
 * <p><strong>Performance:</strong> One pass over the format; literal runs are encoded straight from the format
 * string.</p>
 *
 * @since 0.1.0
 */
public final class PlaceholderScanner {
  static final char PLACEHOLDER = '%';
  static final char ESCAPE = '\\';

  private static final Object[] NO_ARGS = new Object[0];

  private PlaceholderScanner() {}

  /**
   * Renders {@code format} against {@code args} into {@code out}.
   *
   * <p>On failure the target may hold a partial rendering; callers discard it.</p>
   *
   * @param format format string; must not be {@code null}
   * @param args positional arguments; {@code null} is treated as no arguments
   * @param out destination for the rendered bytes
   * @return number of placeholders rendered (equal to {@code args.length} on success)
   * @throws FormatException when the placeholder count differs from the argument count or an argument cannot be
   *     rendered by its verb
   */
  public static int render(String format, Object[] args, RenderTarget out) {
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(out, "out");
    Object[] values = args == null ? NO_ARGS : args;

    boolean inPlaceholder = false;
    int placeholderStart = 0;
    boolean escapePending = false;
    int literalStart = 0;
    int argIndex = 0;

    int length = format.length();
    for (int i = 0; i < length; i++) {
      char c = format.charAt(i);
      if (!inPlaceholder) {
        if (c == PLACEHOLDER) {
          out.appendText(format, literalStart, i);
          inPlaceholder = true;
          placeholderStart = i;
          escapePending = false;
        }
        continue;
      }

      if (VerbRenderer.isVerb(c)) {
        if (argIndex >= values.length) {
          throw new FormatException("placeholder " + format.substring(placeholderStart, i + 1)
              + " at index " + placeholderStart + " has no argument (" + values.length + " supplied)");
        }
        FormatModifiers modifiers = FormatModifiers.parse(format, placeholderStart + 1, i);
        out.appendText(VerbRenderer.render(c, modifiers, values[argIndex]));
        argIndex++;
        literalStart = i + 1;
        inPlaceholder = false;
        escapePending = false;
      } else if (c == ESCAPE) {
        if (escapePending) {
          out.appendAscii(ESCAPE);
        }
        escapePending = !escapePending;
      } else if (c == PLACEHOLDER) {
        if (i == placeholderStart + 1) {
          out.appendAscii(PLACEHOLDER);
          literalStart = i + 1;
          inPlaceholder = false;
        } else {
          appendWithoutEscapes(format, placeholderStart, i, out);
          placeholderStart = i;
        }
        escapePending = false;
      }
    }

    if (inPlaceholder) {
      appendWithoutEscapes(format, placeholderStart, length, out);
    } else {
      out.appendText(format, literalStart, length);
    }
    if (argIndex != values.length) {
      throw new FormatException("format has " + argIndex + " placeholders but " + values.length
          + " arguments were supplied");
    }
    return argIndex;
  }

  // Escape markers in an abandoned placeholder were already applied while scanning it.
  private static void appendWithoutEscapes(String format, int start, int end, RenderTarget out) {
    int runStart = start;
    for (int i = start; i < end; i++) {
      if (format.charAt(i) == ESCAPE) {
        out.appendText(format, runStart, i);
        runStart = i + 1;
      }
    }
    out.appendText(format, runStart, end);
  }
}
