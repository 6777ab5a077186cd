package ca.gc.cra.blog.domain.level;

import java.util.Locale;

/**
 * <strong>What:</strong> Severity catalog for BLOG writers, ordered from most to least verbose.
 * <p><strong>Why:</strong> Gives the writer a stable prefix tag per severity and gives façades a total order to
 * compare calls against the active threshold.</p>
 * <p><strong>Role:</strong> Domain value shared by the level gate, the formatting writer, and configuration.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum Level {
  DEBUG,
  TRACE,
  INFO,
  WARN,
  ERROR,
  CRITICAL;

  private final String prefix = "[" + name() + "] ";

  /**
   * Returns the tag written in front of every message at this level, for example {@code "[INFO] "}.
   *
   * @return ASCII prefix including the trailing separator space
   */
  public String prefix() {
    return prefix;
  }

  /**
   * Checks whether this level meets or exceeds the supplied threshold.
   *
   * @param threshold minimum level that should be emitted; must not be {@code null}
   * @return {@code true} when a message at this level passes the threshold
   */
  public boolean isAtLeast(Level threshold) {
    return ordinal() >= threshold.ordinal();
  }

  /**
   * Parses a level name case-insensitively. {@code WARNING} is accepted as an alias of {@link #WARN}.
   *
   * @param raw level name from configuration or CLI input
   * @return matching level
   * @throws IllegalArgumentException when the name is blank or unknown
   */
  public static Level parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("level must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    if (normalized.equals("WARNING")) {
      return WARN;
    }
    for (Level level : values()) {
      if (level.name().equals(normalized)) {
        return level;
      }
    }
    throw new IllegalArgumentException("unknown level: " + raw.trim());
  }
}
