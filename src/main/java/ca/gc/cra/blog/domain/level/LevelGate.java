package ca.gc.cra.blog.domain.level;

import java.util.Objects;

/**
 * Holds the active severity threshold of a writer.
 *
 * <p>The threshold is a volatile field so reads and updates are atomic and visible across threads without
 * taking the writer lock. The gate only stores the value; emission decisions are made by callers through
 * {@link #allows(Level)}.</p>
 *
 * @since 0.1.0
 */
public final class LevelGate {
  private volatile Level threshold;

  /**
   * Creates a gate with the given initial threshold.
   *
   * @param initial starting threshold; must not be {@code null}
   */
  public LevelGate(Level initial) {
    this.threshold = Objects.requireNonNull(initial, "initial");
  }

  /**
   * Returns the current threshold.
   *
   * @return active threshold
   */
  public Level threshold() {
    return threshold;
  }

  /**
   * Replaces the threshold.
   *
   * @param level new threshold; must not be {@code null}
   */
  public void setThreshold(Level level) {
    this.threshold = Objects.requireNonNull(level, "level");
  }

  /**
   * Checks a call level against the current threshold.
   *
   * @param level level of the candidate message
   * @return {@code true} when the message should be emitted
   */
  public boolean allows(Level level) {
    return level.isAtLeast(threshold);
  }
}
