package ca.gc.cra.blog.domain.level;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LevelGateTest {

  @Test
  void allowsLevelsAtOrAboveThreshold() {
    LevelGate gate = new LevelGate(Level.WARN);

    assertFalse(gate.allows(Level.INFO));
    assertTrue(gate.allows(Level.WARN));
    assertTrue(gate.allows(Level.CRITICAL));
  }

  @Test
  void thresholdChangesAreVisibleToLaterChecks() {
    LevelGate gate = new LevelGate(Level.DEBUG);
    assertTrue(gate.allows(Level.DEBUG));

    gate.setThreshold(Level.ERROR);

    assertEquals(Level.ERROR, gate.threshold());
    assertFalse(gate.allows(Level.WARN));
  }

  @Test
  void rejectsNullThreshold() {
    assertThrows(NullPointerException.class, () -> new LevelGate(null));
    LevelGate gate = new LevelGate(Level.INFO);
    assertThrows(NullPointerException.class, () -> gate.setThreshold(null));
  }
}
