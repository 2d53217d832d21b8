package ca.gc.cra.scout.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void parseIntInRangeAcceptsBounds() {
    assertEquals(1, Numbers.parseIntInRange("queueCapacity", "1", 1, 65_536));
    assertEquals(65_536, Numbers.parseIntInRange("queueCapacity", " 65536 ", 1, 65_536));
  }

  @Test
  void parseIntInRangeRejectsOutOfRangeAndGarbage() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("queueCapacity", "0", 1, 10));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("queueCapacity", "ten", 1, 10));
  }
}
