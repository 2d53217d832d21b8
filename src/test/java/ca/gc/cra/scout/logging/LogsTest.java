package ca.gc.cra.scout.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("ERROR disk full", Logs.truncate("ERROR disk full", 64));
    assertEquals("<null>", Logs.truncate(null, 64));
  }

  @Test
  void truncateAppendsOriginalLength() {
    String truncated = Logs.truncate("abcdefghij", 4);
    assertEquals("abcd... (truncated, 4 of 10)", truncated);
  }

  @Test
  void truncateDropsPartialCodepoints() {
    String truncated = Logs.truncate("ééé", 3);
    assertTrue(truncated.startsWith("é... (truncated"), truncated);
  }

  @Test
  void truncateRejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void singleLineFlattensLineBreaks() {
    assertEquals("first  second", Logs.singleLine("first\r\nsecond\n"));
  }
}
