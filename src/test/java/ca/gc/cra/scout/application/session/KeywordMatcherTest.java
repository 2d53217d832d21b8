package ca.gc.cra.scout.application.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class KeywordMatcherTest {

  @Test
  void matchesSubstringAnywhereInLine() {
    KeywordMatcher matcher = new KeywordMatcher(List.of("ERROR"));

    assertTrue(matcher.matches("2026-10-19 12:00:01 ERROR connection reset"));
    assertTrue(matcher.matches("xERRORx"));
    assertFalse(matcher.matches("all good"));
  }

  @Test
  void matchingIsCaseSensitive() {
    KeywordMatcher matcher = new KeywordMatcher(List.of("error"));

    assertFalse(matcher.matches("Error: disk full"));
    assertFalse(matcher.matches("ERROR: disk full"));
    assertTrue(matcher.matches("an error occurred"));
  }

  @Test
  void firstMatchFollowsConfigurationOrder() {
    KeywordMatcher matcher = new KeywordMatcher(List.of("fatal", "ERROR"));

    assertEquals(Optional.of("fatal"), matcher.firstMatch("ERROR then fatal"));
    assertEquals(Optional.of("ERROR"), matcher.firstMatch("ERROR only"));
    assertEquals(Optional.empty(), matcher.firstMatch(null));
    assertEquals(Optional.empty(), matcher.firstMatch(""));
  }

  @Test
  void rejectsEmptyKeywordLists() {
    assertThrows(IllegalArgumentException.class, () -> new KeywordMatcher(List.of()));
    assertThrows(IllegalArgumentException.class, () -> new KeywordMatcher(List.of("ERROR", "")));
  }
}
