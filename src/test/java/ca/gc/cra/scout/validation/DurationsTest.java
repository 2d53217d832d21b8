package ca.gc.cra.scout.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class DurationsTest {

  @Test
  void parseAcceptsShortForms() {
    assertEquals(Duration.ofMillis(500), Durations.parse("pollInterval", "500ms"));
    assertEquals(Duration.ofSeconds(1), Durations.parse("pollInterval", "1s"));
    assertEquals(Duration.ofMinutes(10), Durations.parse("timeout", " 10m "));
    assertEquals(Duration.ofHours(2), Durations.parse("timeout", "2H"));
  }

  @Test
  void parseAcceptsIsoDurations() {
    assertEquals(Duration.ofSeconds(90), Durations.parse("timeout", "PT1M30S"));
    assertEquals(Duration.ofSeconds(90), Durations.parse("timeout", "pt1m30s"));
  }

  @Test
  void parseRejectsMalformedValues() {
    assertThrows(IllegalArgumentException.class, () -> Durations.parse("timeout", "ten minutes"));
    assertThrows(IllegalArgumentException.class, () -> Durations.parse("timeout", "10d"));
    assertThrows(IllegalArgumentException.class, () -> Durations.parse("timeout", " "));
  }

  @Test
  void parseInRangeEnforcesBounds() {
    assertThrows(IllegalArgumentException.class,
        () -> Durations.parseInRange("pollInterval", "10ms", Duration.ofMillis(50), Duration.ofMinutes(1)));
    assertEquals(Duration.ofSeconds(1),
        Durations.parseInRange("pollInterval", "1s", Duration.ofMillis(50), Duration.ofMinutes(1)));
  }

  @Test
  void formatUsesLargestExactUnit() {
    assertEquals("10m", Durations.format(Duration.ofMinutes(10)));
    assertEquals("90s", Durations.format(Duration.ofSeconds(90)));
    assertEquals("1500ms", Durations.format(Duration.ofMillis(1500)));
    assertEquals("2h", Durations.format(Duration.ofHours(2)));
    assertEquals("0s", Durations.format(Duration.ZERO));
  }

  @Test
  void humanAgeMatchesKubectlStyle() {
    assertEquals("45s", Durations.humanAge(Duration.ofSeconds(45)));
    assertEquals("3m12s", Durations.humanAge(Duration.ofSeconds(192)));
    assertEquals("5m", Durations.humanAge(Duration.ofMinutes(5)));
    assertEquals("42m", Durations.humanAge(Duration.ofMinutes(42)));
    assertEquals("5h", Durations.humanAge(Duration.ofHours(5)));
    assertEquals("18d", Durations.humanAge(Duration.ofDays(18)));
    assertEquals("0s", Durations.humanAge(Duration.ofSeconds(-3)));
  }
}
