package ca.gc.cra.scout.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void collectDefaultsIncludeSessionSettings() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("Collect");

    assertEquals("default", defaults.get("namespace"));
    assertEquals("1s", defaults.get("pollInterval"));
    assertEquals("10m", defaults.get("timeout"));
    assertEquals("1024", defaults.get("queueCapacity"));
    assertEquals("true", defaults.get("exerciser.enabled"));
  }

  @Test
  void deploymentsDefaultsOnlyCarryCommonKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("deployments");

    assertEquals("60s", defaults.get("commandTimeout"));
    assertFalse(defaults.containsKey("pods"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
