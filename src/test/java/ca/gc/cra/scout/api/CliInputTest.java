package ca.gc.cra.scout.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void valueOptionsBecomeKeyValuePairs() {
    CliInput input = CliInput.parse(new String[] {"-n", "uecm", "--pods", "uecm gateway", "timeout=1m"});

    assertArrayEquals(new String[] {"namespace=uecm", "pods=uecm gateway", "timeout=1m"},
        input.keyValueArgs());
  }

  @Test
  void doubleDashAssignmentsAreCanonicalized() {
    CliInput input = CliInput.parse(new String[] {"--namespace=uecm", "--pollInterval=500ms"});

    assertArrayEquals(new String[] {"namespace=uecm", "pollInterval=500ms"}, input.keyValueArgs());
  }

  @Test
  void flagsAreCollectedCaseInsensitively() {
    CliInput input = CliInput.parse(new String[] {"--Dry-Run", "-v", "pods=uecm"});

    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertFalse(input.hasFlag("--allow-overwrite"));
  }

  @Test
  void helpIsRecognized() {
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
  }

  @Test
  void valueOptionWithoutValueIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> CliInput.parse(new String[] {"pods=uecm", "-o"}));
  }
}
