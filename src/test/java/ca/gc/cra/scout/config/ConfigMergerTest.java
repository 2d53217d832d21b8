package ca.gc.cra.scout.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("collect");
    Map<String, String> yaml = Map.of("pods", "uecm", "timeout", "5m");
    Map<String, String> cli = Map.of("pods", "uecm gateway", "pollInterval", "500ms");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "collect", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("uecm gateway", merged.get("pods"));
    assertEquals("5m", merged.get("timeout"));
    assertEquals("500ms", merged.get("pollInterval"));
    assertEquals("default", merged.get("namespace"));
    assertEquals(List.of("CLI overrides YAML for key: pods"), warnings);
  }

  @Test
  void aliasesAreCanonicalized() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "collect",
        Optional.of(Map.of("ns", "uecm")),
        Map.of("pod", "gateway"),
        DefaultsForMode.asFlatMap("collect"),
        msg -> {});

    assertEquals("uecm", merged.get("namespace"));
    assertEquals("gateway", merged.get("pods"));
    assertFalse(merged.containsKey("ns"));
  }

  @Test
  void collectRequiresPods() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "collect", Optional.empty(), Map.of(), DefaultsForMode.asFlatMap("collect"), msg -> {}));
    assertTrue(ex.getMessage().startsWith("pods is required"));
  }

  @Test
  void enabledTraceRequiresEnableCommand() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "collect",
            Optional.empty(),
            Map.of("pods", "uecm", "trace.enableCommand", " "),
            Map.of(),
            msg -> {}));
  }

  @Test
  void deploymentsDoesNotRequirePods() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "deployments", Optional.empty(), Map.of(), DefaultsForMode.asFlatMap("deployments"), msg -> {});

    assertEquals("default", merged.get("namespace"));
  }
}
