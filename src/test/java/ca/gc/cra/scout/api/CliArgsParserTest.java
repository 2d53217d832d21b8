package ca.gc.cra.scout.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"namespace=uecm", "pods=uecm gateway"});
    assertEquals("uecm", map.get("namespace"));
    assertEquals("uecm gateway", map.get("pods"));
  }

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=team=sre,env=test"});
    assertEquals("team=sre,env=test", map.get("otelResourceAttributes"));
  }

  @Test
  void skipsBlankArguments() {
    assertTrue(CliArgsParser.toMap(new String[] {" ", null}).isEmpty());
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"pods="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=x"}));
  }
}
