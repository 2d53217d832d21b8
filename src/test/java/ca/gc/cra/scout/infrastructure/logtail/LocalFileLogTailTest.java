package ca.gc.cra.scout.infrastructure.logtail;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.scout.application.port.LogTailPort.PathKind;
import ca.gc.cra.scout.application.port.LogTailPort.PathStatus;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalFileLogTailTest {
  @TempDir Path root;

  @Test
  void statResolvesAbsolutePathsBeneathRoot() throws Exception {
    Files.createDirectories(root.resolve("dumplog"));
    Files.writeString(root.resolve("logs.txt"), "hello", StandardCharsets.UTF_8);
    LocalFileLogTail tail = new LocalFileLogTail(root);

    assertEquals(PathStatus.directory(), tail.stat("/dumplog"));
    PathStatus file = tail.stat("/logs.txt");
    assertEquals(PathKind.FILE, file.kind());
    assertEquals(5L, file.size());
    assertEquals(PathKind.MISSING, tail.stat("/absent.log").kind());
  }

  @Test
  void readReturnsBytesFromOffset() throws Exception {
    Files.writeString(root.resolve("app.log"), "0123456789", StandardCharsets.UTF_8);
    LocalFileLogTail tail = new LocalFileLogTail(root);

    assertArrayEquals("3456".getBytes(StandardCharsets.UTF_8), tail.read("/app.log", 3, 4));
    assertArrayEquals("89".getBytes(StandardCharsets.UTF_8), tail.read("/app.log", 8, 64));
    assertEquals(0, tail.read("/app.log", 10, 64).length);
    assertEquals(0, tail.read("/app.log", 42, 64).length);
  }

  @Test
  void readRejectsInvalidBounds() throws Exception {
    Files.writeString(root.resolve("app.log"), "x", StandardCharsets.UTF_8);
    LocalFileLogTail tail = new LocalFileLogTail(root);

    assertThrows(IllegalArgumentException.class, () -> tail.read("/app.log", -1, 10));
    assertThrows(IllegalArgumentException.class, () -> tail.read("/app.log", 0, 0));
  }

  @Test
  void listReturnsEntryNames() throws Exception {
    Path dir = Files.createDirectories(root.resolve("dumplog"));
    Files.writeString(dir.resolve("core.1"), "a", StandardCharsets.UTF_8);
    Files.createDirectories(dir.resolve("heap"));
    LocalFileLogTail tail = new LocalFileLogTail(root);

    List<String> names = tail.list("/dumplog").stream().sorted().collect(Collectors.toList());
    assertEquals(List.of("core.1", "heap"), names);
  }

  @Test
  void pathsEscapingRootAreRejected() {
    LocalFileLogTail tail = new LocalFileLogTail(root.resolve("jail"));

    assertThrows(IllegalArgumentException.class, () -> tail.stat("/../outside.log"));
    assertThrows(IllegalArgumentException.class, () -> tail.list("/a/../../etc"));
  }
}
