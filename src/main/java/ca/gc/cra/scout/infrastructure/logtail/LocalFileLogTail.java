package ca.gc.cra.scout.infrastructure.logtail;

import ca.gc.cra.scout.application.port.LogTailPort;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * {@link LogTailPort} over the local filesystem.
 *
 * <p>Monitored paths are absolute paths as seen by the workload (for example {@code /dumplog}).
 * They are resolved beneath a root directory, which is {@code /} in production and a mounted
 * volume or a test directory otherwise. Paths that escape the root are rejected.</p>
 */
public final class LocalFileLogTail implements LogTailPort {
  private final Path root;

  public LocalFileLogTail() {
    this(Path.of("/"));
  }

  public LocalFileLogTail(Path root) {
    this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
  }

  @Override
  public PathStatus stat(String path) throws IOException {
    Path resolved = resolve(path);
    if (Files.isDirectory(resolved)) {
      return PathStatus.directory();
    }
    if (Files.isRegularFile(resolved)) {
      try {
        return PathStatus.file(Files.size(resolved));
      } catch (NoSuchFileException ex) {
        return PathStatus.missing();
      }
    }
    if (!Files.exists(resolved)) {
      return PathStatus.missing();
    }
    throw new IOException(path + " is neither a regular file nor a directory");
  }

  @Override
  public byte[] read(String path, long offset, int maxBytes) throws IOException {
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be >= 0");
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    try (FileChannel channel = FileChannel.open(resolve(path), StandardOpenOption.READ)) {
      long available = channel.size() - offset;
      if (available <= 0) {
        return new byte[0];
      }
      ByteBuffer buffer = ByteBuffer.allocate((int) Math.min(maxBytes, available));
      long position = offset;
      while (buffer.hasRemaining()) {
        int n = channel.read(buffer, position);
        if (n < 0) {
          break;
        }
        position += n;
      }
      return buffer.position() == buffer.capacity()
          ? buffer.array()
          : Arrays.copyOf(buffer.array(), buffer.position());
    }
  }

  @Override
  public List<String> list(String directory) throws IOException {
    List<String> names = new ArrayList<>();
    try (Stream<Path> entries = Files.list(resolve(directory))) {
      entries.forEach(p -> names.add(p.getFileName().toString()));
    }
    return names;
  }

  Path resolve(String path) {
    Objects.requireNonNull(path, "path");
    String relative = path.startsWith("/") ? path.substring(1) : path;
    Path resolved = root.resolve(relative).normalize();
    if (!resolved.startsWith(root)) {
      throw new IllegalArgumentException("path escapes watch root: " + path);
    }
    return resolved;
  }

  public Path root() {
    return root;
  }
}
