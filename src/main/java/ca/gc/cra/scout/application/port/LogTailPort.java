package ca.gc.cra.scout.application.port;

import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Incremental access to monitored log paths.
 * <p><strong>Why:</strong> Log watchers only track offsets and match keywords; where the bytes live
 * (local disk, a pod filesystem) is an adapter concern.</p>
 * <p><strong>Thread-safety:</strong> Each watcher calls the port from its own thread; implementations
 * must not share per-path state between callers.</p>
 *
 * @since 0.1.0
 */
public interface LogTailPort {
  /**
   * Describes the current state of a path.
   *
   * @param path monitored path
   * @return status; {@link PathStatus#missing()} when the path does not exist
   * @throws IOException if the path exists but cannot be inspected
   */
  PathStatus stat(String path) throws IOException;

  /**
   * Reads up to {@code maxBytes} bytes of a regular file starting at {@code offset}.
   *
   * @param path monitored file
   * @param offset byte offset to start from
   * @param maxBytes maximum bytes to return
   * @return bytes read; empty when the offset is at or beyond end of file
   * @throws IOException if the file cannot be read
   */
  byte[] read(String path, long offset, int maxBytes) throws IOException;

  /**
   * Lists entry names of a directory.
   *
   * @param directory monitored directory
   * @return entry names (not paths), order unspecified
   * @throws IOException if the directory cannot be listed
   */
  List<String> list(String directory) throws IOException;

  /** Kind of filesystem object found at a monitored path. */
  enum PathKind {
    MISSING,
    FILE,
    DIRECTORY
  }

  /**
   * Result of {@link #stat(String)}.
   *
   * @param kind object kind
   * @param size file size in bytes; {@code 0} for directories and missing paths
   */
  record PathStatus(PathKind kind, long size) {
    private static final PathStatus MISSING = new PathStatus(PathKind.MISSING, 0L);

    public static PathStatus missing() {
      return MISSING;
    }

    public static PathStatus file(long size) {
      return new PathStatus(PathKind.FILE, size);
    }

    public static PathStatus directory() {
      return new PathStatus(PathKind.DIRECTORY, 0L);
    }
  }
}
