package ca.gc.cra.scout.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for the session output directory.
 * <p><strong>Why:</strong> The CLI must reject an unusable or already populated output directory before
 * it touches the cluster, yet must not create anything until preflight validation has passed.</p>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked output directory is
 * validated as the link target's real path.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that {@code path} is, or can later be created as, a writable directory.
   *
   * <p>Nothing is created. When the directory exists it must be empty unless {@code allowReuse}
   * is set. When it does not exist, its nearest existing ancestor must be a writable directory.</p>
   *
   * @param path candidate output directory
   * @param allowReuse whether an existing non-empty directory is acceptable
   * @return absolute normalized path (the real path when the directory exists)
   * @throws IllegalArgumentException if the path is unusable
   */
  public static Path validateOutputDir(Path path, boolean allowReuse) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0 || containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS) || Files.isSymbolicLink(normalized)) {
        Path real = normalized.toRealPath();
        ensureUsableDirectory(real, allowReuse);
        return real;
      }
      Path ancestor = nearestExistingAncestor(normalized.getParent());
      if (!Files.isDirectory(ancestor)) {
        throw new IllegalArgumentException("parent is not a directory: " + ancestor);
      }
      if (!Files.isWritable(ancestor)) {
        throw new IllegalArgumentException("parent directory is not writable: " + ancestor);
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static void ensureUsableDirectory(Path dir, boolean allowReuse) throws IOException {
    if (!Files.isDirectory(dir)) {
      throw new IllegalArgumentException("path is not a directory: " + dir);
    }
    if (!Files.isWritable(dir)) {
      throw new IllegalArgumentException("directory is not writable: " + dir);
    }
    if (!allowReuse) {
      try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
        if (entries.iterator().hasNext()) {
          throw new IllegalArgumentException(
              "directory " + dir + " is not empty; re-run with --allow-overwrite to reuse");
        }
      }
    }
  }

  private static Path nearestExistingAncestor(Path start) throws IOException {
    Path current = start;
    while (current != null && !Files.exists(current)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current.toRealPath();
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
