package jp.naoj.pfs.redaction.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for the input and output directories of a redaction run.
 * <p><strong>Why:</strong> Redacted views must never overwrite an earlier run by accident, and a missing
 * input should fail before any work starts.</p>
 * <p><strong>Thread-safety:</strong> Stateless; concurrency limited by filesystem semantics.</p>
 *
 * @implNote Checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked output directory is rejected.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates an existing, readable input directory.
   *
   * @param path candidate directory; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the directory is missing or unreadable
   */
  public static Path validateReadableDir(Path path) {
    Path normalized = normalize(path);
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("input directory does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("input directory is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates a writable output directory, optionally creating it.
   *
   * @param path candidate directory; must not be {@code null}
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @param allowReuse when {@code false}, existing non-empty directories are rejected
   * @return real directory path once it exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the path is not a writable directory, is populated without
   *     {@code allowReuse}, or creation fails
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing, boolean allowReuse) {
    Path normalized = normalize(path);
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
        ensureDirectory(real, allowReuse);
        return real;
      }
      if (!createIfMissing) {
        Path parent = normalized.getParent();
        if (parent == null || !Files.isDirectory(parent) || !Files.isWritable(parent)) {
          throw new IllegalArgumentException("parent directory is not writable: " + parent);
        }
        return normalized;
      }
      Files.createDirectories(normalized);
      Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
      ensureDirectory(real, true);
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }

  private static void ensureDirectory(Path dir, boolean allowReuse) throws IOException {
    if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
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
}
