package ca.gc.cra.reach.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for REACH CLI and configuration flows.
 * <p><strong>Why:</strong> Hosts files must be readable before expansion starts, and result files must be
 * writable before the sink opens them.
 * <p><strong>Role:</strong> Domain support utilities executed before sinks or expanders touch the filesystem.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; callers surface validation exceptions.</p>
 *
 * @since 0.1.0
 * @see Strings
 * @see Numbers
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Ensures a path names an existing, readable regular file.
   *
   * @param name logical parameter name used in diagnostics
   * @param path candidate file; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the file is missing, a directory, or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " must reference an existing file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates a destination file, creating missing parent directories.
   *
   * @param path candidate result file; must not be {@code null}
   * @return absolute normalized path whose parent directory exists and is writable
   * @throws IllegalArgumentException if the path is a directory, the parent cannot be created,
   *         or an existing file is not writable
   */
  public static Path validateWritableFile(Path path) {
    Path normalized = normalize("out", path);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("output path is a directory: " + normalized);
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException("output path has no parent directory: " + normalized);
    }
    try {
      if (!Files.exists(parent)) {
        Files.createDirectories(parent);
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to create directory " + parent + ": " + ex.getMessage(), ex);
    }
    if (!Files.isDirectory(parent)) {
      throw new IllegalArgumentException("parent is not a directory: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException("parent directory is not writable: " + parent);
    }
    if (Files.exists(normalized) && !Files.isWritable(normalized)) {
      throw new IllegalArgumentException("output file is not writable: " + normalized);
    }
    return normalized;
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    if (Strings.containsControl(raw)) {
      throw new IllegalArgumentException(name + " must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }
}
