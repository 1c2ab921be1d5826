package ca.gc.cra.reach.util;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/** Utility helpers for working with {@link Path} instances. */
public final class PathUtils {
  private PathUtils() {}

  /**
   * Returns the file name for the supplied path when available.
   *
   * @param path source path; may be {@code null}
   * @return optional file name string
   */
  public static Optional<String> fileName(Path path) {
    if (path == null) {
      return Optional.empty();
    }
    Path name = path.getFileName();
    return name == null ? Optional.empty() : Optional.of(name.toString());
  }

  /**
   * Returns the lower-case extension of the file name, without the dot.
   *
   * @param path source path; may be {@code null}
   * @return extension such as {@code csv}; empty when the name has no dot or ends with one
   */
  public static Optional<String> extension(Path path) {
    return fileName(path).flatMap(name -> {
      int dot = name.lastIndexOf('.');
      if (dot < 0 || dot == name.length() - 1) {
        return Optional.empty();
      }
      return Optional.of(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    });
  }
}
