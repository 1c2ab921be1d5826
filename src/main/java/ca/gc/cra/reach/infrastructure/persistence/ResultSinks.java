package ca.gc.cra.reach.infrastructure.persistence;

import ca.gc.cra.reach.application.port.ResultSinkPort;
import ca.gc.cra.reach.util.PathUtils;
import ca.gc.cra.reach.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Selects a file sink from the destination's extension.
 *
 * @since 0.1.0
 */
public final class ResultSinks {
  private ResultSinks() {}

  /**
   * Returns the sink for a file destination.
   *
   * @param path destination; {@code .csv} or {@code .json}, case-insensitive
   * @return CSV or JSON sink
   * @throws UnsupportedOutputFormatException for any other extension, or none
   */
  public static ResultSinkPort forPath(Path path) {
    Objects.requireNonNull(path, "path");
    String extension = PathUtils.extension(path).orElse("");
    return switch (extension) {
      case "csv" -> new CsvResultSink(path);
      case "json" -> new JsonResultSink(path);
      default -> throw new UnsupportedOutputFormatException(
          "Unsupported output format '" + path + "'; use a .csv or .json file");
    };
  }

  /**
   * Validates a file destination and creates its parent directories.
   *
   * @param path destination file
   * @return absolute path ready to be opened for writing
   * @throws IOException if the destination is a directory or cannot be created or written
   */
  static Path prepareTarget(Path path) throws IOException {
    try {
      return Paths.validateWritableFile(path);
    } catch (IllegalArgumentException ex) {
      throw new IOException(ex.getMessage(), ex);
    }
  }
}
