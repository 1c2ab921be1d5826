package ca.gc.cra.reach.infrastructure.persistence;

import ca.gc.cra.reach.application.port.ResultSinkPort;
import ca.gc.cra.reach.domain.scan.OpenPair;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Writes open pairs as a two-column CSV table with a {@code host,port} header row.
 *
 * <p>Rows use {@code \n} line endings and UTF-8. A host containing a comma, quote or line break is quoted per
 * RFC 4180. Parent directories are created and an existing file is replaced.</p>
 *
 * @since 0.1.0
 */
public final class CsvResultSink implements ResultSinkPort {
  static final String HEADER = "host,port";

  private final Path path;

  public CsvResultSink(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  @Override
  public void write(List<OpenPair> openPairs) throws IOException {
    Path target = ResultSinks.prepareTarget(path);
    try (BufferedWriter out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
      out.write(HEADER);
      out.write('\n');
      for (OpenPair pair : openPairs) {
        out.write(escape(pair.host()));
        out.write(',');
        out.write(Integer.toString(pair.port()));
        out.write('\n');
      }
    }
  }

  @Override
  public String describe() {
    return "csv:" + path;
  }

  static String escape(String value) {
    if (value.indexOf(',') < 0 && value.indexOf('"') < 0
        && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
      return value;
    }
    return '"' + value.replace("\"", "\"\"") + '"';
  }
}
