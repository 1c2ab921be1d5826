package ca.gc.cra.reach.infrastructure.persistence;

import ca.gc.cra.reach.application.port.ResultSinkPort;
import ca.gc.cra.reach.domain.scan.OpenPair;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Writes open pairs as a pretty-printed JSON array of {@code {"host": ..., "port": ...}} objects.
 *
 * <p>Uses the Jackson streaming generator; records are written in the given order with two-space indentation.</p>
 *
 * @since 0.1.0
 */
public final class JsonResultSink implements ResultSinkPort {
  private static final JsonFactory FACTORY = new JsonFactory();

  private final Path path;

  public JsonResultSink(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  @Override
  public void write(List<OpenPair> openPairs) throws IOException {
    Path target = ResultSinks.prepareTarget(path);
    try (OutputStream out = Files.newOutputStream(target);
        JsonGenerator generator = FACTORY.createGenerator(out, JsonEncoding.UTF8)) {
      generator.setPrettyPrinter(prettyPrinter());
      generator.writeStartArray();
      for (OpenPair pair : openPairs) {
        generator.writeStartObject();
        generator.writeStringField("host", pair.host());
        generator.writeNumberField("port", pair.port());
        generator.writeEndObject();
      }
      generator.writeEndArray();
      generator.writeRaw('\n');
    }
  }

  @Override
  public String describe() {
    return "json:" + path;
  }

  private static DefaultPrettyPrinter prettyPrinter() {
    DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
    Separators separators = Separators.createDefaultInstance()
        .withObjectFieldValueSpacing(Separators.Spacing.AFTER)
        .withArrayEmptySeparator("");
    return new DefaultPrettyPrinter()
        .withSeparators(separators)
        .withArrayIndenter(indenter)
        .withObjectIndenter(indenter);
  }
}
