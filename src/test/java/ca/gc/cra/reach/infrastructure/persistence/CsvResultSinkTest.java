package ca.gc.cra.reach.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.reach.domain.scan.OpenPair;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvResultSinkTest {
  @TempDir Path tempDir;

  @Test
  void writesHeaderAndRowsInOrder() throws IOException {
    Path out = tempDir.resolve("reports/open.csv");
    CsvResultSink sink = new CsvResultSink(out);

    sink.write(List.of(new OpenPair("10.0.0.1", 22), new OpenPair("10.0.0.1", 443), new OpenPair("db", 5432)));

    assertEquals("host,port\n10.0.0.1,22\n10.0.0.1,443\ndb,5432\n",
        Files.readString(out, StandardCharsets.UTF_8));
    assertEquals("csv:" + out, sink.describe());
  }

  @Test
  void emptyResultWritesHeaderOnly() throws IOException {
    Path out = tempDir.resolve("none.csv");

    new CsvResultSink(out).write(List.of());

    assertEquals("host,port\n", Files.readString(out, StandardCharsets.UTF_8));
  }

  @Test
  void existingFileIsReplaced() throws IOException {
    Path out = Files.writeString(tempDir.resolve("old.csv"), "stale content that is longer than the new file\n");

    new CsvResultSink(out).write(List.of(new OpenPair("h", 1)));

    assertEquals("host,port\nh,1\n", Files.readString(out, StandardCharsets.UTF_8));
  }

  @Test
  void directoryDestinationFailsWithIoException() {
    assertThrows(IOException.class, () -> new CsvResultSink(tempDir).write(List.of()));
  }

  @Test
  void escapeQuotesSpecialCharacters() {
    assertEquals("plain.host", CsvResultSink.escape("plain.host"));
    assertEquals("\"a,b\"", CsvResultSink.escape("a,b"));
    assertEquals("\"say \"\"hi\"\"\"", CsvResultSink.escape("say \"hi\""));
  }
}
