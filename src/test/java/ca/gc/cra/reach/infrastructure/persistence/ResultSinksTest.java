package ca.gc.cra.reach.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class ResultSinksTest {

  @Test
  void selectsSinkByExtension() {
    assertInstanceOf(CsvResultSink.class, ResultSinks.forPath(Path.of("out.csv")));
    assertInstanceOf(CsvResultSink.class, ResultSinks.forPath(Path.of("OUT.CSV")));
    assertInstanceOf(JsonResultSink.class, ResultSinks.forPath(Path.of("dir/out.json")));
  }

  @Test
  void otherExtensionsAreUnsupported() {
    assertThrows(UnsupportedOutputFormatException.class, () -> ResultSinks.forPath(Path.of("out.txt")));
    assertThrows(UnsupportedOutputFormatException.class, () -> ResultSinks.forPath(Path.of("out")));
    assertThrows(UnsupportedOutputFormatException.class, () -> ResultSinks.forPath(Path.of("out.csv.bak")));
  }
}
