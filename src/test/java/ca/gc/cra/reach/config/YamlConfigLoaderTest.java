package ca.gc.cra.reach.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void modeSectionOverridesCommonSection() throws IOException {
    Path config = Files.writeString(tempDir.resolve("reach.yaml"), String.join("\n",
        "common:",
        "  metricsExporter: otlp",
        "  workers: 100",
        "scan:",
        "  cidr: 192.168.1.0/24",
        "  workers: 300",
        "  timeout: 1.5",
        "  pingFirst: true",
        "targets:",
        "  host: ignored.example",
        ""));

    Map<String, String> values = YamlConfigLoader.load(config, "scan").orElseThrow();

    assertEquals("otlp", values.get("metricsExporter"));
    assertEquals("300", values.get("workers"));
    assertEquals("1.5", values.get("timeout"));
    assertEquals("true", values.get("pingFirst"));
    assertEquals("192.168.1.0/24", values.get("cidr"));
    assertFalse(values.containsKey("host"));
  }

  @Test
  void scalarListsAreJoinedWithCommas() throws IOException {
    Path config = Files.writeString(tempDir.resolve("ports.yaml"), String.join("\n",
        "scan:",
        "  ports: [22, 80, \"8000-8010\"]",
        ""));

    assertEquals("22,80,8000-8010", YamlConfigLoader.load(config, "scan").orElseThrow().get("ports"));
  }

  @Test
  void missingFileYieldsEmpty() throws IOException {
    assertEquals(Optional.empty(), YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "scan"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path config = Files.writeString(tempDir.resolve("empty.yaml"), "");

    assertEquals(Optional.of(Map.of()), YamlConfigLoader.load(config, "scan"));
  }

  @Test
  void invalidStructureIsRejected() throws IOException {
    Path notMapping = Files.writeString(tempDir.resolve("list.yaml"), "- a\n- b\n");
    Path nestedList = Files.writeString(tempDir.resolve("nested.yaml"), "scan:\n  ports: [[1, 2]]\n");
    Path broken = Files.writeString(tempDir.resolve("broken.yaml"), "scan: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(notMapping, "scan"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(nestedList, "scan"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "scan"));
  }

  @Test
  void unsafeTagsAreRejected() throws IOException {
    Path config = Files.writeString(tempDir.resolve("unsafe.yaml"),
        "scan: !!javax.script.ScriptEngineManager [!!java.net.URLClassLoader [[!!java.net.URL [\"http://x\"]]]]\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(config, "scan"));
  }
}
