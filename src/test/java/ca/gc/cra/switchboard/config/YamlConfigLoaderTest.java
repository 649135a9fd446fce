package ca.gc.cra.switchboard.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir
  Path tempDir;

  @Test
  void contextSectionOverridesCommon() throws IOException {
    Path file = write("""
        common:
          lockTimeoutMillis: 1000
          telemetry: log
        server:
          lockTimeoutMillis: 2000
        client:
          telemetry: memory
        """);

    Map<String, String> server = YamlConfigLoader.load(file, "server").orElseThrow();
    Map<String, String> client = YamlConfigLoader.load(file, "CLIENT").orElseThrow();

    assertEquals("2000", server.get("lockTimeoutMillis"));
    assertEquals("log", server.get("telemetry"));
    assertEquals("1000", client.get("lockTimeoutMillis"));
    assertEquals("memory", client.get("telemetry"));
  }

  @Test
  void nestedKeysAreFlattened() throws IOException {
    Path file = write("""
        server:
          otel:
            endpoint: http://collector:4317
          topology:
        """);

    Map<String, String> flat = YamlConfigLoader.load(file, "server").orElseThrow();

    assertEquals("http://collector:4317", flat.get("otel.endpoint"));
    assertEquals("", flat.get("topology"));
  }

  @Test
  void missingFileYieldsEmptyAndEmptyFileYieldsEmptyMap() throws IOException {
    assertEquals(Optional.empty(), YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "server"));
    assertTrue(YamlConfigLoader.load(write(""), "server").orElseThrow().isEmpty());
  }

  @Test
  void invalidShapesAreRejected() throws IOException {
    Path list = write("""
        server:
          modes: [a, b]
        """);
    Path broken = write("server: [unclosed");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(list, "server"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "server"));
  }

  private Path write(String content) throws IOException {
    Path file = Files.createTempFile(tempDir, "bus", ".yaml");
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }
}
