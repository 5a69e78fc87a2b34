package ca.gc.cra.chunkio.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void missingPropertiesFallBackToDefaults() throws IOException {
    assertEquals(WriterConfig.defaults(), ConfigLoader.fromProperties(tempDir.resolve("absent.properties")));
    assertEquals(WriterConfig.defaults(), ConfigLoader.fromProperties(null));
  }

  @Test
  void readsPropertiesFile() throws IOException {
    Path file = tempDir.resolve("writer.properties");
    Files.writeString(file, "maxResultRows=25\nrecording.enabled=true\n", StandardCharsets.UTF_8);

    WriterConfig config = ConfigLoader.fromProperties(file);

    assertEquals(25, config.maxResultRows());
    assertTrue(config.recordingEnabled());
  }

  @Test
  void readsYamlProfile() throws IOException {
    Path file = tempDir.resolve("writer.yaml");
    Files.writeString(file, String.join("\n",
        "common:",
        "  maxResultRows: 100",
        "  metrics:",
        "    prefix: shared.writer",
        "test:",
        "  maxResultRows: 5",
        ""), StandardCharsets.UTF_8);

    WriterConfig config = ConfigLoader.fromYaml(file, "test");

    assertEquals(5, config.maxResultRows());
    assertEquals("shared.writer", config.metricsPrefix());
  }

  @Test
  void missingYamlFallsBackToDefaults() throws IOException {
    assertEquals(WriterConfig.defaults(), ConfigLoader.fromYaml(tempDir.resolve("absent.yaml"), "prod"));
  }
}
