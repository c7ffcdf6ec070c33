package ca.gc.cra.pulse.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndProfileSections() throws IOException {
    Path yaml = tempDir.resolve("pulse.yaml");
    Files.writeString(yaml, """
        common:
          top:
            limit: 5
          metrics:
            exporter: none
        production:
          metrics:
            exporter: otlp
            endpoint: http://collector:4317
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "production");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("5", map.get("top.limit"));
    assertEquals("otlp", map.get("metrics.exporter"));
    assertEquals("http://collector:4317", map.get("metrics.endpoint"));
  }

  @Test
  void loadEngineConfigAppliesFlattenedKeys() throws IOException {
    Path yaml = tempDir.resolve("engine.yaml");
    Files.writeString(yaml, """
        common:
          week:
            start: monday
          anomaly:
            threshold: 2.5
          series:
            fillGaps: false
        """);

    EngineConfig config = YamlConfigLoader.loadEngineConfig(yaml, "Development");

    assertEquals(DayOfWeek.MONDAY, config.weekStart());
    assertEquals(2.5, config.anomalyThreshold());
    assertFalse(config.fillGaps());
  }

  @Test
  void missingFileYieldsDefaults() throws IOException {
    Path missing = tempDir.resolve("missing.yaml");

    assertFalse(YamlConfigLoader.load(missing, "production").isPresent());
    assertEquals(EngineConfig.defaults(), YamlConfigLoader.loadEngineConfig(missing, "production"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertTrue(YamlConfigLoader.load(yaml, "production").orElseThrow().isEmpty());
  }

  @Test
  void invalidStructuresThrow() throws IOException {
    Path list = tempDir.resolve("list.yaml");
    Files.writeString(list, """
        - common:
            top.limit: 5
        """);
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(list, "production"));

    Path nestedList = tempDir.resolve("nested-list.yaml");
    Files.writeString(nestedList, """
        common:
          bots:
            - googlebot
        """);
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(nestedList, "production"));

    Path malformed = tempDir.resolve("malformed.yaml");
    Files.writeString(malformed, "common: [unclosed");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(malformed, "production"));
  }
}
