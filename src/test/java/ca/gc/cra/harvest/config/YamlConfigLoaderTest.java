package ca.gc.cra.harvest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void modeSectionOverridesCommonSection() throws IOException {
    Path yaml = write(String.join("\n",
        "common:",
        "  dir: /data/exports",
        "  interval: 2",
        "ingest:",
        "  interval: 0.5",
        "  commitMode: balanced",
        "watch:",
        "  interval: 10",
        ""));

    Map<String, String> ingest = YamlConfigLoader.load(yaml, HarvestMode.INGEST).orElseThrow();
    Map<String, String> watch = YamlConfigLoader.load(yaml, HarvestMode.WATCH).orElseThrow();

    assertEquals("/data/exports", ingest.get("dir"));
    assertEquals("0.5", ingest.get("interval"));
    assertEquals("balanced", ingest.get("commitMode"));
    assertEquals("10", watch.get("interval"));
    assertFalse(watch.containsKey("commitMode"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    assertTrue(YamlConfigLoader.load(write(""), HarvestMode.INGEST).orElseThrow().isEmpty());
  }

  @Test
  void missingFileYieldsEmpty() throws IOException {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), HarvestMode.INGEST).isEmpty());
  }

  @Test
  void unknownSectionIsRejected() throws IOException {
    Path yaml = write("capture:\n  iface: eth0\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, HarvestMode.INGEST));
  }

  @Test
  void listsAndMalformedYamlAreRejected() throws IOException {
    Path lists = write("common:\n  dir:\n    - a\n    - b\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(lists, HarvestMode.WATCH));

    Path broken = write("common: [unclosed\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, HarvestMode.WATCH));
  }

  private Path write(String content) throws IOException {
    return Files.writeString(Files.createTempFile(tempDir, "harvest", ".yaml"), content);
  }
}
