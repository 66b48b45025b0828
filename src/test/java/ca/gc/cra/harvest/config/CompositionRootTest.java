package ca.gc.cra.harvest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.harvest.application.port.MetricsPort;
import ca.gc.cra.harvest.application.port.ProgressListener;
import ca.gc.cra.harvest.infrastructure.events.LoggingProgressListener;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir Path tempDir;

  @Test
  void metricsDefaultToNoOpWhenExporterIsNone() {
    String previous = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");
    try {
      assertSame(MetricsPort.NO_OP, CompositionRoot.createMetrics());
    } finally {
      if (previous == null) {
        System.clearProperty("otel.metrics.exporter");
      } else {
        System.setProperty("otel.metrics.exporter", previous);
      }
    }
  }

  @Test
  void progressSettingSelectsListener() {
    assertSame(ProgressListener.NO_OP, root(false).progressListener());
    assertTrue(root(true).progressListener() instanceof LoggingProgressListener);
  }

  @Test
  void exportFileSetWatchesConfiguredDirectory() {
    assertEquals(tempDir.toAbsolutePath().normalize(), root(false).exportFileSet().directory());
  }

  private CompositionRoot root(boolean progress) {
    Map<String, String> args = new HashMap<>(DefaultsForMode.asFlatMap(HarvestMode.INGEST, Map.of()));
    args.put("dir", tempDir.toString());
    args.put("db", tempDir.resolve("b.sqlite3").toString());
    args.put("progress", Boolean.toString(progress));
    return new CompositionRoot(HarvestConfig.fromMap(HarvestMode.INGEST, args), MetricsPort.NO_OP);
  }
}
