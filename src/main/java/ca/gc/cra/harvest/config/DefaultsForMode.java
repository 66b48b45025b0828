package ca.gc.cra.harvest.config;

import ca.gc.cra.harvest.application.ingest.CommitMode;
import ca.gc.cra.harvest.application.ingest.InsertStrategy;
import ca.gc.cra.harvest.domain.tail.ExportFileNames;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each harvest mode.
 *
 * <p>The defaults are the single source of truth for recognized keys: {@link ConfigMerger} rejects any key that has
 * no default here. The {@code BENCHVUE_DIR} and {@code BENCHVUE_DB} environment variables replace the built-in
 * directory and database defaults.</p>
 */
public final class DefaultsForMode {
  /** Environment variable naming the watched directory. */
  public static final String ENV_DIR = "BENCHVUE_DIR";
  /** Environment variable naming the SQLite database file. */
  public static final String ENV_DB = "BENCHVUE_DB";

  static final String DEFAULT_DB_FILE = "benchvue.sqlite3";
  static final String INGEST_INTERVAL_SECONDS = "1.0";
  static final String WATCH_INTERVAL_SECONDS = "7.4";

  private DefaultsForMode() {}

  /**
   * Returns defaults for {@code mode} using the process environment.
   *
   * @param mode target mode
   * @return unmodifiable map of default key/value pairs
   */
  public static Map<String, String> asFlatMap(HarvestMode mode) {
    return asFlatMap(mode, System.getenv());
  }

  /**
   * Returns defaults for {@code mode} using the supplied environment.
   *
   * @param mode target mode
   * @param env environment variables consulted for {@link #ENV_DIR} and {@link #ENV_DB}
   * @return unmodifiable map of default key/value pairs
   */
  public static Map<String, String> asFlatMap(HarvestMode mode, Map<String, String> env) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> environment = env == null ? Map.of() : env;
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("verbose", "false");
    map.put("dir", envOr(environment, ENV_DIR, Path.of("").toAbsolutePath().toString()));
    map.put("filePrefix", ExportFileNames.DEFAULT_PREFIX);
    map.put("backfill", "false");
    switch (mode) {
      case INGEST -> {
        map.put("interval", INGEST_INTERVAL_SECONDS);
        map.put("db", envOr(environment, ENV_DB, Path.of(DEFAULT_DB_FILE).toAbsolutePath().toString()));
        map.put("commitMode", CommitMode.STANDARD.name().toLowerCase(Locale.ROOT));
        map.put("batchRows", "");
        map.put("batchSeconds", "");
        map.put("insertStrategy", InsertStrategy.AUTO.name().toLowerCase(Locale.ROOT));
        map.put("progress", "false");
      }
      case WATCH -> map.put("interval", WATCH_INTERVAL_SECONDS);
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    return Map.copyOf(map);
  }

  private static String envOr(Map<String, String> env, String name, String fallback) {
    String value = env.get(name);
    return value == null || value.isBlank() ? fallback : value.trim();
  }
}
