package ca.gc.cra.harvest.config;

import ca.gc.cra.harvest.application.ingest.CommitMode;
import ca.gc.cra.harvest.application.ingest.CommitPolicy;
import ca.gc.cra.harvest.application.ingest.InsertStrategy;
import ca.gc.cra.harvest.domain.tail.ExportFileNames;
import ca.gc.cra.harvest.validation.Numbers;
import ca.gc.cra.harvest.validation.Paths;
import ca.gc.cra.harvest.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated settings of one harvest run.
 * <p><strong>Why:</strong> Converts the merged string map into typed values once, so the composition root never
 * parses strings.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param mode subcommand the settings belong to
 * @param directory watched directory
 * @param database SQLite file; empty for {@link HarvestMode#WATCH}
 * @param pollInterval wait between poll cycles
 * @param backfill whether pre-existing rows of newly tracked files are emitted
 * @param commitMode commit preset
 * @param commitPolicy effective thresholds (preset plus overrides)
 * @param insertStrategy duplicate-suppression strategy
 * @param progress whether per-row progress is reported
 * @param filePrefix export file name prefix
 * @since 0.1.0
 */
public record HarvestConfig(
    HarvestMode mode,
    Path directory,
    Optional<Path> database,
    Duration pollInterval,
    boolean backfill,
    CommitMode commitMode,
    CommitPolicy commitPolicy,
    InsertStrategy insertStrategy,
    boolean progress,
    String filePrefix) {

  private static final double MIN_INTERVAL_SECONDS = 0.01;
  private static final double MAX_INTERVAL_SECONDS = 86_400;
  private static final long MAX_BATCH_ROWS = 10_000_000L;

  public HarvestConfig {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(directory, "directory");
    Objects.requireNonNull(database, "database");
    Objects.requireNonNull(pollInterval, "pollInterval");
    Objects.requireNonNull(commitMode, "commitMode");
    Objects.requireNonNull(commitPolicy, "commitPolicy");
    Objects.requireNonNull(insertStrategy, "insertStrategy");
    Objects.requireNonNull(filePrefix, "filePrefix");
  }

  /**
   * Parses and validates an effective configuration map.
   *
   * <p>Path checks do not touch the filesystem beyond reads; the database directory is created later by
   * {@link #prepareDatabase()}.</p>
   *
   * @param mode subcommand
   * @param args merged key/value settings
   * @return validated configuration
   * @throws IllegalArgumentException naming the offending key when a value is invalid
   */
  public static HarvestConfig fromMap(HarvestMode mode, Map<String, String> args) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(args, "args");
    Path directory = Paths.validateWatchDir(Path.of(Strings.requireNonBlank("dir", args.get("dir"))));
    Duration interval = seconds("interval", args.get("interval"))
        .orElseThrow(() -> new IllegalArgumentException("interval must be provided"));
    boolean backfill = bool(args.get("backfill"));
    String prefix = new ExportFileNames(
        Strings.firstNonBlank(args.get("filePrefix"), ExportFileNames.DEFAULT_PREFIX)).prefix();

    Optional<Path> database = Optional.empty();
    CommitMode commitMode = CommitMode.STANDARD;
    InsertStrategy strategy = InsertStrategy.AUTO;
    Integer batchRows = null;
    Duration batchInterval = null;
    boolean progress = false;
    if (mode == HarvestMode.INGEST) {
      database = Optional.of(Path.of(Strings.requireNonBlank("db", args.get("db"))).toAbsolutePath().normalize());
      commitMode = CommitMode.parse(Strings.firstNonBlank(args.get("commitMode"), "standard"));
      strategy = InsertStrategy.parse(Strings.firstNonBlank(args.get("insertStrategy"), "auto"));
      String rows = args.get("batchRows");
      if (rows != null && !rows.isBlank()) {
        batchRows = (int) Numbers.requireRange("batchRows", parseLong("batchRows", rows), 1, MAX_BATCH_ROWS);
      }
      batchInterval = seconds("batchSeconds", args.get("batchSeconds")).orElse(null);
      progress = bool(args.get("progress"));
    }
    CommitPolicy policy = CommitPolicy.of(commitMode, batchRows, batchInterval);
    return new HarvestConfig(
        mode, directory, database, interval, backfill, commitMode, policy, strategy, progress, prefix);
  }

  /**
   * Validates the database location and creates its parent directory when missing.
   *
   * @return absolute database path
   * @throws IllegalStateException if called for a mode without a database
   * @throws IllegalArgumentException if the location is unusable
   */
  public Path prepareDatabase() {
    Path db = database.orElseThrow(() -> new IllegalStateException(mode.key() + " has no database"));
    return Paths.validateDatabaseFile(db, true);
  }

  /**
   * Renders the settings as {@code key=value} lines for {@code --dry-run}.
   *
   * @return printable summary
   */
  public String describe() {
    StringBuilder sb = new StringBuilder();
    sb.append("mode=").append(mode.key()).append('\n');
    sb.append("dir=").append(directory).append('\n');
    sb.append("filePrefix=").append(filePrefix).append('\n');
    sb.append("interval=").append(pollInterval.toMillis() / 1000.0).append('\n');
    sb.append("backfill=").append(backfill).append('\n');
    database.ifPresent(db -> {
      sb.append("db=").append(db).append('\n');
      sb.append("commitMode=").append(commitMode.name().toLowerCase(Locale.ROOT)).append('\n');
      sb.append("batchRows=").append(commitPolicy.batchRows()).append('\n');
      sb.append("batchSeconds=").append(commitPolicy.batchInterval().toMillis() / 1000.0).append('\n');
      sb.append("insertStrategy=").append(insertStrategy.name().toLowerCase(Locale.ROOT)).append('\n');
      sb.append("progress=").append(progress).append('\n');
    });
    return sb.toString();
  }

  private static Optional<Duration> seconds(String key, String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    double value;
    try {
      value = Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number of seconds (was " + raw + ")", ex);
    }
    Numbers.requireRange(key, value, MIN_INTERVAL_SECONDS, MAX_INTERVAL_SECONDS);
    return Optional.of(Duration.ofNanos(Math.round(value * 1_000_000_000d)));
  }

  private static long parseLong(String key, String raw) {
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw + ")", ex);
    }
  }

  private static boolean bool(String raw) {
    return raw != null && Boolean.parseBoolean(raw.trim());
  }
}
