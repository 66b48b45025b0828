package ca.gc.cra.harvest.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.harvest.infrastructure.exec.StopSignal;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class IngestCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter stdout;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(IngestCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    stdout = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(stdout, true));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpPrintsOptions() {
    assertEquals(ExitCode.SUCCESS, IngestCli.run(new String[] {"--help"}));
    assertTrue(stdout.toString().contains("commitMode=MODE"));
  }

  @Test
  void dryRunPrintsPlanWithoutCreatingDatabase() {
    Path db = tempDir.resolve("out/benchvue.sqlite3");

    ExitCode code = IngestCli.run(new String[] {
        "dir=" + tempDir, "db=" + db, "commitMode=balanced", "--backfill", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String plan = stdout.toString();
    assertTrue(plan.contains("commitMode=balanced"), plan);
    assertTrue(plan.contains("backfill=true"), plan);
    assertTrue(plan.contains("db=" + db.toAbsolutePath().normalize()), plan);
    assertFalse(Files.exists(db.getParent()));
  }

  @Test
  void unknownKeyIsInvalidArgs() {
    ExitCode code = IngestCli.run(new String[] {"dir=" + tempDir, "iface=eth0"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(stdout.toString().contains("usage: ingest"));
    assertTrue(logged(Level.ERROR, "Unknown CLI key for ingest: iface"));
  }

  @Test
  void unknownFlagIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, IngestCli.run(new String[] {"--allow-overwrite"}));
  }

  @Test
  void invalidValueIsConfigError() {
    ExitCode code = IngestCli.run(new String[] {"dir=" + tempDir, "interval=soon", "--dry-run"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(logged(Level.ERROR, "interval"));
  }

  @Test
  void missingConfigFileIsInvalidArgs() {
    ExitCode code = IngestCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml")});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void yamlSettingsAreUsedAndCliWins() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("harvest.yaml"), String.join("\n",
        "common:",
        "  dir: " + tempDir,
        "ingest:",
        "  commitMode: aggressive",
        "  batchRows: 10",
        ""));

    ExitCode code = IngestCli.run(new String[] {"config=" + yaml, "batchRows=20", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(stdout.toString().contains("commitMode=aggressive"));
    assertTrue(stdout.toString().contains("batchRows=20"));
  }

  @Test
  void ingestsUntilStoppedAndReportsTotals() throws Exception {
    Path exports = Files.createDirectory(tempDir.resolve("exports"));
    Files.writeString(exports.resolve("AutoExportTrace_DAQ 1.csv"),
        "Time,Scan Number,A,B\n10:00:00,1,1.0,2.0\n", StandardCharsets.UTF_8);
    Path db = tempDir.resolve("db/benchvue.sqlite3");
    StopSignal stop = new StopSignal();

    CompletableFuture<ExitCode> run = CompletableFuture.supplyAsync(() -> IngestCli.run(new String[] {
        "dir=" + exports, "db=" + db, "interval=0.05", "batchSeconds=0.05", "--backfill"}, stop, false));
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(20);
    while (rowCount(db) < 2 && System.nanoTime() < deadline) {
      Thread.sleep(20);
    }
    stop.requestStop();

    assertEquals(ExitCode.SUCCESS, run.get(20, TimeUnit.SECONDS));
    assertEquals(2, rowCount(db));
    assertTrue(stop.awaitFinished(Duration.ZERO));
    assertTrue(logged(Level.INFO, "Inserted rows: 2 (attempted=2, duplicates=0)"));
  }

  @Test
  void databaseThatIsNotSqliteIsIoError() throws Exception {
    Path db = Files.writeString(tempDir.resolve("benchvue.sqlite3"), "not a database\n".repeat(80));

    ExitCode code = IngestCli.run(new String[] {"dir=" + tempDir, "db=" + db}, new StopSignal(), false);

    assertEquals(ExitCode.IO_ERROR, code);
    assertTrue(logged(Level.ERROR, "Sample store failure"));
  }

  private boolean logged(Level level, String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == level && event.getFormattedMessage().contains(fragment));
  }

  private static long rowCount(Path db) {
    if (!Files.exists(db)) {
      return 0;
    }
    try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + db);
        Statement st = conn.createStatement();
        ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM samples")) {
      return rs.next() ? rs.getLong(1) : 0;
    } catch (SQLException ex) {
      return 0;
    }
  }
}
