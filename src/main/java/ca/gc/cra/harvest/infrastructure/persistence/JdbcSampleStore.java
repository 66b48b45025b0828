package ca.gc.cra.harvest.infrastructure.persistence;

import ca.gc.cra.harvest.application.ingest.CommitMode;
import ca.gc.cra.harvest.application.ingest.InsertStrategy;
import ca.gc.cra.harvest.application.port.SampleStoreException;
import ca.gc.cra.harvest.application.port.SampleStorePort;
import ca.gc.cra.harvest.domain.sample.Measurement;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> SQLite-backed {@link SampleStorePort} writing the {@code samples} table.
 * <p><strong>Why:</strong> A single local database file is what downstream plotting tools read; SQLite needs no
 * server and tolerates readers while this process writes.</p>
 * <p><strong>Role:</strong> Infrastructure adapter used by the batch ingester.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the table, lookup indexes and the unique {@code (timestamp, source, channel)} index.</li>
 *   <li>Apply journal and sync pragmas for the selected {@link CommitMode}.</li>
 *   <li>Insert each batch in one transaction with an ignoring insert or, when the unique index is unavailable,
 *   a conditional insert.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; the owning ingester serializes access.</p>
 * <p><strong>Observability:</strong> Logs the active insert path at INFO and the fallback at WARN.</p>
 *
 * @implNote Databases created by older exporters name the provenance column {@code extra}; the store detects that
 * column and writes to it instead of {@code origin}.
 * @since 0.1.0
 */
public final class JdbcSampleStore implements SampleStorePort {
  private static final Logger log = LoggerFactory.getLogger(JdbcSampleStore.class);
  private static final String URL_PREFIX = "jdbc:sqlite:";
  private static final int BUSY_TIMEOUT_MS = 5_000;
  private static final String UNIQUE_INDEX = "ux_samples_ts_source_channel";

  private static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS samples ("
      + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
      + "timestamp TEXT NOT NULL, "
      + "source TEXT NOT NULL, "
      + "channel TEXT NOT NULL, "
      + "value REAL, "
      + "origin TEXT)";

  private final Path databaseFile;
  private final CommitMode mode;
  private final InsertStrategy requestedStrategy;

  private Connection connection;
  private PreparedStatement insert;
  private InsertStrategy activeStrategy;
  private String provenanceColumn = "origin";

  /**
   * Creates a store for a database file. No connection is opened until {@link #ensureSchema()}.
   *
   * @param databaseFile SQLite file; created on first use
   * @param mode commit preset whose durability level selects the pragmas
   * @param strategy requested duplicate-suppression strategy
   */
  public JdbcSampleStore(Path databaseFile, CommitMode mode, InsertStrategy strategy) {
    this.databaseFile = Objects.requireNonNull(databaseFile, "databaseFile");
    this.mode = Objects.requireNonNull(mode, "mode");
    this.requestedStrategy = Objects.requireNonNull(strategy, "strategy");
  }

  @Override
  public void ensureSchema() {
    if (connection != null) {
      return;
    }
    try {
      connection = DriverManager.getConnection(URL_PREFIX + databaseFile);
      connection.setAutoCommit(true);
      applyPragmas(connection);
      try (Statement st = connection.createStatement()) {
        st.execute(CREATE_TABLE);
        st.execute("CREATE INDEX IF NOT EXISTS idx_samples_timestamp ON samples(timestamp)");
        st.execute("CREATE INDEX IF NOT EXISTS idx_samples_source ON samples(source)");
      }
      provenanceColumn = resolveProvenanceColumn(connection);
      activeStrategy = resolveStrategy(connection);
      insert = connection.prepareStatement(insertSql());
      connection.setAutoCommit(false);
      log.info("Sample store {} ready (mode={}, insert={}, provenance column={})",
          databaseFile, mode, activeStrategy, provenanceColumn);
    } catch (SQLException ex) {
      SampleStoreException failure =
          new SampleStoreException("Failed to prepare sample store " + databaseFile, ex);
      closeQuietly(failure);
      throw failure;
    }
  }

  @Override
  public int insertBatch(List<Measurement> batch) {
    Objects.requireNonNull(batch, "batch");
    if (connection == null) {
      throw new IllegalStateException("ensureSchema() must be called before insertBatch()");
    }
    if (batch.isEmpty()) {
      return 0;
    }
    int written = 0;
    try {
      for (Measurement m : batch) {
        bind(insert, m);
        written += insert.executeUpdate();
      }
      connection.commit();
      return written;
    } catch (SQLException ex) {
      SampleStoreException failure = new SampleStoreException(
          "Failed to insert batch of " + batch.size() + " samples into " + databaseFile, ex);
      try {
        connection.rollback();
      } catch (SQLException rollbackFailure) {
        failure.addSuppressed(rollbackFailure);
      }
      throw failure;
    }
  }

  /**
   * Returns the strategy in effect after {@link #ensureSchema()}; {@code null} before.
   *
   * @return active insert strategy
   */
  public InsertStrategy activeStrategy() {
    return activeStrategy;
  }

  public Path databaseFile() {
    return databaseFile;
  }

  @Override
  public void close() {
    if (connection == null) {
      return;
    }
    SampleStoreException failure = null;
    try {
      if (insert != null) {
        insert.close();
      }
    } catch (SQLException ex) {
      failure = new SampleStoreException("Failed to close insert statement", ex);
    }
    try {
      connection.close();
    } catch (SQLException ex) {
      SampleStoreException closeFailure =
          new SampleStoreException("Failed to close sample store " + databaseFile, ex);
      if (failure == null) {
        failure = closeFailure;
      } else {
        failure.addSuppressed(closeFailure);
      }
    } finally {
      connection = null;
      insert = null;
    }
    if (failure != null) {
      throw failure;
    }
  }

  private void applyPragmas(Connection conn) throws SQLException {
    try (Statement st = conn.createStatement()) {
      st.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MS);
      if (mode.durability() != CommitMode.Durability.FULL) {
        st.execute("PRAGMA journal_mode=WAL");
      }
      st.execute("PRAGMA synchronous=" + mode.durability().name());
    }
  }

  private InsertStrategy resolveStrategy(Connection conn) {
    if (requestedStrategy == InsertStrategy.CONDITIONAL) {
      return InsertStrategy.CONDITIONAL;
    }
    try (Statement st = conn.createStatement()) {
      st.execute("CREATE UNIQUE INDEX IF NOT EXISTS " + UNIQUE_INDEX
          + " ON samples(timestamp, source, channel)");
      return InsertStrategy.AUTO;
    } catch (SQLException ex) {
      log.warn("Unique index on samples(timestamp, source, channel) could not be created ({}); "
          + "falling back to conditional inserts", ex.getMessage());
      return InsertStrategy.CONDITIONAL;
    }
  }

  private static String resolveProvenanceColumn(Connection conn) throws SQLException {
    boolean hasOrigin = false;
    boolean hasExtra = false;
    try (Statement st = conn.createStatement();
        ResultSet rs = st.executeQuery("PRAGMA table_info(samples)")) {
      while (rs.next()) {
        String column = rs.getString("name").toLowerCase(Locale.ROOT);
        hasOrigin |= column.equals("origin");
        hasExtra |= column.equals("extra");
      }
    }
    if (!hasOrigin && hasExtra) {
      return "extra";
    }
    return "origin";
  }

  private String insertSql() {
    String columns = "timestamp, source, channel, value, " + provenanceColumn;
    if (activeStrategy == InsertStrategy.AUTO) {
      return "INSERT OR IGNORE INTO samples (" + columns + ") VALUES (?, ?, ?, ?, ?)";
    }
    return "INSERT INTO samples (" + columns + ") SELECT ?, ?, ?, ?, ? "
        + "WHERE NOT EXISTS (SELECT 1 FROM samples WHERE timestamp = ? AND source = ? AND channel = ?)";
  }

  private void bind(PreparedStatement ps, Measurement m) throws SQLException {
    ps.setString(1, m.timestamp());
    ps.setString(2, m.source());
    ps.setString(3, m.channel());
    ps.setDouble(4, m.value());
    ps.setString(5, m.origin());
    if (activeStrategy == InsertStrategy.CONDITIONAL) {
      ps.setString(6, m.timestamp());
      ps.setString(7, m.source());
      ps.setString(8, m.channel());
    }
  }

  private void closeQuietly(SampleStoreException primary) {
    try {
      close();
    } catch (SampleStoreException ex) {
      primary.addSuppressed(ex);
    }
  }
}
