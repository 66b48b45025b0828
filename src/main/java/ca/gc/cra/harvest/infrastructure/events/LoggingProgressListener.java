package ca.gc.cra.harvest.infrastructure.events;

import ca.gc.cra.harvest.application.ingest.IngestStats;
import ca.gc.cra.harvest.application.port.ProgressListener;
import ca.gc.cra.harvest.domain.sample.Measurement;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports ingest progress through the application log when {@code --progress} is set.
 *
 * <p>Each accepted measurement is logged at INFO with its running count; each committed batch is summarized.</p>
 *
 * @since 0.1.0
 */
public final class LoggingProgressListener implements ProgressListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingProgressListener.class);

  /**
   * Creates a listener.
   */
  public LoggingProgressListener() {}

  @Override
  public void onMeasurement(Measurement measurement, long accepted) {
    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("ts=" + measurement.timestamp());
    joiner.add("source=" + measurement.source());
    joiner.add("channel=" + measurement.channel());
    joiner.add("value=" + measurement.value());
    log.info("[{}] {}", accepted, joiner);
  }

  @Override
  public void onFlush(int batchWritten, IngestStats totals) {
    log.info("Committed {} rows (total written={}, attempted={}, duplicates={})",
        batchWritten, totals.written(), totals.attempted(), totals.duplicates());
  }
}
