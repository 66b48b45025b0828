package ca.gc.cra.harvest.infrastructure.tail;

import ca.gc.cra.harvest.application.port.CancellationToken;
import ca.gc.cra.harvest.application.port.ExportPoller;
import ca.gc.cra.harvest.application.port.MeasurementSink;
import ca.gc.cra.harvest.application.port.MetricsPort;
import ca.gc.cra.harvest.domain.tail.ExportFileNames;
import ca.gc.cra.harvest.domain.tail.FileTrackingState;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Keeps one {@link FileTrackingState} per export file in a directory and drives one poll
 * cycle across all of them.
 * <p><strong>Why:</strong> Several instruments may export into the same directory at once; files appear, grow and
 * vanish independently.</p>
 * <p><strong>Role:</strong> Infrastructure adapter owning the tracking map; invoked by
 * {@code HarvestUseCase} once per cycle.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Discover new files and position them via {@link IncrementalTailer#initialize}.</li>
 *   <li>Drop states whose file no longer exists.</li>
 *   <li>Tail each tracked file, honouring cancellation between files.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the polling thread.</p>
 * <p><strong>Observability:</strong> Emits {@code tail.file.tracked} and {@code tail.file.dropped}; sets MDC key
 * {@code file} while a file is being tailed.</p>
 *
 * @since 0.1.0
 */
public final class ExportFileSet implements ExportPoller {
  private static final Logger log = LoggerFactory.getLogger(ExportFileSet.class);
  private static final String MDC_FILE = "file";

  private final Path directory;
  private final ExportFileNames names;
  private final IncrementalTailer tailer;
  private final boolean backfill;
  private final MetricsPort metrics;
  private final Map<Path, FileTrackingState> tracked = new LinkedHashMap<>();
  private boolean listingFailed;

  /**
   * Creates a file set for a directory.
   *
   * @param directory directory to scan; need not exist yet
   * @param names naming convention selecting export files
   * @param tailer tailer used for every file
   * @param backfill whether newly tracked files start at their header (true) or at their current end (false)
   * @param metrics metrics sink
   */
  public ExportFileSet(
      Path directory,
      ExportFileNames names,
      IncrementalTailer tailer,
      boolean backfill,
      MetricsPort metrics) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.names = Objects.requireNonNull(names, "names");
    this.tailer = Objects.requireNonNull(tailer, "tailer");
    this.backfill = backfill;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs one discovery, eviction and tail cycle.
   *
   * @param sink receiver of measurements, in per-file row order
   * @param cancellation checked before each file; a cancelled cycle stops between files, never within one
   * @return number of measurements emitted during this cycle
   */
  @Override
  public int pollOnce(MeasurementSink sink, CancellationToken cancellation) {
    Objects.requireNonNull(sink, "sink");
    Objects.requireNonNull(cancellation, "cancellation");
    List<Path> listed = list();
    Set<Path> present = new HashSet<>(listed);

    for (Path path : listed) {
      if (cancellation.isCancelled()) {
        return 0;
      }
      if (!tracked.containsKey(path)) {
        track(path);
      }
    }

    Iterator<Map.Entry<Path, FileTrackingState>> it = tracked.entrySet().iterator();
    while (it.hasNext()) {
      Path path = it.next().getKey();
      if (!present.contains(path) && !Files.exists(path)) {
        it.remove();
        metrics.increment("tail.file.dropped");
        log.info("Stopped tracking {} (file removed)", path.getFileName());
      }
    }

    int emitted = 0;
    for (FileTrackingState state : tracked.values()) {
      if (cancellation.isCancelled()) {
        break;
      }
      String previousFile = MDC.get(MDC_FILE);
      MDC.put(MDC_FILE, state.origin());
      try {
        emitted += tailer.poll(state, sink);
      } finally {
        if (previousFile == null) {
          MDC.remove(MDC_FILE);
        } else {
          MDC.put(MDC_FILE, previousFile);
        }
      }
    }
    return emitted;
  }

  /**
   * Returns a read-only view of the tracked states in discovery order.
   *
   * @return tracked states
   */
  public Collection<FileTrackingState> trackedFiles() {
    return Collections.unmodifiableCollection(tracked.values());
  }

  public Path directory() {
    return directory;
  }

  private void track(Path path) {
    String source = names.sourceOf(path);
    FileTrackingState state = new FileTrackingState(path, source);
    tailer.initialize(state, backfill);
    tracked.put(path, state);
    metrics.increment("tail.file.tracked");
    log.info("Tracking {} (source={}, header={}, cursor={})",
        path.getFileName(), source, state.headerKnown() ? "bound" : "pending", state.cursor());
  }

  private List<Path> list() {
    List<Path> files = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, names.glob())) {
      for (Path entry : stream) {
        if (names.matches(entry.getFileName().toString()) && Files.isRegularFile(entry)) {
          files.add(entry);
        }
      }
    } catch (NoSuchFileException | NotDirectoryException ex) {
      log.debug("Watch directory {} not available: {}", directory, ex.toString());
      return List.of();
    } catch (IOException ex) {
      if (!listingFailed) {
        log.warn("Unable to list {}; skipping this cycle", directory, ex);
      }
      listingFailed = true;
      return List.of();
    }
    if (listingFailed) {
      log.info("Listing of {} recovered", directory);
      listingFailed = false;
    }
    files.sort(Comparator.comparing(p -> p.getFileName().toString()));
    return files;
  }
}
