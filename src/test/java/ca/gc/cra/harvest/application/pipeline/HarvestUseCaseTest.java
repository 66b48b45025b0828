package ca.gc.cra.harvest.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import ca.gc.cra.harvest.application.port.CancellationToken;
import ca.gc.cra.harvest.application.port.ExportPoller;
import ca.gc.cra.harvest.application.port.MeasurementSink;
import ca.gc.cra.harvest.domain.sample.Measurement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class HarvestUseCaseTest {

  @Test
  void pollsAndTicksUntilCancelled() throws InterruptedException {
    AtomicInteger polls = new AtomicInteger();
    AtomicInteger ticks = new AtomicInteger();
    List<String> pipelines = new ArrayList<>();
    CancellationToken afterThreePolls = () -> polls.get() >= 3;
    ExportPoller poller = (sink, cancellation) -> {
      polls.incrementAndGet();
      pipelines.add(MDC.get("pipeline"));
      sink.accept(new Measurement("t", "s", "c", 1.0, "o"));
      return 1;
    };
    List<Measurement> accepted = new ArrayList<>();
    MeasurementSink sink = new MeasurementSink() {
      @Override
      public void accept(Measurement measurement) {
        accepted.add(measurement);
      }

      @Override
      public void tick() {
        ticks.incrementAndGet();
      }
    };

    HarvestUseCase.RunSummary summary =
        new HarvestUseCase("ingest", poller, sink, afterThreePolls, Duration.ofMillis(1)).run();

    assertEquals(new HarvestUseCase.RunSummary(3, 3), summary);
    assertEquals(3, ticks.get());
    assertEquals(3, accepted.size());
    assertEquals(List.of("ingest", "ingest", "ingest"), pipelines);
    assertNull(MDC.get("pipeline"));
  }

  @Test
  void cancelledBeforeStartRunsNoCycle() throws InterruptedException {
    AtomicInteger polls = new AtomicInteger();
    ExportPoller poller = (sink, cancellation) -> polls.incrementAndGet();

    HarvestUseCase.RunSummary summary =
        new HarvestUseCase("watch", poller, MeasurementSink.DISCARD, () -> true, Duration.ofSeconds(30)).run();

    assertEquals(0, summary.cycles());
    assertEquals(0, polls.get());
  }
}
