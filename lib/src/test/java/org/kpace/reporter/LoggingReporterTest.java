package org.kpace.reporter;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.util.function.Consumer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.kpace.MutableClock;
import org.kpace.meter.PaceMeter;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LoggingReporterTest {

  @Mock
  private Consumer<String> sink;

  @Captor
  private ArgumentCaptor<String> lineCaptor;

  @Test
  void shouldWriteRateLineToSink() {
    final var reporter = new LoggingReporter(sink);

    reporter.report("items", Duration.ofSeconds(1), 1000);

    verify(sink).accept("items: 1000/s in 1s");
  }

  @Test
  void shouldReportEveryZeroValue() {
    final var reporter = new LoggingReporter(sink);

    reporter.report("items", Duration.ofSeconds(1), 0);
    reporter.report("items", Duration.ofSeconds(1), 0);

    verify(sink, times(2)).accept("items: 0/s in 1s");
  }

  @Test
  void shouldUseCustomFormatter() {
    final var reporter = new LoggingReporter(RateFormatter.fixedPrecision(1), sink);

    reporter.report("items", Duration.ofSeconds(4), 2);

    verify(sink).accept("2.0 items in 4s (pace: 0.5/s)");
  }

  @Test
  void shouldDefaultToSystemLogger() {
    final var reporter = new LoggingReporter();

    assertNotNull(reporter.sink());
    assertDoesNotThrow(() -> reporter.report("items", Duration.ofSeconds(1), 1));
  }

  @Test
  void shouldSwallowSinkFailures() {
    doThrow(new IllegalStateException("closed")).when(sink).accept(anyString());
    final var reporter = new LoggingReporter(sink);

    assertDoesNotThrow(() -> reporter.report("items", Duration.ofSeconds(1), 1));
  }

  @Test
  void shouldReceiveFlushesFromMeter() {
    final var clock = new MutableClock();
    try (
      var meter = PaceMeter
        .builder("requests")
        .withInterval(Duration.ofHours(1))
        .withReporter(new LoggingReporter(sink))
        .withClock(clock)
        .build()
    ) {
      meter.step(30);
      clock.advance(Duration.ofSeconds(3));
      meter.report();
    }

    verify(sink, atLeastOnce()).accept(lineCaptor.capture());
    assertEquals("30 requests in 3s (pace: 10/s)", lineCaptor.getAllValues().get(0));
  }
}
