package org.kpace.reporter;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;
import org.kpace.util.Durations;

/**
 * A reporter that stays quiet while nothing happens and coalesces runs of empty flushes.
 *
 * <p>Rules applied to every flush:
 *
 * <ul>
 *   <li>A zero value that follows another zero value (or no value at all) is not reported
 *   <li>A zero value that follows a non-zero value starts a stall and reports {@code "<label>:
 *       stalled for <duration>"}; every further zero value in the same run reports the total
 *       stalled time
 *   <li>A non-zero value is reported as a rate with three decimal digits and ends any stall
 * </ul>
 *
 * <p>For values {@code [5, 0, 0, 0, 5]} at one second intervals the output is:
 *
 * <pre>{@code
 * items: 5.000/s in 1s
 * items: stalled for 1s
 * items: stalled for 2s
 * items: stalled for 3s
 * items: 5.000/s in 1s
 * }</pre>
 *
 * <p>The stall state belongs to a single meter, so each meter needs its own instance.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Logger logger = System.getLogger("throughput");
 * Pace pace = Pace.create("items", Duration.ofSeconds(1), new StallAwareReporter(logger));
 * }</pre>
 */
public class StallAwareReporter implements Reporter {

  private static final Logger LOGGER = System.getLogger(StallAwareReporter.class.getName());
  private static final Duration STALL_TOLERANCE = Duration.ofMillis(10);

  private final Consumer<String> sink;
  private final RateFormatter formatter;
  private final Clock clock;

  // Guarded by this
  private double previousValue;
  private Instant stalledSince;

  /**
   * Creates a reporter logging at INFO to the given logger.
   *
   * @param logger the logger receiving every line
   */
  public StallAwareReporter(final Logger logger) {
    this(toSink(logger));
  }

  /**
   * Creates a reporter writing to the given sink.
   *
   * @param sink consumer for the formatted lines (defaults to logger if null)
   */
  public StallAwareReporter(final Consumer<String> sink) {
    this(sink, RateFormatter.fixedPrecision(3), Clock.systemUTC());
  }

  /**
   * Creates a reporter with full customization.
   *
   * @param sink consumer for the formatted lines (defaults to logger if null)
   * @param formatter formats non-zero values
   * @param clock measures how long a stall lasts
   */
  public StallAwareReporter(final Consumer<String> sink, final RateFormatter formatter, final Clock clock) {
    this.sink = sink != null ? sink : toSink(LOGGER);
    this.formatter = Objects.requireNonNull(formatter, "Formatter cannot be null");
    this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
  }

  @Override
  public synchronized void report(final String label, final Duration timeframe, final double value) {
    if (value == 0 && previousValue == 0) {
      return;
    }

    if (value == 0) {
      emit(label, "%s: stalled for %s".formatted(label, Durations.format(stalledFor(timeframe))));
      return;
    }

    previousValue = value;
    stalledSince = null;
    emit(label, formatter.format(label, timeframe, value));
  }

  private Duration stalledFor(final Duration timeframe) {
    final var now = clock.instant();
    if (stalledSince == null) {
      stalledSince = now.minus(timeframe);
      return timeframe;
    }
    return Durations.truncate(Duration.between(stalledSince, now), timeframe, STALL_TOLERANCE);
  }

  private void emit(final String label, final String line) {
    try {
      sink.accept(line);
    } catch (final Exception e) {
      LOGGER.log(Level.WARNING, "Error reporting pace for " + label, e);
    }
  }

  private static Consumer<String> toSink(final Logger logger) {
    Objects.requireNonNull(logger, "Logger cannot be null");
    return line -> logger.log(Level.INFO, line);
  }
}
