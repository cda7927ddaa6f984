package org.kpace.meter;

import java.time.Duration;
import org.kpace.reporter.Reporter;

/**
 * A thread-safe meter counting steps and reporting their sum once per interval.
 *
 * <p>Any number of threads may call {@link #step(double)}. Every interval the meter hands the
 * accumulated sum, along with the time it covers, to its {@link Reporter} and starts over from
 * zero.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * try (Pace pace = Pace.create("messages", Duration.ofSeconds(1), null)) {
 *   for (var message : messages) {
 *     handle(message);
 *     pace.step();
 *   }
 * }
 * // logs e.g. "messages: 1250/s in 1s" every second
 * }</pre>
 */
public interface Pace extends AutoCloseable {
  /**
   * Creates a running meter.
   *
   * @param label display label used in reports
   * @param interval time between automatic reports
   * @param reporter receives every report (defaults to a {@link org.kpace.reporter.LoggingReporter}
   *     if null)
   * @return a new meter with its timer armed
   * @throws IllegalArgumentException if the interval is zero or negative
   * @throws NullPointerException if the label or the interval is null
   */
  static Pace create(final String label, final Duration interval, final Reporter reporter) {
    return PaceMeter.builder(label).withInterval(interval).withReporter(reporter).build();
  }

  /**
   * Adds {@code n} to the current interval. Never blocks for longer than the meter takes to flush.
   *
   * @param n the amount to add, negative values subtract
   */
  void step(double n);

  /** Adds one to the current interval. */
  default void step() {
    step(1);
  }

  /**
   * Reports what was accumulated so far and stops automatic reporting. Steps keep being counted.
   */
  void pause();

  /**
   * Reports what was accumulated since the last report and restarts automatic reporting.
   *
   * @param interval new interval between reports, or {@code null}/zero to keep the current one
   */
  void resume(Duration interval);

  /**
   * Reports immediately, covering the time since the last report. Automatic reporting restarts its
   * countdown unless the meter is paused.
   *
   * @param reporter reporter used for this report only, or {@code null} for the meter's own
   */
  void report(Reporter reporter);

  /** Reports immediately with the meter's own reporter. */
  default void report() {
    report(null);
  }

  /**
   * Reports what is left and releases the timer. The meter cannot be resumed afterwards.
   */
  @Override
  void close();
}
