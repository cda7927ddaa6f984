package org.kpace.reporter;

import java.time.Duration;

/**
 * Receives the aggregated value of a pace meter once per flush.
 *
 * <p>A meter calls its reporter synchronously while holding its internal lock, so implementations
 * should return quickly and hand expensive work off to another thread. A reporter never mutates
 * the meter that calls it. It is never invoked concurrently by the same meter.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Reporter printer = (label, timeframe, value) ->
 *     System.out.printf("%s: %.1f in %s%n", label, value, timeframe);
 *
 * Pace pace = Pace.create("requests", Duration.ofSeconds(1), printer);
 * }</pre>
 */
@FunctionalInterface
public interface Reporter {
  /**
   * Reports the value accumulated by a meter.
   *
   * @param label the display label of the meter
   * @param timeframe wall-clock time covered by the value
   * @param value sum of all steps recorded during the timeframe
   */
  void report(String label, Duration timeframe, double value);
}
