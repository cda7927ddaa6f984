package org.kpace.util;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

/**
 * Helpers for turning {@link Duration}s into the compact notation used in pace reports.
 *
 * <p>Examples:
 *
 * <pre>{@code
 * Durations.format(Duration.ofSeconds(1));        // "1s"
 * Durations.format(Duration.ofMillis(3250));      // "3.25s"
 * Durations.format(Duration.ofMinutes(1));        // "1m0s"
 * Durations.format(Duration.ofHours(24));         // "24h0m0s"
 * Durations.format(Duration.ofMillis(250));       // "250ms"
 * }</pre>
 */
public final class Durations {

  private static final long NANOS_PER_MICRO = 1_000L;
  private static final long NANOS_PER_MILLI = 1_000_000L;
  private static final long NANOS_PER_SECOND = 1_000_000_000L;

  private Durations() {}

  /**
   * Formats a duration as hours, minutes and fractional seconds, or as a single sub-second unit
   * when the duration is shorter than one second.
   *
   * @param duration the duration to format
   * @return the compact representation, {@code "0s"} for zero
   */
  public static String format(final Duration duration) {
    Objects.requireNonNull(duration, "Duration cannot be null");
    if (duration.isZero()) {
      return "0s";
    }

    final var result = new StringBuilder(duration.isNegative() ? "-" : "");
    final var abs = duration.abs();

    if (abs.compareTo(Duration.ofSeconds(1)) < 0) {
      final var nanos = abs.toNanos();
      if (nanos < NANOS_PER_MICRO) {
        return result.append(nanos).append("ns").toString();
      }
      if (nanos < NANOS_PER_MILLI) {
        return result.append(decimal(nanos, NANOS_PER_MICRO)).append("µs").toString();
      }
      return result.append(decimal(nanos, NANOS_PER_MILLI)).append("ms").toString();
    }

    final var hours = abs.toHours();
    final var minutes = abs.toMinutesPart();
    if (hours > 0) {
      result.append(hours).append('h');
    }
    if (hours > 0 || minutes > 0) {
      result.append(minutes).append('m');
    }
    final var secondNanos = abs.toSecondsPart() * NANOS_PER_SECOND + abs.toNanosPart();
    return result.append(decimal(secondNanos, NANOS_PER_SECOND)).append('s').toString();
  }

  /**
   * Rounds a duration down to a whole multiple of {@code unit} when the remainder is below
   * {@code tolerance}; otherwise returns the duration unchanged.
   *
   * <p>A zero or negative unit leaves the duration untouched.
   *
   * @param duration the duration to round
   * @param unit the step the result should be a multiple of
   * @param tolerance the largest remainder that is still dropped (exclusive)
   * @return the rounded duration
   */
  public static Duration truncate(final Duration duration, final Duration unit, final Duration tolerance) {
    if (unit.isZero() || unit.isNegative()) {
      return duration;
    }
    final var multiples = duration.dividedBy(unit);
    final var whole = unit.multipliedBy(multiples);
    return duration.minus(whole).compareTo(tolerance) < 0 ? whole : duration;
  }

  private static String decimal(final long value, final long unit) {
    return BigDecimal.valueOf(value).divide(BigDecimal.valueOf(unit)).stripTrailingZeros().toPlainString();
  }
}
