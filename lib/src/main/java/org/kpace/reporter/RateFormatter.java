package org.kpace.reporter;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.DoubleFunction;
import org.kpace.util.Durations;

/**
 * Renders a {@code (label, timeframe, value)} triple as a human-readable rate.
 *
 * <p>Timeframes of exactly one second, minute, hour or day print the value per unit:
 *
 * <pre>{@code
 * items: 1000/s in 1s
 * items: 42/m in 1m0s
 * }</pre>
 *
 * <p>Any other timeframe prints the raw value followed by the per-second pace:
 *
 * <pre>{@code
 * 30 items in 3s (pace: 10/s)
 * }</pre>
 *
 * @param numberFormat formats values and paces
 */
public record RateFormatter(DoubleFunction<String> numberFormat) {
  private static final Map<Duration, String> UNITS = Map.of(
    Duration.ofSeconds(1),
    "s",
    Duration.ofMinutes(1),
    "m",
    Duration.ofHours(1),
    "h",
    Duration.ofDays(1),
    "day"
  );

  /**
   * Creates a formatter with the given number format.
   *
   * @param numberFormat formats values and paces
   */
  public RateFormatter {
    Objects.requireNonNull(numberFormat, "Number format cannot be null");
  }

  /**
   * Formats numbers with the shortest decimal representation that is exact, e.g. {@code 1000} or
   * {@code 2.5}.
   *
   * @return a formatter with natural precision
   */
  public static RateFormatter naturalPrecision() {
    return new RateFormatter(RateFormatter::natural);
  }

  /**
   * Formats numbers as fixed-point decimals, e.g. {@code 1000.000} with three digits.
   *
   * @param digits number of digits after the decimal point
   * @return a formatter with fixed precision
   * @throws IllegalArgumentException if digits is negative
   */
  public static RateFormatter fixedPrecision(final int digits) {
    if (digits < 0) {
      throw new IllegalArgumentException("Digits cannot be negative");
    }
    final var pattern = "%." + digits + "f";
    return new RateFormatter(value -> String.format(Locale.ROOT, pattern, value));
  }

  /**
   * Formats a rate line.
   *
   * @param label the meter label
   * @param timeframe the time covered by the value
   * @param value the accumulated value
   * @return the formatted line
   */
  public String format(final String label, final Duration timeframe, final double value) {
    final var unit = UNITS.get(timeframe);
    if (unit != null) {
      return "%s: %s/%s in %s".formatted(label, numberFormat.apply(value), unit, Durations.format(timeframe));
    }
    return "%s %s in %s (pace: %s/s)".formatted(
        numberFormat.apply(value),
        label,
        Durations.format(timeframe),
        numberFormat.apply(perSecond(timeframe, value))
      );
  }

  /**
   * Normalizes a value to a per-second rate. A zero timeframe yields zero.
   *
   * @param timeframe the time covered by the value
   * @param value the accumulated value
   * @return value per second
   */
  public static double perSecond(final Duration timeframe, final double value) {
    final var nanos = timeframe.toNanos();
    return nanos == 0 ? 0 : value / (nanos / 1e9);
  }

  private static String natural(final double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return Double.toString(value);
    }
    if (value == 0) {
      return "0";
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
