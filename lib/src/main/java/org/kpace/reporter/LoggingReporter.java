package org.kpace.reporter;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * The default reporter: formats every flush as a rate line with natural precision and hands it to
 * a sink.
 *
 * <p><strong>Example 1:</strong> Basic usage with default logging:
 *
 * <pre>{@code
 * // Lines go to the System logger at INFO
 * Pace pace = Pace.create("items", Duration.ofSeconds(1), new LoggingReporter());
 * }</pre>
 *
 * <p><strong>Example 2:</strong> Custom sink:
 *
 * <pre>{@code
 * // Collect lines for a status page
 * Consumer<String> statusPage = line -> recentLines.add(line);
 *
 * Pace pace = Pace.create("items", Duration.ofSeconds(1), new LoggingReporter(statusPage));
 * }</pre>
 *
 * @param formatter formats each flush into a line
 * @param sink consumer for the formatted lines (defaults to logger if null)
 */
public record LoggingReporter(RateFormatter formatter, Consumer<String> sink) implements Reporter {
  private static final Logger LOGGER = System.getLogger(LoggingReporter.class.getName());

  /** Creates a reporter writing to the System logger with natural precision. */
  public LoggingReporter() {
    this(null, null);
  }

  /**
   * Creates a reporter writing to the given sink with natural precision.
   *
   * @param sink consumer for the formatted lines (defaults to logger if null)
   */
  public LoggingReporter(final Consumer<String> sink) {
    this(null, sink);
  }

  /**
   * Creates a reporter with the given formatter and sink.
   *
   * @param formatter formats each flush into a line (defaults to natural precision if null)
   * @param sink consumer for the formatted lines (defaults to logger if null)
   */
  public LoggingReporter(final RateFormatter formatter, final Consumer<String> sink) {
    this.formatter = formatter != null ? formatter : RateFormatter.naturalPrecision();
    this.sink = sink != null ? sink : LoggingReporter::log;
  }

  /**
   * Formats the flush and passes it to the sink. Failures of the sink are logged and never reach
   * the calling meter.
   */
  @Override
  public void report(final String label, final Duration timeframe, final double value) {
    try {
      sink.accept(formatter.format(label, timeframe, value));
    } catch (final Exception e) {
      LOGGER.log(Level.WARNING, "Error reporting pace for " + label, e);
    }
  }

  private static void log(final String line) {
    LOGGER.log(Level.INFO, line);
  }
}
