package org.kpace.config;

import java.util.Locale;
import org.kpace.reporter.LoggingReporter;
import org.kpace.reporter.Reporter;
import org.kpace.reporter.StallAwareReporter;

/** The reporters the application can attach to its meters. */
public enum ReporterType {
  /** Logs every flush, zero values included. */
  LOG {
    @Override
    public Reporter create() {
      return new LoggingReporter();
    }
  },

  /** Logs rates and coalesces idle periods into "stalled for" lines. */
  STALL {
    @Override
    public Reporter create() {
      return new StallAwareReporter(System.getLogger("org.kpace.pace"));
    }
  };

  /**
   * Creates a fresh reporter. Stall tracking is per meter, so every meter gets its own instance.
   *
   * @return a new reporter
   */
  public abstract Reporter create();

  /**
   * Looks up a reporter type by its case-insensitive name.
   *
   * @param name the name, e.g. {@code "stall"}
   * @return the matching type
   * @throws IllegalArgumentException if no type has that name
   */
  public static ReporterType fromName(final String name) {
    return valueOf(name.trim().toUpperCase(Locale.ROOT));
  }
}
