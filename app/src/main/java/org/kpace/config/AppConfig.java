package org.kpace.config;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Configuration of the kpace application: where to read from and how to report the pace.
 *
 * <p>Example usage with default values from environment:
 *
 * <pre>{@code
 * AppConfig config = AppConfig.fromEnv();
 * }</pre>
 *
 * <p>Example with custom configuration:
 *
 * <pre>{@code
 * AppConfig config = new AppConfig(
 *     "localhost:9092",
 *     "kpace-group",
 *     "orders",
 *     "orders-meter",
 *     Duration.ofMillis(100),
 *     Duration.ofSeconds(30),
 *     Duration.ofSeconds(10),
 *     ReporterType.STALL,
 *     "earliest"
 * );
 * }</pre>
 *
 * @param bootstrapServers Kafka bootstrap servers (comma-separated list)
 * @param consumerGroup The Kafka consumer group identifier
 * @param topic The Kafka topic to meter
 * @param appName The name of the application, used as meter label prefix
 * @param pollTimeout Timeout duration for polling messages
 * @param shutdownTimeout Timeout duration for graceful shutdown
 * @param reportInterval Interval between pace reports
 * @param reporter Reporter attached to every meter
 * @param offsetReset Where a new consumer group starts reading ({@code earliest}, {@code latest} or
 *     {@code none})
 */
public record AppConfig(
  String bootstrapServers,
  String consumerGroup,
  String topic,
  String appName,
  Duration pollTimeout,
  Duration shutdownTimeout,
  Duration reportInterval,
  ReporterType reporter,
  String offsetReset
) {
  public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(100);
  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);
  public static final Duration DEFAULT_REPORT_INTERVAL = Duration.ofSeconds(1);
  public static final ReporterType DEFAULT_REPORTER = ReporterType.STALL;
  public static final String DEFAULT_OFFSET_RESET = "latest";

  /**
   * Creates a configuration, filling in defaults for null durations, reporter and offset reset.
   *
   * @throws NullPointerException if a connection setting or the app name is null
   * @throws IllegalArgumentException if a duration is negative or the report interval is zero
   */
  public AppConfig {
    Objects.requireNonNull(bootstrapServers, "Bootstrap servers cannot be null");
    Objects.requireNonNull(consumerGroup, "Consumer group cannot be null");
    Objects.requireNonNull(topic, "Topic cannot be null");
    Objects.requireNonNull(appName, "App name cannot be null");

    pollTimeout = validateDuration(pollTimeout, DEFAULT_POLL_TIMEOUT, "Poll timeout");
    shutdownTimeout = validateDuration(shutdownTimeout, DEFAULT_SHUTDOWN_TIMEOUT, "Shutdown timeout");
    reportInterval = validateDuration(reportInterval, DEFAULT_REPORT_INTERVAL, "Report interval");
    if (reportInterval.isZero()) {
      throw new IllegalArgumentException("Report interval must be positive");
    }

    reporter = reporter != null ? reporter : DEFAULT_REPORTER;
    offsetReset = offsetReset != null && !offsetReset.isBlank() ? offsetReset.trim() : DEFAULT_OFFSET_RESET;
  }

  private static Duration validateDuration(final Duration duration, final Duration defaultValue, final String name) {
    final var result = duration != null ? duration : defaultValue;
    if (result.isNegative()) {
      throw new IllegalArgumentException(name + " cannot be negative");
    }
    return result;
  }

  /**
   * Creates a configuration from environment variables with sensible defaults.
   *
   * @return A new AppConfig instance configured from environment
   */
  public static AppConfig fromEnv() {
    return new AppConfig(
      getEnvOrDefault("KAFKA_BOOTSTRAP_SERVERS", "kafka:9092"),
      getEnvOrDefault("KAFKA_CONSUMER_GROUP", "kpace-group"),
      getEnvOrDefault("KAFKA_TOPIC", "json-topic"),
      getEnvOrDefault("APP_NAME", "kpace"),
      parseDurationWithFallback(getEnvOrDefault("KAFKA_POLL_TIMEOUT_MS", "100"), "100", Duration::ofMillis),
      parseDurationWithFallback(getEnvOrDefault("SHUTDOWN_TIMEOUT_SEC", "30"), "30", Duration::ofSeconds),
      parseDurationWithFallback(getEnvOrDefault("PACE_INTERVAL_SEC", "1"), "1", Duration::ofSeconds),
      parseReporterWithFallback(getEnvOrDefault("PACE_REPORTER", "stall")),
      getEnvOrDefault("KAFKA_AUTO_OFFSET_RESET", DEFAULT_OFFSET_RESET)
    );
  }

  private static Duration parseDurationWithFallback(
    final String value,
    final String defaultValue,
    final Function<Long, Duration> converter
  ) {
    try {
      return converter.apply(Long.parseLong(value));
    } catch (final NumberFormatException e) {
      return converter.apply(Long.parseLong(defaultValue));
    }
  }

  private static ReporterType parseReporterWithFallback(final String value) {
    try {
      return ReporterType.fromName(value);
    } catch (final IllegalArgumentException e) {
      return DEFAULT_REPORTER;
    }
  }

  /**
   * Gets environment variable or returns default if not set.
   *
   * @param name Environment variable name
   * @param defaultValue Default value if environment variable is not set
   * @return Value from environment or default
   */
  public static String getEnvOrDefault(final String name, final String defaultValue) {
    final String value = System.getenv(name);
    return value != null && !value.isEmpty() ? value : defaultValue;
  }
}
