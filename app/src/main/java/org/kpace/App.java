package org.kpace;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.kpace.annotations.VisibleForTesting;
import org.kpace.config.AppConfig;
import org.kpace.config.KafkaConsumerConfig;
import org.kpace.consumer.MeteredConsumer;
import org.kpace.meter.Pace;
import org.kpace.meter.PaceMeter;

/**
 * Application that meters how fast records arrive on a Kafka topic and reports records and bytes
 * per interval.
 */
public class App implements AutoCloseable {

  private static final Logger LOGGER = System.getLogger(App.class.getName());

  private final AppConfig config;
  private final Pace recordsMeter;
  private final Pace bytesMeter;
  private final MeteredConsumer<byte[], byte[]> consumer;
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * Main entry point for the metering application.
   *
   * @param args Command line arguments
   */
  public static void main(final String[] args) {
    final var config = AppConfig.fromEnv();

    try (final App app = new App(config)) {
      Runtime.getRuntime().addShutdownHook(new Thread(app::close));
      app.start();
      app.awaitShutdown();
    } catch (final Exception e) {
      LOGGER.log(Level.ERROR, "Fatal error in kpace application", e);
      System.exit(1);
    }
  }

  /**
   * Creates the application with a Kafka consumer built from the configuration.
   *
   * @param config The application configuration
   */
  public App(final AppConfig config) {
    this(config, createKafkaConsumer(config));
  }

  /**
   * Creates the application around an existing Kafka consumer.
   *
   * @param config The application configuration
   * @param kafkaConsumer The consumer to poll, owned by the application from now on
   */
  public App(final AppConfig config, final Consumer<byte[], byte[]> kafkaConsumer) {
    this.config = config;
    this.recordsMeter = createMeter(config, "%s records".formatted(config.topic()));
    this.bytesMeter = createMeter(config, "%s bytes".formatted(config.topic()));
    this.consumer =
      MeteredConsumer
        .<byte[], byte[]>builder()
        .withConsumer(kafkaConsumer)
        .withTopic(config.topic())
        .withPollTimeout(config.pollTimeout())
        .withThreadTerminationTimeout(config.shutdownTimeout())
        .withRecordsMeter(recordsMeter)
        .withBytesMeter(bytesMeter)
        .build();
  }

  private static Consumer<byte[], byte[]> createKafkaConsumer(final AppConfig config) {
    return new KafkaConsumer<>(consumerProperties(config));
  }

  @VisibleForTesting
  static Properties consumerProperties(final AppConfig config) {
    return KafkaConsumerConfig.createConsumerConfig(
      config.bootstrapServers(),
      config.consumerGroup(),
      KafkaConsumerConfig.withOffsetReset(config.offsetReset())
    );
  }

  private static Pace createMeter(final AppConfig config, final String label) {
    return PaceMeter
      .builder(label)
      .withInterval(config.reportInterval())
      .withReporter(config.reporter().create())
      .build();
  }

  /** Starts metering the configured topic. */
  public void start() {
    consumer.start();
    LOGGER.log(
      Level.INFO,
      "{0} metering topic {1} every {2}",
      config.appName(),
      config.topic(),
      config.reportInterval()
    );
  }

  /**
   * Blocks until {@link #close()} is called, e.g. by the shutdown hook.
   *
   * @return true if the application shut down, false if the wait was interrupted
   */
  public boolean awaitShutdown() {
    try {
      shutdownLatch.await(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
      return true;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * Returns the meter counting records.
   *
   * @return the records meter
   */
  public Pace recordsMeter() {
    return recordsMeter;
  }

  /**
   * Returns the meter counting serialized bytes.
   *
   * @return the bytes meter
   */
  public Pace bytesMeter() {
    return bytesMeter;
  }

  @VisibleForTesting
  MeteredConsumer<byte[], byte[]> consumer() {
    return consumer;
  }

  /** Stops the consumer and reports what the meters hold. Calling it again has no effect. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      consumer.close();
    } finally {
      shutdownLatch.countDown();
    }
  }
}
