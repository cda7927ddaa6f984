package org.kpace.consumer;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;
import org.kpace.annotations.VisibleForTesting;
import org.kpace.meter.Pace;

/**
 * Consumes a Kafka topic on a dedicated thread and feeds what it sees into pace meters.
 *
 * <p>Every poll steps the records meter by the number of records received and, when configured,
 * the bytes meter by their serialized key and value sizes. Records are not processed any further.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * var consumer = MeteredConsumer.<byte[], byte[]>builder()
 *     .withConsumer(new KafkaConsumer<>(props))
 *     .withTopic("orders")
 *     .withRecordsMeter(Pace.create("orders", Duration.ofSeconds(1), null))
 *     .withBytesMeter(Pace.create("orders bytes", Duration.ofSeconds(1), null))
 *     .build();
 *
 * consumer.start();
 * // ...
 * consumer.close(); // final report from both meters
 * }</pre>
 *
 * @param <K> the type of the record key
 * @param <V> the type of the record value
 */
public class MeteredConsumer<K, V> implements AutoCloseable {

  private static final Logger LOGGER = System.getLogger(MeteredConsumer.class.getName());

  private final Consumer<K, V> kafkaConsumer;
  private final String topic;
  private final Duration pollTimeout;
  private final Duration threadTerminationTimeout;
  private final Pace recordsMeter;
  private final Pace bytesMeter;

  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicReference<Thread> consumerThread = new AtomicReference<>();

  /**
   * Creates a new builder.
   *
   * @param <K> the type of the record key
   * @param <V> the type of the record value
   * @return a new builder instance
   */
  public static <K, V> Builder<K, V> builder() {
    return new Builder<>();
  }

  /**
   * Builder for {@link MeteredConsumer} instances.
   *
   * @param <K> the type of the record key
   * @param <V> the type of the record value
   */
  public static class Builder<K, V> {

    private Consumer<K, V> kafkaConsumer;
    private String topic;
    private Duration pollTimeout = Duration.ofMillis(100);
    private Duration threadTerminationTimeout = Duration.ofSeconds(5);
    private Pace recordsMeter;
    private Pace bytesMeter;

    private Builder() {}

    /**
     * Sets the Kafka consumer to poll. The metered consumer takes ownership and closes it.
     *
     * @param kafkaConsumer the Kafka consumer
     * @return this builder instance
     */
    public Builder<K, V> withConsumer(final Consumer<K, V> kafkaConsumer) {
      this.kafkaConsumer = kafkaConsumer;
      return this;
    }

    /**
     * Sets the topic to subscribe to.
     *
     * @param topic the topic name
     * @return this builder instance
     */
    public Builder<K, V> withTopic(final String topic) {
      this.topic = topic;
      return this;
    }

    /**
     * Sets the maximum time a single poll blocks.
     *
     * @param pollTimeout the poll timeout
     * @return this builder instance
     */
    public Builder<K, V> withPollTimeout(final Duration pollTimeout) {
      this.pollTimeout = pollTimeout;
      return this;
    }

    /**
     * Sets how long {@link MeteredConsumer#close()} waits for the polling thread.
     *
     * @param timeout the wait limit
     * @return this builder instance
     */
    public Builder<K, V> withThreadTerminationTimeout(final Duration timeout) {
      this.threadTerminationTimeout = timeout;
      return this;
    }

    /**
     * Sets the meter stepped by the number of records per poll.
     *
     * @param recordsMeter the meter
     * @return this builder instance
     */
    public Builder<K, V> withRecordsMeter(final Pace recordsMeter) {
      this.recordsMeter = recordsMeter;
      return this;
    }

    /**
     * Sets the optional meter stepped by serialized record sizes.
     *
     * @param bytesMeter the meter
     * @return this builder instance
     */
    public Builder<K, V> withBytesMeter(final Pace bytesMeter) {
      this.bytesMeter = bytesMeter;
      return this;
    }

    /**
     * Builds the metered consumer.
     *
     * @return a new, not yet started consumer
     * @throws NullPointerException if the consumer, topic or records meter is missing
     * @throws IllegalArgumentException if the poll timeout is not positive
     */
    public MeteredConsumer<K, V> build() {
      Objects.requireNonNull(kafkaConsumer, "Kafka consumer must be provided");
      Objects.requireNonNull(topic, "Topic must be provided");
      Objects.requireNonNull(recordsMeter, "Records meter must be provided");
      Objects.requireNonNull(threadTerminationTimeout, "Thread termination timeout cannot be null");
      if (pollTimeout == null || pollTimeout.isNegative() || pollTimeout.isZero()) {
        throw new IllegalArgumentException("Poll timeout must be positive");
      }
      return new MeteredConsumer<>(this);
    }
  }

  private MeteredConsumer(final Builder<K, V> builder) {
    this.kafkaConsumer = builder.kafkaConsumer;
    this.topic = builder.topic;
    this.pollTimeout = builder.pollTimeout;
    this.threadTerminationTimeout = builder.threadTerminationTimeout;
    this.recordsMeter = builder.recordsMeter;
    this.bytesMeter = builder.bytesMeter;
  }

  /**
   * Subscribes to the topic and starts polling on a new thread. Calling it again has no effect.
   *
   * @throws IllegalStateException if the consumer has been closed
   */
  public void start() {
    if (closed.get()) {
      throw new IllegalStateException("Cannot restart a closed consumer");
    }

    if (!started.compareAndSet(false, true)) {
      LOGGER.log(Level.WARNING, "Consumer already running for topic {0}", topic);
      return;
    }

    final var thread = new Thread(this::pollLoop, "kpace-consumer-" + topic);
    thread.setUncaughtExceptionHandler((t, throwable) ->
      LOGGER.log(Level.ERROR, "Uncaught exception in consumer thread: " + t.getName(), throwable)
    );
    consumerThread.set(thread);
    thread.start();
    LOGGER.log(Level.INFO, "Metering started for topic {0}", topic);
  }

  /**
   * Returns whether the consumer has been started and not yet closed.
   *
   * @return true if polling, false otherwise
   */
  public boolean isRunning() {
    return started.get() && !closed.get();
  }

  /**
   * Returns how long {@link #close()} waits for the polling thread.
   *
   * @return the wait limit
   */
  public Duration threadTerminationTimeout() {
    return threadTerminationTimeout;
  }

  /**
   * Stops polling, closes the Kafka consumer and closes the meters, which report one last time.
   * Calling it again has no effect.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }

    final var thread = consumerThread.get();
    if (thread == null) {
      closeKafkaConsumer();
    } else {
      wakeupAndWait(thread);
    }

    recordsMeter.close();
    Optional.ofNullable(bytesMeter).ifPresent(Pace::close);
    LOGGER.log(Level.INFO, "Metering stopped for topic {0}", topic);
  }

  /**
   * Polls once and steps the meters.
   *
   * @return the number of records received
   */
  @VisibleForTesting
  int pollOnce() {
    final var records = pollRecords();
    if (records == null || records.isEmpty()) {
      return 0;
    }

    recordsMeter.step(records.count());
    if (bytesMeter != null) {
      var bytes = 0L;
      for (final ConsumerRecord<K, V> record : records) {
        bytes += Math.max(0, record.serializedKeySize()) + Math.max(0, record.serializedValueSize());
      }
      bytesMeter.step(bytes);
    }
    return records.count();
  }

  private void pollLoop() {
    try {
      kafkaConsumer.subscribe(List.of(topic));
      while (!closed.get() && !Thread.currentThread().isInterrupted()) {
        pollOnce();
      }
    } finally {
      closeKafkaConsumer();
    }
  }

  private ConsumerRecords<K, V> pollRecords() {
    try {
      return kafkaConsumer.poll(pollTimeout);
    } catch (final WakeupException e) {
      // Expected during shutdown
      return null;
    } catch (final InterruptException e) {
      Thread.currentThread().interrupt();
      return null;
    } catch (final Exception e) {
      if (!closed.get()) {
        LOGGER.log(Level.WARNING, "Error during Kafka poll operation", e);
      }
      return null;
    }
  }

  private void wakeupAndWait(final Thread thread) {
    try {
      kafkaConsumer.wakeup();
    } catch (final Exception e) {
      LOGGER.log(Level.WARNING, "Error during consumer wakeup", e);
    }

    try {
      thread.join(threadTerminationTimeout.toMillis());
      if (thread.isAlive()) {
        LOGGER.log(Level.WARNING, "Consumer thread for topic {0} did not stop in time", topic);
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.log(Level.WARNING, "Interrupted while waiting for consumer thread");
    }
  }

  private void closeKafkaConsumer() {
    try {
      kafkaConsumer.close();
    } catch (final Exception e) {
      LOGGER.log(Level.WARNING, "Error closing Kafka consumer", e);
    }
  }
}
