package org.kpace.config;

import java.util.Properties;
import java.util.function.UnaryOperator;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;

/**
 * Creates Kafka consumer properties for metering a topic.
 *
 * <p>A metering consumer only counts records, so it reads raw bytes and starts at the latest
 * offset by default: the rate of live traffic matters, not the backlog.
 *
 * <p>Usage examples:
 *
 * <pre>{@code
 * // Basic metering configuration
 * Properties props = KafkaConsumerConfig.createConsumerConfig("localhost:9092", "kpace-group");
 *
 * // Measure the backlog too
 * Properties backlog = KafkaConsumerConfig.createConsumerConfig(
 *     "localhost:9092",
 *     "kpace-group",
 *     KafkaConsumerConfig.withOffsetReset("earliest"));
 * }</pre>
 */
public final class KafkaConsumerConfig {

  private KafkaConsumerConfig() {}

  /**
   * Creates consumer properties with customization.
   *
   * @param bootstrapServers Comma-separated list of host:port pairs of the Kafka cluster
   * @param groupId The consumer group the metering consumer joins
   * @param customizer A function applying additional modifications, may be null
   * @return Properties configured for a metering consumer
   */
  public static Properties createConsumerConfig(
    final String bootstrapServers,
    final String groupId,
    final UnaryOperator<Properties> customizer
  ) {
    final var props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");

    return customizer != null ? customizer.apply(props) : props;
  }

  /**
   * Creates default consumer properties.
   *
   * @param bootstrapServers Comma-separated list of host:port pairs of the Kafka cluster
   * @param groupId The consumer group the metering consumer joins
   * @return Properties configured for a metering consumer
   */
  public static Properties createConsumerConfig(final String bootstrapServers, final String groupId) {
    return createConsumerConfig(bootstrapServers, groupId, null);
  }

  /**
   * Creates a transformer choosing where a new group starts reading.
   *
   * @param strategy {@code earliest}, {@code latest} or {@code none}
   * @return A function that sets the offset reset strategy
   */
  public static UnaryOperator<Properties> withOffsetReset(final String strategy) {
    return withProperty(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, strategy);
  }

  /**
   * Creates a transformer that sets a single property.
   *
   * @param key The property key
   * @param value The property value
   * @return A function that adds the property to a copy of the configuration
   */
  public static UnaryOperator<Properties> withProperty(final String key, final String value) {
    return props -> {
      final var newProps = new Properties();
      newProps.putAll(props);
      newProps.put(key, value);
      return newProps;
    };
  }
}
