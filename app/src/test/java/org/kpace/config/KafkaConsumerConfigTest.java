package org.kpace.config;

import static org.junit.jupiter.api.Assertions.*;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.junit.jupiter.api.Test;

class KafkaConsumerConfigTest {

  private static final String BOOTSTRAP_SERVERS = "localhost:9092";
  private static final String GROUP_ID = "test-group";

  @Test
  void shouldCreateMeteringConsumerConfig() {
    // Act
    final var props = KafkaConsumerConfig.createConsumerConfig(BOOTSTRAP_SERVERS, GROUP_ID);

    // Assert
    assertEquals(BOOTSTRAP_SERVERS, props.get(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG));
    assertEquals(GROUP_ID, props.get(ConsumerConfig.GROUP_ID_CONFIG));
    assertEquals(
      "org.apache.kafka.common.serialization.ByteArrayDeserializer",
      props.get(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG)
    );
    assertEquals(
      "org.apache.kafka.common.serialization.ByteArrayDeserializer",
      props.get(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG)
    );
    assertEquals("latest", props.get(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG));
    assertEquals("true", props.get(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG));
  }

  @Test
  void shouldApplyOffsetReset() {
    // Act
    final var props = KafkaConsumerConfig.createConsumerConfig(
      BOOTSTRAP_SERVERS,
      GROUP_ID,
      KafkaConsumerConfig.withOffsetReset("earliest")
    );

    // Assert
    assertEquals("earliest", props.get(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG));
    assertEquals(GROUP_ID, props.get(ConsumerConfig.GROUP_ID_CONFIG));
  }

  @Test
  void shouldSetCustomPropertyOnCopy() {
    // Arrange
    final var base = KafkaConsumerConfig.createConsumerConfig(BOOTSTRAP_SERVERS, GROUP_ID);

    // Act
    final var props = KafkaConsumerConfig.withProperty("max.poll.records", "100").apply(base);

    // Assert
    assertEquals("100", props.get("max.poll.records"));
    assertNull(base.get("max.poll.records"));
  }
}
