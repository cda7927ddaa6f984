package org.kpace.consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.apache.kafka.common.record.TimestampType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.kpace.meter.Pace;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MeteredConsumerTest {

  private static final String TOPIC = "test-topic";
  private static final TopicPartition PARTITION = new TopicPartition(TOPIC, 0);

  @Mock
  private Consumer<byte[], byte[]> kafkaConsumer;

  @Mock
  private Pace recordsMeter;

  @Mock
  private Pace bytesMeter;

  private MeteredConsumer<byte[], byte[]> consumer;

  @BeforeEach
  void setUp() {
    consumer =
      MeteredConsumer
        .<byte[], byte[]>builder()
        .withConsumer(kafkaConsumer)
        .withTopic(TOPIC)
        .withPollTimeout(Duration.ofMillis(10))
        .withRecordsMeter(recordsMeter)
        .withBytesMeter(bytesMeter)
        .build();
  }

  @AfterEach
  void tearDown() {
    consumer.close();
  }

  private static ConsumerRecord<byte[], byte[]> record(final long offset, final int keySize, final int valueSize) {
    return new ConsumerRecord<>(
      TOPIC,
      0,
      offset,
      0L,
      TimestampType.CREATE_TIME,
      keySize,
      valueSize,
      new byte[Math.max(0, keySize)],
      new byte[valueSize],
      new RecordHeaders(),
      Optional.empty()
    );
  }

  @Test
  void shouldStepMetersByRecordCountAndSize() {
    // Arrange
    final var records = new ConsumerRecords<>(Map.of(PARTITION, List.of(record(0, 4, 100), record(1, -1, 50))));
    when(kafkaConsumer.poll(any(Duration.class))).thenReturn(records);

    // Act
    final var count = consumer.pollOnce();

    // Assert
    assertEquals(2, count);
    verify(recordsMeter).step(2.0);
    verify(bytesMeter).step(154.0);
  }

  @Test
  void shouldNotStepOnEmptyPoll() {
    // Arrange
    when(kafkaConsumer.poll(any(Duration.class))).thenReturn(ConsumerRecords.empty());

    // Act
    final var count = consumer.pollOnce();

    // Assert
    assertEquals(0, count);
    verifyNoInteractions(recordsMeter, bytesMeter);
  }

  @Test
  void shouldKeepPollingAfterPollError() {
    // Arrange
    final var records = new ConsumerRecords<>(Map.of(PARTITION, List.of(record(0, 0, 10))));
    when(kafkaConsumer.poll(any(Duration.class))).thenThrow(new KafkaException("broker unavailable")).thenReturn(records);

    // Act
    final var first = consumer.pollOnce();
    final var second = consumer.pollOnce();

    // Assert
    assertEquals(0, first);
    assertEquals(1, second);
    verify(recordsMeter).step(1.0);
  }

  @Test
  void shouldSubscribeOnStartAndReleaseEverythingOnClose() {
    // Arrange
    lenient()
      .when(kafkaConsumer.poll(any(Duration.class)))
      .thenAnswer(inv -> {
        Thread.sleep(5);
        return ConsumerRecords.empty();
      });

    // Act
    consumer.start();
    verify(kafkaConsumer, timeout(1000)).subscribe(List.of(TOPIC));
    assertTrue(consumer.isRunning());
    consumer.close();

    // Assert
    assertFalse(consumer.isRunning());
    verify(kafkaConsumer).wakeup();
    verify(kafkaConsumer, timeout(1000)).close();
    verify(recordsMeter).close();
    verify(bytesMeter).close();
  }

  @Test
  void shouldCloseOnlyOnce() {
    // Act
    consumer.close();
    consumer.close();

    // Assert
    verify(kafkaConsumer, times(1)).close();
    verify(recordsMeter, times(1)).close();
  }

  @Test
  void shouldRejectStartAfterClose() {
    // Act
    consumer.close();

    // Assert
    assertThrows(IllegalStateException.class, () -> consumer.start());
  }

  @Test
  void shouldRequireRecordsMeter() {
    assertThrows(
      NullPointerException.class,
      () -> MeteredConsumer.<byte[], byte[]>builder().withConsumer(kafkaConsumer).withTopic(TOPIC).build()
    );
  }

  @Test
  void shouldRejectNonPositivePollTimeout() {
    assertThrows(
      IllegalArgumentException.class,
      () ->
        MeteredConsumer
          .<byte[], byte[]>builder()
          .withConsumer(kafkaConsumer)
          .withTopic(TOPIC)
          .withRecordsMeter(recordsMeter)
          .withPollTimeout(Duration.ZERO)
          .build()
    );
  }
}
