package org.kpace.util;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class DurationsTest {

  @ParameterizedTest
  @MethodSource("formatScenarios")
  void shouldFormatCompactly(final Duration duration, final String expected) {
    assertEquals(expected, Durations.format(duration));
  }

  static Stream<Arguments> formatScenarios() {
    return Stream.of(
      Arguments.of(Duration.ZERO, "0s"),
      Arguments.of(Duration.ofNanos(750), "750ns"),
      Arguments.of(Duration.ofNanos(1_500), "1.5µs"),
      Arguments.of(Duration.ofMillis(250), "250ms"),
      Arguments.of(Duration.ofNanos(2_500_000), "2.5ms"),
      Arguments.of(Duration.ofSeconds(1), "1s"),
      Arguments.of(Duration.ofMillis(3_250), "3.25s"),
      Arguments.of(Duration.ofMinutes(1), "1m0s"),
      Arguments.of(Duration.ofSeconds(90), "1m30s"),
      Arguments.of(Duration.ofHours(1), "1h0m0s"),
      Arguments.of(Duration.ofHours(24), "24h0m0s"),
      Arguments.of(Duration.ofHours(1).plusSeconds(5), "1h0m5s"),
      Arguments.of(Duration.ofSeconds(-2), "-2s")
    );
  }

  @Test
  void shouldTruncateWhenRemainderIsWithinTolerance() {
    final var truncated = Durations.truncate(Duration.ofMillis(3_004), Duration.ofSeconds(1), Duration.ofMillis(10));

    assertEquals(Duration.ofSeconds(3), truncated);
  }

  @Test
  void shouldKeepDurationWhenRemainderExceedsTolerance() {
    final var duration = Duration.ofMillis(3_400);

    assertEquals(duration, Durations.truncate(duration, Duration.ofSeconds(1), Duration.ofMillis(10)));
  }

  @Test
  void shouldKeepDurationForEmptyUnit() {
    final var duration = Duration.ofMillis(3_004);

    assertEquals(duration, Durations.truncate(duration, Duration.ZERO, Duration.ofMillis(10)));
  }
}
