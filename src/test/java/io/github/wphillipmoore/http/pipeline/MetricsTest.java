package io.github.wphillipmoore.http.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class MetricsTest {

  private static final Instant START = Instant.parse("2024-01-15T10:00:00Z");

  @Test
  void holdsStartDateAndDuration() {
    Metrics metrics = new Metrics(START, 1.5);

    assertThat(metrics.startDate()).isEqualTo(START);
    assertThat(metrics.duration()).isEqualTo(1.5);
  }

  @Test
  void zeroDurationAccepted() {
    assertThat(new Metrics(START, 0.0).toDuration()).isEqualTo(Duration.ZERO);
  }

  @Test
  void negativeDurationRejected() {
    assertThatThrownBy(() -> new Metrics(START, -0.001))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("duration must be non-negative");
  }

  @Test
  void nanDurationRejected() {
    assertThatThrownBy(() -> new Metrics(START, Double.NaN))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void nullStartDateThrowsNullPointerException() {
    assertThatThrownBy(() -> new Metrics(null, 1.0))
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("startDate");
  }

  @Test
  void toDurationConvertsSeconds() {
    assertThat(new Metrics(START, 0.25).toDuration()).isEqualTo(Duration.ofMillis(250));
  }

  @Test
  void endDateAddsDuration() {
    assertThat(new Metrics(START, 2.0).endDate()).isEqualTo(START.plusSeconds(2));
  }
}
