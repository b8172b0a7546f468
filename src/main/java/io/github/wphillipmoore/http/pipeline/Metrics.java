package io.github.wphillipmoore.http.pipeline;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Timing of a single request execution.
 *
 * @param startDate the wall-clock instant recorded immediately before the execution started
 * @param duration the elapsed wall-clock time of the execution, in seconds, never negative
 */
public record Metrics(Instant startDate, double duration) {

  /** Validates that startDate is non-null and duration is a non-negative number. */
  public Metrics {
    Objects.requireNonNull(startDate, "startDate");
    if (Double.isNaN(duration) || duration < 0) {
      throw new IllegalArgumentException("duration must be non-negative: " + duration);
    }
  }

  /** Returns the duration as a {@link Duration}, truncated to nanoseconds. */
  public Duration toDuration() {
    return Duration.ofNanos((long) (duration * 1_000_000_000.0));
  }

  /** Returns the instant at which the execution finished. */
  public Instant endDate() {
    return startDate.plus(toDuration());
  }
}
