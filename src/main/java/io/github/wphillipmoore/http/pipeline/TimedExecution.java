package io.github.wphillipmoore.http.pipeline;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Wraps a single request execution with wall-clock timing and packages the outcome as a {@link
 * Response}.
 *
 * <p>The start instant and tick are read immediately before the execution is invoked and the
 * elapsed time immediately after it returns. The execution runs exactly once. Its failure
 * propagates unchanged and no {@link Metrics} are produced for it.
 */
public final class TimedExecution {

  static final ExecutionClock SYSTEM_CLOCK = new SystemClock();

  /** Clock abstraction for testability. */
  interface ExecutionClock {
    Instant now();

    long nanoTime();
  }

  /** Real clock using the system UTC clock and System.nanoTime. */
  static final class SystemClock implements ExecutionClock {

    @Override
    public Instant now() {
      return Instant.now();
    }

    @Override
    public long nanoTime() {
      return System.nanoTime();
    }
  }

  private TimedExecution() {}

  /**
   * Executes the request and times the execution.
   *
   * @param request the request to execute
   * @param execution the execution step, typically a transport's {@code data} method
   * @param <R> the request type
   * @param <T> the raw result type
   * @return the timed envelope
   */
  public static <R extends Requestable, T> Response<R, T> time(
      R request, Function<? super R, ? extends T> execution) {
    return time(request, execution, SYSTEM_CLOCK);
  }

  static <R extends Requestable, T> Response<R, T> time(
      R request, Function<? super R, ? extends T> execution, ExecutionClock clock) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(execution, "execution");
    Instant startDate = clock.now();
    long startNanos = clock.nanoTime();
    T result = execution.apply(request);
    Metrics metrics = new Metrics(startDate, elapsedSeconds(startNanos, clock.nanoTime()));
    return new Response<>(request, result, metrics);
  }

  /**
   * Executes the request asynchronously and times the execution.
   *
   * <p>The returned future fails with the execution's failure, including cancellation, and then
   * carries no metrics. A synchronous exception from {@code execution} is rethrown.
   *
   * @param request the request to execute
   * @param execution the asynchronous execution step
   * @param <R> the request type
   * @param <T> the raw result type
   * @return a future of the timed envelope
   */
  public static <R extends Requestable, T> CompletableFuture<Response<R, T>> timeAsync(
      R request, Function<? super R, ? extends CompletionStage<? extends T>> execution) {
    return timeAsync(request, execution, SYSTEM_CLOCK);
  }

  static <R extends Requestable, T> CompletableFuture<Response<R, T>> timeAsync(
      R request,
      Function<? super R, ? extends CompletionStage<? extends T>> execution,
      ExecutionClock clock) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(execution, "execution");
    Instant startDate = clock.now();
    long startNanos = clock.nanoTime();
    CompletionStage<? extends T> stage =
        Objects.requireNonNull(execution.apply(request), "execution returned null");
    return stage
        .<Response<R, T>>thenApply(
            result ->
                new Response<>(
                    request,
                    result,
                    new Metrics(startDate, elapsedSeconds(startNanos, clock.nanoTime()))))
        .toCompletableFuture();
  }

  static double elapsedSeconds(long startNanos, long endNanos) {
    return Math.max(0L, endNanos - startNanos) / 1_000_000_000.0;
  }
}
