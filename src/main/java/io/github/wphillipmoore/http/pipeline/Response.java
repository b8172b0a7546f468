package io.github.wphillipmoore.http.pipeline;

import java.util.Objects;

/**
 * Envelope produced by one request execution: the original request, the raw result and the
 * timing of the execution.
 *
 * <p>Envelopes are immutable. Response modifiers derive new envelopes with the {@code with*}
 * methods instead of changing one in place.
 *
 * @param <R> the request type
 * @param <T> the raw result type, e.g. {@link DataResponse} or {@link DownloadResponse}
 * @param request the executed request, never null
 * @param result the raw execution result, never null
 * @param metrics the execution timing, never null
 */
public record Response<R extends Requestable, T>(R request, T result, Metrics metrics) {

  /** Validates that all fields are non-null. */
  public Response {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(result, "result");
    Objects.requireNonNull(metrics, "metrics");
  }

  /** Returns a copy carrying {@code metrics}. */
  public Response<R, T> withMetrics(Metrics metrics) {
    return new Response<>(request, result, metrics);
  }

  /** Returns a copy carrying {@code result}. */
  public <U> Response<R, U> withResult(U result) {
    return new Response<>(request, result, metrics);
  }

  /** Returns a copy carrying {@code request}. */
  public <Q extends Requestable> Response<Q, T> withRequest(Q request) {
    return new Response<>(request, result, metrics);
  }
}
