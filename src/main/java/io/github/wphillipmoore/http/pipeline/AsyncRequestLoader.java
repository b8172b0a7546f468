package io.github.wphillipmoore.http.pipeline;

import java.util.concurrent.CompletableFuture;

/** Executes requests without blocking the caller. */
public interface AsyncRequestLoader {

  /**
   * Starts executing the request once.
   *
   * @param request the request to execute
   * @return a future of the response body and metadata
   */
  CompletableFuture<DataResponse> dataAsync(Requestable request);

  /**
   * Starts executing the request once and times it.
   *
   * <p>If the data future fails or is cancelled, the returned future fails with it and no
   * envelope is produced.
   *
   * @param request the request to execute
   * @param <R> the request type
   * @return a future of the timed envelope
   */
  default <R extends Requestable> CompletableFuture<Response<R, DataResponse>> responseAsync(
      R request) {
    return TimedExecution.timeAsync(request, this::dataAsync);
  }
}
