package io.github.wphillipmoore.http.pipeline;

/**
 * Executes requests.
 *
 * <p>{@link #data(Requestable)} is the only required operation; it performs the I/O and must be
 * safe to call concurrently for distinct requests. Implementations should throw {@link
 * io.github.wphillipmoore.http.pipeline.exception.TransportException} for network failures.
 */
public interface RequestLoader {

  /**
   * Executes the request once and returns the raw result.
   *
   * @param request the request to execute
   * @return the response body and metadata
   */
  DataResponse data(Requestable request);

  /**
   * Executes the request once and returns the result together with its timing.
   *
   * <p>Failures from {@link #data(Requestable)} propagate unchanged.
   *
   * @param request the request to execute
   * @param <R> the request type
   * @return the timed envelope
   */
  default <R extends Requestable> Response<R, DataResponse> response(R request) {
    return TimedExecution.time(request, this::data);
  }
}
