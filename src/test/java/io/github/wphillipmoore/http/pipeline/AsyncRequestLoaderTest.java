package io.github.wphillipmoore.http.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.wphillipmoore.http.pipeline.exception.TransportException;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;

class AsyncRequestLoaderTest {

  private static final RequestDescription REQUEST =
      RequestDescription.builder().baseUrlString("https://example.com").build();
  private static final DataResponse RESULT =
      new DataResponse(
          new byte[0], new ResponseMetadata(204, Map.of(), URI.create("https://example.com")));

  @Test
  void responseAsyncCompletesWithEnvelope() {
    CompletableFuture<DataResponse> pending = new CompletableFuture<>();
    AsyncRequestLoader loader = request -> pending;

    CompletableFuture<Response<RequestDescription, DataResponse>> future =
        loader.responseAsync(REQUEST);
    pending.complete(RESULT);

    Response<RequestDescription, DataResponse> response = future.join();
    assertThat(response.request()).isSameAs(REQUEST);
    assertThat(response.result()).isSameAs(RESULT);
    assertThat(response.metrics().duration()).isGreaterThanOrEqualTo(0.0);
  }

  @Test
  void responseAsyncFailsWithDataFailure() {
    TransportException failure = new TransportException("refused", "https://example.com");
    AsyncRequestLoader loader = request -> CompletableFuture.failedFuture(failure);

    assertThatThrownBy(() -> loader.responseAsync(REQUEST).join())
        .isInstanceOf(CompletionException.class)
        .hasCause(failure);
  }

  @Test
  void cancelledDataProducesNoEnvelope() {
    CompletableFuture<DataResponse> pending = new CompletableFuture<>();
    AsyncRequestLoader loader = request -> pending;
    CompletableFuture<Response<RequestDescription, DataResponse>> future =
        loader.responseAsync(REQUEST);

    pending.cancel(false);

    assertThat(future).isCompletedExceptionally();
    Throwable failure = future.handle((response, error) -> error).join();
    Throwable cause = failure instanceof CompletionException ? failure.getCause() : failure;
    assertThat(cause).isInstanceOf(CancellationException.class);
  }
}
