package io.github.wphillipmoore.http.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.wphillipmoore.http.pipeline.exception.TransportException;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RequestLoaderTest {

  private static final RequestDescription REQUEST =
      RequestDescription.builder().baseUrlString("https://example.com/slow").build();

  /** Loader that records its calls and sleeps before answering. */
  private static final class DelayedLoader implements RequestLoader {

    private final long delayMillis;
    private final List<Requestable> calls = new ArrayList<>();
    private final DataResponse result =
        new DataResponse(
            new byte[] {42},
            new ResponseMetadata(200, Map.of(), URI.create("https://example.com/slow")));

    DelayedLoader(long delayMillis) {
      this.delayMillis = delayMillis;
    }

    @Override
    public DataResponse data(Requestable request) {
      calls.add(request);
      try {
        Thread.sleep(delayMillis);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new TransportException("interrupted", "https://example.com/slow", e);
      }
      return result;
    }
  }

  @Test
  void responseWrapsDataWithTiming() {
    DelayedLoader loader = new DelayedLoader(100);
    Instant before = Instant.now();

    Response<RequestDescription, DataResponse> response = loader.response(REQUEST);

    Instant after = Instant.now();
    assertThat(response.request()).isSameAs(REQUEST);
    assertThat(response.result()).isSameAs(loader.result);
    assertThat(response.metrics().duration()).isGreaterThanOrEqualTo(0.1);
    assertThat(response.metrics().startDate()).isBetween(before, after);
    assertThat(loader.calls).containsExactly(REQUEST);
  }

  @Test
  void failingLoaderPropagatesError() {
    TransportException failure = new TransportException("refused", "https://example.com/slow");
    RequestLoader loader =
        request -> {
          throw failure;
        };

    assertThatThrownBy(() -> loader.response(REQUEST)).isSameAs(failure);
  }
}
