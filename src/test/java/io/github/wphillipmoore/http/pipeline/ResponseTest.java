package io.github.wphillipmoore.http.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ResponseTest {

  private static final RequestDescription REQUEST =
      RequestDescription.builder().baseUrlString("https://example.com").build();
  private static final Metrics METRICS = new Metrics(Instant.parse("2024-01-15T10:00:00Z"), 0.5);

  @Test
  void withMetricsKeepsRequestAndResult() {
    Response<RequestDescription, String> response = new Response<>(REQUEST, "body", METRICS);
    Metrics changed = new Metrics(METRICS.startDate(), 1.0);

    Response<RequestDescription, String> copy = response.withMetrics(changed);

    assertThat(copy.request()).isSameAs(REQUEST);
    assertThat(copy.result()).isSameAs(response.result());
    assertThat(copy.metrics()).isEqualTo(changed);
    assertThat(response.metrics()).isEqualTo(METRICS);
  }

  @Test
  void withResultChangesResultType() {
    Response<RequestDescription, String> response = new Response<>(REQUEST, "body", METRICS);

    Response<RequestDescription, Integer> copy = response.withResult(4);

    assertThat(copy.result()).isEqualTo(4);
    assertThat(copy.metrics()).isSameAs(METRICS);
  }

  @Test
  void withRequestChangesRequestType() {
    Response<RequestDescription, String> response = new Response<>(REQUEST, "body", METRICS);
    TransportRequest built = REQUEST.build();

    Response<TransportRequest, String> copy = response.withRequest(built);

    assertThat(copy.request()).isSameAs(built);
    assertThat(copy.request().url()).isEqualTo(URI.create("https://example.com"));
  }

  @Test
  void nullResultThrowsNullPointerException() {
    assertThatThrownBy(() -> new Response<>(REQUEST, null, METRICS))
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("result");
  }

  @Test
  void nullMetricsThrowsNullPointerException() {
    assertThatThrownBy(() -> new Response<>(REQUEST, "body", null))
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("metrics");
  }
}
