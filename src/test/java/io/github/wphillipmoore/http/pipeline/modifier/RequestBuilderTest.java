package io.github.wphillipmoore.http.pipeline.modifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.wphillipmoore.http.pipeline.MutableRequestable;
import io.github.wphillipmoore.http.pipeline.RequestDescription;
import io.github.wphillipmoore.http.pipeline.http.HttpHeader;
import io.github.wphillipmoore.http.pipeline.http.HttpMethod;
import java.util.List;
import org.junit.jupiter.api.Test;

class RequestBuilderTest {

  private static final RequestDescription REQUEST =
      RequestDescription.builder().baseUrlString("https://example.com").build();

  private static final RequestBuilder ACCEPT_JSON =
      HeaderInjector.replacing(HttpHeader.accept("application/json"));
  private static final RequestBuilder ACCEPT_XML =
      HeaderInjector.replacing(HttpHeader.accept("application/xml"));

  @Test
  void emptyChainReturnsInput() {
    assertThat(RequestBuilder.applyAll(REQUEST, List.of())).isSameAs(REQUEST);
  }

  @Test
  void identityReturnsInput() {
    assertThat(RequestBuilder.identity().mutate(REQUEST)).isSameAs(REQUEST);
  }

  @Test
  void appliesInListOrder() {
    MutableRequestable jsonLast =
        RequestBuilder.applyAll(REQUEST, List.of(ACCEPT_XML, ACCEPT_JSON));
    MutableRequestable xmlLast =
        RequestBuilder.applyAll(REQUEST, List.of(ACCEPT_JSON, ACCEPT_XML));

    assertThat(jsonLast.build().headerFields()).containsEntry("Accept", "application/json");
    assertThat(xmlLast.build().headerFields()).containsEntry("Accept", "application/xml");
  }

  @Test
  void andThenMatchesApplyAll() {
    RequestBuilder setMethod = request -> request.withMethod(HttpMethod.PUT);
    RequestBuilder chained = ACCEPT_JSON.andThen(setMethod);

    assertThat(chained.mutate(REQUEST))
        .isEqualTo(RequestBuilder.applyAll(REQUEST, List.of(ACCEPT_JSON, setMethod)));
  }

  @Test
  void inputIsNotChanged() {
    RequestBuilder.applyAll(REQUEST, List.of(ACCEPT_JSON, ACCEPT_XML));

    assertThat(REQUEST.headers()).isEmpty();
  }

  @Test
  void nullResultThrowsNullPointerException() {
    RequestBuilder broken = request -> null;

    assertThatThrownBy(() -> RequestBuilder.applyAll(REQUEST, List.of(broken)))
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("builder returned null");
  }
}
