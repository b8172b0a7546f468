package io.github.wphillipmoore.http.pipeline.modifier;

import io.github.wphillipmoore.http.pipeline.MutableRequestable;
import io.github.wphillipmoore.http.pipeline.http.Headers;
import io.github.wphillipmoore.http.pipeline.http.HttpHeader;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Request builder that adds a fixed set of headers.
 *
 * <p>By default headers are inserted into the collection, so an existing header with the same key
 * and a different value stays alongside the new one. A {@link #replacing replacing} injector
 * first removes every header sharing a key with an injected header.
 */
public final class HeaderInjector implements RequestBuilder {

  private final Set<HttpHeader> headers;
  private final boolean replaceExisting;

  private HeaderInjector(Collection<HttpHeader> headers, boolean replaceExisting) {
    this.headers = Headers.copyOf(headers);
    this.replaceExisting = replaceExisting;
  }

  /** Returns an injector that inserts the given headers. */
  public static HeaderInjector of(HttpHeader... headers) {
    return new HeaderInjector(List.of(headers), false);
  }

  /** Returns an injector that replaces same-key headers with the given headers. */
  public static HeaderInjector replacing(HttpHeader... headers) {
    return new HeaderInjector(List.of(headers), true);
  }

  /** Returns the headers this injector adds. */
  public Set<HttpHeader> headers() {
    return headers;
  }

  @Override
  public MutableRequestable mutate(MutableRequestable request) {
    Set<HttpHeader> result = request.headers();
    for (HttpHeader header : headers) {
      if (replaceExisting) {
        result = Headers.without(result, header.key());
      }
      result = Headers.with(result, header);
    }
    return request.withHeaders(result);
  }
}
