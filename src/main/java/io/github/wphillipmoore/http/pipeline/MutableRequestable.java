package io.github.wphillipmoore.http.pipeline;

import io.github.wphillipmoore.http.pipeline.http.Headers;
import io.github.wphillipmoore.http.pipeline.http.HttpHeader;
import io.github.wphillipmoore.http.pipeline.http.HttpMethod;
import io.github.wphillipmoore.http.pipeline.http.ParameterEncoding;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A {@link Requestable} whose fields can be replaced after construction, including the base URL
 * used to resolve the final target.
 *
 * <p>Every {@code with*} method returns a new description and leaves the receiver unchanged, so a
 * description handed to a {@link io.github.wphillipmoore.http.pipeline.modifier.RequestBuilder}
 * is never altered behind the caller's back.
 */
public interface MutableRequestable extends Requestable {

  /** Returns the base URL, or {@code null} to use the implementation's fallback. */
  @Nullable String baseUrlString();

  MutableRequestable withBaseUrlString(@Nullable String baseUrlString);

  MutableRequestable withHeaders(Set<HttpHeader> headers);

  MutableRequestable withMethod(HttpMethod method);

  MutableRequestable withParameters(Map<String, Object> parameters);

  MutableRequestable withParameterEncoding(ParameterEncoding parameterEncoding);

  /** Returns a copy with {@code header} inserted into the header collection. */
  default MutableRequestable withHeader(HttpHeader header) {
    return withHeaders(Headers.with(headers(), header));
  }
}
