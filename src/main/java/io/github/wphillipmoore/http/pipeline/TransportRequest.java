package io.github.wphillipmoore.http.pipeline;

import io.github.wphillipmoore.http.pipeline.encoding.ParameterEncoders;
import io.github.wphillipmoore.http.pipeline.exception.EncodingException;
import io.github.wphillipmoore.http.pipeline.http.Headers;
import io.github.wphillipmoore.http.pipeline.http.HttpHeader;
import io.github.wphillipmoore.http.pipeline.http.HttpMethod;
import io.github.wphillipmoore.http.pipeline.http.ParameterEncoding;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/**
 * A fully resolved request, ready for a transport.
 *
 * <p>Header names are matched ignoring case and each name carries a single value. The body is
 * copied on construction and on access. A transport request is its own description: {@link
 * #build()} returns {@code this}, {@link #headers()} expands the header table and {@link
 * #parameters()} decodes the body with the default encoder for its {@code Content-Type}.
 *
 * @param url the absolute target URL, never null
 * @param httpMethod the method token, never null
 * @param headerFields the header table, never null, unmodifiable
 * @param body the encoded body, never null (empty if there is no body)
 * @param timeout the per-request timeout, or {@code null} for the transport's default
 */
public record TransportRequest(
    URI url,
    String httpMethod,
    Map<String, String> headerFields,
    byte[] body,
    @Nullable Duration timeout)
    implements Requestable {

  private static final String CONTENT_TYPE = "Content-Type";

  /** Validates non-null fields and defensively copies the header table and body. */
  public TransportRequest {
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(httpMethod, "httpMethod");
    Map<String, String> table = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    table.putAll(Objects.requireNonNull(headerFields, "headerFields"));
    headerFields = Collections.unmodifiableMap(table);
    body = Objects.requireNonNull(body, "body").clone();
  }

  /**
   * Creates a body-less request with no timeout.
   *
   * @param url the absolute target URL
   * @param method the method
   */
  public static TransportRequest of(URI url, HttpMethod method) {
    return new TransportRequest(url, method.rawValue(), Map.of(), new byte[0], null);
  }

  /** Returns a copy of the encoded body. */
  @Override
  public byte[] body() {
    return body.clone();
  }

  /** Returns the body decoded as UTF-8 text. */
  public String bodyText() {
    return new String(body, StandardCharsets.UTF_8);
  }

  @Override
  public Set<HttpHeader> headers() {
    return Headers.fromMap(headerFields);
  }

  /** Returns the method token wrapped as an {@link HttpMethod}. */
  @Override
  public HttpMethod method() {
    return new HttpMethod(httpMethod);
  }

  /**
   * Returns the body decoded with the default encoder for the {@code Content-Type} header, or as
   * JSON when there is no such header. Returns an empty map when the body is empty, its content
   * type has no default encoder, or it does not decode.
   */
  @Override
  public Map<String, Object> parameters() {
    if (body.length == 0) {
      return Map.of();
    }
    try {
      return Collections.unmodifiableMap(
          ParameterEncoders.defaults().encoderFor(bodyEncoding()).decode(body));
    } catch (EncodingException e) {
      // Opaque bodies carry no parameters.
      return Map.of();
    }
  }

  /** Returns the encoding named by the {@code Content-Type} media type, ignoring its parameters. */
  ParameterEncoding bodyEncoding() {
    String contentType = headerFields.get(CONTENT_TYPE);
    if (contentType == null) {
      return ParameterEncoding.JSON;
    }
    int semicolon = contentType.indexOf(';');
    String mediaType = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
    return new ParameterEncoding(mediaType.trim().toLowerCase(Locale.ROOT));
  }

  @Override
  public TransportRequest build() {
    return this;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TransportRequest other)) {
      return false;
    }
    return url.equals(other.url)
        && httpMethod.equals(other.httpMethod)
        && headerFields.equals(other.headerFields)
        && Arrays.equals(body, other.body)
        && Objects.equals(timeout, other.timeout);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(url, httpMethod, headerHash(), timeout) + Arrays.hashCode(body);
  }

  // Header names compare ignoring case, so they must hash ignoring case too.
  private int headerHash() {
    int hash = 0;
    for (Map.Entry<String, String> entry : headerFields.entrySet()) {
      hash += entry.getKey().toLowerCase(Locale.ROOT).hashCode() ^ entry.getValue().hashCode();
    }
    return hash;
  }

  @Override
  public String toString() {
    return "TransportRequest[url="
        + url
        + ", httpMethod="
        + httpMethod
        + ", headerFields="
        + headerFields
        + ", body="
        + body.length
        + " bytes, timeout="
        + timeout
        + "]";
  }
}
