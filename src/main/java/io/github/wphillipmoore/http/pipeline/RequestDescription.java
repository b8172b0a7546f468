package io.github.wphillipmoore.http.pipeline;

import io.github.wphillipmoore.http.pipeline.encoding.ParameterEncoders;
import io.github.wphillipmoore.http.pipeline.exception.BuildException;
import io.github.wphillipmoore.http.pipeline.http.Headers;
import io.github.wphillipmoore.http.pipeline.http.HttpHeader;
import io.github.wphillipmoore.http.pipeline.http.HttpMethod;
import io.github.wphillipmoore.http.pipeline.http.ParameterEncoding;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Immutable, declarative HTTP request description.
 *
 * <p>Instances are created via the {@link Builder}:
 *
 * <pre>{@code
 * RequestDescription request = RequestDescription.builder()
 *     .baseUrlString("https://api.example.com/v1/items")
 *     .method(HttpMethod.POST)
 *     .header(HttpHeader.accept("application/json"))
 *     .parameter("name", "widget")
 *     .build();
 *
 * TransportRequest ready = request.build();
 * }</pre>
 *
 * <p>{@link #build()} resolves the base URL (or the fallback when none is set), flattens the
 * headers onto a single-valued table, and encodes the parameters with the encoder registered for
 * the active {@link ParameterEncoding}.
 */
public final class RequestDescription implements MutableRequestable {

  static final String DEFAULT_FALLBACK_BASE_URL = "http://localhost";
  static final String CONTENT_TYPE = "Content-Type";

  private final @Nullable String baseUrlString;
  private final Set<HttpHeader> headers;
  private final HttpMethod method;
  private final Map<String, Object> parameters;
  private final ParameterEncoding parameterEncoding;
  private final @Nullable Duration timeout;
  private final String fallbackBaseUrl;
  private final ParameterEncoders encoders;

  private RequestDescription(Builder builder) {
    this.baseUrlString = builder.baseUrlString;
    this.headers = Headers.copyOf(builder.headers);
    this.method = builder.method;
    this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
    this.parameterEncoding = builder.parameterEncoding;
    this.timeout = builder.timeout;
    this.fallbackBaseUrl = builder.fallbackBaseUrl;
    this.encoders = builder.encoders;
  }

  /** Returns a builder with default settings: GET, JSON, no headers, no parameters. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder initialized from this description. */
  public Builder toBuilder() {
    return new Builder(this);
  }

  @Override
  public @Nullable String baseUrlString() {
    return baseUrlString;
  }

  @Override
  public Set<HttpHeader> headers() {
    return headers;
  }

  @Override
  public HttpMethod method() {
    return method;
  }

  @Override
  public Map<String, Object> parameters() {
    return parameters;
  }

  @Override
  public ParameterEncoding parameterEncoding() {
    return parameterEncoding;
  }

  /** Returns the per-request timeout, or {@code null} to use the transport's default. */
  public @Nullable Duration timeout() {
    return timeout;
  }

  /** Returns the URL used when {@link #baseUrlString()} is {@code null}. */
  public String fallbackBaseUrl() {
    return fallbackBaseUrl;
  }

  /** Returns the encoder registry used by {@link #build()}. */
  public ParameterEncoders encoders() {
    return encoders;
  }

  @Override
  public RequestDescription withBaseUrlString(@Nullable String baseUrlString) {
    return toBuilder().baseUrlString(baseUrlString).build();
  }

  @Override
  public RequestDescription withHeaders(Set<HttpHeader> headers) {
    return toBuilder().headers(headers).build();
  }

  @Override
  public RequestDescription withHeader(HttpHeader header) {
    return toBuilder().header(header).build();
  }

  @Override
  public RequestDescription withMethod(HttpMethod method) {
    return toBuilder().method(method).build();
  }

  @Override
  public RequestDescription withParameters(Map<String, Object> parameters) {
    return toBuilder().parameters(parameters).build();
  }

  @Override
  public RequestDescription withParameterEncoding(ParameterEncoding parameterEncoding) {
    return toBuilder().parameterEncoding(parameterEncoding).build();
  }

  /** Returns a copy with the given per-request timeout. */
  public RequestDescription withTimeout(@Nullable Duration timeout) {
    return toBuilder().timeout(timeout).build();
  }

  /**
   * {@inheritDoc}
   *
   * <p>When several headers share a key the last one in insertion order wins. A {@code
   * Content-Type} header carrying the encoding's token is added when a body is produced and no
   * {@code Content-Type} header is present. Empty parameters produce an empty body.
   *
   * @throws BuildException with {@link BuildException.Reason#INVALID_URL} if the resolved URL is
   *     malformed or lacks a scheme or host, or {@link BuildException.Reason#ENCODING_FAILURE} if
   *     the encoder is missing or raises
   */
  @Override
  public TransportRequest build() {
    URI url = resolveUrl();
    Map<String, String> headerFields = Headers.flatten(headers);
    byte[] body = encodeBody();
    if (body.length > 0 && !headerFields.containsKey(CONTENT_TYPE)) {
      headerFields.put(CONTENT_TYPE, parameterEncoding.rawValue());
    }
    return new TransportRequest(url, method.rawValue(), headerFields, body, timeout);
  }

  private URI resolveUrl() {
    String urlString = baseUrlString != null ? baseUrlString : fallbackBaseUrl;
    URI url;
    try {
      url = new URI(urlString);
    } catch (URISyntaxException e) {
      throw new BuildException(
          BuildException.Reason.INVALID_URL, "Malformed URL: " + urlString, e);
    }
    if (url.getScheme() == null || url.getHost() == null) {
      throw new BuildException(
          BuildException.Reason.INVALID_URL, "URL must have a scheme and a host: " + urlString);
    }
    return url;
  }

  private byte[] encodeBody() {
    if (parameters.isEmpty()) {
      return new byte[0];
    }
    try {
      return encoders.encoderFor(parameterEncoding).encode(parameters);
    } catch (RuntimeException e) {
      throw new BuildException(
          BuildException.Reason.ENCODING_FAILURE,
          "Failed to encode parameters as " + parameterEncoding.rawValue(),
          e);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RequestDescription other)) {
      return false;
    }
    return Objects.equals(baseUrlString, other.baseUrlString)
        && headers.equals(other.headers)
        && method.equals(other.method)
        && parameters.equals(other.parameters)
        && parameterEncoding.equals(other.parameterEncoding)
        && Objects.equals(timeout, other.timeout)
        && fallbackBaseUrl.equals(other.fallbackBaseUrl)
        && encoders == other.encoders;
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        baseUrlString, headers, method, parameters, parameterEncoding, timeout, fallbackBaseUrl);
  }

  @Override
  public String toString() {
    return "RequestDescription[method="
        + method
        + ", baseUrlString="
        + baseUrlString
        + ", headers="
        + headers
        + ", parameters="
        + parameters.keySet()
        + ", parameterEncoding="
        + parameterEncoding.rawValue()
        + "]";
  }

  /** Builder for {@link RequestDescription}. */
  public static final class Builder {

    private @Nullable String baseUrlString;
    private Set<HttpHeader> headers = new LinkedHashSet<>();
    private HttpMethod method = HttpMethod.GET;
    private Map<String, Object> parameters = new LinkedHashMap<>();
    private ParameterEncoding parameterEncoding = ParameterEncoding.JSON;
    private @Nullable Duration timeout;
    private String fallbackBaseUrl = DEFAULT_FALLBACK_BASE_URL;
    private ParameterEncoders encoders = ParameterEncoders.defaults();

    private Builder() {}

    private Builder(RequestDescription source) {
      this.baseUrlString = source.baseUrlString;
      this.headers = new LinkedHashSet<>(source.headers);
      this.method = source.method;
      this.parameters = new LinkedHashMap<>(source.parameters);
      this.parameterEncoding = source.parameterEncoding;
      this.timeout = source.timeout;
      this.fallbackBaseUrl = source.fallbackBaseUrl;
      this.encoders = source.encoders;
    }

    /** Sets the base URL. Pass {@code null} to use the fallback base URL. */
    public Builder baseUrlString(@Nullable String baseUrlString) {
      this.baseUrlString = baseUrlString;
      return this;
    }

    /** Replaces the header collection. */
    public Builder headers(Collection<HttpHeader> headers) {
      this.headers = new LinkedHashSet<>(Headers.copyOf(headers));
      return this;
    }

    /** Inserts a header. Inserting an equal (key, value) pair twice has no effect. */
    public Builder header(HttpHeader header) {
      this.headers.add(Objects.requireNonNull(header, "header"));
      return this;
    }

    /** Sets the method. Defaults to {@link HttpMethod#GET}. */
    public Builder method(HttpMethod method) {
      this.method = Objects.requireNonNull(method, "method");
      return this;
    }

    /** Replaces the parameters. */
    public Builder parameters(Map<String, Object> parameters) {
      this.parameters = new LinkedHashMap<>(Objects.requireNonNull(parameters, "parameters"));
      return this;
    }

    /** Sets a single parameter. */
    public Builder parameter(String key, @Nullable Object value) {
      this.parameters.put(Objects.requireNonNull(key, "key"), value);
      return this;
    }

    /** Sets the parameter encoding. Defaults to {@link ParameterEncoding#JSON}. */
    public Builder parameterEncoding(ParameterEncoding parameterEncoding) {
      this.parameterEncoding = Objects.requireNonNull(parameterEncoding, "parameterEncoding");
      return this;
    }

    /** Sets the per-request timeout. Defaults to {@code null} (transport default). */
    public Builder timeout(@Nullable Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    /** Sets the URL used when no base URL is set. Defaults to {@code http://localhost}. */
    public Builder fallbackBaseUrl(String fallbackBaseUrl) {
      this.fallbackBaseUrl = Objects.requireNonNull(fallbackBaseUrl, "fallbackBaseUrl");
      return this;
    }

    /** Sets the encoder registry. Defaults to {@link ParameterEncoders#defaults()}. */
    public Builder encoders(ParameterEncoders encoders) {
      this.encoders = Objects.requireNonNull(encoders, "encoders");
      return this;
    }

    /**
     * Builds the description.
     *
     * @return the immutable request description
     */
    public RequestDescription build() {
      return new RequestDescription(this);
    }
  }
}
