package io.github.wphillipmoore.http.pipeline;

import io.github.wphillipmoore.http.pipeline.exception.BuildException;
import io.github.wphillipmoore.http.pipeline.http.Headers;
import io.github.wphillipmoore.http.pipeline.http.HttpHeader;
import io.github.wphillipmoore.http.pipeline.http.HttpMethod;
import io.github.wphillipmoore.http.pipeline.http.ParameterEncoding;
import java.util.Map;
import java.util.Set;

/**
 * Describes an HTTP request before it is sent.
 *
 * <p>Implementations expose the request's headers, method and unencoded parameters, and know how
 * to {@link #build()} a {@link TransportRequest} from them. A {@link TransportRequest} is itself a
 * {@code Requestable} whose build is the identity, so already-resolved requests flow through the
 * same execution path as declarative ones.
 */
public interface Requestable {

  /** Returns the header collection. Never null; may be empty. */
  Set<HttpHeader> headers();

  /** Returns the HTTP method. */
  HttpMethod method();

  /** Returns the unencoded request parameters. Never null; may be empty. */
  Map<String, Object> parameters();

  /** Returns how {@link #parameters()} are encoded. Defaults to {@link ParameterEncoding#JSON}. */
  default ParameterEncoding parameterEncoding() {
    return ParameterEncoding.JSON;
  }

  /**
   * Resolves this description into a transport-ready request.
   *
   * <p>Building is pure: two calls without an intervening change yield equal requests.
   *
   * @return the transport-ready request
   * @throws BuildException if the URL is invalid or the parameters cannot be encoded
   */
  TransportRequest build();

  /**
   * Returns whether a {@code Content-Type} header (key compared ignoring case) declares a {@code
   * multipart/form-data} body (value compared ignoring case).
   */
  default boolean isMultipartRequest() {
    return Headers.isMultipart(headers());
  }

  /** Returns the method token. */
  default String rawMethod() {
    return method().rawValue();
  }
}
