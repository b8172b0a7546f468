package io.github.wphillipmoore.http.pipeline.http;

import java.util.Objects;

/**
 * An HTTP method token.
 *
 * <p>Tokens are case-sensitive and are not validated: any non-null string is accepted and passed
 * through to the transport unchanged. Two methods are equal iff their tokens are equal.
 *
 * @param rawValue the method token, never null
 * @see <a href="https://www.rfc-editor.org/rfc/rfc9110#section-9">RFC 9110 section 9</a>
 */
public record HttpMethod(String rawValue) {

  public static final HttpMethod CONNECT = new HttpMethod("CONNECT");
  public static final HttpMethod DELETE = new HttpMethod("DELETE");
  public static final HttpMethod GET = new HttpMethod("GET");
  public static final HttpMethod HEAD = new HttpMethod("HEAD");
  public static final HttpMethod OPTIONS = new HttpMethod("OPTIONS");
  public static final HttpMethod PATCH = new HttpMethod("PATCH");
  public static final HttpMethod POST = new HttpMethod("POST");
  public static final HttpMethod PUT = new HttpMethod("PUT");
  public static final HttpMethod TRACE = new HttpMethod("TRACE");

  /** Validates that the token is non-null. */
  public HttpMethod {
    Objects.requireNonNull(rawValue, "rawValue");
  }

  @Override
  public String toString() {
    return rawValue;
  }
}
