package io.github.wphillipmoore.http.pipeline.http;

import java.util.Objects;

/**
 * A single HTTP header.
 *
 * <p>Equality is by the {@code (key, value)} pair, so a header collection may hold several
 * headers sharing a key as long as their values differ.
 *
 * @param key the header name, never null
 * @param value the header value, never null
 */
public record HttpHeader(String key, String value) {

  /** Validates that key and value are non-null. */
  public HttpHeader {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
  }

  public static HttpHeader accept(String value) {
    return new HttpHeader("Accept", value);
  }

  public static HttpHeader acceptEncoding(String value) {
    return new HttpHeader("Accept-Encoding", value);
  }

  public static HttpHeader acceptLanguage(String value) {
    return new HttpHeader("Accept-Language", value);
  }

  public static HttpHeader authorization(String value) {
    return new HttpHeader("Authorization", value);
  }

  /** Returns an {@code Authorization} header carrying {@code "Bearer <token>"}. */
  public static HttpHeader authorizationBearer(String token) {
    return new HttpHeader("Authorization", "Bearer " + token);
  }

  public static HttpHeader cacheControl(String value) {
    return new HttpHeader("Cache-Control", value);
  }

  public static HttpHeader contentLength(int value) {
    return new HttpHeader("Content-Length", String.valueOf(value));
  }

  public static HttpHeader contentType(String value) {
    return new HttpHeader("Content-Type", value);
  }

  public static HttpHeader cookie(String value) {
    return new HttpHeader("Cookie", value);
  }

  public static HttpHeader host(String value) {
    return new HttpHeader("Host", value);
  }

  public static HttpHeader ifMatch(String etag) {
    return new HttpHeader("If-Match", etag);
  }

  public static HttpHeader ifModifiedSince(String date) {
    return new HttpHeader("If-Modified-Since", date);
  }

  public static HttpHeader ifNoneMatch(String etag) {
    return new HttpHeader("If-None-Match", etag);
  }

  public static HttpHeader ifUnmodifiedSince(String date) {
    return new HttpHeader("If-Unmodified-Since", date);
  }

  public static HttpHeader origin(String value) {
    return new HttpHeader("Origin", value);
  }

  public static HttpHeader referer(String value) {
    return new HttpHeader("Referer", value);
  }

  public static HttpHeader userAgent(String value) {
    return new HttpHeader("User-Agent", value);
  }
}
