package io.github.wphillipmoore.http.pipeline.http;

import java.util.Objects;

/**
 * Identifies how a parameter map is turned into a request body, by MIME content type.
 *
 * @param rawValue the content-type token, never null
 */
public record ParameterEncoding(String rawValue) {

  public static final ParameterEncoding JSON = new ParameterEncoding("application/json");
  public static final ParameterEncoding URL =
      new ParameterEncoding("application/x-www-form-urlencoded");

  /** Validates that the token is non-null. */
  public ParameterEncoding {
    Objects.requireNonNull(rawValue, "rawValue");
  }
}
