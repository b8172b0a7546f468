package io.github.wphillipmoore.http.pipeline;

import java.net.URI;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Transport-level metadata of a response. Headers are defensively copied to guarantee
 * unmodifiability.
 *
 * @param statusCode the HTTP status code
 * @param headers the response headers, never null, unmodifiable
 * @param url the URL the response was received from, never null
 */
public record ResponseMetadata(int statusCode, Map<String, String> headers, URI url) {

  /** Validates non-null fields and defensively copies headers. */
  public ResponseMetadata {
    headers = Map.copyOf(Objects.requireNonNull(headers, "headers"));
    Objects.requireNonNull(url, "url");
  }

  /** Returns the value of the named header, matching the name ignoring case, or {@code null}. */
  public @Nullable String header(String name) {
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (entry.getKey().equalsIgnoreCase(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  /** Returns whether the status code is in the 2xx range. */
  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }
}
