package io.github.wphillipmoore.http.pipeline;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Raw result of an in-memory execution: the response body and its transport metadata.
 *
 * @param data the response body, never null (empty if there is no body)
 * @param metadata the transport metadata, never null
 */
public record DataResponse(byte[] data, ResponseMetadata metadata) {

  /** Validates non-null fields and defensively copies the body. */
  public DataResponse {
    data = Objects.requireNonNull(data, "data").clone();
    Objects.requireNonNull(metadata, "metadata");
  }

  /** Returns a copy of the response body. */
  @Override
  public byte[] data() {
    return data.clone();
  }

  /** Returns the response body decoded as UTF-8 text. */
  public String text() {
    return new String(data, StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof DataResponse other
        && Arrays.equals(data, other.data)
        && metadata.equals(other.metadata);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(data) + metadata.hashCode();
  }

  @Override
  public String toString() {
    return "DataResponse[data=" + data.length + " bytes, metadata=" + metadata + "]";
  }
}
