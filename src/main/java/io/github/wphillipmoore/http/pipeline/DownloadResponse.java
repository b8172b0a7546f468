package io.github.wphillipmoore.http.pipeline;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Raw result of an execution whose body was streamed to a file.
 *
 * @param file the file holding the response body, never null
 * @param metadata the transport metadata, never null
 */
public record DownloadResponse(Path file, ResponseMetadata metadata) {

  /** Validates non-null fields. */
  public DownloadResponse {
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(metadata, "metadata");
  }
}
