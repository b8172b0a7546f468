package io.github.wphillipmoore.http.pipeline.http;

import java.util.Objects;

/**
 * A named file part of a multipart form request.
 *
 * @param name the form field name, never null
 * @param file the file payload, never null
 */
public record FileParameter(String name, File file) {

  /** Validates that name and file are non-null. */
  public FileParameter {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(file, "file");
  }
}
