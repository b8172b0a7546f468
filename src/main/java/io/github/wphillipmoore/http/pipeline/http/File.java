package io.github.wphillipmoore.http.pipeline.http;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A file payload for a multipart form request.
 *
 * <p>The byte content is copied on the way in and on the way out, so instances are immutable.
 * Multipart body assembly is left to the transport.
 */
public final class File {

  private final byte[] data;
  private final @Nullable Map<String, Object> fileData;
  private final @Nullable String filename;
  private final @Nullable String mimetype;

  /**
   * Creates a file payload.
   *
   * @param data the raw file content, never null
   * @param fileData additional form fields sent with the file, or {@code null}
   * @param filename the file name, or {@code null}
   * @param mimetype the MIME type (e.g. {@code image/png}), or {@code null}
   */
  public File(
      byte[] data,
      @Nullable Map<String, Object> fileData,
      @Nullable String filename,
      @Nullable String mimetype) {
    this.data = Objects.requireNonNull(data, "data").clone();
    this.fileData =
        fileData != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fileData)) : null;
    this.filename = filename;
    this.mimetype = mimetype;
  }

  /** Returns a copy of the raw file content. */
  public byte[] data() {
    return data.clone();
  }

  /** Returns the additional form fields, or {@code null}. The returned map is unmodifiable. */
  public @Nullable Map<String, Object> fileData() {
    return fileData;
  }

  public @Nullable String filename() {
    return filename;
  }

  public @Nullable String mimetype() {
    return mimetype;
  }

  /** Returns the content length in bytes. */
  public int size() {
    return data.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof File other)) {
      return false;
    }
    return Arrays.equals(data, other.data)
        && Objects.equals(fileData, other.fileData)
        && Objects.equals(filename, other.filename)
        && Objects.equals(mimetype, other.mimetype);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(data) + Objects.hash(fileData, filename, mimetype);
  }

  @Override
  public String toString() {
    return "File[filename="
        + filename
        + ", mimetype="
        + mimetype
        + ", size="
        + data.length
        + ", fileData="
        + fileData
        + "]";
  }
}
