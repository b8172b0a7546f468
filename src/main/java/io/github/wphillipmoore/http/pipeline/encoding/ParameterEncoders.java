package io.github.wphillipmoore.http.pipeline.encoding;

import io.github.wphillipmoore.http.pipeline.exception.EncodingException;
import io.github.wphillipmoore.http.pipeline.http.ParameterEncoding;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable registry pairing each {@link ParameterEncoding} with its {@link ParameterEncoder}.
 *
 * <pre>{@code
 * ParameterEncoders encoders = ParameterEncoders.defaults()
 *     .with(new ParameterEncoding("application/x-ndjson"), ndjsonEncoder);
 * }</pre>
 */
public final class ParameterEncoders {

  private static final ParameterEncoders DEFAULTS =
      new ParameterEncoders(
          Map.of(
              ParameterEncoding.JSON, new JsonParameterEncoder(),
              ParameterEncoding.URL, new FormUrlParameterEncoder()));

  private final Map<ParameterEncoding, ParameterEncoder> encoders;

  private ParameterEncoders(Map<ParameterEncoding, ParameterEncoder> encoders) {
    this.encoders = Map.copyOf(encoders);
  }

  /** Returns the registry holding the JSON and form URL encoders. */
  public static ParameterEncoders defaults() {
    return DEFAULTS;
  }

  /** Returns an empty registry. */
  public static ParameterEncoders empty() {
    return new ParameterEncoders(Map.of());
  }

  /**
   * Returns a registry that also maps {@code encoding} to {@code encoder}, replacing any encoder
   * already registered for it.
   */
  public ParameterEncoders with(ParameterEncoding encoding, ParameterEncoder encoder) {
    Objects.requireNonNull(encoding, "encoding");
    Objects.requireNonNull(encoder, "encoder");
    Map<ParameterEncoding, ParameterEncoder> copy = new LinkedHashMap<>(encoders);
    copy.put(encoding, encoder);
    return new ParameterEncoders(copy);
  }

  /** Registers an encoder under its own {@link ParameterEncoder#encoding()}. */
  public ParameterEncoders with(ParameterEncoder encoder) {
    return with(encoder.encoding(), encoder);
  }

  /**
   * Returns the encoder for {@code encoding}.
   *
   * @throws EncodingException if no encoder is registered
   */
  public ParameterEncoder encoderFor(ParameterEncoding encoding) {
    ParameterEncoder encoder = encoders.get(Objects.requireNonNull(encoding, "encoding"));
    if (encoder == null) {
      throw new EncodingException("No encoder registered for " + encoding.rawValue(), encoding);
    }
    return encoder;
  }

  /** Returns the registered encodings. */
  public Set<ParameterEncoding> encodings() {
    return encoders.keySet();
  }
}
