package io.github.wphillipmoore.http.pipeline.encoding;

import io.github.wphillipmoore.http.pipeline.http.ParameterEncoding;
import java.util.Map;

/**
 * Serializes a parameter map into request body bytes for one {@link ParameterEncoding}.
 *
 * <p>Implementations should throw {@link
 * io.github.wphillipmoore.http.pipeline.exception.EncodingException} when a value cannot be
 * represented. Encoders must be stateless or thread-safe: one instance serves every request built
 * with its encoding.
 */
public interface ParameterEncoder {

  /** Returns the encoding this encoder implements. */
  ParameterEncoding encoding();

  /**
   * Encodes the parameters.
   *
   * @param parameters the parameters, never null
   * @return the encoded body
   */
  byte[] encode(Map<String, Object> parameters);

  /**
   * Decodes a body produced by {@link #encode(Map)}.
   *
   * @param body the encoded body, never null
   * @return the decoded parameters
   */
  Map<String, Object> decode(byte[] body);
}
