package io.github.wphillipmoore.http.pipeline.exception;

import io.github.wphillipmoore.http.pipeline.http.ParameterEncoding;
import java.util.Objects;

/**
 * Thrown by a parameter encoder that cannot serialize or deserialize a parameter map.
 *
 * <p>Request descriptions report this as a {@link BuildException} with reason {@link
 * BuildException.Reason#ENCODING_FAILURE}.
 */
public final class EncodingException extends HttpPipelineException {

  private static final long serialVersionUID = 1L;

  private final ParameterEncoding encoding;

  /**
   * Creates an encoding exception.
   *
   * @param message description of the failure
   * @param encoding the encoding that failed
   */
  public EncodingException(String message, ParameterEncoding encoding) {
    super(message);
    this.encoding = Objects.requireNonNull(encoding, "encoding");
  }

  /**
   * Creates an encoding exception with a cause.
   *
   * @param message description of the failure
   * @param encoding the encoding that failed
   * @param cause the underlying cause
   */
  public EncodingException(String message, ParameterEncoding encoding, Throwable cause) {
    super(message, cause);
    this.encoding = Objects.requireNonNull(encoding, "encoding");
  }

  /** Returns the encoding that failed. */
  public ParameterEncoding getEncoding() {
    return encoding;
  }
}
