package io.github.wphillipmoore.http.pipeline.exception;

/**
 * Base exception for all request pipeline errors.
 *
 * <p>This is an unchecked exception hierarchy. Build failures and transport failures are
 * distinct subclasses.
 */
public sealed class HttpPipelineException extends RuntimeException
    permits BuildException, EncodingException, TransportException {

  private static final long serialVersionUID = 1L;

  /** Creates an exception with the given message. */
  public HttpPipelineException(String message) {
    super(message);
  }

  /** Creates an exception with the given message and cause. */
  public HttpPipelineException(String message, Throwable cause) {
    super(message, cause);
  }
}
