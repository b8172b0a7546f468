package io.github.wphillipmoore.http.pipeline.exception;

import java.util.Objects;

/**
 * Thrown when a request description cannot be turned into a transport-ready request.
 *
 * <p>No partially built request is ever returned alongside this exception.
 */
public final class BuildException extends HttpPipelineException {

  private static final long serialVersionUID = 1L;

  /** Why the build failed. */
  public enum Reason {
    /** The resolved URL is malformed or lacks a scheme or host. */
    INVALID_URL,
    /** No encoder is registered for the encoding, or the encoder raised. */
    ENCODING_FAILURE,
    /** The transport rejected the URL scheme, the method token or a header name. */
    INVALID_REQUEST
  }

  private final Reason reason;

  /**
   * Creates a build exception.
   *
   * @param reason the failure category
   * @param message description of the failure
   */
  public BuildException(Reason reason, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  /**
   * Creates a build exception with a cause.
   *
   * @param reason the failure category
   * @param message description of the failure
   * @param cause the underlying cause
   */
  public BuildException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  /** Returns the failure category. */
  public Reason getReason() {
    return reason;
  }
}
