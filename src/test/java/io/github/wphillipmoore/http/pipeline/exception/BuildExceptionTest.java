package io.github.wphillipmoore.http.pipeline.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class BuildExceptionTest {

  @Test
  void constructWithoutCause() {
    BuildException ex = new BuildException(BuildException.Reason.INVALID_URL, "bad url");

    assertThat(ex.getMessage()).isEqualTo("bad url");
    assertThat(ex.getReason()).isEqualTo(BuildException.Reason.INVALID_URL);
    assertThat(ex.getCause()).isNull();
  }

  @Test
  void constructWithCause() {
    Throwable cause = new RuntimeException("root");
    BuildException ex =
        new BuildException(BuildException.Reason.ENCODING_FAILURE, "encode failed", cause);

    assertThat(ex.getReason()).isEqualTo(BuildException.Reason.ENCODING_FAILURE);
    assertThat(ex.getCause()).isSameAs(cause);
  }

  @Test
  void nullReasonThrowsNullPointerException() {
    assertThatThrownBy(() -> new BuildException(null, "fail"))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("reason");
  }

  @Test
  void hasExactlyThreeReasons() {
    assertThat(BuildException.Reason.values())
        .containsExactly(
            BuildException.Reason.INVALID_URL,
            BuildException.Reason.ENCODING_FAILURE,
            BuildException.Reason.INVALID_REQUEST);
  }

  @Test
  void isHttpPipelineException() {
    BuildException ex = new BuildException(BuildException.Reason.INVALID_REQUEST, "fail");

    assertThat(ex).isInstanceOf(HttpPipelineException.class);
    assertThat(ex).isInstanceOf(RuntimeException.class);
  }
}
