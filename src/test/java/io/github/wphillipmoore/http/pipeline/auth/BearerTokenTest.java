package io.github.wphillipmoore.http.pipeline.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class BearerTokenTest {

  @Test
  void constructionWithValidToken() {
    assertThat(new BearerToken("abc123").token()).isEqualTo("abc123");
  }

  @Test
  void nullTokenThrowsNullPointerException() {
    assertThatThrownBy(() -> new BearerToken(null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("token");
  }

  @Test
  void equalityForSameValues() {
    assertThat(new BearerToken("abc123")).isEqualTo(new BearerToken("abc123"));
    assertThat(new BearerToken("abc123")).isNotEqualTo(new BearerToken("other"));
  }

  @Test
  void toStringMasksToken() {
    assertThat(new BearerToken("abc123").toString()).doesNotContain("abc123");
  }
}
