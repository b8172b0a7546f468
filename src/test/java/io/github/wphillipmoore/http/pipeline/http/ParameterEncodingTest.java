package io.github.wphillipmoore.http.pipeline.http;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ParameterEncodingTest {

  @Test
  void builtInTokens() {
    assertThat(ParameterEncoding.JSON.rawValue()).isEqualTo("application/json");
    assertThat(ParameterEncoding.URL.rawValue()).isEqualTo("application/x-www-form-urlencoded");
  }

  @Test
  void equalityIsByToken() {
    assertThat(new ParameterEncoding("application/json")).isEqualTo(ParameterEncoding.JSON);
    assertThat(new ParameterEncoding("text/plain")).isNotEqualTo(ParameterEncoding.JSON);
  }
}
