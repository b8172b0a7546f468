package io.github.wphillipmoore.http.pipeline.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FileTest {

  private static final byte[] CONTENT = "file content".getBytes(StandardCharsets.UTF_8);

  @Test
  void constructionWithValidValues() {
    File file = new File(CONTENT, Map.of("key", "value"), "testfile.txt", "text/plain");

    assertThat(file.data()).isEqualTo(CONTENT);
    assertThat(file.fileData()).containsEntry("key", "value");
    assertThat(file.filename()).isEqualTo("testfile.txt");
    assertThat(file.mimetype()).isEqualTo("text/plain");
    assertThat(file.size()).isEqualTo(CONTENT.length);
  }

  @Test
  void optionalFieldsMayBeNull() {
    File file = new File(CONTENT, null, null, null);

    assertThat(file.fileData()).isNull();
    assertThat(file.filename()).isNull();
    assertThat(file.mimetype()).isNull();
  }

  @Test
  void dataIsCopiedOnConstructionAndAccess() {
    byte[] source = CONTENT.clone();
    File file = new File(source, null, "f", null);
    source[0] = 'X';
    file.data()[1] = 'Y';

    assertThat(file.data()).isEqualTo(CONTENT);
  }

  @Test
  void fileDataIsCopiedAndUnmodifiable() {
    Map<String, Object> metadata = new HashMap<>();
    metadata.put("key", "value");
    File file = new File(CONTENT, metadata, "f", null);
    metadata.put("key", "changed");

    assertThat(file.fileData()).containsEntry("key", "value");
    assertThatThrownBy(() -> file.fileData().put("other", 1))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void equalityComparesContent() {
    File first = new File(CONTENT.clone(), null, "f", "text/plain");
    File second = new File(CONTENT.clone(), null, "f", "text/plain");

    assertThat(first).isEqualTo(second);
    assertThat(first.hashCode()).isEqualTo(second.hashCode());
    assertThat(first).isNotEqualTo(new File(new byte[0], null, "f", "text/plain"));
  }

  @Test
  void nullDataThrowsNullPointerException() {
    assertThatThrownBy(() -> new File(null, null, null, null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("data");
  }

  @Test
  void fileParameterPairsNameWithFile() {
    File file = new File(CONTENT, null, "avatar.png", "image/png");

    FileParameter parameter = new FileParameter("avatar", file);

    assertThat(parameter.name()).isEqualTo("avatar");
    assertThat(parameter.file()).isSameAs(file);
  }
}
