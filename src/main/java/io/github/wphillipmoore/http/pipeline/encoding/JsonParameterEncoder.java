package io.github.wphillipmoore.http.pipeline.encoding;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import io.github.wphillipmoore.http.pipeline.exception.EncodingException;
import io.github.wphillipmoore.http.pipeline.http.ParameterEncoding;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * Gson-backed encoder for {@link ParameterEncoding#JSON}.
 *
 * <p>{@code null} values are written as JSON {@code null} and survive decoding. Integral numbers
 * decode as {@link Long}, other numbers as {@link Double}. Non-finite floating point values are
 * rejected.
 */
public final class JsonParameterEncoder implements ParameterEncoder {

  private final Gson gson;

  /** Creates an encoder that keeps null entries and decodes integral numbers as longs. */
  public JsonParameterEncoder() {
    this(
        new GsonBuilder()
            .serializeNulls()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .create());
  }

  /**
   * Creates an encoder with a custom {@link Gson} instance.
   *
   * @param gson the Gson instance to use
   */
  public JsonParameterEncoder(Gson gson) {
    this.gson = Objects.requireNonNull(gson, "gson");
  }

  @Override
  public ParameterEncoding encoding() {
    return ParameterEncoding.JSON;
  }

  @Override
  public byte[] encode(Map<String, Object> parameters) {
    Objects.requireNonNull(parameters, "parameters");
    try {
      return gson.toJson(parameters).getBytes(StandardCharsets.UTF_8);
    } catch (JsonParseException | IllegalArgumentException e) {
      throw new EncodingException("Parameters are not JSON-serializable", encoding(), e);
    }
  }

  @Override
  public Map<String, Object> decode(byte[] body) {
    Objects.requireNonNull(body, "body");
    String text = new String(body, StandardCharsets.UTF_8);
    Object decoded;
    try {
      decoded = gson.fromJson(text, Object.class);
    } catch (JsonParseException e) {
      throw new EncodingException("Invalid JSON body", encoding(), e);
    }
    if (!(decoded instanceof Map)) {
      throw new EncodingException("JSON body is not an object", encoding());
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> result = (Map<String, Object>) decoded;
    return result;
  }
}
