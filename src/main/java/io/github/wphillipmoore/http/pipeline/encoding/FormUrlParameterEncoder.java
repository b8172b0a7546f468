package io.github.wphillipmoore.http.pipeline.encoding;

import io.github.wphillipmoore.http.pipeline.exception.EncodingException;
import io.github.wphillipmoore.http.pipeline.http.ParameterEncoding;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Encoder for {@link ParameterEncoding#URL} ({@code application/x-www-form-urlencoded}).
 *
 * <p>Nested values use bracket notation: a map under {@code a} yields {@code a[b]=c}, a list
 * yields {@code a[]=1&a[]=2}. Booleans and numbers are written with {@link String#valueOf};
 * {@code null} is written as an empty value. Decoding rebuilds the nesting but every leaf comes
 * back as a string. Under {@code a[][b]}, a leaf key already present in the list's last map
 * starts a new map, so {@code a[][b]=1&a[][c]=2&a[][b]=3} decodes as {@code [{b=1, c=2}, {b=3}]}.
 */
public final class FormUrlParameterEncoder implements ParameterEncoder {

  @Override
  public ParameterEncoding encoding() {
    return ParameterEncoding.URL;
  }

  @Override
  public byte[] encode(Map<String, Object> parameters) {
    Objects.requireNonNull(parameters, "parameters");
    List<String> pairs = new ArrayList<>();
    parameters.forEach((key, value) -> appendComponent(pairs, key, value));
    StringJoiner joiner = new StringJoiner("&");
    pairs.forEach(joiner::add);
    return joiner.toString().getBytes(StandardCharsets.UTF_8);
  }

  private void appendComponent(List<String> pairs, String key, Object value) {
    if (value instanceof Map<?, ?> map) {
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String nestedKey)) {
          throw new EncodingException(
              "Nested map key is not a string: " + entry.getKey(), encoding());
        }
        appendComponent(pairs, key + "[" + nestedKey + "]", entry.getValue());
      }
    } else if (value instanceof List<?> list) {
      for (Object element : list) {
        appendComponent(pairs, key + "[]", element);
      }
    } else if (value == null) {
      pairs.add(escape(key) + "=");
    } else if (value instanceof String || value instanceof Number || value instanceof Boolean) {
      pairs.add(escape(key) + "=" + escape(String.valueOf(value)));
    } else {
      throw new EncodingException(
          "Unsupported value type for key '" + key + "': " + value.getClass().getName(),
          encoding());
    }
  }

  private static String escape(String text) {
    return URLEncoder.encode(text, StandardCharsets.UTF_8);
  }

  @Override
  public Map<String, Object> decode(byte[] body) {
    Objects.requireNonNull(body, "body");
    Map<String, Object> result = new LinkedHashMap<>();
    String text = new String(body, StandardCharsets.UTF_8);
    if (text.isEmpty()) {
      return result;
    }
    for (String pair : text.split("&")) {
      int eqIndex = pair.indexOf('=');
      String rawKey = eqIndex >= 0 ? pair.substring(0, eqIndex) : pair;
      String rawValue = eqIndex >= 0 ? pair.substring(eqIndex + 1) : "";
      String key;
      String value;
      try {
        key = URLDecoder.decode(rawKey, StandardCharsets.UTF_8);
        value = URLDecoder.decode(rawValue, StandardCharsets.UTF_8);
      } catch (IllegalArgumentException e) {
        throw new EncodingException("Malformed form body component: " + pair, encoding(), e);
      }
      insert(result, parsePath(key), 0, value);
    }
    return result;
  }

  static List<String> parsePath(String key) {
    List<String> path = new ArrayList<>();
    int bracket = key.indexOf('[');
    if (bracket <= 0 || !key.endsWith("]")) {
      path.add(key);
      return path;
    }
    path.add(key.substring(0, bracket));
    String rest = key.substring(bracket);
    while (rest.startsWith("[")) {
      int close = rest.indexOf(']');
      if (close < 0) {
        break;
      }
      path.add(rest.substring(1, close));
      rest = rest.substring(close + 1);
    }
    return path;
  }

  @SuppressWarnings("unchecked")
  private void insert(Map<String, Object> target, List<String> path, int index, String value) {
    String segment = path.get(index);
    boolean last = index == path.size() - 1;
    if (last) {
      target.put(segment, value);
      return;
    }
    String next = path.get(index + 1);
    if (next.isEmpty()) {
      Object existing = target.get(segment);
      List<Object> list;
      if (existing instanceof List) {
        list = (List<Object>) existing;
      } else {
        list = new ArrayList<>();
        target.put(segment, list);
      }
      if (index + 2 >= path.size() || path.get(index + 2).isEmpty()) {
        list.add(value);
        return;
      }
      boolean leaf = index + 3 == path.size();
      insert(elementFor(list, path.get(index + 2), leaf), path, index + 2, value);
      return;
    }
    Object existing = target.get(segment);
    Map<String, Object> child;
    if (existing instanceof Map) {
      child = (Map<String, Object>) existing;
    } else {
      child = new LinkedHashMap<>();
      target.put(segment, child);
    }
    insert(child, path, index + 1, value);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> elementFor(List<Object> list, String key, boolean leaf) {
    if (!list.isEmpty() && list.get(list.size() - 1) instanceof Map<?, ?> last) {
      Object existing = last.get(key);
      if (existing == null || (!leaf && existing instanceof Map)) {
        return (Map<String, Object>) last;
      }
    }
    Map<String, Object> element = new LinkedHashMap<>();
    list.add(element);
    return element;
  }
}
