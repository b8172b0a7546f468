package io.github.wphillipmoore.http.pipeline.http;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Operations on header collections.
 *
 * <p>A header collection is a {@code Set<HttpHeader>} with pair-based equality. The sets produced
 * here keep insertion order, which only matters for {@link #flatten(Collection)}.
 */
public final class Headers {

  static final String CONTENT_TYPE = "Content-Type";
  static final String MULTIPART_FORM_DATA = "multipart/form-data";

  private Headers() {}

  /** Returns an unmodifiable, insertion-ordered copy of the given headers. */
  public static Set<HttpHeader> copyOf(Collection<HttpHeader> headers) {
    Objects.requireNonNull(headers, "headers");
    Set<HttpHeader> copy = new LinkedHashSet<>();
    for (HttpHeader header : headers) {
      copy.add(Objects.requireNonNull(header, "header"));
    }
    return Collections.unmodifiableSet(copy);
  }

  /** Returns a new collection holding the given headers plus {@code header}. */
  public static Set<HttpHeader> with(Collection<HttpHeader> headers, HttpHeader header) {
    Objects.requireNonNull(header, "header");
    Set<HttpHeader> copy = new LinkedHashSet<>(headers);
    copy.add(header);
    return Collections.unmodifiableSet(copy);
  }

  /** Returns a new collection without any header whose key equals {@code key}, ignoring case. */
  public static Set<HttpHeader> without(Collection<HttpHeader> headers, String key) {
    Objects.requireNonNull(key, "key");
    Set<HttpHeader> copy = new LinkedHashSet<>();
    for (HttpHeader header : headers) {
      if (!header.key().equalsIgnoreCase(key)) {
        copy.add(header);
      }
    }
    return Collections.unmodifiableSet(copy);
  }

  /**
   * Collapses a header collection onto a flat name-to-value table.
   *
   * <p>This reduction is lossy: when several headers share a key (compared ignoring case) only the
   * last one in iteration order survives, and the table keeps the spelling of the first key seen.
   *
   * @param headers the headers to flatten
   * @return a case-insensitive, modifiable name-to-value map
   */
  public static Map<String, String> flatten(Collection<HttpHeader> headers) {
    Map<String, String> table = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    for (HttpHeader header : headers) {
      table.put(header.key(), header.value());
    }
    return table;
  }

  /** Expands a flat name-to-value table into a header collection. */
  public static Set<HttpHeader> fromMap(Map<String, String> table) {
    Objects.requireNonNull(table, "table");
    Set<HttpHeader> headers = new LinkedHashSet<>();
    new LinkedHashMap<>(table).forEach((key, value) -> headers.add(new HttpHeader(key, value)));
    return Collections.unmodifiableSet(headers);
  }

  /** Returns whether any header's key equals {@code key}, ignoring case. */
  public static boolean containsKey(Collection<HttpHeader> headers, String key) {
    for (HttpHeader header : headers) {
      if (header.key().equalsIgnoreCase(key)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns whether the headers declare a multipart form body.
   *
   * <p>True iff some header's key equals {@code Content-Type} ignoring case and its value contains
   * {@code multipart/form-data} ignoring case.
   */
  public static boolean isMultipart(Collection<HttpHeader> headers) {
    for (HttpHeader header : headers) {
      if (CONTENT_TYPE.equalsIgnoreCase(header.key())
          && header.value().toLowerCase(Locale.ROOT).contains(MULTIPART_FORM_DATA)) {
        return true;
      }
    }
    return false;
  }
}
