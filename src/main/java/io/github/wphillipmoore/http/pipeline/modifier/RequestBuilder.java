package io.github.wphillipmoore.http.pipeline.modifier;

import io.github.wphillipmoore.http.pipeline.MutableRequestable;
import java.util.List;
import java.util.Objects;

/**
 * Pre-flight transformation of a mutable request description.
 *
 * <p>Builders must not change their input and must not share mutable state between calls; they
 * return a new description reflecting their change. Builders compose by sequential application in
 * caller-chosen order and are not commutative in general: two builders that set the same header
 * key leave the value of the one applied last.
 */
@FunctionalInterface
public interface RequestBuilder {

  /**
   * Returns a description reflecting this builder's change.
   *
   * @param request the input description, never changed
   * @return the resulting description
   */
  MutableRequestable mutate(MutableRequestable request);

  /** Returns a builder that applies this builder and then {@code next}. */
  default RequestBuilder andThen(RequestBuilder next) {
    Objects.requireNonNull(next, "next");
    return request -> next.mutate(mutate(request));
  }

  /** Returns a builder that returns its input. */
  static RequestBuilder identity() {
    return request -> request;
  }

  /**
   * Applies the builders to {@code request} in list order. An empty list returns {@code request}.
   *
   * @param request the initial description
   * @param builders the builders to apply
   * @return the resulting description
   */
  static MutableRequestable applyAll(
      MutableRequestable request, List<? extends RequestBuilder> builders) {
    Objects.requireNonNull(request, "request");
    MutableRequestable current = request;
    for (RequestBuilder builder : builders) {
      current = Objects.requireNonNull(builder.mutate(current), "builder returned null");
    }
    return current;
  }
}
