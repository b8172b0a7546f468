package io.github.wphillipmoore.http.pipeline.modifier;

import io.github.wphillipmoore.http.pipeline.Requestable;
import io.github.wphillipmoore.http.pipeline.Response;
import java.util.List;
import java.util.Objects;

/**
 * Post-flight transformation of a response envelope.
 *
 * <p>Modifiers work on any request type and any raw result type. They return a new envelope and
 * keep its {@code request} unless replacing it is their explicit purpose. Composition mirrors
 * {@link RequestBuilder}: sequential, order-preserving, not commutative in general.
 */
public interface ResponseModifier {

  /**
   * Returns an envelope reflecting this modifier's change.
   *
   * @param response the input envelope
   * @param <R> the request type
   * @param <T> the raw result type
   * @return the resulting envelope
   */
  <R extends Requestable, T> Response<R, T> mutate(Response<R, T> response);

  /** Returns a modifier that applies this modifier and then {@code next}. */
  default ResponseModifier andThen(ResponseModifier next) {
    Objects.requireNonNull(next, "next");
    ResponseModifier first = this;
    return new ResponseModifier() {
      @Override
      public <R extends Requestable, T> Response<R, T> mutate(Response<R, T> response) {
        return next.mutate(first.mutate(response));
      }
    };
  }

  /** Returns a modifier that returns its input. */
  static ResponseModifier identity() {
    return new ResponseModifier() {
      @Override
      public <R extends Requestable, T> Response<R, T> mutate(Response<R, T> response) {
        return response;
      }
    };
  }

  /**
   * Applies the modifiers to {@code response} in list order. An empty list returns {@code
   * response}.
   *
   * @param response the initial envelope
   * @param modifiers the modifiers to apply
   * @param <R> the request type
   * @param <T> the raw result type
   * @return the resulting envelope
   */
  static <R extends Requestable, T> Response<R, T> applyAll(
      Response<R, T> response, List<? extends ResponseModifier> modifiers) {
    Objects.requireNonNull(response, "response");
    Response<R, T> current = response;
    for (ResponseModifier modifier : modifiers) {
      current = Objects.requireNonNull(modifier.mutate(current), "modifier returned null");
    }
    return current;
  }
}
