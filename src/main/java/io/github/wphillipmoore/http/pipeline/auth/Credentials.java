package io.github.wphillipmoore.http.pipeline.auth;

/**
 * Sealed credential type for the {@code Authorization} header.
 *
 * <p>{@link AuthorizationBuilder} dispatches on the concrete type using {@code instanceof}
 * pattern matching.
 */
public sealed interface Credentials permits BasicAuth, BearerToken {}
