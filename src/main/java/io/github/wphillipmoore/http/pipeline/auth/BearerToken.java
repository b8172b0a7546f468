package io.github.wphillipmoore.http.pipeline.auth;

import java.util.Objects;

/**
 * Bearer token credentials. Used to construct an {@code Authorization: Bearer} header.
 *
 * @param token the token, never null
 */
public record BearerToken(String token) implements Credentials {

  /** Validates that the token is non-null. */
  public BearerToken {
    Objects.requireNonNull(token, "token");
  }

  /** Returns a representation that omits the token. */
  @Override
  public String toString() {
    return "BearerToken[token=***]";
  }
}
