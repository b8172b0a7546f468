package io.github.wphillipmoore.http.pipeline.auth;

import java.util.Objects;

/**
 * Basic authentication credentials. Used to construct an {@code Authorization: Basic} header.
 *
 * @param username the username, never null
 * @param password the password, never null
 */
public record BasicAuth(String username, String password) implements Credentials {

  /** Validates that username and password are non-null. */
  public BasicAuth {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
  }

  /** Returns a representation that omits the password. */
  @Override
  public String toString() {
    return "BasicAuth[username=" + username + ", password=***]";
  }
}
