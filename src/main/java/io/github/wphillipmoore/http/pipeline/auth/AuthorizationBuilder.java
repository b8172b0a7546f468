package io.github.wphillipmoore.http.pipeline.auth;

import io.github.wphillipmoore.http.pipeline.MutableRequestable;
import io.github.wphillipmoore.http.pipeline.http.Headers;
import io.github.wphillipmoore.http.pipeline.http.HttpHeader;
import io.github.wphillipmoore.http.pipeline.modifier.RequestBuilder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * Request builder that sets the {@code Authorization} header from {@link Credentials}.
 *
 * <p>Any {@code Authorization} header already present is removed first, so the request carries
 * exactly one.
 */
public final class AuthorizationBuilder implements RequestBuilder {

  static final String AUTHORIZATION = "Authorization";

  private final HttpHeader header;

  /**
   * Creates an authorization builder.
   *
   * @param credentials the credentials to send
   */
  public AuthorizationBuilder(Credentials credentials) {
    Objects.requireNonNull(credentials, "credentials");
    if (credentials instanceof BasicAuth basicAuth) {
      this.header =
          HttpHeader.authorization(
              buildBasicAuthHeader(basicAuth.username(), basicAuth.password()));
    } else if (credentials instanceof BearerToken bearerToken) {
      this.header = HttpHeader.authorizationBearer(bearerToken.token());
    } else {
      throw new IllegalArgumentException(
          "Unsupported credentials: " + credentials.getClass().getName());
    }
  }

  @Override
  public MutableRequestable mutate(MutableRequestable request) {
    return request.withHeaders(
        Headers.with(Headers.without(request.headers(), AUTHORIZATION), header));
  }

  static String buildBasicAuthHeader(String username, String password) {
    String credentials = username + ":" + password;
    String encoded =
        Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    return "Basic " + encoded;
  }
}
