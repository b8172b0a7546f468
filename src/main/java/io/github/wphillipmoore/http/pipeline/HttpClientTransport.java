package io.github.wphillipmoore.http.pipeline;

import io.github.wphillipmoore.http.pipeline.exception.BuildException;
import io.github.wphillipmoore.http.pipeline.exception.TransportException;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDK {@link HttpClient}-based implementation of {@link RequestLoader} and {@link
 * AsyncRequestLoader}.
 *
 * <p>Each call builds the request description, converts the resulting {@link TransportRequest}
 * into a {@link HttpRequest} and performs exactly one exchange. Headers the JDK client manages
 * itself ({@code Connection}, {@code Content-Length}, {@code Expect}, {@code Host}, {@code
 * Upgrade}) are skipped. Network failures are reported as {@link TransportException}.
 *
 * <pre>{@code
 * HttpClientTransport transport = HttpClientTransport.builder()
 *     .connectTimeout(Duration.ofSeconds(5))
 *     .defaultTimeout(Duration.ofSeconds(10))
 *     .build();
 * Response<RequestDescription, DataResponse> response = transport.response(request);
 * }</pre>
 */
public final class HttpClientTransport implements RequestLoader, AsyncRequestLoader {

  private static final Logger log = LoggerFactory.getLogger(HttpClientTransport.class);

  static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
  static final Set<String> RESTRICTED_HEADERS = restrictedHeaders();

  private final HttpClient client;
  private final @Nullable Duration defaultTimeout;

  /** Creates a transport with a default TLS-verifying {@link HttpClient}. */
  public HttpClientTransport() {
    this(HttpClient.newHttpClient(), DEFAULT_TIMEOUT);
  }

  /**
   * Creates a transport with an injected {@link HttpClient}. Package-private for testing.
   *
   * @param client the HTTP client to use
   * @param defaultTimeout the timeout for requests without their own, or {@code null}
   */
  HttpClientTransport(HttpClient client, @Nullable Duration defaultTimeout) {
    this.client = Objects.requireNonNull(client, "client");
    this.defaultTimeout = defaultTimeout;
  }

  /** Returns a new builder. */
  public static Builder builder() {
    return new Builder();
  }

  @Override
  @SuppressWarnings("PMD.CloseResource") // HttpClient is managed by this transport, not disposable
  public DataResponse data(Requestable request) {
    TransportRequest ready = request.build();
    HttpRequest httpRequest = toHttpRequest(ready);
    String url = ready.url().toString();
    log.debug("Sending {} {}", ready.httpMethod(), url);

    HttpResponse<byte[]> response;
    try {
      response = client.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
    } catch (IOException e) {
      throw new TransportException("HTTP request failed", url, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException("HTTP request interrupted", url, e);
    }

    log.debug("Received {} from {} {}", response.statusCode(), ready.httpMethod(), url);
    return new DataResponse(response.body(), toMetadata(response));
  }

  @Override
  public CompletableFuture<DataResponse> dataAsync(Requestable request) {
    TransportRequest ready;
    HttpRequest httpRequest;
    try {
      ready = request.build();
      httpRequest = toHttpRequest(ready);
    } catch (BuildException e) {
      return CompletableFuture.failedFuture(e);
    }
    String url = ready.url().toString();
    log.debug("Sending {} {} asynchronously", ready.httpMethod(), url);

    return client
        .sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray())
        .handle(
            (response, failure) -> {
              if (failure != null) {
                throw asyncFailure(failure, url);
              }
              log.debug("Received {} from {} {}", response.statusCode(), ready.httpMethod(), url);
              return new DataResponse(response.body(), toMetadata(response));
            });
  }

  /**
   * Executes the request once, streaming the response body into {@code target}.
   *
   * @param request the request to execute
   * @param target the file to write; created or truncated
   * @return the file and response metadata
   */
  public DownloadResponse download(Requestable request, Path target) {
    Objects.requireNonNull(target, "target");
    TransportRequest ready = request.build();
    HttpRequest httpRequest = toHttpRequest(ready);
    String url = ready.url().toString();
    log.debug("Downloading {} {} to {}", ready.httpMethod(), url, target);

    HttpResponse<Path> response;
    try {
      response = client.send(httpRequest, HttpResponse.BodyHandlers.ofFile(target));
    } catch (IOException e) {
      throw new TransportException("HTTP download failed", url, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException("HTTP download interrupted", url, e);
    }
    return new DownloadResponse(response.body(), toMetadata(response));
  }

  /**
   * Downloads the response body into {@code target} and times the execution.
   *
   * @param request the request to execute
   * @param target the file to write
   * @param <R> the request type
   * @return the timed envelope
   */
  public <R extends Requestable> Response<R, DownloadResponse> downloadResponse(
      R request, Path target) {
    return TimedExecution.time(request, r -> download(r, target));
  }

  HttpRequest toHttpRequest(TransportRequest ready) {
    byte[] body = ready.body();
    HttpRequest.BodyPublisher publisher =
        body.length == 0
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofByteArray(body);

    HttpRequest.Builder requestBuilder = HttpRequest.newBuilder();
    try {
      requestBuilder.uri(ready.url()).method(ready.httpMethod(), publisher);
      ready
          .headerFields()
          .forEach(
              (name, value) -> {
                if (RESTRICTED_HEADERS.contains(name)) {
                  log.debug("Skipping header {} managed by the HTTP client", name);
                } else {
                  requestBuilder.setHeader(name, value);
                }
              });
    } catch (IllegalArgumentException e) {
      throw new BuildException(
          BuildException.Reason.INVALID_REQUEST,
          "HTTP client rejected request: " + e.getMessage(),
          e);
    }

    Duration timeout = ready.timeout() != null ? ready.timeout() : defaultTimeout;
    if (timeout != null) {
      requestBuilder.timeout(timeout);
    }
    return requestBuilder.build();
  }

  private static RuntimeException asyncFailure(Throwable failure, String url) {
    Throwable cause =
        failure instanceof CompletionException && failure.getCause() != null
            ? failure.getCause()
            : failure;
    if (cause instanceof RuntimeException runtime) {
      return runtime;
    }
    return new TransportException("HTTP request failed", url, cause);
  }

  private static ResponseMetadata toMetadata(HttpResponse<?> response) {
    return new ResponseMetadata(
        response.statusCode(), flattenHeaders(response.headers()), response.uri());
  }

  /**
   * Flattens {@link HttpHeaders} multi-value map to single-value map per RFC 9110 section 5.3.
   *
   * <p>Multiple values for the same header name are joined with {@code ", "}.
   *
   * @param httpHeaders the HTTP response headers
   * @return a flattened string-to-string header map
   */
  static Map<String, String> flattenHeaders(HttpHeaders httpHeaders) {
    Map<String, String> result = new LinkedHashMap<>();
    httpHeaders.map().forEach((name, values) -> result.put(name, String.join(", ", values)));
    return result;
  }

  private static Set<String> restrictedHeaders() {
    Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
    names.addAll(Set.of("Connection", "Content-Length", "Expect", "Host", "Upgrade"));
    return names;
  }

  /**
   * Creates an {@link SSLContext} with a trust-all manager.
   *
   * @param protocol the SSL protocol name (e.g. "TLS")
   * @return an initialized SSLContext that trusts all certificates
   * @throws IllegalStateException if the protocol is not available
   */
  static SSLContext createSslContext(String protocol) {
    try {
      SSLContext sslContext = SSLContext.getInstance(protocol);
      sslContext.init(null, new TrustManager[] {new TrustAllManager()}, null);
      return sslContext;
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to create SSLContext", e);
    }
  }

  /**
   * An {@link X509TrustManager} that accepts all certificates. Used when TLS verification is
   * disabled.
   */
  static final class TrustAllManager implements X509TrustManager {

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {
      // Accept all client certificates
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {
      // Accept all server certificates
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }

  /** Builder for {@link HttpClientTransport}. */
  public static final class Builder {

    private @Nullable SSLContext sslContext;
    private boolean verifyTls = true;
    private @Nullable Duration connectTimeout;
    private @Nullable Duration defaultTimeout = DEFAULT_TIMEOUT;
    private HttpClient.Redirect followRedirects = HttpClient.Redirect.NEVER;

    private Builder() {}

    /** Sets a custom {@link SSLContext}, e.g. for mutual TLS. */
    public Builder sslContext(SSLContext sslContext) {
      this.sslContext = Objects.requireNonNull(sslContext, "sslContext");
      return this;
    }

    /**
     * Sets whether to verify TLS certificates. Defaults to {@code true}. When {@code false} any
     * custom {@link SSLContext} is ignored.
     */
    public Builder verifyTls(boolean verifyTls) {
      this.verifyTls = verifyTls;
      return this;
    }

    /** Sets the connect timeout. Defaults to the JDK client's (none). */
    public Builder connectTimeout(@Nullable Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    /**
     * Sets the timeout for requests that carry none. Defaults to 30 seconds. Pass {@code null} for
     * no timeout.
     */
    public Builder defaultTimeout(@Nullable Duration defaultTimeout) {
      this.defaultTimeout = defaultTimeout;
      return this;
    }

    /** Sets the redirect policy. Defaults to {@link HttpClient.Redirect#NEVER}. */
    public Builder followRedirects(HttpClient.Redirect followRedirects) {
      this.followRedirects = Objects.requireNonNull(followRedirects, "followRedirects");
      return this;
    }

    /**
     * Builds the transport.
     *
     * @return the configured transport
     */
    public HttpClientTransport build() {
      HttpClient.Builder clientBuilder = HttpClient.newBuilder().followRedirects(followRedirects);
      if (!verifyTls) {
        clientBuilder.sslContext(createSslContext("TLS"));
      } else if (sslContext != null) {
        clientBuilder.sslContext(sslContext);
      }
      if (connectTimeout != null) {
        clientBuilder.connectTimeout(connectTimeout);
      }
      return new HttpClientTransport(clientBuilder.build(), defaultTimeout);
    }
  }
}
