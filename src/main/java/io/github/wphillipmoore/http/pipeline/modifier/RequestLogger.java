package io.github.wphillipmoore.http.pipeline.modifier;

import io.github.wphillipmoore.http.pipeline.MutableRequestable;
import io.github.wphillipmoore.http.pipeline.Requestable;
import io.github.wphillipmoore.http.pipeline.TransportRequest;
import io.github.wphillipmoore.http.pipeline.http.HttpHeader;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request builder that logs the outgoing request at DEBUG and returns it unchanged.
 *
 * <p>Only header names are logged, never values.
 */
public final class RequestLogger implements RequestBuilder {

  private final Logger log;

  /** Creates a request logger writing to this class's logger. */
  public RequestLogger() {
    this(LoggerFactory.getLogger(RequestLogger.class));
  }

  /**
   * Creates a request logger writing to the given logger.
   *
   * @param log the logger to write to
   */
  public RequestLogger(Logger log) {
    this.log = Objects.requireNonNull(log, "log");
  }

  @Override
  public MutableRequestable mutate(MutableRequestable request) {
    if (log.isDebugEnabled()) {
      log.debug(
          "Request {} {} headers={} parameters={}",
          request.rawMethod(),
          target(request),
          headerNames(request.headers()),
          request.parameters().keySet());
    }
    return request;
  }

  static String target(Requestable request) {
    if (request instanceof TransportRequest transportRequest) {
      return transportRequest.url().toString();
    }
    if (request instanceof MutableRequestable mutable && mutable.baseUrlString() != null) {
      return mutable.baseUrlString();
    }
    return "<unresolved>";
  }

  static Set<String> headerNames(Set<HttpHeader> headers) {
    Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
    headers.forEach(header -> names.add(header.key()));
    return names;
  }
}
