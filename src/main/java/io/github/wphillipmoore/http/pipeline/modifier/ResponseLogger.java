package io.github.wphillipmoore.http.pipeline.modifier;

import io.github.wphillipmoore.http.pipeline.DataResponse;
import io.github.wphillipmoore.http.pipeline.DownloadResponse;
import io.github.wphillipmoore.http.pipeline.Requestable;
import io.github.wphillipmoore.http.pipeline.Response;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Response modifier that logs the completed exchange at DEBUG and returns it unchanged. */
public final class ResponseLogger implements ResponseModifier {

  private final Logger log;

  /** Creates a response logger writing to this class's logger. */
  public ResponseLogger() {
    this(LoggerFactory.getLogger(ResponseLogger.class));
  }

  /**
   * Creates a response logger writing to the given logger.
   *
   * @param log the logger to write to
   */
  public ResponseLogger(Logger log) {
    this.log = Objects.requireNonNull(log, "log");
  }

  @Override
  public <R extends Requestable, T> Response<R, T> mutate(Response<R, T> response) {
    if (log.isDebugEnabled()) {
      log.debug(
          "Response {} {} status={} duration={}s",
          response.request().rawMethod(),
          RequestLogger.target(response.request()),
          status(response.result()),
          String.format(Locale.ROOT, "%.3f", response.metrics().duration()));
    }
    return response;
  }

  private static String status(Object result) {
    if (result instanceof DataResponse data) {
      return String.valueOf(data.metadata().statusCode());
    }
    if (result instanceof DownloadResponse download) {
      return String.valueOf(download.metadata().statusCode());
    }
    return "n/a";
  }
}
