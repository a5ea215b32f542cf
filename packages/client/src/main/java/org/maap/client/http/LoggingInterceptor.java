package org.maap.client.http;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;
import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;
import org.maap.client.logging.LoggingService;
import org.slf4j.Logger;

/** Logs every request/response pair at debug level and network failures at warn level. */
public class LoggingInterceptor implements Interceptor {
  private static final Logger log = LoggingService.getLogger(LoggingInterceptor.class);

  static final Set<String> SENSITIVE_HEADERS =
      Set.of("authorization", "token", "proxy-ticket", "dps-machine-token");

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    long startTime = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug(
          "Sending request {} {}\nHeaders:\n{}",
          request.method(),
          request.url(),
          redact(request.headers()));
    }

    Response response;
    try {
      response = chain.proceed(request);
    } catch (java.net.SocketTimeoutException e) {
      log.warn(
          "Request timed out: {} {} ({}ms)", request.method(), request.url(), elapsedMs(startTime));
      throw e;
    } catch (java.net.ConnectException e) {
      log.warn(
          "Connection error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMs(startTime),
          e.getMessage());
      throw e;
    } catch (IOException e) {
      log.warn(
          "IO error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMs(startTime),
          e.getMessage());
      throw e;
    }

    log.debug(
        "Received response for {} in {} ms\nStatus: {}",
        response.request().url(),
        elapsedMs(startTime),
        response.code());
    return response;
  }

  /** Render headers with credential values masked. */
  static String redact(Headers headers) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < headers.size(); i++) {
      String name = headers.name(i);
      boolean sensitive = SENSITIVE_HEADERS.contains(name.toLowerCase(Locale.ROOT));
      sb.append(name).append(": ").append(sensitive ? "***" : headers.value(i)).append('\n');
    }
    return sb.toString();
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }
}
