package org.maap.client.retrieval;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.maap.client.auth.AuthContext;
import org.maap.client.auth.DpsTokenClient;
import org.maap.client.exception.TransferException;
import org.maap.client.exception.TransferUnauthorizedException;
import org.maap.client.logging.LoggingService;
import org.slf4j.Logger;

/**
 * Downloads http(s) URLs to a file, escalating to the caller's {@link AuthContext} when the origin
 * answers 401.
 *
 * <p>The first request always goes out without credentials. On 401:
 *
 * <ul>
 *   <li>{@link AuthContext.JobRuntimeToken}: the machine token is exchanged for a user/app token
 *       pair and the request is retried against the final (post-redirect) URL with those tokens.
 *   <li>{@link AuthContext.ProxyDelegate}: the download is routed through the API relay, with the
 *       original URL percent-encoded twice as a path segment.
 *   <li>{@link AuthContext.Unauthenticated}: the download fails with {@link
 *       TransferUnauthorizedException}.
 * </ul>
 */
public class HttpDownloader {
  private static final Logger log = LoggingService.getLogger(HttpDownloader.class);

  private static final char[] HEX = "0123456789ABCDEF".toCharArray();

  private final OkHttpClient http;
  private final AuthContext auth;
  private final DpsTokenClient tokens;

  public HttpDownloader(OkHttpClient http, AuthContext auth) {
    this(http, auth, new DpsTokenClient(http));
  }

  public HttpDownloader(OkHttpClient http, AuthContext auth, DpsTokenClient tokens) {
    this.http = http;
    this.auth = auth;
    this.tokens = tokens;
  }

  /**
   * Write the body of {@code url} to {@code target}, replacing it.
   *
   * @throws TransferUnauthorizedException when access was refused and escalation did not help
   * @throws TransferException on any other transfer failure
   * @throws IOException when {@code target} cannot be written
   */
  public void download(String url, Path target) throws IOException {
    Request request = new Request.Builder().url(url).get().build();
    Response response = execute(request);
    try {
      if (response.code() == 401) {
        HttpUrl finalUrl = response.request().url();
        response.close();
        log.debug("{} requires authorization, escalating with {}", url, auth);
        response = escalate(url, finalUrl);
      }
      if (response.code() == 401 || response.code() == 403) {
        throw new TransferUnauthorizedException(url, response.code());
      }
      if (!response.isSuccessful()) {
        throw new TransferException("Download of " + url + " failed with HTTP " + response.code());
      }
      ResponseBody body = response.body();
      if (body == null) {
        throw new TransferException("Download of " + url + " returned no body");
      }
      try (InputStream in = body.byteStream();
          OutputStream out = Files.newOutputStream(target)) {
        in.transferTo(out);
      }
    } finally {
      response.close();
    }
  }

  private Response escalate(String url, HttpUrl finalUrl) {
    if (auth instanceof AuthContext.JobRuntimeToken runtime) {
      Optional<DpsTokenClient.TokenPair> pair;
      try {
        pair = tokens.exchange(runtime);
      } catch (IOException e) {
        throw new TransferException("Token exchange for " + url + " failed", e);
      }
      if (pair.isEmpty()) {
        throw new TransferUnauthorizedException(url, 401);
      }
      Request retry =
          new Request.Builder()
              .url(finalUrl)
              .header("Authorization", pair.get().authorizationHeader())
              .header("Connection", "close")
              .get()
              .build();
      return execute(retry);
    }
    if (auth instanceof AuthContext.ProxyDelegate proxy) {
      Request relayed =
          new Request.Builder()
              .url(relayUrl(proxy, url))
              .headers(proxy.apiHeaders())
              .get()
              .build();
      return execute(relayed);
    }
    throw new TransferUnauthorizedException(url, 401);
  }

  static HttpUrl relayUrl(AuthContext.ProxyDelegate proxy, String url) {
    HttpUrl.Builder builder =
        HttpUrl.get(proxy.relayEndpoint()).newBuilder().addEncodedPathSegment(quote(quote(url)));
    if (!proxy.relaySuffix().isBlank()) builder.addPathSegment(proxy.relaySuffix());
    return builder.build();
  }

  /** Percent-encode everything outside the RFC 3986 unreserved set. */
  static String quote(String value) {
    StringBuilder sb = new StringBuilder();
    for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
      int c = b & 0xff;
      if ((c >= 'A' && c <= 'Z')
          || (c >= 'a' && c <= 'z')
          || (c >= '0' && c <= '9')
          || c == '-'
          || c == '.'
          || c == '_'
          || c == '~') {
        sb.append((char) c);
      } else {
        sb.append('%').append(HEX[c >> 4]).append(HEX[c & 0xf]);
      }
    }
    return sb.toString();
  }

  private Response execute(Request request) {
    try {
      return http.newCall(request).execute();
    } catch (IOException e) {
      throw new TransferException("Request to " + request.url() + " failed: " + e.getMessage(), e);
    }
  }
}
