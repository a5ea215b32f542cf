package org.maap.client.http;

import java.util.Locale;
import okhttp3.Headers;

/**
 * Builds the header set sent with every DPS and relay request.
 *
 * <p>A fresh immutable {@link Headers} value is produced per call; nothing is shared between
 * requests.
 */
public final class ApiHeaders {
  public static final String ACCEPT = "Accept";
  public static final String CONTENT_TYPE = "Content-Type";
  public static final String AUTHORIZATION = "Authorization";
  public static final String TOKEN = "token";
  public static final String PROXY_TICKET = "proxy-ticket";

  private ApiHeaders() {}

  /**
   * @param contentType value for {@code Accept} and {@code Content-Type}
   * @param token API token; sent as {@code Authorization} when it already carries a {@code Basic}
   *     or {@code Bearer} scheme, otherwise as a {@code token} header. Blank tokens are omitted.
   * @param proxyTicket proxy-granting ticket, omitted when null or blank
   */
  public static Headers build(String contentType, String token, String proxyTicket) {
    Headers.Builder builder = new Headers.Builder();
    if (contentType != null && !contentType.isBlank()) {
      builder.set(ACCEPT, contentType);
      builder.set(CONTENT_TYPE, contentType);
    }
    if (token != null && !token.isBlank()) {
      String lower = token.trim().toLowerCase(Locale.ROOT);
      if (lower.startsWith("basic") || lower.startsWith("bearer")) {
        builder.set(AUTHORIZATION, token.trim());
      } else {
        builder.set(TOKEN, token.trim());
      }
    }
    if (proxyTicket != null && !proxyTicket.isBlank()) {
      builder.set(PROXY_TICKET, proxyTicket);
    }
    return builder.build();
  }
}
