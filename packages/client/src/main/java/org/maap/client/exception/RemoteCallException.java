package org.maap.client.exception;

/** The DPS API answered with something other than 200 or 201. */
public class RemoteCallException extends MaapException {
  private final int httpCode;
  private final String body;

  public RemoteCallException(String url, int httpCode, String body) {
    super(
        MaapErrorCode.REMOTE_CALL_FAILED,
        "API error: HTTP " + httpCode + ": " + (body == null ? "" : body));
    this.httpCode = httpCode;
    this.body = body;
    withContext("url", url);
  }

  public int getHttpCode() {
    return httpCode;
  }

  public String getBody() {
    return body;
  }
}
