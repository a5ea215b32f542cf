package org.maap.client.exception;

/**
 * The origin rejected the download with an authorization failure and no escalation strategy
 * could obtain access.
 */
public class TransferUnauthorizedException extends TransferException {
  private final int httpCode;

  public TransferUnauthorizedException(String url, int httpCode) {
    super(
        MaapErrorCode.TRANSFER_UNAUTHORIZED,
        "Access to " + url + " was not authorized (HTTP " + httpCode + ")");
    this.httpCode = httpCode;
    withContext("url", url);
  }

  public int getHttpCode() {
    return httpCode;
  }
}
