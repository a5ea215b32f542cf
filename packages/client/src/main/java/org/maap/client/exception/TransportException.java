package org.maap.client.exception;

import java.io.IOException;

/** Network failure (connect, timeout, reset) while calling a remote endpoint. */
public class TransportException extends MaapException {
  public TransportException(String url, IOException cause) {
    super(MaapErrorCode.TRANSPORT_ERROR, "Request to " + url + " failed: " + cause, cause);
    withContext("url", url);
  }
}
