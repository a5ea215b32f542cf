package org.maap.client.exception;

/** A data file could not be downloaded. */
public class TransferException extends MaapException {
  public TransferException(String message) {
    super(MaapErrorCode.TRANSFER_FAILED, message);
  }

  public TransferException(String message, Throwable cause) {
    super(MaapErrorCode.TRANSFER_FAILED, message, cause);
  }

  protected TransferException(MaapErrorCode code, String message) {
    super(code, message);
  }
}
