package org.maap.client.exception;

/** A document returned by the DPS API could not be decoded. The raw body is kept for diagnosis. */
public class DocumentParseException extends MaapException {
  private final String rawBody;

  public DocumentParseException(String message, String rawBody, Throwable cause) {
    super(MaapErrorCode.DOCUMENT_PARSE_ERROR, message, cause);
    this.rawBody = rawBody;
  }

  public String getRawBody() {
    return rawBody;
  }
}
